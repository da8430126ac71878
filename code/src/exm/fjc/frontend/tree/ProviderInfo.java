/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fjc.frontend.tree;

import exm.fjc.ast.SourceLocation;

public class ProviderInfo {
  public static enum ProviderKind {
    INHERITED_WIDGET,
    PROVIDER,
    CHANGE_NOTIFIER,
  }

  private final String name;
  private final String superclass;
  private final ProviderKind kind;
  private final SourceLocation location;

  public ProviderInfo(String name, String superclass, ProviderKind kind,
                      SourceLocation location) {
    this.name = name;
    this.superclass = superclass;
    this.kind = kind;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public String getSuperclass() {
    return superclass;
  }

  public ProviderKind getKind() {
    return kind;
  }

  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return name + " (" + kind + ")";
  }
}
