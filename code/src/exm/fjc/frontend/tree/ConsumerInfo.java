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

/**
 * A Provider.of(context) call site.
 */
public class ConsumerInfo {
  private final String providerName;
  private final String enclosingClass;
  private final String enclosingMethod;
  private final SourceLocation location;
  /** Tree node the consumer was paired with, or null */
  private final WidgetTreeNode matchedProvider;

  public ConsumerInfo(String providerName, String enclosingClass,
      String enclosingMethod, SourceLocation location,
      WidgetTreeNode matchedProvider) {
    this.providerName = providerName;
    this.enclosingClass = enclosingClass;
    this.enclosingMethod = enclosingMethod;
    this.location = location;
    this.matchedProvider = matchedProvider;
  }

  public String getProviderName() {
    return providerName;
  }

  public String getEnclosingClass() {
    return enclosingClass;
  }

  public String getEnclosingMethod() {
    return enclosingMethod;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public boolean isResolved() {
    return matchedProvider != null;
  }

  public WidgetTreeNode getMatchedProvider() {
    return matchedProvider;
  }

  @Override
  public String toString() {
    return providerName + ".of in " + enclosingClass + "." +
           enclosingMethod + " at " + location;
  }
}
