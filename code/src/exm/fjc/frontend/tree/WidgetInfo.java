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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;

/**
 * A declared class as seen by the widget analyzer.
 */
public class WidgetInfo {
  private final String name;
  private final WidgetKind kind;
  private final String superclass;
  private final List<String> methods;
  private final List<String> properties;
  private final SourceLocation location;
  private final WidgetAST declaration;

  public WidgetInfo(String name, WidgetKind kind, String superclass,
      List<String> methods, List<String> properties, WidgetAST declaration) {
    this.name = name;
    this.kind = kind;
    this.superclass = superclass;
    this.methods = ImmutableList.copyOf(methods);
    this.properties = ImmutableList.copyOf(properties);
    this.location = declaration.getLocation();
    this.declaration = declaration;
  }

  public String getName() {
    return name;
  }

  public WidgetKind getKind() {
    return kind;
  }

  /** @return bare superclass name, or null */
  public String getSuperclass() {
    return superclass;
  }

  public List<String> getMethods() {
    return methods;
  }

  public List<String> getProperties() {
    return properties;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /** @return the CLASS_DECL node */
  public WidgetAST getDeclaration() {
    return declaration;
  }

  @Override
  public String toString() {
    return name + " (" + kind.label() + ")";
  }
}
