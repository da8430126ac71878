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
package exm.fjc.ic.tree;

import exm.fjc.ast.SourceLocation;

public class ParameterDecl extends IRNode {
  public static enum ParamKind {
    REQUIRED_POSITIONAL,
    OPTIONAL_POSITIONAL,
    NAMED,
  }

  /** Where the parameter's value goes besides the local name */
  public static enum ParamOrigin {
    NORMAL,
    /** this.x: assigns field x */
    FIELD,
    /** super.x: forwarded to the superclass constructor */
    SUPER,
  }

  private final String name;
  private final TypeIR type;
  private final ParamKind paramKind;
  private final boolean required;
  private final ExprIR defaultValue;
  private final ParamOrigin origin;

  public ParameterDecl(int id, SourceLocation loc, String name, TypeIR type,
      ParamKind paramKind, boolean required, ExprIR defaultValue,
      ParamOrigin origin) {
    super(id, loc);
    this.name = name;
    this.type = type == null ? TypeIR.DYNAMIC : type;
    this.paramKind = paramKind;
    this.required = required;
    this.defaultValue = defaultValue;
    this.origin = origin;
  }

  public String getName() {
    return name;
  }

  public TypeIR getType() {
    return type;
  }

  public ParamKind getParamKind() {
    return paramKind;
  }

  public boolean isNamed() {
    return paramKind == ParamKind.NAMED;
  }

  public boolean isOptionalPositional() {
    return paramKind == ParamKind.OPTIONAL_POSITIONAL;
  }

  /** Required named parameter, or any required positional */
  public boolean isRequired() {
    return required || paramKind == ParamKind.REQUIRED_POSITIONAL;
  }

  public ExprIR getDefaultValue() {
    return defaultValue;
  }

  public ParamOrigin getOrigin() {
    return origin;
  }

  @Override
  public String kindName() {
    return "PARAMETER";
  }

  @Override
  public String toString() {
    return paramKind + " " + type + " " + name;
  }
}
