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

public class FieldDecl extends IRNode {
  private final String name;
  private final TypeIR type;
  private final ExprIR init;
  private final boolean isStatic;
  private final boolean isFinal;
  private final boolean isConst;
  private final boolean isLate;

  public FieldDecl(int id, SourceLocation loc, String name, TypeIR type,
      ExprIR init, boolean isStatic, boolean isFinal, boolean isConst,
      boolean isLate) {
    super(id, loc);
    this.name = name;
    this.type = type == null ? TypeIR.DYNAMIC : type;
    this.init = init;
    this.isStatic = isStatic;
    this.isFinal = isFinal;
    this.isConst = isConst;
    this.isLate = isLate;
  }

  public String getName() {
    return name;
  }

  public TypeIR getType() {
    return type;
  }

  /** @return initializer or null */
  public ExprIR getInit() {
    return init;
  }

  public boolean isStatic() {
    return isStatic;
  }

  public boolean isFinal() {
    return isFinal;
  }

  public boolean isConst() {
    return isConst;
  }

  public boolean isLate() {
    return isLate;
  }

  @Override
  public String kindName() {
    return "FIELD";
  }
}
