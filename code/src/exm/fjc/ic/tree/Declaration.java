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

/**
 * Top-level declaration of a compilation unit.
 */
public abstract class Declaration extends IRNode {
  private final String name;

  protected Declaration(int id, SourceLocation location, String name) {
    super(id, location);
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public abstract DeclKind getDeclKind();

  public abstract <R, X extends Exception> R accept(DeclVisitor<R, X> v)
      throws X;

  @Override
  public String kindName() {
    return getDeclKind().name();
  }

  @Override
  public String toString() {
    return getDeclKind().name().toLowerCase() + " " + name;
  }
}
