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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.SourceLocation;

public class FunctionDecl extends Declaration {
  private final TypeIR returnType;
  private final List<String> typeParams;
  private final List<ParameterDecl> params;
  private final FunctionBody body;
  private final boolean async;
  private final boolean generator;

  public FunctionDecl(int id, SourceLocation loc, String name,
      TypeIR returnType, List<String> typeParams, List<ParameterDecl> params,
      FunctionBody body, boolean async, boolean generator) {
    super(id, loc, name);
    this.returnType = returnType == null ? TypeIR.DYNAMIC : returnType;
    this.typeParams = ImmutableList.copyOf(typeParams);
    this.params = ImmutableList.copyOf(params);
    this.body = body;
    this.async = async;
    this.generator = generator;
  }

  public TypeIR getReturnType() {
    return returnType;
  }

  public List<String> getTypeParams() {
    return typeParams;
  }

  public List<ParameterDecl> getParams() {
    return params;
  }

  /** @return body, null for external functions */
  public FunctionBody getBody() {
    return body;
  }

  public boolean isAsync() {
    return async;
  }

  public boolean isGenerator() {
    return generator;
  }

  @Override
  public DeclKind getDeclKind() {
    return DeclKind.FUNCTION;
  }

  @Override
  public <R, X extends Exception> R accept(DeclVisitor<R, X> v) throws X {
    return v.visitFunction(this);
  }
}
