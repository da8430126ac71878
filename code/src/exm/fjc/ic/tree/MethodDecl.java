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

/**
 * Method, getter or setter of a class.
 */
public class MethodDecl extends IRNode {
  private final String name;
  private final TypeIR returnType;
  private final List<String> typeParams;
  private final List<ParameterDecl> params;
  private final FunctionBody body;
  private final boolean isStatic;
  private final boolean isAbstract;
  private final boolean isGetter;
  private final boolean isSetter;
  private final boolean async;
  private final boolean generator;

  public MethodDecl(int id, SourceLocation loc, String name,
      TypeIR returnType, List<String> typeParams, List<ParameterDecl> params,
      FunctionBody body, boolean isStatic, boolean isAbstract,
      boolean isGetter, boolean isSetter, boolean async, boolean generator) {
    super(id, loc);
    assert(!(isGetter && isSetter));
    this.name = name;
    this.returnType = returnType == null ? TypeIR.DYNAMIC : returnType;
    this.typeParams = ImmutableList.copyOf(typeParams);
    this.params = ImmutableList.copyOf(params);
    this.body = body;
    this.isStatic = isStatic;
    this.isAbstract = isAbstract;
    this.isGetter = isGetter;
    this.isSetter = isSetter;
    this.async = async;
    this.generator = generator;
  }

  public String getName() {
    return name;
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

  /** @return body, or null if abstract/external */
  public FunctionBody getBody() {
    return body;
  }

  public boolean isStatic() {
    return isStatic;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  public boolean isGetter() {
    return isGetter;
  }

  public boolean isSetter() {
    return isSetter;
  }

  public boolean isAsync() {
    return async;
  }

  public boolean isGenerator() {
    return generator;
  }

  @Override
  public String kindName() {
    return isGetter ? "GETTER" : (isSetter ? "SETTER" : "METHOD");
  }
}
