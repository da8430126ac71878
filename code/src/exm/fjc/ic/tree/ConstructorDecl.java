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
import exm.fjc.ic.tree.ConstructorInit.InitKind;

/**
 * Generative or factory constructor, optionally named.
 */
public class ConstructorDecl extends IRNode {
  private final String className;
  private final String name;
  private final List<ParameterDecl> params;
  private final List<ConstructorInit> initializers;
  private final FunctionBody body;
  private final boolean isFactory;
  private final boolean isConst;

  public ConstructorDecl(int id, SourceLocation loc, String className,
      String name, List<ParameterDecl> params,
      List<ConstructorInit> initializers, FunctionBody body,
      boolean isFactory, boolean isConst) {
    super(id, loc);
    this.className = className;
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.initializers = ImmutableList.copyOf(initializers);
    this.body = body;
    this.isFactory = isFactory;
    this.isConst = isConst;
  }

  public String getClassName() {
    return className;
  }

  /** @return constructor name, or null for the unnamed constructor */
  public String getName() {
    return name;
  }

  public boolean isNamed() {
    return name != null;
  }

  public boolean isUnnamedGenerative() {
    return name == null && !isFactory;
  }

  public String getDisplayName() {
    return name == null ? className : className + "." + name;
  }

  public List<ParameterDecl> getParams() {
    return params;
  }

  public List<ConstructorInit> getInitializers() {
    return initializers;
  }

  /** @return super(...) initializer, or null */
  public ConstructorInit getSuperInit() {
    for (ConstructorInit init: initializers) {
      if (init.getKind() == InitKind.SUPER) {
        return init;
      }
    }
    return null;
  }

  /** @return this(...) initializer, or null */
  public ConstructorInit getRedirect() {
    for (ConstructorInit init: initializers) {
      if (init.getKind() == InitKind.REDIRECT) {
        return init;
      }
    }
    return null;
  }

  /** @return body or null if none (C(this.x);) */
  public FunctionBody getBody() {
    return body;
  }

  public boolean isFactory() {
    return isFactory;
  }

  public boolean isConst() {
    return isConst;
  }

  @Override
  public String kindName() {
    return isFactory ? "FACTORY_CONSTRUCTOR" : "CONSTRUCTOR";
  }
}
