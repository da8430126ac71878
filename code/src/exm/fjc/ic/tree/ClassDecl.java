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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.SourceLocation;

/**
 * Class declaration.  Members are kept in source order; the generator
 * imposes its own emission order.
 */
public class ClassDecl extends Declaration {
  private final List<String> typeParams;
  private final TypeIR superclass;
  private final List<TypeIR> mixins;
  private final List<TypeIR> interfaces;
  private final boolean isAbstract;
  private final List<FieldDecl> fields;
  private final List<ConstructorDecl> constructors;
  private final List<MethodDecl> methods;

  public ClassDecl(int id, SourceLocation loc, String name,
      List<String> typeParams, TypeIR superclass, List<TypeIR> mixins,
      List<TypeIR> interfaces, boolean isAbstract, List<FieldDecl> fields,
      List<ConstructorDecl> constructors, List<MethodDecl> methods) {
    super(id, loc, name);
    this.typeParams = ImmutableList.copyOf(typeParams);
    this.superclass = superclass;
    this.mixins = ImmutableList.copyOf(mixins);
    this.interfaces = ImmutableList.copyOf(interfaces);
    this.isAbstract = isAbstract;
    this.fields = ImmutableList.copyOf(fields);
    this.constructors = ImmutableList.copyOf(constructors);
    this.methods = ImmutableList.copyOf(methods);
  }

  public List<String> getTypeParams() {
    return typeParams;
  }

  /** @return superclass, or null if none declared */
  public TypeIR getSuperclass() {
    return superclass;
  }

  public List<TypeIR> getMixins() {
    return mixins;
  }

  public List<TypeIR> getInterfaces() {
    return interfaces;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  public List<FieldDecl> getFields() {
    return fields;
  }

  public List<ConstructorDecl> getConstructors() {
    return constructors;
  }

  public List<MethodDecl> getMethods() {
    return methods;
  }

  public boolean hasUnnamedGenerativeConstructor() {
    for (ConstructorDecl c: constructors) {
      if (c.isUnnamedGenerative()) {
        return true;
      }
    }
    return false;
  }

  public List<FieldDecl> getInstanceFields() {
    return filterFields(false);
  }

  public List<FieldDecl> getStaticFields() {
    return filterFields(true);
  }

  public List<MethodDecl> getInstanceMethods() {
    return filterMethods(false);
  }

  public List<MethodDecl> getStaticMethods() {
    return filterMethods(true);
  }

  public FieldDecl lookupField(String name) {
    for (FieldDecl f: fields) {
      if (f.getName().equals(name)) {
        return f;
      }
    }
    return null;
  }

  private List<FieldDecl> filterFields(boolean isStatic) {
    List<FieldDecl> res = new ArrayList<FieldDecl>();
    for (FieldDecl f: fields) {
      if (f.isStatic() == isStatic) {
        res.add(f);
      }
    }
    return res;
  }

  private List<MethodDecl> filterMethods(boolean isStatic) {
    List<MethodDecl> res = new ArrayList<MethodDecl>();
    for (MethodDecl m: methods) {
      if (m.isStatic() == isStatic) {
        res.add(m);
      }
    }
    return res;
  }

  @Override
  public DeclKind getDeclKind() {
    return DeclKind.CLASS;
  }

  @Override
  public <R, X extends Exception> R accept(DeclVisitor<R, X> v) throws X {
    return v.visitClass(this);
  }
}
