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
package exm.fjc.jsbackend;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.IRNode;
import exm.fjc.ic.tree.MethodDecl;

/**
 * State shared by the generators while emitting one compilation unit
 */
class GenContext {
  final GenConfig config;
  final Diagnostics diagnostics;
  /** Classes declared in the unit */
  final Set<String> declaredClasses;
  /** Declared classes whose unnamed constructor is a factory */
  final Set<String> unnamedFactories;

  final ExprCodeGen exprs;
  final StmtCodeGen stmts;
  final ParameterCodeGen params;
  final FunctionCodeGen functions;
  final ClassCodeGen classes;

  private String enclosingDecl = null;
  private ClassDecl currentClass = null;
  private int tempCounter = 0;

  GenContext(GenConfig config, Diagnostics diagnostics,
             Set<String> declaredClasses, Set<String> unnamedFactories) {
    this.config = config;
    this.diagnostics = diagnostics;
    this.declaredClasses = ImmutableSet.copyOf(declaredClasses);
    this.unnamedFactories = ImmutableSet.copyOf(unnamedFactories);
    this.exprs = new ExprCodeGen(this);
    this.stmts = new StmtCodeGen(this);
    this.params = new ParameterCodeGen(this);
    this.functions = new FunctionCodeGen(this);
    this.classes = new ClassCodeGen(this);
  }

  /**
   * Reset per-declaration state.  Temporaries are numbered from zero in
   * every declaration so output does not depend on earlier declarations.
   */
  void beginDeclaration(String name) {
    enclosingDecl = name;
    currentClass = null;
    tempCounter = 0;
  }

  String getEnclosingDecl() {
    return enclosingDecl;
  }

  void setCurrentClass(ClassDecl cls) {
    currentClass = cls;
  }

  ClassDecl getCurrentClass() {
    return currentClass;
  }

  String newTemp(String prefix) {
    return "_" + prefix + tempCounter++;
  }

  /**
   * @return true if name is a getter (setter if setter is true) of the
   *         class being generated
   */
  boolean isAccessor(String name, boolean setter) {
    if (currentClass == null) {
      return false;
    }
    for (MethodDecl m: currentClass.getMethods()) {
      if (m.getName().equals(name) &&
          (setter ? m.isSetter() : m.isGetter())) {
        return true;
      }
    }
    return false;
  }

  void warn(String message, SourceLocation loc) {
    diagnostics.report(DiagnosticKind.CODEGEN_WARNING, message, loc);
  }

  CodeGenException error(IRNode node, String message, String suggestion) {
    return new CodeGenException(node.getLocation(), node.getId(),
        node.kindName(), enclosingDecl, message, suggestion);
  }
}
