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

import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.FunctionBody;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.VariableDecl;
import exm.fjc.jsbackend.GenConfig.AccessorPolicy;
import exm.fjc.jsbackend.tree.Compound;
import exm.fjc.jsbackend.tree.JSTree;
import exm.fjc.jsbackend.tree.Line;
import exm.fjc.jsbackend.tree.Sequence;

/**
 * Top-level functions, methods and top-level variables
 */
class FunctionCodeGen {
  private final GenContext ctx;

  FunctionCodeGen(GenContext ctx) {
    this.ctx = ctx;
  }

  Sequence body(FunctionBody body) throws CodeGenException {
    if (body.isExpression()) {
      return ctx.stmts.returnValue(body.getExpr());
    }
    return ctx.stmts.statements(body.getBlock().getStatements());
  }

  /**
   * Body rendered for use inside an expression
   */
  String inlineBody(FunctionBody body) throws CodeGenException {
    return ctx.stmts.inline(body(body));
  }

  JSTree function(FunctionDecl decl) throws CodeGenException {
    if (decl.getBody() == null) {
      throw ctx.error(decl, "Function " + decl.getName() + " has no body",
          "External functions must be provided by the runtime; " +
          "remove the declaration or give it a body");
    }
    String header = (decl.isAsync() ? "async " : "") +
        (decl.isGenerator() ? "function* " : "function ") + decl.getName() +
        "(" + ctx.params.declaration(decl.getParams()) + ")";
    return new Compound(header, body(decl.getBody()));
  }

  /**
   * @return method tree, or null for an abstract method
   */
  JSTree method(MethodDecl m) throws CodeGenException {
    if (m.getBody() == null) {
      if (m.isAbstract()) {
        return null;
      }
      throw ctx.error(m, "Method " + m.getName() + " has no body",
          "External methods must be provided by the runtime; " +
          "remove the declaration or give it a body");
    }
    String params = ctx.params.declaration(m.getParams());
    String name;
    if (m.isGetter()) {
      name = ctx.config.getAccessors() == AccessorPolicy.NATIVE ?
             "get " + m.getName() :
             ExprCodeGen.accessorName("get", m.getName());
    } else if (m.isSetter()) {
      name = ctx.config.getAccessors() == AccessorPolicy.NATIVE ?
             "set " + m.getName() :
             ExprCodeGen.accessorName("set", m.getName());
    } else {
      name = m.getName();
    }
    String header = (m.isStatic() ? "static " : "") +
        (m.isAsync() ? "async " : "") +
        (m.isGenerator() ? "*" : "") + name + "(" + params + ")";
    return new Compound(header, body(m.getBody()));
  }

  JSTree variable(VariableDecl v) throws CodeGenException {
    if (v.getInit() == null) {
      return new Line("let " + v.getName() + ";");
    }
    String keyword = v.isImmutable() ? "const " : "let ";
    return new Line(keyword + v.getName() + " = " +
                    ctx.exprs.gen(v.getInit()) + ";");
  }
}
