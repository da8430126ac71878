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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.ConstructorDecl;
import exm.fjc.ic.tree.DeclKind;
import exm.fjc.ic.tree.DeclVisitor;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.VariableDecl;
import exm.fjc.jsbackend.tree.CodeBuffer;
import exm.fjc.jsbackend.tree.JSTree;

/**
 * Generates a JavaScript module from the declarations of one unit.
 *
 * A declaration that fails to generate is left out of the output and
 * reported as a CODEGEN_ERROR; generation carries on with the next one.
 */
public class JSGenerator {
  private static final Logger logger = Logging.getFJCLogger();

  public static final String HEADER = "// Generated by fjc. Do not edit.";

  private final GenConfig config;
  private final Diagnostics diagnostics = new Diagnostics();
  private final GenContext ctx;

  private final DeclVisitor<JSTree, CodeGenException> declGen =
      new DeclVisitor<JSTree, CodeGenException>() {
    @Override
    public JSTree visitClass(ClassDecl decl) throws CodeGenException {
      return ctx.classes.generate(decl);
    }

    @Override
    public JSTree visitFunction(FunctionDecl decl) throws CodeGenException {
      return ctx.functions.function(decl);
    }

    @Override
    public JSTree visitVariable(VariableDecl decl) throws CodeGenException {
      return ctx.functions.variable(decl);
    }
  };

  /**
   * @param unit all declarations of the unit, used to tell local classes
   *             from runtime globals
   */
  public JSGenerator(GenConfig config, List<Declaration> unit) {
    this.config = config;
    Set<String> classes = new HashSet<String>();
    Set<String> factories = new HashSet<String>();
    for (Declaration d: unit) {
      if (d.getDeclKind() == DeclKind.CLASS) {
        ClassDecl cls = (ClassDecl) d;
        classes.add(cls.getName());
        for (ConstructorDecl ctor: cls.getConstructors()) {
          if (!ctor.isNamed() && ctor.isFactory()) {
            factories.add(cls.getName());
          }
        }
      }
    }
    this.ctx = new GenContext(config, diagnostics, classes, factories);
  }

  public static GenerationResult generate(List<Declaration> decls,
                                          GenConfig config) {
    return new JSGenerator(config, decls).generateAll(decls);
  }

  public GenerationResult generateAll(List<Declaration> decls) {
    StringBuilder code = new StringBuilder();
    if (config.isHeaderComment()) {
      code.append(HEADER).append("\n\n");
    }
    List<String> parts = new ArrayList<String>();
    for (Declaration decl: decls) {
      try {
        parts.add(declaration(decl));
      } catch (CodeGenException e) {
        CodeGenException located = e.inDeclaration(decl.getName());
        logger.debug("Skipping " + decl.getName() + ": " +
                     located.getMessage());
        diagnostics.report(DiagnosticKind.CODEGEN_ERROR,
            located.getSummary(), located.getLocation());
      }
    }
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        code.append('\n');
      }
      code.append(parts.get(i));
    }
    List<Diagnostic> errors = diagnostics.ofKind(DiagnosticKind.CODEGEN_ERROR);
    logger.debug("Generated " + parts.size() + " of " + decls.size() +
                 " declarations, " + errors.size() + " errors");
    return new GenerationResult(code.toString(), errors,
        diagnostics.ofKind(DiagnosticKind.CODEGEN_WARNING));
  }

  /**
   * Generate one top-level declaration
   */
  public String declaration(Declaration decl) throws CodeGenException {
    ctx.beginDeclaration(decl.getName());
    logger.trace("generating " + decl.getDeclKind() + " " + decl.getName());
    JSTree tree = decl.accept(declGen);
    CodeBuffer out = new CodeBuffer(config.getIndent());
    int level = out.getLevel();
    tree.appendTo(out);
    out.checkBalanced(level, decl.getName());
    return out.toString();
  }

  public String expression(ExprIR e) throws CodeGenException {
    return ctx.exprs.gen(e);
  }

  public String statement(StmtIR s) throws CodeGenException {
    return ctx.stmts.gen(s).render(config.getIndent());
  }

  /**
   * @return warnings and errors raised so far
   */
  public Diagnostics getDiagnostics() {
    return diagnostics;
  }
}
