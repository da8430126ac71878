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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ExprIR.Cascade;
import exm.fjc.ic.tree.ExprIR.Throw;
import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.StmtIR.Assert;
import exm.fjc.ic.tree.StmtIR.Block;
import exm.fjc.ic.tree.StmtIR.Break;
import exm.fjc.ic.tree.StmtIR.CatchClause;
import exm.fjc.ic.tree.StmtIR.Continue;
import exm.fjc.ic.tree.StmtIR.Declarator;
import exm.fjc.ic.tree.StmtIR.DoWhile;
import exm.fjc.ic.tree.StmtIR.ExpressionStmt;
import exm.fjc.ic.tree.StmtIR.For;
import exm.fjc.ic.tree.StmtIR.ForIn;
import exm.fjc.ic.tree.StmtIR.If;
import exm.fjc.ic.tree.StmtIR.Return;
import exm.fjc.ic.tree.StmtIR.Switch;
import exm.fjc.ic.tree.StmtIR.SwitchCase;
import exm.fjc.ic.tree.StmtIR.Try;
import exm.fjc.ic.tree.StmtIR.VarDecl;
import exm.fjc.ic.tree.StmtIR.While;
import exm.fjc.ic.tree.StmtIR.Yield;
import exm.fjc.ic.tree.StmtKind;
import exm.fjc.ic.tree.StmtVisitor;
import exm.fjc.jsbackend.tree.CaseClause;
import exm.fjc.jsbackend.tree.CodeBuffer;
import exm.fjc.jsbackend.tree.Compound;
import exm.fjc.jsbackend.tree.JSTree;
import exm.fjc.jsbackend.tree.Sequence;

/**
 * Lowers statements to JavaScript statement trees
 */
class StmtCodeGen implements StmtVisitor<JSTree, CodeGenException> {

  /** Statements after which control never reaches the next case */
  private static final List<StmtKind> CASE_TERMINATORS = ImmutableList.of(
      StmtKind.BREAK, StmtKind.RETURN, StmtKind.CONTINUE);

  private final GenContext ctx;

  StmtCodeGen(GenContext ctx) {
    this.ctx = ctx;
  }

  JSTree gen(StmtIR s) throws CodeGenException {
    return s.accept(this);
  }

  Sequence statements(List<StmtIR> stmts) throws CodeGenException {
    Sequence seq = new Sequence();
    for (StmtIR s: stmts) {
      seq.add(gen(s));
    }
    return seq;
  }

  /**
   * Body of a loop or branch: a block contributes its statements
   */
  private Sequence nested(StmtIR s) throws CodeGenException {
    if (s.getKind() == StmtKind.BLOCK) {
      return statements(((Block) s).getStatements());
    }
    return new Sequence(gen(s));
  }

  /**
   * Render a block as "{", the indented statements, then "}", for use
   * inside an expression
   */
  String inlineBlock(Block block) throws CodeGenException {
    return inline(statements(block.getStatements()));
  }

  String inline(Sequence body) {
    CodeBuffer out = new CodeBuffer(ctx.config.getIndent());
    out.indent();
    body.appendTo(out);
    out.dedent();
    out.checkBalanced(0, "function body");
    return "{\n" + out.toString() + "}";
  }

  @Override
  public JSTree visitBlock(Block s) throws CodeGenException {
    return new Compound("", statements(s.getStatements()));
  }

  @Override
  public JSTree visitExpression(ExpressionStmt s) throws CodeGenException {
    ExprIR e = s.getExpr();
    if (e.getKind() == ExprKind.CASCADE) {
      return cascade((Cascade) e, ctx.newTemp("c"));
    } else if (e.getKind() == ExprKind.THROW) {
      return line("throw " + ctx.exprs.gen(((Throw) e).getExpr()) + ";");
    }
    return line(ctx.exprs.gen(e) + ";");
  }

  private static Sequence line(String text) {
    Sequence seq = new Sequence();
    seq.add(text);
    return seq;
  }

  /**
   * Cascade in statement position: bind the target once, then one
   * statement per section
   */
  private Sequence cascade(Cascade e, String tmp) throws CodeGenException {
    Sequence seq = line("const " + tmp + " = " +
                        ctx.exprs.gen(e.getTarget()) + ";");
    seq.append(cascadeSections(e, tmp));
    return seq;
  }

  /**
   * One statement per section on receiver, skipped for a null receiver
   * if the cascade is null-aware
   */
  private Sequence cascadeSections(Cascade e, String receiver)
      throws CodeGenException {
    Sequence sections = new Sequence();
    for (String section: ctx.exprs.cascadeSections(e, receiver)) {
      sections.add(section + ";");
    }
    if (e.isNullAware()) {
      return new Sequence(new Compound("if (" + receiver + " != null)",
                                       sections));
    }
    return sections;
  }

  @Override
  public JSTree visitVarDecl(VarDecl s) throws CodeGenException {
    if (!hasCascadeInit(s)) {
      return line(varDeclText(s) + ";");
    }
    // The declared variable is the cached target
    Sequence seq = new Sequence();
    boolean immutable = s.isFinal() || s.isConst();
    for (Declarator d: s.getDeclarators()) {
      ExprIR init = d.getInit();
      if (init == null) {
        seq.add("let " + d.getName() + ";");
      } else if (init.getKind() == ExprKind.CASCADE) {
        Cascade c = (Cascade) init;
        seq.add((immutable ? "const " : "let ") + d.getName() + " = " +
                ctx.exprs.gen(c.getTarget()) + ";");
        seq.append(cascadeSections(c, d.getName()));
      } else {
        seq.add((immutable ? "const " : "let ") + d.getName() + " = " +
                ctx.exprs.gen(init) + ";");
      }
    }
    return seq;
  }

  private static boolean hasCascadeInit(VarDecl s) {
    for (Declarator d: s.getDeclarators()) {
      if (d.getInit() != null && d.getInit().getKind() == ExprKind.CASCADE) {
        return true;
      }
    }
    return false;
  }

  private String varDeclText(VarDecl s) throws CodeGenException {
    boolean allInit = true;
    List<String> decls = new ArrayList<String>();
    for (Declarator d: s.getDeclarators()) {
      if (d.getInit() == null) {
        allInit = false;
        decls.add(d.getName());
      } else {
        decls.add(d.getName() + " = " + ctx.exprs.gen(d.getInit()));
      }
    }
    boolean immutable = (s.isFinal() || s.isConst()) && allInit;
    return (immutable ? "const " : "let ") + StringUtils.join(decls, ", ");
  }

  @Override
  public JSTree visitIf(If s) throws CodeGenException {
    Compound c = new Compound("if (" + ctx.exprs.gen(s.getCondition()) + ")",
                              nested(s.getThen()));
    StmtIR rest = s.getElse();
    while (rest != null) {
      if (rest.getKind() == StmtKind.IF) {
        If elseIf = (If) rest;
        c.addPart("else if (" + ctx.exprs.gen(elseIf.getCondition()) + ")",
                  nested(elseIf.getThen()));
        rest = elseIf.getElse();
      } else {
        c.addPart("else", nested(rest));
        rest = null;
      }
    }
    return c;
  }

  @Override
  public JSTree visitFor(For s) throws CodeGenException {
    String init = "";
    if (s.getInit() != null) {
      if (s.getInit().getKind() == StmtKind.VAR_DECL) {
        init = varDeclText((VarDecl) s.getInit());
      } else if (s.getInit().getKind() == StmtKind.EXPRESSION) {
        init = ctx.exprs.gen(((ExpressionStmt) s.getInit()).getExpr());
      } else {
        throw ctx.error(s, "Unsupported for-loop initializer " +
                        s.getInit().kindName(),
                        "Use a variable declaration or an expression");
      }
    }
    String cond = s.getCondition() == null ? "" :
                          ctx.exprs.gen(s.getCondition());
    List<String> updates = new ArrayList<String>();
    for (ExprIR u: s.getUpdates()) {
      updates.add(ctx.exprs.gen(u));
    }
    String header = "for (" + init + "; " + cond + "; " +
                    StringUtils.join(updates, ", ") + ")";
    return new Compound(header, nested(s.getBody()));
  }

  @Override
  public JSTree visitForIn(ForIn s) throws CodeGenException {
    String var = s.getVarName();
    if (s.isDeclared()) {
      var = (s.isFinal() ? "const " : "let ") + var;
    }
    String header = (s.isAwait() ? "for await (" : "for (") + var + " of " +
                    ctx.exprs.gen(s.getIterable()) + ")";
    return new Compound(header, nested(s.getBody()));
  }

  @Override
  public JSTree visitWhile(While s) throws CodeGenException {
    return new Compound("while (" + ctx.exprs.gen(s.getCondition()) + ")",
                        nested(s.getBody()));
  }

  @Override
  public JSTree visitDoWhile(DoWhile s) throws CodeGenException {
    Compound c = new Compound("do", nested(s.getBody()));
    c.setSuffix(" while (" + ctx.exprs.gen(s.getCondition()) + ");");
    return c;
  }

  @Override
  public JSTree visitSwitch(Switch s) throws CodeGenException {
    Sequence cases = new Sequence();
    for (SwitchCase sc: s.getCases()) {
      List<String> labels = new ArrayList<String>();
      for (ExprIR v: sc.getValues()) {
        labels.add("case " + ctx.exprs.gen(v) + ":");
      }
      if (sc.isDefault()) {
        labels.add("default:");
      }
      Sequence body = statements(sc.getBody());
      if (needsBreak(sc.getBody())) {
        body.add("break;");
      }
      cases.add(new CaseClause(labels, body));
    }
    return new Compound("switch (" + ctx.exprs.gen(s.getSubject()) + ")",
                        cases);
  }

  /**
   * Cases with statements do not fall through
   */
  private static boolean needsBreak(List<StmtIR> body) {
    if (body.isEmpty()) {
      return false;
    }
    StmtIR last = body.get(body.size() - 1);
    if (CASE_TERMINATORS.contains(last.getKind())) {
      return false;
    }
    return !(last.getKind() == StmtKind.EXPRESSION &&
             ((ExpressionStmt) last).getExpr().getKind() == ExprKind.THROW);
  }

  @Override
  public JSTree visitReturn(Return s) throws CodeGenException {
    if (s.getValue() == null) {
      return line("return;");
    }
    return returnValue(s.getValue());
  }

  Sequence returnValue(ExprIR value) throws CodeGenException {
    if (value.getKind() == ExprKind.CASCADE) {
      String tmp = ctx.newTemp("c");
      Sequence seq = cascade((Cascade) value, tmp);
      seq.add("return " + tmp + ";");
      return seq;
    }
    return line("return " + ctx.exprs.gen(value) + ";");
  }

  @Override
  public JSTree visitBreak(Break s) throws CodeGenException {
    return line(s.getLabel() == null ? "break;" :
                                       "break " + s.getLabel() + ";");
  }

  @Override
  public JSTree visitContinue(Continue s) throws CodeGenException {
    return line(s.getLabel() == null ? "continue;" :
                                       "continue " + s.getLabel() + ";");
  }

  @Override
  public JSTree visitTry(Try s) throws CodeGenException {
    Compound c = new Compound("try", statements(s.getBody().getStatements()));
    List<CatchClause> catches = s.getCatches();
    if (catches.size() == 1 && catches.get(0).getOnType() == null &&
        catches.get(0).getExceptionVar() != null) {
      CatchClause only = catches.get(0);
      Sequence body = new Sequence();
      if (only.getStackVar() != null) {
        body.add("const " + only.getStackVar() + " = " +
                 only.getExceptionVar() + ".stack;");
      }
      body.append(statements(only.getBody().getStatements()));
      c.addPart("catch (" + only.getExceptionVar() + ")", body);
    } else if (!catches.isEmpty()) {
      String ex = ctx.newTemp("e");
      c.addPart("catch (" + ex + ")", catchChain(s, ex));
    }
    if (s.getFinally() != null) {
      c.addPart("finally", statements(s.getFinally().getStatements()));
    }
    return c;
  }

  /**
   * Dispatch on the caught value: one branch per clause, rethrowing when
   * no clause catches everything
   */
  private Sequence catchChain(Try s, String ex) throws CodeGenException {
    Compound chain = null;
    boolean catchAll = false;
    for (CatchClause cc: s.getCatches()) {
      Sequence body = new Sequence();
      if (cc.getExceptionVar() != null) {
        body.add("const " + cc.getExceptionVar() + " = " + ex + ";");
      }
      if (cc.getStackVar() != null) {
        body.add("const " + cc.getStackVar() + " = " + ex + ".stack;");
      }
      body.append(statements(cc.getBody().getStatements()));
      if (cc.getOnType() == null) {
        if (chain == null) {
          return body;
        }
        chain.addPart("else", body);
        catchAll = true;
        break;
      }
      String test = ctx.exprs.typeTest(cc.getOnType(), ex, s.getLocation());
      if (chain == null) {
        chain = new Compound("if (" + test + ")", body);
      } else {
        chain.addPart("else if (" + test + ")", body);
      }
    }
    if (!catchAll) {
      chain.addPart("else", line("throw " + ex + ";"));
    }
    return new Sequence(chain);
  }

  @Override
  public JSTree visitYield(Yield s) throws CodeGenException {
    return line((s.isStar() ? "yield* " : "yield ") +
                ctx.exprs.gen(s.getValue()) + ";");
  }

  @Override
  public JSTree visitAssert(Assert s) throws CodeGenException {
    String args = ctx.exprs.gen(s.getCondition());
    if (s.getMessage() != null) {
      args += ", " + ctx.exprs.gen(s.getMessage());
    }
    return line("console.assert(" + args + ");");
  }
}
