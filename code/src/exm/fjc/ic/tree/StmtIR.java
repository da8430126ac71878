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
 * Statement IR.  Closed set of kinds, one nested class each, dispatched
 * through {@link StmtVisitor}.
 */
public abstract class StmtIR extends IRNode {

  protected StmtIR(int id, SourceLocation location) {
    super(id, location);
  }

  public abstract StmtKind getKind();

  public abstract <R, X extends Exception> R accept(StmtVisitor<R, X> v)
      throws X;

  @Override
  public String kindName() {
    return getKind().name();
  }

  public static class Block extends StmtIR {
    private final List<StmtIR> statements;

    public Block(int id, SourceLocation loc, List<StmtIR> statements) {
      super(id, loc);
      this.statements = ImmutableList.copyOf(statements);
    }

    public List<StmtIR> getStatements() {
      return statements;
    }

    public boolean isEmpty() {
      return statements.isEmpty();
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.BLOCK;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitBlock(this);
    }
  }

  public static class ExpressionStmt extends StmtIR {
    private final ExprIR expr;

    public ExpressionStmt(int id, SourceLocation loc, ExprIR expr) {
      super(id, loc);
      this.expr = expr;
    }

    public ExprIR getExpr() {
      return expr;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.EXPRESSION;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitExpression(this);
    }
  }

  /** name = init, init may be null */
  public static class Declarator {
    private final String name;
    private final ExprIR init;

    public Declarator(String name, ExprIR init) {
      this.name = name;
      this.init = init;
    }

    public String getName() {
      return name;
    }

    public ExprIR getInit() {
      return init;
    }
  }

  /**
   * Local variable declaration.  Type is null for var/final without a
   * declared type.
   */
  public static class VarDecl extends StmtIR {
    private final TypeIR type;
    private final boolean isFinal;
    private final boolean isConst;
    private final boolean isLate;
    private final List<Declarator> declarators;

    public VarDecl(int id, SourceLocation loc, TypeIR type, boolean isFinal,
        boolean isConst, boolean isLate, List<Declarator> declarators) {
      super(id, loc);
      assert(!declarators.isEmpty());
      this.type = type;
      this.isFinal = isFinal;
      this.isConst = isConst;
      this.isLate = isLate;
      this.declarators = ImmutableList.copyOf(declarators);
    }

    public TypeIR getDeclaredType() {
      return type;
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

    public List<Declarator> getDeclarators() {
      return declarators;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.VAR_DECL;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitVarDecl(this);
    }
  }

  public static class If extends StmtIR {
    private final ExprIR condition;
    private final StmtIR thenStmt;
    private final StmtIR elseStmt;

    public If(int id, SourceLocation loc, ExprIR condition, StmtIR thenStmt,
              StmtIR elseStmt) {
      super(id, loc);
      this.condition = condition;
      this.thenStmt = thenStmt;
      this.elseStmt = elseStmt;
    }

    public ExprIR getCondition() {
      return condition;
    }

    public StmtIR getThen() {
      return thenStmt;
    }

    /** @return else branch or null */
    public StmtIR getElse() {
      return elseStmt;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.IF;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitIf(this);
    }
  }

  /**
   * C-style for.  Init is a VarDecl or ExpressionStmt or null, condition
   * may be null.
   */
  public static class For extends StmtIR {
    private final StmtIR init;
    private final ExprIR condition;
    private final List<ExprIR> updates;
    private final StmtIR body;

    public For(int id, SourceLocation loc, StmtIR init, ExprIR condition,
               List<ExprIR> updates, StmtIR body) {
      super(id, loc);
      this.init = init;
      this.condition = condition;
      this.updates = ImmutableList.copyOf(updates);
      this.body = body;
    }

    public StmtIR getInit() {
      return init;
    }

    public ExprIR getCondition() {
      return condition;
    }

    public List<ExprIR> getUpdates() {
      return updates;
    }

    public StmtIR getBody() {
      return body;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.FOR;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitFor(this);
    }
  }

  public static class ForIn extends StmtIR {
    private final String varName;
    private final boolean declared;
    private final boolean isFinal;
    private final ExprIR iterable;
    private final StmtIR body;
    private final boolean isAwait;

    public ForIn(int id, SourceLocation loc, String varName, boolean declared,
        boolean isFinal, ExprIR iterable, StmtIR body, boolean isAwait) {
      super(id, loc);
      this.varName = varName;
      this.declared = declared;
      this.isFinal = isFinal;
      this.iterable = iterable;
      this.body = body;
      this.isAwait = isAwait;
    }

    /** await for (x in stream) */
    public boolean isAwait() {
      return isAwait;
    }

    public String getVarName() {
      return varName;
    }

    /** False if the loop assigns an existing variable */
    public boolean isDeclared() {
      return declared;
    }

    public boolean isFinal() {
      return isFinal;
    }

    public ExprIR getIterable() {
      return iterable;
    }

    public StmtIR getBody() {
      return body;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.FOR_IN;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitForIn(this);
    }
  }

  public static class While extends StmtIR {
    private final ExprIR condition;
    private final StmtIR body;

    public While(int id, SourceLocation loc, ExprIR condition, StmtIR body) {
      super(id, loc);
      this.condition = condition;
      this.body = body;
    }

    public ExprIR getCondition() {
      return condition;
    }

    public StmtIR getBody() {
      return body;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.WHILE;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitWhile(this);
    }
  }

  public static class DoWhile extends StmtIR {
    private final StmtIR body;
    private final ExprIR condition;

    public DoWhile(int id, SourceLocation loc, StmtIR body, ExprIR condition) {
      super(id, loc);
      this.body = body;
      this.condition = condition;
    }

    public StmtIR getBody() {
      return body;
    }

    public ExprIR getCondition() {
      return condition;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.DO_WHILE;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitDoWhile(this);
    }
  }

  /**
   * case a: case b: body.  No values means the default case.
   */
  public static class SwitchCase {
    private final List<ExprIR> values;
    private final List<StmtIR> body;

    public SwitchCase(List<ExprIR> values, List<StmtIR> body) {
      this.values = ImmutableList.copyOf(values);
      this.body = ImmutableList.copyOf(body);
    }

    public List<ExprIR> getValues() {
      return values;
    }

    public boolean isDefault() {
      return values.isEmpty();
    }

    public List<StmtIR> getBody() {
      return body;
    }
  }

  public static class Switch extends StmtIR {
    private final ExprIR subject;
    private final List<SwitchCase> cases;

    public Switch(int id, SourceLocation loc, ExprIR subject,
                  List<SwitchCase> cases) {
      super(id, loc);
      this.subject = subject;
      this.cases = ImmutableList.copyOf(cases);
    }

    public ExprIR getSubject() {
      return subject;
    }

    public List<SwitchCase> getCases() {
      return cases;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.SWITCH;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitSwitch(this);
    }
  }

  public static class Return extends StmtIR {
    private final ExprIR value;

    public Return(int id, SourceLocation loc, ExprIR value) {
      super(id, loc);
      this.value = value;
    }

    /** @return returned value, null for a bare return */
    public ExprIR getValue() {
      return value;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.RETURN;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitReturn(this);
    }
  }

  public static class Break extends StmtIR {
    private final String label;

    public Break(int id, SourceLocation loc, String label) {
      super(id, loc);
      this.label = label;
    }

    public String getLabel() {
      return label;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.BREAK;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitBreak(this);
    }
  }

  public static class Continue extends StmtIR {
    private final String label;

    public Continue(int id, SourceLocation loc, String label) {
      super(id, loc);
      this.label = label;
    }

    public String getLabel() {
      return label;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.CONTINUE;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitContinue(this);
    }
  }

  /**
   * on T catch (e, st) { }.  Any of onType, exceptionVar and stackVar may
   * be null, but not both of onType and exceptionVar.
   */
  public static class CatchClause {
    private final TypeIR onType;
    private final String exceptionVar;
    private final String stackVar;
    private final Block body;

    public CatchClause(TypeIR onType, String exceptionVar, String stackVar,
                       Block body) {
      this.onType = onType;
      this.exceptionVar = exceptionVar;
      this.stackVar = stackVar;
      this.body = body;
    }

    public TypeIR getOnType() {
      return onType;
    }

    public String getExceptionVar() {
      return exceptionVar;
    }

    public String getStackVar() {
      return stackVar;
    }

    public Block getBody() {
      return body;
    }
  }

  public static class Try extends StmtIR {
    private final Block body;
    private final List<CatchClause> catches;
    private final Block finallyBlock;

    public Try(int id, SourceLocation loc, Block body,
               List<CatchClause> catches, Block finallyBlock) {
      super(id, loc);
      this.body = body;
      this.catches = ImmutableList.copyOf(catches);
      this.finallyBlock = finallyBlock;
    }

    public Block getBody() {
      return body;
    }

    public List<CatchClause> getCatches() {
      return catches;
    }

    public Block getFinally() {
      return finallyBlock;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.TRY;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitTry(this);
    }
  }

  public static class Yield extends StmtIR {
    private final ExprIR value;
    private final boolean star;

    public Yield(int id, SourceLocation loc, ExprIR value, boolean star) {
      super(id, loc);
      this.value = value;
      this.star = star;
    }

    public ExprIR getValue() {
      return value;
    }

    public boolean isStar() {
      return star;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.YIELD;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitYield(this);
    }
  }

  public static class Assert extends StmtIR {
    private final ExprIR condition;
    private final ExprIR message;

    public Assert(int id, SourceLocation loc, ExprIR condition,
                  ExprIR message) {
      super(id, loc);
      this.condition = condition;
      this.message = message;
    }

    public ExprIR getCondition() {
      return condition;
    }

    public ExprIR getMessage() {
      return message;
    }

    @Override
    public StmtKind getKind() {
      return StmtKind.ASSERT;
    }

    @Override
    public <R, X extends Exception> R accept(StmtVisitor<R, X> v) throws X {
      return v.visitAssert(this);
    }
  }
}
