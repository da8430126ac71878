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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ic.tree.ArgList;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ExprIR.Assignment;
import exm.fjc.ic.tree.ExprIR.Await;
import exm.fjc.ic.tree.ExprIR.Binary;
import exm.fjc.ic.tree.ExprIR.Cascade;
import exm.fjc.ic.tree.ExprIR.Cast;
import exm.fjc.ic.tree.ExprIR.Conditional;
import exm.fjc.ic.tree.ExprIR.FunctionExpr;
import exm.fjc.ic.tree.ExprIR.Identifier;
import exm.fjc.ic.tree.ExprIR.IndexAccess;
import exm.fjc.ic.tree.ExprIR.InstanceCreation;
import exm.fjc.ic.tree.ExprIR.InterpolatedString;
import exm.fjc.ic.tree.ExprIR.Invocation;
import exm.fjc.ic.tree.ExprIR.ListLiteral;
import exm.fjc.ic.tree.ExprIR.Literal;
import exm.fjc.ic.tree.ExprIR.MapEntryIR;
import exm.fjc.ic.tree.ExprIR.MapLiteral;
import exm.fjc.ic.tree.ExprIR.MethodCall;
import exm.fjc.ic.tree.ExprIR.PropertyAccess;
import exm.fjc.ic.tree.ExprIR.StringPart;
import exm.fjc.ic.tree.ExprIR.Throw;
import exm.fjc.ic.tree.ExprIR.TypeCheck;
import exm.fjc.ic.tree.ExprIR.Unary;
import exm.fjc.ic.tree.ExprVisitor;

/**
 * Finds await expressions that belong to the enclosing function.  Nested
 * function expressions are their own async scope and are not entered.
 */
class AwaitScanner implements ExprVisitor<Boolean, RuntimeException> {

  private static final AwaitScanner INSTANCE = new AwaitScanner();

  static boolean containsAwait(ExprIR e) {
    return e != null && e.accept(INSTANCE);
  }

  static boolean containsAwait(List<ExprIR> exprs) {
    for (ExprIR e: exprs) {
      if (containsAwait(e)) {
        return true;
      }
    }
    return false;
  }

  private static boolean containsAwait(ArgList args) {
    return containsAwait(args.getPositional()) ||
           containsAwait(ImmutableList.copyOf(args.getNamed().values()));
  }

  @Override
  public Boolean visitLiteral(Literal e) {
    return false;
  }

  @Override
  public Boolean visitIdentifier(Identifier e) {
    return false;
  }

  @Override
  public Boolean visitBinary(Binary e) {
    return containsAwait(e.getLeft()) || containsAwait(e.getRight());
  }

  @Override
  public Boolean visitUnary(Unary e) {
    return containsAwait(e.getOperand());
  }

  @Override
  public Boolean visitMethodCall(MethodCall e) {
    return containsAwait(e.getTarget()) || containsAwait(e.getArgs());
  }

  @Override
  public Boolean visitPropertyAccess(PropertyAccess e) {
    return containsAwait(e.getTarget());
  }

  @Override
  public Boolean visitIndexAccess(IndexAccess e) {
    return containsAwait(e.getTarget()) || containsAwait(e.getIndex());
  }

  @Override
  public Boolean visitConditional(Conditional e) {
    return containsAwait(e.getCondition()) || containsAwait(e.getThen()) ||
           containsAwait(e.getElse());
  }

  @Override
  public Boolean visitFunctionExpr(FunctionExpr e) {
    return false;
  }

  @Override
  public Boolean visitListLiteral(ListLiteral e) {
    return containsAwait(e.getElements());
  }

  @Override
  public Boolean visitMapLiteral(MapLiteral e) {
    for (MapEntryIR entry: e.getEntries()) {
      if (containsAwait(entry.getKey()) || containsAwait(entry.getValue())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Boolean visitAwait(Await e) {
    return true;
  }

  @Override
  public Boolean visitCast(Cast e) {
    return containsAwait(e.getExpr());
  }

  @Override
  public Boolean visitTypeCheck(TypeCheck e) {
    return containsAwait(e.getExpr());
  }

  @Override
  public Boolean visitInterpolatedString(InterpolatedString e) {
    for (StringPart part: e.getParts()) {
      if (!part.isText() && containsAwait(part.getExpr())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Boolean visitAssignment(Assignment e) {
    return containsAwait(e.getTarget()) || containsAwait(e.getValue());
  }

  @Override
  public Boolean visitCascade(Cascade e) {
    return containsAwait(e.getTarget()) || containsAwait(e.getSections());
  }

  @Override
  public Boolean visitInstanceCreation(InstanceCreation e) {
    return containsAwait(e.getArgs());
  }

  @Override
  public Boolean visitInvocation(Invocation e) {
    return containsAwait(e.getCallee()) || containsAwait(e.getArgs());
  }

  @Override
  public Boolean visitThrow(Throw e) {
    return containsAwait(e.getExpr());
  }
}
