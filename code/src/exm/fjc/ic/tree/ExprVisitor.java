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
import exm.fjc.ic.tree.ExprIR.MapLiteral;
import exm.fjc.ic.tree.ExprIR.MethodCall;
import exm.fjc.ic.tree.ExprIR.PropertyAccess;
import exm.fjc.ic.tree.ExprIR.Throw;
import exm.fjc.ic.tree.ExprIR.TypeCheck;
import exm.fjc.ic.tree.ExprIR.Unary;

/**
 * One method per expression kind.  Adding a kind means every visitor has
 * to handle it before the project compiles again.
 * @param <R> result
 * @param <X> checked exception the visitor may throw
 */
public interface ExprVisitor<R, X extends Exception> {
  R visitLiteral(Literal e) throws X;
  R visitIdentifier(Identifier e) throws X;
  R visitBinary(Binary e) throws X;
  R visitUnary(Unary e) throws X;
  R visitMethodCall(MethodCall e) throws X;
  R visitPropertyAccess(PropertyAccess e) throws X;
  R visitIndexAccess(IndexAccess e) throws X;
  R visitConditional(Conditional e) throws X;
  R visitFunctionExpr(FunctionExpr e) throws X;
  R visitListLiteral(ListLiteral e) throws X;
  R visitMapLiteral(MapLiteral e) throws X;
  R visitAwait(Await e) throws X;
  R visitCast(Cast e) throws X;
  R visitTypeCheck(TypeCheck e) throws X;
  R visitInterpolatedString(InterpolatedString e) throws X;
  R visitAssignment(Assignment e) throws X;
  R visitCascade(Cascade e) throws X;
  R visitInstanceCreation(InstanceCreation e) throws X;
  R visitInvocation(Invocation e) throws X;
  R visitThrow(Throw e) throws X;
}
