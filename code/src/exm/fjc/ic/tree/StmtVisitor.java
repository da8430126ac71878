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

import exm.fjc.ic.tree.StmtIR.Assert;
import exm.fjc.ic.tree.StmtIR.Block;
import exm.fjc.ic.tree.StmtIR.Break;
import exm.fjc.ic.tree.StmtIR.Continue;
import exm.fjc.ic.tree.StmtIR.DoWhile;
import exm.fjc.ic.tree.StmtIR.ExpressionStmt;
import exm.fjc.ic.tree.StmtIR.For;
import exm.fjc.ic.tree.StmtIR.ForIn;
import exm.fjc.ic.tree.StmtIR.If;
import exm.fjc.ic.tree.StmtIR.Return;
import exm.fjc.ic.tree.StmtIR.Switch;
import exm.fjc.ic.tree.StmtIR.Try;
import exm.fjc.ic.tree.StmtIR.VarDecl;
import exm.fjc.ic.tree.StmtIR.While;
import exm.fjc.ic.tree.StmtIR.Yield;

/**
 * One method per statement kind.
 */
public interface StmtVisitor<R, X extends Exception> {
  R visitBlock(Block s) throws X;
  R visitExpression(ExpressionStmt s) throws X;
  R visitVarDecl(VarDecl s) throws X;
  R visitIf(If s) throws X;
  R visitFor(For s) throws X;
  R visitForIn(ForIn s) throws X;
  R visitWhile(While s) throws X;
  R visitDoWhile(DoWhile s) throws X;
  R visitSwitch(Switch s) throws X;
  R visitReturn(Return s) throws X;
  R visitBreak(Break s) throws X;
  R visitContinue(Continue s) throws X;
  R visitTry(Try s) throws X;
  R visitYield(Yield s) throws X;
  R visitAssert(Assert s) throws X;
}
