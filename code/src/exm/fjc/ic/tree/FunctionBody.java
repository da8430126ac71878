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

import exm.fjc.common.exceptions.FJCRuntimeError;
import exm.fjc.ic.tree.StmtIR.Block;

/**
 * Body of a function, method, constructor or lambda: either a block or a
 * single expression (=> e).
 */
public class FunctionBody {
  private final Block block;
  private final ExprIR expr;

  private FunctionBody(Block block, ExprIR expr) {
    assert((block == null) != (expr == null));
    this.block = block;
    this.expr = expr;
  }

  public static FunctionBody block(Block block) {
    return new FunctionBody(block, null);
  }

  public static FunctionBody expression(ExprIR expr) {
    return new FunctionBody(null, expr);
  }

  public boolean isExpression() {
    return expr != null;
  }

  public Block getBlock() {
    if (block == null) {
      throw new FJCRuntimeError("getBlock on expression body");
    }
    return block;
  }

  public ExprIR getExpr() {
    if (expr == null) {
      throw new FJCRuntimeError("getExpr on block body");
    }
    return expr;
  }
}
