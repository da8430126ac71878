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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * Assignment operators.  Compound forms know their binary operator.
 */
public enum AssignOp {
  ASSIGN("=", null),
  ADD("+=", "+"),
  SUB("-=", "-"),
  MUL("*=", "*"),
  DIV("/=", "/"),
  MOD("%=", "%"),
  INT_DIV("~/=", "~/"),
  IF_NULL("??=", "??"),
  BIT_AND("&=", "&"),
  BIT_OR("|=", "|"),
  BIT_XOR("^=", "^"),
  SHIFT_LEFT("<<=", "<<"),
  SHIFT_RIGHT(">>=", ">>");

  private static final Map<String, AssignOp> bySymbol;
  static {
    ImmutableMap.Builder<String, AssignOp> b = ImmutableMap.builder();
    for (AssignOp op: values()) {
      b.put(op.symbol, op);
    }
    bySymbol = b.build();
  }

  private final String symbol;
  private final String binaryOp;

  private AssignOp(String symbol, String binaryOp) {
    this.symbol = symbol;
    this.binaryOp = binaryOp;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * @return binary operator of a compound assignment, or null for =
   */
  public String binaryOp() {
    return binaryOp;
  }

  public boolean isCompound() {
    return binaryOp != null;
  }

  public static AssignOp fromSymbol(String symbol) {
    AssignOp op = bySymbol.get(symbol);
    if (op == null) {
      throw new FJCRuntimeError("Unknown assignment operator " + symbol);
    }
    return op;
  }
}
