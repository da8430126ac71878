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

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * Entry of a constructor initializer list:
 * <pre>
 *   C(x) : field = x, assert(x > 0), super.named(x);
 *   C.other() : this(0);
 * </pre>
 */
public class ConstructorInit {
  public static enum InitKind {
    FIELD,
    SUPER,
    REDIRECT,
    ASSERT,
  }

  private final InitKind kind;
  private final SourceLocation location;
  /** field name for FIELD, target constructor name (or null) for
   * SUPER and REDIRECT */
  private final String name;
  /** FIELD value or ASSERT condition */
  private final ExprIR value;
  /** ASSERT message */
  private final ExprIR message;
  private final ArgList args;

  private ConstructorInit(InitKind kind, SourceLocation location, String name,
      ExprIR value, ExprIR message, ArgList args) {
    this.kind = kind;
    this.location = location;
    this.name = name;
    this.value = value;
    this.message = message;
    this.args = args;
  }

  public static ConstructorInit field(SourceLocation loc, String field,
                                      ExprIR value) {
    return new ConstructorInit(InitKind.FIELD, loc, field, value, null, null);
  }

  public static ConstructorInit superCall(SourceLocation loc,
                                          String ctorName, ArgList args) {
    return new ConstructorInit(InitKind.SUPER, loc, ctorName, null, null,
                               args);
  }

  public static ConstructorInit redirect(SourceLocation loc,
                                         String ctorName, ArgList args) {
    return new ConstructorInit(InitKind.REDIRECT, loc, ctorName, null, null,
                               args);
  }

  public static ConstructorInit assertion(SourceLocation loc,
                                          ExprIR condition, ExprIR message) {
    return new ConstructorInit(InitKind.ASSERT, loc, null, condition,
                               message, null);
  }

  public InitKind getKind() {
    return kind;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public String getFieldName() {
    check(InitKind.FIELD);
    return name;
  }

  /** @return named constructor targeted by super/this call, or null */
  public String getConstructorName() {
    if (kind != InitKind.SUPER && kind != InitKind.REDIRECT) {
      throw new FJCRuntimeError("No constructor name for " + kind);
    }
    return name;
  }

  public ExprIR getValue() {
    check(InitKind.FIELD);
    return value;
  }

  public ExprIR getCondition() {
    check(InitKind.ASSERT);
    return value;
  }

  public ExprIR getMessage() {
    check(InitKind.ASSERT);
    return message;
  }

  public ArgList getArgs() {
    if (args == null) {
      throw new FJCRuntimeError("No arguments for " + kind);
    }
    return args;
  }

  private void check(InitKind expected) {
    if (kind != expected) {
      throw new FJCRuntimeError("Expected " + expected + " initializer but "
                                + "was " + kind);
    }
  }
}
