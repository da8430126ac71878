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

/**
 * Value of a scalar literal.  Only the field matching the kind is set;
 * asking for another kind's value is an internal error.
 */
public class LiteralValue {
  private final LiteralKind kind;

  /** Storage for literal, dependent on kind */
  private final String stringVal;
  private final long intVal;
  private final double doubleVal;
  private final boolean boolVal;

  public static final LiteralValue NULL =
          new LiteralValue(LiteralKind.NULL, null, 0, 0, false);
  public static final LiteralValue TRUE =
          new LiteralValue(LiteralKind.BOOL, null, 0, 0, true);
  public static final LiteralValue FALSE =
          new LiteralValue(LiteralKind.BOOL, null, 0, 0, false);

  /**
   * Private constructor so that it can only be built using static builder
   * methods (below)
   */
  private LiteralValue(LiteralKind kind, String stringVal, long intVal,
                       double doubleVal, boolean boolVal) {
    assert(!kind.isCollection());
    this.kind = kind;
    this.stringVal = stringVal;
    this.intVal = intVal;
    this.doubleVal = doubleVal;
    this.boolVal = boolVal;
  }

  public static LiteralValue createString(String v) {
    assert(v != null);
    return new LiteralValue(LiteralKind.STRING, v, 0, 0, false);
  }

  public static LiteralValue createInt(long v) {
    return new LiteralValue(LiteralKind.INT, null, v, 0, false);
  }

  public static LiteralValue createDouble(double v) {
    return new LiteralValue(LiteralKind.DOUBLE, null, 0, v, false);
  }

  public static LiteralValue createBool(boolean v) {
    return v ? TRUE : FALSE;
  }

  public LiteralKind getKind() {
    return kind;
  }

  public String getString() {
    if (kind == LiteralKind.STRING) {
      return stringVal;
    } else {
      throw new FJCRuntimeError("getString for " + kind + " literal");
    }
  }

  public long getInt() {
    if (kind == LiteralKind.INT) {
      return intVal;
    } else {
      throw new FJCRuntimeError("getInt for " + kind + " literal");
    }
  }

  public double getDouble() {
    if (kind == LiteralKind.DOUBLE) {
      return doubleVal;
    } else {
      throw new FJCRuntimeError("getDouble for " + kind + " literal");
    }
  }

  public boolean getBool() {
    if (kind == LiteralKind.BOOL) {
      return boolVal;
    } else {
      throw new FJCRuntimeError("getBool for " + kind + " literal");
    }
  }

  public TypeIR getType() {
    switch (kind) {
      case STRING:
        return TypeIR.STRING;
      case INT:
        return TypeIR.INT;
      case DOUBLE:
        return TypeIR.DOUBLE;
      case BOOL:
        return TypeIR.BOOL;
      case NULL:
        return TypeIR.NULL;
      default:
        throw new FJCRuntimeError("Unexpected literal kind " + kind);
    }
  }

  @Override
  public int hashCode() {
    switch (kind) {
      case STRING:
        return stringVal.hashCode();
      case INT:
        return Long.valueOf(intVal).hashCode();
      case DOUBLE:
        return Double.valueOf(doubleVal).hashCode();
      case BOOL:
        return boolVal ? 1 : 2;
      default:
        return 0;
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof LiteralValue)) {
      return false;
    }
    LiteralValue other = (LiteralValue) obj;
    if (kind != other.kind) {
      return false;
    }
    switch (kind) {
      case STRING:
        return stringVal.equals(other.stringVal);
      case INT:
        return intVal == other.intVal;
      case DOUBLE:
        return Double.compare(doubleVal, other.doubleVal) == 0;
      case BOOL:
        return boolVal == other.boolVal;
      default:
        return true;
    }
  }

  @Override
  public String toString() {
    switch (kind) {
      case STRING:
        return "'" + stringVal + "'";
      case INT:
        return Long.toString(intVal);
      case DOUBLE:
        return Double.toString(doubleVal);
      case BOOL:
        return Boolean.toString(boolVal);
      default:
        return "null";
    }
  }
}
