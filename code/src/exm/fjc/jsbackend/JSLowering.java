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

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.TypeIR;

/**
 * Tables for lowering operators and type tests to JavaScript.  Templates
 * take the operand text(s) via String.format.
 */
public class JSLowering {

  /** Operators spelled differently in JavaScript */
  public static final Map<String, String> BINARY_OPERATORS =
      ImmutableMap.of("==", "===", "!=", "!==");

  /** Operators with no JavaScript counterpart */
  public static final Map<String, String> BINARY_TEMPLATES =
      ImmutableMap.of("~/", "Math.trunc(%s / %s)");

  /** Type tests, keyed by erased type name */
  public static final Map<String, String> TYPE_CHECKS =
      ImmutableMap.<String, String>builder()
      .put("String", "typeof %s === 'string'")
      .put("int", "Number.isInteger(%s)")
      .put("double", "typeof %s === 'number'")
      .put("num", "typeof %s === 'number'")
      .put("bool", "typeof %s === 'boolean'")
      .put("List", "Array.isArray(%s)")
      .put("Iterable", "Array.isArray(%s)")
      .put("Map", "((_m) => _m !== null && typeof _m === 'object' && " +
                  "!Array.isArray(_m))(%s)")
      .put("Set", "%s instanceof Set")
      .put("Function", "typeof %s === 'function'")
      .put("Null", "%s == null")
      .put("Object", "%s != null")
      .put("dynamic", "true")
      .build();

  /** Casts that convert the value, keyed by erased type name */
  public static final Map<String, String> CASTS =
      ImmutableMap.<String, String>builder()
      .put("int", "Math.floor(%s)")
      .put("double", "Number(%s)")
      .put("num", "Number(%s)")
      .put("String", "String(%s)")
      .put("bool", "Boolean(%s)")
      .build();

  /** Casts to these types leave the value alone */
  public static final Set<String> UNCHECKED_CASTS = ImmutableSet.of(
      "dynamic", "Object", "List", "Map", "Set", "Iterable", "Function",
      "Null", "void");

  /**
   * Kinds that must be parenthesized when used as an operand
   */
  public static final Set<ExprKind> LOOSE_KINDS = ImmutableSet.of(
      ExprKind.BINARY, ExprKind.CONDITIONAL, ExprKind.ASSIGNMENT,
      ExprKind.TYPE_CHECK, ExprKind.AWAIT, ExprKind.FUNCTION_EXPR,
      ExprKind.THROW);

  public static String binaryOperator(String op) {
    String js = BINARY_OPERATORS.get(op);
    return js == null ? op : js;
  }

  /**
   * @return template for a type test against t, or null if the test
   *         needs instanceof
   */
  public static String typeCheckTemplate(TypeIR t) {
    if (t.isTypeVariable()) {
      return "true";
    }
    return TYPE_CHECKS.get(t.getName());
  }

  /**
   * @return conversion template, "%s" for unchecked casts, or null if
   *         the cast needs an instanceof check
   */
  public static String castTemplate(TypeIR t) {
    if (t.isTypeVariable() || !t.getTypeArgs().isEmpty() ||
        UNCHECKED_CASTS.contains(t.getName())) {
      return "%s";
    }
    return CASTS.get(t.getName());
  }

  /**
   * Double-quoted JavaScript string literal
   */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          appendChar(sb, c);
      }
    }
    sb.append('"');
    return sb.toString();
  }

  /**
   * Escape literal text inside a template literal
   */
  public static String templateText(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '`' || c == '\\') {
        sb.append('\\').append(c);
      } else if (c == '$' && i + 1 < s.length() && s.charAt(i + 1) == '{') {
        sb.append("\\$");
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else {
        appendChar(sb, c);
      }
    }
    return sb.toString();
  }

  private static void appendChar(StringBuilder sb, char c) {
    if (c < 0x20 || c == 0x2028 || c == 0x2029) {
      sb.append(String.format("\\u%04x", (int) c));
    } else {
      sb.append(c);
    }
  }
}
