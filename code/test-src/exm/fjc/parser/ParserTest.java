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
package exm.fjc.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;

public class ParserTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ParserTest.fjc.log", true);
  }

  private static ParseResult parse(String text, Diagnostics diags) {
    return Parser.parse("test.dart", Lexer.tokenize("test.dart", text, diags),
                        diags);
  }

  private static WidgetAST parseClean(String text) {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse(text, diags);
    assertEquals("Unexpected errors: " + diags.getAll(), 0,
                 res.getErrorCount());
    return res.getAST();
  }

  /** Initializer of the single variable of a top-level var */
  private static WidgetAST initializer(String text) {
    WidgetAST decl = parseClean(text).child(0);
    assertEquals(ASTType.TOP_LEVEL_VAR, decl.getType());
    return decl.child(2).child(0);
  }

  @Test
  public void testPrecedence() {
    WidgetAST e = initializer("var x = 1 + 2 * 3 == 7 && !done;");
    assertEquals(ASTType.BINARY, e.getType());
    assertEquals("&&", e.getText());
    WidgetAST eq = e.child(0);
    assertEquals("==", eq.getText());
    WidgetAST plus = eq.child(0);
    assertEquals("+", plus.getText());
    assertEquals("Multiplication binds tighter", "*",
                 plus.child(1).getText());
    assertEquals(ASTType.UNARY, e.child(1).getType());
    assertTrue(e.child(1).hasFlag(ASTFlag.PREFIX));
  }

  @Test
  public void testConditionalAndNullCoalesce() {
    WidgetAST e = initializer("var x = a ?? b ? c : d;");
    assertEquals(ASTType.CONDITIONAL, e.getType());
    assertEquals("??", e.child(0).getText());
  }

  @Test
  public void testNegatedTypeTest() {
    WidgetAST e = initializer("var t = x is! String;");
    assertEquals(ASTType.IS, e.getType());
    assertTrue(e.hasFlag(ASTFlag.NEGATED));
    assertEquals("String", e.child(1).getText());
  }

  @Test
  public void testCascade() {
    WidgetAST e = initializer("var b = a..x = 1..f();");
    assertEquals(ASTType.CASCADE, e.getType());
    assertEquals(3, e.childCount());
    assertEquals("a", e.child(0).getText());
    WidgetAST assign = e.child(1);
    assertEquals(ASTType.ASSIGN, assign.getType());
    assertEquals(ASTType.PROPERTY, assign.child(0).getType());
    assertEquals(ASTType.CASCADE_RECEIVER,
                 assign.child(0).child(0).getType());
    assertEquals(ASTType.METHOD_CALL, e.child(2).getType());
    assertEquals("f", e.child(2).getText());
  }

  @Test
  public void testStringInterpolation() {
    WidgetAST e = initializer("var s = 'a${b}c$d';");
    assertEquals(ASTType.STRING_INTERP, e.getType());
    assertEquals(4, e.childCount());
    assertEquals(ASTType.STRING_PART, e.child(0).getType());
    assertEquals("a", e.child(0).getText());
    assertEquals(ASTType.IDENTIFIER, e.child(1).getType());
    assertEquals("c", e.child(2).getText());
    assertEquals("d", e.child(3).getText());
  }

  @Test
  public void testAdjacentStringsConcatenate() {
    WidgetAST e = initializer("var s = 'ab' \"cd\";");
    assertEquals(ASTType.STRING_LITERAL, e.getType());
    assertEquals("abcd", e.getText());
  }

  @Test
  public void testOptionalAndNamedParams() {
    WidgetAST unit = parseClean(
        "f(a, [b = 2]) {}\n" +
        "g({required int c, d: 1}) => c;\n");
    WidgetAST f = unit.child(0);
    assertEquals(ASTType.FUNCTION_DECL, f.getType());
    WidgetAST fParams = f.child(2);
    assertEquals(2, fParams.childCount());
    assertFalse(fParams.child(0).hasFlag(ASTFlag.OPTIONAL));
    assertTrue(fParams.child(1).hasFlag(ASTFlag.OPTIONAL));
    assertEquals(ASTType.INT_LITERAL, fParams.child(1).child(1).getType());

    WidgetAST g = unit.child(1);
    WidgetAST c = g.child(2).child(0);
    assertTrue(c.hasFlag(ASTFlag.NAMED));
    assertTrue(c.hasFlag(ASTFlag.REQUIRED));
    assertEquals("int", c.child(0).getText());
    WidgetAST d = g.child(2).child(1);
    assertTrue(d.hasFlag(ASTFlag.NAMED));
    assertEquals("1", d.child(1).getText());
    assertEquals(ASTType.EXPR_BODY, g.child(4).getType());
  }

  @Test
  public void testConstructors() {
    WidgetAST cls = parseClean(
        "class P extends Base {\n" +
        "  int x;\n" +
        "  P(this.x, {super.key}) : assert(x > 0), super();\n" +
        "  P.origin() : this(0);\n" +
        "  factory P.make() = Q;\n" +
        "}\n").child(0);
    assertEquals(ASTType.CLASS_DECL, cls.getType());
    assertEquals("Base", cls.child(1).child(0).getText());
    WidgetAST body = cls.child(5);
    assertEquals(4, body.childCount());
    assertEquals(ASTType.FIELD_DECL, body.child(0).getType());

    WidgetAST unnamed = body.child(1);
    assertEquals(ASTType.CONSTRUCTOR_DECL, unnamed.getType());
    assertEquals("", unnamed.getText());
    assertTrue(unnamed.child(0).child(0).hasFlag(ASTFlag.FIELD_PARAM));
    assertTrue(unnamed.child(0).child(1).hasFlag(ASTFlag.SUPER_PARAM));
    WidgetAST inits = unnamed.child(1);
    assertEquals(ASTType.ASSERT_INIT, inits.child(0).getType());
    assertEquals(ASTType.SUPER_INIT, inits.child(1).getType());
    assertTrue(unnamed.child(3).isNone());

    WidgetAST origin = body.child(2);
    assertEquals("origin", origin.getText());
    assertEquals(ASTType.REDIRECT_INIT, origin.child(1).child(0).getType());

    WidgetAST make = body.child(3);
    assertTrue(make.hasFlag(ASTFlag.FACTORY));
    assertEquals("Redirecting factory becomes new Q()", ASTType.NEW,
                 make.child(3).child(0).getType());
  }

  @Test
  public void testAccessorsAndUntypedMethods() {
    WidgetAST body = parseClean(
        "abstract class A {\n" +
        "  int get size => 0;\n" +
        "  set size(int v) {}\n" +
        "  build(context) { return null; }\n" +
        "  void run();\n" +
        "}\n").child(0).child(5);
    assertTrue(body.child(0).hasFlag(ASTFlag.GETTER));
    assertTrue(body.child(1).hasFlag(ASTFlag.SETTER));
    assertEquals(ASTType.METHOD_DECL, body.child(2).getType());
    assertEquals("build", body.child(2).getText());
    assertTrue(body.child(2).child(0).isNone());
    assertTrue("Abstract method has no body", body.child(3).child(4).isNone());
  }

  @Test
  public void testMemberRecovery() {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse(
        "class A { int x = ; void f() {} }\n" +
        "void g() {}\n", diags);
    assertEquals(1, res.getErrorCount());
    assertEquals("expected expression but found ';'",
                 diags.ofKind(DiagnosticKind.PARSE_ERROR).get(0)
                      .getMessage());
    WidgetAST unit = res.getAST();
    assertEquals(2, unit.childCount());
    WidgetAST members = unit.child(0).child(5);
    assertEquals(ASTType.ERROR, members.child(0).getType());
    assertEquals("Parsing resumes at the next member", "f",
                 members.child(1).getText());
    assertEquals("g", unit.child(1).getText());
    assertFalse(unit.child(1).containsError());
  }

  @Test
  public void testCodePointOutOfRange() {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse(
        "void main() {\n" +
        "  var s = '\\u{110000}';\n" +
        "  var t = 'ok';\n" +
        "}\n", diags);
    assertEquals(1, res.getErrorCount());
    String msg = diags.ofKind(DiagnosticKind.PARSE_ERROR).get(0)
                      .getMessage();
    assertTrue(msg, msg.startsWith("code point out of range"));
    WidgetAST block = res.getAST().child(0).child(4);
    assertEquals(ASTType.ERROR, block.child(0).getType());
    assertEquals(ASTType.VAR_DECL_STMT, block.child(1).getType());
  }

  @Test
  public void testLargestCodePoint() {
    WidgetAST e = initializer("var s = '\\u{10FFFF}';");
    assertEquals(ASTType.STRING_LITERAL, e.getType());
    assertEquals(new String(Character.toChars(0x10FFFF)), e.getText());
  }

  @Test
  public void testStatementRecovery() {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse(
        "void f() {\n" +
        "  var a = ;\n" +
        "  return a;\n" +
        "}\n", diags);
    assertEquals(1, res.getErrorCount());
    WidgetAST block = res.getAST().child(0).child(4);
    assertEquals(ASTType.ERROR, block.child(0).getType());
    assertEquals(ASTType.RETURN, block.child(1).getType());
  }

  @Test
  public void testUnsupportedDeclaration() {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse("enum Color { red }\nclass A {}\n", diags);
    assertEquals("'enum' declarations are not supported",
                 diags.getErrors().get(0).getMessage());
    WidgetAST unit = res.getAST();
    assertEquals(ASTType.ERROR, unit.child(0).getType());
    assertEquals(ASTType.CLASS_DECL, unit.child(1).getType());
  }

  @Test
  public void testImports() {
    WidgetAST unit = parseClean(
        "import 'package:flutter/material.dart' as m show Text;\n" +
        "import { a as b, c } from './util.js';\n");
    WidgetAST dart = unit.child(0);
    assertEquals(ASTType.IMPORT, dart.getType());
    assertEquals("package:flutter/material.dart", dart.getText());
    assertEquals(ASTType.IMPORT_ALIAS, dart.child(0).getType());
    assertEquals(ASTType.IMPORT_ITEM, dart.child(1).getType());

    WidgetAST module = unit.child(1);
    assertTrue(module.hasFlag(ASTFlag.MODULE_SYNTAX));
    assertEquals("./util.js", module.getText());
    assertEquals("b", module.child(0).child(0).getText());
  }

  @Test
  public void testCommentsCollected() {
    Diagnostics diags = new Diagnostics();
    ParseResult res = parse("/// Docs\nvoid f() {} // trailing\n", diags);
    assertEquals(2, res.getComments().size());
    assertTrue(res.getComments().get(0).isDocComment());
    assertEquals(1, res.getAST().childCount());
  }

  @Test
  public void testLambdas() {
    WidgetAST e = initializer("var f = (a, b) async => a + b;");
    assertEquals(ASTType.FUNCTION_EXPR, e.getType());
    assertTrue(e.hasFlag(ASTFlag.ASYNC));
    assertEquals(2, e.child(0).childCount());

    WidgetAST single = initializer("var g = x => x * 2;");
    assertEquals(ASTType.FUNCTION_EXPR, single.getType());
    assertEquals("x", single.child(0).child(0).getText());
  }
}
