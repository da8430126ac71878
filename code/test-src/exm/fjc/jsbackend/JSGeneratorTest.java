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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.ASTWalker;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.jsbackend.GenConfig.AccessorPolicy;
import exm.fjc.jsbackend.GenConfig.FieldInitPolicy;
import exm.fjc.parser.Lexer;
import exm.fjc.parser.Parser;

public class JSGeneratorTest {

  private static final GenConfig NO_HEADER =
      GenConfig.builder().headerComment(false).build();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("JSGeneratorTest.fjc.log", true);
  }

  static List<Declaration> walk(String text) {
    Diagnostics diags = new Diagnostics();
    List<Declaration> decls = new ASTWalker(diags).walk(
        Parser.parse("test.dart", Lexer.tokenize("test.dart", text, diags),
                     diags).getAST());
    assertFalse(diags.getAll().toString(), diags.hasErrors());
    return decls;
  }

  private static GenerationResult generate(String text, GenConfig config) {
    return JSGenerator.generate(walk(text), config);
  }

  private static String code(String text) {
    GenerationResult result = generate(text, NO_HEADER);
    assertFalse(result.getErrors().toString(), result.hasErrors());
    return result.getCode();
  }

  @Test
  public void testHeaderComment() {
    String js = generate("var x = 1;\n", GenConfig.defaults()).getCode();
    assertEquals(JSGenerator.HEADER + "\n\nlet x = 1;\n", js);
    assertEquals("let x = 1;\n", code("var x = 1;\n"));
  }

  @Test
  public void testSynthesizedConstructorCallsSuper() {
    String js = code("class Counter extends StatelessWidget {\n" +
                     "  build(context) { return Text('Hi'); }\n" +
                     "}\n");
    assertEquals(1, StringUtils.countMatches(js, "constructor("));
    assertEquals(
        "class Counter extends StatelessWidget {\n" +
        "  constructor() {\n" +
        "    super();\n" +
        "  }\n" +
        "\n" +
        "  build(context) {\n" +
        "    return new Text(\"Hi\");\n" +
        "  }\n" +
        "}\n", js);
  }

  @Test
  public void testSynthesizedConstructorWithoutSuperclass() {
    assertEquals(
        "class Empty {\n" +
        "  constructor() {\n" +
        "  }\n" +
        "}\n", code("class Empty {}\n"));
  }

  @Test
  public void testNoSynthesisBesideUnnamedConstructor() {
    String js = code(
        "class Logger {\n" +
        "  final String name;\n" +
        "  Logger(this.name);\n" +
        "  factory Logger.named(String n) { return Logger(n); }\n" +
        "}\n");
    assertEquals(js, 1, StringUtils.countMatches(js, "constructor("));
    assertTrue(js, js.contains("  constructor(name) {\n" +
                               "    this.name = name;\n" +
                               "  }\n"));
    assertTrue(js, js.contains("  static named(n) {\n" +
                               "    return new Logger(n);\n" +
                               "  }\n"));
  }

  @Test
  public void testUnnamedFactoryBecomesCreate() {
    String js = code(
        "class Single {\n" +
        "  Single._();\n" +
        "  factory Single() => Single._();\n" +
        "}\n" +
        "var one = Single();\n");
    assertTrue(js, js.contains("  constructor() {\n  }\n"));
    assertTrue(js, js.contains("  static _() {\n" +
                               "    const instance = new Single();\n" +
                               "    return instance;\n" +
                               "  }\n"));
    assertTrue(js, js.contains("  static create() {\n" +
                               "    return Single._();\n" +
                               "  }\n"));
    assertTrue(js, js.contains("let one = Single.create();"));
  }

  @Test
  public void testMemberOrder() {
    String js = code(
        "class Order {\n" +
        "  static void make() {}\n" +
        "  void run() {}\n" +
        "  static int created = 0;\n" +
        "  Order();\n" +
        "  int size = 1;\n" +
        "}\n");
    int field = js.indexOf("size = 1;");
    int ctor = js.indexOf("constructor()");
    int method = js.indexOf("run()");
    int staticField = js.indexOf("static created = 0;");
    int staticMethod = js.indexOf("static make()");
    assertTrue(js, field >= 0 && field < ctor);
    assertTrue(js, ctor < method);
    assertTrue(js, method < staticField);
    assertTrue(js, staticField < staticMethod);
  }

  @Test
  public void testFieldInitInConstructor() {
    GenConfig config = GenConfig.builder().headerComment(false)
        .fieldInit(FieldInitPolicy.CONSTRUCTOR).build();
    String js = generate("class Box { int size = 3; }\n", config).getCode();
    assertEquals(
        "class Box {\n" +
        "  constructor() {\n" +
        "    this.size = 3;\n" +
        "  }\n" +
        "}\n", js);
  }

  @Test
  public void testAccessorPolicies() {
    String text = "class P {\n" +
                  "  int _x = 0;\n" +
                  "  int get x => _x;\n" +
                  "}\n";
    assertTrue(code(text).contains("  get x() {\n"));
    GenConfig methods = GenConfig.builder().headerComment(false)
        .accessors(AccessorPolicy.METHODS).build();
    assertTrue(generate(text, methods).getCode().contains("  getX() {\n"));
  }

  @Test
  public void testParametersAndArguments() {
    String js = code("void g(int a, {int b = 2, c}) {}\n" +
                     "void h() { g(1, c: 3); }\n");
    assertTrue(js, js.contains("function g(a, { b = 2, c } = {}) {\n}\n"));
    assertTrue(js, js.contains("  g(1, { c: 3 });\n"));
  }

  @Test
  public void testOperatorLowering() {
    String js = code("f(a, b) => a ~/ b;\n" +
                     "g(a, b) => a == b;\n" +
                     "h(a, b) => (a + b) * 2;\n");
    assertTrue(js, js.contains("return Math.trunc(a / b);"));
    assertTrue(js, js.contains("return a === b;"));
    assertTrue(js, js.contains("return (a + b) * 2;"));
  }

  @Test
  public void testFailedDeclarationIsSkipped() {
    GenerationResult result = generate(
        "var before = 1;\n" +
        "external void now();\n" +
        "void after() { print(before); }\n", NO_HEADER);
    assertEquals(1, result.getErrors().size());
    Diagnostic error = result.getErrors().get(0);
    assertEquals(DiagnosticKind.CODEGEN_ERROR, error.getKind());
    assertTrue(error.getMessage(),
               error.getMessage().contains("Function now has no body"));
    assertTrue(error.getMessage(), error.getMessage().contains("in now"));

    String js = result.getCode();
    assertTrue(js, js.contains("let before = 1;"));
    assertTrue(js, js.contains("function after() {\n  print(before);\n}"));
    assertFalse(js, js.contains("now"));
  }

  @Test
  public void testNullAwareAssignmentRejected() {
    GenerationResult result = generate(
        "void f(a) { a?.x = 1; }\n", NO_HEADER);
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).getMessage().contains(
        "Null-aware assignment target"));
  }

  @Test
  public void testNullAwareChainAssignmentRejected() {
    GenerationResult result = generate(
        "void f(a) { a?.b.c = 1; }\n", NO_HEADER);
    assertEquals(1, result.getErrors().size());
    assertTrue(result.getErrors().get(0).getMessage().contains(
        "Null-aware assignment target"));
  }

  @Test
  public void testNullAwareAccess() {
    String js = code("f(a) => a?.b;\n" +
                     "g(a, i) => a?[i];\n" +
                     "h(a) => a.b?.c();\n");
    assertTrue(js, js.contains("return (a?.b ?? null);"));
    assertTrue(js, js.contains("return (a?.[i] ?? null);"));
    assertTrue(js, js.contains("return (a.b?.c() ?? null);"));
  }

  @Test
  public void testNullAwareShortCircuitsChain() {
    String js = code("f(a) => a?.b.c;\n" +
                     "g(a) => a?.length.isEven;\n" +
                     "h(a) => a?.f(1).g()[0];\n" +
                     "k(a, b) => a?.f(b?.c) == null;\n");
    assertTrue(js, js.contains("return (a?.b.c ?? null);"));
    assertTrue(js, js.contains("return (a?.length.isEven ?? null);"));
    assertTrue(js, js.contains("return (a?.f(1).g()[0] ?? null);"));
    assertTrue("Arguments start chains of their own", js.contains(
        "return (a?.f((b?.c ?? null)) ?? null) === null;"));
  }

  @Test
  public void testCascadeStatements() {
    assertEquals(
        "function s(x) {\n" +
        "  const _c0 = x;\n" +
        "  _c0.f();\n" +
        "  _c0.g = 1;\n" +
        "}\n", code("void s(x) { x..f()..g = 1; }\n"));
    assertEquals(
        "function t(x) {\n" +
        "  const _c0 = x;\n" +
        "  if (_c0 != null) {\n" +
        "    _c0.f();\n" +
        "    _c0.g = 1;\n" +
        "  }\n" +
        "}\n", code("void t(x) { x?..f()..g = 1; }\n"));
  }

  @Test
  public void testCascadeInDeclarationAndReturn() {
    assertEquals(
        "function v() {\n" +
        "  let l = [1];\n" +
        "  l.add(2);\n" +
        "  return l;\n" +
        "}\n", code("v() { var l = [1]..add(2); return l; }\n"));
    assertEquals(
        "function r(x) {\n" +
        "  const _c0 = x;\n" +
        "  _c0.add(1);\n" +
        "  return _c0;\n" +
        "}\n", code("r(x) => x..add(1);\n"));
  }

  @Test
  public void testCascadeWithAwait() {
    String js = code("f() async => 1;\n" +
                     "main() async { var l = [1]..add(await f()); }\n" +
                     "g() async => h([1]..add(await f()));\n" +
                     "k() => h([1]..add(2));\n");
    assertTrue(js, js.contains("  let l = [1];\n  l.add(await f());\n"));
    assertTrue(js, js.contains("return h((await (async (_c0) => { " +
        "_c0.add(await f()); return _c0; })([1])));"));
    assertTrue("No async wrapper without await", js.contains(
        "return h(((_c0) => { _c0.add(2); return _c0; })([1]));"));
  }

  @Test
  public void testSuperInitializerWithoutSuperclass() {
    GenerationResult result = generate(
        "class A { A() : super(); }\n", NO_HEADER);
    assertEquals(1, result.getErrors().size());
    assertEquals("", result.getCode());
  }

  @Test
  public void testMixinWarning() {
    GenerationResult result = generate(
        "class A extends B with M {}\n", NO_HEADER);
    assertFalse(result.hasErrors());
    assertEquals(1, result.getWarnings().size());
    assertEquals(DiagnosticKind.CODEGEN_WARNING,
                 result.getWarnings().get(0).getKind());
  }

  @Test
  public void testIndentationBalanced() {
    GenConfig tabs = GenConfig.builder().headerComment(false)
        .indent("\t").build();
    String js = generate(
        "class Walker {\n" +
        "  void walk(List<int> xs) {\n" +
        "    for (var x in xs) {\n" +
        "      if (x > 0) { print(x); } else { continue; }\n" +
        "    }\n" +
        "    try { throw 'e'; } catch (e) { print(e); }\n" +
        "  }\n" +
        "}\n", tabs).getCode();
    int depth = 0;
    for (String line: js.split("\n")) {
      if (line.isEmpty()) {
        continue;
      }
      String trimmed = StringUtils.stripStart(line, "\t");
      int tabsUsed = line.length() - trimmed.length();
      if (trimmed.startsWith("}")) {
        depth--;
      }
      assertEquals("Indentation of: " + line, depth, tabsUsed);
      if (trimmed.endsWith("{")) {
        depth++;
      }
    }
    assertEquals(0, depth);
  }

  @Test
  public void testDeterministic() {
    String text = "class C {\n" +
                  "  var items = [1, 2];\n" +
                  "  f(x) => x..add(1)..add(2);\n" +
                  "  g(m) => {'b': 1, 'a': 2};\n" +
                  "}\n";
    String first = code(text);
    assertEquals(first, code(text));
    assertTrue(first, first.contains("_c0"));
  }
}
