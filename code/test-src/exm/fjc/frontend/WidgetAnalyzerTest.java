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
package exm.fjc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.imports.FileProber;
import exm.fjc.frontend.imports.ImportResolver;
import exm.fjc.frontend.imports.ResolutionType;
import exm.fjc.frontend.tree.ImportInfo;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetKind;
import exm.fjc.frontend.tree.WidgetTreeNode;
import exm.fjc.parser.Lexer;
import exm.fjc.parser.ParseResult;
import exm.fjc.parser.Parser;

public class WidgetAnalyzerTest {

  static final FileProber NO_FILES = new FileProber() {
    @Override
    public boolean isFile(String path) {
      return false;
    }
  };

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("WidgetAnalyzerTest.fjc.log", true);
  }

  static AnalysisOptions.Builder options() {
    return AnalysisOptions.builder().fileName("test.dart").importResolver(
        ImportResolver.builder().prober(NO_FILES).build());
  }

  static WidgetAST parse(String text, Diagnostics diags) {
    ParseResult res = Parser.parse("test.dart",
        Lexer.tokenize("test.dart", text, diags), diags);
    assertEquals("Unexpected errors: " + diags.getAll(), 0,
                 res.getErrorCount());
    return res.getAST();
  }

  private static WidgetAnalysis analyze(String text, Diagnostics diags) {
    return new WidgetAnalyzer(options().build(), diags)
                 .analyze(parse(text, diags));
  }

  @Test
  public void testSingleStatelessWidget() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze(
        "class Counter extends StatelessWidget {\n" +
        "  build(context) { return Text('Hi'); }\n" +
        "}\n", diags);
    assertEquals(1, res.getWidgets().size());
    WidgetInfo counter = res.getWidgets().get(0);
    assertEquals("Counter", counter.getName());
    assertEquals(WidgetKind.STATELESS, counter.getKind());
    assertEquals("stateless", counter.getKind().label());
    assertEquals("StatelessWidget", counter.getSuperclass());
    assertEquals(Arrays.asList("build"), counter.getMethods());
    assertEquals(Collections.emptyList(), counter.getProperties());
    assertNull(res.getEntryPoint());
    assertNull(res.getRootWidget());

    Diagnostic missing = diags.ofKind(DiagnosticKind.ANALYSIS_ERROR).get(0);
    assertEquals("No entry function 'main' found in test.dart",
                 missing.getMessage());

    WidgetTreeNode tree = res.getWidgetTree().get(0);
    assertEquals("Counter", tree.getName());
    assertEquals("Text", tree.getChildren().get(0).getName());
  }

  @Test
  public void testEntryPointAndRootWidget() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze(
        "class MyApp extends StatelessWidget {\n" +
        "  final String title = 'x';\n" +
        "  build(context) => Text(title);\n" +
        "}\n" +
        "main() { runApp(new MyApp()); }\n", diags);
    assertEquals("main", res.getEntryPoint());
    assertEquals("MyApp", res.getRootWidget());
    assertEquals(1, res.getFunctions().size());
    assertEquals("main", res.getFunctions().get(0).getName());
    assertEquals(Arrays.asList("title"),
                 res.lookupWidget("MyApp").getProperties());
    assertFalse(diags.hasErrors());
  }

  @Test
  public void testConfiguredNames() {
    Diagnostics diags = new Diagnostics();
    WidgetAST ast = parse(
        "class Root extends StatefulWidget {}\n" +
        "start() { mount(Root()); }\n", diags);
    WidgetAnalysis res = new WidgetAnalyzer(options().entryFunction("start")
        .bootstrapCall("mount").build(), diags).analyze(ast);
    assertEquals("start", res.getEntryPoint());
    assertEquals("Root", res.getRootWidget());
  }

  @Test
  public void testEntryWithoutWidget() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze(
        "class A extends StatelessWidget {}\n" +
        "main() { runApp(42); }\n", diags);
    assertEquals("main", res.getEntryPoint());
    assertNull(res.getRootWidget());
    assertEquals("Entry function 'main' does not pass a widget to runApp()",
        diags.ofKind(DiagnosticKind.ANALYSIS_WARNING).get(0).getMessage());
  }

  @Test
  public void testWidgetTreeNesting() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze(
        "class Home extends StatelessWidget {\n" +
        "  Widget build(BuildContext context) {\n" +
        "    return Column(children: [Text('a'), Padding(child: Text('b'))]);\n" +
        "  }\n" +
        "}\n" +
        "main() { runApp(Home()); }\n", diags);
    WidgetTreeNode home = res.getWidgetTree().get(0);
    assertEquals(5, home.size());
    assertEquals("Home\n  Column\n    Text\n    Padding\n      Text\n",
                 home.prettyPrint());
  }

  @Test
  public void testDuplicateClass() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze("class A {}\nclass A {}\n", diags);
    assertEquals(2, res.getWidgets().size());
    assertEquals(1, diags.getErrors().size());
    assertEquals("Duplicate declaration of class A",
                 diags.getErrors().get(0).getMessage());
    assertEquals(WidgetKind.OTHER, res.getWidgets().get(0).getKind());
  }

  @Test
  public void testImports() {
    Diagnostics diags = new Diagnostics();
    WidgetAnalysis res = analyze(
        "import 'package:flutter/material.dart' show Text;\n" +
        "import './missing.dart';\n" +
        "class X extends StatelessWidget {}\n" +
        "main() { runApp(X()); }\n", diags);
    assertEquals(2, res.getImports().size());
    ImportInfo material = res.getImports().get(0);
    assertEquals(Arrays.asList("Text"), material.getItems());
    assertEquals(ResolutionType.FRAMEWORK,
                 material.getResolution().getType());
    assertFalse(res.getImports().get(1).getResolution().isValid());
    assertEquals(1, diags.ofKind(DiagnosticKind.ANALYSIS_WARNING).size());
    assertEquals(Collections.singleton("package:flutter/material.dart"),
                 res.getExternalDependencies());
  }

  @Test
  public void testClassify() {
    assertEquals(WidgetKind.STATEFUL, WidgetKind.classify("StatefulWidget"));
    assertEquals(WidgetKind.STATE, WidgetKind.classify("State"));
    assertEquals(WidgetKind.COMPONENT,
                 WidgetKind.classify("InheritedWidget"));
    assertEquals(WidgetKind.OTHER, WidgetKind.classify(null));
    assertTrue(WidgetKind.STATELESS.isWidget());
    assertFalse(WidgetKind.STATE.isWidget());
  }
}
