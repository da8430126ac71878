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
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.diag.Severity;
import exm.fjc.frontend.SSRAnalysis.Compatibility;
import exm.fjc.frontend.tree.UnsafePattern;

public class SSRAnalyzerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SSRAnalyzerTest.fjc.log", true);
  }

  private static SSRAnalysis analyze(String text, Diagnostics diags) {
    WidgetAST ast = WidgetAnalyzerTest.parse(text, diags);
    WidgetAnalysis widgets = new WidgetAnalyzer(
        WidgetAnalyzerTest.options().build(), diags).analyze(ast);
    return new SSRAnalyzer(diags).analyze(widgets.getWidgets());
  }

  @Test
  public void testNoBrowserGlobals() {
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget { build(c) => Text('a'); }\n",
        new Diagnostics());
    assertEquals(Compatibility.HIGH, res.getCompatibility());
    assertEquals(100, res.getScore());
    assertTrue(res.getRecommendations().isEmpty());
  }

  @Test
  public void testUnguardedGlobalInBuild() {
    Diagnostics diags = new Diagnostics();
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  build(context) { return Text(window.location.href); }\n" +
        "}\n", diags);
    assertEquals(Compatibility.LOW, res.getCompatibility());
    assertEquals("low", res.getCompatibility().label());
    assertEquals(100 - SSRAnalyzer.UNGUARDED_PENALTY, res.getScore());
    assertEquals(1, res.getUnsafePatterns().size());
    UnsafePattern p = res.getUnsafePatterns().get(0);
    assertEquals("window", p.getGlobal());
    assertEquals("A", p.getClassName());
    assertEquals("build", p.getMethodName());
    assertFalse(p.isGuarded());
    assertEquals(1, res.getRecommendations().size());
  }

  @Test
  public void testOnlyBuildMethodsScanned() {
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  void onTap() { window.alert('hi'); }\n" +
        "  build(context) => Text('a');\n" +
        "}\n", new Diagnostics());
    assertEquals(Compatibility.HIGH, res.getCompatibility());
  }

  @Test
  public void testBuildHelpersScanned() {
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  buildHeader() => Text(document.title);\n" +
        "  building() => Text(document.title);\n" +
        "}\n", new Diagnostics());
    assertEquals(1, res.getUnsafePatterns().size());
    assertEquals("buildHeader",
                 res.getUnsafePatterns().get(0).getMethodName());
  }

  @Test
  public void testLocalsShadowGlobals() {
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  buildList(location) => Text(location);\n" +
        "  build(context) {\n" +
        "    final history = 'none';\n" +
        "    var f = (alert) => alert;\n" +
        "    return Text(history + document.title);\n" +
        "  }\n" +
        "}\n", new Diagnostics());
    assertEquals(1, res.getUnsafePatterns().size());
    assertEquals("document", res.getUnsafePatterns().get(0).getGlobal());
    assertEquals("build", res.getUnsafePatterns().get(0).getMethodName());
  }

  @Test
  public void testGuardedGlobal() {
    Diagnostics diags = new Diagnostics();
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  build(context) {\n" +
        "    if (kIsWeb) { return Text(window.name); }\n" +
        "    return Text(localStorage != null && isBrowser ? 'a' : 'b');\n" +
        "  }\n" +
        "}\n" +
        "main() { runApp(A()); }\n", diags);
    assertEquals(Compatibility.MEDIUM, res.getCompatibility());
    assertEquals(SSRAnalyzer.MEDIUM_SCORE, res.getScore());
    assertEquals(2, res.getUnsafePatterns().size());
    for (UnsafePattern p: res.getUnsafePatterns()) {
      assertTrue(p.toString(), p.isGuarded());
    }
    for (Diagnostic d: diags.getAll()) {
      assertEquals(Severity.INFO, d.getSeverity());
    }
  }

  @Test
  public void testScorePenaltyFloorsAtZero() {
    StringBuilder body = new StringBuilder();
    for (int i = 0; i < 12; i++) {
      body.append("    fetch('u');\n");
    }
    SSRAnalysis res = analyze(
        "class A extends StatelessWidget {\n" +
        "  build(context) {\n" + body + "    return null;\n  }\n" +
        "}\n", new Diagnostics());
    assertEquals(12, res.getUnsafePatterns().size());
    assertEquals(0, res.getScore());
  }
}
