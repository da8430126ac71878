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

import java.util.HashSet;
import java.util.Set;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.tree.StateLink;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetKind;

public class StateAnalyzerTest {

  private static final String PROGRAM =
      "class Counter extends StatefulWidget {\n" +
      "  createState() => _CounterState();\n" +
      "}\n" +
      "class _CounterState extends State<Counter> {\n" +
      "  int count = 0;\n" +
      "  void inc() { setState(() { count++; }); }\n" +
      "  void reset() { this.setState(() { count = 0; }); }\n" +
      "  build(context) => Text('$count');\n" +
      "}\n" +
      "class Broken extends StatefulWidget {}\n" +
      "class Multi extends StatefulWidget {\n" +
      "  createState() { if (flag) return AState(); return BState(); }\n" +
      "}\n" +
      "class Lonely extends StatefulWidget {\n" +
      "  createState() => MissingState();\n" +
      "}\n" +
      "class Helper { void poke() { setState(() {}); } }\n" +
      "main() { runApp(Counter()); }\n";

  private static Diagnostics diags;
  private static WidgetAnalysis widgets;
  private static StateAnalysis states;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("StateAnalyzerTest.fjc.log", true);
    diags = new Diagnostics();
    WidgetAST ast = WidgetAnalyzerTest.parse(PROGRAM, diags);
    AnalysisOptions opts = WidgetAnalyzerTest.options().build();
    widgets = new WidgetAnalyzer(opts, diags).analyze(ast);
    states = new StateAnalyzer(opts, diags).link(widgets.getWidgets(), ast);
  }

  @Test
  public void testLink() {
    StateLink link = states.linkFor("Counter");
    assertEquals("_CounterState", link.getStateClass());
    assertTrue(link.isStateDeclared());
    assertEquals("Counter", states.ownerOf("_CounterState"));
  }

  @Test
  public void testUndeclaredStateClass() {
    StateLink link = states.linkFor("Lonely");
    assertEquals("MissingState", link.getStateClass());
    assertFalse(link.isStateDeclared());
  }

  @Test
  public void testEveryStatefulWidgetLinkedOrReported() {
    Set<String> linked = new HashSet<String>();
    for (StateLink l: states.getStateLinks()) {
      linked.add(l.getWidget());
    }
    assertEquals(2, states.getErrors().size());
    int stateful = 0;
    for (WidgetInfo w: widgets.getWidgets()) {
      if (w.getKind() == WidgetKind.STATEFUL) {
        stateful++;
      }
    }
    assertEquals(stateful, linked.size() + states.getErrors().size());
    assertNull(states.linkFor("Broken"));
    assertNull(states.linkFor("Multi"));
  }

  @Test
  public void testErrorMessages() {
    Diagnostic broken = states.getErrors().get(0);
    assertEquals("StatefulWidget Broken has no createState method",
                 broken.getMessage());
    assertEquals(DiagnosticKind.ANALYSIS_ERROR, broken.getKind());
    assertEquals("createState of Multi returns multiple state classes: " +
                 "AState, BState", states.getErrors().get(1).getMessage());
    assertTrue("Errors also go to the sink",
               diags.getErrors().contains(broken));
  }

  @Test
  public void testMutationCounts() {
    assertEquals(Integer.valueOf(2),
                 states.getSetStateCallCount().get("_CounterState"));
    boolean warned = false;
    for (Diagnostic d: diags.ofKind(DiagnosticKind.ANALYSIS_WARNING)) {
      if (d.getMessage().equals(
            "setState() called outside a State class, in class Helper")) {
        warned = true;
      }
    }
    assertTrue(warned);
  }
}
