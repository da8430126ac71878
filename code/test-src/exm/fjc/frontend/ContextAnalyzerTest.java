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
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.tree.ConsumerInfo;
import exm.fjc.frontend.tree.ProviderInfo;
import exm.fjc.frontend.tree.ProviderInfo.ProviderKind;

public class ContextAnalyzerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ContextAnalyzerTest.fjc.log", true);
  }

  private static ContextAnalysis analyze(String text, Diagnostics diags) {
    WidgetAST ast = WidgetAnalyzerTest.parse(text, diags);
    AnalysisOptions opts = WidgetAnalyzerTest.options().build();
    WidgetAnalysis widgets = new WidgetAnalyzer(opts, diags).analyze(ast);
    StateAnalysis states = new StateAnalyzer(opts, diags)
                                 .link(widgets.getWidgets(), ast);
    return new ContextAnalyzer(diags).analyze(widgets, states);
  }

  @Test
  public void testInheritedWidgetAboveConsumer() {
    Diagnostics diags = new Diagnostics();
    ContextAnalysis res = analyze(
        "class AppTheme extends InheritedWidget {\n" +
        "  AppTheme({child}) : super(child: child);\n" +
        "}\n" +
        "class App extends StatelessWidget {\n" +
        "  build(context) => AppTheme(child: Label());\n" +
        "}\n" +
        "class Label extends StatelessWidget {\n" +
        "  build(context) => Text(AppTheme.of(context).title);\n" +
        "}\n" +
        "class Orphan extends StatelessWidget {\n" +
        "  build(context) => Text(AppTheme.of(context).title);\n" +
        "}\n" +
        "main() { runApp(App()); }\n", diags);

    assertEquals(1, res.getProviders().size());
    ProviderInfo theme = res.getProviders().get(0);
    assertEquals("AppTheme", theme.getName());
    assertEquals(ProviderKind.INHERITED_WIDGET, theme.getKind());

    assertEquals(2, res.getConsumers().size());
    ConsumerInfo label = res.getConsumers().get(0);
    assertEquals("Label", label.getEnclosingClass());
    assertEquals("build", label.getEnclosingMethod());
    assertTrue("Found through the place Label is constructed",
               label.isResolved());
    assertEquals("AppTheme", label.getMatchedProvider().getName());

    ConsumerInfo orphan = res.getConsumers().get(1);
    assertFalse(orphan.isResolved());
    assertEquals(1, res.getUnresolvedAccesses().size());
    assertEquals("No AppTheme provider above Orphan in the widget tree",
        diags.ofKind(DiagnosticKind.ANALYSIS_WARNING).get(0).getMessage());
  }

  @Test
  public void testChangeNotifierThroughProviderWidget() {
    Diagnostics diags = new Diagnostics();
    ContextAnalysis res = analyze(
        "class CartModel extends ChangeNotifier {}\n" +
        "class App extends StatelessWidget {\n" +
        "  build(context) => ChangeNotifierProvider(\n" +
        "      create: (c) => CartModel(), child: Cart());\n" +
        "}\n" +
        "class Cart extends StatelessWidget {\n" +
        "  build(context) {\n" +
        "    var cart = context.watch<CartModel>();\n" +
        "    return Text(Provider.of<CartModel>(context).total);\n" +
        "  }\n" +
        "}\n" +
        "main() { runApp(App()); }\n", diags);
    assertEquals(ProviderKind.CHANGE_NOTIFIER,
                 res.getProviders().get(0).getKind());
    assertEquals(2, res.getConsumers().size());
    for (ConsumerInfo c: res.getConsumers()) {
      assertEquals("CartModel", c.getProviderName());
      assertTrue(c.toString(), c.isResolved());
      assertEquals("ChangeNotifierProvider",
                   c.getMatchedProvider().getName());
    }
  }

  @Test
  public void testConsumerInStateClassUsesOwningWidget() {
    Diagnostics diags = new Diagnostics();
    ContextAnalysis res = analyze(
        "class Settings extends InheritedWidget {}\n" +
        "class App extends StatelessWidget {\n" +
        "  build(context) => Settings(child: Page());\n" +
        "}\n" +
        "class Page extends StatefulWidget {\n" +
        "  createState() => PageState();\n" +
        "}\n" +
        "class PageState extends State<Page> {\n" +
        "  build(context) => Text(Settings.of(context).name);\n" +
        "}\n" +
        "main() { runApp(App()); }\n", diags);
    assertEquals(1, res.getConsumers().size());
    assertTrue(res.getConsumers().get(0).isResolved());
    assertTrue(res.getUnresolvedAccesses().isEmpty());
  }
}
