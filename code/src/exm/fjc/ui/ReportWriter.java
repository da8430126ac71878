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
package exm.fjc.ui;

import java.util.Collection;
import java.util.Map;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.frontend.ContextAnalysis;
import exm.fjc.frontend.SSRAnalysis;
import exm.fjc.frontend.StateAnalysis;
import exm.fjc.frontend.imports.FallbackStep;
import exm.fjc.frontend.imports.ResolutionResult;
import exm.fjc.frontend.tree.ConsumerInfo;
import exm.fjc.frontend.tree.FunctionInfo;
import exm.fjc.frontend.tree.ImportInfo;
import exm.fjc.frontend.tree.ProviderInfo;
import exm.fjc.frontend.tree.StateLink;
import exm.fjc.frontend.tree.UnsafePattern;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetTreeNode;

/**
 * Renders an analysis report as JSON for --analyze-only
 */
public class ReportWriter {

  public static String toJson(AnalysisReport report) {
    JsonObject root = new JsonObject();
    root.add("diagnostics", diagnostics(report.getDiagnostics()));

    JsonArray widgets = new JsonArray();
    for (WidgetInfo w: report.getWidgets()) {
      JsonObject o = new JsonObject();
      o.addProperty("name", w.getName());
      o.addProperty("kind", w.getKind().label());
      o.addProperty("superclass", w.getSuperclass());
      o.add("methods", strings(w.getMethods()));
      o.add("properties", strings(w.getProperties()));
      o.add("location", location(w.getLocation()));
      widgets.add(o);
    }
    root.add("widgets", widgets);

    JsonArray functions = new JsonArray();
    for (FunctionInfo f: report.getFunctions()) {
      JsonObject o = new JsonObject();
      o.addProperty("name", f.getName());
      o.add("params", strings(f.getParams()));
      o.addProperty("async", f.isAsync());
      functions.add(o);
    }
    root.add("functions", functions);

    JsonArray imports = new JsonArray();
    for (ImportInfo i: report.getImports()) {
      JsonObject o = new JsonObject();
      o.addProperty("source", i.getSource());
      o.add("items", strings(i.getItems()));
      o.addProperty("alias", i.getAlias());
      o.add("resolution", resolution(i.getResolution()));
      imports.add(o);
    }
    root.add("imports", imports);
    root.add("externalDependencies",
             strings(report.getExternalDependencies()));
    root.addProperty("entryPoint", report.getEntryPoint());
    root.addProperty("rootWidget", report.getRootWidget());

    JsonArray tree = new JsonArray();
    for (WidgetTreeNode n: report.getWidgetTree()) {
      tree.add(treeNode(n));
    }
    root.add("widgetTree", tree);
    root.add("state", state(report.getStateAnalysis()));
    root.add("context", context(report.getContextAnalysis()));
    root.add("ssr", ssr(report.getSSRAnalysis()));

    return new GsonBuilder().setPrettyPrinting().serializeNulls()
                            .disableHtmlEscaping().create().toJson(root);
  }

  private static JsonArray strings(Collection<String> values) {
    JsonArray a = new JsonArray();
    for (String s: values) {
      a.add(s);
    }
    return a;
  }

  private static JsonObject location(SourceLocation loc) {
    JsonObject o = new JsonObject();
    o.addProperty("file", loc.getFile());
    o.addProperty("line", loc.getLine());
    o.addProperty("column", loc.getColumn());
    return o;
  }

  static JsonArray diagnostics(Collection<Diagnostic> diags) {
    JsonArray a = new JsonArray();
    for (Diagnostic d: diags) {
      JsonObject o = new JsonObject();
      o.addProperty("kind", d.getKind().name());
      o.addProperty("severity", d.getSeverity().name());
      o.addProperty("message", d.getMessage());
      o.add("sourceLocation", location(d.getLocation()));
      a.add(o);
    }
    return a;
  }

  private static JsonObject resolution(ResolutionResult r) {
    JsonObject o = new JsonObject();
    if (r == null) {
      return o;
    }
    o.addProperty("isValid", r.isValid());
    o.addProperty("resolved", r.getResolved());
    o.addProperty("actualPath", r.getActualPath());
    o.addProperty("type", r.getType().label());
    o.addProperty("reason", r.getReason());
    JsonArray fallbacks = new JsonArray();
    for (FallbackStep step: r.getFallbacks()) {
      JsonObject s = new JsonObject();
      s.addProperty("step", step.getStep());
      s.addProperty("strategyTried", step.getStrategyTried());
      s.addProperty("found", step.isFound());
      s.addProperty("reason", step.getReason());
      fallbacks.add(s);
    }
    o.add("fallbacks", fallbacks);
    return o;
  }

  private static JsonObject treeNode(WidgetTreeNode n) {
    JsonObject o = new JsonObject();
    o.addProperty("name", n.getName());
    JsonArray children = new JsonArray();
    for (WidgetTreeNode c: n.getChildren()) {
      children.add(treeNode(c));
    }
    o.add("children", children);
    return o;
  }

  private static JsonObject state(StateAnalysis s) {
    JsonObject o = new JsonObject();
    JsonArray links = new JsonArray();
    for (StateLink l: s.getStateLinks()) {
      JsonObject lo = new JsonObject();
      lo.addProperty("widget", l.getWidget());
      lo.addProperty("stateClass", l.getStateClass());
      lo.addProperty("stateDeclared", l.isStateDeclared());
      links.add(lo);
    }
    o.add("stateLinks", links);
    JsonObject counts = new JsonObject();
    for (Map.Entry<String, Integer> e: s.getSetStateCallCount().entrySet()) {
      counts.addProperty(e.getKey(), e.getValue());
    }
    o.add("setStateCalls", counts);
    o.add("errors", diagnostics(s.getErrors()));
    return o;
  }

  private static JsonObject context(ContextAnalysis c) {
    JsonObject o = new JsonObject();
    JsonArray providers = new JsonArray();
    for (ProviderInfo p: c.getProviders()) {
      JsonObject po = new JsonObject();
      po.addProperty("name", p.getName());
      po.addProperty("kind", p.getKind().name());
      providers.add(po);
    }
    o.add("providers", providers);
    JsonArray consumers = new JsonArray();
    for (ConsumerInfo ci: c.getConsumers()) {
      JsonObject co = new JsonObject();
      co.addProperty("provider", ci.getProviderName());
      co.addProperty("enclosingClass", ci.getEnclosingClass());
      co.addProperty("enclosingMethod", ci.getEnclosingMethod());
      co.addProperty("resolved", ci.isResolved());
      consumers.add(co);
    }
    o.add("consumers", consumers);
    return o;
  }

  private static JsonObject ssr(SSRAnalysis s) {
    JsonObject o = new JsonObject();
    o.addProperty("compatibility", s.getCompatibility().label());
    o.addProperty("score", s.getScore());
    JsonArray patterns = new JsonArray();
    for (UnsafePattern p: s.getUnsafePatterns()) {
      JsonObject po = new JsonObject();
      po.addProperty("global", p.getGlobal());
      po.addProperty("className", p.getClassName());
      po.addProperty("methodName", p.getMethodName());
      po.addProperty("guarded", p.isGuarded());
      po.add("location", location(p.getLocation()));
      patterns.add(po);
    }
    o.add("unsafePatterns", patterns);
    o.add("recommendations", strings(s.getRecommendations()));
    return o;
  }
}
