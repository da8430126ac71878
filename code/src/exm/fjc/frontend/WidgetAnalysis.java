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

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.fjc.frontend.tree.FunctionInfo;
import exm.fjc.frontend.tree.ImportInfo;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetTreeNode;

/**
 * Output of {@link WidgetAnalyzer}.
 */
public class WidgetAnalysis {
  private final List<WidgetInfo> widgets;
  private final List<FunctionInfo> functions;
  private final List<ImportInfo> imports;
  private final Set<String> externalDependencies;
  private final String entryPoint;
  private final String rootWidget;
  private final List<WidgetTreeNode> widgetTree;

  public WidgetAnalysis(List<WidgetInfo> widgets, List<FunctionInfo> functions,
      List<ImportInfo> imports, Set<String> externalDependencies,
      String entryPoint, String rootWidget, List<WidgetTreeNode> widgetTree) {
    this.widgets = ImmutableList.copyOf(widgets);
    this.functions = ImmutableList.copyOf(functions);
    this.imports = ImmutableList.copyOf(imports);
    this.externalDependencies = ImmutableSet.copyOf(externalDependencies);
    this.entryPoint = entryPoint;
    this.rootWidget = rootWidget;
    this.widgetTree = ImmutableList.copyOf(widgetTree);
  }

  /** Every declared class, in source order */
  public List<WidgetInfo> getWidgets() {
    return widgets;
  }

  public WidgetInfo lookupWidget(String name) {
    for (WidgetInfo w: widgets) {
      if (w.getName().equals(name)) {
        return w;
      }
    }
    return null;
  }

  public List<FunctionInfo> getFunctions() {
    return functions;
  }

  public List<ImportInfo> getImports() {
    return imports;
  }

  /** Distinct package specifiers, in order of first import */
  public Set<String> getExternalDependencies() {
    return externalDependencies;
  }

  /** @return entry function name, or null if absent */
  public String getEntryPoint() {
    return entryPoint;
  }

  /** @return class passed to the bootstrap call, or null */
  public String getRootWidget() {
    return rootWidget;
  }

  /**
   * One tree per class with build methods, children being the
   * constructor calls in those methods.
   */
  public List<WidgetTreeNode> getWidgetTree() {
    return widgetTree;
  }
}
