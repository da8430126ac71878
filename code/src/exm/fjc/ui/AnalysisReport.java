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

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.WidgetAST;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.frontend.ContextAnalysis;
import exm.fjc.frontend.SSRAnalysis;
import exm.fjc.frontend.StateAnalysis;
import exm.fjc.frontend.WidgetAnalysis;
import exm.fjc.frontend.tree.FunctionInfo;
import exm.fjc.frontend.tree.ImportInfo;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetTreeNode;
import exm.fjc.ic.tree.Declaration;

/**
 * Everything the analysis stages found in one unit.  Always complete:
 * problems are recorded as diagnostics rather than thrown.
 */
public class AnalysisReport {
  private final WidgetAST ast;
  private final List<Diagnostic> diagnostics;
  private final WidgetAnalysis widgets;
  private final StateAnalysis state;
  private final ContextAnalysis context;
  private final SSRAnalysis ssr;
  private final List<Declaration> declarations;

  public AnalysisReport(WidgetAST ast, List<Diagnostic> diagnostics,
      WidgetAnalysis widgets, StateAnalysis state, ContextAnalysis context,
      SSRAnalysis ssr, List<Declaration> declarations) {
    this.ast = ast;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.widgets = widgets;
    this.state = state;
    this.context = context;
    this.ssr = ssr;
    this.declarations = ImmutableList.copyOf(declarations);
  }

  public WidgetAST getAST() {
    return ast;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  /** Every declared class, widgets or not */
  public List<WidgetInfo> getWidgets() {
    return widgets.getWidgets();
  }

  public List<FunctionInfo> getFunctions() {
    return widgets.getFunctions();
  }

  public List<ImportInfo> getImports() {
    return widgets.getImports();
  }

  public Set<String> getExternalDependencies() {
    return widgets.getExternalDependencies();
  }

  public String getEntryPoint() {
    return widgets.getEntryPoint();
  }

  public String getRootWidget() {
    return widgets.getRootWidget();
  }

  public List<WidgetTreeNode> getWidgetTree() {
    return widgets.getWidgetTree();
  }

  public StateAnalysis getStateAnalysis() {
    return state;
  }

  public ContextAnalysis getContextAnalysis() {
    return context;
  }

  public SSRAnalysis getSSRAnalysis() {
    return ssr;
  }

  /** Lowered declarations, ready for code generation */
  public List<Declaration> getDeclarations() {
    return declarations;
  }

  public boolean hasErrors() {
    for (Diagnostic d: diagnostics) {
      if (d.isError()) {
        return true;
      }
    }
    return false;
  }

  public boolean hasParseErrors() {
    for (Diagnostic d: diagnostics) {
      if (d.getKind() == DiagnosticKind.LEX_ERROR ||
          d.getKind() == DiagnosticKind.PARSE_ERROR) {
        return true;
      }
    }
    return false;
  }
}
