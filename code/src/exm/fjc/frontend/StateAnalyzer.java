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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.fjc.ast.ASTType;
import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostic;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.tree.StateLink;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetKind;

/**
 * Link each stateful widget to the state class its createState returns,
 * and count state mutation calls per state class.  Every stateful widget
 * ends up with exactly one link or exactly one error.
 */
public class StateAnalyzer {
  private static final Logger logger = Logging.getFJCLogger();

  public static final String CREATE_STATE = "createState";

  private final AnalysisOptions options;
  private final Diagnostics diagnostics;

  public StateAnalyzer(AnalysisOptions options, Diagnostics diagnostics) {
    this.options = options;
    this.diagnostics = diagnostics;
  }

  /**
   * @param widgets classes from the widget analyzer
   * @param unit compilation unit, for mutation calls in top-level functions
   */
  public StateAnalysis link(List<WidgetInfo> widgets, WidgetAST unit) {
    Map<String, WidgetInfo> byName = new HashMap<String, WidgetInfo>();
    for (WidgetInfo w: widgets) {
      byName.put(w.getName(), w);
    }

    List<StateLink> links = new ArrayList<StateLink>();
    Map<String, String> owners = new TreeMap<String, String>();
    List<Diagnostic> errors = new ArrayList<Diagnostic>();
    for (WidgetInfo w: widgets) {
      if (w.getKind() != WidgetKind.STATEFUL) {
        continue;
      }
      StateLink link = linkWidget(w, byName, errors);
      if (link != null) {
        links.add(link);
        String prev = owners.put(link.getStateClass(), w.getName());
        if (prev != null) {
          diagnostics.report(DiagnosticKind.ANALYSIS_WARNING, "State class " +
              link.getStateClass() + " is created by both " + prev + " and " +
              w.getName(), link.getLocation());
        }
      }
    }

    Map<String, Integer> counts = countMutations(widgets, unit);
    logger.debug("State analysis: " + links.size() + " links, " +
                 errors.size() + " errors, mutation calls " + counts);
    return new StateAnalysis(links, counts, owners, errors);
  }

  private StateLink linkWidget(WidgetInfo w, Map<String, WidgetInfo> byName,
                               List<Diagnostic> errors) {
    WidgetAST method = ASTUtil.findMethod(w.getDeclaration(), CREATE_STATE);
    if (method == null) {
      error(errors, "StatefulWidget " + w.getName() + " has no " +
            CREATE_STATE + " method", w.getLocation());
      return null;
    }

    Set<String> returned = new LinkedHashSet<String>();
    for (WidgetAST e: ASTUtil.returnedExprs(ASTUtil.functionBody(method))) {
      String cls = ASTUtil.constructedClass(e);
      if (cls != null) {
        returned.add(cls);
      }
    }

    if (returned.isEmpty()) {
      error(errors, CREATE_STATE + " of " + w.getName() +
            " does not return a state class instance", method.getLocation());
      return null;
    } else if (returned.size() > 1) {
      error(errors, CREATE_STATE + " of " + w.getName() +
            " returns multiple state classes: " +
            StringUtils.join(returned, ", "), method.getLocation());
      return null;
    }

    String stateClass = returned.iterator().next();
    WidgetInfo state = byName.get(stateClass);
    if (state == null) {
      diagnostics.report(DiagnosticKind.ANALYSIS_WARNING, "State class " +
          stateClass + " of " + w.getName() + " is not declared in this unit",
          method.getLocation());
    } else if (state.getKind() != WidgetKind.STATE) {
      diagnostics.report(DiagnosticKind.ANALYSIS_WARNING, "Class " +
          stateClass + " returned by " + CREATE_STATE + " of " + w.getName() +
          " does not extend State", method.getLocation());
    }
    logger.trace("Linked " + w.getName() + " to " + stateClass);
    return new StateLink(w.getName(), stateClass, state != null,
                         method.getLocation());
  }

  private void error(List<Diagnostic> errors, String msg,
                     SourceLocation loc) {
    Diagnostic d = new Diagnostic(DiagnosticKind.ANALYSIS_ERROR, msg, loc);
    errors.add(d);
    diagnostics.report(d);
  }

  /**
   * Count calls in state classes; calls anywhere else get a warning.
   */
  private Map<String, Integer> countMutations(List<WidgetInfo> widgets,
                                              WidgetAST unit) {
    Map<String, Integer> counts = new TreeMap<String, Integer>();
    for (WidgetInfo w: widgets) {
      List<WidgetAST> calls = mutationCalls(w.getDeclaration());
      if (w.getKind() == WidgetKind.STATE) {
        counts.put(w.getName(), calls.size());
      } else {
        warnOutside(calls, "class " + w.getName());
      }
    }
    for (WidgetAST decl: unit.children()) {
      if (decl.getType() == ASTType.FUNCTION_DECL) {
        warnOutside(mutationCalls(decl), "function " + decl.getText());
      }
    }
    return counts;
  }

  private void warnOutside(List<WidgetAST> calls, String where) {
    for (WidgetAST call: calls) {
      diagnostics.report(DiagnosticKind.ANALYSIS_WARNING,
          options.getStateMutationCall() + "() called outside a State " +
          "class, in " + where, call.getLocation());
    }
  }

  /** Unqualified or this-qualified mutation calls */
  private List<WidgetAST> mutationCalls(WidgetAST root) {
    List<WidgetAST> res = new ArrayList<WidgetAST>();
    for (WidgetAST call: root.findAll(ASTType.METHOD_CALL)) {
      if (call.getText().equals(options.getStateMutationCall()) &&
          (call.child(0).isNone() ||
           call.child(0).getType() == ASTType.THIS)) {
        res.add(call);
      }
    }
    return res;
  }
}
