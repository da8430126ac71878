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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.diag.Severity;
import exm.fjc.frontend.SSRAnalysis.Compatibility;
import exm.fjc.frontend.tree.UnsafePattern;
import exm.fjc.frontend.tree.WidgetInfo;

/**
 * Check that build methods can run without a browser: look for references
 * to browser-only globals.  Only build-like methods are scanned, since the
 * server only runs those.
 */
public class SSRAnalyzer {
  private static final Logger logger = Logging.getFJCLogger();

  public static final Set<String> BROWSER_GLOBALS = ImmutableSet.of(
      "window", "document", "localStorage", "sessionStorage", "navigator",
      "location", "history", "alert", "confirm", "prompt", "setTimeout",
      "setInterval", "requestAnimationFrame", "fetch", "XMLHttpRequest",
      "indexedDB");

  /** Identifiers that, in a condition, mark a platform check */
  public static final Set<String> PLATFORM_CHECKS =
                                  ImmutableSet.of("kIsWeb", "isBrowser");

  public static final int MEDIUM_SCORE = 60;
  public static final int UNGUARDED_PENALTY = 10;

  private final Diagnostics diagnostics;

  public SSRAnalyzer(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  public SSRAnalysis analyze(List<WidgetInfo> classes) {
    List<UnsafePattern> patterns = new ArrayList<UnsafePattern>();
    for (WidgetInfo w: classes) {
      for (WidgetAST m: ASTUtil.methods(w.getDeclaration())) {
        if (ASTUtil.isBuildMethod(m.getText())) {
          WidgetAST body = ASTUtil.functionBody(m);
          Set<String> locals = new HashSet<String>();
          paramNames(m.child(2), locals);
          localNames(body, locals);
          scan(w.getName(), m.getText(), body, false, locals, patterns);
        }
      }
    }

    int unguarded = 0;
    for (UnsafePattern p: patterns) {
      if (!p.isGuarded()) {
        unguarded++;
      }
      diagnostics.report(DiagnosticKind.ANALYSIS_WARNING,
          p.isGuarded() ? Severity.INFO : Severity.WARNING,
          "Browser global '" + p.getGlobal() + "' used in " +
          p.getClassName() + "." + p.getMethodName() +
          (p.isGuarded() ? " under a platform check" :
                           " is not available during server rendering"),
          p.getLocation());
    }

    Compatibility compat;
    int score;
    if (patterns.isEmpty()) {
      compat = Compatibility.HIGH;
      score = 100;
    } else if (unguarded == 0) {
      compat = Compatibility.MEDIUM;
      score = MEDIUM_SCORE;
    } else {
      compat = Compatibility.LOW;
      score = Math.max(0, 100 - UNGUARDED_PENALTY * unguarded);
    }
    logger.debug("SSR analysis: " + patterns.size() + " patterns, " +
                 unguarded + " unguarded, compatibility " + compat.label());
    return new SSRAnalysis(compat, score, patterns,
                           recommendations(patterns));
  }

  private static void paramNames(WidgetAST params, Set<String> out) {
    for (WidgetAST p: params.children()) {
      out.add(p.getText());
    }
  }

  /**
   * Names declared anywhere in a method body, including parameters of
   * nested function expressions.  These shadow browser globals.
   */
  private static void localNames(WidgetAST e, Set<String> out) {
    if (e.getType() == ASTType.VAR_DECL_STMT) {
      for (WidgetAST v: e.children()) {
        if (v.getType() == ASTType.VARIABLE) {
          out.add(v.getText());
        }
      }
    } else if (e.getType() == ASTType.FUNCTION_EXPR) {
      paramNames(e.child(0), out);
    }
    for (WidgetAST c: e.children()) {
      localNames(c, out);
    }
  }

  /**
   * @param guarded true if under a platform check
   * @param locals names declared in the method, which are not globals
   */
  private void scan(String cls, String method, WidgetAST e, boolean guarded,
                    Set<String> locals, List<UnsafePattern> out) {
    switch (e.getType()) {
      case IDENTIFIER:
        if (BROWSER_GLOBALS.contains(e.getText()) &&
            !locals.contains(e.getText())) {
          out.add(new UnsafePattern(e.getText(), cls, method,
                                    e.getLocation(), guarded));
        }
        return;
      case METHOD_CALL:
        // alert(...), fetch(...)
        if (e.child(0).isNone() && BROWSER_GLOBALS.contains(e.getText()) &&
            !locals.contains(e.getText())) {
          out.add(new UnsafePattern(e.getText(), cls, method,
                                    e.getLocation(), guarded));
        }
        break;
      case IF:
      case CONDITIONAL: {
        WidgetAST cond = e.child(0);
        boolean check = isPlatformCheck(cond);
        scan(cls, method, cond, guarded || check, locals, out);
        scan(cls, method, e.child(1), guarded || check, locals, out);
        if (!e.child(2).isNone()) {
          // a negated check guards the else branch, but any check means
          // the author thought about the platform
          scan(cls, method, e.child(2), guarded || check, locals, out);
        }
        return;
      }
      case BINARY:
        if (e.getText().equals("&&") && isPlatformCheck(e.child(0))) {
          scan(cls, method, e.child(0), true, locals, out);
          scan(cls, method, e.child(1), true, locals, out);
          return;
        }
        break;
      default:
        break;
    }
    for (WidgetAST c: e.children()) {
      scan(cls, method, c, guarded, locals, out);
    }
  }

  /**
   * kIsWeb, or a comparison of a browser global with null
   */
  static boolean isPlatformCheck(WidgetAST cond) {
    switch (cond.getType()) {
      case IDENTIFIER:
        return PLATFORM_CHECKS.contains(cond.getText());
      case UNARY:
        return cond.getText().equals("!") && cond.hasFlag(ASTFlag.PREFIX) &&
               isPlatformCheck(cond.child(0));
      case BINARY: {
        String op = cond.getText();
        if (op.equals("&&") || op.equals("||")) {
          return isPlatformCheck(cond.child(0)) ||
                 isPlatformCheck(cond.child(1));
        }
        if (op.equals("==") || op.equals("!=")) {
          return (isGlobal(cond.child(0)) &&
                  cond.child(1).getType() == ASTType.NULL_LITERAL) ||
                 (isGlobal(cond.child(1)) &&
                  cond.child(0).getType() == ASTType.NULL_LITERAL);
        }
        return false;
      }
      default:
        return false;
    }
  }

  private static boolean isGlobal(WidgetAST e) {
    return e.getType() == ASTType.IDENTIFIER &&
           BROWSER_GLOBALS.contains(e.getText());
  }

  private static List<String> recommendations(List<UnsafePattern> patterns) {
    Set<String> recs = new LinkedHashSet<String>();
    boolean anyGuarded = false;
    for (UnsafePattern p: patterns) {
      if (p.isGuarded()) {
        anyGuarded = true;
      } else {
        recs.add("Guard use of '" + p.getGlobal() + "' in " +
            p.getClassName() + "." + p.getMethodName() +
            " with kIsWeb, or move it to initState or an event handler");
      }
    }
    if (anyGuarded) {
      recs.add("Check that the server render path does not depend on " +
               "guarded browser globals");
    }
    return new ArrayList<String>(recs);
  }
}
