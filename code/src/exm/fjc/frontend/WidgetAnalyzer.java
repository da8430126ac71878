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

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.imports.ImportResolver;
import exm.fjc.frontend.imports.ResolutionResult;
import exm.fjc.frontend.imports.ResolutionType;
import exm.fjc.frontend.tree.FunctionInfo;
import exm.fjc.frontend.tree.ImportInfo;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetKind;
import exm.fjc.frontend.tree.WidgetTreeNode;

/**
 * Classify classes by superclass name, find the entry function and the
 * root widget, and build the static widget composition tree.
 *
 * Classification is by name only, so a base class re-exported under
 * another name is not recognized.
 */
public class WidgetAnalyzer {
  private static final Logger logger = Logging.getFJCLogger();

  private final AnalysisOptions options;
  private final Diagnostics diagnostics;

  public WidgetAnalyzer(AnalysisOptions options, Diagnostics diagnostics) {
    this.options = options;
    this.diagnostics = diagnostics;
  }

  public WidgetAnalysis analyze(WidgetAST unit) {
    assert(unit.getType() == ASTType.COMPILATION_UNIT);
    List<WidgetInfo> widgets = new ArrayList<WidgetInfo>();
    List<FunctionInfo> functions = new ArrayList<FunctionInfo>();
    List<ImportInfo> imports = new ArrayList<ImportInfo>();
    Set<String> classNames = new HashSet<String>();
    WidgetAST entryFn = null;

    for (WidgetAST decl: unit.children()) {
      switch (decl.getType()) {
        case IMPORT:
          imports.add(analyzeImport(decl));
          break;
        case CLASS_DECL:
          if (!classNames.add(decl.getText())) {
            diagnostics.report(DiagnosticKind.ANALYSIS_ERROR,
                "Duplicate declaration of class " + decl.getText(),
                decl.getLocation());
          }
          widgets.add(classify(decl));
          break;
        case FUNCTION_DECL:
          functions.add(functionInfo(decl));
          if (decl.getText().equals(options.getEntryFunction()) &&
              entryFn == null) {
            entryFn = decl;
          }
          break;
        default:
          // Variables and exports are not of interest
          break;
      }
    }

    String entryPoint = null;
    String rootWidget = null;
    if (entryFn != null) {
      entryPoint = entryFn.getText();
      rootWidget = findRootWidget(entryFn);
    } else if (declaresWidgets(widgets)) {
      diagnostics.report(DiagnosticKind.ANALYSIS_ERROR,
          "No entry function '" + options.getEntryFunction() +
          "' found in " + options.getFileName(), unit.getLocation());
    }

    List<WidgetTreeNode> tree = new ArrayList<WidgetTreeNode>();
    for (WidgetInfo w: widgets) {
      if (w.getKind() != WidgetKind.OTHER) {
        WidgetTreeNode node = buildTree(w);
        if (node != null) {
          tree.add(node);
        }
      }
    }

    logger.debug("Widget analysis of " + options.getFileName() + ": " +
                 widgets.size() + " classes, " + functions.size() +
                 " functions, " + imports.size() + " imports, entry " +
                 entryPoint + ", root " + rootWidget);
    return new WidgetAnalysis(widgets, functions, imports,
        externalDependencies(imports), entryPoint, rootWidget, tree);
  }

  private static boolean declaresWidgets(List<WidgetInfo> widgets) {
    for (WidgetInfo w: widgets) {
      if (w.getKind().isWidget()) {
        return true;
      }
    }
    return false;
  }

  private WidgetInfo classify(WidgetAST classDecl) {
    String superclass = ASTUtil.superclassName(classDecl);
    WidgetKind kind = WidgetKind.classify(superclass);
    List<String> methods = new ArrayList<String>();
    List<String> properties = new ArrayList<String>();
    for (WidgetAST m: ASTUtil.members(classDecl)) {
      if (m.getType() == ASTType.METHOD_DECL) {
        methods.add(m.getText());
      } else if (m.getType() == ASTType.FIELD_DECL) {
        for (WidgetAST v: m.children(2)) {
          properties.add(v.getText());
        }
      }
    }
    WidgetInfo info = new WidgetInfo(classDecl.getText(), kind, superclass,
                                     methods, properties, classDecl);
    logger.trace("class " + info + " extends " + superclass);
    return info;
  }

  private static FunctionInfo functionInfo(WidgetAST fn) {
    List<String> params = new ArrayList<String>();
    for (WidgetAST p: fn.child(2).children()) {
      params.add(p.getText());
    }
    return new FunctionInfo(fn.getText(), params,
        fn.hasFlag(ASTFlag.ASYNC), fn.getLocation());
  }

  private ImportInfo analyzeImport(WidgetAST imp) {
    List<String> items = new ArrayList<String>();
    String alias = null;
    for (WidgetAST clause: imp.children()) {
      switch (clause.getType()) {
        case IMPORT_ITEM:
          items.add(clause.childCount() > 0 ? clause.child(0).getText()
                                            : clause.getText());
          break;
        case IMPORT_DEFAULT:
          items.add(clause.getText());
          break;
        case IMPORT_ALIAS:
          alias = clause.getText();
          break;
        default:
          break;
      }
    }
    ImportResolver resolver = options.getImportResolver();
    ResolutionResult res = resolver.resolve(imp.getText(), items);
    if (!res.isValid()) {
      diagnostics.report(DiagnosticKind.ANALYSIS_WARNING,
                         res.getReason(), imp.getLocation());
    }
    return new ImportInfo(imp.getText(), items, alias, imp.getLocation(),
                          res);
  }

  /**
   * Framework and cache packages plus any package-style specifier
   */
  private static Set<String> externalDependencies(List<ImportInfo> imports) {
    Set<String> deps = new LinkedHashSet<String>();
    for (ImportInfo imp: imports) {
      ResolutionType type = imp.getResolution().getType();
      String src = imp.getSource();
      if (type == ResolutionType.FRAMEWORK || type == ResolutionType.CACHE ||
          src.startsWith("package:") || src.startsWith("@")) {
        deps.add(src);
      }
    }
    return deps;
  }

  /**
   * @return class of the first argument to the bootstrap call
   */
  private String findRootWidget(WidgetAST entryFn) {
    for (WidgetAST call: entryFn.findAll(ASTType.METHOD_CALL)) {
      if (call.getText().equals(options.getBootstrapCall()) &&
          call.child(0).isNone()) {
        WidgetAST args = call.child(2);
        if (args.childCount() == 0) {
          continue;
        }
        String root = ASTUtil.constructedClass(args.child(0));
        if (root != null) {
          return root;
        }
        logger.debug("Argument of " + options.getBootstrapCall() +
                     " is not a constructor call");
      }
    }
    diagnostics.report(DiagnosticKind.ANALYSIS_WARNING,
        "Entry function '" + entryFn.getText() + "' does not pass a widget " +
        "to " + options.getBootstrapCall() + "()", entryFn.getLocation());
    return null;
  }

  private WidgetTreeNode buildTree(WidgetInfo w) {
    List<WidgetTreeNode> children = new ArrayList<WidgetTreeNode>();
    boolean hasBuild = false;
    for (WidgetAST m: ASTUtil.methods(w.getDeclaration())) {
      if (ASTUtil.isBuildMethod(m.getText())) {
        hasBuild = true;
        collectConstructorCalls(ASTUtil.functionBody(m), children);
      }
    }
    if (!hasBuild) {
      return null;
    }
    return new WidgetTreeNode(w.getName(), w.getLocation(), children);
  }

  /**
   * Constructor calls nest by appearing in each other's arguments
   */
  static void collectConstructorCalls(WidgetAST e,
                                      List<WidgetTreeNode> out) {
    String cls = ASTUtil.constructedClass(e);
    if (cls != null) {
      List<WidgetTreeNode> children = new ArrayList<WidgetTreeNode>();
      WidgetAST args = e.getType() == ASTType.NEW ? e.child(1) : e.child(2);
      collectConstructorCalls(args, children);
      out.add(new WidgetTreeNode(cls, e.getLocation(), children));
      return;
    }
    for (WidgetAST c: e.children()) {
      collectConstructorCalls(c, out);
    }
  }
}
