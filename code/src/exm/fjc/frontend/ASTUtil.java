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
import java.util.List;

import exm.fjc.ast.ASTType;
import exm.fjc.ast.WidgetAST;

/**
 * Syntactic queries on the AST shared by the analyzers.  Matching is by
 * name only: no type resolution is done.
 */
public class ASTUtil {

  /**
   * Drop a namespace prefix: material.Text -&gt; Text
   */
  public static String bareName(String name) {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? name : name.substring(dot + 1);
  }

  /**
   * @param classDecl CLASS_DECL node
   * @return bare superclass name without type arguments, or null
   */
  public static String superclassName(WidgetAST classDecl) {
    WidgetAST sup = classDecl.child(1);
    if (sup.childCount() == 0) {
      return null;
    }
    return bareName(sup.child(0).getText());
  }

  /** Members of a CLASS_DECL, errors excluded */
  public static List<WidgetAST> members(WidgetAST classDecl) {
    List<WidgetAST> res = new ArrayList<WidgetAST>();
    for (WidgetAST m: classDecl.child(5).children()) {
      if (m.getType() != ASTType.ERROR) {
        res.add(m);
      }
    }
    return res;
  }

  public static List<WidgetAST> methods(WidgetAST classDecl) {
    List<WidgetAST> res = new ArrayList<WidgetAST>();
    for (WidgetAST m: members(classDecl)) {
      if (m.getType() == ASTType.METHOD_DECL) {
        res.add(m);
      }
    }
    return res;
  }

  /**
   * @return METHOD_DECL with given name, or null
   */
  public static WidgetAST findMethod(WidgetAST classDecl, String name) {
    for (WidgetAST m: methods(classDecl)) {
      if (m.getText().equals(name)) {
        return m;
      }
    }
    return null;
  }

  /**
   * build, or buildSomething
   */
  public static boolean isBuildMethod(String name) {
    return name.equals("build") ||
        (name.startsWith("build") && name.length() > 5 &&
         Character.isUpperCase(name.charAt(5)));
  }

  /** Body slot of METHOD_DECL or FUNCTION_DECL */
  public static WidgetAST functionBody(WidgetAST fn) {
    return fn.child(4);
  }

  /**
   * @return name of the class constructed if e is a constructor call,
   *    with or without new, otherwise null
   */
  public static String constructedClass(WidgetAST e) {
    if (e.getType() == ASTType.NEW) {
      return bareName(e.child(0).getText());
    } else if (e.getType() == ASTType.METHOD_CALL && e.child(0).isNone() &&
               isClassName(e.getText())) {
      return e.getText();
    }
    return null;
  }

  /** Capitalized, so by convention a class */
  public static boolean isClassName(String name) {
    int i = 0;
    while (i < name.length() && (name.charAt(i) == '_' ||
                                 name.charAt(i) == '$')) {
      i++;
    }
    return i < name.length() && Character.isUpperCase(name.charAt(i));
  }

  /**
   * Expressions that a function body may return: the expression of an
   * expression body, or the values of return statements.
   */
  public static List<WidgetAST> returnedExprs(WidgetAST body) {
    List<WidgetAST> res = new ArrayList<WidgetAST>();
    if (body.getType() == ASTType.EXPR_BODY) {
      res.add(body.child(0));
    } else if (body.getType() == ASTType.BLOCK) {
      for (WidgetAST ret: body.findAll(ASTType.RETURN)) {
        if (!ret.child(0).isNone() && !insideFunctionExpr(body, ret)) {
          res.add(ret.child(0));
        }
      }
    }
    return res;
  }

  /**
   * @return true if target is nested inside a function expression under
   *         root
   */
  public static boolean insideFunctionExpr(WidgetAST root, WidgetAST target) {
    for (WidgetAST fn: root.findAll(ASTType.FUNCTION_EXPR)) {
      if (fn != root && contains(fn, target)) {
        return true;
      }
    }
    return false;
  }

  public static boolean contains(WidgetAST root, WidgetAST target) {
    if (root == target) {
      return true;
    }
    for (WidgetAST c: root.children()) {
      if (contains(c, target)) {
        return true;
      }
    }
    return false;
  }
}
