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
package exm.fjc.jsbackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;

import exm.fjc.common.exceptions.CodeGenException;
import exm.fjc.ic.tree.ConstructorInit;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ParameterDecl;
import exm.fjc.ic.tree.ParameterDecl.ParamOrigin;
import exm.fjc.jsbackend.tree.Sequence;

/**
 * Parameter lists.  Named parameters collapse into one destructured
 * object parameter defaulting to {}, matching the trailing object that
 * call sites pass.
 */
class ParameterCodeGen {
  private final GenContext ctx;

  ParameterCodeGen(GenContext ctx) {
    this.ctx = ctx;
  }

  /**
   * @return parameter list text without parentheses
   */
  String declaration(List<ParameterDecl> params) throws CodeGenException {
    List<String> positional = new ArrayList<String>();
    List<String> named = new ArrayList<String>();
    for (ParameterDecl p: params) {
      ExprIR def = p.getDefaultValue();
      switch (p.getParamKind()) {
        case REQUIRED_POSITIONAL:
          positional.add(p.getName());
          break;
        case OPTIONAL_POSITIONAL:
          positional.add(p.getName() + " = " +
              (def == null ? "null" : ctx.exprs.gen(def)));
          break;
        case NAMED:
          named.add(def == null ? p.getName() :
                    p.getName() + " = " + ctx.exprs.gen(def));
          break;
        default:
          throw ctx.error(p, "Unexpected parameter kind " + p.getParamKind(),
                          null);
      }
    }
    if (!named.isEmpty()) {
      positional.add("{ " + StringUtils.join(named, ", ") + " } = {}");
    }
    return StringUtils.join(positional, ", ");
  }

  /**
   * Assignments for this.x parameters
   */
  Sequence fieldAssignments(List<ParameterDecl> params, String receiver) {
    Sequence seq = new Sequence();
    for (ParameterDecl p: params) {
      if (p.getOrigin() == ParamOrigin.FIELD) {
        seq.add(receiver + "." + p.getName() + " = " + p.getName() + ";");
      }
    }
    return seq;
  }

  static boolean hasSuperParams(List<ParameterDecl> params) {
    for (ParameterDecl p: params) {
      if (p.getOrigin() == ParamOrigin.SUPER) {
        return true;
      }
    }
    return false;
  }

  /**
   * Arguments of the superclass constructor call: super.x parameters
   * first, then the explicit super(...) arguments.
   *
   * @param superInit explicit super initializer, or null
   */
  String superArgs(List<ParameterDecl> params, ConstructorInit superInit)
      throws CodeGenException {
    List<String> positional = new ArrayList<String>();
    SortedMap<String, String> named = new TreeMap<String, String>();
    for (ParameterDecl p: params) {
      if (p.getOrigin() != ParamOrigin.SUPER) {
        continue;
      }
      if (p.isNamed()) {
        named.put(p.getName(), p.getName());
      } else {
        positional.add(p.getName());
      }
    }
    if (superInit != null) {
      for (ExprIR arg: superInit.getArgs().getPositional()) {
        positional.add(ctx.exprs.gen(arg));
      }
      for (Map.Entry<String, ExprIR> e:
                    superInit.getArgs().getNamed().entrySet()) {
        named.put(e.getKey(), ctx.exprs.gen(e.getValue()));
      }
    }
    if (!named.isEmpty()) {
      List<String> entries = new ArrayList<String>();
      for (Map.Entry<String, String> e: named.entrySet()) {
        entries.add(e.getKey().equals(e.getValue()) ? e.getKey() :
                    e.getKey() + ": " + e.getValue());
      }
      positional.add("{ " + StringUtils.join(entries, ", ") + " }");
    }
    return StringUtils.join(positional, ", ");
  }
}
