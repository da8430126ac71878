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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.FJCRuntimeError;
import exm.fjc.ic.tree.ArgList;
import exm.fjc.ic.tree.AssignOp;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ExprIR.Assignment;
import exm.fjc.ic.tree.ExprIR.Await;
import exm.fjc.ic.tree.ExprIR.Binary;
import exm.fjc.ic.tree.ExprIR.Cascade;
import exm.fjc.ic.tree.ExprIR.Cast;
import exm.fjc.ic.tree.ExprIR.Conditional;
import exm.fjc.ic.tree.ExprIR.FunctionExpr;
import exm.fjc.ic.tree.ExprIR.Identifier;
import exm.fjc.ic.tree.ExprIR.IndexAccess;
import exm.fjc.ic.tree.ExprIR.InstanceCreation;
import exm.fjc.ic.tree.ExprIR.InterpolatedString;
import exm.fjc.ic.tree.ExprIR.Invocation;
import exm.fjc.ic.tree.ExprIR.ListLiteral;
import exm.fjc.ic.tree.ExprIR.Literal;
import exm.fjc.ic.tree.ExprIR.MapEntryIR;
import exm.fjc.ic.tree.ExprIR.MapLiteral;
import exm.fjc.ic.tree.ExprIR.MethodCall;
import exm.fjc.ic.tree.ExprIR.PropertyAccess;
import exm.fjc.ic.tree.ExprIR.StringPart;
import exm.fjc.ic.tree.ExprIR.Throw;
import exm.fjc.ic.tree.ExprIR.TypeCheck;
import exm.fjc.ic.tree.ExprIR.Unary;
import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.FunctionBody;
import exm.fjc.ic.tree.LiteralKind;
import exm.fjc.ic.tree.LiteralValue;
import exm.fjc.ic.tree.ParameterDecl;
import exm.fjc.ic.tree.TypeIR;

/**
 * Builds expression IR from the AST.  Bare names are resolved against
 * the local scope first, then the members of the enclosing class.
 */
public class ExprWalker {

  private static final Set<String> COMPARISON_OPS = ImmutableSet.of(
      "==", "!=", "<", ">", "<=", ">=", "&&", "||");

  private static final Set<String> INT_OPS = ImmutableSet.of(
      "~/", "&", "|", "^", "<<", ">>", ">>>");

  private static final Set<String> ARITH_OPS = ImmutableSet.of(
      "+", "-", "*", "%");

  private final ASTWalker walker;
  private final Diagnostics diagnostics;

  public ExprWalker(ASTWalker walker, Diagnostics diagnostics) {
    this.walker = walker;
    this.diagnostics = diagnostics;
  }

  public ExprIR walk(WidgetAST e, Scope scope) {
    SourceLocation loc = e.getLocation();
    switch (e.getType()) {
      case INT_LITERAL:
        return intLiteral(e);
      case DOUBLE_LITERAL:
        return new Literal(walker.nextId(), loc,
            LiteralValue.createDouble(Double.parseDouble(e.getText())));
      case STRING_LITERAL:
        return new Literal(walker.nextId(), loc,
                           LiteralValue.createString(e.getText()));
      case BOOL_LITERAL:
        return new Literal(walker.nextId(), loc,
            LiteralValue.createBool(e.getText().equals("true")));
      case NULL_LITERAL:
        return new Literal(walker.nextId(), loc, LiteralValue.NULL);
      case STRING_INTERP:
        return interpolation(e, scope);
      case IDENTIFIER:
        return identifier(e.getText(), loc, scope);
      case THIS:
        return thisRef(loc, scope);
      case SUPER:
        return new Identifier(walker.nextId(), loc, TypeIR.DYNAMIC, "super",
                              false, true, false);
      case BINARY:
        return binary(e, scope);
      case UNARY:
        return unary(e, scope);
      case ASSIGN: {
        ExprIR target = walk(e.child(0), scope);
        ExprIR value = walk(e.child(1), scope);
        return new Assignment(walker.nextId(), loc, target, value,
                              AssignOp.fromSymbol(e.getText()));
      }
      case CONDITIONAL: {
        ExprIR cond = walk(e.child(0), scope);
        ExprIR then = walk(e.child(1), scope);
        ExprIR els = walk(e.child(2), scope);
        TypeIR t = then.getType().equals(els.getType()) ?
                        then.getType() : TypeIR.DYNAMIC;
        return new Conditional(walker.nextId(), loc, t, cond, then, els);
      }
      case METHOD_CALL:
        return methodCall(e, scope);
      case INVOKE:
        return new Invocation(walker.nextId(), loc, walk(e.child(0), scope),
                              args(e.child(2), scope),
                              walker.typeArgs(e.child(1)));
      case PROPERTY:
        return property(e, scope);
      case INDEX: {
        boolean cascade = isReceiver(e.child(0));
        ExprIR target = cascade ? null : walk(e.child(0), scope);
        return new IndexAccess(walker.nextId(), loc, TypeIR.DYNAMIC, target,
                               walk(e.child(1), scope),
                               e.hasFlag(ASTFlag.NULL_AWARE), cascade);
      }
      case NEW: {
        String ctor = e.getText().isEmpty() ? null : e.getText();
        return new InstanceCreation(walker.nextId(), loc,
            walker.type(e.child(0)), ctor, args(e.child(1), scope),
            e.hasFlag(ASTFlag.CONST));
      }
      case LIST_LITERAL:
        return collection(e, LiteralKind.LIST, scope);
      case SET_LITERAL:
        return collection(e, LiteralKind.SET, scope);
      case MAP_LITERAL:
        return map(e, scope);
      case FUNCTION_EXPR:
        return function(e, scope);
      case AWAIT:
        return new Await(walker.nextId(), loc, walk(e.child(0), scope));
      case AS:
        return new Cast(walker.nextId(), loc, walk(e.child(0), scope),
                        walker.type(e.child(1)));
      case IS:
        return new TypeCheck(walker.nextId(), loc, walk(e.child(0), scope),
            walker.type(e.child(1)), e.hasFlag(ASTFlag.NEGATED));
      case CASCADE: {
        ExprIR target = walk(e.child(0), scope);
        List<ExprIR> sections = new ArrayList<ExprIR>();
        for (WidgetAST s: e.children(1)) {
          sections.add(walk(s, scope));
        }
        return new Cascade(walker.nextId(), loc, target, sections,
                           e.hasFlag(ASTFlag.NULL_AWARE));
      }
      case THROW:
        return new Throw(walker.nextId(), loc, walk(e.child(0), scope));
      default:
        throw new FJCRuntimeError("Unexpected " + e.getType() +
                                  " in expression at " + loc);
    }
  }

  private ExprIR intLiteral(WidgetAST e) {
    String text = e.getText();
    long v;
    try {
      if (text.startsWith("0x") || text.startsWith("0X")) {
        v = Long.parseLong(text.substring(2), 16);
      } else {
        v = Long.parseLong(text);
      }
    } catch (NumberFormatException ex) {
      diagnostics.report(DiagnosticKind.ANALYSIS_ERROR,
          "Integer literal out of range: " + text, e.getLocation());
      v = 0;
    }
    return new Literal(walker.nextId(), e.getLocation(),
                       LiteralValue.createInt(v));
  }

  private ExprIR interpolation(WidgetAST e, Scope scope) {
    List<StringPart> parts = new ArrayList<StringPart>();
    for (WidgetAST p: e.children()) {
      if (p.getType() == ASTType.STRING_PART) {
        parts.add(StringPart.text(p.getText()));
      } else {
        parts.add(StringPart.expr(walk(p, scope)));
      }
    }
    return new InterpolatedString(walker.nextId(), e.getLocation(), parts);
  }

  private ExprIR thisRef(SourceLocation loc, Scope scope) {
    MemberContext members = scope.getMembers();
    TypeIR t = members == null ? TypeIR.DYNAMIC :
                              new TypeIR(members.getClassName());
    return new Identifier(walker.nextId(), loc, t, "this", true, false,
                          false);
  }

  private ExprIR classRef(String className, SourceLocation loc) {
    return new Identifier(walker.nextId(), loc, new TypeIR("Type"),
                          className, false, false, true);
  }

  /**
   * Resolve a bare name: local, then instance member (this.x), then
   * static member (C.x), then global.
   */
  private ExprIR identifier(String name, SourceLocation loc, Scope scope) {
    TypeIR local = scope.lookup(name);
    if (local != null) {
      return new Identifier(walker.nextId(), loc, local, name, false, false,
                            false);
    }
    MemberContext members = scope.getMembers();
    if (members != null) {
      if (members.isInstanceMember(name)) {
        return new PropertyAccess(walker.nextId(), loc, TypeIR.DYNAMIC,
            thisRef(loc, scope), name, false, false);
      } else if (members.isStaticMember(name)) {
        return new PropertyAccess(walker.nextId(), loc, TypeIR.DYNAMIC,
            classRef(members.getClassName(), loc), name, false, false);
      }
    }
    boolean typeRef = ASTUtil.isClassName(name);
    return new Identifier(walker.nextId(), loc,
        typeRef ? new TypeIR("Type") : TypeIR.DYNAMIC, name, false, false,
        typeRef);
  }

  private ExprIR binary(WidgetAST e, Scope scope) {
    ExprIR left = walk(e.child(0), scope);
    ExprIR right = walk(e.child(1), scope);
    String op = e.getText();
    return new Binary(walker.nextId(), e.getLocation(),
        binaryType(op, left.getType(), right.getType()), left, op, right);
  }

  static TypeIR binaryType(String op, TypeIR left, TypeIR right) {
    if (COMPARISON_OPS.contains(op)) {
      return TypeIR.BOOL;
    } else if (INT_OPS.contains(op)) {
      return TypeIR.INT;
    } else if (op.equals("??")) {
      return left.isDynamic() ? right : left;
    } else if (op.equals("/")) {
      return TypeIR.DOUBLE;
    } else if (ARITH_OPS.contains(op)) {
      left = left.erased();
      right = right.erased();
      if (op.equals("+") && (left.equals(TypeIR.STRING) ||
                             right.equals(TypeIR.STRING))) {
        return TypeIR.STRING;
      } else if (left.equals(TypeIR.INT) && right.equals(TypeIR.INT)) {
        return TypeIR.INT;
      } else if (isNumeric(left) && isNumeric(right)) {
        return TypeIR.DOUBLE;
      }
    }
    return TypeIR.DYNAMIC;
  }

  private static boolean isNumeric(TypeIR t) {
    return t.equals(TypeIR.INT) || t.equals(TypeIR.DOUBLE) ||
           t.getName().equals("num");
  }

  private ExprIR unary(WidgetAST e, Scope scope) {
    ExprIR operand = walk(e.child(0), scope);
    String op = e.getText();
    boolean prefix = e.hasFlag(ASTFlag.PREFIX);
    TypeIR t;
    if (prefix && op.equals("!")) {
      t = TypeIR.BOOL;
    } else if (op.equals("~")) {
      t = TypeIR.INT;
    } else if (!prefix && op.equals("!")) {
      TypeIR ot = operand.getType();
      t = new TypeIR(ot.getName(), ot.getTypeArgs(), false);
    } else {
      t = operand.getType();
    }
    return new Unary(walker.nextId(), e.getLocation(), t, op, operand,
                     prefix);
  }

  private static boolean isReceiver(WidgetAST e) {
    return e.getType() == ASTType.CASCADE_RECEIVER;
  }

  private ExprIR property(WidgetAST e, Scope scope) {
    SourceLocation loc = e.getLocation();
    boolean nullAware = e.hasFlag(ASTFlag.NULL_AWARE);
    if (isReceiver(e.child(0))) {
      return new PropertyAccess(walker.nextId(), loc, TypeIR.DYNAMIC, null,
                                e.getText(), nullAware, true);
    }
    ExprIR target = walk(e.child(0), scope);
    TypeIR t = e.getText().equals("length") ? TypeIR.INT : TypeIR.DYNAMIC;
    return new PropertyAccess(walker.nextId(), loc, t, target, e.getText(),
                              nullAware, false);
  }

  private ExprIR methodCall(WidgetAST e, Scope scope) {
    SourceLocation loc = e.getLocation();
    String name = e.getText();
    WidgetAST targetAST = e.child(0);
    List<TypeIR> typeArgs = walker.typeArgs(e.child(1));
    ArgList args = args(e.child(2), scope);
    boolean nullAware = e.hasFlag(ASTFlag.NULL_AWARE);
    TypeIR resultType = name.equals("toString") ? TypeIR.STRING :
                                                   TypeIR.DYNAMIC;

    if (targetAST.isNone()) {
      TypeIR local = scope.lookup(name);
      if (local != null) {
        ExprIR callee = new Identifier(walker.nextId(), loc, local, name,
                                       false, false, false);
        return new Invocation(walker.nextId(), loc, callee, args, typeArgs);
      }
      MemberContext members = scope.getMembers();
      if (members != null && members.isInstanceMember(name)) {
        return new MethodCall(walker.nextId(), loc, resultType,
            thisRef(loc, scope), name, args, typeArgs, false, false);
      } else if (members != null && members.isStaticMember(name)) {
        return new MethodCall(walker.nextId(), loc, resultType,
            classRef(members.getClassName(), loc), name, args, typeArgs,
            false, false);
      } else if (ASTUtil.isClassName(name)) {
        // Constructor call without new
        return new InstanceCreation(walker.nextId(), loc,
            new TypeIR(name, typeArgs, false), null, args, false);
      }
      return new MethodCall(walker.nextId(), loc, resultType, null, name,
                            args, typeArgs, false, false);
    } else if (isReceiver(targetAST)) {
      return new MethodCall(walker.nextId(), loc, resultType, null, name,
                            args, typeArgs, nullAware, true);
    } else if (targetAST.getType() == ASTType.IDENTIFIER &&
               walker.isNamedConstructor(targetAST.getText(), name) &&
               scope.lookup(targetAST.getText()) == null) {
      return new InstanceCreation(walker.nextId(), loc,
          new TypeIR(targetAST.getText()), name, args, false);
    }
    ExprIR target = walk(targetAST, scope);
    return new MethodCall(walker.nextId(), loc, resultType, target, name,
                          args, typeArgs, nullAware, false);
  }

  /**
   * Positional arguments in order, named arguments keyed by name.
   * A repeated name is an error; the first occurrence wins.
   */
  public ArgList args(WidgetAST arguments, Scope scope) {
    assert(arguments.getType() == ASTType.ARGUMENTS);
    if (arguments.childCount() == 0) {
      return ArgList.EMPTY;
    }
    List<ExprIR> positional = new ArrayList<ExprIR>();
    TreeMap<String, ExprIR> named = new TreeMap<String, ExprIR>();
    for (WidgetAST a: arguments.children()) {
      if (a.getType() == ASTType.NAMED_ARG) {
        ExprIR value = walk(a.child(0), scope);
        if (named.containsKey(a.getText())) {
          diagnostics.report(DiagnosticKind.ANALYSIS_ERROR,
              "Duplicate named argument '" + a.getText() + "'",
              a.getLocation());
        } else {
          named.put(a.getText(), value);
        }
      } else {
        positional.add(walk(a, scope));
      }
    }
    return new ArgList(positional, named);
  }

  private ExprIR collection(WidgetAST e, LiteralKind kind, Scope scope) {
    List<TypeIR> typeArgs = walker.typeArgs(e.child(0));
    List<ExprIR> elements = new ArrayList<ExprIR>();
    for (WidgetAST el: e.children(1)) {
      elements.add(walk(el, scope));
    }
    TypeIR elementType;
    if (typeArgs.size() == 1) {
      elementType = typeArgs.get(0);
    } else {
      elementType = commonType(elements);
    }
    return new ListLiteral(walker.nextId(), e.getLocation(), kind, elements,
                           elementType, e.hasFlag(ASTFlag.CONST));
  }

  private static TypeIR commonType(List<ExprIR> exprs) {
    TypeIR result = null;
    for (ExprIR x: exprs) {
      if (result == null) {
        result = x.getType();
      } else if (!result.equals(x.getType())) {
        return TypeIR.DYNAMIC;
      }
    }
    return result == null ? TypeIR.DYNAMIC : result;
  }

  private ExprIR map(WidgetAST e, Scope scope) {
    List<TypeIR> typeArgs = walker.typeArgs(e.child(0));
    List<MapEntryIR> entries = new ArrayList<MapEntryIR>();
    List<ExprIR> keys = new ArrayList<ExprIR>();
    List<ExprIR> values = new ArrayList<ExprIR>();
    Set<LiteralValue> seen = new LinkedHashSet<LiteralValue>();
    for (WidgetAST entry: e.children(1)) {
      ExprIR key = walk(entry.child(0), scope);
      ExprIR value = walk(entry.child(1), scope);
      if (key.getKind() == ExprKind.LITERAL) {
        LiteralValue k = ((Literal) key).getValue();
        if (!seen.add(k)) {
          diagnostics.report(DiagnosticKind.ANALYSIS_ERROR,
              "Duplicate key " + k + " in map literal", entry.getLocation());
          continue;
        }
      }
      entries.add(new MapEntryIR(key, value));
      keys.add(key);
      values.add(value);
    }
    TypeIR keyType, valueType;
    if (typeArgs.size() == 2) {
      keyType = typeArgs.get(0);
      valueType = typeArgs.get(1);
    } else {
      keyType = commonType(keys);
      valueType = commonType(values);
    }
    return new MapLiteral(walker.nextId(), e.getLocation(), entries,
                          keyType, valueType, e.hasFlag(ASTFlag.CONST));
  }

  private ExprIR function(WidgetAST e, Scope scope) {
    Scope fnScope = scope.function();
    List<ParameterDecl> params = walker.params(e.child(0), fnScope);
    FunctionBody body = walker.body(e.child(1), fnScope);
    return new FunctionExpr(walker.nextId(), e.getLocation(), params, body,
        e.hasFlag(ASTFlag.ASYNC), e.hasFlag(ASTFlag.GENERATOR),
        ImmutableSet.copyOf(fnScope.getCaptured()));
  }

  /** Convenience for optional expression slots */
  public ExprIR walkOptional(WidgetAST e, Scope scope) {
    return e.isNone() ? null : walk(e, scope);
  }

  public List<ExprIR> walkAll(List<WidgetAST> es, Scope scope) {
    ImmutableList.Builder<ExprIR> result = ImmutableList.builder();
    for (WidgetAST e: es) {
      result.add(walk(e, scope));
    }
    return result.build();
  }
}
