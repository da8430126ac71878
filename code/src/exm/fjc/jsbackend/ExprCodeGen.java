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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.exceptions.CodeGenException;
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
import exm.fjc.ic.tree.ExprVisitor;
import exm.fjc.ic.tree.LiteralKind;
import exm.fjc.ic.tree.LiteralValue;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.jsbackend.GenConfig.AccessorPolicy;

/**
 * Lowers expressions to JavaScript expression text.  Multi-line results
 * (function bodies) carry their own relative indentation.
 */
class ExprCodeGen implements ExprVisitor<String, CodeGenException> {

  private static final Pattern JS_IDENTIFIER =
      Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

  /** Kinds that extend a chain of member accesses, calls and indexing */
  private static final Set<ExprKind> CHAIN_LINKS = ImmutableSet.of(
      ExprKind.METHOD_CALL, ExprKind.PROPERTY_ACCESS, ExprKind.INDEX_ACCESS);

  private final GenContext ctx;

  /** Names bound to the targets of the enclosing cascades */
  private final Deque<String> receivers = new ArrayDeque<String>();

  /** Set while generating the receiver of a member, call or index link */
  private boolean chainReceiver = false;

  ExprCodeGen(GenContext ctx) {
    this.ctx = ctx;
  }

  String gen(ExprIR e) throws CodeGenException {
    return e.accept(this);
  }

  /**
   * Generate e for use as an operand, parenthesized if it binds loosely
   */
  String operand(ExprIR e) throws CodeGenException {
    String js = gen(e);
    if (JSLowering.LOOSE_KINDS.contains(e.getKind())) {
      return "(" + js + ")";
    }
    return js;
  }

  void pushReceiver(String name) {
    receivers.push(name);
  }

  void popReceiver() {
    receivers.pop();
  }

  /**
   * Argument list text without the enclosing parentheses.  Named
   * arguments are passed as one trailing object.
   */
  String args(ArgList args) throws CodeGenException {
    List<String> parts = new ArrayList<String>();
    for (ExprIR arg: args.getPositional()) {
      parts.add(gen(arg));
    }
    if (!args.getNamed().isEmpty()) {
      List<String> named = new ArrayList<String>();
      for (Map.Entry<String, ExprIR> e: args.getNamed().entrySet()) {
        named.add(propertyKey(e.getKey()) + ": " + gen(e.getValue()));
      }
      parts.add("{ " + StringUtils.join(named, ", ") + " }");
    }
    return StringUtils.join(parts, ", ");
  }

  @Override
  public String visitLiteral(Literal e) throws CodeGenException {
    LiteralValue v = e.getValue();
    switch (v.getKind()) {
      case STRING:
        return JSLowering.quote(v.getString());
      case INT:
        return Long.toString(v.getInt());
      case DOUBLE:
        return doubleLiteral(v.getDouble());
      case BOOL:
        return Boolean.toString(v.getBool());
      case NULL:
        return "null";
      default:
        throw ctx.error(e, "Unexpected literal kind " + v.getKind(), null);
    }
  }

  private static String doubleLiteral(double d) {
    if (Double.isNaN(d)) {
      return "NaN";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "Infinity" : "-Infinity";
    }
    return Double.toString(d);
  }

  @Override
  public String visitIdentifier(Identifier e) throws CodeGenException {
    if (e.isSuper()) {
      throw ctx.error(e, "super used as a value",
          "Call a superclass member instead, e.g. super.build(context)");
    }
    return e.isThis() ? "this" : e.getName();
  }

  /**
   * Receiver of a member access: like gen, but allows super.  A receiver
   * that is itself a link continues the same chain.
   */
  private String receiver(ExprIR target) throws CodeGenException {
    if (target.getKind() == ExprKind.IDENTIFIER &&
        ((Identifier) target).isSuper()) {
      return "super";
    } else if (CHAIN_LINKS.contains(target.getKind())) {
      chainReceiver = true;
      return gen(target);
    }
    return operand(target);
  }

  /**
   * Start generating a link.  Must come before any other generation in
   * the link's visitor.
   * @return true if the link ends its chain
   */
  private boolean enterLink() {
    boolean last = !chainReceiver;
    chainReceiver = false;
    return last;
  }

  /**
   * Null-aware links use optional chaining, which skips the rest of the
   * chain once a receiver is null.  The chain's value is then undefined,
   * so the last link maps it back to null.
   */
  private static String endLink(ExprIR e, String js, boolean last) {
    if (last && hasNullAwareLink(e)) {
      return "(" + js + " ?? null)";
    }
    return js;
  }

  /**
   * @return true if e or one of the links it is reached through is
   *         null-aware
   */
  private static boolean hasNullAwareLink(ExprIR e) {
    while (e != null) {
      switch (e.getKind()) {
        case METHOD_CALL:
          MethodCall mc = (MethodCall) e;
          if (mc.isNullAware()) {
            return true;
          }
          e = mc.getTarget();
          break;
        case PROPERTY_ACCESS:
          PropertyAccess pa = (PropertyAccess) e;
          if (pa.isNullAware()) {
            return true;
          }
          e = pa.getTarget();
          break;
        case INDEX_ACCESS:
          IndexAccess ia = (IndexAccess) e;
          if (ia.isNullAware()) {
            return true;
          }
          e = ia.getTarget();
          break;
        default:
          return false;
      }
    }
    return false;
  }

  private static boolean isSimple(ExprIR e) {
    return e.getKind() == ExprKind.IDENTIFIER;
  }

  private String cascadeReceiver(ExprIR e) throws CodeGenException {
    if (receivers.isEmpty()) {
      throw ctx.error(e, "Cascade section outside a cascade",
          "Use a cascade target, e.g. list..add(1)");
    }
    return receivers.peek();
  }

  @Override
  public String visitBinary(Binary e) throws CodeGenException {
    String left = operand(e.getLeft());
    String right = operand(e.getRight());
    String template = JSLowering.BINARY_TEMPLATES.get(e.getOperator());
    if (template != null) {
      return String.format(template, left, right);
    }
    return left + " " + JSLowering.binaryOperator(e.getOperator()) +
           " " + right;
  }

  @Override
  public String visitUnary(Unary e) throws CodeGenException {
    String op = e.getOperator();
    if (!e.isPrefix()) {
      if (op.equals("!")) {
        // Null assertion has no runtime counterpart
        return gen(e.getOperand());
      }
      return operand(e.getOperand()) + op;
    }
    String inner = operand(e.getOperand());
    if (e.getOperand().getKind() == ExprKind.UNARY ||
        inner.startsWith(op.substring(0, 1))) {
      inner = "(" + inner + ")";
    }
    return op + inner;
  }

  @Override
  public String visitMethodCall(MethodCall e) throws CodeGenException {
    boolean last = enterLink();
    String call = e.getName() + "(" + args(e.getArgs()) + ")";
    if (e.isCascade()) {
      return cascadeReceiver(e) + "." + call;
    } else if (e.getTarget() == null) {
      return call;
    }
    String dot = e.isNullAware() ? "?." : ".";
    return endLink(e, receiver(e.getTarget()) + dot + call, last);
  }

  @Override
  public String visitPropertyAccess(PropertyAccess e)
      throws CodeGenException {
    boolean last = enterLink();
    String member = "." + e.getName();
    if (isThisTarget(e.getTarget()) && useAccessorMethods() &&
        ctx.isAccessor(e.getName(), false)) {
      member = "." + accessorName("get", e.getName()) + "()";
    }
    if (e.isCascade()) {
      return cascadeReceiver(e) + member;
    } else if (e.getTarget() == null) {
      throw ctx.error(e, "Property access without a target",
          "Check the IR document: only cascade sections omit the target");
    }
    String dot = e.isNullAware() ? "?" : "";
    return endLink(e, receiver(e.getTarget()) + dot + member, last);
  }

  private static boolean isThisTarget(ExprIR target) {
    return target != null && target.getKind() == ExprKind.IDENTIFIER &&
           ((Identifier) target).isThis();
  }

  private boolean useAccessorMethods() {
    return ctx.config.getAccessors() == AccessorPolicy.METHODS;
  }

  static String accessorName(String prefix, String name) {
    return prefix + StringUtils.capitalize(name);
  }

  @Override
  public String visitIndexAccess(IndexAccess e) throws CodeGenException {
    boolean last = enterLink();
    String index = "[" + gen(e.getIndex()) + "]";
    if (e.isCascade()) {
      return cascadeReceiver(e) + index;
    }
    String dot = e.isNullAware() ? "?." : "";
    return endLink(e, receiver(e.getTarget()) + dot + index, last);
  }

  @Override
  public String visitConditional(Conditional e) throws CodeGenException {
    return operand(e.getCondition()) + " ? " + operand(e.getThen()) +
           " : " + operand(e.getElse());
  }

  @Override
  public String visitFunctionExpr(FunctionExpr e) throws CodeGenException {
    String params = ctx.params.declaration(e.getParams());
    if (e.isGenerator()) {
      String header = (e.isAsync() ? "async " : "") +
                      "function*(" + params + ") ";
      return header + ctx.functions.inlineBody(e.getBody());
    }
    String header = (e.isAsync() ? "async " : "") + "(" + params + ") => ";
    if (e.getBody().isExpression()) {
      ExprIR body = e.getBody().getExpr();
      if (body.getKind() == ExprKind.CASCADE) {
        return header + ctx.functions.inlineBody(e.getBody());
      }
      String js = gen(body);
      if (body.getKind() == ExprKind.MAP_LITERAL) {
        // An object literal would parse as a block
        js = "(" + js + ")";
      }
      return header + js;
    }
    return header + ctx.stmts.inlineBlock(e.getBody().getBlock());
  }

  @Override
  public String visitListLiteral(ListLiteral e) throws CodeGenException {
    List<String> elems = new ArrayList<String>();
    for (ExprIR elem: e.getElements()) {
      elems.add(gen(elem));
    }
    String array = "[" + StringUtils.join(elems, ", ") + "]";
    if (e.getLiteralKind() == LiteralKind.SET) {
      return "new Set(" + array + ")";
    }
    return array;
  }

  @Override
  public String visitMapLiteral(MapLiteral e) throws CodeGenException {
    if (e.getEntries().isEmpty()) {
      return "{}";
    }
    List<String> entries = new ArrayList<String>();
    for (MapEntryIR entry: e.getEntries()) {
      entries.add(mapKey(entry.getKey()) + ": " + gen(entry.getValue()));
    }
    return "{ " + StringUtils.join(entries, ", ") + " }";
  }

  private String mapKey(ExprIR key) throws CodeGenException {
    if (key.getKind() == ExprKind.LITERAL) {
      LiteralValue v = ((Literal) key).getValue();
      if (v.getKind() == LiteralKind.STRING) {
        return JSLowering.quote(v.getString());
      } else if (v.getKind() == LiteralKind.INT) {
        return Long.toString(v.getInt());
      }
    }
    return "[" + gen(key) + "]";
  }

  private static String propertyKey(String name) {
    return JS_IDENTIFIER.matcher(name).matches() ?
                          name : JSLowering.quote(name);
  }

  @Override
  public String visitAwait(Await e) throws CodeGenException {
    return "await " + operand(e.getExpr());
  }

  @Override
  public String visitCast(Cast e) throws CodeGenException {
    TypeIR t = e.getTargetType();
    String template = JSLowering.castTemplate(t);
    if (template != null) {
      if (template.equals("%s")) {
        return gen(e.getExpr());
      }
      return String.format(template, gen(e.getExpr()));
    }
    String name = t.getName();
    checkKnownClass(e.getLocation(), name);
    String tmp = ctx.newTemp("v");
    String test = tmp + " instanceof " + name;
    if (t.isNullable()) {
      test = tmp + " == null || " + test;
    }
    return "((" + tmp + ") => " + test + " ? " + tmp +
           " : (() => { throw new TypeError(" +
           JSLowering.quote("Cast to " + name + " failed") + "); })())(" +
           gen(e.getExpr()) + ")";
  }

  @Override
  public String visitTypeCheck(TypeCheck e) throws CodeGenException {
    TypeIR t = e.getCheckedType();
    String subject = operand(e.getExpr());
    String prefix = null;
    if (t.isNullable() && !isSimple(e.getExpr())) {
      String tmp = ctx.newTemp("v");
      prefix = "((" + tmp + ") => ";
      subject = tmp;
    }
    String test = typeTest(t, subject, e.getLocation());
    if (t.isNullable()) {
      test = subject + " == null || " + test;
    }
    if (prefix != null) {
      test = prefix + test + ")(" + gen(e.getExpr()) + ")";
    }
    if (e.isNegated()) {
      return "!(" + test + ")";
    }
    return test;
  }

  /**
   * Test of subject against t, ignoring nullability of t
   */
  String typeTest(TypeIR t, String subject, SourceLocation loc) {
    String template = JSLowering.typeCheckTemplate(t);
    if (template != null) {
      return template.contains("%s") ?
                String.format(template, subject) : template;
    }
    checkKnownClass(loc, t.getName());
    return subject + " instanceof " + t.getName();
  }

  private void checkKnownClass(SourceLocation loc, String name) {
    if (!ctx.declaredClasses.contains(name)) {
      ctx.warn("Type test against " + name + " relies on a runtime " +
               "global of that name", loc);
    }
  }

  @Override
  public String visitInterpolatedString(InterpolatedString e)
      throws CodeGenException {
    StringBuilder sb = new StringBuilder("`");
    for (StringPart part: e.getParts()) {
      if (part.isText()) {
        sb.append(JSLowering.templateText(part.getText()));
      } else {
        sb.append("${").append(gen(part.getExpr())).append('}');
      }
    }
    return sb.append('`').toString();
  }

  @Override
  public String visitAssignment(Assignment e) throws CodeGenException {
    ExprIR target = e.getTarget();
    String value = gen(e.getValue());
    switch (target.getKind()) {
      case IDENTIFIER:
        Identifier id = (Identifier) target;
        if (id.isThis() || id.isSuper() || id.isTypeReference()) {
          throw invalidTarget(e);
        }
        break;
      case PROPERTY_ACCESS:
        PropertyAccess pa = (PropertyAccess) target;
        if (hasNullAwareLink(pa)) {
          throw nullAwareTarget(e);
        }
        if (isThisTarget(pa.getTarget()) && useAccessorMethods() &&
            ctx.isAccessor(pa.getName(), true)) {
          if (e.getOp() != AssignOp.ASSIGN) {
            throw ctx.error(e, "Compound assignment through a setter",
                "Write the read and the write separately");
          }
          return "this." + accessorName("set", pa.getName()) +
                 "(" + value + ")";
        }
        break;
      case INDEX_ACCESS:
        if (hasNullAwareLink(target)) {
          throw nullAwareTarget(e);
        }
        break;
      default:
        throw invalidTarget(e);
    }
    String lhs = gen(target);
    if (e.getOp() == AssignOp.INT_DIV) {
      return lhs + " = " + String.format(
          JSLowering.BINARY_TEMPLATES.get("~/"), lhs, operand(e.getValue()));
    }
    return lhs + " " + e.getOp().symbol() + " " + value;
  }

  private CodeGenException invalidTarget(Assignment e) {
    return ctx.error(e, "Invalid assignment target " +
                     e.getTarget().kindName(),
                     "Assign to a variable, field or index");
  }

  private CodeGenException nullAwareTarget(Assignment e) {
    return ctx.error(e, "Null-aware assignment target",
        "Test the receiver for null in an if statement first");
  }

  /**
   * Section texts of a cascade whose target is bound to receiver
   */
  List<String> cascadeSections(Cascade e, String receiver)
      throws CodeGenException {
    List<String> sections = new ArrayList<String>();
    pushReceiver(receiver);
    try {
      for (ExprIR section: e.getSections()) {
        sections.add(gen(section));
      }
    } finally {
      popReceiver();
    }
    return sections;
  }

  /**
   * Cascade inside a larger expression.  Statement, declaration and return
   * positions are lowered to statements instead.
   */
  @Override
  public String visitCascade(Cascade e) throws CodeGenException {
    String tmp = ctx.newTemp("c");
    String target = gen(e.getTarget());
    boolean async = AwaitScanner.containsAwait(e.getSections());
    StringBuilder sb = new StringBuilder();
    sb.append(async ? "(await (async (" : "((").append(tmp)
      .append(") => { ");
    if (e.isNullAware()) {
      sb.append("if (").append(tmp).append(" == null) return ")
        .append(tmp).append("; ");
    }
    for (String section: cascadeSections(e, tmp)) {
      sb.append(section).append("; ");
    }
    sb.append("return ").append(tmp).append("; })(").append(target)
      .append(async ? "))" : ")");
    return sb.toString();
  }

  @Override
  public String visitInstanceCreation(InstanceCreation e)
      throws CodeGenException {
    String type = e.getCreatedType().getName();
    String args = "(" + args(e.getArgs()) + ")";
    if (e.getConstructorName() != null) {
      return type + "." + e.getConstructorName() + args;
    } else if (ctx.unnamedFactories.contains(type)) {
      return type + "." + ClassCodeGen.UNNAMED_FACTORY + args;
    }
    return "new " + type + args;
  }

  @Override
  public String visitInvocation(Invocation e) throws CodeGenException {
    return operand(e.getCallee()) + "(" + args(e.getArgs()) + ")";
  }

  @Override
  public String visitThrow(Throw e) throws CodeGenException {
    if (AwaitScanner.containsAwait(e.getExpr())) {
      return "await (async () => { throw " + gen(e.getExpr()) + "; })()";
    }
    return "(() => { throw " + gen(e.getExpr()) + "; })()";
  }
}
