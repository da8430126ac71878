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
package exm.fjc.ic.json;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import exm.fjc.ast.SourceLocation;
import exm.fjc.ic.tree.ArgList;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.ConstructorDecl;
import exm.fjc.ic.tree.ConstructorInit;
import exm.fjc.ic.tree.DeclVisitor;
import exm.fjc.ic.tree.Declaration;
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
import exm.fjc.ic.tree.ExprVisitor;
import exm.fjc.ic.tree.FieldDecl;
import exm.fjc.ic.tree.FunctionBody;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.IRNode;
import exm.fjc.ic.tree.LiteralValue;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.ParameterDecl;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.StmtIR.Assert;
import exm.fjc.ic.tree.StmtIR.Block;
import exm.fjc.ic.tree.StmtIR.Break;
import exm.fjc.ic.tree.StmtIR.CatchClause;
import exm.fjc.ic.tree.StmtIR.Continue;
import exm.fjc.ic.tree.StmtIR.Declarator;
import exm.fjc.ic.tree.StmtIR.DoWhile;
import exm.fjc.ic.tree.StmtIR.ExpressionStmt;
import exm.fjc.ic.tree.StmtIR.For;
import exm.fjc.ic.tree.StmtIR.ForIn;
import exm.fjc.ic.tree.StmtIR.If;
import exm.fjc.ic.tree.StmtIR.Return;
import exm.fjc.ic.tree.StmtIR.Switch;
import exm.fjc.ic.tree.StmtIR.SwitchCase;
import exm.fjc.ic.tree.StmtIR.Try;
import exm.fjc.ic.tree.StmtIR.VarDecl;
import exm.fjc.ic.tree.StmtIR.While;
import exm.fjc.ic.tree.StmtIR.Yield;
import exm.fjc.ic.tree.StmtVisitor;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.ic.tree.VariableDecl;

/**
 * Converts IR to the JSON tree described by {@link IRSchema}.  Optional
 * fields are written only when they differ from their default.
 */
class IRJsonWriter implements DeclVisitor<JsonObject, RuntimeException>,
    ExprVisitor<JsonObject, RuntimeException>,
    StmtVisitor<JsonObject, RuntimeException> {

  JsonObject document(List<Declaration> decls) {
    JsonObject doc = new JsonObject();
    doc.addProperty(IRSchema.VERSION_FIELD, IRSchema.SCHEMA_VERSION);
    JsonArray arr = new JsonArray();
    for (Declaration d: decls) {
      arr.add(d.accept(this));
    }
    doc.add(IRSchema.DECLARATIONS_FIELD, arr);
    return doc;
  }

  private static JsonObject node(String kind, IRNode n) {
    JsonObject o = new JsonObject();
    o.addProperty(IRSchema.KIND_FIELD, kind);
    o.addProperty("id", n.getId());
    SourceLocation loc = n.getLocation();
    if (loc != null && !loc.equals(SourceLocation.UNKNOWN)) {
      JsonObject l = new JsonObject();
      l.addProperty("file", loc.getFile());
      l.addProperty("line", loc.getLine());
      l.addProperty("column", loc.getColumn());
      o.add("loc", l);
    }
    return o;
  }

  private JsonObject expr(ExprIR e) {
    JsonObject o = node(e.getKind().name(), e);
    if (!e.getType().isDynamic()) {
      o.add("type", type(e.getType()));
    }
    return o;
  }

  private static void flag(JsonObject o, String name, boolean value) {
    if (value) {
      o.addProperty(name, true);
    }
  }

  private void child(JsonObject o, String name, ExprIR e) {
    if (e != null) {
      o.add(name, e.accept(this));
    }
  }

  private void child(JsonObject o, String name, StmtIR s) {
    if (s != null) {
      o.add(name, s.accept(this));
    }
  }

  private static void string(JsonObject o, String name, String value) {
    if (value != null) {
      o.addProperty(name, value);
    }
  }

  private JsonArray exprs(List<ExprIR> es) {
    JsonArray arr = new JsonArray();
    for (ExprIR e: es) {
      arr.add(e.accept(this));
    }
    return arr;
  }

  private JsonArray stmts(List<StmtIR> ss) {
    JsonArray arr = new JsonArray();
    for (StmtIR s: ss) {
      arr.add(s.accept(this));
    }
    return arr;
  }

  private static JsonArray strings(Iterable<String> ss) {
    JsonArray arr = new JsonArray();
    for (String s: ss) {
      arr.add(s);
    }
    return arr;
  }

  static JsonObject type(TypeIR t) {
    JsonObject o = new JsonObject();
    o.addProperty("name", t.getName());
    if (!t.getTypeArgs().isEmpty()) {
      o.add("args", types(t.getTypeArgs()));
    }
    flag(o, "nullable", t.isNullable());
    return o;
  }

  private static JsonArray types(List<TypeIR> ts) {
    JsonArray arr = new JsonArray();
    for (TypeIR t: ts) {
      arr.add(type(t));
    }
    return arr;
  }

  private static void type(JsonObject o, String name, TypeIR t) {
    if (t != null && !t.isDynamic()) {
      o.add(name, type(t));
    }
  }

  private JsonObject args(ArgList args) {
    JsonObject o = new JsonObject();
    o.add("positional", exprs(args.getPositional()));
    JsonObject named = new JsonObject();
    for (Map.Entry<String, ExprIR> e: args.getNamed().entrySet()) {
      named.add(e.getKey(), e.getValue().accept(this));
    }
    o.add("named", named);
    return o;
  }

  private void args(JsonObject o, ArgList args) {
    if (!args.isEmpty()) {
      o.add("args", args(args));
    }
  }

  /** A block body is written as a BLOCK node, anything else is an
      expression body */
  private JsonObject body(FunctionBody body) {
    if (body.isExpression()) {
      return body.getExpr().accept(this);
    }
    return body.getBlock().accept(this);
  }

  private JsonArray params(List<ParameterDecl> params) {
    JsonArray arr = new JsonArray();
    for (ParameterDecl p: params) {
      JsonObject o = node(IRSchema.PARAM, p);
      o.addProperty("name", p.getName());
      o.addProperty("paramKind", p.getParamKind().name());
      o.addProperty("origin", p.getOrigin().name());
      type(o, "type", p.getType());
      flag(o, "required", p.isRequired());
      child(o, "default", p.getDefaultValue());
      arr.add(o);
    }
    return arr;
  }

  /*
   * Declarations
   */

  @Override
  public JsonObject visitClass(ClassDecl decl) {
    JsonObject o = node("CLASS", decl);
    o.addProperty("name", decl.getName());
    o.add("typeParams", strings(decl.getTypeParams()));
    if (decl.getSuperclass() != null) {
      o.add("superclass", type(decl.getSuperclass()));
    }
    o.add("mixins", types(decl.getMixins()));
    o.add("interfaces", types(decl.getInterfaces()));
    flag(o, "abstract", decl.isAbstract());

    JsonArray fields = new JsonArray();
    for (FieldDecl f: decl.getFields()) {
      JsonObject fo = node(IRSchema.FIELD, f);
      fo.addProperty("name", f.getName());
      type(fo, "type", f.getType());
      child(fo, "init", f.getInit());
      flag(fo, "static", f.isStatic());
      flag(fo, "final", f.isFinal());
      flag(fo, "const", f.isConst());
      flag(fo, "late", f.isLate());
      fields.add(fo);
    }
    o.add("fields", fields);

    JsonArray ctors = new JsonArray();
    for (ConstructorDecl c: decl.getConstructors()) {
      JsonObject co = node(IRSchema.CONSTRUCTOR, c);
      co.addProperty("className", c.getClassName());
      string(co, "name", c.getName());
      co.add("params", params(c.getParams()));
      JsonArray inits = new JsonArray();
      for (ConstructorInit init: c.getInitializers()) {
        inits.add(initializer(init));
      }
      co.add("initializers", inits);
      if (c.getBody() != null) {
        co.add("body", body(c.getBody()));
      }
      flag(co, "factory", c.isFactory());
      flag(co, "const", c.isConst());
      ctors.add(co);
    }
    o.add("constructors", ctors);

    JsonArray methods = new JsonArray();
    for (MethodDecl m: decl.getMethods()) {
      JsonObject mo = node(IRSchema.METHOD, m);
      mo.addProperty("name", m.getName());
      type(mo, "returnType", m.getReturnType());
      mo.add("typeParams", strings(m.getTypeParams()));
      mo.add("params", params(m.getParams()));
      if (m.getBody() != null) {
        mo.add("body", body(m.getBody()));
      }
      flag(mo, "static", m.isStatic());
      flag(mo, "abstract", m.isAbstract());
      flag(mo, "getter", m.isGetter());
      flag(mo, "setter", m.isSetter());
      flag(mo, "async", m.isAsync());
      flag(mo, "generator", m.isGenerator());
      methods.add(mo);
    }
    o.add("methods", methods);
    return o;
  }

  private JsonObject initializer(ConstructorInit init) {
    JsonObject o = new JsonObject();
    o.addProperty(IRSchema.KIND_FIELD, IRSchema.INIT);
    o.addProperty("initKind", init.getKind().name());
    switch (init.getKind()) {
      case FIELD:
        o.addProperty("field", init.getFieldName());
        child(o, "value", init.getValue());
        break;
      case SUPER:
      case REDIRECT:
        string(o, "constructor", init.getConstructorName());
        o.add("args", args(init.getArgs()));
        break;
      case ASSERT:
        child(o, "condition", init.getCondition());
        child(o, "message", init.getMessage());
        break;
    }
    return o;
  }

  @Override
  public JsonObject visitFunction(FunctionDecl decl) {
    JsonObject o = node("FUNCTION", decl);
    o.addProperty("name", decl.getName());
    type(o, "returnType", decl.getReturnType());
    o.add("typeParams", strings(decl.getTypeParams()));
    o.add("params", params(decl.getParams()));
    if (decl.getBody() != null) {
      o.add("body", body(decl.getBody()));
    }
    flag(o, "async", decl.isAsync());
    flag(o, "generator", decl.isGenerator());
    return o;
  }

  @Override
  public JsonObject visitVariable(VariableDecl decl) {
    JsonObject o = node("VARIABLE", decl);
    o.addProperty("name", decl.getName());
    type(o, "type", decl.getType());
    child(o, "init", decl.getInit());
    flag(o, "final", decl.isFinal());
    flag(o, "const", decl.isConst());
    flag(o, "late", decl.isLate());
    return o;
  }

  /*
   * Expressions
   */

  @Override
  public JsonObject visitLiteral(Literal e) {
    JsonObject o = expr(e);
    LiteralValue v = e.getValue();
    o.addProperty("literalKind", v.getKind().name());
    switch (v.getKind()) {
      case STRING:
        o.addProperty("value", v.getString());
        break;
      case INT:
        o.addProperty("value", v.getInt());
        break;
      case DOUBLE:
        o.addProperty("value", v.getDouble());
        break;
      case BOOL:
        o.addProperty("value", v.getBool());
        break;
      default:
        break;
    }
    return o;
  }

  @Override
  public JsonObject visitIdentifier(Identifier e) {
    JsonObject o = expr(e);
    o.addProperty("name", e.getName());
    flag(o, "this", e.isThis());
    flag(o, "super", e.isSuper());
    flag(o, "typeReference", e.isTypeReference());
    return o;
  }

  @Override
  public JsonObject visitBinary(Binary e) {
    JsonObject o = expr(e);
    child(o, "left", e.getLeft());
    o.addProperty("operator", e.getOperator());
    child(o, "right", e.getRight());
    return o;
  }

  @Override
  public JsonObject visitUnary(Unary e) {
    JsonObject o = expr(e);
    o.addProperty("operator", e.getOperator());
    child(o, "operand", e.getOperand());
    flag(o, "prefix", e.isPrefix());
    return o;
  }

  @Override
  public JsonObject visitMethodCall(MethodCall e) {
    JsonObject o = expr(e);
    child(o, "target", e.getTarget());
    o.addProperty("name", e.getName());
    args(o, e.getArgs());
    if (!e.getTypeArgs().isEmpty()) {
      o.add("typeArgs", types(e.getTypeArgs()));
    }
    flag(o, "nullAware", e.isNullAware());
    flag(o, "cascade", e.isCascade());
    return o;
  }

  @Override
  public JsonObject visitPropertyAccess(PropertyAccess e) {
    JsonObject o = expr(e);
    child(o, "target", e.getTarget());
    o.addProperty("name", e.getName());
    flag(o, "nullAware", e.isNullAware());
    flag(o, "cascade", e.isCascade());
    return o;
  }

  @Override
  public JsonObject visitIndexAccess(IndexAccess e) {
    JsonObject o = expr(e);
    child(o, "target", e.getTarget());
    child(o, "index", e.getIndex());
    flag(o, "nullAware", e.isNullAware());
    flag(o, "cascade", e.isCascade());
    return o;
  }

  @Override
  public JsonObject visitConditional(Conditional e) {
    JsonObject o = expr(e);
    child(o, "condition", e.getCondition());
    child(o, "then", e.getThen());
    child(o, "else", e.getElse());
    return o;
  }

  @Override
  public JsonObject visitFunctionExpr(FunctionExpr e) {
    JsonObject o = node(e.getKind().name(), e);
    o.add("params", params(e.getParams()));
    o.add("body", body(e.getBody()));
    flag(o, "async", e.isAsync());
    flag(o, "generator", e.isGenerator());
    o.add("captured", strings(e.getCaptured()));
    return o;
  }

  @Override
  public JsonObject visitListLiteral(ListLiteral e) {
    JsonObject o = node(e.getKind().name(), e);
    o.addProperty("literalKind", e.getLiteralKind().name());
    o.add("elements", exprs(e.getElements()));
    type(o, "elementType", e.getElementType());
    flag(o, "const", e.isConst());
    return o;
  }

  @Override
  public JsonObject visitMapLiteral(MapLiteral e) {
    JsonObject o = node(e.getKind().name(), e);
    JsonArray entries = new JsonArray();
    for (MapEntryIR entry: e.getEntries()) {
      JsonObject eo = new JsonObject();
      eo.add("key", entry.getKey().accept(this));
      eo.add("value", entry.getValue().accept(this));
      entries.add(eo);
    }
    o.add("entries", entries);
    type(o, "keyType", e.getKeyType());
    type(o, "valueType", e.getValueType());
    flag(o, "const", e.isConst());
    return o;
  }

  @Override
  public JsonObject visitAwait(Await e) {
    JsonObject o = expr(e);
    child(o, "expr", e.getExpr());
    return o;
  }

  @Override
  public JsonObject visitCast(Cast e) {
    JsonObject o = node(e.getKind().name(), e);
    child(o, "expr", e.getExpr());
    o.add("targetType", type(e.getTargetType()));
    return o;
  }

  @Override
  public JsonObject visitTypeCheck(TypeCheck e) {
    JsonObject o = node(e.getKind().name(), e);
    child(o, "expr", e.getExpr());
    o.add("checkedType", type(e.getCheckedType()));
    flag(o, "negated", e.isNegated());
    return o;
  }

  @Override
  public JsonObject visitInterpolatedString(InterpolatedString e) {
    JsonObject o = node(e.getKind().name(), e);
    JsonArray parts = new JsonArray();
    for (StringPart p: e.getParts()) {
      JsonObject po = new JsonObject();
      if (p.isText()) {
        po.addProperty("text", p.getText());
      } else {
        po.add("expr", p.getExpr().accept(this));
      }
      parts.add(po);
    }
    o.add("parts", parts);
    return o;
  }

  @Override
  public JsonObject visitAssignment(Assignment e) {
    JsonObject o = expr(e);
    child(o, "target", e.getTarget());
    child(o, "value", e.getValue());
    o.addProperty("op", e.getOp().symbol());
    return o;
  }

  @Override
  public JsonObject visitCascade(Cascade e) {
    JsonObject o = node(e.getKind().name(), e);
    child(o, "target", e.getTarget());
    o.add("sections", exprs(e.getSections()));
    flag(o, "nullAware", e.isNullAware());
    return o;
  }

  @Override
  public JsonObject visitInstanceCreation(InstanceCreation e) {
    JsonObject o = node(e.getKind().name(), e);
    o.add("createdType", type(e.getCreatedType()));
    string(o, "constructor", e.getConstructorName());
    args(o, e.getArgs());
    flag(o, "const", e.isConst());
    return o;
  }

  @Override
  public JsonObject visitInvocation(Invocation e) {
    JsonObject o = node(e.getKind().name(), e);
    child(o, "callee", e.getCallee());
    args(o, e.getArgs());
    if (!e.getTypeArgs().isEmpty()) {
      o.add("typeArgs", types(e.getTypeArgs()));
    }
    return o;
  }

  @Override
  public JsonObject visitThrow(Throw e) {
    JsonObject o = node(e.getKind().name(), e);
    child(o, "expr", e.getExpr());
    return o;
  }

  /*
   * Statements
   */

  private static JsonObject stmt(StmtIR s) {
    return node(s.getKind().name(), s);
  }

  @Override
  public JsonObject visitBlock(Block s) {
    JsonObject o = stmt(s);
    o.add("statements", stmts(s.getStatements()));
    return o;
  }

  @Override
  public JsonObject visitExpression(ExpressionStmt s) {
    JsonObject o = stmt(s);
    child(o, "expr", s.getExpr());
    return o;
  }

  @Override
  public JsonObject visitVarDecl(VarDecl s) {
    JsonObject o = stmt(s);
    type(o, "type", s.getDeclaredType());
    flag(o, "final", s.isFinal());
    flag(o, "const", s.isConst());
    flag(o, "late", s.isLate());
    JsonArray decls = new JsonArray();
    for (Declarator d: s.getDeclarators()) {
      JsonObject d0 = new JsonObject();
      d0.addProperty("name", d.getName());
      child(d0, "init", d.getInit());
      decls.add(d0);
    }
    o.add("declarators", decls);
    return o;
  }

  @Override
  public JsonObject visitIf(If s) {
    JsonObject o = stmt(s);
    child(o, "condition", s.getCondition());
    child(o, "then", s.getThen());
    child(o, "else", s.getElse());
    return o;
  }

  @Override
  public JsonObject visitFor(For s) {
    JsonObject o = stmt(s);
    child(o, "init", s.getInit());
    child(o, "condition", s.getCondition());
    o.add("updates", exprs(s.getUpdates()));
    child(o, "body", s.getBody());
    return o;
  }

  @Override
  public JsonObject visitForIn(ForIn s) {
    JsonObject o = stmt(s);
    o.addProperty("varName", s.getVarName());
    flag(o, "declared", s.isDeclared());
    flag(o, "final", s.isFinal());
    flag(o, "await", s.isAwait());
    child(o, "iterable", s.getIterable());
    child(o, "body", s.getBody());
    return o;
  }

  @Override
  public JsonObject visitWhile(While s) {
    JsonObject o = stmt(s);
    child(o, "condition", s.getCondition());
    child(o, "body", s.getBody());
    return o;
  }

  @Override
  public JsonObject visitDoWhile(DoWhile s) {
    JsonObject o = stmt(s);
    child(o, "body", s.getBody());
    child(o, "condition", s.getCondition());
    return o;
  }

  @Override
  public JsonObject visitSwitch(Switch s) {
    JsonObject o = stmt(s);
    child(o, "subject", s.getSubject());
    JsonArray cases = new JsonArray();
    for (SwitchCase c: s.getCases()) {
      JsonObject co = new JsonObject();
      co.add("values", exprs(c.getValues()));
      co.add("body", stmts(c.getBody()));
      cases.add(co);
    }
    o.add("cases", cases);
    return o;
  }

  @Override
  public JsonObject visitReturn(Return s) {
    JsonObject o = stmt(s);
    child(o, "value", s.getValue());
    return o;
  }

  @Override
  public JsonObject visitBreak(Break s) {
    JsonObject o = stmt(s);
    string(o, "label", s.getLabel());
    return o;
  }

  @Override
  public JsonObject visitContinue(Continue s) {
    JsonObject o = stmt(s);
    string(o, "label", s.getLabel());
    return o;
  }

  @Override
  public JsonObject visitTry(Try s) {
    JsonObject o = stmt(s);
    child(o, "body", s.getBody());
    JsonArray catches = new JsonArray();
    for (CatchClause c: s.getCatches()) {
      JsonObject co = new JsonObject();
      if (c.getOnType() != null) {
        co.add("onType", type(c.getOnType()));
      }
      string(co, "exceptionVar", c.getExceptionVar());
      string(co, "stackVar", c.getStackVar());
      co.add("body", c.getBody().accept(this));
      catches.add(co);
    }
    o.add("catches", catches);
    child(o, "finally", s.getFinally());
    return o;
  }

  @Override
  public JsonObject visitYield(Yield s) {
    JsonObject o = stmt(s);
    child(o, "value", s.getValue());
    flag(o, "star", s.isStar());
    return o;
  }

  @Override
  public JsonObject visitAssert(Assert s) {
    JsonObject o = stmt(s);
    child(o, "condition", s.getCondition());
    child(o, "message", s.getMessage());
    return o;
  }
}
