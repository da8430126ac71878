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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.exceptions.FJCRuntimeError;
import exm.fjc.common.exceptions.IRSchemaException;
import exm.fjc.ic.tree.ArgList;
import exm.fjc.ic.tree.AssignOp;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.ConstructorDecl;
import exm.fjc.ic.tree.ConstructorInit;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.ExprIR.MapEntryIR;
import exm.fjc.ic.tree.ExprIR.StringPart;
import exm.fjc.ic.tree.ExprKind;
import exm.fjc.ic.tree.FieldDecl;
import exm.fjc.ic.tree.FunctionBody;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.LiteralKind;
import exm.fjc.ic.tree.LiteralValue;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.ParameterDecl;
import exm.fjc.ic.tree.ParameterDecl.ParamKind;
import exm.fjc.ic.tree.ParameterDecl.ParamOrigin;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.StmtIR.Block;
import exm.fjc.ic.tree.StmtIR.CatchClause;
import exm.fjc.ic.tree.StmtIR.Declarator;
import exm.fjc.ic.tree.StmtIR.SwitchCase;
import exm.fjc.ic.tree.StmtKind;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.ic.tree.VariableDecl;

/**
 * Rebuilds IR from the JSON tree described by {@link IRSchema}.
 * Every failure names the JSON path of the offending element.
 */
class IRJsonReader {

  /**
   * A JSON object with the path used to reach it
   */
  private static class Obj {
    final JsonObject json;
    final String path;

    Obj(JsonObject json, String path) {
      this.json = json;
      this.path = path;
    }

    String at(String field) {
      return path + "." + field;
    }

    boolean has(String field) {
      return json.has(field) && !json.get(field).isJsonNull();
    }

    String string(String field) throws IRSchemaException {
      JsonElement e = require(field);
      if (!e.isJsonPrimitive()) {
        throw new IRSchemaException(at(field), "expected a string");
      }
      return e.getAsString();
    }

    String optString(String field) throws IRSchemaException {
      return has(field) ? string(field) : null;
    }

    int integer(String field) throws IRSchemaException {
      JsonElement e = require(field);
      if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
        throw new IRSchemaException(at(field), "expected a number");
      }
      return e.getAsInt();
    }

    boolean flag(String field) throws IRSchemaException {
      if (!has(field)) {
        return false;
      }
      JsonElement e = json.get(field);
      if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
        throw new IRSchemaException(at(field), "expected true or false");
      }
      return e.getAsBoolean();
    }

    JsonElement require(String field) throws IRSchemaException {
      if (!has(field)) {
        throw new IRSchemaException(path, "missing required field \"" +
                                    field + "\"");
      }
      return json.get(field);
    }

    Obj object(String field) throws IRSchemaException {
      JsonElement e = require(field);
      if (!e.isJsonObject()) {
        throw new IRSchemaException(at(field), "expected an object");
      }
      return new Obj(e.getAsJsonObject(), at(field));
    }

    Obj optObject(String field) throws IRSchemaException {
      return has(field) ? object(field) : null;
    }

    /** Absent lists are empty */
    List<Obj> objects(String field) throws IRSchemaException {
      List<Obj> result = new ArrayList<Obj>();
      if (!has(field)) {
        return result;
      }
      JsonElement e = json.get(field);
      if (!e.isJsonArray()) {
        throw new IRSchemaException(at(field), "expected an array");
      }
      JsonArray arr = e.getAsJsonArray();
      for (int i = 0; i < arr.size(); i++) {
        String p = at(field) + "[" + i + "]";
        if (!arr.get(i).isJsonObject()) {
          throw new IRSchemaException(p, "expected an object");
        }
        result.add(new Obj(arr.get(i).getAsJsonObject(), p));
      }
      return result;
    }

    List<String> strings(String field) throws IRSchemaException {
      List<String> result = new ArrayList<String>();
      if (!has(field)) {
        return result;
      }
      JsonElement e = json.get(field);
      if (!e.isJsonArray()) {
        throw new IRSchemaException(at(field), "expected an array");
      }
      for (JsonElement s: e.getAsJsonArray()) {
        result.add(s.getAsString());
      }
      return result;
    }

    <E extends Enum<E>> E enumValue(String field, Class<E> cls)
        throws IRSchemaException {
      String value = string(field);
      try {
        return Enum.valueOf(cls, value);
      } catch (IllegalArgumentException ex) {
        throw new IRSchemaException(at(field), "unknown value \"" + value +
                                    "\"");
      }
    }
  }

  List<Declaration> document(JsonObject doc) throws IRSchemaException {
    Obj root = new Obj(doc, "$");
    int version = root.integer(IRSchema.VERSION_FIELD);
    if (version > IRSchema.SCHEMA_VERSION) {
      throw new IRSchemaException(root.at(IRSchema.VERSION_FIELD),
          "schema version " + version + " is newer than supported version " +
          IRSchema.SCHEMA_VERSION);
    } else if (version < 1) {
      throw new IRSchemaException(root.at(IRSchema.VERSION_FIELD),
                                  "invalid schema version " + version);
    }
    root.require(IRSchema.DECLARATIONS_FIELD);
    List<Declaration> result = new ArrayList<Declaration>();
    for (Obj d: root.objects(IRSchema.DECLARATIONS_FIELD)) {
      result.add(declaration(d));
    }
    return result;
  }

  /**
   * Check kind and required fields
   */
  private static String kind(Obj o) throws IRSchemaException {
    return IRSchema.check(o.json, o.path);
  }

  private static void expectKind(Obj o, String expected)
      throws IRSchemaException {
    String kind = kind(o);
    if (!kind.equals(expected)) {
      throw new IRSchemaException(o.path, "expected " + expected +
                                  " but found " + kind);
    }
  }

  private static SourceLocation loc(Obj o) throws IRSchemaException {
    Obj l = o.optObject("loc");
    if (l == null) {
      return SourceLocation.UNKNOWN;
    }
    return new SourceLocation(l.string("file"), l.integer("line"),
                              l.integer("column"));
  }

  static TypeIR type(Obj o) throws IRSchemaException {
    List<TypeIR> args = new ArrayList<TypeIR>();
    for (Obj a: o.objects("args")) {
      args.add(type(a));
    }
    return new TypeIR(o.string("name"), args, o.flag("nullable"));
  }

  /** Absent types are dynamic */
  private static TypeIR optType(Obj o, String field)
      throws IRSchemaException {
    Obj t = o.optObject(field);
    return t == null ? TypeIR.DYNAMIC : type(t);
  }

  private static List<TypeIR> types(Obj o, String field)
      throws IRSchemaException {
    List<TypeIR> result = new ArrayList<TypeIR>();
    for (Obj t: o.objects(field)) {
      result.add(type(t));
    }
    return result;
  }

  /*
   * Declarations
   */

  private Declaration declaration(Obj o) throws IRSchemaException {
    String kind = kind(o);
    if (kind.equals("CLASS")) {
      return classDecl(o);
    } else if (kind.equals("FUNCTION")) {
      return new FunctionDecl(o.integer("id"), loc(o), o.string("name"),
          optType(o, "returnType"), o.strings("typeParams"), params(o),
          optBody(o), o.flag("async"), o.flag("generator"));
    } else if (kind.equals("VARIABLE")) {
      return new VariableDecl(o.integer("id"), loc(o), o.string("name"),
          optType(o, "type"), optExpr(o, "init"), o.flag("final"),
          o.flag("const"), o.flag("late"));
    }
    throw new IRSchemaException(o.path, "expected a declaration but found " +
                                kind);
  }

  private ClassDecl classDecl(Obj o) throws IRSchemaException {
    Obj sup = o.optObject("superclass");
    List<FieldDecl> fields = new ArrayList<FieldDecl>();
    for (Obj f: o.objects("fields")) {
      expectKind(f, IRSchema.FIELD);
      fields.add(new FieldDecl(f.integer("id"), loc(f), f.string("name"),
          optType(f, "type"), optExpr(f, "init"), f.flag("static"),
          f.flag("final"), f.flag("const"), f.flag("late")));
    }
    String className = o.string("name");
    List<ConstructorDecl> ctors = new ArrayList<ConstructorDecl>();
    for (Obj c: o.objects("constructors")) {
      expectKind(c, IRSchema.CONSTRUCTOR);
      List<ConstructorInit> inits = new ArrayList<ConstructorInit>();
      for (Obj i: c.objects("initializers")) {
        inits.add(initializer(i, loc(c)));
      }
      ctors.add(new ConstructorDecl(c.integer("id"), loc(c),
          c.string("className"), c.optString("name"), params(c), inits,
          optBody(c), c.flag("factory"), c.flag("const")));
    }
    List<MethodDecl> methods = new ArrayList<MethodDecl>();
    for (Obj m: o.objects("methods")) {
      expectKind(m, IRSchema.METHOD);
      methods.add(new MethodDecl(m.integer("id"), loc(m), m.string("name"),
          optType(m, "returnType"), m.strings("typeParams"), params(m),
          optBody(m), m.flag("static"), m.flag("abstract"),
          m.flag("getter"), m.flag("setter"), m.flag("async"),
          m.flag("generator")));
    }
    return new ClassDecl(o.integer("id"), loc(o), className,
        o.strings("typeParams"), sup == null ? null : type(sup),
        types(o, "mixins"), types(o, "interfaces"), o.flag("abstract"),
        fields, ctors, methods);
  }

  private ConstructorInit initializer(Obj o, SourceLocation loc)
      throws IRSchemaException {
    expectKind(o, IRSchema.INIT);
    ConstructorInit.InitKind k = o.enumValue("initKind",
                                         ConstructorInit.InitKind.class);
    switch (k) {
      case FIELD:
        return ConstructorInit.field(loc, o.string("field"),
                                     expr(o.object("value")));
      case SUPER:
        return ConstructorInit.superCall(loc, o.optString("constructor"),
                                         args(o));
      case REDIRECT:
        return ConstructorInit.redirect(loc, o.optString("constructor"),
                                        args(o));
      case ASSERT:
        return ConstructorInit.assertion(loc, expr(o.object("condition")),
                                         optExpr(o, "message"));
      default:
        throw new FJCRuntimeError("Unexpected initializer kind " + k);
    }
  }

  private List<ParameterDecl> params(Obj o) throws IRSchemaException {
    List<ParameterDecl> result = new ArrayList<ParameterDecl>();
    for (Obj p: o.objects("params")) {
      expectKind(p, IRSchema.PARAM);
      result.add(new ParameterDecl(p.integer("id"), loc(p),
          p.string("name"), optType(p, "type"),
          p.enumValue("paramKind", ParamKind.class), p.flag("required"),
          optExpr(p, "default"), p.enumValue("origin", ParamOrigin.class)));
    }
    return result;
  }

  /**
   * A BLOCK node is a block body, any expression an expression body
   */
  private FunctionBody body(Obj o) throws IRSchemaException {
    String kind = kind(o);
    if (kind.equals(StmtKind.BLOCK.name())) {
      return FunctionBody.block(block(o));
    }
    return FunctionBody.expression(expr(o));
  }

  private FunctionBody optBody(Obj o) throws IRSchemaException {
    Obj b = o.optObject("body");
    return b == null ? null : body(b);
  }

  /*
   * Expressions
   */

  private ExprIR optExpr(Obj o, String field) throws IRSchemaException {
    Obj e = o.optObject(field);
    return e == null ? null : expr(e);
  }

  private List<ExprIR> exprs(Obj o, String field) throws IRSchemaException {
    List<ExprIR> result = new ArrayList<ExprIR>();
    for (Obj e: o.objects(field)) {
      result.add(expr(e));
    }
    return result;
  }

  private ArgList args(Obj o) throws IRSchemaException {
    Obj a = o.optObject("args");
    if (a == null) {
      return ArgList.EMPTY;
    }
    List<ExprIR> positional = exprs(a, "positional");
    TreeMap<String, ExprIR> named = new TreeMap<String, ExprIR>();
    Obj n = a.optObject("named");
    if (n != null) {
      for (Map.Entry<String, JsonElement> e: n.json.entrySet()) {
        named.put(e.getKey(), expr(n.object(e.getKey())));
      }
    }
    return new ArgList(positional, named);
  }

  private ExprIR expr(Obj o) throws IRSchemaException {
    String kindName = kind(o);
    ExprKind kind;
    try {
      kind = ExprKind.valueOf(kindName);
    } catch (IllegalArgumentException ex) {
      throw new IRSchemaException(o.path,
                          "expected an expression but found " + kindName);
    }
    int id = o.integer("id");
    SourceLocation loc = loc(o);
    TypeIR type = optType(o, "type");
    switch (kind) {
      case LITERAL:
        return new ExprIR.Literal(id, loc, literal(o));
      case IDENTIFIER:
        return new ExprIR.Identifier(id, loc, type, o.string("name"),
            o.flag("this"), o.flag("super"), o.flag("typeReference"));
      case BINARY:
        return new ExprIR.Binary(id, loc, type, expr(o.object("left")),
            o.string("operator"), expr(o.object("right")));
      case UNARY:
        return new ExprIR.Unary(id, loc, type, o.string("operator"),
            expr(o.object("operand")), o.flag("prefix"));
      case METHOD_CALL:
        return new ExprIR.MethodCall(id, loc, type, optExpr(o, "target"),
            o.string("name"), args(o), types(o, "typeArgs"),
            o.flag("nullAware"), o.flag("cascade"));
      case PROPERTY_ACCESS: {
        ExprIR target = optExpr(o, "target");
        boolean cascade = o.flag("cascade");
        if (target == null && !cascade) {
          throw new IRSchemaException(o.path, "missing required field " +
              "\"target\" of PROPERTY_ACCESS outside a cascade");
        }
        return new ExprIR.PropertyAccess(id, loc, type, target,
            o.string("name"), o.flag("nullAware"), cascade);
      }
      case INDEX_ACCESS:
        return new ExprIR.IndexAccess(id, loc, type, optExpr(o, "target"),
            expr(o.object("index")), o.flag("nullAware"), o.flag("cascade"));
      case CONDITIONAL:
        return new ExprIR.Conditional(id, loc, type,
            expr(o.object("condition")), expr(o.object("then")),
            expr(o.object("else")));
      case FUNCTION_EXPR:
        return new ExprIR.FunctionExpr(id, loc, params(o),
            body(o.object("body")), o.flag("async"), o.flag("generator"),
            new TreeSet<String>(o.strings("captured")));
      case LIST_LITERAL: {
        LiteralKind lk = o.enumValue("literalKind", LiteralKind.class);
        if (lk != LiteralKind.LIST && lk != LiteralKind.SET) {
          throw new IRSchemaException(o.at("literalKind"),
                                      "expected LIST or SET");
        }
        return new ExprIR.ListLiteral(id, loc, lk, exprs(o, "elements"),
            optType(o, "elementType"), o.flag("const"));
      }
      case MAP_LITERAL: {
        List<MapEntryIR> entries = new ArrayList<MapEntryIR>();
        for (Obj e: o.objects("entries")) {
          entries.add(new MapEntryIR(expr(e.object("key")),
                                     expr(e.object("value"))));
        }
        return new ExprIR.MapLiteral(id, loc, entries,
            optType(o, "keyType"), optType(o, "valueType"), o.flag("const"));
      }
      case AWAIT:
        return new ExprIR.Await(id, loc, expr(o.object("expr")));
      case CAST:
        return new ExprIR.Cast(id, loc, expr(o.object("expr")),
                               type(o.object("targetType")));
      case TYPE_CHECK:
        return new ExprIR.TypeCheck(id, loc, expr(o.object("expr")),
            type(o.object("checkedType")), o.flag("negated"));
      case INTERPOLATED_STRING: {
        List<StringPart> parts = new ArrayList<StringPart>();
        for (Obj p: o.objects("parts")) {
          if (p.has("text")) {
            parts.add(StringPart.text(p.string("text")));
          } else {
            parts.add(StringPart.expr(expr(p.object("expr"))));
          }
        }
        return new ExprIR.InterpolatedString(id, loc, parts);
      }
      case ASSIGNMENT: {
        AssignOp op;
        try {
          op = AssignOp.fromSymbol(o.string("op"));
        } catch (FJCRuntimeError ex) {
          throw new IRSchemaException(o.at("op"), ex.getMessage());
        }
        return new ExprIR.Assignment(id, loc, expr(o.object("target")),
                                     expr(o.object("value")), op);
      }
      case CASCADE:
        return new ExprIR.Cascade(id, loc, expr(o.object("target")),
            exprs(o, "sections"), o.flag("nullAware"));
      case INSTANCE_CREATION:
        return new ExprIR.InstanceCreation(id, loc,
            type(o.object("createdType")), o.optString("constructor"),
            args(o), o.flag("const"));
      case INVOCATION:
        return new ExprIR.Invocation(id, loc, expr(o.object("callee")),
                                     args(o), types(o, "typeArgs"));
      case THROW:
        return new ExprIR.Throw(id, loc, expr(o.object("expr")));
      default:
        throw new FJCRuntimeError("Unexpected expression kind " + kind);
    }
  }

  private static LiteralValue literal(Obj o) throws IRSchemaException {
    LiteralKind lk = o.enumValue("literalKind", LiteralKind.class);
    if (lk == LiteralKind.NULL) {
      return LiteralValue.NULL;
    }
    JsonElement v = o.require("value");
    try {
      switch (lk) {
        case STRING:
          return LiteralValue.createString(v.getAsString());
        case INT:
          return LiteralValue.createInt(v.getAsLong());
        case DOUBLE:
          return LiteralValue.createDouble(v.getAsDouble());
        case BOOL:
          return LiteralValue.createBool(v.getAsBoolean());
        default:
          throw new IRSchemaException(o.at("literalKind"),
                                      "not a scalar literal kind: " + lk);
      }
    } catch (NumberFormatException ex) {
      throw new IRSchemaException(o.at("value"), "expected a number");
    } catch (UnsupportedOperationException ex) {
      throw new IRSchemaException(o.at("value"), "expected a " + lk +
                                  " value");
    } catch (IllegalStateException ex) {
      throw new IRSchemaException(o.at("value"), "expected a " + lk +
                                  " value");
    }
  }

  /*
   * Statements
   */

  private Block block(Obj o) throws IRSchemaException {
    expectKind(o, StmtKind.BLOCK.name());
    List<StmtIR> stmts = new ArrayList<StmtIR>();
    for (Obj s: o.objects("statements")) {
      stmts.add(stmt(s));
    }
    return new Block(o.integer("id"), loc(o), stmts);
  }

  private StmtIR optStmt(Obj o, String field) throws IRSchemaException {
    Obj s = o.optObject(field);
    return s == null ? null : stmt(s);
  }

  private Block optBlock(Obj o, String field) throws IRSchemaException {
    Obj s = o.optObject(field);
    return s == null ? null : block(s);
  }

  private StmtIR stmt(Obj o) throws IRSchemaException {
    String kindName = kind(o);
    StmtKind kind;
    try {
      kind = StmtKind.valueOf(kindName);
    } catch (IllegalArgumentException ex) {
      throw new IRSchemaException(o.path,
                          "expected a statement but found " + kindName);
    }
    int id = o.integer("id");
    SourceLocation loc = loc(o);
    switch (kind) {
      case BLOCK:
        return block(o);
      case EXPRESSION:
        return new StmtIR.ExpressionStmt(id, loc, expr(o.object("expr")));
      case VAR_DECL: {
        List<Declarator> decls = new ArrayList<Declarator>();
        for (Obj d: o.objects("declarators")) {
          decls.add(new Declarator(d.string("name"), optExpr(d, "init")));
        }
        if (decls.isEmpty()) {
          throw new IRSchemaException(o.at("declarators"),
                                      "needs at least one declarator");
        }
        Obj t = o.optObject("type");
        return new StmtIR.VarDecl(id, loc, t == null ? null : type(t),
            o.flag("final"), o.flag("const"), o.flag("late"), decls);
      }
      case IF:
        return new StmtIR.If(id, loc, expr(o.object("condition")),
            stmt(o.object("then")), optStmt(o, "else"));
      case FOR:
        return new StmtIR.For(id, loc, optStmt(o, "init"),
            optExpr(o, "condition"), exprs(o, "updates"),
            stmt(o.object("body")));
      case FOR_IN:
        return new StmtIR.ForIn(id, loc, o.string("varName"),
            o.flag("declared"), o.flag("final"),
            expr(o.object("iterable")), stmt(o.object("body")),
            o.flag("await"));
      case WHILE:
        return new StmtIR.While(id, loc, expr(o.object("condition")),
                                stmt(o.object("body")));
      case DO_WHILE:
        return new StmtIR.DoWhile(id, loc, stmt(o.object("body")),
                                  expr(o.object("condition")));
      case SWITCH: {
        List<SwitchCase> cases = new ArrayList<SwitchCase>();
        for (Obj c: o.objects("cases")) {
          List<StmtIR> body = new ArrayList<StmtIR>();
          for (Obj s: c.objects("body")) {
            body.add(stmt(s));
          }
          cases.add(new SwitchCase(exprs(c, "values"), body));
        }
        return new StmtIR.Switch(id, loc, expr(o.object("subject")), cases);
      }
      case RETURN:
        return new StmtIR.Return(id, loc, optExpr(o, "value"));
      case BREAK:
        return new StmtIR.Break(id, loc, o.optString("label"));
      case CONTINUE:
        return new StmtIR.Continue(id, loc, o.optString("label"));
      case TRY: {
        List<CatchClause> catches = new ArrayList<CatchClause>();
        for (Obj c: o.objects("catches")) {
          Obj on = c.optObject("onType");
          catches.add(new CatchClause(on == null ? null : type(on),
              c.optString("exceptionVar"), c.optString("stackVar"),
              block(c.object("body"))));
        }
        return new StmtIR.Try(id, loc, block(o.object("body")), catches,
                              optBlock(o, "finally"));
      }
      case YIELD:
        return new StmtIR.Yield(id, loc, expr(o.object("value")),
                                o.flag("star"));
      case ASSERT:
        return new StmtIR.Assert(id, loc, expr(o.object("condition")),
                                 optExpr(o, "message"));
      default:
        throw new FJCRuntimeError("Unexpected statement kind " + kind);
    }
  }
}
