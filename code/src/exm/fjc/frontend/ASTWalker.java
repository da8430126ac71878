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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.common.exceptions.FJCRuntimeError;
import exm.fjc.ic.tree.ArgList;
import exm.fjc.ic.tree.ClassDecl;
import exm.fjc.ic.tree.ConstructorDecl;
import exm.fjc.ic.tree.ConstructorInit;
import exm.fjc.ic.tree.Declaration;
import exm.fjc.ic.tree.ExprIR;
import exm.fjc.ic.tree.FieldDecl;
import exm.fjc.ic.tree.FunctionBody;
import exm.fjc.ic.tree.FunctionDecl;
import exm.fjc.ic.tree.MethodDecl;
import exm.fjc.ic.tree.ParameterDecl;
import exm.fjc.ic.tree.ParameterDecl.ParamKind;
import exm.fjc.ic.tree.ParameterDecl.ParamOrigin;
import exm.fjc.ic.tree.StmtIR;
import exm.fjc.ic.tree.StmtIR.Block;
import exm.fjc.ic.tree.StmtIR.CatchClause;
import exm.fjc.ic.tree.StmtIR.Declarator;
import exm.fjc.ic.tree.StmtIR.SwitchCase;
import exm.fjc.ic.tree.TypeIR;
import exm.fjc.ic.tree.VariableDecl;

/**
 * This class walks the checked AST and builds the intermediate
 * representation consumed by the code generator.  Declarations whose
 * subtree contains a parse error are skipped: the error was already
 * reported.
 */
public class ASTWalker {

  private static final Logger logger = Logging.getFJCLogger();

  private final ExprWalker exprWalker;

  private int nextId = 1;

  /** Class name to summary of its members, for every class in the unit */
  private final Map<String, ClassSummary> classes =
      new HashMap<String, ClassSummary>();

  public ASTWalker(Diagnostics diagnostics) {
    this.exprWalker = new ExprWalker(this, diagnostics);
  }

  int nextId() {
    return nextId++;
  }

  public List<Declaration> walk(WidgetAST unit) {
    assert(unit.getType() == ASTType.COMPILATION_UNIT);
    summarizeClasses(unit);
    List<Declaration> result = new ArrayList<Declaration>();
    for (WidgetAST decl: unit.children()) {
      if (decl.getType() == ASTType.IMPORT ||
          decl.getType() == ASTType.EXPORT) {
        continue;
      }
      if (decl.containsError()) {
        LogHelper.debug(0, decl.getLocation(), "skipping " + decl.getType() +
                        " " + decl.getText() + " with errors");
        continue;
      }
      switch (decl.getType()) {
        case CLASS_DECL:
          result.add(classDecl(decl));
          break;
        case FUNCTION_DECL:
          result.add(functionDecl(decl));
          break;
        case TOP_LEVEL_VAR:
          result.addAll(topLevelVars(decl));
          break;
        default:
          throw new FJCRuntimeError("Unexpected top-level " +
                                    decl.getType());
      }
    }
    logger.debug("Built IR for " + result.size() + " declarations");
    return result;
  }

  /*
   * Class member summaries
   */

  private static class ClassSummary {
    final String superclass;
    final Set<String> instanceMembers = new HashSet<String>();
    final Set<String> staticMembers = new HashSet<String>();
    final Set<String> namedConstructors = new HashSet<String>();

    ClassSummary(String superclass) {
      this.superclass = superclass;
    }
  }

  private void summarizeClasses(WidgetAST unit) {
    for (WidgetAST decl: unit.children()) {
      if (decl.getType() != ASTType.CLASS_DECL) {
        continue;
      }
      ClassSummary s = new ClassSummary(ASTUtil.superclassName(decl));
      for (WidgetAST m: ASTUtil.members(decl)) {
        boolean isStatic = m.hasFlag(ASTFlag.STATIC);
        switch (m.getType()) {
          case FIELD_DECL:
            for (WidgetAST v: m.children(2)) {
              (isStatic ? s.staticMembers : s.instanceMembers).add(
                                                           v.getText());
            }
            break;
          case METHOD_DECL:
            (isStatic ? s.staticMembers : s.instanceMembers).add(m.getText());
            break;
          case CONSTRUCTOR_DECL:
            if (!m.getText().isEmpty()) {
              s.namedConstructors.add(m.getText());
            }
            break;
          default:
            break;
        }
      }
      if (!classes.containsKey(decl.getText())) {
        classes.put(decl.getText(), s);
      }
    }
  }

  /**
   * Members visible by bare name in class: its own, those of superclasses
   * declared in this unit, and framework members if the chain reaches an
   * external superclass.
   */
  private MemberContext memberContext(String className) {
    Set<String> instance = new HashSet<String>();
    Set<String> statics = new HashSet<String>(
                              classes.get(className).staticMembers);
    Set<String> visited = new HashSet<String>();
    String current = className;
    while (current != null && visited.add(current)) {
      ClassSummary s = classes.get(current);
      if (s == null) {
        instance.addAll(MemberContext.FRAMEWORK_MEMBERS);
        break;
      }
      instance.addAll(s.instanceMembers);
      current = s.superclass;
    }
    return new MemberContext(className, false, instance, statics);
  }

  boolean isNamedConstructor(String className, String name) {
    ClassSummary s = classes.get(className);
    return s != null && s.namedConstructors.contains(name);
  }

  /*
   * Types
   */

  /**
   * @return the type, or null for a NONE placeholder
   */
  TypeIR type(WidgetAST t) {
    if (t.isNone()) {
      return null;
    }
    assert(t.getType() == ASTType.TYPE) : t;
    List<TypeIR> args;
    if (t.childCount() > 0) {
      args = typeArgs(t.child(0));
    } else {
      args = ImmutableList.of();
    }
    return new TypeIR(t.getText(), args, t.hasFlag(ASTFlag.NULLABLE));
  }

  List<TypeIR> typeArgs(WidgetAST typeArgs) {
    List<TypeIR> result = new ArrayList<TypeIR>();
    for (WidgetAST t: typeArgs.children()) {
      result.add(type(t));
    }
    return result;
  }

  private static List<String> typeParams(WidgetAST typeParams) {
    List<String> result = new ArrayList<String>();
    for (WidgetAST p: typeParams.children()) {
      result.add(p.getText());
    }
    return result;
  }

  private List<TypeIR> types(WidgetAST list) {
    List<TypeIR> result = new ArrayList<TypeIR>();
    for (WidgetAST t: list.children()) {
      result.add(type(t));
    }
    return result;
  }

  /*
   * Declarations
   */

  private ClassDecl classDecl(WidgetAST c) {
    String name = c.getText();
    LogHelper.trace(0, c.getLocation(), "class " + name);
    MemberContext members = memberContext(name);
    WidgetAST superclassNode = c.child(1);
    TypeIR superclass = superclassNode.childCount() == 0 ? null :
                                 type(superclassNode.child(0));

    List<FieldDecl> fields = new ArrayList<FieldDecl>();
    List<ConstructorDecl> ctors = new ArrayList<ConstructorDecl>();
    List<MethodDecl> methods = new ArrayList<MethodDecl>();
    for (WidgetAST m: ASTUtil.members(c)) {
      switch (m.getType()) {
        case FIELD_DECL:
          fields.addAll(fieldDecls(m, members));
          break;
        case METHOD_DECL:
          methods.add(methodDecl(m, members));
          break;
        case CONSTRUCTOR_DECL:
          ctors.add(constructorDecl(name, m, members));
          break;
        default:
          throw new FJCRuntimeError("Unexpected class member " + m.getType());
      }
    }
    return new ClassDecl(nextId(), c.getLocation(), name,
        typeParams(c.child(0)), superclass, types(c.child(2)),
        types(c.child(3)), c.hasFlag(ASTFlag.ABSTRACT), fields, ctors,
        methods);
  }

  private List<FieldDecl> fieldDecls(WidgetAST f, MemberContext members) {
    boolean isStatic = f.hasFlag(ASTFlag.STATIC);
    boolean isLate = f.hasFlag(ASTFlag.LATE);
    TypeIR t = type(f.child(0));
    // Only late instance fields may refer to this in their initializer
    Scope scope = Scope.root(members.withStatic(isStatic || !isLate));
    List<FieldDecl> result = new ArrayList<FieldDecl>();
    for (WidgetAST v: f.children(2)) {
      ExprIR init = v.childCount() == 0 ? null :
                              exprWalker.walk(v.child(0), scope);
      result.add(new FieldDecl(nextId(), v.getLocation(), v.getText(),
          inferred(t, init), init, isStatic, f.hasFlag(ASTFlag.FINAL),
          f.hasFlag(ASTFlag.CONST), isLate));
    }
    return result;
  }

  private MethodDecl methodDecl(WidgetAST m, MemberContext members) {
    LogHelper.trace(2, m.getLocation(), "method " + m.getText());
    boolean isStatic = m.hasFlag(ASTFlag.STATIC);
    Scope scope = Scope.root(members.withStatic(isStatic));
    List<ParameterDecl> params = params(m.child(2), scope);
    WidgetAST bodyAST = m.child(4);
    FunctionBody body = bodyAST.isNone() ? null : body(bodyAST, scope);
    boolean isAbstract = bodyAST.isNone() &&
                         !m.hasFlag(ASTFlag.EXTERNAL);
    return new MethodDecl(nextId(), m.getLocation(), m.getText(),
        type(m.child(0)), typeParams(m.child(1)), params, body, isStatic,
        isAbstract, m.hasFlag(ASTFlag.GETTER), m.hasFlag(ASTFlag.SETTER),
        m.hasFlag(ASTFlag.ASYNC), m.hasFlag(ASTFlag.GENERATOR));
  }

  private ConstructorDecl constructorDecl(String className, WidgetAST c,
                                          MemberContext members) {
    String ctorName = c.getText().isEmpty() ? null : c.getText();
    LogHelper.trace(2, c.getLocation(), "constructor " + className +
                    (ctorName == null ? "" : "." + ctorName));
    boolean isFactory = c.hasFlag(ASTFlag.FACTORY);
    Scope scope = Scope.root(members.withStatic(isFactory));
    List<ParameterDecl> params = params(c.child(0), scope);

    // this.x and super.x parameters are only locals in initializers
    Scope initScope = scope.block();
    for (ParameterDecl p: params) {
      if (p.getOrigin() != ParamOrigin.NORMAL) {
        initScope.declare(p.getName(), p.getType());
      }
    }
    List<ConstructorInit> inits = new ArrayList<ConstructorInit>();
    for (WidgetAST init: c.child(1).children()) {
      inits.add(initializer(init, initScope));
    }

    WidgetAST bodyAST = c.child(3);
    FunctionBody body = null;
    if (!bodyAST.isNone()) {
      Scope bodyScope = bodyAST.getType() == ASTType.EXPR_BODY ?
                              initScope : scope;
      body = body(bodyAST, bodyScope);
    }
    return new ConstructorDecl(nextId(), c.getLocation(), className,
        ctorName, params, inits, body, isFactory, c.hasFlag(ASTFlag.CONST));
  }

  private ConstructorInit initializer(WidgetAST init, Scope scope) {
    SourceLocation loc = init.getLocation();
    String name = init.getText().isEmpty() ? null : init.getText();
    switch (init.getType()) {
      case FIELD_INIT:
        return ConstructorInit.field(loc, init.getText(),
                                     exprWalker.walk(init.child(0), scope));
      case SUPER_INIT:
        return ConstructorInit.superCall(loc, name,
                                   exprWalker.args(init.child(0), scope));
      case REDIRECT_INIT:
        return ConstructorInit.redirect(loc, name,
                                   exprWalker.args(init.child(0), scope));
      case ASSERT_INIT: {
        ArgList args = exprWalker.args(init.child(0), scope);
        return ConstructorInit.assertion(loc, args.getPositional().get(0),
            args.size() > 1 ? args.getPositional().get(1) : null);
      }
      default:
        throw new FJCRuntimeError("Unexpected initializer " + init.getType());
    }
  }

  private FunctionDecl functionDecl(WidgetAST f) {
    LogHelper.trace(0, f.getLocation(), "function " + f.getText());
    Scope scope = Scope.root(null);
    List<ParameterDecl> params = params(f.child(2), scope);
    WidgetAST bodyAST = f.child(4);
    FunctionBody body = bodyAST.isNone() ? null : body(bodyAST, scope);
    return new FunctionDecl(nextId(), f.getLocation(), f.getText(),
        type(f.child(0)), typeParams(f.child(1)), params, body,
        f.hasFlag(ASTFlag.ASYNC), f.hasFlag(ASTFlag.GENERATOR));
  }

  private List<VariableDecl> topLevelVars(WidgetAST decl) {
    TypeIR t = type(decl.child(0));
    Scope scope = Scope.root(null);
    List<VariableDecl> result = new ArrayList<VariableDecl>();
    for (WidgetAST v: decl.children(2)) {
      ExprIR init = v.childCount() == 0 ? null :
                            exprWalker.walk(v.child(0), scope);
      result.add(new VariableDecl(nextId(), v.getLocation(), v.getText(),
          inferred(t, init), init, decl.hasFlag(ASTFlag.FINAL),
          decl.hasFlag(ASTFlag.CONST), decl.hasFlag(ASTFlag.LATE)));
    }
    return result;
  }

  private static TypeIR inferred(TypeIR declared, ExprIR init) {
    if (declared != null) {
      return declared;
    }
    return init == null ? TypeIR.DYNAMIC : init.getType();
  }

  /**
   * Build parameters and declare them in scope.  Defaults are evaluated
   * outside the function.
   */
  List<ParameterDecl> params(WidgetAST params, Scope scope) {
    List<ParameterDecl> result = new ArrayList<ParameterDecl>();
    for (WidgetAST p: params.children()) {
      ParamKind kind;
      if (p.hasFlag(ASTFlag.NAMED)) {
        kind = ParamKind.NAMED;
      } else if (p.hasFlag(ASTFlag.OPTIONAL)) {
        kind = ParamKind.OPTIONAL_POSITIONAL;
      } else {
        kind = ParamKind.REQUIRED_POSITIONAL;
      }
      ParamOrigin origin = ParamOrigin.NORMAL;
      if (p.hasFlag(ASTFlag.FIELD_PARAM)) {
        origin = ParamOrigin.FIELD;
      } else if (p.hasFlag(ASTFlag.SUPER_PARAM)) {
        origin = ParamOrigin.SUPER;
      }
      ExprIR dflt = p.child(1).isNone() ? null :
                    exprWalker.walk(p.child(1), scope);
      TypeIR t = type(p.child(0));
      result.add(new ParameterDecl(nextId(), p.getLocation(), p.getText(), t,
          kind, p.hasFlag(ASTFlag.REQUIRED), dflt, origin));
    }
    for (ParameterDecl p: result) {
      if (p.getOrigin() == ParamOrigin.NORMAL) {
        scope.declare(p.getName(), p.getType());
      }
    }
    return result;
  }

  FunctionBody body(WidgetAST body, Scope scope) {
    if (body.getType() == ASTType.EXPR_BODY) {
      return FunctionBody.expression(exprWalker.walk(body.child(0), scope));
    }
    return FunctionBody.block(block(body, scope.block()));
  }

  /*
   * Statements
   */

  private Block block(WidgetAST b, Scope scope) {
    assert(b.getType() == ASTType.BLOCK) : b;
    List<StmtIR> stmts = new ArrayList<StmtIR>();
    for (WidgetAST s: b.children()) {
      StmtIR st = statement(s, scope);
      if (st != null) {
        stmts.add(st);
      }
    }
    return new Block(nextId(), b.getLocation(), stmts);
  }

  /** Statement in its own scope, never null */
  private StmtIR nested(WidgetAST s, Scope scope) {
    StmtIR st = statement(s, scope.block());
    if (st == null) {
      return new Block(nextId(), s.getLocation(),
                       ImmutableList.<StmtIR>of());
    }
    return st;
  }

  /**
   * @return the statement, or null for an empty statement
   */
  private StmtIR statement(WidgetAST s, Scope scope) {
    SourceLocation loc = s.getLocation();
    switch (s.getType()) {
      case EMPTY_STMT:
        return null;
      case BLOCK:
        return block(s, scope.block());
      case EXPR_STMT:
        return new StmtIR.ExpressionStmt(nextId(), loc,
                                   exprWalker.walk(s.child(0), scope));
      case VAR_DECL_STMT:
        return varDecl(s, scope);
      case IF: {
        ExprIR cond = exprWalker.walk(s.child(0), scope);
        StmtIR then = nested(s.child(1), scope);
        StmtIR els = s.child(2).isNone() ? null :
                              nested(s.child(2), scope);
        return new StmtIR.If(nextId(), loc, cond, then, els);
      }
      case FOR: {
        Scope forScope = scope.block();
        StmtIR init = s.child(0).isNone() ? null :
                                statement(s.child(0), forScope);
        ExprIR cond = exprWalker.walkOptional(s.child(1), forScope);
        List<ExprIR> updates = exprWalker.walkAll(s.child(2).children(),
                                                  forScope);
        return new StmtIR.For(nextId(), loc, init, cond, updates,
                              nested(s.child(3), forScope));
      }
      case FOR_IN:
        return forIn(s, scope);
      case WHILE:
        return new StmtIR.While(nextId(), loc,
            exprWalker.walk(s.child(0), scope), nested(s.child(1), scope));
      case DO_WHILE: {
        StmtIR b = nested(s.child(0), scope);
        return new StmtIR.DoWhile(nextId(), loc, b,
                                  exprWalker.walk(s.child(1), scope));
      }
      case SWITCH:
        return switchStmt(s, scope);
      case RETURN:
        return new StmtIR.Return(nextId(), loc,
                                 exprWalker.walkOptional(s.child(0), scope));
      case BREAK:
        return new StmtIR.Break(nextId(), loc, label(s));
      case CONTINUE:
        return new StmtIR.Continue(nextId(), loc, label(s));
      case TRY:
        return tryStmt(s, scope);
      case YIELD:
        return new StmtIR.Yield(nextId(), loc,
            exprWalker.walk(s.child(0), scope), s.hasFlag(ASTFlag.STAR));
      case ASSERT: {
        ArgList args = exprWalker.args(s.child(0), scope);
        return new StmtIR.Assert(nextId(), loc, args.getPositional().get(0),
            args.size() > 1 ? args.getPositional().get(1) : null);
      }
      default:
        throw new FJCRuntimeError("Unexpected statement " + s.getType() +
                                  " at " + loc);
    }
  }

  private static void warnIfShadowsMember(WidgetAST var, Scope scope) {
    MemberContext members = scope.getMembers();
    String name = var.getText();
    if (members != null && (members.isInstanceMember(name) ||
                            members.isStaticMember(name))) {
      LogHelper.uniqueWarn(var.getLocation(), "Local variable " + name +
          " shadows a member of " + members.getClassName());
    }
  }

  private static String label(WidgetAST s) {
    return s.getText().isEmpty() ? null : s.getText();
  }

  private StmtIR varDecl(WidgetAST s, Scope scope) {
    TypeIR t = type(s.child(0));
    List<Declarator> decls = new ArrayList<Declarator>();
    for (WidgetAST v: s.children(1)) {
      ExprIR init = null;
      if (v.childCount() > 0) {
        WidgetAST initAST = v.child(0);
        if (initAST.getType() == ASTType.FUNCTION_EXPR) {
          // Local functions may call themselves
          scope.declare(v.getText(), TypeIR.FUNCTION);
        }
        init = exprWalker.walk(initAST, scope);
      }
      warnIfShadowsMember(v, scope);
      scope.declare(v.getText(), inferred(t, init));
      decls.add(new Declarator(v.getText(), init));
    }
    return new StmtIR.VarDecl(nextId(), s.getLocation(), t,
        s.hasFlag(ASTFlag.FINAL), s.hasFlag(ASTFlag.CONST),
        s.hasFlag(ASTFlag.LATE), decls);
  }

  private StmtIR forIn(WidgetAST s, Scope scope) {
    Scope loopScope = scope.block();
    WidgetAST init = s.child(0);
    ExprIR iterable = exprWalker.walk(s.child(1), scope);
    String varName;
    boolean declared;
    boolean isFinal = false;
    if (init.getType() == ASTType.VAR_DECL_STMT) {
      WidgetAST v = init.child(1);
      varName = v.getText();
      declared = true;
      isFinal = init.hasFlag(ASTFlag.FINAL);
      loopScope.declare(varName, type(init.child(0)));
    } else {
      varName = init.getText();
      declared = false;
    }
    return new StmtIR.ForIn(nextId(), s.getLocation(), varName, declared,
        isFinal, iterable, nested(s.child(2), loopScope),
        s.hasFlag(ASTFlag.ASYNC));
  }

  private StmtIR switchStmt(WidgetAST s, Scope scope) {
    ExprIR subject = exprWalker.walk(s.child(0), scope);
    List<SwitchCase> cases = new ArrayList<SwitchCase>();
    for (WidgetAST c: s.children(1)) {
      List<ExprIR> values = exprWalker.walkAll(c.child(0).children(), scope);
      Block b = block(c.child(1), scope.block());
      cases.add(new SwitchCase(values, b.getStatements()));
    }
    return new StmtIR.Switch(nextId(), s.getLocation(), subject, cases);
  }

  private StmtIR tryStmt(WidgetAST s, Scope scope) {
    Block body = block(s.child(0), scope.block());
    List<CatchClause> catches = new ArrayList<CatchClause>();
    Block finallyBlock = null;
    for (WidgetAST c: s.children(1)) {
      if (c.getType() == ASTType.CATCH_CLAUSE) {
        Scope catchScope = scope.block();
        String exVar = c.child(1).isNone() ? null : c.child(1).getText();
        String stackVar = c.child(2).isNone() ? null : c.child(2).getText();
        TypeIR onType = type(c.child(0));
        if (exVar != null) {
          catchScope.declare(exVar, onType);
        }
        if (stackVar != null) {
          catchScope.declare(stackVar, new TypeIR("StackTrace"));
        }
        catches.add(new CatchClause(onType, exVar, stackVar,
                                    block(c.child(3), catchScope)));
      } else if (!c.isNone()) {
        finallyBlock = block(c, scope.block());
      }
    }
    return new StmtIR.Try(nextId(), s.getLocation(), body, catches,
                          finallyBlock);
  }
}
