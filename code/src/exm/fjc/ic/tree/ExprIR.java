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
package exm.fjc.ic.tree;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * Expression IR.  The set of kinds is closed: each kind is a nested class
 * here and has a method in {@link ExprVisitor}.  Every expression has a
 * non-null result type, dynamic when nothing better is known.
 */
public abstract class ExprIR extends IRNode {
  private final TypeIR type;

  protected ExprIR(int id, SourceLocation location, TypeIR type) {
    super(id, location);
    if (type == null) {
      throw new FJCRuntimeError("Expression without type at " + location);
    }
    this.type = type;
  }

  public TypeIR getType() {
    return type;
  }

  public abstract ExprKind getKind();

  public abstract <R, X extends Exception> R accept(ExprVisitor<R, X> v)
      throws X;

  @Override
  public String kindName() {
    return getKind().name();
  }

  public static class Literal extends ExprIR {
    private final LiteralValue value;

    public Literal(int id, SourceLocation loc, LiteralValue value) {
      super(id, loc, value.getType());
      this.value = value;
    }

    public LiteralValue getValue() {
      return value;
    }

    public LiteralKind getLiteralKind() {
      return value.getKind();
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.LITERAL;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitLiteral(this);
    }
  }

  public static class Identifier extends ExprIR {
    private final String name;
    private final boolean isThis;
    private final boolean isSuper;
    private final boolean isTypeReference;

    public Identifier(int id, SourceLocation loc, TypeIR type, String name,
        boolean isThis, boolean isSuper, boolean isTypeReference) {
      super(id, loc, type);
      this.name = name;
      this.isThis = isThis;
      this.isSuper = isSuper;
      this.isTypeReference = isTypeReference;
    }

    public String getName() {
      return name;
    }

    public boolean isThis() {
      return isThis;
    }

    public boolean isSuper() {
      return isSuper;
    }

    public boolean isTypeReference() {
      return isTypeReference;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.IDENTIFIER;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitIdentifier(this);
    }
  }

  public static class Binary extends ExprIR {
    private final ExprIR left;
    private final String operator;
    private final ExprIR right;

    public Binary(int id, SourceLocation loc, TypeIR type, ExprIR left,
                  String operator, ExprIR right) {
      super(id, loc, type);
      this.left = left;
      this.operator = operator;
      this.right = right;
    }

    public ExprIR getLeft() {
      return left;
    }

    public String getOperator() {
      return operator;
    }

    public ExprIR getRight() {
      return right;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.BINARY;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitBinary(this);
    }
  }

  public static class Unary extends ExprIR {
    private final String operator;
    private final ExprIR operand;
    private final boolean prefix;

    public Unary(int id, SourceLocation loc, TypeIR type, String operator,
                 ExprIR operand, boolean prefix) {
      super(id, loc, type);
      this.operator = operator;
      this.operand = operand;
      this.prefix = prefix;
    }

    public String getOperator() {
      return operator;
    }

    public ExprIR getOperand() {
      return operand;
    }

    public boolean isPrefix() {
      return prefix;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.UNARY;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitUnary(this);
    }
  }

  /**
   * Method or function call by name.  A null target means an unqualified
   * call, or the cascade receiver if the cascade flag is set.
   */
  public static class MethodCall extends ExprIR {
    private final ExprIR target;
    private final String name;
    private final ArgList args;
    private final List<TypeIR> typeArgs;
    private final boolean nullAware;
    private final boolean cascade;

    public MethodCall(int id, SourceLocation loc, TypeIR type, ExprIR target,
        String name, ArgList args, List<TypeIR> typeArgs, boolean nullAware,
        boolean cascade) {
      super(id, loc, type);
      this.target = target;
      this.name = name;
      this.args = args;
      this.typeArgs = ImmutableList.copyOf(typeArgs);
      this.nullAware = nullAware;
      this.cascade = cascade;
    }

    public ExprIR getTarget() {
      return target;
    }

    public String getName() {
      return name;
    }

    public ArgList getArgs() {
      return args;
    }

    public List<TypeIR> getTypeArgs() {
      return typeArgs;
    }

    public boolean isNullAware() {
      return nullAware;
    }

    public boolean isCascade() {
      return cascade;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.METHOD_CALL;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitMethodCall(this);
    }
  }

  /**
   * target.name.  A null target with the cascade flag is the cascade
   * receiver.
   */
  public static class PropertyAccess extends ExprIR {
    private final ExprIR target;
    private final String name;
    private final boolean nullAware;
    private final boolean cascade;

    public PropertyAccess(int id, SourceLocation loc, TypeIR type,
        ExprIR target, String name, boolean nullAware, boolean cascade) {
      super(id, loc, type);
      assert(target != null || cascade);
      this.target = target;
      this.name = name;
      this.nullAware = nullAware;
      this.cascade = cascade;
    }

    public ExprIR getTarget() {
      return target;
    }

    public String getName() {
      return name;
    }

    public boolean isNullAware() {
      return nullAware;
    }

    public boolean isCascade() {
      return cascade;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.PROPERTY_ACCESS;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitPropertyAccess(this);
    }
  }

  public static class IndexAccess extends ExprIR {
    private final ExprIR target;
    private final ExprIR index;
    private final boolean nullAware;
    private final boolean cascade;

    public IndexAccess(int id, SourceLocation loc, TypeIR type,
        ExprIR target, ExprIR index, boolean nullAware, boolean cascade) {
      super(id, loc, type);
      assert(target != null || cascade);
      this.target = target;
      this.index = index;
      this.nullAware = nullAware;
      this.cascade = cascade;
    }

    public ExprIR getTarget() {
      return target;
    }

    public ExprIR getIndex() {
      return index;
    }

    public boolean isNullAware() {
      return nullAware;
    }

    public boolean isCascade() {
      return cascade;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.INDEX_ACCESS;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitIndexAccess(this);
    }
  }

  public static class Conditional extends ExprIR {
    private final ExprIR condition;
    private final ExprIR thenExpr;
    private final ExprIR elseExpr;

    public Conditional(int id, SourceLocation loc, TypeIR type,
        ExprIR condition, ExprIR thenExpr, ExprIR elseExpr) {
      super(id, loc, type);
      this.condition = condition;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    public ExprIR getCondition() {
      return condition;
    }

    public ExprIR getThen() {
      return thenExpr;
    }

    public ExprIR getElse() {
      return elseExpr;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.CONDITIONAL;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitConditional(this);
    }
  }

  /**
   * Anonymous function.  Captured variables are the free names of the
   * body, computed syntactically.
   */
  public static class FunctionExpr extends ExprIR {
    private final List<ParameterDecl> params;
    private final FunctionBody body;
    private final boolean async;
    private final boolean generator;
    private final Set<String> captured;

    public FunctionExpr(int id, SourceLocation loc, List<ParameterDecl> params,
        FunctionBody body, boolean async, boolean generator,
        Set<String> captured) {
      super(id, loc, TypeIR.FUNCTION);
      this.params = ImmutableList.copyOf(params);
      this.body = body;
      this.async = async;
      this.generator = generator;
      this.captured = ImmutableSortedSet.copyOf(captured);
    }

    public List<ParameterDecl> getParams() {
      return params;
    }

    public FunctionBody getBody() {
      return body;
    }

    public boolean isAsync() {
      return async;
    }

    public boolean isGenerator() {
      return generator;
    }

    public Set<String> getCaptured() {
      return captured;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.FUNCTION_EXPR;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitFunctionExpr(this);
    }
  }

  /**
   * List or set literal; the literal kind says which.
   */
  public static class ListLiteral extends ExprIR {
    private final LiteralKind literalKind;
    private final List<ExprIR> elements;
    private final TypeIR elementType;
    private final boolean isConst;

    public ListLiteral(int id, SourceLocation loc, LiteralKind literalKind,
        List<ExprIR> elements, TypeIR elementType, boolean isConst) {
      super(id, loc, TypeIR.generic(
            literalKind == LiteralKind.SET ? "Set" : "List", elementType));
      assert(literalKind == LiteralKind.LIST || literalKind == LiteralKind.SET);
      this.literalKind = literalKind;
      this.elements = ImmutableList.copyOf(elements);
      this.elementType = elementType;
      this.isConst = isConst;
    }

    public LiteralKind getLiteralKind() {
      return literalKind;
    }

    public List<ExprIR> getElements() {
      return elements;
    }

    public TypeIR getElementType() {
      return elementType;
    }

    public boolean isConst() {
      return isConst;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.LIST_LITERAL;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitListLiteral(this);
    }
  }

  public static class MapEntryIR {
    private final ExprIR key;
    private final ExprIR value;

    public MapEntryIR(ExprIR key, ExprIR value) {
      this.key = key;
      this.value = value;
    }

    public ExprIR getKey() {
      return key;
    }

    public ExprIR getValue() {
      return value;
    }
  }

  public static class MapLiteral extends ExprIR {
    private final List<MapEntryIR> entries;
    private final TypeIR keyType;
    private final TypeIR valueType;
    private final boolean isConst;

    public MapLiteral(int id, SourceLocation loc, List<MapEntryIR> entries,
        TypeIR keyType, TypeIR valueType, boolean isConst) {
      super(id, loc, TypeIR.generic("Map", keyType, valueType));
      this.entries = ImmutableList.copyOf(entries);
      this.keyType = keyType;
      this.valueType = valueType;
      this.isConst = isConst;
    }

    public LiteralKind getLiteralKind() {
      return LiteralKind.MAP;
    }

    public List<MapEntryIR> getEntries() {
      return entries;
    }

    public TypeIR getKeyType() {
      return keyType;
    }

    public TypeIR getValueType() {
      return valueType;
    }

    public boolean isConst() {
      return isConst;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.MAP_LITERAL;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitMapLiteral(this);
    }
  }

  public static class Await extends ExprIR {
    private final ExprIR expr;

    public Await(int id, SourceLocation loc, ExprIR expr) {
      super(id, loc, TypeIR.DYNAMIC);
      this.expr = expr;
    }

    public ExprIR getExpr() {
      return expr;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.AWAIT;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitAwait(this);
    }
  }

  /** expr as T */
  public static class Cast extends ExprIR {
    private final ExprIR expr;

    public Cast(int id, SourceLocation loc, ExprIR expr, TypeIR target) {
      super(id, loc, target);
      this.expr = expr;
    }

    public ExprIR getExpr() {
      return expr;
    }

    public TypeIR getTargetType() {
      return getType();
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.CAST;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitCast(this);
    }
  }

  /** expr is T, or expr is! T when negated */
  public static class TypeCheck extends ExprIR {
    private final ExprIR expr;
    private final TypeIR checkedType;
    private final boolean negated;

    public TypeCheck(int id, SourceLocation loc, ExprIR expr,
                     TypeIR checkedType, boolean negated) {
      super(id, loc, TypeIR.BOOL);
      this.expr = expr;
      this.checkedType = checkedType;
      this.negated = negated;
    }

    public ExprIR getExpr() {
      return expr;
    }

    public TypeIR getCheckedType() {
      return checkedType;
    }

    public boolean isNegated() {
      return negated;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.TYPE_CHECK;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitTypeCheck(this);
    }
  }

  /**
   * One piece of an interpolated string: literal text or an expression.
   */
  public static class StringPart {
    private final String text;
    private final ExprIR expr;

    private StringPart(String text, ExprIR expr) {
      this.text = text;
      this.expr = expr;
    }

    public static StringPart text(String text) {
      return new StringPart(text, null);
    }

    public static StringPart expr(ExprIR expr) {
      return new StringPart(null, expr);
    }

    public boolean isText() {
      return text != null;
    }

    public String getText() {
      if (text == null) {
        throw new FJCRuntimeError("getText for expression part");
      }
      return text;
    }

    public ExprIR getExpr() {
      if (expr == null) {
        throw new FJCRuntimeError("getExpr for text part");
      }
      return expr;
    }
  }

  public static class InterpolatedString extends ExprIR {
    private final List<StringPart> parts;

    public InterpolatedString(int id, SourceLocation loc,
                              List<StringPart> parts) {
      super(id, loc, TypeIR.STRING);
      this.parts = ImmutableList.copyOf(parts);
    }

    public List<StringPart> getParts() {
      return parts;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.INTERPOLATED_STRING;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitInterpolatedString(this);
    }
  }

  public static class Assignment extends ExprIR {
    private final ExprIR target;
    private final ExprIR value;
    private final AssignOp op;

    public Assignment(int id, SourceLocation loc, ExprIR target, ExprIR value,
                      AssignOp op) {
      super(id, loc, value.getType());
      this.target = target;
      this.value = value;
      this.op = op;
    }

    public ExprIR getTarget() {
      return target;
    }

    public ExprIR getValue() {
      return value;
    }

    public AssignOp getOp() {
      return op;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.ASSIGNMENT;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitAssignment(this);
    }
  }

  /**
   * target..a()..b = 1.  Sections refer to the target through a null
   * target with the cascade flag set.  The value is the target.
   */
  public static class Cascade extends ExprIR {
    private final ExprIR target;
    private final List<ExprIR> sections;
    private final boolean nullAware;

    public Cascade(int id, SourceLocation loc, ExprIR target,
                   List<ExprIR> sections, boolean nullAware) {
      super(id, loc, target.getType());
      this.target = target;
      this.sections = ImmutableList.copyOf(sections);
      this.nullAware = nullAware;
    }

    public ExprIR getTarget() {
      return target;
    }

    public List<ExprIR> getSections() {
      return sections;
    }

    public boolean isNullAware() {
      return nullAware;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.CASCADE;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitCascade(this);
    }
  }

  /**
   * Constructor call, with or without new/const.  A null constructor name
   * means the unnamed constructor.
   */
  public static class InstanceCreation extends ExprIR {
    private final String constructorName;
    private final ArgList args;
    private final boolean isConst;

    public InstanceCreation(int id, SourceLocation loc, TypeIR type,
        String constructorName, ArgList args, boolean isConst) {
      super(id, loc, type);
      this.constructorName = constructorName;
      this.args = args;
      this.isConst = isConst;
    }

    public TypeIR getCreatedType() {
      return getType();
    }

    public String getConstructorName() {
      return constructorName;
    }

    public ArgList getArgs() {
      return args;
    }

    public boolean isConst() {
      return isConst;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.INSTANCE_CREATION;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitInstanceCreation(this);
    }
  }

  /** Call of a computed function value: f()(x) */
  public static class Invocation extends ExprIR {
    private final ExprIR callee;
    private final ArgList args;
    private final List<TypeIR> typeArgs;

    public Invocation(int id, SourceLocation loc, ExprIR callee, ArgList args,
                      List<TypeIR> typeArgs) {
      super(id, loc, TypeIR.DYNAMIC);
      this.callee = callee;
      this.args = args;
      this.typeArgs = ImmutableList.copyOf(typeArgs);
    }

    public ExprIR getCallee() {
      return callee;
    }

    public ArgList getArgs() {
      return args;
    }

    public List<TypeIR> getTypeArgs() {
      return typeArgs;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.INVOCATION;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitInvocation(this);
    }
  }

  public static class Throw extends ExprIR {
    private final ExprIR expr;

    public Throw(int id, SourceLocation loc, ExprIR expr) {
      super(id, loc, TypeIR.DYNAMIC);
      this.expr = expr;
    }

    public ExprIR getExpr() {
      return expr;
    }

    @Override
    public ExprKind getKind() {
      return ExprKind.THROW;
    }

    @Override
    public <R, X extends Exception> R accept(ExprVisitor<R, X> v) throws X {
      return v.visitThrow(this);
    }
  }
}
