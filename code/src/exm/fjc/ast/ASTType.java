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
package exm.fjc.ast;

/**
 * Node types of the syntax tree.  Child layouts are fixed per type; slots
 * that may be absent hold a {@link #NONE} node so that positions never
 * shift.  Layouts are given as [child0, child1, ...].
 */
public enum ASTType {
  /** [decl*] */
  COMPILATION_UNIT,
  /** text=uri; [IMPORT_ITEM | IMPORT_ALIAS | IMPORT_DEFAULT | IMPORT_HIDE]* */
  IMPORT,
  /** text=imported name; [IDENTIFIER alias]? */
  IMPORT_ITEM,
  /** text=namespace prefix */
  IMPORT_ALIAS,
  /** text=local name of default import */
  IMPORT_DEFAULT,
  /** text=hidden name */
  IMPORT_HIDE,
  /** text=uri */
  EXPORT,
  /** [ANNOTATION*] */
  METADATA,
  /** text=name; [ARGUMENTS | NONE] */
  ANNOTATION,
  /** text=name; [TYPE_PARAMS, SUPERCLASS, MIXINS, INTERFACES, METADATA,
   * CLASS_BODY] */
  CLASS_DECL,
  /** [TYPE_PARAM*] */
  TYPE_PARAMS,
  /** text=name; [TYPE bound | NONE] */
  TYPE_PARAM,
  /** [TYPE]? */
  SUPERCLASS,
  /** [TYPE*] */
  MIXINS,
  /** [TYPE*] */
  INTERFACES,
  /** [FIELD_DECL | METHOD_DECL | CONSTRUCTOR_DECL]* */
  CLASS_BODY,
  /** [TYPE | NONE, METADATA, VARIABLE+] */
  FIELD_DECL,
  /** text=name; [initializer]? */
  VARIABLE,
  /** text=name; [TYPE | NONE return, TYPE_PARAMS, PARAMS, METADATA,
   * BLOCK | EXPR_BODY | NONE] */
  METHOD_DECL,
  /** text=constructor name or ""; [PARAMS, INITIALIZERS, METADATA,
   * BLOCK | EXPR_BODY | NONE] */
  CONSTRUCTOR_DECL,
  /** [FIELD_INIT | SUPER_INIT | REDIRECT_INIT | ASSERT_INIT]* */
  INITIALIZERS,
  /** text=field; [expr] */
  FIELD_INIT,
  /** text=named super constructor or ""; [ARGUMENTS] */
  SUPER_INIT,
  /** text=named constructor or ""; [ARGUMENTS] */
  REDIRECT_INIT,
  /** [ARGUMENTS] */
  ASSERT_INIT,
  /** text=name; same layout as METHOD_DECL */
  FUNCTION_DECL,
  /** [TYPE | NONE, METADATA, VARIABLE+] */
  TOP_LEVEL_VAR,
  /** [PARAM*] */
  PARAMS,
  /** text=name; [TYPE | NONE, default expr | NONE] */
  PARAM,
  /** text=name, possibly dotted; [TYPE_ARGS] */
  TYPE,
  /** [TYPE*] */
  TYPE_ARGS,
  /** Placeholder for an absent optional slot */
  NONE,
  /** [expr] */
  EXPR_BODY,

  /** [stmt*] */
  BLOCK,
  /** [TYPE | NONE, VARIABLE+] */
  VAR_DECL_STMT,
  /** [expr] */
  EXPR_STMT,
  /** [cond, then, else | NONE] */
  IF,
  /** [init stmt | NONE, cond | NONE, FOR_UPDATES, body] */
  FOR,
  /** [expr*] */
  FOR_UPDATES,
  /** [VAR_DECL_STMT | IDENTIFIER, iterable, body] */
  FOR_IN,
  /** [cond, body] */
  WHILE,
  /** [body, cond] */
  DO_WHILE,
  /** [subject, SWITCH_CASE*] */
  SWITCH,
  /** [CASE_VALUES, BLOCK]; no values means default */
  SWITCH_CASE,
  /** [expr*] */
  CASE_VALUES,
  /** [expr | NONE] */
  RETURN,
  /** text=label or "" */
  BREAK,
  /** text=label or "" */
  CONTINUE,
  /** [BLOCK, CATCH_CLAUSE*, BLOCK finally | NONE] */
  TRY,
  /** [TYPE on | NONE, IDENTIFIER exception | NONE,
   * IDENTIFIER stack | NONE, BLOCK] */
  CATCH_CLAUSE,
  /** [expr]; GENERATOR flag for yield* */
  YIELD,
  /** [ARGUMENTS] */
  ASSERT,
  EMPTY_STMT,

  /** text=literal as written */
  INT_LITERAL,
  DOUBLE_LITERAL,
  /** text=decoded value */
  STRING_LITERAL,
  BOOL_LITERAL,
  NULL_LITERAL,
  /** [STRING_PART | expr]* in source order */
  STRING_INTERP,
  /** text=decoded literal segment */
  STRING_PART,
  /** text=name */
  IDENTIFIER,
  THIS,
  SUPER,
  /** text=operator; [left, right] */
  BINARY,
  /** text=operator; [operand]; PREFIX or POSTFIX flag */
  UNARY,
  /** text=operator, "=" or compound; [target, value] */
  ASSIGN,
  /** [cond, then, else] */
  CONDITIONAL,
  /** text=method name; [target | NONE, TYPE_ARGS, ARGUMENTS] */
  METHOD_CALL,
  /** [callee, TYPE_ARGS, ARGUMENTS] */
  INVOKE,
  /** text=name; [target] */
  PROPERTY,
  /** [target, index] */
  INDEX,
  /** text=constructor name or ""; [TYPE, ARGUMENTS]; CONST flag */
  NEW,
  /** [TYPE_ARGS, element*] */
  LIST_LITERAL,
  /** [TYPE_ARGS, MAP_ENTRY*] */
  MAP_LITERAL,
  /** [TYPE_ARGS, element*] */
  SET_LITERAL,
  /** [key, value] */
  MAP_ENTRY,
  /** [PARAMS, BLOCK | EXPR_BODY] */
  FUNCTION_EXPR,
  /** [expr] */
  AWAIT,
  /** [expr, TYPE] */
  AS,
  /** [expr, TYPE]; NEGATED flag for is! */
  IS,
  /** [target, section+]; sections start from CASCADE_RECEIVER */
  CASCADE,
  /** Implicit receiver of a cascade section */
  CASCADE_RECEIVER,
  /** [expr] */
  THROW,
  /** [expr | NAMED_ARG]* */
  ARGUMENTS,
  /** text=name; [expr] */
  NAMED_ARG,
  /** Malformed input; a parse error was reported */
  ERROR;

  public boolean isLiteral() {
    switch (this) {
      case INT_LITERAL:
      case DOUBLE_LITERAL:
      case STRING_LITERAL:
      case BOOL_LITERAL:
      case NULL_LITERAL:
        return true;
      default:
        return false;
    }
  }
}
