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
package exm.fjc.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.mutable.MutableInt;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.ASTFlag;
import exm.fjc.ast.ASTType;
import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;

/**
 * Error-tolerant recursive descent parser.  On an unexpected token it
 * reports a PARSE_ERROR, puts an ERROR node in the tree and skips ahead to
 * the next statement, member or declaration boundary.  A tree is always
 * returned.
 *
 * Binary operator precedence, loosest first: assignment, conditional,
 * ??, ||, &&, comparison (== != &lt; &gt; &lt;= &gt;= is as), |, ^, &amp;,
 * shift, additive, multiplicative, unary.
 */
public class Parser {
  private static final Logger logger = Logging.getFJCLogger();

  private static final Set<String> ASSIGN_OPS = ImmutableSet.of(
      "=", "+=", "-=", "*=", "/=", "%=", "~/=", "??=", "&=", "|=", "^=",
      "<<=");

  private static final Set<String> COMPARISON_OPS = ImmutableSet.of(
      "==", "!=", "<", "<=", ">", ">=");

  private static final Set<String> MEMBER_MODIFIERS = ImmutableSet.of(
      "static", "final", "const", "late", "var", "external", "abstract",
      "covariant", "factory");

  private static final Set<String> STATEMENT_STARTS = ImmutableSet.of(
      "if", "for", "while", "do", "switch", "return", "break", "continue",
      "try", "var", "final", "const", "assert", "throw");

  /** Raised to unwind to the nearest recovery point; already reported */
  private static class ParseFailure extends Exception {
    private static final long serialVersionUID = 1L;
  }

  private final String file;
  private final Iterator<Token> source;
  private final Diagnostics diagnostics;
  private final MutableInt nextId;

  /** Non-trivia tokens pulled so far */
  private final List<Token> tokens = new ArrayList<Token>();
  private final List<Token> comments = new ArrayList<Token>();
  private int pos = 0;
  private int errors = 0;

  public Parser(String file, Iterable<Token> tokens, Diagnostics diagnostics) {
    this(file, tokens.iterator(), diagnostics, new MutableInt(1));
  }

  private Parser(String file, Iterator<Token> source, Diagnostics diagnostics,
                 MutableInt nextId) {
    this.file = file;
    this.source = source;
    this.diagnostics = diagnostics;
    this.nextId = nextId;
  }

  /**
   * Parse a whole compilation unit
   */
  public static ParseResult parse(String file, Iterable<Token> tokens,
                                  Diagnostics diagnostics) {
    return new Parser(file, tokens, diagnostics).parseCompilationUnit();
  }

  public ParseResult parseCompilationUnit() {
    SourceLocation start = la(0).getLocation();
    List<WidgetAST> decls = new ArrayList<WidgetAST>();
    while (la(0).getKind() != TokenKind.EOF) {
      int before = pos;
      try {
        WidgetAST decl = parseTopLevel();
        if (decl != null) {
          decls.add(decl);
        }
      } catch (ParseFailure ex) {
        decls.add(error(tokenAt(before).getLocation()));
        syncTopLevel(before);
      }
    }
    WidgetAST unit = node(ASTType.COMPILATION_UNIT, "", start, decls);
    logger.debug("Parsed " + file + ": " + decls.size() +
                 " top-level declarations, " + errors + " errors");
    return new ParseResult(unit, comments, errors);
  }

  // ---------------------------------------------------------------------
  // Token buffer
  // ---------------------------------------------------------------------

  private Token tokenAt(int i) {
    while (tokens.size() <= i) {
      if (!source.hasNext()) {
        // Past EOF: keep returning it
        return tokens.get(tokens.size() - 1);
      }
      Token t = source.next();
      if (t.getKind() == TokenKind.COMMENT) {
        comments.add(t);
      } else if (t.getKind() != TokenKind.ERROR) {
        tokens.add(t);
      }
    }
    return tokens.get(i);
  }

  private Token la(int k) {
    return tokenAt(pos + k);
  }

  private boolean at(String s) {
    return la(0).is(s);
  }

  private boolean atOffset(int k, String s) {
    return la(k).is(s);
  }

  private Token advance() {
    Token t = la(0);
    if (t.getKind() != TokenKind.EOF) {
      pos++;
    }
    return t;
  }

  private boolean accept(String s) {
    if (at(s)) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(String s) throws ParseFailure {
    if (!at(s)) {
      throw fail("'" + s + "'");
    }
    return advance();
  }

  private String expectIdentifier() throws ParseFailure {
    Token t = la(0);
    if (t.getKind() != TokenKind.IDENTIFIER) {
      throw fail("identifier");
    }
    advance();
    return t.getText();
  }

  /** Tokens a and b with nothing between them */
  private boolean adjacent(int k) {
    return la(k).getEnd() == la(k + 1).getOffset();
  }

  private ParseFailure fail(String expected) {
    Token t = la(0);
    String found = t.getKind() == TokenKind.EOF ? "end of input"
                                                 : "'" + t.getText() + "'";
    return failMessage("expected " + expected + " but found " + found,
                       t.getLocation());
  }

  private ParseFailure failMessage(String msg, SourceLocation loc) {
    errors++;
    diagnostics.report(DiagnosticKind.PARSE_ERROR, msg, loc);
    return new ParseFailure();
  }

  // ---------------------------------------------------------------------
  // Recovery
  // ---------------------------------------------------------------------

  private void syncTopLevel(int failedStart) {
    int depth = 0;
    if (pos == failedStart) {
      advance();
    }
    while (la(0).getKind() != TokenKind.EOF) {
      if (depth == 0 && (at("class") || at("import") || at("export") ||
                         at("abstract") || at("@"))) {
        return;
      }
      Token t = advance();
      if (t.is("{")) {
        depth++;
      } else if (t.is("}")) {
        depth--;
        if (depth <= 0) {
          return;
        }
      } else if (t.is(";") && depth == 0) {
        return;
      }
    }
  }

  /**
   * Skip to just after the end of the current statement or member, or to
   * the close brace of the enclosing block, which is left unconsumed.
   */
  private void syncStatement(int failedStart) {
    int depth = 0;
    while (la(0).getKind() != TokenKind.EOF) {
      if (depth == 0 && at("}")) {
        return;
      }
      if (depth == 0 && pos > failedStart && la(0).isWord() &&
          STATEMENT_STARTS.contains(la(0).getText())) {
        return;
      }
      Token t = advance();
      if (t.is("{")) {
        depth++;
      } else if (t.is("}")) {
        depth--;
        if (depth == 0) {
          return;
        }
      } else if (t.is(";") && depth == 0) {
        return;
      }
    }
  }

  // ---------------------------------------------------------------------
  // Node construction
  // ---------------------------------------------------------------------

  private WidgetAST node(ASTType type, String text, SourceLocation loc,
                         List<WidgetAST> children) {
    return node(type, text, EnumSet.noneOf(ASTFlag.class), loc, children);
  }

  private WidgetAST node(ASTType type, String text, Set<ASTFlag> flags,
                         SourceLocation loc, List<WidgetAST> children) {
    int id = nextId.intValue();
    nextId.increment();
    return new WidgetAST(id, type, text, flags, children, loc);
  }

  private WidgetAST node(ASTType type, String text, SourceLocation loc,
                         WidgetAST... children) {
    return node(type, text, loc, list(children));
  }

  private WidgetAST node(ASTType type, String text, Set<ASTFlag> flags,
                         SourceLocation loc, WidgetAST... children) {
    return node(type, text, flags, loc, list(children));
  }

  private WidgetAST leaf(ASTType type, String text, SourceLocation loc) {
    return node(type, text, loc, Collections.<WidgetAST>emptyList());
  }

  private WidgetAST none() {
    return leaf(ASTType.NONE, "", la(0).getLocation());
  }

  private WidgetAST error(SourceLocation loc) {
    return leaf(ASTType.ERROR, "", loc);
  }

  private static List<WidgetAST> list(WidgetAST... children) {
    List<WidgetAST> l = new ArrayList<WidgetAST>(children.length);
    Collections.addAll(l, children);
    return l;
  }

  private static EnumSet<ASTFlag> flags() {
    return EnumSet.noneOf(ASTFlag.class);
  }

  // ---------------------------------------------------------------------
  // Declarations
  // ---------------------------------------------------------------------

  /**
   * @return declaration, or null for directives with no tree of their own
   */
  private WidgetAST parseTopLevel() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    WidgetAST metadata = parseMetadata();
    if (at("import")) {
      return parseImport();
    } else if (at("export")) {
      advance();
      Token uri = la(0);
      if (uri.getKind() != TokenKind.STRING) {
        throw fail("module uri");
      }
      advance();
      skipPast(";");
      return leaf(ASTType.EXPORT, stringValue(uri), loc);
    } else if (at("library") || at("part")) {
      skipPast(";");
      return null;
    } else if (at("class") || (at("abstract") && atOffset(1, "class"))) {
      return parseClass(metadata);
    } else if (at("enum") || at("typedef") || at("mixin") ||
               at("extension")) {
      throw failMessage("'" + la(0).getText() +
            "' declarations are not supported", loc);
    } else if (at("function") && la(1).getKind() == TokenKind.IDENTIFIER) {
      advance();
      return parseFunctionRest(ASTType.FUNCTION_DECL, flags(), none(),
                               metadata, loc);
    }
    return parseFunctionOrVariable(metadata, loc);
  }

  private void skipPast(String s) {
    while (la(0).getKind() != TokenKind.EOF && !at(s)) {
      advance();
    }
    accept(s);
  }

  private WidgetAST parseMetadata() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    List<WidgetAST> annotations = new ArrayList<WidgetAST>();
    while (at("@")) {
      SourceLocation aLoc = advance().getLocation();
      StringBuilder name = new StringBuilder(expectIdentifier());
      while (at(".") && la(1).getKind() == TokenKind.IDENTIFIER) {
        advance();
        name.append('.').append(advance().getText());
      }
      WidgetAST args = at("(") ? parseArguments() : none();
      annotations.add(node(ASTType.ANNOTATION, name.toString(), aLoc, args));
    }
    return node(ASTType.METADATA, "", loc, annotations);
  }

  private WidgetAST parseImport() throws ParseFailure {
    SourceLocation loc = expect("import").getLocation();
    List<WidgetAST> clauses = new ArrayList<WidgetAST>();
    EnumSet<ASTFlag> fl = flags();
    Token uri;
    if (la(0).getKind() == TokenKind.STRING) {
      uri = advance();
      // Dart style: import 'uri' as p show A hide B;
      while (!at(";") && la(0).getKind() != TokenKind.EOF) {
        if (at("as")) {
          advance();
          Token alias = la(0);
          clauses.add(leaf(ASTType.IMPORT_ALIAS, expectIdentifier(),
                           alias.getLocation()));
        } else if (at("show") || at("hide")) {
          boolean show = advance().is("show");
          do {
            Token name = la(0);
            clauses.add(leaf(show ? ASTType.IMPORT_ITEM : ASTType.IMPORT_HIDE,
                             expectIdentifier(), name.getLocation()));
          } while (accept(","));
        } else if (at("deferred")) {
          advance();
        } else {
          throw fail("'as', 'show', 'hide' or ';'");
        }
      }
      expect(";");
    } else {
      fl.add(ASTFlag.MODULE_SYNTAX);
      if (la(0).getKind() == TokenKind.IDENTIFIER && !at("from")) {
        Token def = advance();
        clauses.add(leaf(ASTType.IMPORT_DEFAULT, def.getText(),
                         def.getLocation()));
        accept(",");
      }
      if (accept("*")) {
        if (!at("as")) {
          throw fail("'as'");
        }
        advance();
        Token alias = la(0);
        clauses.add(leaf(ASTType.IMPORT_ALIAS, expectIdentifier(),
                         alias.getLocation()));
      } else if (accept("{")) {
        while (!at("}")) {
          Token name = la(0);
          String imported = expectIdentifier();
          if (at("as")) {
            advance();
            Token alias = la(0);
            WidgetAST aliasNode = leaf(ASTType.IDENTIFIER, expectIdentifier(),
                                       alias.getLocation());
            clauses.add(node(ASTType.IMPORT_ITEM, imported,
                             name.getLocation(), aliasNode));
          } else {
            clauses.add(leaf(ASTType.IMPORT_ITEM, imported,
                             name.getLocation()));
          }
          if (!accept(",")) {
            break;
          }
        }
        expect("}");
      }
      if (!at("from")) {
        throw fail("'from'");
      }
      advance();
      uri = la(0);
      if (uri.getKind() != TokenKind.STRING) {
        throw fail("module uri");
      }
      advance();
      accept(";");
    }
    return node(ASTType.IMPORT, stringValue(uri), fl, loc, clauses);
  }

  private WidgetAST parseClass(WidgetAST metadata) throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    EnumSet<ASTFlag> fl = flags();
    if (accept("abstract")) {
      fl.add(ASTFlag.ABSTRACT);
    }
    expect("class");
    String name = expectIdentifier();
    WidgetAST typeParams = parseTypeParams();

    SourceLocation superLoc = la(0).getLocation();
    List<WidgetAST> superclass = new ArrayList<WidgetAST>();
    if (accept("extends")) {
      superclass.add(parseType());
    }
    SourceLocation mixinLoc = la(0).getLocation();
    List<WidgetAST> mixins = new ArrayList<WidgetAST>();
    if (accept("with")) {
      do {
        mixins.add(parseType());
      } while (accept(","));
    }
    SourceLocation ifaceLoc = la(0).getLocation();
    List<WidgetAST> interfaces = new ArrayList<WidgetAST>();
    if (accept("implements")) {
      do {
        interfaces.add(parseType());
      } while (accept(","));
    }

    SourceLocation bodyLoc = expect("{").getLocation();
    List<WidgetAST> members = new ArrayList<WidgetAST>();
    while (!at("}") && la(0).getKind() != TokenKind.EOF) {
      int before = pos;
      try {
        members.add(parseMember(name));
      } catch (ParseFailure ex) {
        members.add(error(tokenAt(before).getLocation()));
        syncStatement(before);
        if (pos == before) {
          advance();
        }
      }
    }
    expect("}");

    return node(ASTType.CLASS_DECL, name, fl, loc,
        typeParams,
        node(ASTType.SUPERCLASS, "", superLoc, superclass),
        node(ASTType.MIXINS, "", mixinLoc, mixins),
        node(ASTType.INTERFACES, "", ifaceLoc, interfaces),
        metadata,
        node(ASTType.CLASS_BODY, "", bodyLoc, members));
  }

  private WidgetAST parseMember(String className) throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    WidgetAST metadata = parseMetadata();
    EnumSet<ASTFlag> fl = parseModifiers();

    // Constructors: Name(...), Name.named(...), or constructor(...)
    if ((at(className) && (atOffset(1, "(") || atOffset(1, "."))) ||
        (at("constructor") && atOffset(1, "("))) {
      return parseConstructor(className, fl, metadata, loc);
    }
    if (at("operator")) {
      throw failMessage("operator declarations are not supported", loc);
    }

    WidgetAST type = none();
    if (!isAccessorStart(0) && isTypedName(0)) {
      type = parseType();
    }
    if (isAccessorStart(0)) {
      fl.add(advance().is("get") ? ASTFlag.GETTER : ASTFlag.SETTER);
    }
    if (la(1).is("(") || la(1).is("<") || fl.contains(ASTFlag.GETTER)) {
      return parseFunctionRest(ASTType.METHOD_DECL, fl, type, metadata, loc);
    }
    List<WidgetAST> vars = parseVariables();
    expect(";");
    List<WidgetAST> children = list(type, metadata);
    children.addAll(vars);
    return node(ASTType.FIELD_DECL, "", fl, loc, children);
  }

  /** get/set followed by a name, as opposed to a method called get */
  private boolean isAccessorStart(int k) {
    return (la(k).is("get") || la(k).is("set")) &&
           la(k + 1).getKind() == TokenKind.IDENTIFIER;
  }

  private EnumSet<ASTFlag> parseModifiers() {
    EnumSet<ASTFlag> fl = flags();
    while (la(0).isWord() && MEMBER_MODIFIERS.contains(la(0).getText()) &&
           !atOffset(1, "(")) {
      String mod = advance().getText();
      if (mod.equals("static")) {
        fl.add(ASTFlag.STATIC);
      } else if (mod.equals("final")) {
        fl.add(ASTFlag.FINAL);
      } else if (mod.equals("const")) {
        fl.add(ASTFlag.CONST);
      } else if (mod.equals("late")) {
        fl.add(ASTFlag.LATE);
      } else if (mod.equals("var")) {
        fl.add(ASTFlag.VAR);
      } else if (mod.equals("external")) {
        fl.add(ASTFlag.EXTERNAL);
      } else if (mod.equals("abstract")) {
        fl.add(ASTFlag.ABSTRACT);
      } else if (mod.equals("factory")) {
        fl.add(ASTFlag.FACTORY);
      }
    }
    return fl;
  }

  private WidgetAST parseConstructor(String className, EnumSet<ASTFlag> fl,
        WidgetAST metadata, SourceLocation loc) throws ParseFailure {
    advance();
    String ctorName = "";
    if (accept(".")) {
      ctorName = expectIdentifier();
    }
    WidgetAST params = parseParams();

    SourceLocation initLoc = la(0).getLocation();
    List<WidgetAST> inits = new ArrayList<WidgetAST>();
    if (accept(":")) {
      do {
        inits.add(parseInitializer());
      } while (accept(","));
    }

    WidgetAST body;
    if (accept("=")) {
      // Redirecting factory: factory A() = B;
      WidgetAST target = parseType();
      expect(";");
      body = node(ASTType.EXPR_BODY, "", target.getLocation(),
          node(ASTType.NEW, "", target.getLocation(), target,
               node(ASTType.ARGUMENTS, "", target.getLocation(),
                    forwardParams(params))));
    } else {
      body = parseBody(false);
    }
    return node(ASTType.CONSTRUCTOR_DECL, ctorName, fl, loc, params,
        node(ASTType.INITIALIZERS, "", initLoc, inits), metadata, body);
  }

  /** Pass each parameter through as an argument of the same kind */
  private List<WidgetAST> forwardParams(WidgetAST params) {
    List<WidgetAST> args = new ArrayList<WidgetAST>();
    for (WidgetAST p: params.children()) {
      WidgetAST ref = leaf(ASTType.IDENTIFIER, p.getText(), p.getLocation());
      if (p.hasFlag(ASTFlag.NAMED)) {
        args.add(node(ASTType.NAMED_ARG, p.getText(), p.getLocation(), ref));
      } else {
        args.add(ref);
      }
    }
    return args;
  }

  private WidgetAST parseInitializer() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    boolean redirect = at("this") && (atOffset(1, "(") ||
        (atOffset(1, ".") && atOffset(3, "(")));
    if (at("super") || redirect) {
      boolean isSuper = advance().is("super");
      String name = "";
      if (accept(".")) {
        name = expectIdentifier();
      }
      return node(isSuper ? ASTType.SUPER_INIT : ASTType.REDIRECT_INIT,
                  name, loc, parseArguments());
    } else if (at("assert")) {
      advance();
      return node(ASTType.ASSERT_INIT, "", loc, parseArguments());
    }
    if (accept("this")) {
      expect(".");
    }
    String field = expectIdentifier();
    expect("=");
    return node(ASTType.FIELD_INIT, field, loc, parseNoCascadeExpression());
  }

  /**
   * Top-level function or variable.  Return types and variable types are
   * optional.
   */
  private WidgetAST parseFunctionOrVariable(WidgetAST metadata,
        SourceLocation loc) throws ParseFailure {
    EnumSet<ASTFlag> fl = parseModifiers();
    WidgetAST type = none();
    if (isTypedName(0)) {
      type = parseType();
    }
    if (la(0).getKind() != TokenKind.IDENTIFIER) {
      throw fail("declaration");
    }
    if (atOffset(1, "(") || atOffset(1, "<")) {
      return parseFunctionRest(ASTType.FUNCTION_DECL, fl, type, metadata,
                               loc);
    }
    List<WidgetAST> vars = parseVariables();
    expect(";");
    List<WidgetAST> children = list(type, metadata);
    children.addAll(vars);
    return node(ASTType.TOP_LEVEL_VAR, "", fl, loc, children);
  }

  /**
   * From the name of a function or method onwards
   */
  private WidgetAST parseFunctionRest(ASTType kind, EnumSet<ASTFlag> fl,
        WidgetAST returnType, WidgetAST metadata, SourceLocation loc)
        throws ParseFailure {
    String name = expectIdentifier();
    WidgetAST typeParams = parseTypeParams();
    WidgetAST params;
    if (fl.contains(ASTFlag.GETTER)) {
      params = node(ASTType.PARAMS, "", la(0).getLocation(),
                    Collections.<WidgetAST>emptyList());
    } else {
      params = parseParams();
    }
    parseBodyModifiers(fl);
    WidgetAST body = parseBody(kind == ASTType.METHOD_DECL);
    return node(kind, name, fl, loc, returnType, typeParams, params,
                metadata, body);
  }

  private void parseBodyModifiers(EnumSet<ASTFlag> fl) {
    if (at("async")) {
      advance();
      fl.add(ASTFlag.ASYNC);
      if (at("*")) {
        advance();
        fl.add(ASTFlag.GENERATOR);
      }
    } else if (at("sync") && atOffset(1, "*")) {
      advance();
      advance();
      fl.add(ASTFlag.GENERATOR);
    }
  }

  /**
   * @param allowMissing true if a bare ';' (abstract member) is allowed
   */
  private WidgetAST parseBody(boolean allowMissing) throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (at("{")) {
      return parseBlock();
    } else if (accept("=>")) {
      WidgetAST e = parseExpression();
      expect(";");
      return node(ASTType.EXPR_BODY, "", loc, e);
    } else if (accept(";")) {
      return leaf(ASTType.NONE, "", loc);
    }
    if (allowMissing) {
      throw fail("'{', '=>' or ';'");
    }
    throw fail("'{' or '=>'");
  }

  private List<WidgetAST> parseVariables() throws ParseFailure {
    List<WidgetAST> vars = new ArrayList<WidgetAST>();
    do {
      Token name = la(0);
      String id = expectIdentifier();
      if (accept("=")) {
        vars.add(node(ASTType.VARIABLE, id, name.getLocation(),
                      parseExpression()));
      } else {
        vars.add(leaf(ASTType.VARIABLE, id, name.getLocation()));
      }
    } while (accept(","));
    return vars;
  }

  private WidgetAST parseParams() throws ParseFailure {
    SourceLocation loc = expect("(").getLocation();
    List<WidgetAST> params = new ArrayList<WidgetAST>();
    while (!at(")")) {
      if (accept("[")) {
        while (!at("]")) {
          params.add(parseParam(ASTFlag.OPTIONAL));
          if (!accept(",")) {
            break;
          }
        }
        expect("]");
        accept(",");
        break;
      } else if (accept("{")) {
        while (!at("}")) {
          params.add(parseParam(ASTFlag.NAMED));
          if (!accept(",")) {
            break;
          }
        }
        expect("}");
        accept(",");
        break;
      }
      params.add(parseParam(null));
      if (!accept(",")) {
        break;
      }
    }
    expect(")");
    return node(ASTType.PARAMS, "", loc, params);
  }

  private WidgetAST parseParam(ASTFlag group) throws ParseFailure {
    parseMetadata();
    SourceLocation loc = la(0).getLocation();
    EnumSet<ASTFlag> fl = flags();
    if (group != null) {
      fl.add(group);
    }
    if (accept("required")) {
      fl.add(ASTFlag.REQUIRED);
    }
    accept("covariant");
    if (accept("final") || accept("var") || accept("const")) {
      fl.add(ASTFlag.FINAL);
    }

    WidgetAST type = none();
    String name;
    if ((at("this") || at("super")) && atOffset(1, ".")) {
      fl.add(advance().is("this") ? ASTFlag.FIELD_PARAM : ASTFlag.SUPER_PARAM);
      advance();
      name = expectIdentifier();
    } else {
      if (isTypedName(0)) {
        type = parseType();
      }
      name = expectIdentifier();
    }
    if (at("(")) {
      // Function-typed parameter: void onTap()
      skipBalanced("(", ")");
      type = leaf(ASTType.TYPE, "Function", loc);
    }
    accept("?");

    WidgetAST dflt = none();
    if (accept("=") || (group == ASTFlag.NAMED && accept(":"))) {
      dflt = parseNoCascadeExpression();
    }
    return node(ASTType.PARAM, name, fl, loc, type, dflt);
  }

  private void skipBalanced(String open, String close) throws ParseFailure {
    expect(open);
    int depth = 1;
    while (depth > 0) {
      if (la(0).getKind() == TokenKind.EOF) {
        throw fail("'" + close + "'");
      }
      Token t = advance();
      if (t.is(open)) {
        depth++;
      } else if (t.is(close)) {
        depth--;
      }
    }
  }

  // ---------------------------------------------------------------------
  // Types
  // ---------------------------------------------------------------------

  private WidgetAST parseTypeParams() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    List<WidgetAST> params = new ArrayList<WidgetAST>();
    if (accept("<")) {
      do {
        Token name = la(0);
        String id = expectIdentifier();
        WidgetAST bound = none();
        if (accept("extends")) {
          bound = parseType();
        }
        params.add(node(ASTType.TYPE_PARAM, id, name.getLocation(), bound));
      } while (accept(","));
      expect(">");
    }
    return node(ASTType.TYPE_PARAMS, "", loc, params);
  }

  private WidgetAST parseType() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    Token first = la(0);
    if (!isTypeName(first)) {
      throw fail("type");
    }
    advance();
    String name = first.getText();
    if (at(".") && la(1).getKind() == TokenKind.IDENTIFIER) {
      advance();
      name = name + "." + advance().getText();
    }
    WidgetAST args = parseTypeArgs();
    if (at("Function") && atOffset(1, "(")) {
      // void Function(int) is just a Function
      advance();
      name = "Function";
      args = node(ASTType.TYPE_ARGS, "", loc,
                  Collections.<WidgetAST>emptyList());
    }
    if (name.equals("Function") && at("(")) {
      skipBalanced("(", ")");
    }
    EnumSet<ASTFlag> fl = flags();
    if (at("?") && adjacent(-1)) {
      advance();
      fl.add(ASTFlag.NULLABLE);
    }
    return node(ASTType.TYPE, name, fl, loc, args);
  }

  private WidgetAST parseTypeArgs() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    List<WidgetAST> args = new ArrayList<WidgetAST>();
    if (accept("<")) {
      do {
        args.add(parseType());
      } while (accept(","));
      expect(">");
    }
    return node(ASTType.TYPE_ARGS, "", loc, args);
  }

  private static boolean isTypeName(Token t) {
    return t.getKind() == TokenKind.IDENTIFIER || t.is("void");
  }

  /**
   * Scan a type starting k tokens ahead without consuming anything.
   * @return offset just past the type, or -1 if there is no type there
   */
  private int scanType(int k) {
    if (!isTypeName(la(k))) {
      return -1;
    }
    k++;
    if (la(k).is(".") && la(k + 1).getKind() == TokenKind.IDENTIFIER) {
      k += 2;
    }
    if (la(k).is("<")) {
      k = scanTypeArgs(k);
      if (k < 0) {
        return -1;
      }
    }
    if (la(k).is("Function") && la(k + 1).is("(")) {
      // Return type of a function type: void Function(int)
      k++;
    }
    if (la(k - 1).is("Function") && la(k).is("(")) {
      k = scanParens(k);
      if (k < 0) {
        return -1;
      }
    }
    if (la(k).is("?") && la(k - 1).getEnd() == la(k).getOffset()) {
      k++;
    }
    return k;
  }

  /**
   * @param k offset of '('
   * @return offset just past the matching ')', or -1
   */
  private int scanParens(int k) {
    int depth = 0;
    do {
      Token t = la(k);
      if (t.is("(")) {
        depth++;
      } else if (t.is(")")) {
        depth--;
      } else if (t.getKind() == TokenKind.EOF) {
        return -1;
      }
      k++;
    } while (depth > 0);
    return k;
  }

  /**
   * @param k offset of '&lt;'
   * @return offset just past the matching '&gt;', or -1
   */
  private int scanTypeArgs(int k) {
    int depth = 0;
    do {
      Token t = la(k);
      if (t.is("<")) {
        depth++;
      } else if (t.is(">")) {
        depth--;
      } else if (!(t.getKind() == TokenKind.IDENTIFIER || t.is("void") ||
                   t.is(",") || t.is(".") || t.is("?"))) {
        return -1;
      }
      k++;
    } while (depth > 0);
    return k;
  }

  /** A type followed by a declared name */
  private boolean isTypedName(int k) {
    int end = scanType(k);
    return end > 0 && la(end).getKind() == TokenKind.IDENTIFIER &&
           !la(end).is("in") && !la(end).is("of");
  }

  // ---------------------------------------------------------------------
  // Statements
  // ---------------------------------------------------------------------

  private WidgetAST parseBlock() throws ParseFailure {
    SourceLocation loc = expect("{").getLocation();
    List<WidgetAST> stmts = new ArrayList<WidgetAST>();
    while (!at("}") && la(0).getKind() != TokenKind.EOF) {
      stmts.add(parseStatementRecovering());
    }
    expect("}");
    return node(ASTType.BLOCK, "", loc, stmts);
  }

  private WidgetAST parseStatementRecovering() {
    int before = pos;
    try {
      return parseStatement();
    } catch (ParseFailure ex) {
      WidgetAST err = error(tokenAt(before).getLocation());
      syncStatement(before);
      if (pos == before) {
        advance();
      }
      return err;
    }
  }

  private WidgetAST parseStatement() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (at("{")) {
      return parseBlock();
    } else if (accept(";")) {
      return leaf(ASTType.EMPTY_STMT, "", loc);
    } else if (at("if")) {
      return parseIf();
    } else if (at("for") || (at("await") && atOffset(1, "for"))) {
      return parseFor();
    } else if (at("while")) {
      advance();
      WidgetAST cond = parseCondition();
      return node(ASTType.WHILE, "", loc, cond, parseStatementRecovering());
    } else if (at("do")) {
      advance();
      WidgetAST body = parseStatementRecovering();
      expect("while");
      WidgetAST cond = parseCondition();
      expect(";");
      return node(ASTType.DO_WHILE, "", loc, body, cond);
    } else if (at("switch")) {
      return parseSwitch();
    } else if (at("try")) {
      return parseTry();
    } else if (at("return")) {
      advance();
      WidgetAST value = at(";") ? none() : parseExpression();
      expect(";");
      return node(ASTType.RETURN, "", loc, value);
    } else if (at("break") || at("continue")) {
      boolean isBreak = advance().is("break");
      String label = la(0).getKind() == TokenKind.IDENTIFIER ?
                     advance().getText() : "";
      expect(";");
      return leaf(isBreak ? ASTType.BREAK : ASTType.CONTINUE, label, loc);
    } else if (at("yield")) {
      advance();
      EnumSet<ASTFlag> fl = flags();
      if (accept("*")) {
        fl.add(ASTFlag.STAR);
      }
      WidgetAST value = parseExpression();
      expect(";");
      return node(ASTType.YIELD, "", fl, loc, value);
    } else if (at("assert")) {
      advance();
      WidgetAST args = parseArguments();
      expect(";");
      return node(ASTType.ASSERT, "", loc, args);
    } else if (at("rethrow")) {
      throw failMessage("rethrow is not supported", loc);
    } else if (isLocalFunctionStart()) {
      return parseLocalFunction();
    } else if (isLocalVarStart()) {
      WidgetAST decl = parseLocalVar();
      expect(";");
      return decl;
    }
    WidgetAST e = parseExpression();
    expect(";");
    return node(ASTType.EXPR_STMT, "", loc, e);
  }

  private boolean isLocalFunctionStart() {
    int k = isTypedName(0) ? scanType(0) : 0;
    return la(k).getKind() == TokenKind.IDENTIFIER && la(k + 1).is("(") &&
           isBodyAfterParens(k + 1);
  }

  /**
   * A nested function becomes a final variable holding a function
   * expression.
   */
  private WidgetAST parseLocalFunction() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (isTypedName(0)) {
      parseType();
    }
    Token name = la(0);
    String id = expectIdentifier();
    WidgetAST fn = parseLambda();
    return node(ASTType.VAR_DECL_STMT, "", EnumSet.of(ASTFlag.FINAL), loc,
        none(), node(ASTType.VARIABLE, id, name.getLocation(), fn));
  }

  private boolean isLocalVarStart() {
    if (at("var") || at("final") || at("late")) {
      return true;
    }
    if (at("const")) {
      // const [..] or const Foo(..) is an expression
      return la(1).getKind() == TokenKind.IDENTIFIER &&
             (la(2).getKind() == TokenKind.IDENTIFIER || la(2).is("=") ||
              la(2).is("<") || la(2).is("?"));
    }
    if (at("let") && la(1).getKind() == TokenKind.IDENTIFIER) {
      return true;
    }
    return isTypedName(0);
  }

  /**
   * Local variable declaration without the trailing ';'
   */
  private WidgetAST parseLocalVar() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    EnumSet<ASTFlag> fl = flags();
    if (accept("late")) {
      fl.add(ASTFlag.LATE);
    }
    if (accept("final")) {
      fl.add(ASTFlag.FINAL);
    } else if (accept("const")) {
      fl.add(ASTFlag.CONST);
    } else if (accept("var") || accept("let")) {
      fl.add(ASTFlag.VAR);
    }
    WidgetAST type = none();
    if (isTypedName(0)) {
      type = parseType();
    }
    List<WidgetAST> children = list(type);
    children.addAll(parseVariables());
    return node(ASTType.VAR_DECL_STMT, "", fl, loc, children);
  }

  private WidgetAST parseCondition() throws ParseFailure {
    expect("(");
    WidgetAST cond = parseExpression();
    expect(")");
    return cond;
  }

  private WidgetAST parseIf() throws ParseFailure {
    SourceLocation loc = expect("if").getLocation();
    WidgetAST cond = parseCondition();
    WidgetAST then = parseStatementRecovering();
    WidgetAST els = none();
    if (accept("else")) {
      els = parseStatementRecovering();
    }
    return node(ASTType.IF, "", loc, cond, then, els);
  }

  private WidgetAST parseFor() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    EnumSet<ASTFlag> fl = flags();
    if (accept("await")) {
      fl.add(ASTFlag.ASYNC);
    }
    expect("for");
    expect("(");

    WidgetAST init;
    if (at(";")) {
      init = none();
    } else if (la(0).getKind() == TokenKind.IDENTIFIER &&
               (atOffset(1, "in") || atOffset(1, "of"))) {
      init = leaf(ASTType.IDENTIFIER, advance().getText(), loc);
    } else if (isLocalVarStart()) {
      init = parseLocalVar();
    } else {
      SourceLocation eLoc = la(0).getLocation();
      init = node(ASTType.EXPR_STMT, "", eLoc, parseExpression());
    }

    if (at("in") || at("of")) {
      advance();
      WidgetAST iterable = parseExpression();
      expect(")");
      return node(ASTType.FOR_IN, "", fl, loc, init, iterable,
                  parseStatementRecovering());
    }

    expect(";");
    WidgetAST cond = at(";") ? none() : parseExpression();
    expect(";");
    SourceLocation updLoc = la(0).getLocation();
    List<WidgetAST> updates = new ArrayList<WidgetAST>();
    while (!at(")")) {
      updates.add(parseExpression());
      if (!accept(",")) {
        break;
      }
    }
    expect(")");
    return node(ASTType.FOR, "", loc, init, cond,
        node(ASTType.FOR_UPDATES, "", updLoc, updates),
        parseStatementRecovering());
  }

  private WidgetAST parseSwitch() throws ParseFailure {
    SourceLocation loc = expect("switch").getLocation();
    WidgetAST subject = parseCondition();
    expect("{");
    List<WidgetAST> children = list(subject);
    while (!at("}") && la(0).getKind() != TokenKind.EOF) {
      SourceLocation caseLoc = la(0).getLocation();
      List<WidgetAST> values = new ArrayList<WidgetAST>();
      boolean isDefault = false;
      // Consecutive labels share one body
      while (at("case") || at("default")) {
        if (accept("default")) {
          isDefault = true;
        } else {
          advance();
          values.add(parseExpression());
        }
        expect(":");
      }
      if (values.isEmpty() && !isDefault) {
        throw fail("'case' or 'default'");
      }
      SourceLocation bodyLoc = la(0).getLocation();
      List<WidgetAST> stmts = new ArrayList<WidgetAST>();
      while (!at("case") && !at("default") && !at("}") &&
             la(0).getKind() != TokenKind.EOF) {
        stmts.add(parseStatementRecovering());
      }
      if (isDefault) {
        // default merged with other labels behaves as default
        values.clear();
      }
      children.add(node(ASTType.SWITCH_CASE, "", caseLoc,
          node(ASTType.CASE_VALUES, "", caseLoc, values),
          node(ASTType.BLOCK, "", bodyLoc, stmts)));
    }
    expect("}");
    return node(ASTType.SWITCH, "", loc, children);
  }

  private WidgetAST parseTry() throws ParseFailure {
    SourceLocation loc = expect("try").getLocation();
    List<WidgetAST> children = list(parseBlock());
    while (at("on") || at("catch")) {
      SourceLocation cLoc = la(0).getLocation();
      WidgetAST onType = none();
      WidgetAST exVar = none();
      WidgetAST stackVar = none();
      if (accept("on")) {
        onType = parseType();
      }
      if (accept("catch")) {
        expect("(");
        Token ex = la(0);
        exVar = leaf(ASTType.IDENTIFIER, expectIdentifier(), ex.getLocation());
        if (accept(",")) {
          Token st = la(0);
          stackVar = leaf(ASTType.IDENTIFIER, expectIdentifier(),
                          st.getLocation());
        }
        expect(")");
      }
      children.add(node(ASTType.CATCH_CLAUSE, "", cLoc, onType, exVar,
                        stackVar, parseBlock()));
    }
    if (accept("finally")) {
      children.add(parseBlock());
    } else {
      children.add(none());
    }
    if (children.size() == 2 && children.get(1).isNone()) {
      throw failMessage("try needs a catch or finally clause", loc);
    }
    return node(ASTType.TRY, "", loc, children);
  }

  // ---------------------------------------------------------------------
  // Expressions
  // ---------------------------------------------------------------------

  private WidgetAST parseExpression() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (accept("throw")) {
      return node(ASTType.THROW, "", loc, parseExpression());
    }
    WidgetAST left = parseConditional();
    if (at("..") || at("?..")) {
      left = parseCascade(left);
    }
    return parseAssignmentRest(left, true);
  }

  private WidgetAST parseNoCascadeExpression() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (accept("throw")) {
      return node(ASTType.THROW, "", loc, parseNoCascadeExpression());
    }
    return parseAssignmentRest(parseConditional(), false);
  }

  private WidgetAST parseAssignmentRest(WidgetAST left, boolean cascades)
      throws ParseFailure {
    String op = assignmentOp();
    if (op == null) {
      return left;
    }
    if (!isAssignable(left)) {
      throw failMessage("invalid assignment target", left.getLocation());
    }
    // >>= is lexed as '>' '>='
    for (int i = 0; i < (op.equals(">>=") ? 2 : 1); i++) {
      advance();
    }
    WidgetAST value = cascades ? parseExpression() : parseNoCascadeExpression();
    return node(ASTType.ASSIGN, op, left.getLocation(), left, value);
  }

  private String assignmentOp() {
    Token t = la(0);
    if (t.getKind() == TokenKind.OPERATOR && ASSIGN_OPS.contains(t.getText())) {
      return t.getText();
    }
    if (t.is(">") && la(1).is(">=") && adjacent(0)) {
      return ">>=";
    }
    return null;
  }

  private static boolean isAssignable(WidgetAST e) {
    switch (e.getType()) {
      case IDENTIFIER:
      case PROPERTY:
      case INDEX:
        return true;
      default:
        return false;
    }
  }

  private WidgetAST parseCascade(WidgetAST target) throws ParseFailure {
    EnumSet<ASTFlag> fl = flags();
    if (at("?..")) {
      fl.add(ASTFlag.NULL_AWARE);
    }
    List<WidgetAST> children = list(target);
    while (at("..") || at("?..")) {
      SourceLocation loc = advance().getLocation();
      WidgetAST receiver = leaf(ASTType.CASCADE_RECEIVER, "", loc);
      WidgetAST section;
      if (at("[")) {
        advance();
        WidgetAST index = parseExpression();
        expect("]");
        section = node(ASTType.INDEX, "", loc, receiver, index);
      } else {
        section = parseMemberSelector(receiver, loc, flags());
      }
      section = parseSelectors(section);
      children.add(parseAssignmentRest(section, false));
    }
    return node(ASTType.CASCADE, "", fl, target.getLocation(), children);
  }

  private WidgetAST parseConditional() throws ParseFailure {
    WidgetAST cond = parseNullCoalesce();
    if (at("?")) {
      advance();
      WidgetAST then = parseNoCascadeExpression();
      expect(":");
      WidgetAST els = parseNoCascadeExpression();
      return node(ASTType.CONDITIONAL, "", cond.getLocation(), cond, then, els);
    }
    return cond;
  }

  private WidgetAST parseNullCoalesce() throws ParseFailure {
    WidgetAST left = parseLogicalOr();
    while (at("??")) {
      advance();
      left = binary("??", left, parseLogicalOr());
    }
    return left;
  }

  private WidgetAST parseLogicalOr() throws ParseFailure {
    WidgetAST left = parseLogicalAnd();
    while (at("||")) {
      advance();
      left = binary("||", left, parseLogicalAnd());
    }
    return left;
  }

  private WidgetAST parseLogicalAnd() throws ParseFailure {
    WidgetAST left = parseComparison();
    while (at("&&")) {
      advance();
      left = binary("&&", left, parseComparison());
    }
    return left;
  }

  private WidgetAST parseComparison() throws ParseFailure {
    WidgetAST left = parseBitOr();
    while (true) {
      if (at("is")) {
        advance();
        EnumSet<ASTFlag> fl = flags();
        if (accept("!")) {
          fl.add(ASTFlag.NEGATED);
        }
        left = node(ASTType.IS, "", fl, left.getLocation(), left, parseType());
      } else if (at("as")) {
        advance();
        left = node(ASTType.AS, "", left.getLocation(), left, parseType());
      } else if (la(0).getKind() == TokenKind.OPERATOR &&
                 COMPARISON_OPS.contains(la(0).getText()) &&
                 !isShiftRight() && assignmentOp() == null) {
        String op = advance().getText();
        left = binary(op, left, parseBitOr());
      } else {
        return left;
      }
    }
  }

  private WidgetAST parseBitOr() throws ParseFailure {
    WidgetAST left = parseBitXor();
    while (at("|")) {
      advance();
      left = binary("|", left, parseBitXor());
    }
    return left;
  }

  private WidgetAST parseBitXor() throws ParseFailure {
    WidgetAST left = parseBitAnd();
    while (at("^")) {
      advance();
      left = binary("^", left, parseBitAnd());
    }
    return left;
  }

  private WidgetAST parseBitAnd() throws ParseFailure {
    WidgetAST left = parseShift();
    while (at("&")) {
      advance();
      left = binary("&", left, parseShift());
    }
    return left;
  }

  /** Two or three adjacent '&gt;' tokens form a right shift */
  private boolean isShiftRight() {
    return at(">") && la(1).is(">") && adjacent(0);
  }

  private WidgetAST parseShift() throws ParseFailure {
    WidgetAST left = parseAdditive();
    while (true) {
      if (at("<<")) {
        advance();
        left = binary("<<", left, parseAdditive());
      } else if (isShiftRight()) {
        advance();
        advance();
        String op = ">>";
        if (at(">") && adjacent(-1)) {
          advance();
          op = ">>>";
        }
        left = binary(op, left, parseAdditive());
      } else {
        return left;
      }
    }
  }

  private WidgetAST parseAdditive() throws ParseFailure {
    WidgetAST left = parseMultiplicative();
    while (at("+") || at("-")) {
      String op = advance().getText();
      left = binary(op, left, parseMultiplicative());
    }
    return left;
  }

  private WidgetAST parseMultiplicative() throws ParseFailure {
    WidgetAST left = parseUnary();
    while (at("*") || at("/") || at("%") || at("~/")) {
      String op = advance().getText();
      left = binary(op, left, parseUnary());
    }
    return left;
  }

  private WidgetAST binary(String op, WidgetAST left, WidgetAST right) {
    return node(ASTType.BINARY, op, left.getLocation(), left, right);
  }

  private WidgetAST parseUnary() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    if (at("-") || at("!") || at("~") || at("++") || at("--")) {
      String op = advance().getText();
      return node(ASTType.UNARY, op, EnumSet.of(ASTFlag.PREFIX), loc,
                  parseUnary());
    } else if (at("await") && !atOffset(1, ";") && !atOffset(1, ")")) {
      advance();
      return node(ASTType.AWAIT, "", loc, parseUnary());
    }
    return parseSelectors(parsePrimary());
  }

  /**
   * Member access, calls, indexing and postfix operators
   */
  private WidgetAST parseSelectors(WidgetAST e) throws ParseFailure {
    while (true) {
      SourceLocation loc = la(0).getLocation();
      if (at(".")) {
        advance();
        e = parseMemberSelector(e, loc, flags());
      } else if (at("?.")) {
        advance();
        e = parseMemberSelector(e, loc, EnumSet.of(ASTFlag.NULL_AWARE));
      } else if (at("?") && la(1).is("[") && adjacent(0)) {
        advance();
        advance();
        WidgetAST index = parseExpression();
        expect("]");
        e = node(ASTType.INDEX, "", EnumSet.of(ASTFlag.NULL_AWARE), loc, e,
                 index);
      } else if (at("[")) {
        advance();
        WidgetAST index = parseExpression();
        expect("]");
        e = node(ASTType.INDEX, "", loc, e, index);
      } else if (at("(")) {
        e = node(ASTType.INVOKE, "", e.getLocation(), e,
                 node(ASTType.TYPE_ARGS, "", loc,
                      Collections.<WidgetAST>emptyList()),
                 parseArguments());
      } else if (at("<") && isGenericCall(0)) {
        WidgetAST typeArgs = parseTypeArgs();
        e = node(ASTType.INVOKE, "", e.getLocation(), e, typeArgs,
                 parseArguments());
      } else if (at("!") && adjacent(-1)) {
        advance();
        e = node(ASTType.UNARY, "!", EnumSet.of(ASTFlag.POSTFIX), loc, e);
      } else if ((at("++") || at("--")) && isAssignable(e)) {
        String op = advance().getText();
        e = node(ASTType.UNARY, op, EnumSet.of(ASTFlag.POSTFIX), loc, e);
      } else {
        return e;
      }
    }
  }

  /**
   * After '.' or '?.': a property or a method call
   */
  private WidgetAST parseMemberSelector(WidgetAST target, SourceLocation loc,
        EnumSet<ASTFlag> fl) throws ParseFailure {
    Token nameTok = la(0);
    if (!nameTok.isWord()) {
      throw fail("member name");
    }
    advance();
    String name = nameTok.getText();
    if (at("(") || (at("<") && isGenericCall(0))) {
      WidgetAST typeArgs = parseTypeArgs();
      return node(ASTType.METHOD_CALL, name, fl, nameTok.getLocation(),
                  target, typeArgs, parseArguments());
    }
    return node(ASTType.PROPERTY, name, fl, nameTok.getLocation(), target);
  }

  /** Type arguments at offset k followed by '(' */
  private boolean isGenericCall(int k) {
    int end = scanTypeArgs(k);
    return end > 0 && la(end).is("(");
  }

  private WidgetAST parseArguments() throws ParseFailure {
    SourceLocation loc = expect("(").getLocation();
    List<WidgetAST> args = new ArrayList<WidgetAST>();
    while (!at(")")) {
      if (la(0).isWord() && atOffset(1, ":")) {
        Token name = advance();
        advance();
        args.add(node(ASTType.NAMED_ARG, name.getText(), name.getLocation(),
                      parseExpression()));
      } else {
        args.add(parseExpression());
      }
      if (!accept(",")) {
        break;
      }
    }
    expect(")");
    return node(ASTType.ARGUMENTS, "", loc, args);
  }

  private WidgetAST parsePrimary() throws ParseFailure {
    Token t = la(0);
    SourceLocation loc = t.getLocation();
    switch (t.getKind()) {
      case INTEGER:
        advance();
        return leaf(ASTType.INT_LITERAL, t.getText(), loc);
      case DECIMAL:
        advance();
        return leaf(ASTType.DOUBLE_LITERAL, t.getText(), loc);
      case STRING:
        return parseStrings();
      default:
        break;
    }

    if (at("true") || at("false")) {
      advance();
      return leaf(ASTType.BOOL_LITERAL, t.getText(), loc);
    } else if (at("null")) {
      advance();
      return leaf(ASTType.NULL_LITERAL, "", loc);
    } else if (at("this")) {
      advance();
      return leaf(ASTType.THIS, "", loc);
    } else if (at("super")) {
      advance();
      return leaf(ASTType.SUPER, "", loc);
    } else if (at("new")) {
      advance();
      return parseNew(loc, EnumSet.of(ASTFlag.NEW_KEYWORD));
    } else if (at("const")) {
      advance();
      if (at("[") || at("{") || at("<")) {
        return parseCollection(EnumSet.of(ASTFlag.CONST));
      }
      return parseNew(loc, EnumSet.of(ASTFlag.CONST));
    } else if (at("[") || at("{") || at("<")) {
      return parseCollection(flags());
    } else if (at("(")) {
      if (isLambdaStart()) {
        return parseLambda();
      }
      advance();
      WidgetAST inner = parseExpression();
      expect(")");
      return inner;
    } else if (at("function") && atOffset(1, "(")) {
      advance();
      return parseLambda();
    } else if (t.getKind() == TokenKind.IDENTIFIER) {
      if (atOffset(1, "=>")) {
        // x => expr
        WidgetAST param = node(ASTType.PARAM, advance().getText(), loc,
                               none(), none());
        advance();
        WidgetAST body = node(ASTType.EXPR_BODY, "", la(0).getLocation(),
                              parseExpression());
        return node(ASTType.FUNCTION_EXPR, "", loc,
                    node(ASTType.PARAMS, "", loc, param), body);
      }
      advance();
      if (at("(") || (at("<") && isGenericCall(0))) {
        WidgetAST typeArgs = parseTypeArgs();
        return node(ASTType.METHOD_CALL, t.getText(), loc, none(), typeArgs,
                    parseArguments());
      }
      return leaf(ASTType.IDENTIFIER, t.getText(), loc);
    }
    throw fail("expression");
  }

  /** '(' params ')' followed by a function body */
  private boolean isLambdaStart() {
    return isBodyAfterParens(0);
  }

  /** Parenthesized list at offset k followed by a function body */
  private boolean isBodyAfterParens(int k) {
    int end = scanParens(k);
    if (end < 0) {
      return false;
    }
    return la(end).is("=>") || la(end).is("{") || la(end).is("async") ||
           (la(end).is("sync") && la(end + 1).is("*"));
  }

  private WidgetAST parseLambda() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    WidgetAST params = parseParams();
    EnumSet<ASTFlag> fl = flags();
    parseBodyModifiers(fl);
    WidgetAST body;
    if (at("{")) {
      body = parseBlock();
    } else {
      SourceLocation bodyLoc = expect("=>").getLocation();
      body = node(ASTType.EXPR_BODY, "", bodyLoc, parseExpression());
    }
    return node(ASTType.FUNCTION_EXPR, "", fl, loc, params, body);
  }

  private WidgetAST parseNew(SourceLocation loc, EnumSet<ASTFlag> fl)
      throws ParseFailure {
    Token first = la(0);
    String typeName = expectIdentifier();
    String ctorName = "";
    if (at(".") && la(1).getKind() == TokenKind.IDENTIFIER) {
      String second = la(1).getText();
      advance();
      advance();
      if (Character.isLowerCase(typeName.charAt(0)) &&
          Character.isUpperCase(second.charAt(0))) {
        // prefix.Type
        typeName = typeName + "." + second;
      } else {
        ctorName = second;
      }
    }
    WidgetAST typeArgs = parseTypeArgs();
    if (ctorName.isEmpty() && at(".")) {
      advance();
      ctorName = expectIdentifier();
    }
    WidgetAST type = node(ASTType.TYPE, typeName, first.getLocation(),
                          typeArgs);
    return node(ASTType.NEW, ctorName, fl, loc, type, parseArguments());
  }

  private WidgetAST parseCollection(EnumSet<ASTFlag> fl) throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    WidgetAST typeArgs = parseTypeArgs();
    if (at("[")) {
      advance();
      List<WidgetAST> children = list(typeArgs);
      children.addAll(parseElements("]"));
      expect("]");
      return node(ASTType.LIST_LITERAL, "", fl, loc, children);
    }
    expect("{");
    List<WidgetAST> children = list(typeArgs);
    if (at("}")) {
      advance();
      // {} is a map unless given exactly one type argument
      return node(typeArgs.childCount() == 1 ? ASTType.SET_LITERAL
                                             : ASTType.MAP_LITERAL,
                  "", fl, loc, children);
    }
    WidgetAST first = parseCollectionElement();
    if (at(":")) {
      advance();
      children.add(node(ASTType.MAP_ENTRY, "", first.getLocation(), first,
                        parseExpression()));
      while (accept(",") && !at("}")) {
        WidgetAST key = parseCollectionElement();
        expect(":");
        children.add(node(ASTType.MAP_ENTRY, "", key.getLocation(), key,
                          parseExpression()));
      }
      expect("}");
      return node(ASTType.MAP_LITERAL, "", fl, loc, children);
    }
    children.add(first);
    if (accept(",")) {
      children.addAll(parseElements("}"));
    }
    expect("}");
    return node(ASTType.SET_LITERAL, "", fl, loc, children);
  }

  private List<WidgetAST> parseElements(String close) throws ParseFailure {
    List<WidgetAST> elems = new ArrayList<WidgetAST>();
    while (!at(close)) {
      elems.add(parseCollectionElement());
      if (!accept(",")) {
        break;
      }
    }
    return elems;
  }

  private WidgetAST parseCollectionElement() throws ParseFailure {
    if (at("...") || at("...?") || at("if") || at("for")) {
      throw failMessage("'" + la(0).getText() +
          "' collection elements are not supported", la(0).getLocation());
    }
    return parseExpression();
  }

  /**
   * One or more adjacent string tokens, which are concatenated
   */
  private WidgetAST parseStrings() throws ParseFailure {
    SourceLocation loc = la(0).getLocation();
    List<WidgetAST> parts = new ArrayList<WidgetAST>();
    boolean interpolated = false;
    StringBuilder lit = new StringBuilder();
    while (la(0).getKind() == TokenKind.STRING) {
      Token t = advance();
      List<StringLiterals.Segment> segs;
      try {
        segs = StringLiterals.split(t);
      } catch (StringLiterals.MalformedStringException ex) {
        throw failMessage(ex.getMessage(), t.getLocation());
      }
      for (StringLiterals.Segment seg: segs) {
        if (seg.isExpr) {
          interpolated = true;
          if (lit.length() > 0) {
            parts.add(leaf(ASTType.STRING_PART, lit.toString(), loc));
            lit.setLength(0);
          }
          parts.add(parseInterpolated(seg));
        } else {
          lit.append(seg.text);
        }
      }
    }
    if (!interpolated) {
      return leaf(ASTType.STRING_LITERAL, lit.toString(), loc);
    }
    if (lit.length() > 0) {
      parts.add(leaf(ASTType.STRING_PART, lit.toString(), loc));
    }
    return node(ASTType.STRING_INTERP, "", loc, parts);
  }

  private WidgetAST parseInterpolated(StringLiterals.Segment seg) {
    SourceLocation start = seg.location;
    Lexer lexer = new Lexer(start.getFile(), seg.text, diagnostics,
                            start.getLine(), start.getColumn());
    Parser sub = new Parser(file, lexer, diagnostics, nextId);
    WidgetAST e;
    try {
      e = sub.parseExpression();
      if (sub.la(0).getKind() != TokenKind.EOF) {
        throw sub.fail("end of interpolation");
      }
    } catch (ParseFailure ex) {
      // Keep the rest of the string
      e = error(start);
    }
    errors += sub.errors;
    return e;
  }

  /**
   * @return decoded value of a string token without interpolation
   */
  private String stringValue(Token t) throws ParseFailure {
    try {
      StringBuilder sb = new StringBuilder();
      for (StringLiterals.Segment seg: StringLiterals.split(t)) {
        if (seg.isExpr) {
          throw failMessage("interpolation not allowed here",
                            t.getLocation());
        }
        sb.append(seg.text);
      }
      return sb.toString();
    } catch (StringLiterals.MalformedStringException ex) {
      throw failMessage(ex.getMessage(), t.getLocation());
    }
  }
}
