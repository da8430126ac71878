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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import exm.fjc.ast.SourceLocation;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;

/**
 * Turns source text into tokens on demand.  A Lexer is a single pass over
 * the text: it cannot be rewound.  Use {@link #tokenize} to get an
 * Iterable that starts a fresh pass each time it is iterated.
 *
 * Comments are returned as {@link TokenKind#COMMENT} tokens.  Unrecognized
 * characters come back as {@link TokenKind#ERROR} tokens after a
 * LEX_ERROR is reported, so the caller can keep going.  The last token is
 * always {@link TokenKind#EOF}.
 */
public class Lexer implements Iterator<Token> {

  /** Reserved words.  Built-in identifiers like get or show are contextual
   * and come back as identifiers. */
  public static final Set<String> KEYWORDS = ImmutableSet.of(
      "assert", "break", "case", "catch", "class", "const", "continue",
      "default", "do", "else", "enum", "extends", "false", "final",
      "finally", "for", "if", "in", "is", "new", "null", "rethrow", "return",
      "super", "switch", "this", "throw", "true", "try", "var", "void",
      "while", "with");

  /**
   * Operators, longest first so that matching can stop at the first hit.
   * Closing angle brackets are never merged: the parser rejoins adjacent
   * '>' tokens into shift operators where it needs them.
   */
  private static final ImmutableList<String> OPERATORS = ImmutableList.of(
      "...", "?..", "??=", "<<=", "~/=",
      "..", "?.", "??", "==", "!=", "<=", ">=", "&&", "||", "<<", "+=",
      "-=", "*=", "/=", "%=", "&=", "|=", "^=", "++", "--", "=>", "~/",
      "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^", "?",
      ":", ".");

  private static final String PUNCTUATION = "()[]{},;@";

  private final String file;
  private final String text;
  private final Diagnostics diagnostics;

  private int pos = 0;
  private int line = 1;
  private int col = 1;
  private boolean done = false;

  /**
   * @param file name for source locations
   * @param text source text
   * @param diagnostics where to report lex errors, or null to not report
   */
  public Lexer(String file, String text, Diagnostics diagnostics) {
    this(file, text, diagnostics, 1, 1);
  }

  /**
   * Lexer for a fragment that starts at the given position of a larger
   * file, e.g. an interpolated expression.
   */
  public Lexer(String file, String text, Diagnostics diagnostics,
               int startLine, int startCol) {
    this.file = file;
    this.text = text;
    this.diagnostics = diagnostics;
    this.line = startLine;
    this.col = startCol;
  }

  /**
   * @return restartable token sequence.  Each iteration lexes from the
   *    start again and reports its own lex errors.
   */
  public static Iterable<Token> tokenize(final String file, final String text,
                                         final Diagnostics diagnostics) {
    return new Iterable<Token>() {
      @Override
      public Iterator<Token> iterator() {
        return new Lexer(file, text, diagnostics);
      }
    };
  }

  @Override
  public boolean hasNext() {
    return !done;
  }

  @Override
  public Token next() {
    if (done) {
      throw new NoSuchElementException("Lexer already returned EOF");
    }
    skipWhitespace();
    if (pos >= text.length()) {
      done = true;
      return new Token(TokenKind.EOF, "", location(), pos);
    }
    char c = text.charAt(pos);
    char c1 = peekChar(1);

    if (c == '/' && (c1 == '/' || c1 == '*')) {
      return lexComment();
    } else if (isStringStart()) {
      return lexString();
    } else if (isIdentStart(c)) {
      return lexWord();
    } else if (Character.isDigit(c) ||
               (c == '.' && Character.isDigit(c1))) {
      return lexNumber();
    } else if (PUNCTUATION.indexOf(c) >= 0) {
      return make(TokenKind.PUNCTUATION, 1);
    }
    for (String op: OPERATORS) {
      if (text.startsWith(op, pos)) {
        return make(TokenKind.OPERATOR, op.length());
      }
    }
    Token err = make(TokenKind.ERROR, 1);
    reportError(err, "unexpected character '" + err.getText() + "'");
    return err;
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      advance(1);
    }
  }

  private Token lexComment() {
    int start = pos;
    if (text.charAt(pos + 1) == '/') {
      int end = text.indexOf('\n', pos);
      return make(TokenKind.COMMENT, (end < 0 ? text.length() : end) - start);
    }
    // Block comments nest
    int depth = 0;
    int i = pos;
    while (i < text.length()) {
      if (text.startsWith("/*", i)) {
        depth++;
        i += 2;
      } else if (text.startsWith("*/", i)) {
        depth--;
        i += 2;
        if (depth == 0) {
          return make(TokenKind.COMMENT, i - start);
        }
      } else {
        i++;
      }
    }
    Token err = make(TokenKind.ERROR, text.length() - start);
    reportError(err, "unterminated block comment");
    return err;
  }

  private boolean isStringStart() {
    char c = text.charAt(pos);
    if (c == '\'' || c == '"' || c == '`') {
      return true;
    }
    char c1 = peekChar(1);
    return c == 'r' && (c1 == '\'' || c1 == '"');
  }

  private Token lexString() {
    int i = scanString(pos);
    if (i < 0) {
      int end = text.indexOf('\n', pos);
      Token err = make(TokenKind.ERROR,
                       (end < 0 ? text.length() : end) - pos);
      reportError(err, "unterminated string literal");
      return err;
    }
    return make(TokenKind.STRING, i - pos);
  }

  /**
   * @param start index of the prefix or opening quote
   * @return index one past the closing quote, or -1 if unterminated
   */
  private int scanString(int start) {
    int i = start;
    boolean raw = false;
    if (text.charAt(i) == 'r') {
      raw = true;
      i++;
    }
    char quote = text.charAt(i);
    boolean triple = quote != '`' &&
        text.startsWith(new String(new char[] {quote, quote, quote}), i);
    String close = triple ? text.substring(i, i + 3) : String.valueOf(quote);
    i += close.length();
    while (i < text.length()) {
      char c = text.charAt(i);
      if (text.startsWith(close, i)) {
        return i + close.length();
      } else if (c == '\n' && !triple && quote != '`') {
        return -1;
      } else if (c == '\\' && !raw) {
        i += 2;
      } else if (c == '$' && !raw && i + 1 < text.length() &&
                 text.charAt(i + 1) == '{') {
        i = scanInterpolation(i + 2);
        if (i < 0) {
          return -1;
        }
      } else {
        i++;
      }
    }
    return -1;
  }

  /**
   * @param start index just after "${"
   * @return index one past the matching close brace, or -1
   */
  private int scanInterpolation(int start) {
    int depth = 1;
    int i = start;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '{') {
        depth++;
        i++;
      } else if (c == '}') {
        depth--;
        i++;
        if (depth == 0) {
          return i;
        }
      } else if (c == '\'' || c == '"' || c == '`') {
        i = scanString(i);
        if (i < 0) {
          return -1;
        }
      } else {
        i++;
      }
    }
    return -1;
  }

  private Token lexWord() {
    int i = pos;
    while (i < text.length() && isIdentPart(text.charAt(i))) {
      i++;
    }
    String word = text.substring(pos, i);
    return make(KEYWORDS.contains(word) ? TokenKind.KEYWORD
                                        : TokenKind.IDENTIFIER, i - pos);
  }

  private Token lexNumber() {
    int i = pos;
    if (text.startsWith("0x", i) || text.startsWith("0X", i)) {
      i += 2;
      while (i < text.length() && isHexDigit(text.charAt(i))) {
        i++;
      }
      return make(TokenKind.INTEGER, i - pos);
    }
    boolean decimal = false;
    i = skipDigits(i);
    if (i + 1 < text.length() && text.charAt(i) == '.' &&
        Character.isDigit(text.charAt(i + 1))) {
      decimal = true;
      i = skipDigits(i + 1);
    }
    if (i < text.length() &&
        (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
      int j = i + 1;
      if (j < text.length() &&
          (text.charAt(j) == '+' || text.charAt(j) == '-')) {
        j++;
      }
      if (j < text.length() && Character.isDigit(text.charAt(j))) {
        decimal = true;
        i = skipDigits(j);
      }
    }
    return make(decimal ? TokenKind.DECIMAL : TokenKind.INTEGER, i - pos);
  }

  private int skipDigits(int i) {
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private Token make(TokenKind kind, int length) {
    Token t = new Token(kind, text.substring(pos, pos + length), location(),
                        pos);
    advance(length);
    return t;
  }

  private void advance(int n) {
    for (int k = 0; k < n && pos < text.length(); k++) {
      if (text.charAt(pos) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
      pos++;
    }
  }

  private SourceLocation location() {
    return new SourceLocation(file, line, col);
  }

  private char peekChar(int ahead) {
    int i = pos + ahead;
    return i < text.length() ? text.charAt(i) : '\0';
  }

  private void reportError(Token t, String msg) {
    if (diagnostics != null) {
      diagnostics.report(DiagnosticKind.LEX_ERROR, msg, t.getLocation());
    }
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private static boolean isHexDigit(char c) {
    return Character.digit(c, 16) >= 0;
  }
}
