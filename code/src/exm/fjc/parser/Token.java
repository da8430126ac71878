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

import exm.fjc.ast.SourceLocation;

/**
 * A lexical unit.  Immutable.
 */
public class Token {
  private final TokenKind kind;
  private final String text;
  private final SourceLocation location;
  private final int offset;

  public Token(TokenKind kind, String text, SourceLocation location,
               int offset) {
    this.kind = kind;
    this.text = text;
    this.location = location;
    this.offset = offset;
  }

  public TokenKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /**
   * @return character offset of first character in the source text
   */
  public int getOffset() {
    return offset;
  }

  /**
   * @return offset one past the last character
   */
  public int getEnd() {
    return offset + text.length();
  }

  /**
   * True if this token is the given operator, punctuation, keyword or
   * identifier text.
   */
  public boolean is(String s) {
    return kind != TokenKind.STRING && kind != TokenKind.COMMENT &&
           kind != TokenKind.ERROR && text.equals(s);
  }

  public boolean isWord() {
    return kind == TokenKind.IDENTIFIER || kind == TokenKind.KEYWORD;
  }

  public boolean isDocComment() {
    return kind == TokenKind.COMMENT &&
        (text.startsWith("///") ||
         (text.startsWith("/**") && !text.equals("/**/")));
  }

  @Override
  public String toString() {
    return kind + "(" + text + ")@" + location;
  }
}
