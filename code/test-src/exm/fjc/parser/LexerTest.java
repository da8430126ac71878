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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;

public class LexerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("LexerTest.fjc.log", true);
  }

  private static List<Token> lex(String text, Diagnostics diags) {
    List<Token> result = new ArrayList<Token>();
    for (Token t: Lexer.tokenize("test.dart", text, diags)) {
      result.add(t);
    }
    return result;
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> result = new ArrayList<TokenKind>();
    for (Token t: tokens) {
      result.add(t.getKind());
    }
    return result;
  }

  @Test
  public void testKeywordsAndIdentifiers() {
    List<Token> toks = lex("class Foo extends Bar { get x; }",
                           new Diagnostics());
    assertEquals(TokenKind.KEYWORD, toks.get(0).getKind());
    assertEquals(TokenKind.IDENTIFIER, toks.get(1).getKind());
    assertEquals(TokenKind.KEYWORD, toks.get(2).getKind());
    assertEquals(TokenKind.PUNCTUATION, toks.get(4).getKind());
    assertEquals("get is contextual", TokenKind.IDENTIFIER,
                 toks.get(5).getKind());
    assertEquals(TokenKind.EOF, toks.get(toks.size() - 1).getKind());
  }

  @Test
  public void testNumbers() {
    List<Token> toks = lex("42 0xFF 3.14 1e10 .5", new Diagnostics());
    assertEquals(Arrays.asList(TokenKind.INTEGER,
        TokenKind.INTEGER, TokenKind.DECIMAL, TokenKind.DECIMAL,
        TokenKind.DECIMAL, TokenKind.EOF), kinds(toks));
    assertEquals("0xFF", toks.get(1).getText());
  }

  @Test
  public void testLongestOperatorMatch() {
    List<Token> toks = lex("a ?.. b ~/= c ?? d", new Diagnostics());
    assertEquals("?..", toks.get(1).getText());
    assertEquals("~/=", toks.get(3).getText());
    assertEquals("??", toks.get(5).getText());
  }

  @Test
  public void testCommentsAreTrivia() {
    List<Token> toks = lex("a // line\n/* outer /* inner */ still */ b",
                           new Diagnostics());
    assertEquals(Arrays.asList(TokenKind.IDENTIFIER,
        TokenKind.COMMENT, TokenKind.COMMENT, TokenKind.IDENTIFIER,
        TokenKind.EOF), kinds(toks));
    assertTrue(toks.get(1).getKind().isTrivia());
    assertEquals("Nested block comment kept whole",
                 "/* outer /* inner */ still */", toks.get(2).getText());
  }

  @Test
  public void testInterpolatedStringIsOneToken() {
    List<Token> toks = lex("'Hello ${user.name('}')}!' x",
                           new Diagnostics());
    assertEquals(TokenKind.STRING, toks.get(0).getKind());
    assertEquals("'Hello ${user.name('}')}!'", toks.get(0).getText());
    assertEquals("x", toks.get(1).getText());
  }

  @Test
  public void testRawAndTripleStrings() {
    List<Token> toks = lex("r'\\n' '''a\nb''' x", new Diagnostics());
    assertEquals(TokenKind.STRING, toks.get(0).getKind());
    assertEquals("r'\\n'", toks.get(0).getText());
    assertEquals("'''a\nb'''", toks.get(1).getText());
    assertEquals("Line tracked across the literal", 2,
                 toks.get(2).getLocation().getLine());
  }

  @Test
  public void testUnexpectedCharacter() {
    Diagnostics diags = new Diagnostics();
    List<Token> toks = lex("a # b", diags);
    assertEquals(TokenKind.ERROR, toks.get(1).getKind());
    assertEquals("b", toks.get(2).getText());
    assertEquals(1, diags.ofKind(DiagnosticKind.LEX_ERROR).size());
    assertEquals("unexpected character '#'",
                 diags.getErrors().get(0).getMessage());
    assertEquals(3, diags.getErrors().get(0).getLocation().getColumn());
  }

  @Test
  public void testUnterminatedString() {
    Diagnostics diags = new Diagnostics();
    List<Token> toks = lex("x = 'abc\ny;", diags);
    assertEquals(TokenKind.ERROR, toks.get(2).getKind());
    assertEquals("Lexing resumes on the next line", "y",
                 toks.get(3).getText());
    assertEquals("unterminated string literal",
                 diags.getErrors().get(0).getMessage());
  }

  @Test
  public void testUnterminatedBlockComment() {
    Diagnostics diags = new Diagnostics();
    List<Token> toks = lex("a /* never closed", diags);
    assertEquals(TokenKind.ERROR, toks.get(1).getKind());
    assertEquals(TokenKind.EOF, toks.get(2).getKind());
    assertEquals("unterminated block comment",
                 diags.getErrors().get(0).getMessage());
  }

  @Test
  public void testLocations() {
    List<Token> toks = lex("a\n  bc", new Diagnostics());
    assertEquals(1, toks.get(0).getLocation().getLine());
    assertEquals(2, toks.get(1).getLocation().getLine());
    assertEquals(3, toks.get(1).getLocation().getColumn());
    assertEquals("test.dart", toks.get(1).getLocation().getFile());
  }
}
