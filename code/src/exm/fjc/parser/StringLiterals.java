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
import java.util.List;

import exm.fjc.ast.SourceLocation;

/**
 * Splits the text of a string token into literal segments and
 * interpolated expression sources.
 */
class StringLiterals {

  /**
   * A piece of a string literal.  For expressions, text holds the
   * expression source and location where it starts.
   */
  static class Segment {
    final boolean isExpr;
    final String text;
    final SourceLocation location;

    Segment(boolean isExpr, String text, SourceLocation location) {
      this.isExpr = isExpr;
      this.text = text;
      this.location = location;
    }
  }

  static class MalformedStringException extends Exception {
    MalformedStringException(String msg) {
      super(msg);
    }

    private static final long serialVersionUID = 1L;
  }

  /**
   * @param tok a STRING token
   * @return segments in source order.  Adjacent literal text is merged.
   */
  static List<Segment> split(Token tok) throws MalformedStringException {
    String s = tok.getText();
    int i = 0;
    boolean raw = false;
    if (s.charAt(0) == 'r') {
      raw = true;
      i++;
    }
    char quote = s.charAt(i);
    int quoteLen = (quote != '`' && s.startsWith(
          new String(new char[] {quote, quote, quote}), i)) ? 3 : 1;
    int bodyStart = i + quoteLen;
    int bodyEnd = s.length() - quoteLen;
    // Leading newline of a multi-line string is dropped
    if (quoteLen == 3 && bodyStart < bodyEnd && s.charAt(bodyStart) == '\n') {
      bodyStart++;
    }

    List<Segment> result = new ArrayList<Segment>();
    StringBuilder lit = new StringBuilder();
    int p = bodyStart;
    while (p < bodyEnd) {
      char c = s.charAt(p);
      if (raw) {
        lit.append(c);
        p++;
      } else if (c == '\\') {
        p = unescape(s, p, lit);
      } else if (c == '$' && p + 1 < bodyEnd && s.charAt(p + 1) == '{') {
        int close = matchingBrace(s, p + 2, bodyEnd);
        if (close < 0) {
          throw new MalformedStringException("unterminated interpolation");
        }
        flush(lit, result, tok);
        result.add(new Segment(true, s.substring(p + 2, close),
                               locationAt(tok, p + 2)));
        p = close + 1;
      } else if (c == '$' && quote != '`' && p + 1 < bodyEnd &&
                 isIdentStart(s.charAt(p + 1))) {
        int end = p + 1;
        while (end < bodyEnd && isIdentPart(s.charAt(end))) {
          end++;
        }
        flush(lit, result, tok);
        result.add(new Segment(true, s.substring(p + 1, end),
                               locationAt(tok, p + 1)));
        p = end;
      } else {
        lit.append(c);
        p++;
      }
    }
    flush(lit, result, tok);
    return result;
  }

  private static void flush(StringBuilder lit, List<Segment> result,
                            Token tok) {
    if (lit.length() > 0) {
      result.add(new Segment(false, lit.toString(), tok.getLocation()));
      lit.setLength(0);
    }
  }

  private static int unescape(String s, int p, StringBuilder out)
      throws MalformedStringException {
    if (p + 1 >= s.length()) {
      throw new MalformedStringException("dangling escape");
    }
    char e = s.charAt(p + 1);
    switch (e) {
      case 'n': out.append('\n'); return p + 2;
      case 't': out.append('\t'); return p + 2;
      case 'r': out.append('\r'); return p + 2;
      case 'b': out.append('\b'); return p + 2;
      case 'f': out.append('\f'); return p + 2;
      case 'v': out.append('\u000B'); return p + 2;
      case '0': out.append('\0'); return p + 2;
      case 'x':
        return appendCodePoint(s, p + 2, p + 4, out);
      case 'u':
        if (p + 2 < s.length() && s.charAt(p + 2) == '{') {
          int close = s.indexOf('}', p + 3);
          if (close < 0) {
            throw new MalformedStringException("bad unicode escape");
          }
          appendCodePoint(s, p + 3, close, out);
          return close + 1;
        }
        return appendCodePoint(s, p + 2, p + 6, out);
      default:
        // \\ \' \" \$ and any other character stand for themselves
        out.append(e);
        return p + 2;
    }
  }

  private static int appendCodePoint(String s, int start, int end,
        StringBuilder out) throws MalformedStringException {
    if (end > s.length()) {
      throw new MalformedStringException("truncated escape sequence");
    }
    int codePoint;
    try {
      codePoint = Integer.parseInt(s.substring(start, end), 16);
    } catch (NumberFormatException ex) {
      throw new MalformedStringException("bad escape sequence \\" +
                                         s.substring(start - 1, end));
    }
    if (!Character.isValidCodePoint(codePoint)) {
      throw new MalformedStringException("code point out of range in \\" +
                                         s.substring(start - 1, end));
    }
    out.appendCodePoint(codePoint);
    return end;
  }

  /**
   * @return index of close brace matching an open brace just before start
   */
  private static int matchingBrace(String s, int start, int end) {
    int depth = 1;
    int i = start;
    while (i < end) {
      char c = s.charAt(i);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      } else if (c == '\'' || c == '"') {
        int close = s.indexOf(c, i + 1);
        if (close < 0) {
          return -1;
        }
        i = close;
      }
      i++;
    }
    return -1;
  }

  private static SourceLocation locationAt(Token tok, int index) {
    SourceLocation start = tok.getLocation();
    int line = start.getLine();
    int col = start.getColumn();
    String s = tok.getText();
    for (int i = 0; i < index; i++) {
      if (s.charAt(i) == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
    return new SourceLocation(start.getFile(), line, col);
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
