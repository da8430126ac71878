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
package exm.fjc.jsbackend.tree;

import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * Line-oriented output buffer with an explicit indentation level.
 * Every indent() must be matched by a dedent().
 */
public class CodeBuffer {
  private final StringBuilder sb = new StringBuilder(4096);
  private final String indentUnit;
  private int level = 0;

  public CodeBuffer(String indentUnit) {
    this.indentUnit = indentUnit;
  }

  public void indent() {
    level++;
  }

  public void dedent() {
    if (level == 0) {
      throw new FJCRuntimeError("dedent below indentation level 0");
    }
    level--;
  }

  public int getLevel() {
    return level;
  }

  public String getIndentUnit() {
    return indentUnit;
  }

  /**
   * Append text as one or more lines.  Continuation lines of multi-line
   * text keep their own relative indentation.
   */
  public void line(String text) {
    int start = 0;
    while (true) {
      int nl = text.indexOf('\n', start);
      String piece = nl < 0 ? text.substring(start) :
                              text.substring(start, nl);
      if (piece.isEmpty()) {
        sb.append('\n');
      } else {
        for (int i = 0; i < level; i++) {
          sb.append(indentUnit);
        }
        sb.append(piece).append('\n');
      }
      if (nl < 0) {
        break;
      }
      start = nl + 1;
    }
  }

  public void blank() {
    sb.append('\n');
  }

  /**
   * Check the level is back where it started
   */
  public void checkBalanced(int expected, String what) {
    if (level != expected) {
      throw new FJCRuntimeError("Unbalanced indentation after " + what +
          ": level " + level + ", expected " + expected);
    }
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
