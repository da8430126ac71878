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

/**
 * A single line of code, or a blank line if the text is empty
 */
public class Line extends JSTree {
  public static final Line BLANK = new Line("");

  private final String text;

  public Line(String text) {
    this.text = text;
  }

  public String getText() {
    return text;
  }

  @Override
  public void appendTo(CodeBuffer out) {
    if (text.isEmpty()) {
      out.blank();
    } else {
      out.line(text);
    }
  }
}
