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
 * JavaScript statement-level syntax tree.  Expressions are kept as text.
 */
public abstract class JSTree {

  public abstract void appendTo(CodeBuffer out);

  /**
   * Render at indentation level 0
   */
  public String render(String indentUnit) {
    CodeBuffer out = new CodeBuffer(indentUnit);
    appendTo(out);
    out.checkBalanced(0, getClass().getSimpleName());
    return out.toString();
  }

  @Override
  public String toString() {
    return render("  ");
  }
}
