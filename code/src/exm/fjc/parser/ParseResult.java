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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.WidgetAST;

/**
 * Output of the parser: the tree, which is always present even when there
 * were errors, plus the comments that were skipped.
 */
public class ParseResult {
  private final WidgetAST ast;
  private final List<Token> comments;
  private final int errorCount;

  public ParseResult(WidgetAST ast, List<Token> comments, int errorCount) {
    this.ast = ast;
    this.comments = ImmutableList.copyOf(comments);
    this.errorCount = errorCount;
  }

  public WidgetAST getAST() {
    return ast;
  }

  public List<Token> getComments() {
    return comments;
  }

  /**
   * @return number of parse errors reported while building this tree
   */
  public int getErrorCount() {
    return errorCount;
  }
}
