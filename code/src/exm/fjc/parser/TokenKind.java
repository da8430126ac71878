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

public enum TokenKind {
  KEYWORD,
  IDENTIFIER,
  INTEGER,
  DECIMAL,
  /** Text includes quotes, prefix and any interpolation */
  STRING,
  OPERATOR,
  PUNCTUATION,
  /** Line, block or doc comment, kept as trivia */
  COMMENT,
  /** Unrecognized input; a lex error was reported */
  ERROR,
  EOF;

  public boolean isTrivia() {
    return this == COMMENT;
  }
}
