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
package exm.fjc.ast;

/**
 * Immutable position in a source file.  Lines and columns start at 1.
 */
public class SourceLocation {
  public static final SourceLocation UNKNOWN =
                        new SourceLocation("<unknown>", 0, 0);

  private final String file;
  private final int line;
  private final int column;

  public SourceLocation(String file, int line, int column) {
    this.file = file;
    this.line = line;
    this.column = column;
  }

  public String getFile() {
    return file;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public int hashCode() {
    return (file.hashCode() * 31 + line) * 31 + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceLocation)) {
      return false;
    }
    SourceLocation other = (SourceLocation) obj;
    return file.equals(other.file) && line == other.line &&
           column == other.column;
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }
}
