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
package exm.fjc.common.exceptions;

import exm.fjc.ast.SourceLocation;

/**
 * An error in the compiler input.  The message is shown to the user as
 * is, prefixed with the source position when there is one.
 */
public class UserException extends Exception {
  private final SourceLocation location;

  public UserException(SourceLocation location, String message) {
    super(location + ": " + message);
    this.location = location;
  }

  public UserException(String message) {
    super(message);
    this.location = null;
  }

  /**
   * @return source position, or null if the error is not tied to one
   */
  public SourceLocation getLocation() {
    return location;
  }

  private static final long serialVersionUID = 1L;
}
