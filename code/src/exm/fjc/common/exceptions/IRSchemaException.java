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

/**
 * Malformed IR document.  The path names the offending JSON element,
 * e.g. <code>declarations[2].members[0].name</code>.
 */
public class IRSchemaException extends UserException {
  private final String path;

  public IRSchemaException(String path, String message) {
    super(path + ": " + message);
    this.path = path;
  }

  public String getPath() {
    return path;
  }

  private static final long serialVersionUID = 1L;
}
