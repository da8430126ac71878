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
package exm.fjc.ic.tree;

import exm.fjc.ast.SourceLocation;

/**
 * Common part of expression and statement IR: an id unique within the
 * compilation unit and a source location.  All IR is immutable.
 */
public abstract class IRNode {
  private final int id;
  private final SourceLocation location;

  protected IRNode(int id, SourceLocation location) {
    assert(location != null);
    this.id = id;
    this.location = location;
  }

  public int getId() {
    return id;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /**
   * @return name of the node kind for diagnostics
   */
  public abstract String kindName();
}
