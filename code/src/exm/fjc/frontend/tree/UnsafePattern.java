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
package exm.fjc.frontend.tree;

import exm.fjc.ast.SourceLocation;

/**
 * Reference to a browser-only global from a build method.
 */
public class UnsafePattern {
  private final String global;
  private final String className;
  private final String methodName;
  private final SourceLocation location;
  private final boolean guarded;

  public UnsafePattern(String global, String className, String methodName,
                       SourceLocation location, boolean guarded) {
    this.global = global;
    this.className = className;
    this.methodName = methodName;
    this.location = location;
    this.guarded = guarded;
  }

  public String getGlobal() {
    return global;
  }

  public String getClassName() {
    return className;
  }

  public String getMethodName() {
    return methodName;
  }

  public SourceLocation getLocation() {
    return location;
  }

  /** Only reached under a platform check */
  public boolean isGuarded() {
    return guarded;
  }

  @Override
  public String toString() {
    return global + " in " + className + "." + methodName + " at " +
           location + (guarded ? " (guarded)" : "");
  }
}
