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
 * Stateful widget and the state class its createState returns.
 */
public class StateLink {
  private final String widget;
  private final String stateClass;
  private final boolean stateDeclared;
  private final SourceLocation location;

  public StateLink(String widget, String stateClass, boolean stateDeclared,
                   SourceLocation location) {
    this.widget = widget;
    this.stateClass = stateClass;
    this.stateDeclared = stateDeclared;
    this.location = location;
  }

  public String getWidget() {
    return widget;
  }

  public String getStateClass() {
    return stateClass;
  }

  /** True if the state class is declared in the same unit */
  public boolean isStateDeclared() {
    return stateDeclared;
  }

  /** Location of the createState method */
  public SourceLocation getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return widget + " -> " + stateClass;
  }
}
