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

/**
 * Classification of a declared class by its superclass name.
 */
public enum WidgetKind {
  STATELESS,
  STATEFUL,
  STATE,
  COMPONENT,
  OTHER;

  /**
   * @param superclass superclass name with any prefix and type arguments
   *        removed, or null if the class has no superclass
   */
  public static WidgetKind classify(String superclass) {
    if (superclass == null) {
      return OTHER;
    } else if (superclass.equals("StatelessWidget")) {
      return STATELESS;
    } else if (superclass.equals("StatefulWidget")) {
      return STATEFUL;
    } else if (superclass.startsWith("State")) {
      return STATE;
    } else {
      return COMPONENT;
    }
  }

  /** Name as shown in reports */
  public String label() {
    return name().toLowerCase();
  }

  /** Stateless or stateful widget proper */
  public boolean isWidget() {
    return this == STATELESS || this == STATEFUL;
  }
}
