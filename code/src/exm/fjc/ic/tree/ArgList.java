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

import java.util.List;
import java.util.SortedMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/**
 * Call arguments.  Positional order matters; named arguments are keyed by
 * name and kept sorted so that iteration order never depends on source
 * order.
 */
public class ArgList {
  public static final ArgList EMPTY = new ArgList(
      ImmutableList.<ExprIR>of(), ImmutableSortedMap.<String, ExprIR>of());

  private final List<ExprIR> positional;
  private final SortedMap<String, ExprIR> named;

  public ArgList(List<ExprIR> positional, SortedMap<String, ExprIR> named) {
    this.positional = ImmutableList.copyOf(positional);
    this.named = ImmutableSortedMap.copyOfSorted(named);
  }

  public List<ExprIR> getPositional() {
    return positional;
  }

  public SortedMap<String, ExprIR> getNamed() {
    return named;
  }

  public boolean isEmpty() {
    return positional.isEmpty() && named.isEmpty();
  }

  public int size() {
    return positional.size() + named.size();
  }

  /**
   * @return named argument expression, or null if not passed
   */
  public ExprIR getNamed(String name) {
    return named.get(name);
  }
}
