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
package exm.fjc.frontend;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;

import exm.fjc.common.diag.Diagnostic;
import exm.fjc.frontend.tree.StateLink;

/**
 * Output of {@link StateAnalyzer}.
 */
public class StateAnalysis {
  private final List<StateLink> stateLinks;
  private final SortedMap<String, Integer> setStateCallCount;
  private final Map<String, String> stateOwners;
  private final List<Diagnostic> errors;

  public StateAnalysis(List<StateLink> stateLinks,
      Map<String, Integer> setStateCallCount, Map<String, String> stateOwners,
      List<Diagnostic> errors) {
    this.stateLinks = ImmutableList.copyOf(stateLinks);
    this.setStateCallCount = ImmutableSortedMap.copyOf(setStateCallCount);
    this.stateOwners = ImmutableMap.copyOf(stateOwners);
    this.errors = ImmutableList.copyOf(errors);
  }

  public List<StateLink> getStateLinks() {
    return stateLinks;
  }

  public StateLink linkFor(String widget) {
    for (StateLink link: stateLinks) {
      if (link.getWidget().equals(widget)) {
        return link;
      }
    }
    return null;
  }

  /** State class name to number of state mutation calls in it */
  public SortedMap<String, Integer> getSetStateCallCount() {
    return setStateCallCount;
  }

  /**
   * @return widget whose createState returns the state class, or null
   */
  public String ownerOf(String stateClass) {
    return stateOwners.get(stateClass);
  }

  public Map<String, String> getStateOwners() {
    return stateOwners;
  }

  /** Linkage errors, also reported to the diagnostics sink */
  public List<Diagnostic> getErrors() {
    return errors;
  }
}
