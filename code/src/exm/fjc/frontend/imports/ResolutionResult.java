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
package exm.fjc.frontend.imports;

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * Immutable outcome of resolving one (specifier, imported items) pair.
 */
public class ResolutionResult {
  private final String specifier;
  private final List<String> items;
  private final ResolutionType type;
  private final String resolved;
  private final String actualPath;
  private final String reason;
  private final List<FallbackStep> fallbacks;

  public ResolutionResult(String specifier, List<String> items,
      ResolutionType type, String resolved, String actualPath, String reason,
      List<FallbackStep> fallbacks) {
    this.specifier = specifier;
    this.items = ImmutableList.copyOf(items);
    this.type = type;
    this.resolved = resolved;
    this.actualPath = actualPath;
    this.reason = reason;
    this.fallbacks = ImmutableList.copyOf(fallbacks);
  }

  public String getSpecifier() {
    return specifier;
  }

  public List<String> getItems() {
    return items;
  }

  public boolean isValid() {
    return type != ResolutionType.ERROR;
  }

  public ResolutionType getType() {
    return type;
  }

  /** @return resolved module name, or null if not valid */
  public String getResolved() {
    return resolved;
  }

  /** @return file the module was found in, or null if not a file */
  public String getActualPath() {
    return actualPath;
  }

  public String getReason() {
    return reason;
  }

  public List<FallbackStep> getFallbacks() {
    return fallbacks;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(specifier, items, type, resolved, actualPath,
                            reason, fallbacks);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ResolutionResult)) {
      return false;
    }
    ResolutionResult o = (ResolutionResult) obj;
    return specifier.equals(o.specifier) && items.equals(o.items) &&
           type == o.type && Objects.equal(resolved, o.resolved) &&
           Objects.equal(actualPath, o.actualPath) &&
           reason.equals(o.reason) && fallbacks.equals(o.fallbacks);
  }

  @Override
  public String toString() {
    return specifier + " -> " + type.label() +
           (resolved != null ? " " + resolved : "") + " (" + reason + ")";
  }
}
