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

/**
 * Record of one resolution strategy that was tried and failed.
 */
public class FallbackStep {
  public static final String FRAMEWORK_PACKAGE = "framework-package";
  public static final String LOCAL_CODE = "local-code";
  public static final String PACKAGE_CACHE = "package-cache";

  private final int step;
  private final String strategyTried;
  private final boolean found;
  private final String reason;

  public FallbackStep(int step, String strategyTried, boolean found,
                      String reason) {
    this.step = step;
    this.strategyTried = strategyTried;
    this.found = found;
    this.reason = reason;
  }

  public int getStep() {
    return step;
  }

  public String getStrategyTried() {
    return strategyTried;
  }

  public boolean isFound() {
    return found;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public int hashCode() {
    return (step * 31 + strategyTried.hashCode()) * 31 + reason.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FallbackStep)) {
      return false;
    }
    FallbackStep other = (FallbackStep) obj;
    return step == other.step && found == other.found &&
           strategyTried.equals(other.strategyTried) &&
           reason.equals(other.reason);
  }

  @Override
  public String toString() {
    return step + ":" + strategyTried + (found ? " found" : " not found") +
           " (" + reason + ")";
  }
}
