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

import com.google.common.collect.ImmutableList;

import exm.fjc.frontend.tree.UnsafePattern;

/**
 * Output of {@link SSRAnalyzer}.
 */
public class SSRAnalysis {
  public static enum Compatibility {
    HIGH,
    MEDIUM,
    LOW;

    public String label() {
      return name().toLowerCase();
    }
  }

  private final Compatibility compatibility;
  private final int score;
  private final List<UnsafePattern> unsafePatterns;
  private final List<String> recommendations;

  public SSRAnalysis(Compatibility compatibility, int score,
      List<UnsafePattern> unsafePatterns, List<String> recommendations) {
    this.compatibility = compatibility;
    this.score = score;
    this.unsafePatterns = ImmutableList.copyOf(unsafePatterns);
    this.recommendations = ImmutableList.copyOf(recommendations);
  }

  public Compatibility getCompatibility() {
    return compatibility;
  }

  /** 0 to 100 */
  public int getScore() {
    return score;
  }

  public List<UnsafePattern> getUnsafePatterns() {
    return unsafePatterns;
  }

  public List<String> getRecommendations() {
    return recommendations;
  }
}
