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

import exm.fjc.frontend.tree.ConsumerInfo;
import exm.fjc.frontend.tree.ProviderInfo;

/**
 * Output of {@link ContextAnalyzer}.
 */
public class ContextAnalysis {
  private final List<ProviderInfo> providers;
  private final List<ConsumerInfo> consumers;

  public ContextAnalysis(List<ProviderInfo> providers,
                         List<ConsumerInfo> consumers) {
    this.providers = ImmutableList.copyOf(providers);
    this.consumers = ImmutableList.copyOf(consumers);
  }

  public List<ProviderInfo> getProviders() {
    return providers;
  }

  public List<ConsumerInfo> getConsumers() {
    return consumers;
  }

  /** Consumers with no matching provider above them */
  public List<ConsumerInfo> getUnresolvedAccesses() {
    ImmutableList.Builder<ConsumerInfo> res = ImmutableList.builder();
    for (ConsumerInfo c: consumers) {
      if (!c.isResolved()) {
        res.add(c);
      }
    }
    return res.build();
  }
}
