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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.fjc.ast.SourceLocation;
import exm.fjc.frontend.imports.ResolutionResult;

/**
 * An import directive and how it resolved.
 */
public class ImportInfo {
  private final String source;
  private final List<String> items;
  private final String alias;
  private final SourceLocation location;
  private final ResolutionResult resolution;

  public ImportInfo(String source, List<String> items, String alias,
                    SourceLocation location, ResolutionResult resolution) {
    this.source = source;
    this.items = ImmutableList.copyOf(items);
    this.alias = alias;
    this.location = location;
    this.resolution = resolution;
  }

  public String getSource() {
    return source;
  }

  /** Names imported, empty if the whole module is imported */
  public List<String> getItems() {
    return items;
  }

  /** @return namespace prefix, or null */
  public String getAlias() {
    return alias;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public ResolutionResult getResolution() {
    return resolution;
  }
}
