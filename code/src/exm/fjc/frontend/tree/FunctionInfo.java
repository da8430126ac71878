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

public class FunctionInfo {
  private final String name;
  private final List<String> params;
  private final boolean async;
  private final SourceLocation location;

  public FunctionInfo(String name, List<String> params, boolean async,
                      SourceLocation location) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.async = async;
    this.location = location;
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  public boolean isAsync() {
    return async;
  }

  public SourceLocation getLocation() {
    return location;
  }
}
