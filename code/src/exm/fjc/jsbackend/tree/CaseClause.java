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
package exm.fjc.jsbackend.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One arm of a switch: its labels, then the indented body
 */
public class CaseClause extends JSTree {
  private final List<String> labels;
  private final Sequence body;

  public CaseClause(List<String> labels, Sequence body) {
    this.labels = ImmutableList.copyOf(labels);
    this.body = body;
  }

  @Override
  public void appendTo(CodeBuffer out) {
    for (String label: labels) {
      out.line(label);
    }
    out.indent();
    body.appendTo(out);
    out.dedent();
  }
}
