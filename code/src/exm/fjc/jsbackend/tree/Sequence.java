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

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of trees at the same indentation
 */
public class Sequence extends JSTree {
  private final List<JSTree> members = new ArrayList<JSTree>();

  public Sequence() {
  }

  public Sequence(JSTree... trees) {
    for (JSTree tree: trees) {
      add(tree);
    }
  }

  public void add(JSTree tree) {
    members.add(tree);
  }

  public void add(String line) {
    members.add(new Line(line));
  }

  /**
   * Append at end of current sequence
   */
  public void append(Sequence seq) {
    members.addAll(seq.members);
  }

  public boolean isEmpty() {
    return members.isEmpty();
  }

  public List<JSTree> members() {
    return members;
  }

  /**
   * @return last member, or null if empty
   */
  public JSTree last() {
    return members.isEmpty() ? null : members.get(members.size() - 1);
  }

  @Override
  public void appendTo(CodeBuffer out) {
    for (JSTree member: members) {
      member.appendTo(out);
    }
  }
}
