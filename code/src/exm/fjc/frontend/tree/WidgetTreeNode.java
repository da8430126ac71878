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

/**
 * Node of the static widget composition tree: a constructor call found in
 * a build method, or a widget class at the top.
 */
public class WidgetTreeNode {
  private final String name;
  private final SourceLocation location;
  private final List<WidgetTreeNode> children;

  public WidgetTreeNode(String name, SourceLocation location,
                        List<WidgetTreeNode> children) {
    this.name = name;
    this.location = location;
    this.children = ImmutableList.copyOf(children);
  }

  public String getName() {
    return name;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public List<WidgetTreeNode> getChildren() {
    return children;
  }

  /**
   * @return number of nodes in this subtree
   */
  public int size() {
    int n = 1;
    for (WidgetTreeNode c: children) {
      n += c.size();
    }
    return n;
  }

  public String prettyPrint() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, 0);
    return sb.toString();
  }

  private void prettyPrint(StringBuilder sb, int indent) {
    for (int i = 0; i < indent; i++) {
      sb.append("  ");
    }
    sb.append(name).append('\n');
    for (WidgetTreeNode c: children) {
      c.prettyPrint(sb, indent + 1);
    }
  }

  @Override
  public String toString() {
    return name + children;
  }
}
