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
package exm.fjc.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import exm.fjc.common.exceptions.FJCRuntimeError;

/**
 * Homogeneous syntax tree node.  The meaning of text and children depends
 * on the {@link ASTType}.  Nodes are built once by the parser and never
 * modified.
 */
public class WidgetAST {
  private final int id;
  private final ASTType type;
  private final String text;
  private final Set<ASTFlag> flags;
  private final List<WidgetAST> children;
  private final SourceLocation location;

  public WidgetAST(int id, ASTType type, String text, Set<ASTFlag> flags,
                   List<WidgetAST> children, SourceLocation location) {
    assert(location != null);
    this.id = id;
    this.type = type;
    this.text = text == null ? "" : text;
    this.flags = flags.isEmpty() ? Collections.<ASTFlag>emptySet()
                                 : Sets.immutableEnumSet(flags);
    this.children = ImmutableList.copyOf(children);
    this.location = location;
  }

  /**
   * @return id, unique within the compilation unit
   */
  public int getId() {
    return id;
  }

  public ASTType getType() {
    return type;
  }

  public String getText() {
    return text;
  }

  public SourceLocation getLocation() {
    return location;
  }

  public boolean hasFlag(ASTFlag flag) {
    return flags.contains(flag);
  }

  public Set<ASTFlag> getFlags() {
    return flags;
  }

  public boolean isNone() {
    return type == ASTType.NONE;
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return children.size();
  }

  public WidgetAST child(int i) {
    if (i >= children.size()) {
      throw new FJCRuntimeError("No child " + i + " of " + type + " at " +
                                location);
    }
    return children.get(i);
  }

  public List<WidgetAST> children() {
    return children;
  }

  public List<WidgetAST> children(int start) {
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children.subList(start, children.size());
  }

  /**
   * @return first child of the given type, or null
   */
  public WidgetAST firstChild(ASTType childType) {
    for (WidgetAST c: children) {
      if (c.type == childType) {
        return c;
      }
    }
    return null;
  }

  /**
   * @return all nodes of the given type in this subtree, in pre-order,
   *         including this node
   */
  public List<WidgetAST> findAll(ASTType findType) {
    List<WidgetAST> result = new ArrayList<WidgetAST>();
    findAll(findType, result);
    return result;
  }

  private void findAll(ASTType findType, List<WidgetAST> result) {
    if (type == findType) {
      result.add(this);
    }
    for (WidgetAST c: children) {
      c.findAll(findType, result);
    }
  }

  /**
   * @return true if any node in this subtree is an ERROR node
   */
  public boolean containsError() {
    if (type == ASTType.ERROR) {
      return true;
    }
    for (WidgetAST c: children) {
      if (c.containsError()) {
        return true;
      }
    }
    return false;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++) {
      writer.print(' ');
    }
    writer.print(type);
    if (text.length() > 0) {
      writer.print(" '" + text + "'");
    }
    if (!flags.isEmpty()) {
      writer.print(" " + flags);
    }
    writer.println();
    for (WidgetAST c: children) {
      c.printTree(writer, indent + 2);
    }
  }

  @Override
  public String toString() {
    return type + (text.length() > 0 ? "(" + text + ")" : "") + "@" +
           location;
  }
}
