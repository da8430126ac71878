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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;

import exm.fjc.ast.ASTType;
import exm.fjc.ast.SourceLocation;
import exm.fjc.ast.WidgetAST;
import exm.fjc.common.Logging;
import exm.fjc.common.diag.DiagnosticKind;
import exm.fjc.common.diag.Diagnostics;
import exm.fjc.frontend.tree.ConsumerInfo;
import exm.fjc.frontend.tree.ProviderInfo;
import exm.fjc.frontend.tree.ProviderInfo.ProviderKind;
import exm.fjc.frontend.tree.WidgetInfo;
import exm.fjc.frontend.tree.WidgetTreeNode;

/**
 * Find provider classes and Provider.of(context) consumers, and pair each
 * consumer with the nearest provider above it in the widget tree.
 */
public class ContextAnalyzer {
  private static final Logger logger = Logging.getFJCLogger();

  public static final String OF = "of";

  /** Extension methods of the provider package: context.watch&lt;T&gt;() */
  private static final Set<String> CONTEXT_LOOKUPS =
                              ImmutableSet.of("watch", "read", "select");

  private final Diagnostics diagnostics;

  /** Tree node to its parent */
  private final Map<WidgetTreeNode, WidgetTreeNode> parents =
      new IdentityHashMap<WidgetTreeNode, WidgetTreeNode>();
  /** Tree node to the class whose tree it is in */
  private final Map<WidgetTreeNode, String> owningClass =
      new IdentityHashMap<WidgetTreeNode, String>();
  /** Constructor calls by class name and location */
  private final Map<Pair<String, SourceLocation>, WidgetTreeNode> byCall =
      new HashMap<Pair<String, SourceLocation>, WidgetTreeNode>();
  /** Class name to tree nodes that construct it */
  private final ListMultimap<String, WidgetTreeNode> usages =
      ArrayListMultimap.create();
  private final Map<String, WidgetTreeNode> roots =
      new HashMap<String, WidgetTreeNode>();

  public ContextAnalyzer(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  public ContextAnalysis analyze(WidgetAnalysis widgets,
                                 StateAnalysis states) {
    indexTree(widgets.getWidgetTree());

    Map<String, ProviderInfo> providers =
        new LinkedHashMap<String, ProviderInfo>();
    for (WidgetInfo w: widgets.getWidgets()) {
      ProviderInfo p = providerInfo(w);
      if (p != null) {
        providers.put(p.getName(), p);
      }
    }

    List<ConsumerInfo> consumers = new ArrayList<ConsumerInfo>();
    for (WidgetInfo w: widgets.getWidgets()) {
      for (WidgetAST m: ASTUtil.methods(w.getDeclaration())) {
        if (ASTUtil.isBuildMethod(m.getText())) {
          findConsumers(w.getName(), m.getText(), ASTUtil.functionBody(m),
              new ArrayDeque<WidgetTreeNode>(), providers, states, consumers);
        }
      }
    }

    for (ConsumerInfo c: consumers) {
      if (!c.isResolved()) {
        diagnostics.report(DiagnosticKind.ANALYSIS_WARNING, "No " +
            c.getProviderName() + " provider above " + c.getEnclosingClass() +
            " in the widget tree", c.getLocation());
      }
    }
    logger.debug("Context analysis: " + providers.size() + " providers, " +
                 consumers.size() + " consumers");
    return new ContextAnalysis(new ArrayList<ProviderInfo>(providers.values()),
                               consumers);
  }

  private void indexTree(List<WidgetTreeNode> forest) {
    for (WidgetTreeNode root: forest) {
      roots.put(root.getName(), root);
      indexNode(root, root.getName());
    }
  }

  private void indexNode(WidgetTreeNode node, String cls) {
    owningClass.put(node, cls);
    for (WidgetTreeNode child: node.getChildren()) {
      parents.put(child, node);
      byCall.put(Pair.of(child.getName(), child.getLocation()), child);
      usages.put(child.getName(), child);
      indexNode(child, cls);
    }
  }

  /**
   * Superclass or mixin names containing InheritedWidget, Provider or
   * ChangeNotifier mark a provider.
   */
  static ProviderInfo providerInfo(WidgetInfo w) {
    List<String> supers = new ArrayList<String>();
    if (w.getSuperclass() != null) {
      supers.add(w.getSuperclass());
    }
    for (WidgetAST mixin: w.getDeclaration().child(2).children()) {
      supers.add(ASTUtil.bareName(mixin.getText()));
    }
    for (String s: supers) {
      ProviderKind kind = null;
      if (s.contains("InheritedWidget") || s.contains("InheritedNotifier") ||
          s.contains("InheritedModel")) {
        kind = ProviderKind.INHERITED_WIDGET;
      } else if (s.contains("ChangeNotifier")) {
        kind = ProviderKind.CHANGE_NOTIFIER;
      } else if (s.contains("Provider")) {
        kind = ProviderKind.PROVIDER;
      }
      if (kind != null) {
        return new ProviderInfo(w.getName(), s, kind, w.getLocation());
      }
    }
    return null;
  }

  /**
   * Walk a build method body, tracking the enclosing constructor calls
   */
  private void findConsumers(String cls, String method, WidgetAST e,
      Deque<WidgetTreeNode> enclosing, Map<String, ProviderInfo> providers,
      StateAnalysis states, List<ConsumerInfo> out) {
    String consumed = consumedProvider(e, providers);
    if (consumed != null) {
      WidgetTreeNode start = enclosing.isEmpty() ? roots.get(cls)
                                                 : enclosing.peek();
      WidgetTreeNode match = null;
      if (start != null) {
        match = nearestProvider(start, consumed, providers, states);
      }
      logger.trace("Consumer of " + consumed + " in " + cls + "." + method +
                   (match == null ? " unresolved" : " matched"));
      out.add(new ConsumerInfo(consumed, cls, method, e.getLocation(),
                               match));
    }

    String constructed = ASTUtil.constructedClass(e);
    WidgetTreeNode node = constructed == null ? null :
        byCall.get(Pair.of(constructed, e.getLocation()));
    if (node != null) {
      enclosing.push(node);
    }
    for (WidgetAST c: e.children()) {
      findConsumers(cls, method, c, enclosing, providers, states, out);
    }
    if (node != null) {
      enclosing.pop();
    }
  }

  /**
   * @return provider name if e is X.of(ctx), Provider.of&lt;X&gt;(ctx)
   *         or ctx.watch&lt;X&gt;(), else null
   */
  private static String consumedProvider(WidgetAST e,
                                         Map<String, ProviderInfo> providers) {
    if (e.getType() != ASTType.METHOD_CALL ||
        e.child(0).getType() != ASTType.IDENTIFIER) {
      return null;
    }
    String target = e.child(0).getText();
    WidgetAST typeArgs = e.child(1);
    int argc = e.child(2).childCount();
    if (e.getText().equals(OF) && argc >= 1) {
      if (providers.containsKey(target)) {
        return target;
      }
      if (target.equals("Provider") && typeArgs.childCount() == 1) {
        return ASTUtil.bareName(typeArgs.child(0).getText());
      }
    } else if (CONTEXT_LOOKUPS.contains(e.getText()) &&
               typeArgs.childCount() == 1 &&
               !ASTUtil.isClassName(target)) {
      return ASTUtil.bareName(typeArgs.child(0).getText());
    }
    return null;
  }

  /**
   * Breadth-first search upwards: first the lexically enclosing calls,
   * then the places the enclosing class is constructed.
   */
  private WidgetTreeNode nearestProvider(WidgetTreeNode start,
      String provider, Map<String, ProviderInfo> providers,
      StateAnalysis states) {
    boolean notifier = providers.containsKey(provider) &&
        providers.get(provider).getKind() == ProviderKind.CHANGE_NOTIFIER;
    Deque<WidgetTreeNode> queue = new ArrayDeque<WidgetTreeNode>();
    Set<String> visitedClasses = new HashSet<String>();
    queue.add(start);
    while (!queue.isEmpty()) {
      WidgetTreeNode n = queue.poll();
      // Walk to the root of this tree
      for (WidgetTreeNode cur = n; cur != null; cur = parents.get(cur)) {
        if (parents.containsKey(cur) && matches(cur, provider, notifier)) {
          return cur;
        }
        if (!parents.containsKey(cur)) {
          // Root: continue from where its class is constructed
          String cls = owningClass.get(cur);
          List<String> names = new ArrayList<String>();
          names.add(cls);
          String owner = states.ownerOf(cls);
          if (owner != null) {
            names.add(owner);
          }
          for (String name: names) {
            if (visitedClasses.add(name)) {
              for (WidgetTreeNode use: usages.get(name)) {
                queue.add(use);
              }
            }
          }
        }
      }
    }
    return null;
  }

  private static boolean matches(WidgetTreeNode node, String provider,
                                 boolean notifier) {
    return node.getName().equals(provider) ||
           (notifier && node.getName().endsWith("Provider"));
  }
}
