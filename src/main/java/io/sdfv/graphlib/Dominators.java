// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.sdfv.graphlib;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Dominance over a directed graph with a designated entry node.
 *
 * <p>Node d dominates node n if every path from the entry to n passes through d. The immediate
 * dominator of n is its closest strict dominator. Only nodes reachable from the entry take part.
 */
public final class Dominators {

  private static final Logger logger = LogManager.getLogger(Dominators.class);

  private Dominators() {}

  /**
   * Returns the immediate dominator of every node reachable from {@code start}; {@code start}
   * maps to itself. Uses the iterative algorithm of Cooper, Harvey and Kennedy over a depth-first
   * post-order.
   *
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static ImmutableMap<String, String> immediateDominators(
      DirectedGraph<?, ?> graph, String start) {
    checkNotNull(graph, "graph");
    ImmutableList<String> postorder = DepthFirstTraversal.postorderNodes(graph, start);
    Map<String, Integer> postorderNumber = new HashMap<>();
    for (int i = 0; i < postorder.size(); i++) {
      postorderNumber.put(postorder.get(i), i);
    }
    // Reverse post-order without the start node, which comes last in post-order.
    ImmutableList<String> order = postorder.subList(0, postorder.size() - 1).reverse();

    Map<String, String> idom = new LinkedHashMap<>();
    idom.put(start, start);
    boolean changed = true;
    int iterations = 0;
    while (changed) {
      changed = false;
      iterations++;
      for (String node : order) {
        String newIdom = null;
        for (String pred : graph.predecessors(node)) {
          if (!idom.containsKey(pred)) {
            continue;
          }
          newIdom = newIdom == null ? pred : intersect(pred, newIdom, idom, postorderNumber);
        }
        // A reverse post-order visits some predecessor of each node before the node itself.
        if (newIdom != null && !newIdom.equals(idom.get(node))) {
          idom.put(node, newIdom);
          changed = true;
        }
      }
    }
    logger.debug("Immediate dominators from {} converged after {} passes", start, iterations);
    return ImmutableMap.copyOf(idom);
  }

  /** Walks two fingers up the dominator tree built so far until they meet. */
  private static String intersect(
      String nodeU, String nodeV, Map<String, String> idom, Map<String, Integer> postorderNumber) {
    String u = nodeU;
    String v = nodeV;
    while (!u.equals(v)) {
      while (postorderNumber.get(u) < postorderNumber.get(v)) {
        u = idom.get(u);
      }
      while (postorderNumber.get(v) < postorderNumber.get(u)) {
        v = idom.get(v);
      }
    }
    return u;
  }

  /** Follows immediate dominators from {@code node} to the node that dominates itself. */
  private static String rootOfChain(String node, Map<String, String> idoms) {
    String current = node;
    for (int steps = 0; steps <= idoms.size(); steps++) {
      String next = idoms.get(current);
      if (next == null || next.equals(current)) {
        return current;
      }
      current = next;
    }
    throw new IllegalArgumentException("Immediate dominators of " + node + " form a cycle");
  }

  /**
   * Builds the dominator tree of {@code graph} rooted at {@code start}, together with the set of
   * nodes each node strictly dominates.
   *
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static DominatorTree dominatorTree(DirectedGraph<?, ?> graph, String start) {
    return dominatorTree(graph, start, immediateDominators(graph, start));
  }

  /**
   * As {@link #dominatorTree(DirectedGraph, String)}, reusing precomputed immediate dominators.
   *
   * @throws ElementNotFoundException if {@code start}, or a node or dominator in {@code idoms},
   *     is not a node of the graph
   * @throws IllegalArgumentException if the dominators in {@code idoms} do not all lead to {@code
   *     start}
   */
  public static DominatorTree dominatorTree(
      DirectedGraph<?, ?> graph, String start, Map<String, String> idoms) {
    checkNotNull(graph, "graph");
    checkNotNull(idoms, "idoms");
    graph.checkNode(start);
    idoms.forEach(
        (node, dom) -> {
          graph.checkNode(node);
          graph.checkNode(dom);
        });
    for (String node : idoms.keySet()) {
      String root = rootOfChain(node, idoms);
      checkArgument(root.equals(start), "Dominators of %s lead to %s, not %s", node, root, start);
    }

    Map<String, Set<String>> allDominated = new LinkedHashMap<>();
    for (String node : graph.nodes()) {
      allDominated.put(node, new LinkedHashSet<>());
    }
    DirectedGraph<Integer, Void> tree = new DirectedGraph<>();
    tree.addNode(start, 0);

    idoms.forEach(
        (node, dom) -> {
          if (node.equals(dom)) {
            return;
          }
          tree.addEdge(dom, node);
          // Every dominator of dom up to the root dominates node as well.
          String ancestor = dom;
          while (true) {
            allDominated.get(ancestor).add(node);
            String next = idoms.get(ancestor);
            if (next == null || next.equals(ancestor)) {
              break;
            }
            ancestor = next;
          }
        });

    // The payload of a tree node is its distance from the root.
    Queue<String> queue = new ArrayDeque<>();
    queue.add(start);
    while (!queue.isEmpty()) {
      String node = queue.remove();
      int level = tree.get(node);
      for (String child : tree.successors(node)) {
        tree.addNode(child, level + 1);
        queue.add(child);
      }
    }

    ImmutableMap.Builder<String, ImmutableSet<String>> dominated = ImmutableMap.builder();
    allDominated.forEach((node, nodes) -> dominated.put(node, ImmutableSet.copyOf(nodes)));
    return new DominatorTree(start, dominated.build(), tree);
  }
}
