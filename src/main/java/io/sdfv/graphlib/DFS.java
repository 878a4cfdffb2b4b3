// Copyright 2014 The Bazel Authors. All rights reserved.
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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * The DFS class encapsulates a depth-first search visitation, including the order in which nodes
 * are reported relative to their successors (PREORDER/POSTORDER), how deep the search may go and
 * which nodes have been seen already.
 *
 * <p>The search follows {@link LabeledGraph#neighbors} and keeps its own explicit stack, so long
 * chains do not exhaust the call stack. Successors are examined in adjacency (insertion) order,
 * from a snapshot taken when their node is entered.
 *
 * <p>Several calls to {@link #visit} share the marked set: a node reached by an earlier tree is
 * not entered again. Clients should not modify the graph while a traversal is in progress.
 */
final class DFS {

  // (Preferred over a boolean to avoid parameter confusion.)
  enum Order {
    PREORDER,
    POSTORDER
  }

  private final LabeledGraph<?, ?> graph;

  private final Order order; // = (PREORDER|POSTORDER)

  private final int depthLimit;

  private final Set<String> marked = new HashSet<>();

  /**
   * Constructs a DFS instance for searching over {@code graph}.
   *
   * @param order PREORDER or POSTORDER, determines node visitation order
   * @param depthLimit the maximum depth of the search tree; the root is at depth 1. Nodes at the
   *     limit are discovered but their successors are not examined.
   */
  DFS(LabeledGraph<?, ?> graph, Order order, int depthLimit) {
    checkArgument(depthLimit > 0, "depthLimit must be positive: %s", depthLimit);
    this.graph = graph;
    this.order = order;
    this.depthLimit = depthLimit;
  }

  /** Constructs a DFS instance whose depth is only bounded by the size of the graph. */
  DFS(LabeledGraph<?, ?> graph, Order order) {
    this(graph, order, Math.max(1, graph.numberOfNodes()));
  }

  /** Returns the (immutable) set of nodes visited so far. */
  Set<String> getMarked() {
    return Collections.unmodifiableSet(marked);
  }

  /**
   * Visits the tree rooted at {@code root}, unless {@code root} has been visited already.
   *
   * @throws ElementNotFoundException if {@code root} is not a node of the graph
   */
  void visit(String root, GraphVisitor visitor) {
    graph.checkNode(root);
    if (!marked.add(root)) {
      return;
    }

    visitor.visitEdge(root, root, LabeledEdge.Label.FORWARD);
    if (order == Order.PREORDER) {
      visitor.visitNode(root);
    }

    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(root, depthLimit));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.children.hasNext()) {
        String child = frame.children.next();
        if (!marked.add(child)) {
          visitor.visitEdge(frame.node, child, LabeledEdge.Label.NONTREE);
          continue;
        }
        visitor.visitEdge(frame.node, child, LabeledEdge.Label.FORWARD);
        if (order == Order.PREORDER) {
          visitor.visitNode(child);
        }
        if (frame.depth > 1) {
          stack.push(new Frame(child, frame.depth - 1));
        } else {
          // Depth limit reached: retreat at once so FORWARD and REVERSE edges stay paired.
          if (order == Order.POSTORDER) {
            visitor.visitNode(child);
          }
          visitor.visitEdge(frame.node, child, LabeledEdge.Label.REVERSE);
        }
        continue;
      }

      stack.pop();
      if (order == Order.POSTORDER) {
        visitor.visitNode(frame.node);
      }
      if (!stack.isEmpty()) {
        visitor.visitEdge(stack.peek().node, frame.node, LabeledEdge.Label.REVERSE);
      }
    }
    visitor.visitEdge(root, root, LabeledEdge.Label.REVERSE);
  }

  private final class Frame {
    final String node;
    final int depth;
    final Iterator<String> children;

    Frame(String node, int depth) {
      this.node = node;
      this.depth = depth;
      this.children = ImmutableList.copyOf(graph.neighbors(node)).iterator();
    }
  }
}
