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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Depth-first traversals of a graph that report what they saw as plain lists.
 *
 * <p>Edges are followed through {@link LabeledGraph#neighbors}: successors in a {@link
 * DirectedGraph}, neighbours in an {@link UndirectedGraph}.
 */
public final class DepthFirstTraversal {

  private DepthFirstTraversal() {}

  /** Equivalent to {@code labeledEdges(graph, source, graph.numberOfNodes())}. */
  public static ImmutableList<LabeledEdge> labeledEdges(
      LabeledGraph<?, ?> graph, @Nullable String source) {
    return labeledEdges(graph, source, Math.max(1, graph.numberOfNodes()));
  }

  /**
   * Returns every edge examined by a depth-first search, in the order the search examined them,
   * labeled {@link LabeledEdge.Label#FORWARD FORWARD}, {@link LabeledEdge.Label#REVERSE REVERSE}
   * or {@link LabeledEdge.Label#NONTREE NONTREE}.
   *
   * @param source the root of the search; if null, every node not reached yet becomes the root of
   *     a new tree, in node order
   * @param depthLimit the maximum depth of a search tree, the root being at depth 1
   * @throws ElementNotFoundException if {@code source} is not a node of the graph
   */
  public static ImmutableList<LabeledEdge> labeledEdges(
      LabeledGraph<?, ?> graph, @Nullable String source, int depthLimit) {
    checkNotNull(graph, "graph");
    ImmutableList.Builder<LabeledEdge> edges = ImmutableList.builder();
    GraphVisitor collector =
        new AbstractGraphVisitor() {
          @Override
          public void visitEdge(String from, String to, LabeledEdge.Label label) {
            edges.add(new LabeledEdge(from, to, label));
          }
        };

    DFS dfs = new DFS(graph, DFS.Order.PREORDER, depthLimit);
    collector.beginVisit();
    Iterable<String> roots =
        source == null ? ImmutableList.copyOf(graph.nodes()) : ImmutableList.of(source);
    for (String root : roots) {
      dfs.visit(root, collector);
    }
    collector.endVisit();
    return edges.build();
  }

  /** Equivalent to {@code postorderNodes(graph, start, graph.numberOfNodes())}. */
  public static ImmutableList<String> postorderNodes(LabeledGraph<?, ?> graph, String start) {
    return postorderNodes(graph, start, Math.max(1, graph.numberOfNodes()));
  }

  /**
   * Returns the nodes reachable from {@code start} in depth-first post-order: each node comes
   * after every node discovered through it, and {@code start} comes last.
   *
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static ImmutableList<String> postorderNodes(
      LabeledGraph<?, ?> graph, String start, int depthLimit) {
    checkNotNull(graph, "graph");
    checkNotNull(start, "start");
    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(graph, DFS.Order.POSTORDER, depthLimit).visit(start, visitor);
    return visitor.visitedNodes.build();
  }

  /**
   * Returns the nodes reachable from {@code start} in depth-first pre-order, {@code start} first.
   *
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static ImmutableList<String> preorderNodes(LabeledGraph<?, ?> graph, String start) {
    checkNotNull(graph, "graph");
    checkNotNull(start, "start");
    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(graph, DFS.Order.PREORDER).visit(start, visitor);
    return visitor.visitedNodes.build();
  }

  private static final class CollectingVisitor extends AbstractGraphVisitor {
    final ImmutableList.Builder<String> visitedNodes = ImmutableList.builder();

    @Override
    public void visitNode(String node) {
      visitedNodes.add(node);
    }
  }
}
