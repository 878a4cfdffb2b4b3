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

import com.google.common.collect.AbstractIterator;
import java.util.ArrayDeque;
import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/** Forward reachability over the edges of a graph. */
public final class Reachability {

  private Reachability() {}

  /**
   * Returns the nodes reachable from {@code start} along one or more edges, following {@link
   * LabeledGraph#neighbors} (successors, for a directed graph).
   *
   * <p>{@code start} itself is only included if it lies on a cycle through which it reaches
   * itself; it is never included just for being the start. The result is lazy: each call to
   * {@code iterator()} starts a fresh depth-first exploration, and each node is produced once.
   * Adding or removing nodes or edges while an iterator is in use makes its next call fail with a
   * {@link ConcurrentModificationException}.
   *
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static Iterable<String> allReachable(LabeledGraph<?, ?> graph, String start) {
    checkNotNull(graph, "graph");
    graph.checkNode(start);
    return () -> new ReachableIterator(graph, start);
  }

  private static final class ReachableIterator extends AbstractIterator<String> {

    private final LabeledGraph<?, ?> graph;
    private final Set<String> visited = new HashSet<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final int expectedModCount;

    ReachableIterator(LabeledGraph<?, ?> graph, String start) {
      this.graph = graph;
      this.expectedModCount = graph.modCount();
      stack.addAll(graph.neighbors(start));
    }

    @Override
    protected String computeNext() {
      if (graph.modCount() != expectedModCount) {
        throw new ConcurrentModificationException();
      }
      while (!stack.isEmpty()) {
        String node = stack.removeLast();
        if (visited.add(node)) {
          stack.addAll(graph.neighbors(node));
          return node;
        }
      }
      return endOfData();
    }
  }
}
