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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Partitions the nodes of a directed graph into strongly connected components.
 *
 * <p>This is Tarjan's algorithm with an explicit stack. We visit nodes depth-first, numbering them
 * in the order we first see them (preorder). Once all successors of a node are done, its lowlink is
 * the smallest preorder number it can reach through nodes not yet assigned to a component. A node
 * whose lowlink equals its own number is the first-visited node of its component, and the
 * component consists of it plus every node left on the component stack since it was visited.
 */
public final class StronglyConnectedComponents {

  private StronglyConnectedComponents() {}

  /**
   * Returns the strongly connected components of {@code graph}. Every node is in exactly one
   * component; a component is emitted only after every component reachable from it, i.e. in
   * reverse topological order of the component graph.
   */
  public static ImmutableList<ImmutableSet<String>> of(DirectedGraph<?, ?> graph) {
    checkNotNull(graph, "graph");
    Map<String, Integer> preorder = new HashMap<>();
    Map<String, Integer> lowlink = new HashMap<>();
    Set<String> assigned = new HashSet<>();

    // Nodes whose visit is complete but whose component has not been found yet.
    Deque<String> componentStack = new ArrayDeque<>();
    ImmutableList.Builder<ImmutableSet<String>> components = ImmutableList.builder();
    int counter = 0;

    for (String source : graph.nodes()) {
      if (assigned.contains(source)) {
        continue;
      }
      Deque<String> stack = new ArrayDeque<>();
      stack.push(source);
      while (!stack.isEmpty()) {
        String node = stack.peek();
        if (!preorder.containsKey(node)) {
          preorder.put(node, ++counter);
        }

        boolean done = true;
        for (String succ : graph.successors(node)) {
          if (!preorder.containsKey(succ)) {
            stack.push(succ);
            done = false;
            break;
          }
        }
        if (!done) {
          continue;
        }

        int nodePreorder = preorder.get(node);
        int low = nodePreorder;
        for (String succ : graph.successors(node)) {
          if (assigned.contains(succ)) {
            continue;
          }
          int succPreorder = preorder.get(succ);
          low = Math.min(low, succPreorder > nodePreorder ? lowlink.get(succ) : succPreorder);
        }
        lowlink.put(node, low);
        stack.pop();

        if (low == nodePreorder) {
          ImmutableSet.Builder<String> component = ImmutableSet.builder();
          component.add(node);
          assigned.add(node);
          while (!componentStack.isEmpty() && preorder.get(componentStack.peek()) > nodePreorder) {
            String member = componentStack.pop();
            component.add(member);
            assigned.add(member);
          }
          components.add(component.build());
        } else {
          componentStack.push(node);
        }
      }
    }
    return components.build();
  }
}
