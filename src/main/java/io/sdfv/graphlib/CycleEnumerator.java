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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Enumerates the elementary cycles of a directed graph with Johnson's algorithm.
 *
 * <p>Self-loops are reported first. The remaining cycles are found one strongly connected
 * component at a time: pick a start node in the component, search depth-first for paths that
 * return to it while blocking nodes that cannot currently lead back, unblock them on the way back
 * from a successful path, then drop the start node and recurse on the components of what is left.
 * Every elementary cycle is reported exactly once, whatever its rotation.
 *
 * <p>All searches use explicit stacks and run on a private copy of the graph; the input graph is
 * never modified.
 */
public final class CycleEnumerator {

  private static final Logger logger = LogManager.getLogger(CycleEnumerator.class);

  private CycleEnumerator() {}

  /**
   * Returns the elementary cycles of {@code graph}. The result is lazy: cycles are computed while
   * iterating, and each call to {@code iterator()} starts over from a fresh snapshot of the graph.
   */
  public static Iterable<Cycle> simpleCycles(DirectedGraph<?, ?> graph) {
    checkNotNull(graph, "graph");
    return () -> new CycleIterator(graph);
  }

  private static final class CycleIterator extends AbstractIterator<Cycle> {

    /** The graph being searched, without its self-loops. */
    private final DirectedGraph<?, ?> remaining;

    private final Deque<Cycle> selfLoops = new ArrayDeque<>();
    private final Deque<Set<String>> components = new ArrayDeque<>();

    @Nullable private CircuitSearch search;

    CycleIterator(DirectedGraph<?, ?> graph) {
      remaining = graph.copy();
      for (String node : remaining.nodes()) {
        if (remaining.hasEdge(node, node)) {
          selfLoops.add(Cycle.selfLoop(node));
        }
      }
      for (Cycle selfLoop : selfLoops) {
        String node = selfLoop.nodes().get(0);
        remaining.removeEdge(node, node);
      }
      pushNontrivialComponents(remaining);
    }

    @Override
    protected Cycle computeNext() {
      if (!selfLoops.isEmpty()) {
        return selfLoops.poll();
      }
      while (true) {
        if (search == null) {
          if (components.isEmpty()) {
            return endOfData();
          }
          search = new CircuitSearch(remaining.subgraph(components.pop()));
        }
        Cycle cycle = search.next();
        if (cycle != null) {
          return cycle;
        }
        // Every cycle through the start node has been found; continue without it.
        pushNontrivialComponents(remaining.subgraph(search.rest));
        search = null;
      }
    }

    private void pushNontrivialComponents(DirectedGraph<?, ?> graph) {
      for (ImmutableSet<String> component : StronglyConnectedComponents.of(graph)) {
        if (component.size() > 1) {
          logger.trace("Queueing strongly connected component {}", component);
          components.push(new LinkedHashSet<>(component));
        }
      }
    }
  }

  /** Finds the elementary circuits through one start node of a strongly connected component. */
  private static final class CircuitSearch {

    private final DirectedGraph<?, ?> component;
    private final String startNode;

    /** The nodes of the component other than the start node. */
    final Set<String> rest;

    private final List<String> path = new ArrayList<>();
    private final List<EndpointPair<String>> edgePath = new ArrayList<>();
    private final Set<String> blocked = new HashSet<>();
    private final Set<String> closed = new HashSet<>();

    /** For each node, the nodes to unblock once it is unblocked. */
    private final Map<String, Set<String>> blockedBy = new HashMap<>();

    private final Deque<Frame> stack = new ArrayDeque<>();

    CircuitSearch(DirectedGraph<?, ?> component) {
      this.component = component;
      this.startNode = component.nodes().iterator().next();
      this.rest = new LinkedHashSet<>(component.nodes());
      rest.remove(startNode);

      path.add(startNode);
      blocked.add(startNode);
      stack.push(new Frame(startNode));
    }

    /** Returns the next circuit through the start node, or null once there are none left. */
    @Nullable
    Cycle next() {
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.successors.hasNext()) {
          String nextNode = frame.successors.next();
          if (nextNode.equals(startNode)) {
            edgePath.add(EndpointPair.ordered(frame.node, nextNode));
            Cycle cycle = new Cycle(ImmutableList.copyOf(path), ImmutableList.copyOf(edgePath));
            edgePath.remove(edgePath.size() - 1);
            closed.addAll(path);
            return cycle;
          }
          if (!blocked.contains(nextNode)) {
            path.add(nextNode);
            edgePath.add(EndpointPair.ordered(frame.node, nextNode));
            stack.push(new Frame(nextNode));
            closed.remove(nextNode);
            blocked.add(nextNode);
          }
          continue;
        }

        if (closed.contains(frame.node)) {
          unblock(frame.node);
        } else {
          for (String successor : component.successors(frame.node)) {
            blockedBy.computeIfAbsent(successor, k -> new HashSet<>()).add(frame.node);
          }
        }
        stack.pop();
        path.remove(path.size() - 1);
        if (!edgePath.isEmpty()) {
          edgePath.remove(edgePath.size() - 1);
        }
      }
      return null;
    }

    private void unblock(String node) {
      Deque<String> worklist = new ArrayDeque<>();
      worklist.push(node);
      while (!worklist.isEmpty()) {
        String current = worklist.pop();
        if (blocked.remove(current)) {
          Set<String> waiting = blockedBy.remove(current);
          if (waiting != null) {
            waiting.forEach(worklist::push);
          }
        }
      }
    }

    private final class Frame {
      final String node;
      final Iterator<String> successors;

      Frame(String node) {
        this.node = node;
        this.successors = ImmutableList.copyOf(component.successors(node)).iterator();
      }
    }
  }
}
