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
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the loops of a directed graph the way a compiler finds the loops of a control-flow graph.
 *
 * <p>A depth-first traversal from a root classifies an edge (u, v) as a back edge when v is an
 * ancestor of u in the traversal tree, u itself included. Each back edge closes a natural loop:
 * its target (the loop header) plus every node that reaches its source without passing through
 * the header.
 */
public final class LoopAnalyzer {

  private static final Logger logger = LogManager.getLogger(LoopAnalyzer.class);

  private LoopAnalyzer() {}

  /** Equivalent to {@code allBackedges(graph, null, false)}. */
  public static BackedgeAnalysis allBackedges(DirectedGraph<?, ?> graph) {
    return allBackedges(graph, null, false);
  }

  /** Equivalent to {@code allBackedges(graph, start, false)}. */
  public static BackedgeAnalysis allBackedges(DirectedGraph<?, ?> graph, @Nullable String start) {
    return allBackedges(graph, start, false);
  }

  /**
   * Returns the back edges of a depth-first traversal of {@code graph} from {@code start}.
   *
   * <p>With {@code coalesceNested}, back edges sharing a header are compared by their natural
   * loops. A back edge whose loop is properly contained in the loop of another back edge with the
   * same header, or equals the loop of one found earlier, is moved to {@link
   * BackedgeAnalysis#eclipsedBackedges()}. For a while loop, for example, the loop edge stays a
   * back edge and a {@code continue} inside the loop is eclipsed. Without {@code coalesceNested}
   * every back edge is reported and nothing is eclipsed.
   *
   * @param start the root of the traversal; if null, the unique source node of the graph
   * @throws AmbiguousRootException if {@code start} is null and the graph does not have exactly
   *     one source node
   * @throws ElementNotFoundException if {@code start} is not a node of the graph
   */
  public static BackedgeAnalysis allBackedges(
      DirectedGraph<?, ?> graph, @Nullable String start, boolean coalesceNested) {
    checkNotNull(graph, "graph");
    String root = start == null ? inferRoot(graph) : start;

    BackedgeCollector collector = new BackedgeCollector();
    DFS dfs = new DFS(graph, DFS.Order.PREORDER);
    collector.beginVisit();
    dfs.visit(root, collector);
    collector.endVisit();

    ImmutableList<EndpointPair<String>> found = collector.backedges.build();
    logger.debug("Found {} back edges in a traversal from {}", found.size(), root);
    if (!coalesceNested) {
      return new BackedgeAnalysis(ImmutableSet.copyOf(found), ImmutableSet.of());
    }
    return coalesce(graph, found, dfs.getMarked());
  }

  /**
   * Returns the natural loop closed by {@code backedge}: its target, the loop header, plus every
   * node from which its source can be reached without passing through the header. The header
   * comes first.
   *
   * @throws ElementNotFoundException if {@code backedge} is not an edge of the graph
   */
  public static ImmutableSet<String> naturalLoop(
      DirectedGraph<?, ?> graph, EndpointPair<String> backedge) {
    checkNotNull(graph, "graph");
    checkNotNull(backedge, "backedge");
    checkArgument(backedge.isOrdered(), "a back edge has ordered endpoints: %s", backedge);
    if (!graph.hasEdge(backedge.source(), backedge.target())) {
      throw ElementNotFoundException.forEdge(backedge.source(), backedge.target(), true);
    }
    return naturalLoop(graph, backedge, node -> true);
  }

  private static ImmutableSet<String> naturalLoop(
      DirectedGraph<?, ?> graph, EndpointPair<String> backedge, Predicate<String> within) {
    Set<String> body = new LinkedHashSet<>();
    body.add(backedge.target());
    Deque<String> worklist = new ArrayDeque<>();
    worklist.push(backedge.source());
    while (!worklist.isEmpty()) {
      String node = worklist.pop();
      if (within.test(node) && body.add(node)) {
        graph.predecessors(node).forEach(worklist::push);
      }
    }
    return ImmutableSet.copyOf(body);
  }

  private static String inferRoot(DirectedGraph<?, ?> graph) {
    ImmutableSet<String> sources = graph.sources();
    if (sources.size() != 1) {
      throw new AmbiguousRootException(sources);
    }
    String root = sources.iterator().next();
    logger.debug("Using source node {} as the traversal root", root);
    return root;
  }

  private static BackedgeAnalysis coalesce(
      DirectedGraph<?, ?> graph, List<EndpointPair<String>> found, Set<String> reached) {
    // Loops are only compared with loops that have the same header.
    Map<String, List<Loop>> loopsByHeader = new LinkedHashMap<>();
    for (int i = 0; i < found.size(); i++) {
      EndpointPair<String> backedge = found.get(i);
      Loop loop = new Loop(backedge, i, naturalLoop(graph, backedge, reached::contains));
      loopsByHeader.computeIfAbsent(backedge.target(), k -> new ArrayList<>()).add(loop);
    }

    Set<EndpointPair<String>> eclipsed = new HashSet<>();
    for (List<Loop> loops : loopsByHeader.values()) {
      for (Loop inner : loops) {
        for (Loop outer : loops) {
          if (outer != inner && outer.eclipses(inner)) {
            eclipsed.add(inner.backedge);
            break;
          }
        }
      }
    }

    ImmutableSet.Builder<EndpointPair<String>> retained = ImmutableSet.builder();
    ImmutableSet.Builder<EndpointPair<String>> suppressed = ImmutableSet.builder();
    for (EndpointPair<String> backedge : found) {
      if (eclipsed.contains(backedge)) {
        suppressed.add(backedge);
      } else {
        retained.add(backedge);
      }
    }
    logger.debug("Coalesced {} nested back edges", eclipsed.size());
    return new BackedgeAnalysis(retained.build(), suppressed.build());
  }

  /** A back edge, its discovery index and the body of the loop it closes. */
  private static final class Loop {
    final EndpointPair<String> backedge;
    final int index;
    final ImmutableSet<String> body;

    Loop(EndpointPair<String> backedge, int index, ImmutableSet<String> body) {
      this.backedge = backedge;
      this.index = index;
      this.body = body;
    }

    /** Whether this loop encloses {@code other}; equal loops go to the earlier back edge. */
    boolean eclipses(Loop other) {
      if (!body.containsAll(other.body)) {
        return false;
      }
      return body.size() > other.body.size() || index < other.index;
    }
  }

  /**
   * Tracks the nodes on the current traversal path and reports edges back into that path. The
   * path grows on FORWARD edges and shrinks on REVERSE edges, including the root brackets.
   */
  private static final class BackedgeCollector extends AbstractGraphVisitor {

    private final Set<String> onPath = new HashSet<>();
    final ImmutableList.Builder<EndpointPair<String>> backedges = ImmutableList.builder();

    @Override
    public void visitEdge(String source, String target, LabeledEdge.Label label) {
      switch (label) {
        case FORWARD:
          onPath.add(target);
          break;
        case REVERSE:
          onPath.remove(target);
          break;
        case NONTREE:
          if (onPath.contains(target)) {
            backedges.add(EndpointPair.ordered(source, target));
          }
          break;
      }
    }
  }
}
