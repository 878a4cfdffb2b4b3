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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * {@code UndirectedGraph} a graph with symmetric adjacency, suitable for relations where edge
 * direction is immaterial (layout adjacency, for instance).
 *
 * <p>Each edge is stored twice, once in the adjacency map of each endpoint, and both records share
 * the same payload instance. For all u, v: v is adjacent to u with payload P iff u is adjacent to
 * v with payload P. Self-edges are permitted; multiple edges between the same pair of nodes are
 * not.
 *
 * <p>{@link #edges()} yields every edge exactly once: the two physical records are collapsed by
 * content equality of {@link com.google.common.graph.EndpointPair#unordered unordered pairs}, and
 * {@link #numberOfEdges()} is the size of that set.
 */
public final class UndirectedGraph<N, E> extends LabeledGraph<N, E> {

  private final Map<String, Map<String, E>> adjacency = new LinkedHashMap<>();

  /** Construct an empty, unnamed UndirectedGraph. */
  public UndirectedGraph() {
    this("");
  }

  public UndirectedGraph(String name) {
    this(name, false);
  }

  /**
   * Construct an empty UndirectedGraph.
   *
   * @param compound whether the nodes may be arranged in a parent/child hierarchy
   */
  public UndirectedGraph(String name, boolean compound) {
    super(name, compound);
  }

  @Override
  void createAdjacency(String id) {
    adjacency.put(id, new LinkedHashMap<>());
  }

  @Override
  void removeAdjacency(String id) {
    Map<String, E> neighbors = adjacency.remove(id);
    for (String neighbor : neighbors.keySet()) {
      if (!neighbor.equals(id)) {
        adjacency.get(neighbor).remove(id);
      }
    }
  }

  @Override
  void link(String nodeU, String nodeV, @Nullable E payload) {
    adjacency.get(nodeU).put(nodeV, payload);
    adjacency.get(nodeV).put(nodeU, payload);
  }

  @Override
  boolean unlink(String nodeU, String nodeV) {
    Map<String, E> neighborsOfU = adjacency.get(nodeU);
    if (!neighborsOfU.containsKey(nodeV)) {
      return false;
    }
    neighborsOfU.remove(nodeV);
    adjacency.get(nodeV).remove(nodeU);
    return true;
  }

  @Override
  @Nullable
  Map<String, E> outgoing(String id) {
    return adjacency.get(id);
  }

  @Override
  void clearAdjacency() {
    adjacency.clear();
  }

  @Override
  public UndirectedGraph<N, E> copy() {
    UndirectedGraph<N, E> that = new UndirectedGraph<>(getName(), isCompound());
    induceInto(that, nodes());
    return that;
  }

  @Override
  public UndirectedGraph<N, E> subgraph(Set<String> ids) {
    checkNotNull(ids, "ids");
    UndirectedGraph<N, E> that = new UndirectedGraph<>("", isCompound());
    induceInto(that, ids);
    return that;
  }

  @Override
  public boolean isDirected() {
    return false;
  }

  @Override
  public Set<String> adjacentNodes(String node) {
    checkNode(node);
    return Collections.unmodifiableSet(adjacency.get(node).keySet());
  }

  @Override
  public Set<String> predecessors(String node) {
    return adjacentNodes(node);
  }

  @Override
  public Set<String> successors(String node) {
    return adjacentNodes(node);
  }
}
