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
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * {@code DirectedGraph} a directed graph or "digraph" whose nodes and edges carry payloads,
 * suitable for modeling control flow between the states of a program.
 *
 * <p>An instance <code>G = &lt;V,E&gt;</code> consists of a set of nodes <code>V</code> and a set
 * of directed edges <code>E</code>, which is a subset of <code>V &times; V</code>. This permits
 * self-edges but does not represent multiple edges between the same pair of nodes.
 *
 * <p>Each node keeps a successor and a predecessor map. An edge (u, v) is stored once in the
 * successor map of u and once in the predecessor map of v, and both records share one payload
 * instance: v is a successor of u with payload P iff u is a predecessor of v with payload P.
 * Removing a node strips it from the maps of all its former neighbours.
 */
public final class DirectedGraph<N, E> extends LabeledGraph<N, E> {

  private final Map<String, Map<String, E>> succ = new LinkedHashMap<>();
  private final Map<String, Map<String, E>> pred = new LinkedHashMap<>();

  /** Construct an empty, unnamed DirectedGraph. */
  public DirectedGraph() {
    this("");
  }

  public DirectedGraph(String name) {
    this(name, false);
  }

  /**
   * Construct an empty DirectedGraph.
   *
   * @param compound whether the nodes may be arranged in a parent/child hierarchy
   */
  public DirectedGraph(String name, boolean compound) {
    super(name, compound);
  }

  @Override
  void createAdjacency(String id) {
    succ.put(id, new LinkedHashMap<>());
    pred.put(id, new LinkedHashMap<>());
  }

  @Override
  void removeAdjacency(String id) {
    for (String successor : succ.remove(id).keySet()) {
      if (!successor.equals(id)) {
        pred.get(successor).remove(id);
      }
    }
    for (String predecessor : pred.remove(id).keySet()) {
      if (!predecessor.equals(id)) {
        succ.get(predecessor).remove(id);
      }
    }
  }

  @Override
  void link(String nodeU, String nodeV, @Nullable E payload) {
    succ.get(nodeU).put(nodeV, payload);
    pred.get(nodeV).put(nodeU, payload);
  }

  @Override
  boolean unlink(String nodeU, String nodeV) {
    Map<String, E> successorsOfU = succ.get(nodeU);
    if (!successorsOfU.containsKey(nodeV)) {
      return false;
    }
    successorsOfU.remove(nodeV);
    pred.get(nodeV).remove(nodeU);
    return true;
  }

  @Override
  @Nullable
  Map<String, E> outgoing(String id) {
    return succ.get(id);
  }

  @Override
  void clearAdjacency() {
    succ.clear();
    pred.clear();
  }

  /**
   * Returns a duplicate graph with the same nodes, edges, payloads and name. The payloads
   * themselves are not cloned.
   */
  @Override
  public DirectedGraph<N, E> copy() {
    DirectedGraph<N, E> that = new DirectedGraph<>(getName(), isCompound());
    induceInto(that, nodes());
    return that;
  }

  @Override
  public DirectedGraph<N, E> subgraph(Set<String> ids) {
    checkNotNull(ids, "ids");
    DirectedGraph<N, E> that = new DirectedGraph<>("", isCompound());
    induceInto(that, ids);
    return that;
  }

  /**
   * Returns a new, unnamed graph with the same nodes, payloads and hierarchy in which every edge
   * points the other way.
   */
  public DirectedGraph<N, E> reversed() {
    DirectedGraph<N, E> that = new DirectedGraph<>("", isCompound());
    copyNodesInto(that, nodes());
    succ.forEach(
        (from, successors) -> successors.forEach((to, payload) -> that.link(to, from, payload)));
    return that;
  }

  @Override
  public boolean isDirected() {
    return true;
  }

  @Override
  public Set<String> adjacentNodes(String node) {
    return Sets.union(predecessors(node), successors(node));
  }

  @Override
  public Set<String> predecessors(String node) {
    checkNode(node);
    return Collections.unmodifiableSet(pred.get(node).keySet());
  }

  @Override
  public Set<String> successors(String node) {
    checkNode(node);
    return Collections.unmodifiableSet(succ.get(node).keySet());
  }

  /** Returns the edges ending at {@code node}, with their payloads. */
  public ImmutableList<Edge<E>> inEdges(String node) {
    checkNode(node);
    ImmutableList.Builder<Edge<E>> edges = ImmutableList.builder();
    pred.get(node).forEach((from, payload) -> edges.add(Edge.directed(from, node, payload)));
    return edges.build();
  }

  /** Returns the edges starting at {@code node}, with their payloads. */
  public ImmutableList<Edge<E>> outEdges(String node) {
    checkNode(node);
    ImmutableList.Builder<Edge<E>> edges = ImmutableList.builder();
    succ.get(node).forEach((to, payload) -> edges.add(Edge.directed(node, to, payload)));
    return edges.build();
  }

  /**
   * @return the set of source nodes: those with no predecessors. Isolated nodes are sources.
   *     <p>NOTE: in a cyclic graph, there may be nodes that are not reachable from any source.
   */
  public ImmutableSet<String> sources() {
    ImmutableSet.Builder<String> sources = ImmutableSet.builder();
    pred.forEach(
        (id, predecessors) -> {
          if (predecessors.isEmpty()) {
            sources.add(id);
          }
        });
    return sources.build();
  }

  /** @return the set of sink nodes: those with no successors. */
  public ImmutableSet<String> sinks() {
    ImmutableSet.Builder<String> sinks = ImmutableSet.builder();
    succ.forEach(
        (id, successors) -> {
          if (successors.isEmpty()) {
            sinks.add(id);
          }
        });
    return sinks.build();
  }
}
