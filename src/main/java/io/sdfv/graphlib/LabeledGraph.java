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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.AbstractGraph;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.MutableGraph;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A graph over string node ids in which every node and every edge may carry a payload.
 *
 * <p>Node payloads have type {@code N}, edge payloads type {@code E}; both are optional. A node
 * that was added without a payload gets the {@linkplain #setDefaultNodePayload default node
 * payload}, null unless set otherwise. A null payload is distinct from a node
 * that does not exist: {@link #get} returns null for the former and throws {@link
 * ElementNotFoundException} for the latter. The same holds for {@link #edge}.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>Every id that appears in an adjacency set is a node of the graph. Adding an edge creates
 *       missing endpoints with a null payload.
 *   <li>Removing a node removes every edge incident to it, on both sides.
 *   <li>Nodes and adjacency sets iterate in insertion order.
 *   <li>The sets and iterators returned by this class are live views. Mutating the graph while
 *       iterating over one of them fails fast with a {@link
 *       java.util.ConcurrentModificationException}.
 *   <li>{@link #copy} and {@link #subgraph} are shallow: the new graph owns its own adjacency
 *       structure but shares the payload objects with this graph. Payloads are expected to be
 *       treated as immutable.
 * </ul>
 *
 * <p>A <em>compound</em> graph additionally arranges its nodes in a forest: every node has at most
 * one parent, set with {@link #setParent}, and nodes without a parent are the top-level nodes
 * returned by {@code children(null)}. The hierarchy is independent of the edges.
 *
 * <p>Structural equality ({@link #equals}) is inherited from Guava and compares nodes and edges
 * only; payloads, the hierarchy and the graph data are not part of it.
 *
 * <p>Instances are not thread-safe.
 */
public abstract class LabeledGraph<N, E> extends AbstractGraph<String>
    implements MutableGraph<String> {

  /** Maps node ids to payloads. A null value is a node without payload. */
  private final Map<String, N> nodeTable = new LinkedHashMap<>();

  private String name;

  private final boolean compound;

  /** Maps a node of a compound graph to its parent. Top-level nodes have no entry. */
  private final Map<String, String> parents = new LinkedHashMap<>();

  /** Maps every node of a compound graph to its children. */
  private final Map<String, Set<String>> children = new LinkedHashMap<>();

  private final Set<String> topLevel = new LinkedHashSet<>();

  private Function<? super String, ? extends N> defaultNodePayload = id -> null;

  @Nullable private Object data;

  /** Counts structural changes, so that lazy traversals can fail fast. */
  private int modCount;

  LabeledGraph(String name, boolean compound) {
    this.name = checkNotNull(name, "name");
    this.compound = compound;
  }

  // *** Adjacency hooks implemented by the concrete graphs ***

  /** Creates the empty adjacency entries of a node that was just added. */
  abstract void createAdjacency(String id);

  /** Drops the adjacency entries of {@code id} and unlinks it from every neighbour. */
  abstract void removeAdjacency(String id);

  /** Links two existing nodes, overwriting the payload of an existing edge. */
  abstract void link(String nodeU, String nodeV, @Nullable E payload);

  /** Unlinks two existing nodes. Returns true iff they were linked. */
  abstract boolean unlink(String nodeU, String nodeV);

  /** Returns the outgoing payload map of {@code id}, or null if there is no such node. */
  @Nullable
  abstract Map<String, E> outgoing(String id);

  abstract void clearAdjacency();

  /**
   * Returns a shallow copy of this graph, keeping its name, its hierarchy, its default node
   * payload and its data.
   */
  public abstract LabeledGraph<N, E> copy();

  /**
   * Returns the subgraph induced by {@code ids}: exactly those nodes, with their payloads, and
   * every edge of this graph whose endpoints are both in {@code ids}. In a compound graph a node
   * keeps its parent if the parent is in {@code ids} as well, and becomes a top-level node
   * otherwise.
   *
   * @throws ElementNotFoundException if an id is not a node of this graph
   */
  public abstract LabeledGraph<N, E> subgraph(Set<String> ids);

  // *** Nodes ***

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = checkNotNull(name, "name");
  }

  /** Returns the data attached to the graph as a whole, or null if there is none. */
  @Nullable
  public Object getData() {
    return data;
  }

  public void setData(@Nullable Object data) {
    this.data = data;
  }

  /**
   * Sets the payload given to nodes that are added without one, including the endpoints created
   * by {@link #addEdge}. Nodes already in the graph are not affected.
   */
  public void setDefaultNodePayload(@Nullable N payload) {
    defaultNodePayload = id -> payload;
  }

  /**
   * Sets a function computing the payload of nodes that are added without one from their id. The
   * function may return null.
   */
  public void setDefaultNodePayloadFunction(Function<? super String, ? extends N> function) {
    defaultNodePayload = checkNotNull(function, "function");
  }

  /**
   * Returns the payload of node {@code id}, which is null if the node was added without one.
   *
   * @throws ElementNotFoundException if there is no such node
   */
  @Nullable
  public N get(String id) {
    checkNode(id);
    return nodeTable.get(id);
  }

  public boolean containsNode(String id) {
    return nodeTable.containsKey(checkNotNull(id, "id"));
  }

  /**
   * Adds a node with the default payload if it is not present yet. An existing node keeps its
   * payload.
   *
   * @return true iff the node was added
   */
  @Override
  public boolean addNode(String id) {
    if (containsNode(id)) {
      return false;
    }
    addNode(id, null);
    return true;
  }

  /**
   * Adds node {@code id} with the given payload. If the node already exists its payload is
   * replaced and its edges are kept. A null payload is replaced by the default node payload.
   */
  public void addNode(String id, @Nullable N payload) {
    checkNotNull(id, "id");
    if (!nodeTable.containsKey(id)) {
      createAdjacency(id);
      if (compound) {
        children.put(id, new LinkedHashSet<>());
        topLevel.add(id);
      }
      modCount++;
    }
    nodeTable.put(id, payload != null ? payload : defaultNodePayload.apply(id));
  }

  /** Adds every id with the default payload, replacing the payload of ids already present. */
  public void addNodes(Iterable<String> ids) {
    for (String id : ImmutableList.copyOf(ids)) {
      addNode(id, null);
    }
  }

  public void addNodesWithAttributes(Map<String, ? extends N> nodes) {
    for (String id : nodes.keySet()) {
      checkNotNull(id, "id");
    }
    nodes.forEach(this::addNode);
  }

  /**
   * Removes a node and every edge incident to it. In a compound graph the children of the node
   * become top-level nodes.
   *
   * @return true iff the node was present
   */
  @Override
  public boolean removeNode(String id) {
    if (!containsNode(id)) {
      return false;
    }
    removeAdjacency(id);
    nodeTable.remove(id);
    if (compound) {
      detach(id);
      for (String child : children.remove(id)) {
        parents.remove(child);
        topLevel.add(child);
      }
    }
    modCount++;
    return true;
  }

  public void removeNodes(Iterable<String> ids) {
    for (String id : ImmutableList.copyOf(ids)) {
      removeNode(id);
    }
  }

  // *** Hierarchy ***

  public boolean isCompound() {
    return compound;
  }

  /**
   * Returns the parent of {@code id}, or null if it is a top-level node. Every node of a graph
   * that is not compound is a top-level node.
   *
   * @throws ElementNotFoundException if there is no such node
   */
  @Nullable
  public String parent(String id) {
    checkNode(id);
    return parents.get(id);
  }

  /**
   * Moves {@code id} under {@code parent}, or to the top level if {@code parent} is null.
   *
   * @throws IllegalStateException if this graph is not compound
   * @throws ElementNotFoundException if {@code id} or {@code parent} is not a node
   * @throws IllegalArgumentException if {@code parent} is {@code id} or one of its descendants
   */
  public void setParent(String id, @Nullable String parent) {
    checkState(compound, "Cannot set parent in a non-compound graph");
    checkNode(id);
    if (parent != null) {
      checkNode(parent);
      for (String ancestor = parent; ancestor != null; ancestor = parents.get(ancestor)) {
        checkArgument(
            !ancestor.equals(id), "Setting parent %s of %s would create a cycle", parent, id);
      }
    }
    detach(id);
    if (parent == null) {
      topLevel.add(id);
    } else {
      parents.put(id, parent);
      children.get(parent).add(id);
    }
  }

  /**
   * Returns the children of {@code id} in the order they were attached, or the top-level nodes
   * if {@code id} is null. A graph that is not compound has no hierarchy: all its nodes are
   * top-level nodes and none has children.
   *
   * @throws ElementNotFoundException if {@code id} is not null and not a node
   */
  public Set<String> children(@Nullable String id) {
    if (id == null) {
      return compound ? Collections.unmodifiableSet(topLevel) : nodes();
    }
    checkNode(id);
    return compound ? Collections.unmodifiableSet(children.get(id)) : Collections.emptySet();
  }

  private void detach(String id) {
    String oldParent = parents.remove(id);
    if (oldParent == null) {
      topLevel.remove(id);
    } else {
      children.get(oldParent).remove(id);
    }
  }

  public int numberOfNodes() {
    return nodeTable.size();
  }

  /** Returns an unmodifiable live view of the node ids, in insertion order. */
  @Override
  public Set<String> nodes() {
    return Collections.unmodifiableSet(nodeTable.keySet());
  }

  /**
   * Returns the nodes one edge away from {@code id}: the neighbours of an undirected graph, the
   * successors of a directed one.
   *
   * @throws ElementNotFoundException if there is no such node
   */
  public Set<String> neighbors(String id) {
    return successors(id);
  }

  // *** Edges ***

  /** Adds an edge without payload, creating missing endpoints with the default payload. */
  public void addEdge(String nodeU, String nodeV) {
    addEdge(nodeU, nodeV, null);
  }

  /**
   * Adds an edge, creating missing endpoints with the default payload. Re-adding an existing edge
   * replaces its payload.
   */
  public void addEdge(String nodeU, String nodeV, @Nullable E payload) {
    checkNotNull(nodeU, "nodeU");
    checkNotNull(nodeV, "nodeV");
    addNode(nodeU);
    addNode(nodeV);
    link(nodeU, nodeV, payload);
    modCount++;
  }

  public void addEdges(Iterable<? extends EndpointPair<String>> edges) {
    ImmutableList<EndpointPair<String>> pairs = ImmutableList.copyOf(edges);
    pairs.forEach(this::checkOrdering);
    for (EndpointPair<String> pair : pairs) {
      addEdge(pair.nodeU(), pair.nodeV(), null);
    }
  }

  public void addEdgesWithAttributes(Iterable<? extends Edge<? extends E>> edges) {
    ImmutableList<Edge<? extends E>> copy = ImmutableList.copyOf(edges);
    for (Edge<? extends E> edge : copy) {
      checkOrdering(edge.endpoints());
    }
    for (Edge<? extends E> edge : copy) {
      addEdge(edge.source(), edge.target(), edge.payload());
    }
  }

  /**
   * Adds an edge without payload unless it is already present; an existing edge keeps its
   * payload.
   *
   * @return true iff the edge was added
   */
  @Override
  public boolean putEdge(String nodeU, String nodeV) {
    if (hasEdge(nodeU, nodeV)) {
      return false;
    }
    addEdge(nodeU, nodeV, null);
    return true;
  }

  @Override
  public boolean putEdge(EndpointPair<String> endpoints) {
    checkOrdering(endpoints);
    return putEdge(endpoints.nodeU(), endpoints.nodeV());
  }

  /**
   * Removes an edge. Idempotent: removing an edge that does not exist, including one whose
   * endpoints do not exist, has no effect.
   *
   * @return true iff the graph changed
   */
  @Override
  public boolean removeEdge(String nodeU, String nodeV) {
    checkNotNull(nodeU, "nodeU");
    checkNotNull(nodeV, "nodeV");
    if (nodeTable.containsKey(nodeU) && nodeTable.containsKey(nodeV) && unlink(nodeU, nodeV)) {
      modCount++;
      return true;
    }
    return false;
  }

  @Override
  public boolean removeEdge(EndpointPair<String> endpoints) {
    checkOrdering(endpoints);
    return removeEdge(endpoints.nodeU(), endpoints.nodeV());
  }

  public boolean hasEdge(String nodeU, String nodeV) {
    return hasEdgeConnecting(nodeU, nodeV);
  }

  /**
   * Returns the payload of the edge between {@code nodeU} and {@code nodeV}, which is null if the
   * edge was added without one.
   *
   * @throws ElementNotFoundException if there is no such edge
   */
  @Nullable
  public E edge(String nodeU, String nodeV) {
    checkNotNull(nodeU, "nodeU");
    checkNotNull(nodeV, "nodeV");
    Map<String, E> adjacent = outgoing(nodeU);
    if (adjacent == null || !adjacent.containsKey(nodeV)) {
      throw ElementNotFoundException.forEdge(nodeU, nodeV, isDirected());
    }
    return adjacent.get(nodeV);
  }

  /** Returns every edge of {@link #edges()} together with its payload. */
  public ImmutableList<Edge<E>> edgesWithAttributes() {
    ImmutableList.Builder<Edge<E>> result = ImmutableList.builderWithExpectedSize(numberOfEdges());
    for (EndpointPair<String> pair : edges()) {
      result.add(Edge.of(pair, edge(pair.nodeU(), pair.nodeV())));
    }
    return result.build();
  }

  /**
   * Returns the number of distinct edges, which is the size of {@link #edges()}. An undirected
   * edge is counted once although it is stored at both endpoints.
   */
  public int numberOfEdges() {
    return edges().size();
  }

  /**
   * Removes all nodes and edges and resets the name. The graph stays compound if it was; the
   * default node payload and the graph data are kept.
   */
  public void clear() {
    name = "";
    nodeTable.clear();
    clearAdjacency();
    parents.clear();
    children.clear();
    topLevel.clear();
    modCount++;
  }

  @Override
  public boolean allowsSelfLoops() {
    return true;
  }

  @Override
  public ElementOrder<String> nodeOrder() {
    return ElementOrder.insertion();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "["
        + (name.isEmpty() ? "" : name + ", ")
        + numberOfNodes()
        + " nodes, "
        + numberOfEdges()
        + " edges]";
  }

  // *** Helpers for the concrete graphs ***

  int modCount() {
    return modCount;
  }

  void checkNode(String id) {
    checkNotNull(id, "id");
    if (!nodeTable.containsKey(id)) {
      throw ElementNotFoundException.forNode(id);
    }
  }

  /** Adds the subgraph induced by {@code ids} to the empty graph {@code target}. */
  void induceInto(LabeledGraph<N, E> target, Set<String> ids) {
    copyNodesInto(target, ids);
    for (EndpointPair<String> pair : edges()) {
      if (ids.contains(pair.nodeU()) && ids.contains(pair.nodeV())) {
        target.link(pair.nodeU(), pair.nodeV(), edge(pair.nodeU(), pair.nodeV()));
      }
    }
  }

  /**
   * Adds the nodes {@code ids}, with their payloads and the hierarchy among them, to the empty
   * graph {@code target}, which is compound iff this graph is. The target takes over the default
   * node payload and the data.
   */
  void copyNodesInto(LabeledGraph<N, ?> target, Set<String> ids) {
    for (String id : ids) {
      checkNode(id);
    }
    target.defaultNodePayload = defaultNodePayload;
    target.data = data;
    for (String id : ids) {
      target.nodeTable.put(id, nodeTable.get(id));
      target.createAdjacency(id);
      if (compound) {
        target.children.put(id, new LinkedHashSet<>());
        target.topLevel.add(id);
      }
    }
    if (compound) {
      for (String id : ids) {
        String parent = parents.get(id);
        if (parent != null && ids.contains(parent)) {
          target.setParent(id, parent);
        }
      }
    }
  }

  private void checkOrdering(EndpointPair<?> endpoints) {
    checkNotNull(endpoints, "endpoints");
    checkArgument(
        endpoints.isOrdered() || !isDirected(),
        "Mismatch: unordered endpoints cannot be used with directed graphs");
  }
}
