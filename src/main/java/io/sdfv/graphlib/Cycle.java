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
import com.google.common.graph.EndpointPair;

/**
 * An elementary cycle of a directed graph: a closed walk that visits no node twice.
 *
 * <p>{@link #nodes()} lists the nodes in walk order, starting anywhere on the cycle. {@link
 * #edges()} lists the edges in the same order, the edge that closes the walk last. A self-loop is
 * a cycle of one node and one edge.
 */
public final class Cycle {

  private final ImmutableList<String> nodes;
  private final ImmutableList<EndpointPair<String>> edges;

  Cycle(ImmutableList<String> nodes, ImmutableList<EndpointPair<String>> edges) {
    checkArgument(!nodes.isEmpty(), "a cycle has at least one node");
    checkArgument(
        nodes.size() == edges.size(), "a cycle has as many edges as nodes: %s, %s", nodes, edges);
    this.nodes = nodes;
    this.edges = edges;
  }

  static Cycle selfLoop(String node) {
    return new Cycle(ImmutableList.of(node), ImmutableList.of(EndpointPair.ordered(node, node)));
  }

  public ImmutableList<String> nodes() {
    return nodes;
  }

  public ImmutableList<EndpointPair<String>> edges() {
    return edges;
  }

  /** The number of edges on the cycle. */
  public int length() {
    return edges.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Cycle)) {
      return false;
    }
    Cycle that = (Cycle) obj;
    return nodes.equals(that.nodes) && edges.equals(that.edges);
  }

  @Override
  public int hashCode() {
    return 31 * nodes.hashCode() + edges.hashCode();
  }

  @Override
  public String toString() {
    return "Cycle" + nodes;
  }
}
