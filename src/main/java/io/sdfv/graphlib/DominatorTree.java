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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The dominator tree of a directed graph, as computed by {@link Dominators#dominatorTree}. */
public final class DominatorTree {

  private final String root;
  private final ImmutableMap<String, ImmutableSet<String>> allDominated;
  private final DirectedGraph<Integer, Void> tree;

  DominatorTree(
      String root,
      ImmutableMap<String, ImmutableSet<String>> allDominated,
      DirectedGraph<Integer, Void> tree) {
    this.root = root;
    this.allDominated = allDominated;
    this.tree = tree;
  }

  public String root() {
    return root;
  }

  /**
   * Maps every node of the analyzed graph to the nodes it strictly dominates. Nodes unreachable
   * from the root map to the empty set.
   */
  public ImmutableMap<String, ImmutableSet<String>> allDominated() {
    return allDominated;
  }

  /**
   * The tree itself: an edge d -> n for every node n whose immediate dominator is d. Each node's
   * payload is its depth, the root being at depth 0. The tree belongs to the caller.
   */
  public DirectedGraph<Integer, Void> tree() {
    return tree;
  }

  /**
   * Returns the depth of {@code node} in the tree.
   *
   * @throws ElementNotFoundException if {@code node} is not reachable from the root
   */
  public int level(String node) {
    return tree.get(node);
  }

  /** Whether {@code dominator} strictly dominates {@code node}. */
  public boolean strictlyDominates(String dominator, String node) {
    ImmutableSet<String> dominated = allDominated.get(dominator);
    return dominated != null && dominated.contains(node);
  }
}
