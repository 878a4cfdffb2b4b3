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

import com.google.common.collect.ImmutableList;

/**
 * Thrown when a node or an edge referenced by id does not exist in a graph.
 *
 * <p>This is distinct from a node or edge that exists without a payload: those lookups succeed and
 * return null. Extends {@link IllegalArgumentException} so that the graphs honour the {@link
 * com.google.common.graph.Graph} contract for unknown nodes.
 */
public final class ElementNotFoundException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> ids;

  private ElementNotFoundException(String message, ImmutableList<String> ids) {
    super(message);
    this.ids = ids;
  }

  static ElementNotFoundException forNode(String id) {
    return new ElementNotFoundException("Node " + id + " does not exist", ImmutableList.of(id));
  }

  static ElementNotFoundException forEdge(String nodeU, String nodeV, boolean directed) {
    String arrow = directed ? " -> " : " <-> ";
    return new ElementNotFoundException(
        "Edge " + nodeU + arrow + nodeV + " does not exist", ImmutableList.of(nodeU, nodeV));
  }

  /** The offending identifiers: one node id, or the two endpoints of a missing edge. */
  public ImmutableList<String> ids() {
    return ids;
  }

  public boolean isEdge() {
    return ids.size() == 2;
  }
}
