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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test for the node hierarchy, default payloads and data of {@link LabeledGraph}. */
class CompoundGraphTests {

  private DirectedGraph<String, Void> compound;

  /**
   * A compound graph with the hierarchy
   *
   * <pre>
   * outer
   *   inner
   *     leaf
   *   sibling
   * loose
   * </pre>
   *
   * and the edges leaf -> sibling -> loose.
   */
  @BeforeEach
  void setUp() {
    compound = new DirectedGraph<>("states", true);
    compound.addNode("outer");
    compound.addNode("inner");
    compound.addNode("leaf");
    compound.addNode("sibling");
    compound.addNode("loose");
    compound.setParent("inner", "outer");
    compound.setParent("leaf", "inner");
    compound.setParent("sibling", "outer");
    compound.addEdge("leaf", "sibling");
    compound.addEdge("sibling", "loose");
  }

  @Test
  void testGraphWithoutHierarchy() {
    UndirectedGraph<Void, Void> graph = new UndirectedGraph<>();
    graph.addEdge("a", "b");

    assertThat(graph.isCompound()).isFalse();
    assertThat(graph.parent("a")).isNull();
    assertThat(graph.children(null)).containsExactly("a", "b").inOrder();
    assertThat(graph.children("a")).isEmpty();
    assertThrows(ElementNotFoundException.class, () -> graph.children("c"));
    assertThrows(IllegalStateException.class, () -> graph.setParent("a", "b"));
  }

  @Test
  void testParentsAndChildren() {
    assertThat(compound.isCompound()).isTrue();
    assertThat(compound.parent("leaf")).isEqualTo("inner");
    assertThat(compound.parent("inner")).isEqualTo("outer");
    assertThat(compound.parent("outer")).isNull();
    assertThat(compound.children(null)).containsExactly("outer", "loose").inOrder();
    assertThat(compound.children("outer")).containsExactly("inner", "sibling").inOrder();
    assertThat(compound.children("leaf")).isEmpty();
  }

  @Test
  void testNewNodesStartAtTheTopLevel() {
    compound.addEdge("loose", "fresh");

    assertThat(compound.parent("fresh")).isNull();
    assertThat(compound.children(null)).containsExactly("outer", "loose", "fresh").inOrder();
  }

  @Test
  void testSetParentMovesTheNode() {
    compound.setParent("leaf", "loose");

    assertThat(compound.parent("leaf")).isEqualTo("loose");
    assertThat(compound.children("inner")).isEmpty();
    assertThat(compound.children("loose")).containsExactly("leaf");

    compound.setParent("leaf", null);

    assertThat(compound.parent("leaf")).isNull();
    assertThat(compound.children("loose")).isEmpty();
    assertThat(compound.children(null)).containsExactly("outer", "loose", "leaf").inOrder();
  }

  @Test
  void testSetParentRejectsCycles() {
    assertThrows(IllegalArgumentException.class, () -> compound.setParent("outer", "outer"));
    assertThrows(IllegalArgumentException.class, () -> compound.setParent("outer", "leaf"));

    assertThat(compound.parent("outer")).isNull();
    assertThat(compound.children(null)).containsExactly("outer", "loose").inOrder();
  }

  @Test
  void testUnknownNodesFail() {
    assertThrows(ElementNotFoundException.class, () -> compound.parent("nowhere"));
    assertThrows(ElementNotFoundException.class, () -> compound.children("nowhere"));
    assertThrows(ElementNotFoundException.class, () -> compound.setParent("nowhere", "outer"));
    ElementNotFoundException e =
        assertThrows(ElementNotFoundException.class, () -> compound.setParent("leaf", "nowhere"));
    assertThat(e.ids()).containsExactly("nowhere");
    assertThat(compound.parent("leaf")).isEqualTo("inner");
  }

  @Test
  void testRemovingANodeMovesItsChildrenToTheTopLevel() {
    compound.removeNode("inner");

    assertThat(compound.children("outer")).containsExactly("sibling");
    assertThat(compound.parent("leaf")).isNull();
    assertThat(compound.children(null)).containsExactly("outer", "loose", "leaf").inOrder();
    assertThat(compound.successors("leaf")).containsExactly("sibling");
  }

  @Test
  void testClearEmptiesTheHierarchy() {
    compound.clear();
    compound.addNode("outer");

    assertThat(compound.isCompound()).isTrue();
    assertThat(compound.children(null)).containsExactly("outer");
    assertThat(compound.children("outer")).isEmpty();
  }

  @Test
  void testCopyKeepsTheHierarchy() {
    DirectedGraph<String, Void> copy = compound.copy();
    copy.setParent("leaf", null);

    assertThat(copy.isCompound()).isTrue();
    assertThat(copy.children("outer")).containsExactly("inner", "sibling");
    assertThat(copy.parent("leaf")).isNull();
    assertThat(compound.parent("leaf")).isEqualTo("inner");
  }

  @Test
  void testSubgraphKeepsLinksBetweenKeptNodes() {
    DirectedGraph<String, Void> sub =
        compound.subgraph(ImmutableSet.of("inner", "leaf", "sibling"));

    assertThat(sub.isCompound()).isTrue();
    assertThat(sub.parent("leaf")).isEqualTo("inner");
    assertThat(sub.parent("inner")).isNull();
    assertThat(sub.parent("sibling")).isNull();
    assertThat(sub.children(null)).containsExactly("inner", "sibling");
    assertThat(sub.hasEdge("leaf", "sibling")).isTrue();
  }

  @Test
  void testReversedKeepsTheHierarchy() {
    DirectedGraph<String, Void> reversed = compound.reversed();

    assertThat(reversed.parent("leaf")).isEqualTo("inner");
    assertThat(reversed.hasEdge("loose", "sibling")).isTrue();
  }

  @Test
  void testHierarchyIsNotPartOfEquality() {
    DirectedGraph<String, Void> flat = new DirectedGraph<>();
    flat.addNode("outer");
    flat.addNode("inner");
    flat.addEdge("leaf", "sibling");
    flat.addEdge("sibling", "loose");

    assertThat(flat).isEqualTo(compound);
  }

  @Test
  void testDefaultNodePayload() {
    DirectedGraph<String, Void> graph = new DirectedGraph<>();
    graph.addNode("before");
    graph.setDefaultNodePayload("blank");
    graph.addNode("after");
    graph.addEdge("after", "endpoint");
    graph.addNode("explicit", "given");

    assertThat(graph.get("before")).isNull();
    assertThat(graph.get("after")).isEqualTo("blank");
    assertThat(graph.get("endpoint")).isEqualTo("blank");
    assertThat(graph.get("explicit")).isEqualTo("given");
  }

  @Test
  void testDefaultNodePayloadFunction() {
    UndirectedGraph<String, Void> graph = new UndirectedGraph<>();
    graph.setDefaultNodePayloadFunction(id -> "node " + id);
    graph.addNodes(ImmutableSet.of("a", "b"));
    graph.addNode("c", null);

    assertThat(graph.get("a")).isEqualTo("node a");
    assertThat(graph.get("b")).isEqualTo("node b");
    assertThat(graph.get("c")).isEqualTo("node c");
    assertThat(graph.copy().get("a")).isEqualTo("node a");
    assertThrows(NullPointerException.class, () -> graph.setDefaultNodePayloadFunction(null));
  }

  @Test
  void testGraphData() {
    Object layout = new Object();
    assertThat(compound.getData()).isNull();

    compound.setData(layout);

    assertThat(compound.getData()).isSameInstanceAs(layout);
    assertThat(compound.copy().getData()).isSameInstanceAs(layout);
    compound.clear();
    assertThat(compound.getData()).isSameInstanceAs(layout);
  }
}
