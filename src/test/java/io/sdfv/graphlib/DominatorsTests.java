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

import com.google.common.collect.ImmutableMap;
import com.google.common.graph.EndpointPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test for {@link Dominators}. */
class DominatorsTests {

  private DirectedGraph<Void, Void> digraph;

  /**
   * A diamond followed by a loop, plus a node "u" that is not reachable from "entry".
   *
   * <pre>
   *        entry
   *        /   \
   *       a     b
   *        \   /
   *          c  <-- u
   *         ^ |
   *         | v
   *          d
   *          |
   *         exit
   * </pre>
   */
  @BeforeEach
  void setUp() {
    digraph = new DirectedGraph<>();
    digraph.addEdge("entry", "a");
    digraph.addEdge("entry", "b");
    digraph.addEdge("a", "c");
    digraph.addEdge("b", "c");
    digraph.addEdge("c", "d");
    digraph.addEdge("d", "c");
    digraph.addEdge("d", "exit");
    digraph.addEdge("u", "c");
  }

  @Test
  void testImmediateDominators() {
    ImmutableMap<String, String> idoms = Dominators.immediateDominators(digraph, "entry");

    assertThat(idoms)
        .containsExactly(
            "entry", "entry",
            "a", "entry",
            "b", "entry",
            "c", "entry",
            "d", "c",
            "exit", "d");
    assertThat(idoms).doesNotContainKey("u");
  }

  @Test
  void testImmediateDominatorsOfChain() {
    DirectedGraph<Void, Void> chain = new DirectedGraph<>();
    chain.addEdge("x", "y");
    chain.addEdge("y", "z");

    assertThat(Dominators.immediateDominators(chain, "x"))
        .containsExactly("x", "x", "y", "x", "z", "y");
    assertThat(Dominators.immediateDominators(chain, "z")).containsExactly("z", "z");
  }

  @Test
  void testUnknownStartFails() {
    assertThrows(
        ElementNotFoundException.class, () -> Dominators.immediateDominators(digraph, "nowhere"));
    assertThrows(
        ElementNotFoundException.class, () -> Dominators.dominatorTree(digraph, "nowhere"));
  }

  @Test
  void testDominatorTree() {
    DominatorTree dominatorTree = Dominators.dominatorTree(digraph, "entry");

    assertThat(dominatorTree.root()).isEqualTo("entry");
    assertThat(dominatorTree.tree().edges())
        .containsExactly(
            EndpointPair.ordered("entry", "a"),
            EndpointPair.ordered("entry", "b"),
            EndpointPair.ordered("entry", "c"),
            EndpointPair.ordered("c", "d"),
            EndpointPair.ordered("d", "exit"));
    assertThat(dominatorTree.tree().nodes()).doesNotContain("u");
  }

  @Test
  void testLevels() {
    DominatorTree dominatorTree = Dominators.dominatorTree(digraph, "entry");

    assertThat(dominatorTree.level("entry")).isEqualTo(0);
    assertThat(dominatorTree.level("a")).isEqualTo(1);
    assertThat(dominatorTree.level("c")).isEqualTo(1);
    assertThat(dominatorTree.level("d")).isEqualTo(2);
    assertThat(dominatorTree.level("exit")).isEqualTo(3);
    assertThrows(ElementNotFoundException.class, () -> dominatorTree.level("u"));
  }

  @Test
  void testAllDominated() {
    DominatorTree dominatorTree = Dominators.dominatorTree(digraph, "entry");

    assertThat(dominatorTree.allDominated().keySet()).isEqualTo(digraph.nodes());
    assertThat(dominatorTree.allDominated().get("entry"))
        .containsExactly("a", "b", "c", "d", "exit");
    assertThat(dominatorTree.allDominated().get("c")).containsExactly("d", "exit");
    assertThat(dominatorTree.allDominated().get("exit")).isEmpty();
    assertThat(dominatorTree.allDominated().get("u")).isEmpty();

    assertThat(dominatorTree.strictlyDominates("c", "exit")).isTrue();
    assertThat(dominatorTree.strictlyDominates("c", "c")).isFalse();
    assertThat(dominatorTree.strictlyDominates("a", "c")).isFalse();
  }

  @Test
  void testDominatorTreeFromPrecomputedDominators() {
    ImmutableMap<String, String> idoms = Dominators.immediateDominators(digraph, "entry");

    DominatorTree dominatorTree = Dominators.dominatorTree(digraph, "entry", idoms);

    assertThat(dominatorTree.allDominated())
        .isEqualTo(Dominators.dominatorTree(digraph, "entry").allDominated());
  }

  @Test
  void testPrecomputedDominatorsMustNameNodesOfTheGraph() {
    DirectedGraph<Void, Void> pair = new DirectedGraph<>();
    pair.addEdge("a", "b");

    ImmutableMap<String, String> idoms = ImmutableMap.of("a", "a", "b", "a", "z", "q");

    ElementNotFoundException e =
        assertThrows(
            ElementNotFoundException.class, () -> Dominators.dominatorTree(pair, "a", idoms));
    assertThat(e.ids()).containsExactly("z");
    assertThrows(
        ElementNotFoundException.class,
        () -> Dominators.dominatorTree(pair, "a", ImmutableMap.of("b", "q")));
  }

  @Test
  void testPrecomputedDominatorsMustLeadToTheStart() {
    DirectedGraph<Void, Void> pair = new DirectedGraph<>();
    pair.addEdge("a", "b");
    pair.addEdge("b", "a");

    assertThrows(
        IllegalArgumentException.class,
        () -> Dominators.dominatorTree(pair, "a", ImmutableMap.of("a", "b", "b", "a")));
    assertThrows(
        IllegalArgumentException.class,
        () -> Dominators.dominatorTree(pair, "a", ImmutableMap.of("b", "b")));
  }
}
