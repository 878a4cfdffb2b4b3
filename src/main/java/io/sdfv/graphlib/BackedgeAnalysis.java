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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.EndpointPair;

/**
 * The back edges found by {@link LoopAnalyzer#allBackedges}, split into the edges that close a
 * loop and the edges whose loop is nested inside another loop with the same header.
 */
public final class BackedgeAnalysis {

  private final ImmutableSet<EndpointPair<String>> backedges;
  private final ImmutableSet<EndpointPair<String>> eclipsedBackedges;

  BackedgeAnalysis(
      ImmutableSet<EndpointPair<String>> backedges,
      ImmutableSet<EndpointPair<String>> eclipsedBackedges) {
    this.backedges = checkNotNull(backedges, "backedges");
    this.eclipsedBackedges = checkNotNull(eclipsedBackedges, "eclipsedBackedges");
  }

  /** The retained back edges, in the order the traversal found them. */
  public ImmutableSet<EndpointPair<String>> backedges() {
    return backedges;
  }

  /**
   * The back edges suppressed in favour of an enclosing loop with the same header. Always empty
   * unless nested loops were coalesced.
   */
  public ImmutableSet<EndpointPair<String>> eclipsedBackedges() {
    return eclipsedBackedges;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BackedgeAnalysis)) {
      return false;
    }
    BackedgeAnalysis that = (BackedgeAnalysis) obj;
    return backedges.equals(that.backedges) && eclipsedBackedges.equals(that.eclipsedBackedges);
  }

  @Override
  public int hashCode() {
    return 31 * backedges.hashCode() + eclipsedBackedges.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("backedges", backedges)
        .add("eclipsedBackedges", eclipsedBackedges)
        .toString();
  }
}
