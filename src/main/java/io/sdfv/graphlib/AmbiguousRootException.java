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

import com.google.common.collect.ImmutableSet;

/**
 * Thrown when an analysis has to infer its root node and the graph does not have exactly one
 * source. Callers recover by passing the root explicitly.
 */
public final class AmbiguousRootException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final ImmutableSet<String> candidates;

  AmbiguousRootException(ImmutableSet<String> candidates) {
    super(
        candidates.isEmpty()
            ? "No start node specified and the graph has no source node"
            : "No start node specified and the graph has "
                + candidates.size()
                + " source nodes: "
                + candidates);
    this.candidates = candidates;
  }

  /** The source nodes found while inferring the root; empty if there were none. */
  public ImmutableSet<String> candidates() {
    return candidates;
  }
}
