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

import com.google.common.base.Objects;

/**
 * An edge examined by a depth-first traversal, labeled with the role it played.
 *
 * <p>Each tree is bracketed by a {@code (root, root, FORWARD)} edge at its start and a {@code
 * (root, root, REVERSE)} edge at its end.
 */
public final class LabeledEdge {

  /** The role of an edge in a depth-first traversal. */
  public enum Label {
    /** A tree edge: the target was discovered through it. */
    FORWARD,
    /** The traversal retreats from the target back to the source. */
    REVERSE,
    /** The target had been discovered already. */
    NONTREE
  }

  private final String source;
  private final String target;
  private final Label label;

  public LabeledEdge(String source, String target, Label label) {
    this.source = checkNotNull(source, "source");
    this.target = checkNotNull(target, "target");
    this.label = checkNotNull(label, "label");
  }

  public String source() {
    return source;
  }

  public String target() {
    return target;
  }

  public Label label() {
    return label;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LabeledEdge)) {
      return false;
    }
    LabeledEdge that = (LabeledEdge) obj;
    return source.equals(that.source) && target.equals(that.target) && label == that.label;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(source, target, label);
  }

  @Override
  public String toString() {
    return "(" + source + ", " + target + ", " + label + ")";
  }
}
