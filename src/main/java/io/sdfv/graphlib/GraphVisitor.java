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

/**
 * A graph visitor interface, driven by {@link DFS}. Every edge the traversal examines is reported
 * once with its {@link LabeledEdge.Label label}, and every node is reported once, before or after
 * its successors depending on the {@link DFS.Order} of the visitation.
 */
interface GraphVisitor {

  /** Called before visitation commences. */
  void beginVisit();

  /** Called after visitation is complete. */
  void endVisit();

  void visitEdge(String source, String target, LabeledEdge.Label label);

  void visitNode(String node);
}
