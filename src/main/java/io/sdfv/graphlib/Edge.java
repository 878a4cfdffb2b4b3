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
import com.google.common.graph.EndpointPair;
import javax.annotation.Nullable;

/**
 * An edge together with its (possibly absent) payload. The endpoints are ordered for edges of a
 * {@link DirectedGraph} and unordered for edges of an {@link UndirectedGraph}.
 */
public final class Edge<E> {

  private final EndpointPair<String> endpoints;
  @Nullable private final E payload;

  private Edge(EndpointPair<String> endpoints, @Nullable E payload) {
    this.endpoints = checkNotNull(endpoints, "endpoints");
    this.payload = payload;
  }

  public static <E> Edge<E> of(EndpointPair<String> endpoints, @Nullable E payload) {
    return new Edge<>(endpoints, payload);
  }

  public static <E> Edge<E> directed(String source, String target, @Nullable E payload) {
    return new Edge<>(EndpointPair.ordered(source, target), payload);
  }

  public static <E> Edge<E> undirected(String nodeU, String nodeV, @Nullable E payload) {
    return new Edge<>(EndpointPair.unordered(nodeU, nodeV), payload);
  }

  public EndpointPair<String> endpoints() {
    return endpoints;
  }

  /** The source of a directed edge; for an undirected edge, the first endpoint. */
  public String source() {
    return endpoints.nodeU();
  }

  /** The target of a directed edge; for an undirected edge, the second endpoint. */
  public String target() {
    return endpoints.nodeV();
  }

  @Nullable
  public E payload() {
    return payload;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Edge)) {
      return false;
    }
    Edge<?> that = (Edge<?>) obj;
    return endpoints.equals(that.endpoints) && Objects.equal(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(endpoints, payload);
  }

  @Override
  public String toString() {
    return endpoints + "=" + payload;
  }
}
