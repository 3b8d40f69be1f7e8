/*
 * Copyright 2025 The QSlice Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.qslice.graph;

import java.util.Objects;

/** A directed, typed dependency from {@code src} to {@code dst}. */
public final class Edge {
  public final Node src;
  public final Node dst;
  public final EdgeKind kind;

  public Edge(Node src, Node dst, EdgeKind kind) {
    this.src = src;
    this.dst = dst;
    this.kind = kind;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Edge edge
        && edge.src.equals(src)
        && edge.dst.equals(dst)
        && edge.kind == kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(src, dst, kind);
  }

  @Override
  public String toString() {
    return src + " -" + kind + "-> " + dst;
  }
}
