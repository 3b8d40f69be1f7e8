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

package org.qslice.slice;

import org.jspecify.annotations.Nullable;
import org.qslice.graph.EdgeKind;
import org.qslice.graph.Node;

/**
 * Why a node is in a slice: either it matched the criterion, or it was first reached from {@code
 * neighbor} over an edge of kind {@code kind}.
 */
public final class Explanation {

  /** The reason type reported for criterion nodes. */
  public static final String CRITERION = "criterion";

  /** The kind of the edge the node was discovered over, or null for a criterion node. */
  public final @Nullable EdgeKind kind;

  public final Direction direction;

  /**
   * The node the traversal came from: for a backward slice the next node towards the criterion,
   * for a forward slice the previous node from it. Null for a criterion node.
   */
  public final @Nullable Node neighbor;

  private Explanation(@Nullable EdgeKind kind, Direction direction, @Nullable Node neighbor) {
    this.kind = kind;
    this.direction = direction;
    this.neighbor = neighbor;
  }

  static Explanation criterion(Direction direction) {
    return new Explanation(null, direction, null);
  }

  static Explanation discovered(EdgeKind kind, Direction direction, Node neighbor) {
    return new Explanation(kind, direction, neighbor);
  }

  public boolean isCriterion() {
    return kind == null;
  }

  /** Returns the edge kind's label, or {@link #CRITERION}. */
  public String reasonType() {
    return (kind == null) ? CRITERION : kind.label;
  }

  @Override
  public String toString() {
    return (neighbor == null)
        ? reasonType() + " " + direction
        : reasonType() + " " + direction + " from " + neighbor;
  }
}
