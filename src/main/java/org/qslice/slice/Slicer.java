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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.Edge;
import org.qslice.graph.Node;

/**
 * Computes slices of a {@link DependencyGraph}: the nodes reachable from the nodes matching a
 * {@link Criterion}, following edges forwards or backwards.
 *
 * <p>The traversal is breadth-first from all criterion nodes at once, visiting each node's edges
 * in insertion order. A node's {@link Explanation} is fixed when it is first discovered. The
 * graph is never modified, so independent slices of the same graph may be computed concurrently.
 */
public final class Slicer {

  // Static methods only
  private Slicer() {}

  /** Returns the nodes of {@code graph} that match {@code criterion}, in insertion order. */
  public static ImmutableList<Node> matching(DependencyGraph graph, Criterion criterion) {
    return graph.nodes().stream()
        .filter(criterion::matches)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the slice of {@code graph} for the given criterion and direction.
   *
   * @throws EmptyCriterionError if no node matches the criterion
   */
  public static SliceResult slice(
      DependencyGraph graph, Criterion criterion, Direction direction) {
    ImmutableList<Node> seeds = matching(graph, criterion);
    if (seeds.isEmpty()) {
      throw new EmptyCriterionError(criterion);
    }
    Map<Node, Explanation> explanations = new LinkedHashMap<>();
    ArrayDeque<Node> pending = new ArrayDeque<>();
    for (Node seed : seeds) {
      explanations.put(seed, Explanation.criterion(direction));
      pending.add(seed);
    }
    while (!pending.isEmpty()) {
      Node node = pending.poll();
      boolean backward = (direction == Direction.BACKWARD);
      for (Edge edge : backward ? graph.incoming(node) : graph.outgoing(node)) {
        Node next = backward ? edge.src : edge.dst;
        if (!explanations.containsKey(next)) {
          explanations.put(next, Explanation.discovered(edge.kind, direction, node));
          pending.add(next);
        }
      }
    }
    return new SliceResult(criterion, direction, seeds, explanations);
  }
}
