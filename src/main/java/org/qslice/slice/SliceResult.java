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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Comparator;
import java.util.Map;
import java.util.function.Function;
import org.qslice.graph.Node;

/** The result of {@link Slicer#slice}: the nodes reached, and why each one was included. */
public final class SliceResult {
  public final Criterion criterion;
  public final Direction direction;

  /** The nodes that matched the criterion, in {@link Node#ORDER}. */
  public final ImmutableList<Node> matched;

  /** In discovery order. */
  private final ImmutableMap<Node, Explanation> explanations;

  SliceResult(
      Criterion criterion,
      Direction direction,
      ImmutableList<Node> matched,
      Map<Node, Explanation> explanations) {
    this.criterion = criterion;
    this.direction = direction;
    this.matched = ImmutableList.sortedCopyOf(Node.ORDER, matched);
    this.explanations = ImmutableMap.copyOf(explanations);
  }

  /** Returns every node in the slice, in {@link Node#ORDER}. */
  public ImmutableList<Node> nodes() {
    return ImmutableList.sortedCopyOf(Node.ORDER, explanations.keySet());
  }

  public int size() {
    return explanations.size();
  }

  public boolean contains(Node node) {
    return explanations.containsKey(node);
  }

  /** Returns the distinct wires of the nodes in the slice, sorted. */
  public ImmutableSortedSet<String> wires() {
    return collect(n -> n.wire);
  }

  public ImmutableSortedSet<Integer> times() {
    return collect(n -> n.time);
  }

  public ImmutableSortedSet<Integer> lines() {
    return collect(n -> n.line);
  }

  private <T extends Comparable<? super T>> ImmutableSortedSet<T> collect(Function<Node, T> fn) {
    return explanations.keySet().stream()
        .map(fn)
        .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.<T>naturalOrder()));
  }

  /** Returns the explanation of a node in the slice. */
  public Explanation explanation(Node node) {
    Explanation result = explanations.get(node);
    Preconditions.checkArgument(result != null, "%s is not in the slice", node);
    return result;
  }

  /**
   * Returns the chain of discovering neighbors from {@code node} back to a criterion node: the
   * first element is {@code node} and the last matched the criterion. The chain is a shortest one
   * but, when there are several of the same length, not necessarily any particular one.
   */
  public ImmutableList<Node> path(Node node) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node current = node; current != null; current = explanation(current).neighbor) {
      result.add(current);
    }
    return result.build();
  }

  @Override
  public String toString() {
    return String.format(
        "%s slice of %s: %s node(s) from %s match(es)",
        direction, criterion, explanations.size(), matched.size());
  }
}
