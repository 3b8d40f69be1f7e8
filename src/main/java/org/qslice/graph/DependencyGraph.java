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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A directed multigraph of {@link Node}s connected by typed {@link Edge}s. Two nodes may be
 * connected by several edges of different kinds, but never by two edges of the same kind in the
 * same direction.
 *
 * <p>DependencyGraphs are immutable and are created with a {@link Builder}. Nodes and edges are
 * enumerated in the order they were first added.
 */
public final class DependencyGraph {
  private final ImmutableMap<Node, Integer> nodes;
  private final ImmutableList<Edge> edges;
  private final ImmutableListMultimap<Node, Edge> outgoing;
  private final ImmutableListMultimap<Node, Edge> incoming;
  private final ImmutableMap<String, Node> definitions;

  private DependencyGraph(Builder builder) {
    ImmutableMap.Builder<Node, Integer> nodeIndex = ImmutableMap.builder();
    int i = 0;
    for (Node node : builder.nodes) {
      nodeIndex.put(node, i++);
    }
    this.nodes = nodeIndex.buildOrThrow();
    this.edges = ImmutableList.copyOf(builder.edges);
    ImmutableListMultimap.Builder<Node, Edge> out = ImmutableListMultimap.builder();
    ImmutableListMultimap.Builder<Node, Edge> in = ImmutableListMultimap.builder();
    for (Edge edge : edges) {
      out.put(edge.src, edge);
      in.put(edge.dst, edge);
    }
    this.outgoing = out.build();
    this.incoming = in.build();
    this.definitions = ImmutableMap.copyOf(builder.definitions);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns all nodes, in insertion order. */
  public ImmutableList<Node> nodes() {
    return nodes.keySet().asList();
  }

  /** Returns all edges, in insertion order. */
  public ImmutableList<Edge> edges() {
    return edges;
  }

  public boolean contains(Node node) {
    return nodes.containsKey(node);
  }

  /**
   * Returns the position of {@code node} in {@link #nodes}; this is the id used when the graph is
   * exported.
   */
  public int indexOf(Node node) {
    Integer index = nodes.get(node);
    Preconditions.checkArgument(index != null, "%s is not in the graph", node);
    return index;
  }

  /** Returns the edges leaving {@code node}, in insertion order. */
  public ImmutableList<Edge> outgoing(Node node) {
    return outgoing.get(node);
  }

  /** Returns the edges entering {@code node}, in insertion order. */
  public ImmutableList<Edge> incoming(Node node) {
    return incoming.get(node);
  }

  /**
   * Returns the node that most recently defined the given classical location, or null if no
   * measurement stored to it.
   */
  public @Nullable Node definitionOf(String store) {
    return definitions.get(store);
  }

  @Override
  public String toString() {
    return String.format("DependencyGraph(%s nodes, %s edges)", nodes.size(), edges.size());
  }

  /** Accumulates the nodes and edges of a DependencyGraph; adding either is idempotent. */
  public static final class Builder {
    private final Set<Node> nodes = new LinkedHashSet<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<String, Node> definitions = new LinkedHashMap<>();

    private Builder() {}

    /** Adds a node unless an equal node is already present; returns true if it was added. */
    @CanIgnoreReturnValue
    public boolean addNode(Node node) {
      return nodes.add(node);
    }

    /**
     * Adds an edge between two nodes that have already been added, unless there is already an
     * edge of the same kind between them; returns true if it was added.
     */
    @CanIgnoreReturnValue
    public boolean addEdge(Node src, Node dst, EdgeKind kind) {
      Preconditions.checkArgument(nodes.contains(src), "Unknown node %s", src);
      Preconditions.checkArgument(nodes.contains(dst), "Unknown node %s", dst);
      return edges.add(new Edge(src, dst, kind));
    }

    /** Records {@code node} as the current definition of a classical location. */
    @CanIgnoreReturnValue
    public Builder setDefinition(String store, Node node) {
      Preconditions.checkArgument(nodes.contains(node), "Unknown node %s", node);
      definitions.put(store, node);
      return this;
    }

    public @Nullable Node definitionOf(String store) {
      return definitions.get(store);
    }

    public DependencyGraph build() {
      return new DependencyGraph(this);
    }
  }
}
