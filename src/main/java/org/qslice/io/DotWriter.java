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

package org.qslice.io;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.Edge;
import org.qslice.graph.EdgeKind;
import org.qslice.graph.Node;
import org.qslice.slice.SliceResult;

/**
 * Renders a DependencyGraph in Graphviz DOT. Time runs left to right and each wire gets its own
 * cluster; edge styles distinguish the edge kinds. Nodes of an optional slice are filled.
 */
public final class DotWriter {

  private static final ImmutableMap<EdgeKind, String> EDGE_STYLES =
      ImmutableMap.of(
          EdgeKind.TEMPORAL, "style=\"solid\"",
          EdgeKind.ENTANGLEMENT, "style=\"dashed\", penwidth=2",
          EdgeKind.MEASUREMENT, "style=\"dotted\"",
          EdgeKind.QUANTUM_TO_CLASSICAL, "style=\"bold\"");

  private final @Nullable SliceResult highlight;
  private final int maxNodes;

  /**
   * @param highlight if non-null, the nodes of this slice are filled
   * @param maxNodes if non-negative, only this many nodes (the earliest in {@link Node#ORDER})
   *     are drawn
   */
  public DotWriter(@Nullable SliceResult highlight, int maxNodes) {
    this.highlight = highlight;
    this.maxNodes = maxNodes;
  }

  public DotWriter() {
    this(null, -1);
  }

  public void write(DependencyGraph graph, Path path) throws IOException {
    Files.writeString(path, render(graph), StandardCharsets.UTF_8);
  }

  public String render(DependencyGraph graph) {
    List<Node> drawn =
        graph.nodes().stream()
            .sorted(Node.ORDER)
            .limit((maxNodes < 0) ? Long.MAX_VALUE : maxNodes)
            .collect(Collectors.toList());
    Map<Node, Integer> ids = new HashMap<>();
    drawn.forEach(n -> ids.put(n, graph.indexOf(n)));
    // Clusters appear in the order their wires first appear in the graph.
    SetMultimap<String, Node> byWire = LinkedHashMultimap.create();
    graph.nodes().stream().filter(ids::containsKey).forEach(n -> byWire.put(n.wire, n));

    StringBuilder sb = new StringBuilder();
    sb.append("digraph QDG {\n");
    sb.append("  rankdir=LR;\n");
    sb.append("  compound=true;\n");
    sb.append("  node [shape=box, fontsize=10];\n");
    sb.append("  graph [fontsize=12];\n");
    int cluster = 0;
    for (String wire : byWire.keySet()) {
      sb.append("  subgraph cluster_w").append(cluster++).append(" {\n");
      sb.append("    style=\"rounded\";\n");
      sb.append("    label=\"").append(escape(wire)).append("\";\n");
      List<Node> nodes = byWire.get(wire).stream().sorted(Node.ORDER).collect(Collectors.toList());
      for (Node node : nodes) {
        sb.append("    n").append(ids.get(node)).append(" [");
        if (node.isDefinition()) {
          sb.append("shape=ellipse, ");
        }
        if (highlight != null && highlight.contains(node)) {
          sb.append("style=\"filled\", fillcolor=\"lightgray\", ");
        }
        sb.append("label=\"").append(escape(label(node))).append("\"];\n");
      }
      // Invisible edges keep each wire in time order.
      for (int i = 1; i < nodes.size(); i++) {
        sb.append("    n").append(ids.get(nodes.get(i - 1)));
        sb.append(" -> n").append(ids.get(nodes.get(i))).append(" [style=invis, weight=10];\n");
      }
      sb.append("  }\n");
    }
    Set<Node> included = ids.keySet();
    for (Edge edge : graph.edges()) {
      if (included.contains(edge.src) && included.contains(edge.dst)) {
        sb.append("  n").append(ids.get(edge.src)).append(" -> n").append(ids.get(edge.dst));
        String style = EDGE_STYLES.getOrDefault(edge.kind, "style=\"solid\"");
        sb.append(" [").append(style).append("];\n");
      }
    }
    sb.append("}\n");
    return sb.toString();
  }

  private static String label(Node node) {
    return node.gate.isEmpty() ? node.action : node.action + " " + node.gate;
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
