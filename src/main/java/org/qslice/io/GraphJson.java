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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.Edge;
import org.qslice.graph.EdgeKind;
import org.qslice.graph.Node;

/**
 * Reads and writes DependencyGraphs as JSON: {@code {"nodes": [...], "edges": [...]}}. Each node
 * has an integer {@code id} (its position in the graph) and the six identifying fields; each edge
 * refers to its endpoints by id and names its kind in {@code type}.
 */
public final class GraphJson {

  // Static methods only
  private GraphJson() {}

  public static ObjectNode toJson(DependencyGraph graph) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    ArrayNode nodes = root.putArray("nodes");
    for (Node node : graph.nodes()) {
      ObjectNode obj = nodes.addObject();
      obj.put("id", graph.indexOf(node));
      obj.put("wire", node.wire);
      obj.put("time", node.time);
      obj.put("line", node.line);
      obj.put("action", node.action);
      obj.put("gate", node.gate);
      obj.put("local_name", node.localName);
    }
    ArrayNode edges = root.putArray("edges");
    for (Edge edge : graph.edges()) {
      ObjectNode obj = edges.addObject();
      obj.put("from", graph.indexOf(edge.src));
      obj.put("to", graph.indexOf(edge.dst));
      obj.put("type", edge.kind.label);
    }
    return root;
  }

  public static String toString(DependencyGraph graph) throws IOException {
    return Json.toString(toJson(graph));
  }

  public static void write(DependencyGraph graph, Path path) throws IOException {
    Json.write(toJson(graph), path);
  }

  public static DependencyGraph read(Path path) throws IOException {
    return fromJson(Json.read(path));
  }

  public static DependencyGraph parse(String text) throws IOException {
    return fromJson(Json.parse(text));
  }

  /**
   * Returns the graph represented by {@code root}. Nodes keep their order; definition nodes are
   * registered as the definitions of their locations.
   *
   * @throws IllegalArgumentException if {@code root} doesn't have the expected shape
   */
  public static DependencyGraph fromJson(JsonNode root) {
    Json.requireObject(root, "graph");
    DependencyGraph.Builder builder = DependencyGraph.builder();
    Map<Integer, Node> byId = new HashMap<>();
    for (JsonNode obj : requireArray(root, "nodes")) {
      Json.requireObject(obj, "node");
      Node node =
          new Node(
              Json.requireText(obj, "wire"),
              Json.requireInt(obj, "time"),
              Json.requireInt(obj, "line"),
              Json.requireText(obj, "action"),
              obj.path("gate").asText(""),
              obj.path("local_name").asText(""));
      if (byId.put(Json.requireInt(obj, "id"), node) != null) {
        throw new IllegalArgumentException("Duplicate node id in " + obj);
      }
      builder.addNode(node);
      if (node.isDefinition()) {
        builder.setDefinition(node.wire, node);
      }
    }
    for (JsonNode obj : requireArray(root, "edges")) {
      Json.requireObject(obj, "edge");
      builder.addEdge(
          endpoint(byId, obj, "from"),
          endpoint(byId, obj, "to"),
          EdgeKind.of(Json.requireText(obj, "type")));
    }
    return builder.build();
  }

  private static Node endpoint(Map<Integer, Node> byId, JsonNode edge, String field) {
    Node node = byId.get(Json.requireInt(edge, field));
    if (node == null) {
      throw new IllegalArgumentException("Unknown node id in edge " + edge);
    }
    return node;
  }

  private static JsonNode requireArray(JsonNode root, String field) {
    JsonNode value = root.get(field);
    if (value == null || !value.isArray()) {
      throw new IllegalArgumentException("Expected a '" + field + "' array");
    }
    return value;
  }
}
