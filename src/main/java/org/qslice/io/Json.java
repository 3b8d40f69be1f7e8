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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.qslice.graph.Node;

/** Helpers shared by the JSON codecs. */
final class Json {
  static final ObjectMapper MAPPER = new ObjectMapper();

  // Static methods only
  private Json() {}

  static String toString(JsonNode root) throws JsonProcessingException {
    return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
  }

  static void write(JsonNode root, Path path) throws IOException {
    Files.writeString(path, toString(root), StandardCharsets.UTF_8);
  }

  static JsonNode parse(String text) throws IOException {
    return MAPPER.readTree(text);
  }

  static JsonNode read(Path path) throws IOException {
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  /** Returns a required field of a JSON object, which must be an integer. */
  static int requireInt(JsonNode obj, String field) {
    JsonNode value = obj.get(field);
    if (value == null || !value.canConvertToInt()) {
      throw new IllegalArgumentException("Expected integer '" + field + "' in " + obj);
    }
    return value.asInt();
  }

  /** Returns a required field of a JSON object, which must be a string. */
  static String requireText(JsonNode obj, String field) {
    JsonNode value = obj.get(field);
    if (value == null || !value.isTextual()) {
      throw new IllegalArgumentException("Expected string '" + field + "' in " + obj);
    }
    return value.asText();
  }

  /** Returns an optional string field, or null if it is absent or JSON null. */
  static @Nullable String optionalText(JsonNode obj, String field) {
    JsonNode value = obj.get(field);
    return (value == null || value.isNull()) ? null : value.asText();
  }

  static JsonNode requireObject(JsonNode node, String what) {
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected " + what + " to be a JSON object");
    }
    return node;
  }

  /** Returns the brief form of a node used in slices: wire, time, line, action, gate, name. */
  static ObjectNode brief(Node node) {
    ObjectNode result = MAPPER.createObjectNode();
    result.put("wire", node.wire);
    result.put("time", node.time);
    result.put("line", node.line);
    result.put("action", node.action);
    result.put("gate", node.gate);
    result.put("local_name", node.localName);
    return result;
  }
}
