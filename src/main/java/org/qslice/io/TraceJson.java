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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import org.qslice.trace.Action;
import org.qslice.trace.ActionKind;
import org.qslice.trace.Trace;
import org.qslice.trace.Wire;
import org.qslice.trace.WireKind;

/**
 * Reads and writes Traces as JSON: one object per wire, keyed by wire id, holding the wire's kind
 * (and index, for register elements) and its Actions; plus a {@code _filename} entry for the
 * program path. Keys starting with {@code _} are metadata and are skipped when reading.
 *
 * <p>Action fields use the names {@code time}, {@code line}, {@code action}, {@code type} (the
 * gate), {@code ctrl} (the lineage, comma-separated; present on every gate application), {@code
 * store}, {@code with} (the paired wire), {@code if} (the conditions) and {@code local_name}.
 */
public final class TraceJson {

  /** The metadata key holding the program path. */
  public static final String FILENAME_KEY = "_filename";

  // Static methods only
  private TraceJson() {}

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

  public static ObjectNode toJson(Trace trace) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    for (Wire wire : trace.wires()) {
      ObjectNode wireNode = root.putObject(wire.id);
      wireNode.put("kind", wire.kind.label);
      if (wire.kind == WireKind.ARRAY) {
        wireNode.put("index", wire.index);
      }
      ArrayNode actions = wireNode.putArray("actions");
      wire.actions.forEach(a -> actions.add(toJson(a)));
    }
    root.put(FILENAME_KEY, trace.source);
    return root;
  }

  private static ObjectNode toJson(Action action) {
    ObjectNode result = Json.MAPPER.createObjectNode();
    result.put("time", action.time);
    result.put("line", action.line);
    result.put("action", action.kind.label);
    if (action.gate != null) {
      result.put("type", action.gate);
    }
    if (action.hasLineage()) {
      result.put("ctrl", action.lineageString());
    }
    if (action.store != null) {
      result.put("store", action.store);
    }
    if (action.pairedWire != null) {
      result.put("with", action.pairedWire);
    }
    if (action.condition != null) {
      result.put("if", action.condition);
    }
    if (action.localName != null) {
      result.put("local_name", action.localName);
    }
    return result;
  }

  public static String toString(Trace trace) throws IOException {
    return Json.toString(toJson(trace));
  }

  public static void write(Trace trace, Path path) throws IOException {
    Json.write(toJson(trace), path);
  }

  public static Trace read(Path path) throws IOException {
    return fromJson(Json.read(path));
  }

  public static Trace parse(String text) throws IOException {
    return fromJson(Json.parse(text));
  }

  /**
   * Returns the Trace represented by {@code root}.
   *
   * @throws IllegalArgumentException if {@code root} doesn't have the expected shape
   */
  public static Trace fromJson(JsonNode root) {
    Json.requireObject(root, "trace");
    String source = "";
    ImmutableList.Builder<Wire> wires = ImmutableList.builder();
    for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      String id = field.getKey();
      if (id.startsWith("_")) {
        if (id.equals(FILENAME_KEY) && field.getValue().isTextual()) {
          source = field.getValue().asText();
        }
        continue;
      }
      wires.add(wireFromJson(id, Json.requireObject(field.getValue(), "wire " + id)));
    }
    return new Trace(source, wires.build());
  }

  private static Wire wireFromJson(String id, JsonNode node) {
    // Older traces call the wire kind "type".
    String kindLabel = Json.optionalText(node, "kind");
    if (kindLabel == null) {
      kindLabel = Json.optionalText(node, "type");
    }
    WireKind kind = (kindLabel == null) ? inferKind(id) : WireKind.fromLabel(kindLabel);
    int index = -1;
    if (kind == WireKind.ARRAY) {
      index = node.has("index") ? Json.requireInt(node, "index") : indexFromId(id);
    }
    JsonNode actions = node.get("actions");
    if (actions == null || !actions.isArray()) {
      throw new IllegalArgumentException("Expected an 'actions' array for wire " + id);
    }
    ImmutableList.Builder<Action> result = ImmutableList.builder();
    actions.forEach(a -> result.add(actionFromJson(Json.requireObject(a, "action of " + id))));
    return new Wire(id, kind, index, result.build());
  }

  private static WireKind inferKind(String id) {
    if (Wire.isPhysical(id)) {
      return WireKind.PHYSICAL;
    }
    return id.endsWith("]") ? WireKind.ARRAY : WireKind.NAMED;
  }

  private static int indexFromId(String id) {
    int open = id.lastIndexOf('[');
    try {
      return Integer.parseInt(id.substring(open + 1, id.length() - 1));
    } catch (NumberFormatException | IndexOutOfBoundsException e) {
      throw new IllegalArgumentException("Can't determine the index of array wire " + id, e);
    }
  }

  private static Action actionFromJson(JsonNode node) {
    ActionKind kind = ActionKind.fromLabel(Json.requireText(node, "action"));
    Action.Builder builder =
        Action.builder(kind, Json.requireInt(node, "time"), Json.requireInt(node, "line"))
            .gate(Json.optionalText(node, "type"))
            .store(Json.optionalText(node, "store"))
            .pairedWire(Json.optionalText(node, "with"))
            .condition(Json.optionalText(node, "if"))
            .localName(Json.optionalText(node, "local_name"));
    String ctrl = Json.optionalText(node, "ctrl");
    if (ctrl != null) {
      builder.lineage(COMMA.split(ctrl));
    }
    return builder.build();
  }
}
