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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import org.qslice.graph.Node;
import org.qslice.slice.Criterion;
import org.qslice.slice.Explanation;
import org.qslice.slice.SliceResult;

/**
 * Writes a {@link SliceResult} as JSON: the sorted wires, times and lines it touches; one entry
 * per node with its explanation (and optionally its path back to the criterion); and the
 * criterion with the nodes it matched.
 */
public final class SliceJson {

  // Static methods only
  private SliceJson() {}

  public static ObjectNode toJson(SliceResult slice, boolean includePaths) {
    ObjectNode root = Json.MAPPER.createObjectNode();
    ArrayNode wires = root.putArray("slice_wires");
    slice.wires().forEach(wires::add);
    ArrayNode times = root.putArray("slice_times");
    slice.times().forEach(times::add);
    ArrayNode lines = root.putArray("slice_lines");
    slice.lines().forEach(lines::add);
    ArrayNode actions = root.putArray("slice_actions");
    for (Node node : slice.nodes()) {
      ObjectNode entry = Json.brief(node);
      Explanation explanation = slice.explanation(node);
      entry.put("reason_type", explanation.reasonType());
      entry.put("reason_direction", explanation.direction.label);
      if (explanation.neighbor == null) {
        entry.putNull("reason_neighbor");
      } else {
        entry.set("reason_neighbor", Json.brief(explanation.neighbor));
      }
      if (includePaths) {
        ArrayNode path = entry.putArray("reason_path");
        slice.path(node).forEach(n -> path.add(Json.brief(n)));
      }
      actions.add(entry);
    }
    root.set("criterion", criterionJson(slice));
    return root;
  }

  private static ObjectNode criterionJson(SliceResult slice) {
    Criterion criterion = slice.criterion;
    ObjectNode result = Json.MAPPER.createObjectNode();
    result.put("wire", criterion.wire);
    result.put("line", criterion.line);
    result.put("time", criterion.time);
    result.put("action", criterion.action);
    result.put("gate", criterion.gate);
    result.put("direction", slice.direction.label);
    ArrayNode matched = result.putArray("matched_nodes");
    slice.matched.forEach(n -> matched.add(Json.brief(n)));
    return result;
  }

  public static String toString(SliceResult slice, boolean includePaths) throws IOException {
    return Json.toString(toJson(slice, includePaths));
  }

  public static void write(SliceResult slice, boolean includePaths, Path path)
      throws IOException {
    Json.write(toJson(slice, includePaths), path);
  }
}
