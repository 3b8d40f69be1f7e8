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

import static com.google.common.truth.Truth.assertThat;
import static org.qslice.graph.GraphBuilderTest.BELL;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.GraphBuilderTest;
import org.qslice.slice.Criterion;
import org.qslice.slice.Direction;
import org.qslice.slice.SliceResult;
import org.qslice.slice.Slicer;

@RunWith(JUnit4.class)
public class SliceJsonTest {

  private final DependencyGraph bell = GraphBuilderTest.graph(BELL);

  private SliceResult measureSlice() {
    Criterion criterion = Criterion.builder().wire("b").action("measure").build();
    return Slicer.slice(bell, criterion, Direction.BACKWARD);
  }

  @Test
  public void summaryFields() {
    ObjectNode json = SliceJson.toJson(measureSlice(), false);
    assertThat(json.get("slice_wires").toString()).isEqualTo("[\"a\",\"b\"]");
    assertThat(json.get("slice_times").toString()).isEqualTo("[0,1,2]");
    assertThat(json.get("slice_lines").toString()).isEqualTo("[3,4,6]");
    JsonNode actions = json.get("slice_actions");
    assertThat(actions.size()).isEqualTo(4);
    JsonNode cx = actions.get(2);
    assertThat(cx.get("wire").asText()).isEqualTo("b");
    assertThat(cx.get("reason_type").asText()).isEqualTo("measurement");
    assertThat(cx.get("reason_direction").asText()).isEqualTo("backward");
    assertThat(cx.get("reason_neighbor").get("action").asText()).isEqualTo("measure");
    assertThat(cx.has("reason_path")).isFalse();
    JsonNode measure = actions.get(3);
    assertThat(measure.get("reason_type").asText()).isEqualTo("criterion");
    assertThat(measure.get("reason_neighbor").isNull()).isTrue();
  }

  @Test
  public void criterionBlock() {
    JsonNode criterion = SliceJson.toJson(measureSlice(), false).get("criterion");
    assertThat(criterion.get("wire").asText()).isEqualTo("b");
    assertThat(criterion.get("line").isNull()).isTrue();
    assertThat(criterion.get("direction").asText()).isEqualTo("backward");
    assertThat(criterion.get("matched_nodes").size()).isEqualTo(1);
    assertThat(criterion.get("matched_nodes").get(0).get("time").asInt()).isEqualTo(2);
  }

  @Test
  public void paths() throws Exception {
    JsonNode actions = SliceJson.toJson(measureSlice(), true).get("slice_actions");
    JsonNode firstPath = actions.get(0).get("reason_path");
    assertThat(firstPath.size()).isEqualTo(4);
    assertThat(firstPath.get(0).get("gate").asText()).isEqualTo("h");
    assertThat(firstPath.get(3).get("action").asText()).isEqualTo("measure");
    assertThat(SliceJson.toString(measureSlice(), true)).contains("\"reason_path\"");
  }
}
