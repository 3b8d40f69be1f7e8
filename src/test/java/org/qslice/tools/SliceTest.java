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

package org.qslice.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.graph.DependencyGraph;
import org.qslice.io.GraphJson;
import org.qslice.io.TraceJson;
import org.qslice.parser.QasmFrontEnd;
import org.qslice.trace.TraceBuilder;

@RunWith(JUnit4.class)
public class SliceTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();
  private Path trace;

  @Before
  public void writeTrace() throws Exception {
    trace = tmp.getRoot().toPath().resolve("trace.json");
    String code = "qubit a;\nqubit b;\nh a;\ncx a, b;\nbit c;\nc = measure b;\nx $1;\n";
    TraceJson.write(TraceBuilder.build(QasmFrontEnd.parse(code, "bell.qasm")), trace);
  }

  private int run(String... args) {
    return Slice.run(args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private Path file(String name) {
    return tmp.getRoot().toPath().resolve(name);
  }

  @Test
  public void backwardSlice() throws Exception {
    Path output = file("slice.json");
    int status = run(trace.toString(), "out=" + output, "wire=b", "action=measure", "paths=true");
    assertThat(status).isEqualTo(0);
    String printed = out.toString(UTF_8);
    assertThat(printed).contains("Criterion matched: 1 node(s)");
    assertThat(printed).contains("Slice lines: [3, 4, 6]");
    assertThat(printed).contains("Slice actions: 4");
    JsonNode json = new ObjectMapper().readTree(Files.readString(output));
    assertThat(json.get("slice_actions").get(0).has("reason_path")).isTrue();
    assertThat(json.get("criterion").get("direction").asText()).isEqualTo("backward");
  }

  @Test
  public void graphAndDotOutputs() throws Exception {
    Path graphFile = file("qdg.json");
    Path dotFile = file("qdg.dot");
    int status =
        run(
            trace.toString(),
            "out=" + file("s.json"),
            "direction=forward",
            "time=0",
            "graph=" + graphFile,
            "dot=" + dotFile,
            "dotHighlight=true");
    assertThat(status).isEqualTo(0);
    DependencyGraph graph = GraphJson.read(graphFile);
    assertThat(graph.nodes()).hasSize(6);
    assertThat(Files.readString(dotFile)).contains("fillcolor=\"lightgray\"");
    assertThat(out.toString(UTF_8)).contains("Wrote " + dotFile);
  }

  @Test
  public void physicalWiresCanBeLeftOut() throws Exception {
    Path graphFile = file("qdg.json");
    int status =
        run(
            trace.toString(),
            "out=" + file("s.json"),
            "action=ctrl",
            "physical=false",
            "graph=" + graphFile);
    assertThat(status).isEqualTo(0);
    assertThat(GraphJson.read(graphFile).nodes()).hasSize(5);
  }

  @Test
  public void emptyCriterion() {
    assertThat(run(trace.toString(), "out=" + file("s.json"), "wire=zz")).isEqualTo(2);
    assertThat(err.toString(UTF_8)).contains("No nodes match the criterion");
  }

  @Test
  public void usageErrors() {
    assertThat(run(trace.toString(), "direction=sideways")).isEqualTo(1);
    assertThat(err.toString(UTF_8)).contains("Unknown direction 'sideways'");
    assertThat(run(trace.toString(), "line=four")).isEqualTo(1);
    assertThat(run(trace.toString(), "paths=maybe")).isEqualTo(1);
    assertThat(run()).isEqualTo(1);
  }

  @Test
  public void invalidTrace() throws Exception {
    Path bad = file("bad.json");
    Files.writeString(bad, "{\"a\": {\"actions\": 3}}");
    assertThat(run(bad.toString(), "out=" + file("s.json"))).isEqualTo(2);
    assertThat(err.toString(UTF_8)).contains("is not a valid trace");
  }
}
