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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.io.TraceJson;
import org.qslice.trace.Trace;

@RunWith(JUnit4.class)
public class AnalyzeTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  private int run(String... args) {
    return Analyze.run(args, new PrintStream(out, true, UTF_8), new PrintStream(err, true, UTF_8));
  }

  private Path program(String code) throws Exception {
    Path file = tmp.newFile("prog.qasm").toPath();
    Files.writeString(file, code);
    return file;
  }

  @Test
  public void writesTrace() throws Exception {
    Path input = program("OPENQASM 3.0;\nqubit[2] q;\nh q[0];\ncx q[0], q[1];\n");
    Path output = tmp.getRoot().toPath().resolve("trace.json");
    assertThat(run(input.toString(), "out=" + output, "verbose=true")).isEqualTo(0);
    assertThat(out.toString(UTF_8)).contains("Wrote " + output + " (8 wires, 2 times)");
    assertThat(out.toString(UTF_8)).contains("TIME 1");
    Trace trace = TraceJson.read(output);
    assertThat(trace.wire("q[1]").actions.get(0).lineage).containsExactly("q[0]");
    assertThat(trace.source).endsWith("prog.qasm");
  }

  @Test
  public void physicalWireSetting() throws Exception {
    Path input = program("qubit a;\nx a;\n");
    Path output = tmp.getRoot().toPath().resolve("t.json");
    assertThat(run(input.toString(), "out=" + output, "physical=0")).isEqualTo(0);
    assertThat(TraceJson.read(output).wires()).hasSize(1);
  }

  @Test
  public void usageErrors() {
    assertThat(run()).isEqualTo(1);
    assertThat(err.toString(UTF_8)).contains("Use: analyze");
    assertThat(run("p.qasm", "colour=red")).isEqualTo(1);
    assertThat(err.toString(UTF_8)).contains("Unknown setting 'colour'");
    assertThat(run("p.qasm", "physical=-1")).isEqualTo(1);
  }

  @Test
  public void analysisErrorsAreReported() throws Exception {
    Path input = program("qubit a;\ncx a, b;\n");
    assertThat(run(input.toString(), "out=" + tmp.getRoot().toPath().resolve("x.json")))
        .isEqualTo(2);
    assertThat(err.toString(UTF_8)).contains("Qubit 'b' has not been declared at this point");
  }

  @Test
  public void missingInput() {
    assertThat(run(tmp.getRoot().toPath().resolve("absent.qasm").toString())).isEqualTo(2);
    assertThat(err.toString(UTF_8)).contains("I/O error");
  }
}
