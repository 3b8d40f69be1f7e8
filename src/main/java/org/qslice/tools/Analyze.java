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

import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import org.qslice.AnalysisError;
import org.qslice.ast.Program;
import org.qslice.io.TraceJson;
import org.qslice.parser.QasmFrontEnd;
import org.qslice.trace.Trace;
import org.qslice.trace.TraceBuilder;

/** A command-line tool that traces an OpenQASM program and writes the trace as JSON. */
public class Analyze {
  private Analyze() {}

  private static final String USAGE =
      "Use: analyze <program.qasm> [out=trace.json] [physical=6] [verbose=true]";

  private static final ImmutableSet<String> KEYS = ImmutableSet.of("out", "physical", "verbose");

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool, returning its exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    ToolArgs toolArgs;
    int physical;
    boolean verbose;
    try {
      toolArgs = ToolArgs.parse(args, 1, KEYS);
      physical = toolArgs.getInt("physical", TraceBuilder.Options.DEFAULT.physicalWires);
      verbose = toolArgs.getBoolean("verbose", false);
      if (physical < 0) {
        throw new IllegalArgumentException("'physical' must not be negative");
      }
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 1;
    }
    Path input = Path.of(toolArgs.positional.get(0));
    Path output = Path.of(toolArgs.get("out", "trace.json"));
    try {
      Program program = QasmFrontEnd.parse(input);
      Trace trace = TraceBuilder.build(program, TraceBuilder.Options.withPhysicalWires(physical));
      if (verbose) {
        out.print(trace);
      }
      TraceJson.write(trace, output);
      out.printf(
          "Wrote %s (%s wires, %s times)\n", output, trace.wires().size(), trace.timeLimit());
      return 0;
    } catch (AnalysisError e) {
      err.printf("%s: %s\n", input, e.getMessage());
      return 2;
    } catch (IOException e) {
      err.printf("I/O error: %s\n", e.getMessage());
      return 2;
    }
  }
}
