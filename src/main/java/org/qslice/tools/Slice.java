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
import org.qslice.graph.DependencyGraph;
import org.qslice.graph.GraphBuilder;
import org.qslice.io.DotWriter;
import org.qslice.io.GraphJson;
import org.qslice.io.SliceJson;
import org.qslice.io.TraceJson;
import org.qslice.slice.Criterion;
import org.qslice.slice.Direction;
import org.qslice.slice.SliceResult;
import org.qslice.slice.Slicer;
import org.qslice.trace.Trace;

/**
 * A command-line tool that slices the dependency graph of a trace (as written by {@link Analyze})
 * and writes the slice as JSON, optionally also writing the graph as JSON and DOT.
 */
public class Slice {
  private Slice() {}

  private static final String USAGE =
      "Use: slice <trace.json> [out=slice.json] [direction=backward|forward] [wire=<id>]"
          + " [line=<n>] [time=<n>] [action=<kind>] [gate=<name>] [graph=<qdg.json>]"
          + " [dot=<qdg.dot>] [dotMaxNodes=<n>] [dotHighlight=true] [paths=true]"
          + " [physical=true|false]";

  private static final ImmutableSet<String> KEYS =
      ImmutableSet.of(
          "out",
          "direction",
          "wire",
          "line",
          "time",
          "action",
          "gate",
          "graph",
          "dot",
          "dotMaxNodes",
          "dotHighlight",
          "paths",
          "physical");

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /** Runs the tool, returning its exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    ToolArgs toolArgs;
    Criterion criterion;
    Direction direction;
    int dotMaxNodes;
    boolean dotHighlight;
    boolean paths;
    boolean physical;
    try {
      toolArgs = ToolArgs.parse(args, 1, KEYS);
      direction = Direction.fromLabel(toolArgs.get("direction", Direction.BACKWARD.label));
      criterion =
          Criterion.builder()
              .wire(toolArgs.get("wire"))
              .line(toolArgs.getInt("line"))
              .time(toolArgs.getInt("time"))
              .action(toolArgs.get("action"))
              .gate(toolArgs.get("gate"))
              .build();
      dotMaxNodes = toolArgs.getInt("dotMaxNodes", -1);
      dotHighlight = toolArgs.getBoolean("dotHighlight", false);
      paths = toolArgs.getBoolean("paths", false);
      physical = toolArgs.getBoolean("physical", true);
    } catch (IllegalArgumentException e) {
      err.println(e.getMessage());
      err.println(USAGE);
      return 1;
    }
    Path input = Path.of(toolArgs.positional.get(0));
    try {
      Trace trace = TraceJson.read(input);
      DependencyGraph graph =
          GraphBuilder.build(trace, GraphBuilder.Options.includePhysical(physical));
      String graphOut = toolArgs.get("graph");
      if (graphOut != null) {
        GraphJson.write(graph, Path.of(graphOut));
        out.println("Wrote " + graphOut);
      }
      SliceResult slice = Slicer.slice(graph, criterion, direction);
      String dotOut = toolArgs.get("dot");
      if (dotOut != null) {
        new DotWriter(dotHighlight ? slice : null, dotMaxNodes).write(graph, Path.of(dotOut));
        out.println("Wrote " + dotOut);
      }
      Path output = Path.of(toolArgs.get("out", "slice.json"));
      SliceJson.write(slice, paths, output);
      out.println("Wrote " + output);
      out.printf("Criterion matched: %s node(s)\n", slice.matched.size());
      out.println("Slice lines: " + slice.lines());
      out.printf("Slice actions: %s\n", slice.size());
      return 0;
    } catch (AnalysisError e) {
      err.println(e.getMessage());
      return 2;
    } catch (IllegalArgumentException e) {
      err.printf("%s is not a valid trace: %s\n", input, e.getMessage());
      return 2;
    } catch (IOException e) {
      err.printf("I/O error: %s\n", e.getMessage());
      return 2;
    }
  }
}
