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

package org.qslice.graph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.parser.QasmFrontEnd;
import org.qslice.trace.Action;
import org.qslice.trace.ActionKind;
import org.qslice.trace.Trace;
import org.qslice.trace.TraceBuilder;
import org.qslice.trace.Wire;
import org.qslice.trace.WireKind;

@RunWith(JUnit4.class)
public class GraphBuilderTest {

  /** A gate, a controlled gate and a measurement into a classical bit. */
  public static final String BELL =
      "qubit a;\nqubit b;\nh a;\ncx a, b;\nbit c;\nc = measure b;\n";

  public static final Node A_H = new Node("a", 0, 3, "gate-call", "h", "a");
  public static final Node A_CTRL = new Node("a", 1, 4, "ctrl", "", "a");
  public static final Node B_CX = new Node("b", 1, 4, "ctrl-gate-call", "cx", "b");
  public static final Node B_MEASURE = new Node("b", 2, 6, "measure", "", "");
  public static final Node C_DEF = Node.definition("c", 2, 6);

  public static DependencyGraph graph(String code) {
    return GraphBuilder.build(TraceBuilder.build(QasmFrontEnd.parse(code, "test.qasm")));
  }

  private static ImmutableList<String> edgeStrings(DependencyGraph graph) {
    return graph.edges().stream().map(Edge::toString).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void bellGraph() {
    DependencyGraph graph = graph(BELL);
    assertThat(graph.nodes()).containsExactly(A_H, A_CTRL, B_CX, B_MEASURE, C_DEF).inOrder();
    assertThat(graph.edges())
        .containsExactly(
            new Edge(A_H, A_CTRL, EdgeKind.TEMPORAL),
            new Edge(B_CX, B_MEASURE, EdgeKind.MEASUREMENT),
            new Edge(B_CX, B_MEASURE, EdgeKind.TEMPORAL),
            new Edge(B_MEASURE, C_DEF, EdgeKind.QUANTUM_TO_CLASSICAL),
            new Edge(A_CTRL, B_CX, EdgeKind.ENTANGLEMENT),
            new Edge(B_CX, A_CTRL, EdgeKind.ENTANGLEMENT))
        .inOrder();
    assertThat(graph.definitionOf("c")).isEqualTo(C_DEF);
    assertThat(graph.indexOf(C_DEF)).isEqualTo(4);
    assertThat(C_DEF.isDefinition()).isTrue();
  }

  @Test
  public void measurementEdgePrecedesTemporalEdge() {
    DependencyGraph graph = graph(BELL);
    assertThat(graph.incoming(B_MEASURE).stream().map(e -> e.kind))
        .containsExactly(EdgeKind.MEASUREMENT, EdgeKind.TEMPORAL)
        .inOrder();
  }

  @Test
  public void buildsAreDeterministic() {
    Trace trace = TraceBuilder.build(QasmFrontEnd.parse(BELL, "test.qasm"));
    assertThat(edgeStrings(GraphBuilder.build(trace)))
        .containsExactlyElementsIn(edgeStrings(GraphBuilder.build(trace)))
        .inOrder();
  }

  @Test
  public void definitionNodeIsShared() {
    DependencyGraph graph = graph("qubit a;\nbit c;\nc = measure a;\nx a;\nc = measure a;\n");
    Node def = graph.definitionOf("c");
    assertThat(def).isEqualTo(Node.definition("c", 0, 3));
    assertThat(graph.incoming(def)).hasSize(2);
    assertThat(graph.nodes().stream().filter(Node::isDefinition).count()).isEqualTo(1);
  }

  @Test
  public void measurementWithoutStore() {
    DependencyGraph graph = graph("qubit a;\nmeasure a;\n");
    assertThat(graph.nodes()).hasSize(1);
    assertThat(graph.edges()).isEmpty();
  }

  @Test
  public void uncontrolledGroupsCoupleEveryPair() {
    DependencyGraph graph = graph("qubit a;\nqubit b;\nswap a, b;\n");
    assertThat(edgeStrings(graph))
        .containsExactly(
            "a@t0:l3 gate-call swap -entanglement-> b@t0:l3 gate-call swap",
            "b@t0:l3 gate-call swap -entanglement-> a@t0:l3 gate-call swap");
  }

  @Test
  public void controlsCoupleOnlyWithTargets() {
    DependencyGraph graph = graph("qubit a;\nqubit b;\nqubit c;\nccx a, b, c;\n");
    assertThat(graph.edges()).hasSize(4);
    for (Edge edge : graph.edges()) {
      assertThat(ImmutableList.of(edge.src.wire, edge.dst.wire)).contains("c");
    }
  }

  @Test
  public void barriersAndResetsCoupleEveryPair() {
    DependencyGraph graph = graph("qubit[3] q;\nbarrier q;\nreset q[0:1];\n");
    assertThat(graph.edges().stream().filter(e -> e.kind == EdgeKind.ENTANGLEMENT)).hasSize(8);
    Node barrier = new Node("q[0]", 0, 2, "barrier", "", "");
    assertThat(graph.outgoing(barrier).stream().map(e -> e.dst.wire))
        .containsExactly("q[0]", "q[1]", "q[2]");
    Node reset = new Node("q[1]", 1, 3, "reset", "", "");
    assertThat(graph.incoming(reset).stream().map(e -> e.src.wire))
        .containsExactly("q[1]", "q[0]");
  }

  @Test
  public void measurementsAreNotEntangled() {
    DependencyGraph graph = graph("qubit[2] q;\nbit[2] c;\nc = measure q;\n");
    assertThat(graph.edges().stream().anyMatch(e -> e.kind == EdgeKind.ENTANGLEMENT)).isFalse();
    assertThat(graph.edges().stream().filter(e -> e.kind == EdgeKind.QUANTUM_TO_CLASSICAL))
        .hasSize(2);
  }

  @Test
  public void physicalWiresCanBeExcluded() {
    Trace trace = TraceBuilder.build(QasmFrontEnd.parse("qubit a;\ncx a, $0;\n", "test.qasm"));
    assertThat(GraphBuilder.build(trace).nodes()).hasSize(2);
    DependencyGraph graph = GraphBuilder.build(trace, GraphBuilder.Options.includePhysical(false));
    assertThat(graph.nodes()).containsExactly(new Node("a", 0, 2, "ctrl", "", "a"));
    assertThat(graph.edges()).isEmpty();
  }

  @Test
  public void metadataWiresAreSkipped() {
    Action action = Action.builder(ActionKind.RESET, 0, 1).build();
    Trace trace =
        new Trace(
            "",
            ImmutableList.of(
                new Wire("_notes", WireKind.NAMED, -1, ImmutableList.of(action)),
                new Wire("a", WireKind.NAMED, -1, ImmutableList.of(action))));
    assertThat(GraphBuilder.build(trace).nodes()).containsExactly(Node.of("a", action));
    assertThat(GraphBuilder.isMetadata("_filename")).isTrue();
  }

  @Test
  public void actionsAreOrderedByTimeThenLine() {
    Action late = Action.builder(ActionKind.RESET, 1, 2).build();
    Action early = Action.builder(ActionKind.RESET, 0, 9).build();
    Trace trace =
        new Trace(
            "", ImmutableList.of(new Wire("a", WireKind.NAMED, -1, ImmutableList.of(late, early))));
    DependencyGraph graph = GraphBuilder.build(trace);
    assertThat(graph.edges())
        .containsExactly(new Edge(Node.of("a", early), Node.of("a", late), EdgeKind.TEMPORAL));
  }

  @Test
  public void edgesAreDeduplicated() {
    DependencyGraph.Builder builder = DependencyGraph.builder();
    assertThat(builder.addNode(A_H)).isTrue();
    assertThat(builder.addNode(A_H)).isFalse();
    builder.addNode(A_CTRL);
    assertThat(builder.addEdge(A_H, A_CTRL, EdgeKind.TEMPORAL)).isTrue();
    assertThat(builder.addEdge(A_H, A_CTRL, EdgeKind.TEMPORAL)).isFalse();
    assertThat(builder.addEdge(A_H, A_CTRL, EdgeKind.of("custom"))).isTrue();
    assertThat(builder.build().edges()).hasSize(2);
    assertThrows(
        IllegalArgumentException.class, () -> builder.addEdge(A_H, B_CX, EdgeKind.TEMPORAL));
  }

  @Test
  public void edgeKindsAreInterned() {
    assertThat(EdgeKind.of("temporal")).isSameInstanceAs(EdgeKind.TEMPORAL);
    assertThat(EdgeKind.of("classical-control").label).isEqualTo("classical-control");
  }
}
