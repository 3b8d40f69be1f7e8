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

package org.qslice.trace;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.qslice.AnalysisError;
import org.qslice.parser.QasmFrontEnd;
import org.qslice.testing.TestdataScanner;
import org.qslice.testing.TestdataScanner.TestProgram;

/**
 * Builds the trace of each program in the testdata directory and compares it with the expected
 * result in the comment that follows the program.
 */
@RunWith(TestParameterInjector.class)
public class TraceBuilderTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/qslice/trace/testdata");

  /**
   * Each program is followed by a comment that begins "{@code /* TRACE}". Either the rest of the
   * comment is the expected {@link Trace#toString} (starting on the next line), or it is a colon
   * followed by the expected start of the error message.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* TRACE(.*?)\\*/\\n*", Pattern.DOTALL);

  @Test
  public void traceTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    String comment = checkNotNull(testProgram.comment(), "No TRACE comment found");
    String errMsg = comment.startsWith(":") ? comment.substring(1).trim() : null;
    try {
      Trace trace = TraceBuilder.build(QasmFrontEnd.parse(testProgram.code(), testProgram.name()));
      assertWithMessage("Expected error, traced OK").that(errMsg).isNull();
      System.out.format("** %s:\n%s\n", testProgram.name(), trace);
      assertWithMessage("Trace doesn't match")
          .that(cleanLines(trace.toString()))
          .isEqualTo(cleanLines(comment));
    } catch (AnalysisError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg;
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  @Test
  public void actionTimesNeverDecreaseAlongAWire(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    if (testProgram.comment() != null && testProgram.comment().startsWith(":")) {
      return;
    }
    assertTimesOrdered(TraceBuilder.build(QasmFrontEnd.parse(testProgram.code(), "t.qasm")));
  }

  @Test
  public void actionTimesNeverDecreaseInAMixedProgram() {
    assertTimesOrdered(
        trace(
            "gate bump a, b {\n  cx a, b;\n  h b;\n}\n"
                + "def flip(qubit r) {\n  x r;\n}\n"
                + "qubit[4] q;\nbit[4] c;\nh q;\n"
                + "for int i in [0:2] {\n  bump q[i], q[i + 1];\n  flip(q[3 - i]);\n}\n"
                + "ctrl @ bump q[3], q[0], q[1];\nbarrier q;\nc = measure q;\n"));
  }

  private static void assertTimesOrdered(Trace trace) {
    for (Wire wire : trace.wires()) {
      ImmutableList<Integer> times =
          wire.actions.stream().map(a -> a.time).collect(ImmutableList.toImmutableList());
      assertWithMessage("Times on %s", wire.id).that(Ordering.natural().isOrdered(times)).isTrue();
    }
  }

  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }

  /**
   * Removes all whitespace at the beginning and end of lines in the given output, and removes all
   * completely blank lines.
   */
  private static String cleanLines(String output) {
    return output.replaceAll(" *\n[ \n]*", "\n").trim();
  }

  private static Trace trace(String code) {
    return TraceBuilder.build(QasmFrontEnd.parse(code, "test.qasm"));
  }

  @Test
  public void physicalWiresComeFirst() {
    Trace trace = trace("qubit a;\nh a;\n");
    assertThat(trace.wires().stream().map(w -> w.id))
        .containsExactly("$0", "$1", "$2", "$3", "$4", "$5", "a")
        .inOrder();
    assertThat(trace.wire("$0").kind).isEqualTo(WireKind.PHYSICAL);
    assertThat(trace.wire("a").kind).isEqualTo(WireKind.NAMED);
    assertThat(trace.wire("$0").actions).isEmpty();
    assertThat(trace.source).isEqualTo("test.qasm");
  }

  @Test
  public void physicalWireOption() {
    Trace trace =
        TraceBuilder.build(
            QasmFrontEnd.parse("x $1;\n", "p.qasm"), TraceBuilder.Options.withPhysicalWires(0));
    assertThat(trace.wires().stream().map(w -> w.id)).containsExactly("$1");
  }

  @Test
  public void registerWires() {
    Trace trace = trace("qubit[3] q;\n");
    Wire second = trace.wire("q[1]");
    assertThat(second.kind).isEqualTo(WireKind.ARRAY);
    assertThat(second.index).isEqualTo(1);
    assertThat(trace.timeLimit()).isEqualTo(0);
    assertThat(trace.toString()).isEmpty();
  }

  @Test
  public void controlledGateScenario() {
    Trace trace = trace("qubit a;\nqubit b;\ncx a, b;\n");
    Action control = trace.wire("a").actions.get(0);
    Action target = trace.wire("b").actions.get(0);
    assertThat(control.kind).isEqualTo(ActionKind.CTRL);
    assertThat(control.localName).isEqualTo("a");
    assertThat(target.kind).isEqualTo(ActionKind.CTRL_GATE_CALL);
    assertThat(target.gate).isEqualTo("cx");
    assertThat(target.lineage).containsExactly("a");
    assertThat(target.time).isEqualTo(control.time);
    assertThat(target.line).isEqualTo(3);
  }

  @Test
  public void localNameIsTheArgumentAsWritten() {
    Trace trace = trace("gate g a {\n  h a;\n}\nqubit[2] q;\ng q[1];\n");
    Action action = trace.wire("q[1]").actions.get(0);
    assertThat(action.localName).isEqualTo("a");
    assertThat(action.line).isEqualTo(2);
  }

  @Test
  public void broadcastUsesOneTimePerElement() {
    Trace trace = trace("qubit[3] a;\nqubit[3] b;\ncx a, b;\n");
    for (int i = 0; i < 3; i++) {
      Action target = trace.wire("b[" + i + "]").actions.get(0);
      assertThat(target.time).isEqualTo(i);
      assertThat(target.lineage).containsExactly("a[" + i + "]");
    }
  }

  @Test
  public void broadcastWithSingleOperand() {
    Trace trace = trace("qubit c;\nqubit[2] t;\ncx c, t;\n");
    assertThat(trace.wire("c").actions).hasSize(2);
    assertThat(trace.wire("t[1]").actions.get(0).lineage).containsExactly("c");
  }

  @Test
  public void swapTargetsShareLineage() {
    Trace trace = trace("qubit c;\nqubit a;\nqubit b;\nctrl @ swap c, a, b;\n");
    Action first = trace.wire("a").actions.get(0);
    Action second = trace.wire("b").actions.get(0);
    assertThat(first.lineage).containsExactly("c");
    assertThat(second.lineage).isEqualTo(first.lineage);
    assertThat(first.pairedWire).isEqualTo("b");
    assertThat(second.pairedWire).isEqualTo("a");
  }

  @Test
  public void conditionsAttachToEveryAction() {
    Trace trace = trace("qubit a;\nqubit b;\nbit c;\nif (c) {\n  cx a, b;\n}\nh a;\n");
    assertThat(trace.wire("a").actions.get(0).condition).isEqualTo("c");
    assertThat(trace.wire("b").actions.get(0).condition).isEqualTo("c");
    assertThat(trace.wire("a").actions.get(1).condition).isNull();
  }

  @Test
  public void aliasOfSingleWire() {
    Trace trace = trace("qubit[2] q;\nlet first = q[0];\nx first;\n");
    assertThat(trace.wire("q[0]").actions).hasSize(1);
    assertThat(trace.wire("q[0]").actions.get(0).localName).isEqualTo("first");
  }

  @Test
  public void aliasOfRangeBroadcasts() {
    Trace trace = trace("qubit[4] q;\nlet tail = q[1:3];\nh tail;\n");
    assertThat(trace.wire("q[0]").actions).isEmpty();
    assertThat(trace.wire("q[3]").actions.get(0).time).isEqualTo(2);
  }

  @Test
  public void steppedRange() {
    Trace trace = trace("qubit[5] q;\nreset q[0:2:4];\n");
    assertThat(trace.wire("q[1]").actions).isEmpty();
    assertThat(trace.at(0).stream().map(Timeline.Entry::wire))
        .containsExactly("q[0]", "q[2]", "q[4]")
        .inOrder();
  }

  @Test
  public void descendingLoop() {
    Trace trace = trace("qubit[3] q;\nfor int i in [2:-1:0] {\n  x q[i];\n}\n");
    assertThat(trace.wire("q[2]").actions.get(0).time).isEqualTo(0);
    assertThat(trace.wire("q[0]").actions.get(0).time).isEqualTo(2);
  }

  @Test
  public void nestedCallsRestoreScope() {
    String code =
        "gate inner a {\n  h a;\n}\n"
            + "gate outer a, b {\n  inner b;\n  cx a, b;\n}\n"
            + "qubit x1;\nqubit x2;\nouter x1, x2;\nh x1;\n";
    Trace trace = trace(code);
    assertThat(trace.wire("x2").actions.stream().map(a -> a.kind))
        .containsExactly(ActionKind.GATE_CALL, ActionKind.CTRL_GATE_CALL)
        .inOrder();
    assertThat(trace.wire("x1").actions.get(1).time).isEqualTo(2);
  }

  @Test
  public void functionWithoutQubitsIsIgnored() {
    Trace trace = trace("def f(int n) {\n}\nf(3);\nqubit a;\nh a;\n");
    assertThat(trace.wire("a").actions.get(0).time).isEqualTo(0);
  }

  @Test
  public void wrongFunctionArgumentCount() {
    AnalysisError e =
        assertThrows(
            UnresolvedCallableError.class,
            () -> trace("def f(qubit a, int n) {\n  x a;\n}\nqubit q;\nf(q);\n"));
    assertThat(e.lineNum).isEqualTo(5);
    assertThat(e).hasMessageThat().contains("expects 2 argument(s), got 1");
  }

  @Test
  public void modifierArgumentMustBeConstant() {
    AnalysisError e =
        assertThrows(
            MalformedModifierError.class,
            () -> trace("qubit a;\nqubit b;\nint k;\nctrl(k) @ x a, b;\n"));
    assertThat(e.lineNum).isEqualTo(4);
  }

  @Test
  public void singleBitStoreForWholeRegister() {
    assertThrows(
        DeclarationError.class, () -> trace("qubit[2] q;\nbit[2] c;\nmeasure q -> c[0];\n"));
  }

  @Test
  public void nonConstantConst() {
    assertThrows(DeclarationError.class, () -> trace("int x;\nconst int n = x + 1;\n"));
  }

  @Test
  public void unusedPhysicalWiresAreNotBarriered() {
    Trace trace = trace("qubit a;\nh $2;\nbarrier;\n");
    assertThat(trace.wire("$2").actions).hasSize(2);
    assertThat(trace.wire("$0").actions).isEmpty();
    assertThat(trace.wire("a").actions).hasSize(1);
  }

  @Test
  public void controlsOfAnEmptyBodyRemainPending() {
    Trace trace = trace("gate g t {\n}\nqubit a;\nqubit b;\nctrl @ g a, b;\n");
    assertThat(trace.timeLimit()).isEqualTo(1);
    assertThat(trace.lineageAt(1)).containsExactly("a");
    assertThat(trace.wire("b").actions).isEmpty();
  }
}
