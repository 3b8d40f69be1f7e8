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

package org.qslice.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.qslice.ast.Program;
import org.qslice.ast.Statement;

@RunWith(JUnit4.class)
public class QasmFrontEndTest {

  private static ImmutableList<Statement> parse(String code) {
    return QasmFrontEnd.parse(code, "test.qasm").statements;
  }

  @Test
  public void statementsKeepTheirLines() {
    ImmutableList<Statement> statements =
        parse("OPENQASM 3.0;\ninclude \"stdgates.inc\";\nqubit[2] q;\n\nh q[0];\n");
    assertThat(statements).hasSize(2);
    assertThat(statements.get(0)).isInstanceOf(Statement.QubitDeclaration.class);
    assertThat(statements.get(1).line).isEqualTo(5);
    assertThat(statements.get(1).toString()).isEqualTo("h q[0];");
  }

  @Test
  public void gateCalls() {
    Statement.GateCall call =
        (Statement.GateCall) parse("ctrl @ negctrl(2) @ rz(pi / 2) a, b[1], $3, c;\n").get(0);
    assertThat(call.name).isEqualTo("rz");
    assertThat(call.modifiers.toString()).isEqualTo("[ctrl, negctrl(2)]");
    assertThat(call.params.get(0).toString()).isEqualTo("pi / 2");
    assertThat(call.qubits.toString()).isEqualTo("[a, b[1], $3, c]");
  }

  @Test
  public void functionCallArgumentsAreParams() {
    Statement.GateCall call = (Statement.GateCall) parse("f(q[0], 2);\n").get(0);
    assertThat(call.params).hasSize(2);
    assertThat(call.qubits).isEmpty();
  }

  @Test
  public void definitions() {
    ImmutableList<Statement> statements =
        parse("gate g(theta, phi) a, b {\n  rx(theta) a;\n}\n"
            + "def f(qubit[2] r, qreg s[3], int n) -> bit {\n  return measure r[0];\n}\n");
    Statement.GateDefinition gate = (Statement.GateDefinition) statements.get(0);
    assertThat(gate.params).containsExactly("theta", "phi").inOrder();
    assertThat(gate.qubits).containsExactly("a", "b").inOrder();
    assertThat(gate.body).hasSize(1);
    Statement.FunctionDefinition def = (Statement.FunctionDefinition) statements.get(1);
    assertThat(def.params.stream().map(p -> p.isQubit))
        .containsExactly(true, true, false)
        .inOrder();
    assertThat(def.params.get(1).size.toString()).isEqualTo("3");
    assertThat(def.body.get(0)).isInstanceOf(Statement.Measure.class);
  }

  @Test
  public void measureForms() {
    ImmutableList<Statement> statements =
        parse("measure q -> c;\nc[0] = measure q[0];\nbit d = measure q[1];\nmeasure q;\n");
    assertThat(statements).hasSize(5);
    assertThat(statements.get(0).toString()).isEqualTo("measure q -> c;");
    assertThat(statements.get(1).toString()).isEqualTo("c[0] = measure q[0];");
    assertThat(statements.get(2)).isInstanceOf(Statement.ClassicalDeclaration.class);
    assertThat(statements.get(3).toString()).isEqualTo("d = measure q[1];");
    assertThat(statements.get(4).toString()).isEqualTo("measure q;");
  }

  @Test
  public void classicalAssignmentsAreDropped() {
    assertThat(parse("int x = 3;\nx = x + 1;\n")).hasSize(1);
  }

  @Test
  public void controlFlow() {
    ImmutableList<Statement> statements =
        parse("for int i in [0:2:6] x q[i];\nfor j in {1, 3} { h q[j]; }\n"
            + "if (c == 1 && d) x a; else { y a; z a; }\nbox { h a; }\n");
    Statement.For loop = (Statement.For) statements.get(0);
    assertThat(loop.range.toString()).isEqualTo("0:2:6");
    assertThat(((Statement.For) statements.get(1)).values).hasSize(2);
    Statement.If ifStmt = (Statement.If) statements.get(2);
    assertThat(ifStmt.condition.toString()).isEqualTo("c == 1 && d");
    assertThat(ifStmt.elseBody).hasSize(2);
    assertThat(statements.get(3)).isInstanceOf(Statement.Box.class);
  }

  @Test
  public void expressionsRenderWithMinimalParentheses() {
    Statement.ConstDeclaration stmt =
        (Statement.ConstDeclaration) parse("const int n = (1 + 2) * 3 - (4 - 5);\n").get(0);
    assertThat(stmt.value.toString()).isEqualTo("(1 + 2) * 3 - (4 - 5)");
  }

  @Test
  public void legacyRegisters() {
    ImmutableList<Statement> statements = parse("qreg q[3];\ncreg c[3];\n");
    assertThat(statements.get(0).toString()).isEqualTo("qubit[3] q;");
    assertThat(statements.get(1)).isInstanceOf(Statement.ClassicalDeclaration.class);
  }

  @Test
  public void syntaxErrors() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> parse("qubit a;\nh a\n"));
    assertThat(e.lineNum).isAtLeast(2);
    e = assertThrows(SyntaxError.class, () -> parse("qubit q;\nfor i in [3] x q;\n"));
    assertThat(e.msg).startsWith("Loop range must have the form");
    assertThat(e.lineNum).isEqualTo(2);
    assertThrows(SyntaxError.class, () -> parse("qubit q # 3;\n"));
    assertThrows(SyntaxError.class, () -> parse("const int n = 99999999999999999999;\n"));
  }

  @Test
  public void sourceIsRecorded() {
    Program program = QasmFrontEnd.parse("", "empty.qasm");
    assertThat(program.source).isEqualTo("empty.qasm");
    assertThat(program.statements).isEmpty();
  }
}
