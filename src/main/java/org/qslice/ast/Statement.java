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

package org.qslice.ast;

import com.google.common.collect.ImmutableList;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A statement of a quantum program. There is one subclass per statement shape; each carries only
 * the fields relevant to that shape, plus the source line on which the statement begins.
 *
 * <p>Statements are immutable. {@link #toString} renders each one back to (normalized) OpenQASM.
 */
public abstract class Statement {
  public final int line;

  // Subclasses are all nested in this file.
  private Statement(int line) {
    this.line = line;
  }

  /** Calls the visitor method corresponding to this Statement's variant. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** One method per Statement variant. */
  public interface Visitor<T> {
    T visitQubitDeclaration(QubitDeclaration stmt);

    T visitConstDeclaration(ConstDeclaration stmt);

    T visitClassicalDeclaration(ClassicalDeclaration stmt);

    T visitAliasDeclaration(AliasDeclaration stmt);

    T visitGateDefinition(GateDefinition stmt);

    T visitFunctionDefinition(FunctionDefinition stmt);

    T visitReset(Reset stmt);

    T visitGateCall(GateCall stmt);

    T visitMeasureAssign(MeasureAssign stmt);

    T visitMeasure(Measure stmt);

    T visitIf(If stmt);

    T visitFor(For stmt);

    T visitBox(Box stmt);

    T visitBarrier(Barrier stmt);
  }

  private static String joined(ImmutableList<?> items) {
    return items.stream().map(Object::toString).collect(Collectors.joining(", "));
  }

  private static String block(ImmutableList<Statement> body) {
    return body.stream().map(Object::toString).collect(Collectors.joining(" ", "{ ", " }"));
  }

  /** {@code qubit q;}, {@code qubit[n] q;} or {@code qreg q[n];}. */
  public static final class QubitDeclaration extends Statement {
    public final String name;

    /** The register size, or null for a single qubit. */
    public final @Nullable Expr size;

    public QubitDeclaration(int line, String name, @Nullable Expr size) {
      super(line);
      this.name = name;
      this.size = size;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitQubitDeclaration(this);
    }

    @Override
    public String toString() {
      return (size == null) ? "qubit " + name + ";" : "qubit[" + size + "] " + name + ";";
    }
  }

  /** {@code const <type> name = value;} */
  public static final class ConstDeclaration extends Statement {
    public final String name;
    public final Expr value;

    public ConstDeclaration(int line, String name, Expr value) {
      super(line);
      this.name = name;
      this.value = value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConstDeclaration(this);
    }

    @Override
    public String toString() {
      return "const " + name + " = " + value + ";";
    }
  }

  /** A declaration of a classical (non-constant) variable, e.g. {@code bit[3] c;}. */
  public static final class ClassicalDeclaration extends Statement {
    public final String type;
    public final String name;
    public final @Nullable Expr initializer;

    public ClassicalDeclaration(int line, String type, String name, @Nullable Expr initializer) {
      super(line);
      this.type = type;
      this.name = name;
      this.initializer = initializer;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitClassicalDeclaration(this);
    }

    @Override
    public String toString() {
      String init = (initializer == null) ? "" : " = " + initializer;
      return type + " " + name + init + ";";
    }
  }

  /** {@code let name = target;} */
  public static final class AliasDeclaration extends Statement {
    public final String name;
    public final Operand target;

    public AliasDeclaration(int line, String name, Operand target) {
      super(line);
      this.name = name;
      this.target = target;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAliasDeclaration(this);
    }

    @Override
    public String toString() {
      return "let " + name + " = " + target + ";";
    }
  }

  /** {@code gate name(params) qubits { body }} */
  public static final class GateDefinition extends Statement {
    public final String name;
    public final ImmutableList<String> params;
    public final ImmutableList<String> qubits;
    public final ImmutableList<Statement> body;

    public GateDefinition(
        int line,
        String name,
        ImmutableList<String> params,
        ImmutableList<String> qubits,
        ImmutableList<Statement> body) {
      super(line);
      this.name = name;
      this.params = params;
      this.qubits = qubits;
      this.body = body;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitGateDefinition(this);
    }

    @Override
    public String toString() {
      String paramList = params.isEmpty() ? "" : "(" + joined(params) + ")";
      return "gate " + name + paramList + " " + joined(qubits) + " " + block(body);
    }
  }

  /** {@code def name(params) { body }} */
  public static final class FunctionDefinition extends Statement {
    public final String name;
    public final ImmutableList<Parameter> params;
    public final ImmutableList<Statement> body;

    public FunctionDefinition(
        int line, String name, ImmutableList<Parameter> params, ImmutableList<Statement> body) {
      super(line);
      this.name = name;
      this.params = params;
      this.body = body;
    }

    /** Returns the names of the qubit-typed parameters, in declaration order. */
    public ImmutableList<Parameter> qubitParams() {
      return params.stream().filter(p -> p.isQubit).collect(ImmutableList.toImmutableList());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunctionDefinition(this);
    }

    @Override
    public String toString() {
      return "def " + name + "(" + joined(params) + ") " + block(body);
    }
  }

  /** {@code reset target;} */
  public static final class Reset extends Statement {
    public final Operand target;

    public Reset(int line, Operand target) {
      super(line);
      this.target = target;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReset(this);
    }

    @Override
    public String toString() {
      return "reset " + target + ";";
    }
  }

  /**
   * {@code modifiers @ name(params) qubits;}
   *
   * <p>A call of a {@code def} written with all arguments in parentheses ({@code f(q[0], 2);})
   * has every argument in {@code params} and no {@code qubits}; the trace builder picks out the
   * quantum arguments once it knows the callee's signature.
   */
  public static final class GateCall extends Statement {
    public final String name;
    public final ImmutableList<Modifier> modifiers;
    public final ImmutableList<Expr> params;
    public final ImmutableList<Operand> qubits;

    public GateCall(
        int line,
        String name,
        ImmutableList<Modifier> modifiers,
        ImmutableList<Expr> params,
        ImmutableList<Operand> qubits) {
      super(line);
      this.name = name;
      this.modifiers = modifiers;
      this.params = params;
      this.qubits = qubits;
    }

    /** Returns a copy of this call with different quantum arguments. */
    public GateCall withQubits(ImmutableList<Operand> newQubits) {
      return new GateCall(line, name, modifiers, params, newQubits);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitGateCall(this);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      modifiers.forEach(m -> sb.append(m).append(" @ "));
      sb.append(name);
      if (!params.isEmpty()) {
        sb.append('(').append(joined(params)).append(')');
      }
      if (!qubits.isEmpty()) {
        sb.append(' ').append(joined(qubits));
      }
      return sb.append(';').toString();
    }
  }

  /** The assignment form of measurement, {@code store = measure target;}. */
  public static final class MeasureAssign extends Statement {
    public final Operand store;
    public final Operand target;

    public MeasureAssign(int line, Operand store, Operand target) {
      super(line);
      this.store = store;
      this.target = target;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMeasureAssign(this);
    }

    @Override
    public String toString() {
      return store + " = measure " + target + ";";
    }
  }

  /** The arrow form of measurement, {@code measure target -> store;} (the store is optional). */
  public static final class Measure extends Statement {
    public final Operand target;
    public final @Nullable Operand store;

    public Measure(int line, Operand target, @Nullable Operand store) {
      super(line);
      this.target = target;
      this.store = store;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMeasure(this);
    }

    @Override
    public String toString() {
      String result = "measure " + target;
      return (store == null) ? result + ";" : result + " -> " + store + ";";
    }
  }

  /** {@code if (condition) { body } else { elseBody }}; elseBody is empty if there was no else. */
  public static final class If extends Statement {
    public final Expr condition;
    public final ImmutableList<Statement> body;
    public final ImmutableList<Statement> elseBody;

    public If(
        int line,
        Expr condition,
        ImmutableList<Statement> body,
        ImmutableList<Statement> elseBody) {
      super(line);
      this.condition = condition;
      this.body = body;
      this.elseBody = elseBody;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public String toString() {
      String result = "if (" + condition + ") " + block(body);
      return elseBody.isEmpty() ? result : result + " else " + block(elseBody);
    }
  }

  /**
   * {@code for <type> variable in [range] { body }} or {@code for <type> variable in {values} {
   * body }}; exactly one of {@code range} and {@code values} is used.
   */
  public static final class For extends Statement {
    public final String variable;
    public final Expr.@Nullable Range range;
    public final ImmutableList<Expr> values;
    public final ImmutableList<Statement> body;

    public For(
        int line,
        String variable,
        Expr.@Nullable Range range,
        ImmutableList<Expr> values,
        ImmutableList<Statement> body) {
      super(line);
      this.variable = variable;
      this.range = range;
      this.values = values;
      this.body = body;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }

    @Override
    public String toString() {
      String source = (range != null) ? "[" + range + "]" : "{" + joined(values) + "}";
      return "for " + variable + " in " + source + " " + block(body);
    }
  }

  /** {@code box { body }} */
  public static final class Box extends Statement {
    public final ImmutableList<Statement> body;

    public Box(int line, ImmutableList<Statement> body) {
      super(line);
      this.body = body;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBox(this);
    }

    @Override
    public String toString() {
      return "box " + block(body);
    }
  }

  /** {@code barrier targets;}; targets is empty for a barrier across the whole circuit. */
  public static final class Barrier extends Statement {
    public final ImmutableList<Operand> targets;

    public Barrier(int line, ImmutableList<Operand> targets) {
      super(line);
      this.targets = targets;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBarrier(this);
    }

    @Override
    public String toString() {
      return targets.isEmpty() ? "barrier;" : "barrier " + joined(targets) + ";";
    }
  }
}
