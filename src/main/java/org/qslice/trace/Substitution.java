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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Expr;
import org.qslice.ast.Modifier;
import org.qslice.ast.Operand;
import org.qslice.ast.Statement;

/**
 * Replaces identifiers with values throughout a statement tree; used to unroll loops (binding the
 * loop variable to each iteration's value) and to pass classical arguments into a gate or function
 * body.
 *
 * <p>Wherever a replacement happens inside an arithmetic expression, the enclosing operators are
 * folded if they have become constant, so {@code q[i + 1]} with {@code i = 2} becomes {@code q[3]}.
 * A subexpression that can't be folded keeps its substituted form. Subtrees that contain no
 * replaced identifier are returned unchanged (and unfolded).
 *
 * <p>Nested gate and function definitions are left alone, and a nested loop that redefines a
 * substituted name is substituted in its range but not its body.
 */
final class Substitution implements Expr.Visitor<Expr>, Statement.Visitor<Statement> {
  private final ImmutableMap<String, Expr> values;
  private final ConstantEvaluator folder;

  Substitution(ImmutableMap<String, Expr> values, ConstantEvaluator folder) {
    this.values = values;
    this.folder = folder;
  }

  static Substitution of(String name, Expr value, ConstantEvaluator folder) {
    return new Substitution(ImmutableMap.of(name, value), folder);
  }

  ImmutableList<Statement> applyAll(List<Statement> statements) {
    if (values.isEmpty()) {
      return ImmutableList.copyOf(statements);
    }
    return statements.stream().map(s -> s.accept(this)).collect(ImmutableList.toImmutableList());
  }

  Expr apply(Expr expr) {
    return expr.accept(this);
  }

  @Nullable Expr applyNullable(@Nullable Expr expr) {
    return (expr == null) ? null : expr.accept(this);
  }

  Operand apply(Operand operand) {
    return (operand.index == null) ? operand : operand.withIndex(apply(operand.index));
  }

  private ImmutableList<Expr> applyExprs(List<Expr> exprs) {
    return exprs.stream().map(this::apply).collect(ImmutableList.toImmutableList());
  }

  private ImmutableList<Operand> applyOperands(List<Operand> operands) {
    return operands.stream().map(this::apply).collect(ImmutableList.toImmutableList());
  }

  /** Returns {@code rebuilt} folded to a literal if it is constant, otherwise unchanged. */
  private Expr fold(Expr rebuilt) {
    OptionalDouble value = folder.tryEvaluate(rebuilt);
    return value.isPresent() ? Expr.of(value.getAsDouble()) : rebuilt;
  }

  // Expressions

  @Override
  public Expr visitLiteral(Expr.Literal literal) {
    return literal;
  }

  @Override
  public Expr visitIdentifier(Expr.Identifier identifier) {
    Expr value = values.get(identifier.name);
    return (value == null) ? identifier : value;
  }

  @Override
  public Expr visitUnary(Expr.Unary unary) {
    Expr operand = apply(unary.operand);
    return (operand == unary.operand) ? unary : fold(new Expr.Unary(unary.op, operand));
  }

  @Override
  public Expr visitBinary(Expr.Binary binary) {
    Expr left = apply(binary.left);
    Expr right = apply(binary.right);
    if (left == binary.left && right == binary.right) {
      return binary;
    }
    return fold(new Expr.Binary(binary.op, left, right));
  }

  @Override
  public Expr visitIndexed(Expr.Indexed indexed) {
    Expr index = apply(indexed.index);
    return (index == indexed.index) ? indexed : new Expr.Indexed(indexed.name, index);
  }

  @Override
  public Expr visitRange(Expr.Range range) {
    Expr start = apply(range.start);
    @Nullable Expr step = applyNullable(range.step);
    Expr stop = apply(range.stop);
    if (start == range.start && step == range.step && stop == range.stop) {
      return range;
    }
    return new Expr.Range(start, step, stop);
  }

  @Override
  public Expr visitCall(Expr.Call call) {
    ImmutableList<Expr> args = applyExprs(call.args);
    return args.equals(call.args) ? call : new Expr.Call(call.name, args);
  }

  // Statements

  @Override
  public Statement visitQubitDeclaration(Statement.QubitDeclaration stmt) {
    return new Statement.QubitDeclaration(stmt.line, stmt.name, applyNullable(stmt.size));
  }

  @Override
  public Statement visitConstDeclaration(Statement.ConstDeclaration stmt) {
    return new Statement.ConstDeclaration(stmt.line, stmt.name, apply(stmt.value));
  }

  @Override
  public Statement visitClassicalDeclaration(Statement.ClassicalDeclaration stmt) {
    return new Statement.ClassicalDeclaration(
        stmt.line, stmt.type, stmt.name, applyNullable(stmt.initializer));
  }

  @Override
  public Statement visitAliasDeclaration(Statement.AliasDeclaration stmt) {
    return new Statement.AliasDeclaration(stmt.line, stmt.name, apply(stmt.target));
  }

  @Override
  public Statement visitGateDefinition(Statement.GateDefinition stmt) {
    return stmt;
  }

  @Override
  public Statement visitFunctionDefinition(Statement.FunctionDefinition stmt) {
    return stmt;
  }

  @Override
  public Statement visitReset(Statement.Reset stmt) {
    return new Statement.Reset(stmt.line, apply(stmt.target));
  }

  @Override
  public Statement visitGateCall(Statement.GateCall stmt) {
    ImmutableList<Modifier> modifiers =
        stmt.modifiers.stream()
            .map(m -> new Modifier(m.name, applyNullable(m.argument)))
            .collect(ImmutableList.toImmutableList());
    return new Statement.GateCall(
        stmt.line, stmt.name, modifiers, applyExprs(stmt.params), applyOperands(stmt.qubits));
  }

  @Override
  public Statement visitMeasureAssign(Statement.MeasureAssign stmt) {
    return new Statement.MeasureAssign(stmt.line, apply(stmt.store), apply(stmt.target));
  }

  @Override
  public Statement visitMeasure(Statement.Measure stmt) {
    @Nullable Operand store = (stmt.store == null) ? null : apply(stmt.store);
    return new Statement.Measure(stmt.line, apply(stmt.target), store);
  }

  @Override
  public Statement visitIf(Statement.If stmt) {
    return new Statement.If(
        stmt.line, apply(stmt.condition), applyAll(stmt.body), applyAll(stmt.elseBody));
  }

  @Override
  public Statement visitFor(Statement.For stmt) {
    Expr.@Nullable Range range = (stmt.range == null) ? null : (Expr.Range) apply(stmt.range);
    ImmutableList<Expr> loopValues = applyExprs(stmt.values);
    ImmutableList<Statement> body;
    if (values.containsKey(stmt.variable)) {
      Substitution inner =
          new Substitution(
              values.entrySet().stream()
                  .filter(e -> !e.getKey().equals(stmt.variable))
                  .collect(ImmutableMap.toImmutableMap(e -> e.getKey(), e -> e.getValue())),
              folder);
      body = inner.applyAll(stmt.body);
    } else {
      body = applyAll(stmt.body);
    }
    return new Statement.For(stmt.line, stmt.variable, range, loopValues, body);
  }

  @Override
  public Statement visitBox(Statement.Box stmt) {
    return new Statement.Box(stmt.line, applyAll(stmt.body));
  }

  @Override
  public Statement visitBarrier(Statement.Barrier stmt) {
    return new Statement.Barrier(stmt.line, applyOperands(stmt.targets));
  }
}
