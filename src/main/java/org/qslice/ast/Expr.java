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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A classical expression, as it appears in constant declarations, loop ranges, conditions, gate
 * parameters and qubit indices.
 *
 * <p>Exprs are immutable; rewriting (e.g. substituting a loop variable) always returns a new tree.
 * {@link #toString} renders the expression back to source form, inserting parentheses only where
 * operator precedence requires them; conditions are carried through the trace in this form.
 */
public abstract class Expr {

  // Subclasses are all nested in this file.
  private Expr() {}

  /** Calls the visitor method corresponding to this Expr's variant. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** One method per Expr variant. */
  public interface Visitor<T> {
    T visitLiteral(Literal literal);

    T visitIdentifier(Identifier identifier);

    T visitUnary(Unary unary);

    T visitBinary(Binary binary);

    T visitIndexed(Indexed indexed);

    T visitRange(Range range);

    T visitCall(Call call);
  }

  /** Returns a new Literal for the given integer. */
  public static Literal of(long value) {
    return new Literal(value, Long.toString(value));
  }

  /** Returns a new Literal for the given number, rendered as an integer if it is integral. */
  public static Literal of(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return of((long) value);
    }
    return new Literal(value, Double.toString(value));
  }

  /** A numeric literal. {@code text} is the source spelling. */
  public static final class Literal extends Expr {
    public final double value;
    public final String text;

    public Literal(double value, String text) {
      this.value = value;
      this.text = text;
    }

    /** True if this literal holds an integral value. */
    public boolean isIntegral() {
      return value == Math.rint(value) && !Double.isInfinite(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal lit && lit.value == value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** A reference to a named value: a constant, loop variable, classical variable or qubit. */
  public static final class Identifier extends Expr {
    public final String name;

    public Identifier(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIdentifier(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Identifier id && id.name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A prefix operator applied to one operand ({@code -}, {@code !} or {@code ~}). */
  public static final class Unary extends Expr {
    public final String op;
    public final Expr operand;

    public Unary(String op, Expr operand) {
      this.op = op;
      this.operand = operand;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Unary u && u.op.equals(op) && u.operand.equals(operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public String toString() {
      boolean parens = operand instanceof Binary;
      return op + (parens ? "(" + operand + ")" : operand.toString());
    }
  }

  /** A binary operator expression. */
  public static final class Binary extends Expr {

    /** Binding strength of each supported operator; larger binds tighter. */
    private static final ImmutableMap<String, Integer> PRECEDENCE =
        ImmutableMap.<String, Integer>builder()
            .put("||", 1)
            .put("&&", 2)
            .put("|", 3)
            .put("^", 4)
            .put("&", 5)
            .put("==", 6)
            .put("!=", 6)
            .put("<", 7)
            .put(">", 7)
            .put("<=", 7)
            .put(">=", 7)
            .put("<<", 8)
            .put(">>", 8)
            .put("+", 9)
            .put("-", 9)
            .put("*", 10)
            .put("/", 10)
            .put("%", 10)
            .put("**", 11)
            .buildOrThrow();

    public final String op;
    public final Expr left;
    public final Expr right;

    public Binary(String op, Expr left, Expr right) {
      Preconditions.checkArgument(PRECEDENCE.containsKey(op), "Unknown operator %s", op);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    int precedence() {
      return PRECEDENCE.get(op);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Binary b
          && b.op.equals(op)
          && b.left.equals(left)
          && b.right.equals(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
      // "**" is right-associative, everything else is left-associative.
      boolean rightAssoc = op.equals("**");
      return operand(left, rightAssoc) + " " + op + " " + operand(right, !rightAssoc);
    }

    private String operand(Expr e, boolean parenthesizeEqual) {
      if (e instanceof Binary b) {
        int cmp = Integer.compare(b.precedence(), precedence());
        if (cmp < 0 || (cmp == 0 && parenthesizeEqual)) {
          return "(" + b + ")";
        }
      }
      return e.toString();
    }
  }

  /**
   * A name followed by a single index, e.g. {@code q[2]}, {@code c[i + 1]} or {@code q[0:3]} (in
   * which case the index is a {@link Range}).
   */
  public static final class Indexed extends Expr {
    public final String name;
    public final Expr index;

    public Indexed(String name, Expr index) {
      this.name = name;
      this.index = index;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIndexed(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Indexed i && i.name.equals(name) && i.index.equals(index);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, index);
    }

    @Override
    public String toString() {
      return name + "[" + index + "]";
    }
  }

  /** A range {@code start:stop} or {@code start:step:stop}; the stop value is inclusive. */
  public static final class Range extends Expr {
    public final Expr start;
    public final @Nullable Expr step;
    public final Expr stop;

    public Range(Expr start, @Nullable Expr step, Expr stop) {
      this.start = start;
      this.step = step;
      this.stop = stop;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Range r
          && r.start.equals(start)
          && Objects.equals(r.step, step)
          && r.stop.equals(stop);
    }

    @Override
    public int hashCode() {
      return Objects.hash(start, step, stop);
    }

    @Override
    public String toString() {
      return (step == null) ? start + ":" + stop : start + ":" + step + ":" + stop;
    }
  }

  /** A call of a classical built-in such as {@code sin(theta)}. */
  public static final class Call extends Expr {
    public final String name;
    public final ImmutableList<Expr> args;

    public Call(String name, ImmutableList<Expr> args) {
      this.name = name;
      this.args = args;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Call c && c.name.equals(name) && c.args.equals(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override
    public String toString() {
      return args.stream().map(Expr::toString).collect(Collectors.joining(", ", name + "(", ")"));
    }
  }
}
