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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Expr;

/**
 * Evaluates small arithmetic expressions (register sizes, loop bounds, indices) against a table of
 * global constants.
 *
 * <p>Only numeric literals, constants, unary minus and the binary operators {@code + - * / % **}
 * are supported; anything else (comparisons, calls, unknown identifiers, division by zero) makes
 * the expression non-constant rather than raising an error. Callers decide whether that is fatal.
 */
public final class ConstantEvaluator {

  /** Constants that are predefined in every program. */
  private static final ImmutableMap<String, Double> BUILTIN_CONSTANTS =
      ImmutableMap.of(
          "pi", Math.PI,
          "π", Math.PI,
          "tau", 2 * Math.PI,
          "τ", 2 * Math.PI,
          "euler", Math.E,
          "ℇ", Math.E);

  private final Map<String, Double> constants = new HashMap<>(BUILTIN_CONSTANTS);

  /** Adds (or replaces) a named constant. */
  public void define(String name, double value) {
    constants.put(name, value);
  }

  /** Returns the value of the given constant, or null if it isn't defined. */
  public @Nullable Double lookup(String name) {
    return constants.get(name);
  }

  /** Returns the value of {@code expr}, or an empty result if it isn't constant. */
  public OptionalDouble tryEvaluate(Expr expr) {
    Double result = expr.accept(visitor);
    return (result == null || result.isNaN()) ? OptionalDouble.empty() : OptionalDouble.of(result);
  }

  /** Returns the value of {@code expr} if it is constant and integral. */
  public OptionalLong tryEvaluateInt(Expr expr) {
    OptionalDouble result = tryEvaluate(expr);
    if (result.isEmpty()) {
      return OptionalLong.empty();
    }
    double value = result.getAsDouble();
    if (value != Math.rint(value) || Math.abs(value) > Long.MAX_VALUE) {
      return OptionalLong.empty();
    }
    return OptionalLong.of((long) value);
  }

  /** Each visit method returns the expression's value, or null if it isn't constant. */
  private final Expr.Visitor<Double> visitor =
      new Expr.Visitor<>() {
        @Override
        public Double visitLiteral(Expr.Literal literal) {
          return literal.value;
        }

        @Override
        public Double visitIdentifier(Expr.Identifier identifier) {
          return constants.get(identifier.name);
        }

        @Override
        public Double visitUnary(Expr.Unary unary) {
          Double operand = unary.operand.accept(this);
          return (operand == null || !unary.op.equals("-")) ? null : -operand;
        }

        @Override
        public Double visitBinary(Expr.Binary binary) {
          Double left = binary.left.accept(this);
          Double right = (left == null) ? null : binary.right.accept(this);
          if (right == null) {
            return null;
          }
          switch (binary.op) {
            case "+":
              return left + right;
            case "-":
              return left - right;
            case "*":
              return left * right;
            case "/":
              return (right == 0) ? null : left / right;
            case "%":
              return (right == 0) ? null : left % right;
            case "**":
              return Math.pow(left, right);
            default:
              return null;
          }
        }

        @Override
        public Double visitIndexed(Expr.Indexed indexed) {
          return null;
        }

        @Override
        public Double visitRange(Expr.Range range) {
          return null;
        }

        @Override
        public Double visitCall(Expr.Call call) {
          return null;
        }
      };
}
