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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A quantum argument: a physical qubit ({@code $3}), a named qubit or whole register ({@code q}),
 * or one element or slice of a register ({@code q[1]}, {@code q[0:2]}).
 */
public final class Operand {
  public final String name;

  /** The index expression, possibly a {@link Expr.Range}; null if the operand is unindexed. */
  public final @Nullable Expr index;

  public Operand(String name, @Nullable Expr index) {
    this.name = name;
    this.index = index;
  }

  /** Returns an unindexed operand. */
  public static Operand named(String name) {
    return new Operand(name, null);
  }

  /** Returns an operand indexed by the given integer. */
  public static Operand indexed(String name, long index) {
    return new Operand(name, Expr.of(index));
  }

  /** Returns a copy of this operand with a different index. */
  public Operand withIndex(@Nullable Expr newIndex) {
    return new Operand(name, newIndex);
  }

  public boolean isRange() {
    return index instanceof Expr.Range;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Operand op && op.name.equals(name) && Objects.equals(op.index, index);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, index);
  }

  /** Returns the source form, which is also the key used for wire and scope lookups. */
  @Override
  public String toString() {
    return (index == null) ? name : name + "[" + index + "]";
  }
}
