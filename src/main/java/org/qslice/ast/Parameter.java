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

import org.jspecify.annotations.Nullable;

/** A formal parameter of a {@code def}: either a qubit (or qubit register) or a classical value. */
public final class Parameter {
  public final String name;
  public final boolean isQubit;

  /** For a qubit register parameter ({@code qubit[n] r}), the declared size; otherwise null. */
  public final @Nullable Expr size;

  public Parameter(String name, boolean isQubit, @Nullable Expr size) {
    this.name = name;
    this.isQubit = isQubit;
    this.size = size;
  }

  @Override
  public String toString() {
    if (!isQubit) {
      return name;
    }
    return (size == null) ? "qubit " + name : "qubit[" + size + "] " + name;
  }
}
