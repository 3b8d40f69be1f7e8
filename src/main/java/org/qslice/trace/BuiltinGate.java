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
import org.jspecify.annotations.Nullable;

/**
 * The standard gates that need no definition, grouped by how they wire their qubits. Each group
 * determines the Actions recorded when one of its gates is applied.
 */
enum BuiltinGate {
  /** One qubit; a {@code gate-call}. */
  UNITARY(
      1,
      "U", "p", "phase", "x", "y", "z", "h", "s", "sdg", "t", "tdg", "sx", "rx", "ry", "rz", "id",
      "u1", "u2", "u3"),
  /** A control then a target. */
  CONTROLLED(2, "cx", "CX", "cy", "cz", "cp", "cphase", "crx", "cry", "crz", "ch", "cu"),
  /** Two {@code gate-call}s, each naming the other wire as its partner. */
  SWAP(2, "swap"),
  /** Two controls then a target. */
  CCX(3, "ccx"),
  /** A control then two targets that are partners of each other. */
  CSWAP(3, "cswap");

  /** The number of qubits each gate of this group is applied to. */
  final int arity;

  final ImmutableList<String> gates;

  private static final ImmutableMap<String, BuiltinGate> BY_NAME;

  static {
    ImmutableMap.Builder<String, BuiltinGate> builder = ImmutableMap.builder();
    for (BuiltinGate group : values()) {
      group.gates.forEach(g -> builder.put(g, group));
    }
    BY_NAME = builder.buildOrThrow();
  }

  BuiltinGate(int arity, String... gates) {
    this.arity = arity;
    this.gates = ImmutableList.copyOf(gates);
  }

  /** Returns the group containing the named gate, or null if it isn't a built-in. */
  static @Nullable BuiltinGate lookup(String name) {
    return BY_NAME.get(name);
  }
}
