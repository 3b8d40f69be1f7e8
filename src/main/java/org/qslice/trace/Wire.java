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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A qubit-valued location and the ordered list of Actions recorded on it. */
public final class Wire {
  public final String id;
  public final WireKind kind;

  /** For {@link WireKind#ARRAY} wires, the element index; otherwise -1. */
  public final int index;

  public final ImmutableList<Action> actions;

  public Wire(String id, WireKind kind, int index, ImmutableList<Action> actions) {
    Preconditions.checkArgument((kind == WireKind.ARRAY) == (index >= 0), "bad index for %s", id);
    this.id = id;
    this.kind = kind;
    this.index = index;
    this.actions = actions;
  }

  /** True if {@code id} names a physical (hardware) qubit, e.g. {@code $3}. */
  public static boolean isPhysical(String id) {
    return id.startsWith("$");
  }

  @Override
  public String toString() {
    return id + " (" + kind + ")";
  }
}
