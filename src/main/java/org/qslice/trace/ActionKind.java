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
import java.util.Arrays;

/** What an {@link Action} does to its wire. */
public enum ActionKind {
  RESET("reset"),
  MEASURE("measure"),
  /** The wire is a control of the operation at this time. */
  CTRL("ctrl"),
  /** An uncontrolled gate, or one of the wires of a swap. */
  GATE_CALL("gate-call"),
  /** The target of a controlled gate. */
  CTRL_GATE_CALL("ctrl-gate-call"),
  BARRIER("barrier"),
  /**
   * An explicit target marker. The trace builder never emits it, but traces produced by other
   * tools may contain it and the graph builder treats it like {@link #CTRL_GATE_CALL}.
   */
  TARGET("targ");

  /** The name used for this kind in exported traces and graphs. */
  public final String label;

  private static final ImmutableMap<String, ActionKind> BY_LABEL =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(k -> k.label, k -> k));

  ActionKind(String label) {
    this.label = label;
  }

  /** True if this action is the operated-on side of a controlled operation. */
  public boolean isTargetLike() {
    return this == CTRL_GATE_CALL || this == TARGET;
  }

  /**
   * Returns the ActionKind with the given label.
   *
   * @throws IllegalArgumentException if there is no such kind
   */
  public static ActionKind fromLabel(String label) {
    ActionKind result = BY_LABEL.get(label);
    if (result == null) {
      throw new IllegalArgumentException("Unknown action '" + label + "'");
    }
    return result;
  }

  @Override
  public String toString() {
    return label;
  }
}
