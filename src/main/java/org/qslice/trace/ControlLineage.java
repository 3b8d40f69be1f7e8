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
import java.util.List;

/**
 * Infers which wires control a gate application from the Actions already recorded.
 *
 * <p>Control modifiers and the control qubits of built-in controlled gates are recorded as {@link
 * ActionKind#CTRL} Actions before the gate itself. A gate recorded at time T therefore collects
 * every wire with a CTRL Action at T; if T held nothing but CTRL Actions (or nothing at all) the
 * scan continues at T-1, so that controls applied to a user-defined gate (recorded one step before
 * the first gate of its body) are inherited by that gate. The scan stops at the first step that
 * holds any other kind of Action.
 */
public final class ControlLineage {

  // Static methods only
  private ControlLineage() {}

  /**
   * Returns the control wires for a gate recorded at {@code time}: most recent step first, and in
   * the order given by {@link Timeline#at} within a step. The result depends only on the Actions
   * recorded at or before {@code time}.
   */
  public static ImmutableList<String> resolve(Timeline timeline, int time) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (int t = time; t >= 0; t--) {
      List<Timeline.Entry> step = timeline.at(t);
      if (!step.stream().allMatch(e -> e.action().kind == ActionKind.CTRL)) {
        break;
      }
      step.forEach(e -> result.add(e.wire()));
    }
    return result.build();
  }
}
