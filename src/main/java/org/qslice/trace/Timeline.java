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

import java.util.List;

/**
 * A read-only view of recorded Actions indexed by logical time. Implemented both by a finished
 * {@link Trace} and by the {@link TraceBuilder} while it is still recording, so that control
 * lineage can be resolved at either point.
 */
public interface Timeline {

  /** An Action paired with the id of the wire it was recorded on. */
  record Entry(String wire, Action action) {}

  /**
   * Returns the Actions recorded at the given time, ordered by the registration order of their
   * wires (and by recording order within a wire). Returns an empty list for times with no
   * Actions, including negative times.
   */
  List<Entry> at(int time);
}
