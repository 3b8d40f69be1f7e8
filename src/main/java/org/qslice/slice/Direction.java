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

package org.qslice.slice;

/** Which way a slice follows the dependency edges. */
public enum Direction {
  /** Against the edges: everything the criterion could depend on. */
  BACKWARD("backward"),
  /** Along the edges: everything the criterion could affect. */
  FORWARD("forward");

  public final String label;

  Direction(String label) {
    this.label = label;
  }

  /**
   * Returns the Direction with the given label.
   *
   * @throws IllegalArgumentException if there is no such direction
   */
  public static Direction fromLabel(String label) {
    for (Direction direction : values()) {
      if (direction.label.equals(label)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("Unknown direction '" + label + "'");
  }

  @Override
  public String toString() {
    return label;
  }
}
