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

/** The three ways a wire can come into existence. */
public enum WireKind {
  /** A hardware qubit, {@code $n}; these need no declaration. */
  PHYSICAL("physical"),
  /** A qubit declared on its own, {@code qubit a;}. */
  NAMED("named"),
  /** One element of a declared register, {@code qubit[n] q;}. */
  ARRAY("array");

  public final String label;

  WireKind(String label) {
    this.label = label;
  }

  /**
   * Returns the WireKind with the given label.
   *
   * @throws IllegalArgumentException if there is no such kind
   */
  public static WireKind fromLabel(String label) {
    for (WireKind kind : values()) {
      if (kind.label.equals(label)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown wire kind '" + label + "'");
  }

  @Override
  public String toString() {
    return label;
  }
}
