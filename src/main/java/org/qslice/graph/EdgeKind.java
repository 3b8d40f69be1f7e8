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

package org.qslice.graph;

import com.google.common.base.Preconditions;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * The kind of dependency an {@link Edge} represents.
 *
 * <p>The four kinds produced by {@link GraphBuilder} are constants, but the set is open: {@link
 * #of} returns a kind for any label, so graphs read from JSON may carry kinds this version
 * doesn't produce. EdgeKinds are interned, so there is exactly one instance per label.
 */
public final class EdgeKind {
  private static final ConcurrentMap<String, EdgeKind> KINDS = new ConcurrentHashMap<>();

  /** Consecutive Actions on one wire. */
  public static final EdgeKind TEMPORAL = of("temporal");

  /** Wires that take part in the same multi-qubit operation. */
  public static final EdgeKind ENTANGLEMENT = of("entanglement");

  /** From the Action before a measurement to the measurement. */
  public static final EdgeKind MEASUREMENT = of("measurement");

  /** From a measurement to the classical value it defines. */
  public static final EdgeKind QUANTUM_TO_CLASSICAL = of("quantum-to-classical");

  public final String label;

  private EdgeKind(String label) {
    this.label = label;
  }

  /** Returns the EdgeKind with the given label, creating it if necessary. */
  public static EdgeKind of(String label) {
    Preconditions.checkArgument(!label.isEmpty(), "empty edge kind");
    return KINDS.computeIfAbsent(label, EdgeKind::new);
  }

  @Override
  public String toString() {
    return label;
  }
}
