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
import java.util.Comparator;
import java.util.Objects;
import org.qslice.trace.Action;

/**
 * A vertex of the dependency graph: one Action on one wire, or the definition of a classical
 * value by a measurement.
 *
 * <p>Two Nodes are equal if they agree on all six identifying fields; nothing else is stored.
 * Absent gate and local names are represented by empty strings.
 */
public final class Node {

  /** The action label of a classical-definition node. */
  public static final String DEF = "def";

  /** Orders nodes by time, then line, then wire, then action (with gate and name as tiebreaks). */
  public static final Comparator<Node> ORDER =
      Comparator.<Node>comparingInt(n -> n.time)
          .thenComparingInt(n -> n.line)
          .thenComparing(n -> n.wire)
          .thenComparing(n -> n.action)
          .thenComparing(n -> n.gate)
          .thenComparing(n -> n.localName);

  /** The wire id, or for a classical definition the name of the defined location. */
  public final String wire;

  public final int time;
  public final int line;

  /** An {@link org.qslice.trace.ActionKind} label, or {@link #DEF}. */
  public final String action;

  public final String gate;
  public final String localName;

  public Node(String wire, int time, int line, String action, String gate, String localName) {
    this.wire = Preconditions.checkNotNull(wire);
    this.time = time;
    this.line = line;
    this.action = Preconditions.checkNotNull(action);
    this.gate = Preconditions.checkNotNull(gate);
    this.localName = Preconditions.checkNotNull(localName);
  }

  /** Returns the node for an Action recorded on the given wire. */
  public static Node of(String wire, Action action) {
    return new Node(
        wire,
        action.time,
        action.line,
        action.kind.label,
        Objects.requireNonNullElse(action.gate, ""),
        Objects.requireNonNullElse(action.localName, ""));
  }

  /** Returns the classical-definition node for a value stored by a measurement. */
  public static Node definition(String store, int time, int line) {
    return new Node(store, time, line, DEF, "", "");
  }

  public boolean isDefinition() {
    return action.equals(DEF);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Node)) {
      return false;
    }
    Node other = (Node) obj;
    return wire.equals(other.wire)
        && time == other.time
        && line == other.line
        && action.equals(other.action)
        && gate.equals(other.gate)
        && localName.equals(other.localName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(wire, time, line, action, gate, localName);
  }

  @Override
  public String toString() {
    String gatePart = gate.isEmpty() ? "" : " " + gate;
    return String.format("%s@t%s:l%s %s%s", wire, time, line, action, gatePart);
  }
}
