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
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The result of symbolically executing a program: every wire with its ordered Actions, plus the
 * path of the program the trace was built from.
 *
 * <p>A Trace is immutable; it may be shared freely and used for any number of graph builds.
 */
public final class Trace implements Timeline {

  /** The path of the program this trace was built from, or an empty string if unknown. */
  public final String source;

  /** All wires, in registration order. */
  private final ImmutableMap<String, Wire> wires;

  /** Every Action keyed by its time, in wire registration order within each time. */
  private final ImmutableListMultimap<Integer, Entry> byTime;

  /** One more than the largest time of any Action (zero for an empty trace). */
  private final int timeLimit;

  public Trace(String source, Collection<Wire> wires) {
    this.source = source;
    this.wires = wires.stream().collect(ImmutableMap.toImmutableMap(w -> w.id, w -> w));
    ImmutableListMultimap.Builder<Integer, Entry> builder = ImmutableListMultimap.builder();
    int limit = 0;
    for (Wire wire : wires) {
      for (Action action : wire.actions) {
        builder.put(action.time, new Entry(wire.id, action));
        limit = Math.max(limit, action.time + 1);
      }
    }
    this.byTime = builder.orderKeysBy(Comparator.naturalOrder()).build();
    this.timeLimit = limit;
  }

  /** Returns all wires, in registration order. */
  public ImmutableList<Wire> wires() {
    return wires.values().asList();
  }

  /** Returns the wire with the given id, or null if there is none. */
  public @Nullable Wire wire(String id) {
    return wires.get(id);
  }

  /** Returns the number of distinct logical times that were allocated. */
  public int timeLimit() {
    return timeLimit;
  }

  @Override
  public List<Entry> at(int time) {
    return byTime.get(time);
  }

  /** Returns the control lineage that a gate recorded at {@code time} would be given. */
  public ImmutableList<String> lineageAt(int time) {
    return ControlLineage.resolve(this, time);
  }

  /** Returns a listing of all Actions, grouped by time. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int time : byTime.keySet()) {
      sb.append("TIME ").append(time).append('\n');
      for (Entry entry : byTime.get(time)) {
        sb.append("  ").append(entry.wire()).append(" -> ").append(entry.action()).append('\n');
      }
    }
    return sb.toString();
  }
}
