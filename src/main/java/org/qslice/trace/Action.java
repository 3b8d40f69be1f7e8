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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One event on one wire: a reset, measurement, barrier, or participation in a gate application.
 *
 * <p>All Actions produced by a single program construct share the same {@code time}. Optional
 * fields are null (or, for {@code lineage}, empty) when they don't apply to the action's kind.
 */
public final class Action {
  public final int time;
  public final int line;
  public final ActionKind kind;

  /** The gate applied, for {@link ActionKind#GATE_CALL} and {@link ActionKind#CTRL_GATE_CALL}. */
  public final @Nullable String gate;

  /** For swap-like gates, the other wire exchanged with this one. */
  public final @Nullable String pairedWire;

  /** The guards in effect when the action was recorded, innermost first, comma-separated. */
  public final @Nullable String condition;

  /** For measurements, the classical location that receives the result. */
  public final @Nullable String store;

  /** For gate applications, the control wires feeding the gate (see {@link ControlLineage}). */
  public final ImmutableList<String> lineage;

  /** The argument as written at the call site, before scope resolution. */
  public final @Nullable String localName;

  private Action(Builder builder) {
    this.time = builder.time;
    this.line = builder.line;
    this.kind = builder.kind;
    this.gate = builder.gate;
    this.pairedWire = builder.pairedWire;
    this.condition = builder.condition;
    this.store = builder.store;
    this.lineage = builder.lineage;
    this.localName = builder.localName;
  }

  public static Builder builder(ActionKind kind, int time, int line) {
    return new Builder(kind, time, line);
  }

  /** Returns the lineage in its exported form, the wire ids joined by commas. */
  public String lineageString() {
    return String.join(",", lineage);
  }

  /** True if this kind of action carries a lineage (even if it's empty). */
  public boolean hasLineage() {
    return kind == ActionKind.GATE_CALL || kind.isTargetLike();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Action)) {
      return false;
    }
    Action other = (Action) obj;
    return time == other.time
        && line == other.line
        && kind == other.kind
        && Objects.equals(gate, other.gate)
        && Objects.equals(pairedWire, other.pairedWire)
        && Objects.equals(condition, other.condition)
        && Objects.equals(store, other.store)
        && lineage.equals(other.lineage)
        && Objects.equals(localName, other.localName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, line, kind, gate, pairedWire, condition, store, lineage, localName);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{").append(kind);
    if (gate != null) {
      sb.append(' ').append(gate);
    }
    sb.append(" t=").append(time).append(" l=").append(line);
    if (hasLineage() && !lineage.isEmpty()) {
      sb.append(" ctrl=").append(lineageString());
    }
    if (pairedWire != null) {
      sb.append(" with=").append(pairedWire);
    }
    if (store != null) {
      sb.append(" store=").append(store);
    }
    if (condition != null) {
      sb.append(" if=").append(condition);
    }
    return sb.append('}').toString();
  }

  /** Builds an Action; only the fields relevant to the kind need to be set. */
  public static final class Builder {
    private final ActionKind kind;
    private final int time;
    private final int line;
    private String gate;
    private String pairedWire;
    private String condition;
    private String store;
    private ImmutableList<String> lineage = ImmutableList.of();
    private String localName;

    private Builder(ActionKind kind, int time, int line) {
      Preconditions.checkArgument(time >= 0, "negative time %s", time);
      this.kind = Preconditions.checkNotNull(kind);
      this.time = time;
      this.line = line;
    }

    @CanIgnoreReturnValue
    public Builder gate(@Nullable String gate) {
      this.gate = gate;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder pairedWire(@Nullable String pairedWire) {
      this.pairedWire = pairedWire;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder condition(@Nullable String condition) {
      this.condition = (condition == null || condition.isEmpty()) ? null : condition;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder store(@Nullable String store) {
      this.store = store;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder lineage(Iterable<String> lineage) {
      this.lineage = ImmutableList.copyOf(lineage);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder localName(@Nullable String localName) {
      this.localName = localName;
      return this;
    }

    public Action build() {
      return new Action(this);
    }
  }
}
