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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.qslice.graph.Node;

/**
 * Selects the nodes a slice starts from. Each field that is set must match; fields that are null
 * match anything, so an empty Criterion matches every node.
 */
public final class Criterion {
  public final @Nullable String wire;
  public final @Nullable Integer line;
  public final @Nullable Integer time;
  public final @Nullable String action;
  public final @Nullable String gate;

  private Criterion(Builder builder) {
    this.wire = builder.wire;
    this.line = builder.line;
    this.time = builder.time;
    this.action = builder.action;
    this.gate = builder.gate;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean matches(Node node) {
    return (wire == null || wire.equals(node.wire))
        && (line == null || line == node.line)
        && (time == null || time == node.time)
        && (action == null || action.equals(node.action))
        && (gate == null || gate.equals(node.gate));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Criterion c
        && Objects.equals(c.wire, wire)
        && Objects.equals(c.line, line)
        && Objects.equals(c.time, time)
        && Objects.equals(c.action, action)
        && Objects.equals(c.gate, gate);
  }

  @Override
  public int hashCode() {
    return Objects.hash(wire, line, time, action, gate);
  }

  /** Returns the fields that are set, e.g. {@code wire=q[0], action=ctrl}. */
  @Override
  public String toString() {
    List<String> parts = new ArrayList<>();
    addPart(parts, "wire", wire);
    addPart(parts, "line", line);
    addPart(parts, "time", time);
    addPart(parts, "action", action);
    addPart(parts, "gate", gate);
    return parts.isEmpty() ? "(any)" : String.join(", ", parts);
  }

  private static void addPart(List<String> parts, String name, @Nullable Object value) {
    if (value != null) {
      parts.add(name + "=" + value);
    }
  }

  public static final class Builder {
    private String wire;
    private Integer line;
    private Integer time;
    private String action;
    private String gate;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder wire(@Nullable String wire) {
      this.wire = wire;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder line(@Nullable Integer line) {
      this.line = line;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder time(@Nullable Integer time) {
      this.time = time;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder action(@Nullable String action) {
      this.action = action;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder gate(@Nullable String gate) {
      this.gate = gate;
      return this;
    }

    public Criterion build() {
      return new Criterion(this);
    }
  }
}
