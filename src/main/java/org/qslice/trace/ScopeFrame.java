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
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The bindings visible to the statement being executed: each formal qubit name (or alias element
 * such as {@code x[1]}) mapped to the wire or register it stands for.
 *
 * <p>Frames are immutable. Entering a call or declaring an alias creates a new frame that copies
 * the current one and overrides some names; leaving the call restores the previous frame.
 */
final class ScopeFrame {
  static final ScopeFrame EMPTY = new ScopeFrame(ImmutableMap.of(), ImmutableMap.of());

  /** Keys are either plain names ({@code a}) or indexed names ({@code x[2]}). */
  private final ImmutableMap<String, String> bindings;

  /** The number of elements of each name that is bound element-by-element. */
  private final ImmutableMap<String, Integer> aliasSizes;

  private ScopeFrame(ImmutableMap<String, String> bindings, ImmutableMap<String, Integer> sizes) {
    this.bindings = bindings;
    this.aliasSizes = sizes;
  }

  /** Returns the binding of {@code key}, or null if it isn't bound in this frame. */
  @Nullable String lookup(String key) {
    return bindings.get(key);
  }

  /**
   * If {@code name} was bound element-by-element (by a {@code let} of a range or by passing a
   * register to a sized parameter), returns the number of elements; otherwise returns null.
   */
  @Nullable Integer aliasSize(String name) {
    return aliasSizes.get(name);
  }

  /**
   * Returns a frame with all the bindings of this one, except that any name mentioned in {@code
   * overrides} or {@code newAliasSizes} (with or without an index) loses its previous bindings
   * and gets the new ones.
   */
  ScopeFrame extend(Map<String, String> overrides, Map<String, Integer> newAliasSizes) {
    if (overrides.isEmpty() && newAliasSizes.isEmpty()) {
      return this;
    }
    Set<String> replaced = new HashSet<>(newAliasSizes.keySet());
    overrides.keySet().forEach(k -> replaced.add(baseName(k)));
    ImmutableMap.Builder<String, String> newBindings = ImmutableMap.builder();
    bindings.forEach(
        (k, v) -> {
          if (!replaced.contains(baseName(k))) {
            newBindings.put(k, v);
          }
        });
    newBindings.putAll(overrides);
    ImmutableMap.Builder<String, Integer> sizes = ImmutableMap.builder();
    aliasSizes.forEach(
        (k, v) -> {
          if (!replaced.contains(k)) {
            sizes.put(k, v);
          }
        });
    sizes.putAll(newAliasSizes);
    return new ScopeFrame(newBindings.buildOrThrow(), sizes.buildOrThrow());
  }

  /** Returns {@code key} with any index removed. */
  static String baseName(String key) {
    int bracket = key.indexOf('[');
    return (bracket < 0) ? key : key.substring(0, bracket);
  }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
