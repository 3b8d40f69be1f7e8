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

package org.qslice.tools;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The command-line arguments of a tool: some positional arguments followed by any number of
 * {@code <key>=<value>} settings.
 */
final class ToolArgs {
  final ImmutableList<String> positional;
  private final ImmutableMap<String, String> settings;

  private ToolArgs(ImmutableList<String> positional, ImmutableMap<String, String> settings) {
    this.positional = positional;
    this.settings = settings;
  }

  /**
   * Splits {@code args} into {@code numPositional} positional arguments and the settings that
   * follow them.
   *
   * @throws IllegalArgumentException if there are too few arguments, a setting isn't of the form
   *     {@code key=value}, or its key isn't one of {@code allowedKeys}
   */
  static ToolArgs parse(String[] args, int numPositional, ImmutableSet<String> allowedKeys) {
    if (args.length < numPositional) {
      throw new IllegalArgumentException("Missing arguments");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    for (int i = numPositional; i < args.length; i++) {
      int eq = args[i].indexOf('=');
      if (eq <= 0) {
        throw new IllegalArgumentException("Expected <key>=<value>, got '" + args[i] + "'");
      }
      String key = args[i].substring(0, eq).trim();
      if (!allowedKeys.contains(key)) {
        throw new IllegalArgumentException("Unknown setting '" + key + "'");
      }
      settings.put(key, args[i].substring(eq + 1).trim());
    }
    return new ToolArgs(
        ImmutableList.copyOf(args).subList(0, numPositional), ImmutableMap.copyOf(settings));
  }

  @Nullable String get(String key) {
    return settings.get(key);
  }

  String get(String key, String defaultValue) {
    return settings.getOrDefault(key, defaultValue);
  }

  @Nullable Integer getInt(String key) {
    String value = settings.get(key);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected an integer for '" + key + "'", e);
    }
  }

  int getInt(String key, int defaultValue) {
    Integer value = getInt(key);
    return (value == null) ? defaultValue : value;
  }

  boolean getBoolean(String key, boolean defaultValue) {
    String value = settings.get(key);
    if (value == null) {
      return defaultValue;
    } else if (value.equals("true") || value.equals("false")) {
      return Boolean.parseBoolean(value);
    }
    throw new IllegalArgumentException("Expected true or false for '" + key + "'");
  }
}
