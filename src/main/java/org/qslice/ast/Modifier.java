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

package org.qslice.ast;

import org.jspecify.annotations.Nullable;

/**
 * A gate modifier such as {@code ctrl}, {@code negctrl(2)}, {@code inv} or {@code pow(2)}. The
 * name is kept as written; interpreting it is left to the trace builder.
 */
public final class Modifier {
  public final String name;
  public final @Nullable Expr argument;

  public Modifier(String name, @Nullable Expr argument) {
    this.name = name;
    this.argument = argument;
  }

  @Override
  public String toString() {
    return (argument == null) ? name : name + "(" + argument + ")";
  }
}
