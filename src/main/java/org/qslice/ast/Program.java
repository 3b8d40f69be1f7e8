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

import com.google.common.collect.ImmutableList;

/** A parsed program: its top-level statements, in source order, and where it came from. */
public final class Program {
  public final String source;
  public final ImmutableList<Statement> statements;

  public Program(String source, ImmutableList<Statement> statements) {
    this.source = source;
    this.statements = statements;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    statements.forEach(s -> sb.append(s).append('\n'));
    return sb.toString();
  }
}
