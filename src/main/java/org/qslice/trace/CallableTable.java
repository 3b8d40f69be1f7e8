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
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.qslice.ast.Parameter;
import org.qslice.ast.Statement;

/** The gates and functions defined so far by the program being traced, keyed by name. */
final class CallableTable {

  /** A user-defined gate or function. */
  static final class Callable {
    final String name;

    /** True for a {@code def}, false for a {@code gate}. */
    final boolean isFunction;

    /** All parameters, in declaration order. */
    final ImmutableList<Parameter> params;

    final ImmutableList<Statement> body;

    private Callable(
        String name,
        boolean isFunction,
        ImmutableList<Parameter> params,
        ImmutableList<Statement> body) {
      this.name = name;
      this.isFunction = isFunction;
      this.params = params;
      this.body = body;
    }

    static Callable of(Statement.GateDefinition def) {
      // A gate's angle parameters come first, then its qubits.
      ImmutableList.Builder<Parameter> params = ImmutableList.builder();
      def.params.forEach(p -> params.add(new Parameter(p, false, null)));
      def.qubits.forEach(q -> params.add(new Parameter(q, true, null)));
      return new Callable(def.name, false, params.build(), def.body);
    }

    static Callable of(Statement.FunctionDefinition def) {
      return new Callable(def.name, true, def.params, def.body);
    }

    ImmutableList<Parameter> qubitParams() {
      return params.stream().filter(p -> p.isQubit).collect(ImmutableList.toImmutableList());
    }

    ImmutableList<Parameter> classicalParams() {
      return params.stream().filter(p -> !p.isQubit).collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
      return (isFunction ? "def " : "gate ") + name;
    }
  }

  private final Map<String, Callable> callables = new HashMap<>();

  /** Adds a definition; a later definition with the same name replaces an earlier one. */
  void define(Callable callable) {
    callables.put(callable.name, callable);
  }

  @Nullable Callable get(String name) {
    return callables.get(name);
  }
}
