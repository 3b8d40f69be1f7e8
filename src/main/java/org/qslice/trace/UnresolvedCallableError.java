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

import org.qslice.AnalysisError;

/**
 * Thrown when a call names neither a built-in gate nor a gate or function defined earlier in the
 * program, or passes a callable the wrong number of qubits.
 */
public class UnresolvedCallableError extends AnalysisError {
  public final String name;

  public UnresolvedCallableError(String name, String msg, int lineNum) {
    super(msg, lineNum);
    this.name = name;
  }

  /** Returns a new "Cannot find gate or function '%s'" error. */
  static UnresolvedCallableError unknown(String name, int lineNum) {
    return new UnresolvedCallableError(
        name, String.format("Cannot find gate or function '%s'", name), lineNum);
  }

  /** Returns a new error for a call with the wrong number of qubit arguments. */
  static UnresolvedCallableError wrongArity(String name, int expected, int actual, int lineNum) {
    return new UnresolvedCallableError(
        name,
        String.format("'%s' expects %s qubit argument(s), got %s", name, expected, actual),
        lineNum);
  }

  /** Returns a new error for a function call with the wrong number of arguments. */
  static UnresolvedCallableError wrongArgumentCount(
      String name, int expected, int actual, int lineNum) {
    return new UnresolvedCallableError(
        name,
        String.format("'%s' expects %s argument(s), got %s", name, expected, actual),
        lineNum);
  }
}
