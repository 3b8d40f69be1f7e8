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

package org.qslice;

/**
 * The base class of every error that aborts an analysis run: an undeclared wire, mismatched
 * register sizes, an unknown callable, a malformed modifier, an empty slicing criterion or a
 * syntax error in the program text. None of these are recoverable; no partial result is produced.
 */
public abstract class AnalysisError extends RuntimeException {
  public final String msg;

  /** The source line the error refers to, or 0 if it isn't tied to a line. */
  public final int lineNum;

  protected AnalysisError(String msg, int lineNum) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
  }

  @Override
  public String getMessage() {
    return (lineNum > 0) ? String.format("%s (line %s)", msg, lineNum) : msg;
  }
}
