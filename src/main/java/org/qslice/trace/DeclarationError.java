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

import com.google.errorprone.annotations.FormatMethod;
import org.qslice.AnalysisError;

/**
 * Thrown when a program refers to a qubit (or a constant needed to size or index one) that has not
 * been declared at that point.
 */
public class DeclarationError extends AnalysisError {
  public DeclarationError(String msg, int lineNum) {
    super(msg, lineNum);
  }

  @FormatMethod
  static DeclarationError of(int lineNum, String fmt, Object... fmtArgs) {
    return new DeclarationError(String.format(fmt, fmtArgs), lineNum);
  }

  /** Returns a new "Qubit '%s' has not been declared at this point" DeclarationError. */
  static DeclarationError undeclared(String name, int lineNum) {
    return of(lineNum, "Qubit '%s' has not been declared at this point", name);
  }
}
