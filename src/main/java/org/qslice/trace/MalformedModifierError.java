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
 * Thrown for a gate modifier that can't be interpreted: an unknown modifier name, a control count
 * that isn't a positive integer constant, or more controls than there are qubit arguments.
 */
public class MalformedModifierError extends AnalysisError {
  public MalformedModifierError(String msg, int lineNum) {
    super(msg, lineNum);
  }
}
