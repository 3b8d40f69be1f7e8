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

/** Thrown when registers that are expanded together by one statement differ in size. */
public class SizeMismatchError extends AnalysisError {
  public final String first;
  public final String second;

  public SizeMismatchError(
      String first, int firstSize, String second, int secondSize, int lineNum) {
    super(
        String.format(
            "Arrays '%s' and '%s' do not match in size (%s vs %s)",
            first, second, firstSize, secondSize),
        lineNum);
    this.first = first;
    this.second = second;
  }
}
