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

package org.qslice.slice;

import org.qslice.AnalysisError;

/** Thrown when no node of the graph matches a slicing criterion. */
public class EmptyCriterionError extends AnalysisError {
  public final Criterion criterion;

  public EmptyCriterionError(Criterion criterion) {
    super("No nodes match the criterion; try relaxing the filters (" + criterion + ")", 0);
    this.criterion = criterion;
  }
}
