/*
 * Copyright 2026 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloud.labelenum;

/**
 * Assigns an index to the label at a given zero-based position when a {@link LabelEnum} is built.
 *
 * <p>Returned values are unsigned. Implementations should never return {@link
 * LabelEnum#NO_RECORD}, should return distinct values for distinct positions and, when the enum is
 * used with {@link LabelEnum#bitMap} and {@link LabelEnum#hydrate}, should return a single set bit.
 * None of this is checked.
 */
@FunctionalInterface
public interface IndexFunction {

  /** Indexes labels 1, 2, 3, ... in the order they are given. */
  IndexFunction SEQUENTIAL = position -> position + 1L;

  /**
   * Indexes labels 1, 2, 4, 8, ... so that every label owns one bit of a bitmask.
   *
   * <p>Shift distances wrap past position 63, so {@link LabelEnum#createCustom} rejects more than
   * {@link LabelEnum#MAX_COMPOSITE_LABELS} labels with this function.
   */
  IndexFunction COMPOSITE = position -> 1L << position;

  /**
   * Returns the index of the label at {@code position}.
   *
   * @param position zero-based position of the label in the construction order
   * @return the unsigned index to bind the label to
   */
  long indexOf(int position);
}
