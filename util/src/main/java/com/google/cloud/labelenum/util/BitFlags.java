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

package com.google.cloud.labelenum.util;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A set of flags stored in a single unsigned 64-bit value.
 *
 * <p>The value is read as unsigned everywhere: bit 63 is an ordinary flag, not a sign. Instances
 * are mutable and not thread-safe; they are intended as short-lived accumulators.
 */
public final class BitFlags {

  private long value;

  /** Creates an empty set of flags. */
  public BitFlags() {
    this(0L);
  }

  private BitFlags(long value) {
    this.value = value;
  }

  /** Returns flags initialized to the given unsigned value. */
  public static BitFlags of(long value) {
    return new BitFlags(value);
  }

  /**
   * Returns {@code true} if any bit of {@code flag} is set. For a single-bit flag this is the same
   * as testing that the bit is set.
   */
  public boolean has(long flag) {
    return (value & flag) != 0;
  }

  /** Turns on every bit of {@code flag}. */
  @CanIgnoreReturnValue
  public BitFlags set(long flag) {
    value |= flag;
    return this;
  }

  /** Turns off every bit of {@code flag}. */
  @CanIgnoreReturnValue
  public BitFlags clear(long flag) {
    value &= ~flag;
    return this;
  }

  /** Flips every bit of {@code flag}. */
  @CanIgnoreReturnValue
  public BitFlags toggle(long flag) {
    value ^= flag;
    return this;
  }

  /** Returns the underlying value, to be interpreted as unsigned. */
  public long asUnsigned() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof BitFlags && ((BitFlags) o).value == value;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("bits", Long.toBinaryString(value)).toString();
  }
}
