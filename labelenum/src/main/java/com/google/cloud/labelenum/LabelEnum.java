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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.cloud.labelenum.util.BitFlags;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.common.primitives.UnsignedLongs;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A read-only enumeration of string labels, each bound to an unsigned {@code long} index.
 *
 * <p>Sequential enums ({@link #create}) suit values that take exactly one label:
 *
 * <pre>{@code
 * LabelEnum colors = LabelEnum.create("red", "green", "blue");
 * long green = colors.index("green"); // 2
 * String name = colors.value(green); // "green"
 * }</pre>
 *
 * <p>Composite enums ({@link #createComposite}) give every label its own bit, so a set of labels
 * can be packed into a single value and recovered later:
 *
 * <pre>{@code
 * LabelEnum perms = LabelEnum.createComposite("read", "write", "exec");
 * long mask = perms.bitMap("exec", "read"); // 5
 * perms.hydrate(mask); // ["read", "exec"]
 * }</pre>
 *
 * <p>Lookups never fail: unknown labels map to {@link #NO_RECORD} and unbound indices map to an
 * empty string. If a label occurs more than once at construction only its first occurrence is
 * bound. Instances are immutable.
 */
public final class LabelEnum {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Index returned for labels that are not members. Member indices are never 0. */
  public static final long NO_RECORD = 0L;

  /** Maximum number of labels in a composite enum, one per bit of an unsigned {@code long}. */
  public static final int MAX_COMPOSITE_LABELS = Long.SIZE;

  private final ImmutableMap<String, Long> indexByLabel;
  private final ImmutableMap<Long, String> labelByIndex;

  private LabelEnum(
      ImmutableMap<String, Long> indexByLabel, ImmutableMap<Long, String> labelByIndex) {
    this.indexByLabel = indexByLabel;
    this.labelByIndex = labelByIndex;
  }

  /**
   * Creates an enum that indexes {@code labels} sequentially from 1, in the given order.
   *
   * <p>Use it when a value takes exactly one label. Indices are dense and must not be combined
   * into bitmasks; see {@link #createComposite} for that.
   *
   * @throws IllegalArgumentException if {@code labels} is empty
   */
  public static LabelEnum create(String... labels) {
    return createCustom(Arrays.asList(checkNotNull(labels, "labels")), IndexFunction.SEQUENTIAL);
  }

  /**
   * Creates an enum that indexes {@code labels} with successive powers of two: 1, 2, 4, 8, ...
   *
   * <p>Use it when a value takes any subset of the labels, packed with {@link #bitMap} and
   * unpacked with {@link #hydrate}.
   *
   * @throws IllegalArgumentException if {@code labels} is empty or longer than {@link
   *     #MAX_COMPOSITE_LABELS}
   */
  public static LabelEnum createComposite(String... labels) {
    return createCustom(Arrays.asList(checkNotNull(labels, "labels")), IndexFunction.COMPOSITE);
  }

  /**
   * Creates an enum that binds the label at position {@code i} to {@code indexFunction.indexOf(i)}.
   *
   * <p>The function is trusted: colliding indices, {@link #NO_RECORD}, or values that are not
   * single bits are bound as returned. When two labels share an index, {@link #value} returns the
   * later one.
   *
   * @throws IllegalArgumentException if {@code labels} is empty, or if {@code indexFunction} is
   *     {@link IndexFunction#COMPOSITE} and {@code labels} is longer than {@link
   *     #MAX_COMPOSITE_LABELS}
   */
  public static LabelEnum createCustom(List<String> labels, IndexFunction indexFunction) {
    checkNotNull(labels, "labels");
    checkNotNull(indexFunction, "indexFunction");
    checkArgument(!labels.isEmpty(), "At least one label is expected");
    // 1L << 64 wraps around to 1L, which would silently rebind bit 0.
    checkArgument(
        indexFunction != IndexFunction.COMPOSITE || labels.size() <= MAX_COMPOSITE_LABELS,
        "A composite enum holds at most %s labels, got %s",
        MAX_COMPOSITE_LABELS,
        labels.size());

    Map<String, Long> indexByLabel = new LinkedHashMap<>();
    Map<Long, String> labelByIndex = new HashMap<>();
    for (int position = 0; position < labels.size(); position++) {
      String label = checkNotNull(labels.get(position), "label at position %s", position);
      if (indexByLabel.containsKey(label)) {
        // Intentionally tolerated: the first occurrence keeps its binding.
        logger.atFine().log("Dropping duplicate label '%s' at position %d", label, position);
        continue;
      }
      long index = indexFunction.indexOf(position);
      indexByLabel.put(label, index);
      labelByIndex.put(index, label);
    }
    return new LabelEnum(ImmutableMap.copyOf(indexByLabel), ImmutableMap.copyOf(labelByIndex));
  }

  /** Returns the index bound to {@code label}, or {@link #NO_RECORD} if it is not a member. */
  public long index(String label) {
    Long index = indexByLabel.get(label);
    return index == null ? NO_RECORD : index;
  }

  /**
   * Returns the label bound to {@code index}, or an empty string if none is.
   *
   * <p>If the empty string is itself a member, use {@link #findValue} to tell the two apart.
   */
  public String value(long index) {
    return findValue(index).orElse("");
  }

  /** Returns the label bound to {@code index}, or empty if none is. */
  public Optional<String> findValue(long index) {
    return Optional.ofNullable(labelByIndex.get(index));
  }

  /** Returns {@code true} if every given label is a member. Vacuously true for no labels. */
  public boolean contains(String... labels) {
    for (String label : labels) {
      if (!indexByLabel.containsKey(label)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Packs {@code labels} into a bitmask by OR-ing their indices.
   *
   * <p>Only meaningful for composite enums: sequential indices overlap bitwise and the result can
   * not be hydrated. Unknown labels are skipped, and repeated labels contribute the same bit, so
   * the result depends only on the set of known labels given.
   */
  public long bitMap(String... labels) {
    return bitMap(Arrays.asList(labels));
  }

  /** Packs {@code labels} into a bitmask. See {@link #bitMap(String...)}. */
  public long bitMap(Iterable<String> labels) {
    BitFlags bits = new BitFlags();
    for (String label : labels) {
      long index = index(label);
      // Unknown labels are skipped rather than reported.
      if (index != NO_RECORD) {
        bits.set(index);
      }
    }
    return bits.asUnsigned();
  }

  /**
   * Unpacks a bitmask produced by {@link #bitMap} into the labels whose bits are set.
   *
   * <p>Labels come back in ascending index order, whatever order they were packed in. Only
   * meaningful for composite enums. Set bits that are not bound to a label are skipped.
   */
  public ImmutableList<String> hydrate(long bitmask) {
    BitFlags bits = BitFlags.of(bitmask);
    ImmutableList.Builder<String> labels = ImmutableList.builder();
    // The shift reaches 0 after the top bit, which also ends the loop.
    for (long bit = 1; bit != 0 && UnsignedLongs.compare(bit, bitmask) <= 0; bit <<= 1) {
      if (!bits.has(bit)) {
        continue;
      }
      String label = labelByIndex.get(bit);
      if (label == null) {
        logger.atFine().log(
            "Skipping unbound bit %s of bitmask %s",
            UnsignedLongs.toString(bit),
            UnsignedLongs.toString(bitmask));
        continue;
      }
      labels.add(label);
    }
    return labels.build();
  }

  /** Returns the number of member labels. */
  public int size() {
    return indexByLabel.size();
  }

  /** Returns the member labels in the order their indices were assigned. */
  public ImmutableList<String> labels() {
    return indexByLabel.keySet().asList();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("labels", indexByLabel).toString();
  }
}
