/*
 * Copyright 2025 AxonOps
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

package com.axonops.libkmp.api;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Ordered start offsets of every occurrence of a pattern in a text.
 *
 * <p>Offsets are 0-based, strictly increasing, and overlapping occurrences are all reported:
 *
 * <pre>{@code
 * MatchResult result = KMP.match("abababab", "abab");
 * result.offsets();   // [0, 2, 4]
 * result.count();     // 3
 * }</pre>
 *
 * <p>Immutable and thread-safe.
 *
 * @since 1.0.0
 */
public final class MatchResult {

  private static final MatchResult EMPTY = new MatchResult(new int[0]);

  private final int[] offsets;

  private MatchResult(int[] offsets) {
    this.offsets = offsets;
  }

  /** Result with no occurrences. */
  public static MatchResult empty() {
    return EMPTY;
  }

  /**
   * Creates a result from the first {@code count} entries of a scan buffer.
   *
   * <p>The buffer is adopted when it is exactly full, so the caller must not reuse it.
   */
  static MatchResult of(int[] buffer, int count) {
    if (count == 0) {
      return EMPTY;
    }
    return new MatchResult(count == buffer.length ? buffer : Arrays.copyOf(buffer, count));
  }

  /**
   * Number of occurrences found.
   *
   * @return occurrence count, at most {@code n - m + 1}
   */
  public int count() {
    return offsets.length;
  }

  public boolean isEmpty() {
    return offsets.length == 0;
  }

  /**
   * Gets the start offset of the {@code index}-th occurrence.
   *
   * @param index occurrence index, {@code 0 <= index < count()}
   * @return start offset in the text
   * @throws IndexOutOfBoundsException if index is out of range
   */
  public int offset(int index) {
    return offsets[index];
  }

  /**
   * Start offset of the first occurrence.
   *
   * @return first offset, or -1 if there is no occurrence
   */
  public int first() {
    return offsets.length == 0 ? -1 : offsets[0];
  }

  /**
   * Returns a copy of all start offsets, in increasing order.
   */
  public int[] offsets() {
    return offsets.clone();
  }

  public IntStream stream() {
    return Arrays.stream(offsets);
  }

  /**
   * Returns the start offsets as an unmodifiable list.
   */
  public List<Integer> toList() {
    return Arrays.stream(offsets).boxed().collect(Collectors.toUnmodifiableList());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MatchResult)) {
      return false;
    }
    return Arrays.equals(offsets, ((MatchResult) o).offsets);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(offsets);
  }

  @Override
  public String toString() {
    return "MatchResult" + Arrays.toString(offsets);
  }
}
