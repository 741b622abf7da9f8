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

import com.axonops.libkmp.util.PatternHasher;

import java.util.Arrays;
import java.util.Objects;

/**
 * Failure table of a pattern, bundled with the pattern bytes it describes.
 *
 * <p>For every prefix {@code pattern[0..i]} the table records the length minus one of the longest
 * proper prefix that is also a suffix of it, or {@code -1} when there is none. So
 * {@code link(0) == -1} and {@code link(i) < i} for every {@code i}.
 *
 * <p>The pattern is copied on construction; mutating the caller's array afterwards has no effect.
 * Instances are immutable and can be shared freely between threads.
 *
 * <p>Example for {@code "ababaca"}:
 * <pre>
 *   index    0  1  2  3  4  5  6
 *   symbol   a  b  a  b  a  c  a
 *   link    -1 -1  0  1  2 -1  0
 * </pre>
 *
 * @since 1.0.0
 */
public final class FailureTable {

    /** Sentinel for "no proper prefix-suffix", also the initial matching state. */
    public static final int NO_PREFIX = -1;

    // Rough JVM layout figures used by sizeInBytes(), not exact for every JVM
    static final int OBJECT_HEADER_BYTES = 16;
    static final int ARRAY_HEADER_BYTES = 16;
    static final int REFERENCE_BYTES = 8;

    private static final FailureTable EMPTY = new FailureTable(new byte[0], new int[0]);

    private final byte[] pattern;
    private final int[] links;

    private FailureTable(byte[] pattern, int[] links) {
        this.pattern = pattern;
        this.links = links;
    }

    /**
     * Builds the failure table for a pattern.
     *
     * <p>Runs in O(m): every fallback along the failure chain undoes at least one earlier advance.
     * An empty pattern yields an empty table.
     *
     * @param pattern the pattern symbols (copied)
     * @return the failure table
     * @throws NullPointerException if pattern is null
     * @throws AllocationException if the pattern copy or the table cannot be allocated
     */
    public static FailureTable build(byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return build(pattern, 0, pattern.length);
    }

    /**
     * Builds the failure table for {@code pattern[offset .. offset+length-1]}.
     *
     * @param pattern array holding the pattern symbols (the range is copied)
     * @param offset index of the first pattern symbol
     * @param length pattern length
     * @return the failure table
     * @throws IndexOutOfBoundsException if the range is outside the array
     * @throws AllocationException if the pattern copy or the table cannot be allocated
     */
    public static FailureTable build(byte[] pattern, int offset, int length) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.checkFromIndexSize(offset, length, pattern.length);

        if (length == 0) {
            return EMPTY;
        }

        byte[] copy;
        int[] links;
        try {
            copy = Arrays.copyOfRange(pattern, offset, offset + length);
            links = new int[length];
        } catch (OutOfMemoryError e) {
            throw new AllocationException("failure table", length, e);
        }

        links[0] = NO_PREFIX;
        int i = NO_PREFIX;
        for (int j = 1; j < length; j++) {
            i = advance(copy, links, i, copy[j]);
            links[j] = i;
        }
        return new FailureTable(copy, links);
    }

    /**
     * Fallback-then-advance transition shared by table construction and both matchers.
     *
     * <p>Requires {@code -1 <= state < pattern.length - 1}; only {@code links[0..state]} is read,
     * which is what lets {@link #build} use it on a partially filled table.
     */
    private static int advance(byte[] pattern, int[] links, int state, byte symbol) {
        while (state > NO_PREFIX && pattern[state + 1] != symbol) {
            state = links[state];
        }
        if (pattern[state + 1] == symbol) {
            state++;
        }
        return state;
    }

    /**
     * Computes the matching state after {@code symbol}, starting from {@code state}.
     *
     * <p>The result equals {@code length() - 1} when the pattern has just been completed; callers
     * must then collapse it with {@link #link(int)} before the next transition.
     *
     * @param state current state, {@code -1 <= state < length() - 1}
     * @param symbol next text symbol
     * @return the new state
     */
    int next(int state, byte symbol) {
        return advance(pattern, links, state, symbol);
    }

    /**
     * Gets the failure link of position {@code i}.
     *
     * @param i pattern position, {@code 0 <= i < length()}
     * @return length minus one of the longest proper prefix-suffix of {@code pattern[0..i]}
     */
    public int link(int i) {
        return links[i];
    }

    /** Pattern length m. */
    public int length() {
        return pattern.length;
    }

    public boolean isEmpty() {
        return pattern.length == 0;
    }

    /**
     * Gets the pattern symbol at position {@code i}.
     */
    public byte symbolAt(int i) {
        return pattern[i];
    }

    /**
     * Returns a copy of the failure links.
     */
    public int[] toArray() {
        return links.clone();
    }

    /**
     * Returns a copy of the pattern this table describes.
     */
    public byte[] pattern() {
        return pattern.clone();
    }

    /**
     * Approximate heap footprint of the pattern copy plus the table.
     *
     * <p>Diagnostic only; the figure assumes a typical 64-bit JVM layout.
     *
     * @return size estimate in bytes
     */
    public long sizeInBytes() {
        return OBJECT_HEADER_BYTES + 2L * REFERENCE_BYTES
            + ARRAY_HEADER_BYTES + pattern.length
            + ARRAY_HEADER_BYTES + (long) Integer.BYTES * links.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FailureTable)) {
            return false;
        }
        // links are a function of the pattern
        return Arrays.equals(pattern, ((FailureTable) o).pattern);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(pattern);
    }

    @Override
    public String toString() {
        return "FailureTable{length=" + pattern.length + ", hash=" + PatternHasher.hash(pattern) + "}";
    }
}
