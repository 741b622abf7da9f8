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

import java.util.Objects;

/**
 * Main entry point for Knuth-Morris-Pratt substring search.
 *
 * Thread-safe: All methods can be called concurrently from multiple threads. The
 * {@link StreamMatcher} returned by {@link #createMatcher(byte[])} is not.
 *
 * Patterns passed to the static helpers go through the global pattern cache, so repeated
 * searches for the same pattern build its failure table once.
 *
 * @since 1.0.0
 */
public final class KMP {

    private KMP() {
        // Utility class
    }

    public static Pattern compile(byte[] pattern) {
        return Pattern.compile(pattern);
    }

    public static Pattern compile(String pattern) {
        return Pattern.compile(pattern);
    }

    /**
     * Builds the failure table of a pattern (not cached).
     *
     * @param pattern pattern bytes, possibly empty
     * @return failure table of length {@code pattern.length}
     */
    public static FailureTable buildFailureTable(byte[] pattern) {
        return FailureTable.build(pattern);
    }

    // ========== Batch Operations ==========

    /**
     * Finds every (possibly overlapping) occurrence of {@code pattern} in {@code text}.
     *
     * @param text text to scan
     * @param pattern pattern to look for
     * @return increasing start offsets; empty if the pattern is empty or longer than the text
     */
    public static MatchResult match(byte[] text, byte[] pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        return compile(pattern).match(text);
    }

    /**
     * Finds every occurrence in UTF-8 encoded text.
     *
     * @param text text to scan
     * @param pattern pattern to look for
     * @return UTF-8 byte offsets of all occurrences
     */
    public static MatchResult match(String text, String pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        return compile(pattern).match(text);
    }

    /**
     * Finds the first occurrence of {@code pattern} in {@code text}.
     *
     * @return start offset, or -1
     */
    public static int find(byte[] text, byte[] pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        return compile(pattern).find(text);
    }

    /**
     * Finds the first occurrence in UTF-8 encoded text.
     *
     * @return UTF-8 byte offset, or -1
     */
    public static int find(String text, String pattern) {
        Objects.requireNonNull(text, "text cannot be null");
        return compile(pattern).find(text);
    }

    public static boolean contains(byte[] text, byte[] pattern) {
        return find(text, pattern) >= 0;
    }

    public static boolean contains(String text, String pattern) {
        return find(text, pattern) >= 0;
    }

    // ========== Streaming Operations ==========

    /**
     * Creates a stream matcher for {@code pattern} with no progress. Close it when the stream ends.
     *
     * @param pattern pattern bytes (copied)
     * @return new matcher
     * @throws ResourceException if the configured limit of live matchers is reached
     */
    public static StreamMatcher createMatcher(byte[] pattern) {
        return compile(pattern).matcher();
    }

    /**
     * Approximate heap footprint of a live matcher.
     *
     * @see StreamMatcher#sizeOfState()
     */
    public static long sizeOfState(StreamMatcher matcher) {
        return matcher.sizeOfState();
    }

    /**
     * Releases a matcher. The matcher must not be used afterwards.
     *
     * @see StreamMatcher#close()
     */
    public static void destroyMatcher(StreamMatcher matcher) {
        matcher.close();
    }
}
