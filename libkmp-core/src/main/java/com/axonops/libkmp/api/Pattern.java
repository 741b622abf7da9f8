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

import com.axonops.libkmp.cache.CacheStatistics;
import com.axonops.libkmp.cache.KMPConfig;
import com.axonops.libkmp.cache.PatternCache;
import com.axonops.libkmp.metrics.KMPMetricsRegistry;
import com.axonops.libkmp.metrics.MetricNames;
import com.axonops.libkmp.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A compiled search pattern: a private copy of the pattern bytes plus its failure table.
 *
 * Thread-safe: Pattern instances are immutable and can be shared between threads.
 * Batch operations ({@link #match}, {@link #find}, {@link #count}) may run concurrently on the
 * same Pattern. Each {@link StreamMatcher} from {@link #matcher()} is confined to one thread.
 *
 * Symbols are bytes. The String overloads encode pattern and text as UTF-8, so reported offsets
 * are byte offsets into the encoded text, not char indices.
 *
 * Example:
 * <pre>{@code
 * Pattern pattern = Pattern.compile("abab");
 * MatchResult result = pattern.match("abababab");   // [0, 2, 4]
 * }</pre>
 *
 * An empty pattern is valid and never matches. Patterns longer than the text never match.
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    private static final int INITIAL_OUTPUT_CAPACITY = 16;

    // Global pattern cache (mutable for testing only)
    private static volatile PatternCache cache = new PatternCache(KMPConfig.DEFAULT);

    private final FailureTable table;
    private final boolean fromCache;

    Pattern(FailureTable table, boolean fromCache) {
        this.table = Objects.requireNonNull(table);
        this.fromCache = fromCache;
    }

    /**
     * Compiles a pattern, reusing a cached compilation when one exists.
     *
     * @param pattern pattern bytes (copied)
     * @return compiled pattern
     * @throws NullPointerException if pattern is null
     * @throws AllocationException if the failure table cannot be allocated
     */
    public static Pattern compile(byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        PatternCache current = cache;
        return current.getOrCompile(pattern, () -> doCompile(pattern, current.getConfig().cacheEnabled()));
    }

    /**
     * Compiles the UTF-8 encoding of a pattern string.
     *
     * @param pattern pattern text
     * @return compiled pattern
     */
    public static Pattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return compile(pattern.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Compiles a pattern without consulting or populating the cache.
     *
     * @param pattern pattern bytes (copied)
     * @return compiled pattern
     */
    public static Pattern compileWithoutCache(byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return doCompile(pattern, false);
    }

    /**
     * Compiles the UTF-8 encoding of a pattern string without the cache.
     *
     * @param pattern pattern text
     * @return compiled pattern
     */
    public static Pattern compileWithoutCache(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return doCompile(pattern.getBytes(StandardCharsets.UTF_8), false);
    }

    private static Pattern doCompile(byte[] pattern, boolean fromCache) {
        KMPMetricsRegistry metrics = cache.getConfig().metricsRegistry();

        long startNanos = System.nanoTime();
        FailureTable table;
        try {
            table = FailureTable.build(pattern);
        } catch (AllocationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_ALLOCATION_FAILED);
            logger.debug("KMP: Pattern compilation failed - hash: {}, length: {}",
                PatternHasher.hash(pattern), pattern.length);
            throw e;
        }
        long durationNanos = System.nanoTime() - startNanos;

        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

        logger.trace("KMP: Pattern compiled - hash: {}, length: {}, fromCache: {}, bytes: {}, timeNs: {}",
            PatternHasher.hash(pattern), pattern.length, fromCache, table.sizeInBytes(), durationNanos);

        return new Pattern(table, fromCache);
    }

    // ========== Batch Matching ==========

    /**
     * Finds every occurrence of this pattern in {@code text}.
     *
     * @param text text to scan
     * @return start offsets of all (possibly overlapping) occurrences, in increasing order
     * @throws NullPointerException if text is null
     * @throws AllocationException if the output buffer cannot be allocated
     */
    public MatchResult match(byte[] text) {
        Objects.requireNonNull(text, "text cannot be null");
        return match(text, 0, text.length);
    }

    /**
     * Finds every occurrence inside {@code text[offset .. offset+length-1]}.
     *
     * <p>Reported offsets are indices into {@code text}, not relative to {@code offset}.
     *
     * @param text array holding the text
     * @param offset index of the first text symbol
     * @param length number of symbols to scan
     * @return start offsets of all occurrences, in increasing order
     * @throws IndexOutOfBoundsException if the range is outside the array
     */
    public MatchResult match(byte[] text, int offset, int length) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.checkFromIndexSize(offset, length, text.length);

        long startNanos = System.nanoTime();
        MatchResult result = scan(text, offset, length, Integer.MAX_VALUE);
        recordBatch(startNanos, length, result.count());
        return result;
    }

    /**
     * Finds every occurrence in the remaining bytes of {@code text}.
     *
     * <p>Scans {@code position()} to {@code limit()} without moving the buffer's position.
     * Offsets are relative to {@code position()}.
     *
     * @param text buffer to scan (heap or direct)
     * @return start offsets of all occurrences, in increasing order
     */
    public MatchResult match(ByteBuffer text) {
        Objects.requireNonNull(text, "text cannot be null");

        long startNanos = System.nanoTime();
        MatchResult result = scan(text, Integer.MAX_VALUE);
        recordBatch(startNanos, text.remaining(), result.count());
        return result;
    }

    /**
     * Finds every occurrence in the UTF-8 encoding of {@code text}.
     *
     * @param text text to scan
     * @return UTF-8 byte offsets of all occurrences
     */
    public MatchResult match(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return match(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Finds the first occurrence, stopping the scan there.
     *
     * @param text text to scan
     * @return start offset of the first occurrence, or -1
     */
    public int find(byte[] text) {
        Objects.requireNonNull(text, "text cannot be null");
        return find(text, 0, text.length);
    }

    /**
     * Finds the first occurrence inside {@code text[offset .. offset+length-1]}.
     *
     * @return index into {@code text} of the first occurrence, or -1
     */
    public int find(byte[] text, int offset, int length) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.checkFromIndexSize(offset, length, text.length);

        long startNanos = System.nanoTime();
        MatchResult result = scan(text, offset, length, 1);
        recordBatch(startNanos, length, result.count());
        return result.first();
    }

    /**
     * Finds the first occurrence in the remaining bytes of {@code text}.
     *
     * @return offset relative to {@code position()}, or -1
     */
    public int find(ByteBuffer text) {
        Objects.requireNonNull(text, "text cannot be null");

        long startNanos = System.nanoTime();
        MatchResult result = scan(text, 1);
        recordBatch(startNanos, text.remaining(), result.count());
        return result.first();
    }

    /**
     * Finds the first occurrence in the UTF-8 encoding of {@code text}.
     *
     * @return UTF-8 byte offset of the first occurrence, or -1
     */
    public int find(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return find(text.getBytes(StandardCharsets.UTF_8));
    }

    public boolean contains(byte[] text) {
        return find(text) >= 0;
    }

    public boolean contains(String text) {
        return find(text) >= 0;
    }

    /**
     * Counts occurrences, overlapping ones included.
     *
     * @param text text to scan
     * @return number of occurrences
     */
    public int count(byte[] text) {
        return match(text).count();
    }

    /**
     * Single left-to-right pass over a byte array range.
     */
    private MatchResult scan(byte[] text, int offset, int length, int maxMatches) {
        int m = table.length();
        if (m == 0 || m > length) {
            return MatchResult.empty();
        }

        int capacity = length - m + 1;
        int[] out = allocateOutput(Math.min(INITIAL_OUTPUT_CAPACITY, capacity));
        int count = 0;

        int last = m - 1;
        int i = FailureTable.NO_PREFIX;
        int end = offset + length;
        for (int j = offset; j < end; j++) {
            i = table.next(i, text[j]);
            if (i == last) {
                if (count == out.length) {
                    out = growOutput(out, capacity);
                }
                out[count++] = j - last;
                if (count == maxMatches) {
                    break;
                }
                i = table.link(i);
            }
        }
        return MatchResult.of(out, count);
    }

    /**
     * Single pass over {@code position()..limit()} using absolute reads.
     */
    private MatchResult scan(ByteBuffer text, int maxMatches) {
        int base = text.position();
        if (text.hasArray()) {
            int arrayBase = text.arrayOffset() + base;
            MatchResult inArray = scan(text.array(), arrayBase, text.remaining(), maxMatches);
            if (inArray.isEmpty() || arrayBase == 0) {
                return inArray;
            }
            return MatchResult.of(inArray.stream().map(o -> o - arrayBase).toArray(), inArray.count());
        }

        int m = table.length();
        int length = text.remaining();
        if (m == 0 || m > length) {
            return MatchResult.empty();
        }

        int capacity = length - m + 1;
        int[] out = allocateOutput(Math.min(INITIAL_OUTPUT_CAPACITY, capacity));
        int count = 0;

        int last = m - 1;
        int i = FailureTable.NO_PREFIX;
        int end = text.limit();
        for (int j = base; j < end; j++) {
            i = table.next(i, text.get(j));
            if (i == last) {
                if (count == out.length) {
                    out = growOutput(out, capacity);
                }
                out[count++] = j - last - base;
                if (count == maxMatches) {
                    break;
                }
                i = table.link(i);
            }
        }
        return MatchResult.of(out, count);
    }

    private int[] allocateOutput(int size) {
        try {
            return new int[size];
        } catch (OutOfMemoryError e) {
            throw allocationFailed(size, e);
        }
    }

    private int[] growOutput(int[] out, int capacity) {
        int size = (int) Math.min((long) out.length * 2, capacity);
        try {
            return Arrays.copyOf(out, size);
        } catch (OutOfMemoryError e) {
            throw allocationFailed(size, e);
        }
    }

    private AllocationException allocationFailed(int size, OutOfMemoryError e) {
        cache.getConfig().metricsRegistry().incrementCounter(MetricNames.ERRORS_ALLOCATION_FAILED);
        return new AllocationException("match output buffer", size, e);
    }

    private void recordBatch(long startNanos, int bytes, int matches) {
        long durationNanos = System.nanoTime() - startNanos;
        KMPMetricsRegistry metrics = cache.getConfig().metricsRegistry();

        metrics.incrementCounter(MetricNames.MATCHING_BATCH_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_BATCH_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.MATCHING_BATCH_BYTES, bytes);
        if (matches > 0) {
            metrics.incrementCounter(MetricNames.MATCHING_BATCH_MATCHES, matches);
        }
    }

    // ========== Streaming ==========

    /**
     * Creates a stream matcher for this pattern, starting with no progress.
     *
     * <p>The matcher must be closed when the stream ends:
     * <pre>{@code
     * try (StreamMatcher m = pattern.matcher()) {
     *     long position = 0;
     *     int b;
     *     while ((b = in.read()) != -1) {
     *         long end = m.feed((byte) b, position++);
     *         if (end != StreamMatcher.NO_MATCH) {
     *             onMatch(end - pattern.length() + 1);
     *         }
     *     }
     * }
     * }</pre>
     *
     * @return new matcher
     * @throws ResourceException if the configured limit of live matchers is reached
     */
    public StreamMatcher matcher() {
        PatternCache current = cache;
        KMPMetricsRegistry metrics = current.getConfig().metricsRegistry();
        current.getResourceTracker().trackMatcherAllocated(current.getConfig().maxActiveMatchers(), metrics);
        return new StreamMatcher(this, current.getResourceTracker(), metrics);
    }

    // ========== Accessors ==========

    /** The failure table of this pattern. */
    public FailureTable failureTable() {
        return table;
    }

    /** Pattern length m. */
    public int length() {
        return table.length();
    }

    /** Returns a copy of the pattern bytes. */
    public byte[] bytes() {
        return table.pattern();
    }

    /**
     * Approximate heap held by this pattern (pattern copy plus failure table).
     *
     * @return size estimate in bytes
     */
    public long getMemoryBytes() {
        return table.sizeInBytes();
    }

    /** Whether this pattern was compiled through the cache. */
    public boolean isFromCache() {
        return fromCache;
    }

    @Override
    public String toString() {
        return "Pattern{length=" + table.length() + ", fromCache=" + fromCache + "}";
    }

    // ========== Global Cache ==========

    /**
     * Gets the global pattern cache (for internal use).
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    /**
     * Sets a new global cache (for testing only).
     *
     * Primarily for tests that need to inject a cache with custom limits or metrics.
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "cache cannot be null");
    }

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Gets the current cache configuration.
     */
    public static KMPConfig getCacheConfig() {
        return cache.getConfig();
    }
}
