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

import com.axonops.libkmp.metrics.KMPMetricsRegistry;
import com.axonops.libkmp.metrics.MetricNames;
import com.axonops.libkmp.util.ResourceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Incremental matcher that consumes a stream one symbol (or one block) at a time.
 *
 * The only state carried between calls is the progress index: the length of the longest pattern
 * prefix that ends at the most recently fed symbol, minus one. It ranges over
 * {@code [-1, length-1]}, starts at -1, and collapses through the failure link right after a
 * match, so occurrences that overlap each other or straddle block boundaries are all reported.
 * Feeding a text in any split produces exactly the offsets {@link Pattern#match(byte[])} returns
 * for the whole text.
 *
 * NOT Thread-Safe: Each StreamMatcher must be confined to one stream consumer at a time.
 * Different matchers, even for the same Pattern, are independent.
 *
 * Lifecycle: create with {@link Pattern#matcher()}, close when the stream ends. Using a matcher
 * after {@link #close()} is a caller error: {@link #feed(byte, long)} only guards it with an
 * {@code assert}; the other methods throw {@link IllegalStateException}.
 *
 * @since 1.0.0
 */
public final class StreamMatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StreamMatcher.class);

    /** Returned by {@link #feed(byte, long)} when the symbol completes no occurrence. */
    public static final long NO_MATCH = -1L;

    // Header, five references and two ints
    private static final long FIXED_STATE_BYTES =
        FailureTable.OBJECT_HEADER_BYTES + 5L * FailureTable.REFERENCE_BYTES + 2L * Integer.BYTES;

    private final ResourceTracker resourceTracker;
    private final KMPMetricsRegistry metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Both dropped on close()
    private Pattern pattern;
    private FailureTable table;

    private final int last;
    private int state = FailureTable.NO_PREFIX;

    StreamMatcher(Pattern pattern, ResourceTracker resourceTracker, KMPMetricsRegistry metrics) {
        this.pattern = Objects.requireNonNull(pattern);
        this.table = pattern.failureTable();
        this.resourceTracker = Objects.requireNonNull(resourceTracker);
        this.metrics = Objects.requireNonNull(metrics);
        this.last = table.length() - 1;
    }

    /**
     * Feeds the next symbol of the stream.
     *
     * @param symbol next symbol
     * @param position caller-maintained absolute index of {@code symbol} in the stream
     * @return {@code position} if {@code symbol} completes an occurrence (which therefore starts at
     *     {@code position - length() + 1}), otherwise {@link #NO_MATCH}
     */
    public long feed(byte symbol, long position) {
        assert !closed.get() : "KMP: StreamMatcher is closed";
        if (last < 0) {
            return NO_MATCH;
        }

        int i = table.next(state, symbol);
        if (i == last) {
            state = table.link(i);
            return position;
        }
        state = i;
        return NO_MATCH;
    }

    /**
     * Feeds a whole block.
     *
     * @param chunk array holding the block
     * @param startPosition absolute stream position of {@code chunk[0]}
     * @param listener notified once per completed occurrence
     * @return number of occurrences completed inside the block
     */
    public int feed(byte[] chunk, long startPosition, MatchListener listener) {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        return feed(chunk, 0, chunk.length, startPosition, listener);
    }

    /**
     * Feeds {@code chunk[offset .. offset+length-1]}.
     *
     * <p>If the listener throws, the matcher has consumed the block up to and including the symbol
     * that completed the reported occurrence.
     *
     * @param chunk array holding the block
     * @param offset index of the first symbol to feed
     * @param length number of symbols to feed
     * @param startPosition absolute stream position of {@code chunk[offset]}
     * @param listener notified once per completed occurrence
     * @return number of occurrences completed inside the block
     * @throws IndexOutOfBoundsException if the range is outside the array
     * @throws IllegalStateException if the matcher is closed
     */
    public int feed(byte[] chunk, int offset, int length, long startPosition, MatchListener listener) {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        Objects.checkFromIndexSize(offset, length, chunk.length);
        checkNotClosed();

        int matches = 0;
        if (last >= 0) {
            long delta = startPosition - offset;
            int i = state;
            int end = offset + length;
            for (int j = offset; j < end; j++) {
                i = table.next(i, chunk[j]);
                if (i == last) {
                    i = table.link(i);
                    state = i;
                    matches++;
                    long endPosition = j + delta;
                    listener.onMatch(endPosition - last, endPosition);
                }
            }
            state = i;
        }

        recordChunk(length, matches);
        return matches;
    }

    /**
     * Feeds the remaining bytes of {@code chunk}, advancing its position to its limit.
     *
     * @param chunk buffer holding the block (heap or direct)
     * @param startPosition absolute stream position of the byte at {@code chunk.position()}
     * @param listener notified once per completed occurrence
     * @return number of occurrences completed inside the block
     */
    public int feed(ByteBuffer chunk, long startPosition, MatchListener listener) {
        Objects.requireNonNull(chunk, "chunk cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        checkNotClosed();

        int length = chunk.remaining();
        int matches = 0;
        long position = startPosition;
        if (last < 0) {
            chunk.position(chunk.limit());
        } else {
            int i = state;
            while (chunk.hasRemaining()) {
                i = table.next(i, chunk.get());
                if (i == last) {
                    i = table.link(i);
                    state = i;
                    matches++;
                    listener.onMatch(position - last, position);
                }
                position++;
            }
            state = i;
        }

        recordChunk(length, matches);
        return matches;
    }

    private void recordChunk(int bytes, int matches) {
        metrics.incrementCounter(MetricNames.MATCHING_STREAM_CHUNKS);
        metrics.incrementCounter(MetricNames.MATCHING_STREAM_BYTES, bytes);
        if (matches > 0) {
            metrics.incrementCounter(MetricNames.MATCHING_STREAM_MATCHES, matches);
        }
    }

    /**
     * Current progress index, in {@code [-1, length()-1)}.
     */
    public int state() {
        return state;
    }

    /**
     * Number of leading pattern symbols matched by the most recent stream suffix.
     */
    public int matchedLength() {
        return state + 1;
    }

    /**
     * Drops all progress, as if the matcher had just been created. The failure table is kept.
     *
     * @throws IllegalStateException if the matcher is closed
     */
    public void reset() {
        checkNotClosed();
        state = FailureTable.NO_PREFIX;
    }

    /**
     * The pattern this matcher searches for.
     *
     * @throws IllegalStateException if the matcher is closed
     */
    public Pattern pattern() {
        checkNotClosed();
        return pattern;
    }

    /**
     * Approximate heap footprint of the matcher: pattern copy, failure table and scalar fields.
     *
     * <p>Diagnostic only. The pattern copy and table are shared with the {@link Pattern} and with
     * other matchers of the same pattern, so summing this over matchers overstates real usage.
     *
     * @return size estimate in bytes
     * @throws IllegalStateException if the matcher is closed
     */
    public long sizeOfState() {
        checkNotClosed();
        return FIXED_STATE_BYTES + table.sizeInBytes();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Releases the matcher. Idempotent: only the first call releases anything.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            table = null;
            pattern = null;
            resourceTracker.trackMatcherFreed(metrics);
            logger.trace("KMP: StreamMatcher closed - final state: {}", state);
        }
    }

    private void checkNotClosed() {
        if (closed.get()) {
            throw new IllegalStateException("KMP: StreamMatcher is closed");
        }
    }
}
