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

package com.axonops.libkmp.util;

import com.axonops.libkmp.api.ResourceException;
import com.axonops.libkmp.metrics.KMPMetricsRegistry;
import com.axonops.libkmp.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks stream matcher lifecycles for enforcing limits and monitoring.
 *
 * CRITICAL: Tracks ACTIVE (simultaneous) matchers, not cumulative total.
 * Instance-level (per-cache) to avoid conflicts when multiple caches exist.
 *
 * Every matcher must be reported allocated once and freed once; a balanced tracker
 * ({@code created == closed + active}) is how tests verify that close() releases exactly once.
 *
 * @since 1.0.0
 */
public final class ResourceTracker {
    private final Logger logger = LoggerFactory.getLogger(ResourceTracker.class);

    // ACTIVE count - AtomicInteger for fast limit checks on the creation path
    private final AtomicInteger activeMatchersCount = new AtomicInteger(0);

    // Cumulative counters (lifetime) - LongAdder for write throughput
    private final LongAdder totalMatchersCreated = new LongAdder();
    private final LongAdder totalMatchersClosed = new LongAdder();
    private final LongAdder matcherLimitRejections = new LongAdder();

    public ResourceTracker() {
        // Instance per cache
    }

    /**
     * Tracks a new matcher allocation.
     *
     * @param maxActive maximum allowed live matchers
     * @param metricsRegistry optional metrics registry
     * @throws ResourceException if the live matcher limit is exceeded
     */
    public void trackMatcherAllocated(int maxActive, KMPMetricsRegistry metricsRegistry) {
        int current = activeMatchersCount.incrementAndGet();

        if (current > maxActive) {
            activeMatchersCount.decrementAndGet(); // Roll back
            matcherLimitRejections.increment();

            if (metricsRegistry != null) {
                metricsRegistry.incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
            }

            throw new ResourceException(
                "Maximum active stream matchers exceeded: " + maxActive +
                " (this is ACTIVE count, not cumulative - close matchers to free slots)");
        }

        totalMatchersCreated.increment();
        if (metricsRegistry != null) {
            metricsRegistry.incrementCounter(MetricNames.RESOURCES_MATCHERS_CREATED);
        }

        logger.trace("KMP: Matcher allocated - active: {}, cumulative: {}", current, totalMatchersCreated.sum());
    }

    /**
     * Tracks a matcher being freed (called once from StreamMatcher.close()).
     *
     * @param metricsRegistry optional metrics registry to record freed count
     */
    public void trackMatcherFreed(KMPMetricsRegistry metricsRegistry) {
        int currentBefore = activeMatchersCount.get();
        int current = activeMatchersCount.decrementAndGet();
        totalMatchersClosed.increment();

        if (metricsRegistry != null) {
            metricsRegistry.incrementCounter(MetricNames.RESOURCES_MATCHERS_FREED);
        }

        if (current < 0) {
            // Get stack trace to see WHO is calling this incorrectly
            StackTraceElement[] stack = Thread.currentThread().getStackTrace();
            StringBuilder stackStr = new StringBuilder();
            for (int i = 2; i < Math.min(10, stack.length); i++) {
                stackStr.append("\n  at ").append(stack[i]);
            }
            logger.error("KMP: Matcher count went negative! before={}, after={}, Stack trace:{}",
                currentBefore, current, stackStr);
            activeMatchersCount.set(0);
        }

        logger.trace("KMP: Matcher freed - active: {}, cumulative closed: {}", current, totalMatchersClosed.sum());
    }

    /**
     * Gets current ACTIVE (simultaneous) matcher count.
     */
    public int getActiveMatcherCount() {
        return activeMatchersCount.get();
    }

    /**
     * Gets total matchers created over library lifetime.
     */
    public long getTotalMatchersCreated() {
        return totalMatchersCreated.sum();
    }

    /**
     * Gets total matchers closed over library lifetime.
     */
    public long getTotalMatchersClosed() {
        return totalMatchersClosed.sum();
    }

    /**
     * Gets rejection count for the matcher limit.
     */
    public long getMatcherLimitRejections() {
        return matcherLimitRejections.sum();
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        activeMatchersCount.set(0);
        totalMatchersCreated.reset();
        totalMatchersClosed.reset();
        matcherLimitRejections.reset();
        logger.trace("KMP: ResourceTracker reset");
    }

    /**
     * Gets statistics snapshot.
     */
    public ResourceStatistics getStatistics() {
        return new ResourceStatistics(
            activeMatchersCount.get(),
            totalMatchersCreated.sum(),
            totalMatchersClosed.sum(),
            matcherLimitRejections.sum()
        );
    }

    public record ResourceStatistics(
        int activeMatchers,
        long totalCreated,
        long totalClosed,
        long matcherLimitRejections
    ) {
        /**
         * Whether every created matcher is either still active or was closed exactly once.
         */
        public boolean isBalanced() {
            return totalCreated == totalClosed + activeMatchers;
        }
    }
}
