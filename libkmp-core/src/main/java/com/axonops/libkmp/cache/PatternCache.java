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

package com.axonops.libkmp.cache;

import com.axonops.libkmp.api.Pattern;
import com.axonops.libkmp.metrics.KMPMetricsRegistry;
import com.axonops.libkmp.metrics.MetricNames;
import com.axonops.libkmp.util.PatternHasher;
import com.axonops.libkmp.util.ResourceTracker;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe LRU cache for compiled patterns.
 *
 * <p>Keyed by pattern bytes. Lookups and insertions are serialized on the cache lock; the failure
 * table itself is built outside the lock, so a slow compilation never blocks readers of other
 * patterns. When two threads miss on the same pattern concurrently both build a table and the
 * first insertion wins.
 *
 * <p>Eviction is synchronous: an insertion that grows the cache beyond {@code maxCacheSize} drops
 * the least recently used entries before returning.
 *
 * <p>The cache also owns the {@link ResourceTracker} that accounts for live stream matchers.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private final KMPConfig config;
  private final ResourceTracker resourceTracker;

  // Access-ordered; guarded by itself
  private final LinkedHashMap<CacheKey, Pattern> cache;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictions = new AtomicLong(0);

  // Approximate heap held by cached patterns
  private final AtomicLong memoryBytes = new AtomicLong(0);
  private final AtomicLong peakMemoryBytes = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(KMPConfig config) {
    this.config = config;
    this.resourceTracker = new ResourceTracker();

    if (config.cacheEnabled()) {
      this.cache = new LinkedHashMap<>(16, 0.75f, true);
      logger.debug("KMP: Pattern cache initialized - maxSize: {}", config.maxCacheSize());
    } else {
      this.cache = null;
      logger.info("KMP: Pattern caching disabled");
    }

    registerMetrics();
  }

  public KMPConfig getConfig() {
    return config;
  }

  public ResourceTracker getResourceTracker() {
    return resourceTracker;
  }

  /**
   * Gets or compiles a pattern.
   *
   * @param pattern pattern bytes (not retained; the cache keys on the compiled copy)
   * @param compiler builds the pattern on cache miss
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(byte[] pattern, Supplier<Pattern> compiler) {
    KMPMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    synchronized (cache) {
      Pattern cached = cache.get(new CacheKey(pattern));
      if (cached != null) {
        hits.incrementAndGet();
        metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
        logger.trace("KMP: Cache hit - hash: {}", PatternHasher.hash(pattern));
        return cached;
      }
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("KMP: Cache miss - hash: {}, compiling", PatternHasher.hash(pattern));

    Pattern compiled = compiler.get();
    CacheKey key = new CacheKey(compiled.bytes());

    int evicted = 0;
    synchronized (cache) {
      Pattern raced = cache.putIfAbsent(key, compiled);
      if (raced != null) {
        // Another thread inserted the same pattern first
        return raced;
      }
      updateMemory(compiled.getMemoryBytes());

      Iterator<Map.Entry<CacheKey, Pattern>> eldest = cache.entrySet().iterator();
      while (cache.size() > config.maxCacheSize() && eldest.hasNext()) {
        Pattern dropped = eldest.next().getValue();
        eldest.remove();
        memoryBytes.addAndGet(-dropped.getMemoryBytes());
        evicted++;
      }
    }

    if (evicted > 0) {
      evictions.addAndGet(evicted);
      metrics.incrementCounter(MetricNames.CACHE_EVICTIONS_LRU, evicted);
      logger.debug("KMP: LRU eviction - evicted: {}, maxSize: {}", evicted, config.maxCacheSize());
    }

    return compiled;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictions.get(),
        size(),
        config.maxCacheSize(),
        memoryBytes.get(),
        peakMemoryBytes.get());
  }

  /** Current number of cached patterns. */
  public int size() {
    if (cache == null) {
      return 0;
    }
    synchronized (cache) {
      return cache.size();
    }
  }

  /**
   * Removes every cached pattern.
   *
   * <p>Patterns already handed out stay usable; only the cache's references are dropped.
   */
  public void clear() {
    if (cache == null) {
      return;
    }
    synchronized (cache) {
      logger.debug("KMP: Clearing cache - {} cached patterns", cache.size());
      cache.clear();
      memoryBytes.set(0);
    }
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
    peakMemoryBytes.set(memoryBytes.get());
    logger.trace("KMP: Cache statistics reset");
  }

  /**
   * Full reset for testing: clears the cache, statistics and the resource tracker.
   *
   * <p>Only call when no stream matchers from this cache are still open, otherwise their later
   * close() drives the active count negative.
   */
  public void reset() {
    clear();
    resetStatistics();
    resourceTracker.reset();
  }

  /** Removes the gauges this cache registered and clears it. */
  public void shutdown() {
    logger.info("KMP: Shutting down cache");
    KMPMetricsRegistry metrics = config.metricsRegistry();
    metrics.removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    metrics.removeGauge(MetricNames.CACHE_MEMORY);
    metrics.removeGauge(MetricNames.CACHE_MEMORY_PEAK);
    metrics.removeGauge(MetricNames.RESOURCES_MATCHERS_ACTIVE);
    clear();
  }

  private void registerMetrics() {
    KMPMetricsRegistry metrics = config.metricsRegistry();

    if (config.cacheEnabled()) {
      metrics.registerGauge(MetricNames.CACHE_PATTERNS_COUNT, this::size);
      metrics.registerGauge(MetricNames.CACHE_MEMORY, memoryBytes::get);
      metrics.registerGauge(MetricNames.CACHE_MEMORY_PEAK, peakMemoryBytes::get);
    }
    metrics.registerGauge(
        MetricNames.RESOURCES_MATCHERS_ACTIVE, resourceTracker::getActiveMatcherCount);

    logger.debug("KMP: Metrics registered - cache gauges: {}", config.cacheEnabled());
  }

  /** Updates current memory and the peak high water mark. */
  private void updateMemory(long added) {
    long current = memoryBytes.addAndGet(added);
    long peak;
    do {
      peak = peakMemoryBytes.get();
    } while (current > peak && !peakMemoryBytes.compareAndSet(peak, current));
  }

  /** Cache key comparing pattern bytes by content. */
  private static final class CacheKey {
    private final byte[] pattern;
    private final int hash;

    CacheKey(byte[] pattern) {
      this.pattern = pattern;
      this.hash = Arrays.hashCode(pattern);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof CacheKey && Arrays.equals(pattern, ((CacheKey) o).pattern);
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public String toString() {
      return "CacheKey{length=" + pattern.length + ", hash=" + PatternHasher.hash(pattern) + "}";
    }
  }
}
