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

package com.axonops.libkmp.metrics;

/**
 * Metric name constants for KMP library instrumentation.
 *
 * <h2>Architecture Overview</h2>
 *
 * <p>Compiling a pattern builds its failure table once. {@link
 * com.axonops.libkmp.api.Pattern#compile(byte[])} keeps compiled patterns in a bounded LRU cache
 * so that repeated searches for the same bytes reuse the table:
 *
 * <ol>
 *   <li><b>Cache Hit</b> - Pattern found in cache, returned immediately
 *   <li><b>Cache Miss</b> - Failure table built, pattern stored in cache (evicting the least
 *       recently used entry when full)
 * </ol>
 *
 * <p>Batch matching ({@code Pattern.match}) is measured per call. Streaming matching is measured
 * per block fed through {@code StreamMatcher.feed(byte[], ...)}; single-symbol feeds are not
 * instrumented since they run once per input byte.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current or peak value (suffix: {@code .current.*} or {@code .peak.*})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * KMPConfig config = KMPConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.kmp"))
 *     .build();
 * Pattern.setGlobalCache(new PatternCache(config));
 *
 * Pattern.compile("needle").match(haystack);
 *
 * Counter compilations = registry.counter(
 *     MetricRegistry.name("myapp.kmp", MetricNames.PATTERNS_COMPILED));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.libkmp.cache.PatternCache
 * @see com.axonops.libkmp.api.Pattern
 * @see com.axonops.libkmp.api.StreamMatcher
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics
  // ========================================

  /**
   * Total patterns compiled (failure tables built).
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High values relative to cache hits indicate many unique patterns
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Total cache hits (pattern found in cache).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Total cache misses (pattern not in cache, compilation required).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Failure table construction latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> Linear in pattern length
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  // ========================================
  // Cache State Metrics
  // ========================================

  /**
   * Current number of patterns in cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /**
   * Approximate heap memory held by cached patterns (pattern copies plus failure tables).
   *
   * <p><b>Type:</b> Gauge (bytes)
   */
  public static final String CACHE_MEMORY = "cache.memory.current.bytes";

  /**
   * Peak heap memory held by cached patterns (high water mark).
   *
   * <p><b>Type:</b> Gauge (bytes)
   */
  public static final String CACHE_MEMORY_PEAK = "cache.memory.peak.bytes";

  /**
   * Patterns evicted because the cache exceeded {@code maxCacheSize}.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Sustained growth means the cache is too small for the working set
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  // ========================================
  // Batch Matching Metrics
  // ========================================

  /**
   * Total batch scans (one per {@code match}, {@code find}, {@code count} call).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BATCH_OPERATIONS = "matching.batch.operations.total.count";

  /**
   * Batch scan latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHING_BATCH_LATENCY = "matching.batch.latency";

  /**
   * Total bytes scanned by batch operations.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BATCH_BYTES = "matching.batch.bytes.total.count";

  /**
   * Total occurrences reported by batch operations.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_BATCH_MATCHES = "matching.batch.matches.total.count";

  // ========================================
  // Streaming Metrics
  // ========================================

  /**
   * Total blocks fed to stream matchers.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_STREAM_CHUNKS = "matching.stream.chunks.total.count";

  /**
   * Total bytes fed to stream matchers in blocks.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_STREAM_BYTES = "matching.stream.bytes.total.count";

  /**
   * Total occurrences reported by stream matchers while feeding blocks.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHING_STREAM_MATCHES = "matching.stream.matches.total.count";

  // ========================================
  // Resource Management Metrics
  // ========================================

  /**
   * Current number of live (not yet closed) stream matchers.
   *
   * <p><b>Type:</b> Gauge (count)
   *
   * <p><b>Interpretation:</b> Steady growth indicates matchers that are never closed
   */
  public static final String RESOURCES_MATCHERS_ACTIVE = "resources.matchers.active.current.count";

  /**
   * Total stream matchers created.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String RESOURCES_MATCHERS_CREATED = "resources.matchers.created.total.count";

  /**
   * Total stream matchers closed.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should track {@link #RESOURCES_MATCHERS_CREATED} closely
   */
  public static final String RESOURCES_MATCHERS_FREED = "resources.matchers.freed.total.count";

  // ========================================
  // Error Metrics
  // ========================================

  /**
   * Working storage could not be allocated.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_ALLOCATION_FAILED = "errors.allocation.failed.total.count";

  /**
   * Stream matcher creation rejected because {@code maxActiveMatchers} was reached.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_RESOURCE_EXHAUSTED = "errors.resource.exhausted.total.count";
}
