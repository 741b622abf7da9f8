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

import com.axonops.libkmp.metrics.KMPMetricsRegistry;
import com.axonops.libkmp.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the KMP library: pattern caching, resource limits and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>{@link com.axonops.libkmp.api.Pattern#compile(byte[])} keeps compiled patterns (pattern copy
 * plus failure table) in a bounded LRU cache. When the cache holds more than {@code maxCacheSize}
 * patterns the least recently used one is dropped. Patterns live on the heap, so an evicted
 * pattern that is still referenced by a caller or a {@link com.axonops.libkmp.api.StreamMatcher}
 * stays valid and is collected once unreachable.
 *
 * <h2>Resource Limits</h2>
 *
 * <p>{@code maxActiveMatchers} caps the number of stream matchers that are live at the same time
 * (created and not yet closed). It is an ACTIVE count, not cumulative: closing a matcher frees a
 * slot. Hitting the limit usually means matchers are not being closed.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K cached patterns, 100K live matchers, metrics disabled
 * KMPConfig config = KMPConfig.DEFAULT;
 *
 * // Metrics enabled, smaller cache
 * KMPConfig config = KMPConfig.builder()
 *     .maxCacheSize(1_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.kmp"))
 *     .build();
 *
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * @param cacheEnabled Enable pattern caching (if false, every compile builds a new table)
 * @param maxCacheSize Maximum patterns in cache before LRU eviction (must be > 0 if cache enabled)
 * @param maxActiveMatchers Maximum live stream matchers (must be > 0)
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.libkmp.cache.PatternCache
 * @see com.axonops.libkmp.metrics.MetricNames
 */
public record KMPConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    int maxActiveMatchers,
    KMPMetricsRegistry metricsRegistry) {

  /** Default configuration: cache of 10K patterns, 100K live matchers, metrics disabled. */
  public static final KMPConfig DEFAULT =
      new KMPConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          100000, // Max 100K live stream matchers
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled. */
  public static final KMPConfig NO_CACHE =
      new KMPConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          100000, // Still enforce matcher limit
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public KMPConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (maxActiveMatchers <= 0) {
      throw new IllegalArgumentException(
          "maxActiveMatchers must be positive (this is the ACTIVE matcher count, not cumulative)");
    }
    if (cacheEnabled && maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT} values.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private int maxActiveMatchers = 100000;
    private KMPMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default), false to disable
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of patterns in cache before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set maximum number of live stream matchers.
     *
     * <p><b>Default: 100,000</b>
     *
     * @param max maximum live matchers (must be > 0)
     * @return this builder
     */
    public Builder maxActiveMatchers(int max) {
      this.maxActiveMatchers = max;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(KMPMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public KMPConfig build() {
      return new KMPConfig(cacheEnabled, maxCacheSize, maxActiveMatchers, metricsRegistry);
    }
  }
}
