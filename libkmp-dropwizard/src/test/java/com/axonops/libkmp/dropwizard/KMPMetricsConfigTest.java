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

package com.axonops.libkmp.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.axonops.libkmp.cache.KMPConfig;
import com.axonops.libkmp.metrics.DropwizardMetricsAdapter;
import com.axonops.libkmp.metrics.MetricNames;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/** Tests for KMPMetricsConfig factory methods. */
class KMPMetricsConfigTest {

  @AfterEach
  void cleanup() {
    KMPMetricsConfig.shutdown();
  }

  @Test
  void testWithMetrics_CustomPrefix() {
    MetricRegistry registry = new MetricRegistry();

    KMPConfig config = KMPMetricsConfig.withMetrics(registry, "com.myapp.search");

    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
    config.metricsRegistry().incrementCounter(MetricNames.PATTERNS_COMPILED);
    assertThat(registry.counter("com.myapp.search.patterns.compiled.total.count").getCount()).isEqualTo(1);
  }

  @Test
  void testWithMetrics_DefaultPrefix() {
    MetricRegistry registry = new MetricRegistry();

    KMPConfig config = KMPMetricsConfig.withMetrics(registry);

    config.metricsRegistry().incrementCounter(MetricNames.PATTERNS_COMPILED);
    assertThat(registry.getCounters().keySet())
        .containsExactly("com.axonops.libkmp.patterns.compiled.total.count");
  }

  @Test
  void testWithMetrics_KeepsDefaultLimits() {
    KMPConfig config = KMPMetricsConfig.withMetrics(new MetricRegistry(), "test", false);

    assertThat(config.cacheEnabled()).isTrue();
    assertThat(config.maxCacheSize()).isEqualTo(KMPConfig.DEFAULT.maxCacheSize());
    assertThat(config.maxActiveMatchers()).isEqualTo(KMPConfig.DEFAULT.maxActiveMatchers());
  }

  @Test
  void testConfigure_KeepsBuilderSettings() {
    KMPConfig config = KMPMetricsConfig.configure(
        KMPConfig.builder().maxCacheSize(50).maxActiveMatchers(7), new MetricRegistry(), "tuned", false);

    assertThat(config.maxCacheSize()).isEqualTo(50);
    assertThat(config.maxActiveMatchers()).isEqualTo(7);
    assertThat(config.metricsRegistry()).isInstanceOf(DropwizardMetricsAdapter.class);
  }

  @Test
  void testRepeatedJmxSetupIsHarmless() {
    MetricRegistry registry = new MetricRegistry();

    KMPMetricsConfig.withMetrics(registry, "jmx.once");
    KMPMetricsConfig.withMetrics(registry, "jmx.once");

    KMPMetricsConfig.shutdown();
    KMPMetricsConfig.shutdown();
  }

  @Test
  void testNullRegistry_ThrowsException() {
    assertThatThrownBy(() -> KMPMetricsConfig.withMetrics(null, "test"))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("registry");
  }

  @Test
  void testNullPrefix_ThrowsException() {
    assertThatThrownBy(() -> KMPMetricsConfig.withMetrics(new MetricRegistry(), null))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("metricPrefix");
  }
}
