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

import com.axonops.libkmp.cache.KMPConfig;
import com.axonops.libkmp.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for KMPConfig with Dropwizard Metrics integration.
 *
 * <p>Sets up the Dropwizard adapter and, optionally, a JmxReporter so that search metrics show up
 * next to the host application's own metrics.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * KMPConfig config = KMPMetricsConfig.withMetrics(registry, "com.mycompany.search");
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class KMPMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(KMPMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private KMPMetricsConfig() {
        // Utility class
    }

    /**
     * Creates KMPConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured KMPConfig with metrics enabled
     */
    public static KMPConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates KMPConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured KMPConfig with metrics enabled
     */
    public static KMPConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return configure(KMPConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Creates KMPConfig with Dropwizard Metrics using the default prefix
     * {@code "com.axonops.libkmp"}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured KMPConfig with metrics enabled
     */
    public static KMPConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Applies Dropwizard metrics to a caller-tuned builder (cache size, matcher limit).
     *
     * @param builder builder carrying the caller's other settings
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured KMPConfig with metrics enabled
     */
    public static KMPConfig configure(KMPConfig.Builder builder, MetricRegistry registry,
                                      String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Ensures a JmxReporter is registered. Idempotent: only the first registry gets a reporter.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("KMP: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("KMP: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("KMP: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("KMP: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
