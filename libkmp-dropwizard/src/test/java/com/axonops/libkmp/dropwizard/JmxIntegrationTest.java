package com.axonops.libkmp.dropwizard;

import com.axonops.libkmp.api.Pattern;
import com.axonops.libkmp.api.StreamMatcher;
import com.axonops.libkmp.cache.KMPConfig;
import com.axonops.libkmp.cache.PatternCache;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private PatternCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = Pattern.getGlobalCache();
        registry = new MetricRegistry();

        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
        Pattern.setGlobalCache(originalCache);
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        KMPConfig config = KMPMetricsConfig.withMetrics(registry, "com.test.jmx", false);
        Pattern.setGlobalCache(new PatternCache(config));

        Pattern.compile("test").match("a test text");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for search metrics")
            .hasSizeGreaterThan(5);

        boolean foundCacheSizeGauge = mbeans.stream()
            .anyMatch(name -> name.toString().contains("cache.patterns.current.count") && name.toString().contains("type=gauges"));
        boolean foundCompiledCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("patterns.compiled.total.count") && name.toString().contains("type=counters"));
        boolean foundBatchTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("matching.batch.latency") && name.toString().contains("type=timers"));

        assertThat(foundCacheSizeGauge).as("cache.patterns.current.count gauge should be in JMX").isTrue();
        assertThat(foundCompiledCounter).as("patterns.compiled.total.count counter should be in JMX").isTrue();
        assertThat(foundBatchTimer).as("matching.batch.latency timer should be in JMX").isTrue();
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        KMPConfig config = KMPMetricsConfig.withMetrics(registry, "jmx.readable.test", false);
        Pattern.setGlobalCache(new PatternCache(config));

        Pattern.compile("p1");
        Pattern.compile("p2");
        Pattern.compile("p3");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName cacheSizeName = new ObjectName("metrics:name=jmx.readable.test.cache.patterns.current.count,type=gauges");

        assertThat(mBeanServer.isRegistered(cacheSizeName))
            .as("cache.patterns.current.count gauge should be registered in JMX")
            .isTrue();

        Object value = mBeanServer.getAttribute(cacheSizeName, "Value");
        assertThat(value).isInstanceOf(Number.class);
        assertThat(((Number) value).intValue()).isEqualTo(3);
    }

    @Test
    void testActiveMatchersGaugeReadable() throws Exception {
        KMPConfig config = KMPMetricsConfig.withMetrics(registry, "jmx.matchers.test", false);
        Pattern.setGlobalCache(new PatternCache(config));

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName activeName = new ObjectName(
            "metrics:name=jmx.matchers.test.resources.matchers.active.current.count,type=gauges");

        try (StreamMatcher matcher = Pattern.compile("abc").matcher()) {
            assertThat(matcher.isClosed()).isFalse();
            assertThat(((Number) mBeanServer.getAttribute(activeName, "Value")).intValue()).isEqualTo(1);
        }
        assertThat(((Number) mBeanServer.getAttribute(activeName, "Value")).intValue()).isZero();
    }

    @Test
    void testJmxTimerStatistics() throws Exception {
        KMPConfig config = KMPMetricsConfig.withMetrics(registry, "jmx.timer.test", false);
        Pattern.setGlobalCache(new PatternCache(config));

        for (int i = 0; i < 50; i++) {
            Pattern.compile("timer_pattern_" + i);
        }

        assertThat(registry.getTimers().keySet())
            .as("Timer should exist in MetricRegistry")
            .contains("jmx.timer.test.patterns.compilation.latency");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName timerName = new ObjectName("metrics:name=jmx.timer.test.patterns.compilation.latency,type=timers");

        assertThat(mBeanServer.isRegistered(timerName))
            .as("Compilation latency timer should be in JMX")
            .isTrue();

        long countValue = ((Number) mBeanServer.getAttribute(timerName, "Count")).longValue();
        assertThat(countValue).as("Timer count via JMX").isEqualTo(50);

        // min/max can be 0 for fast operations
        assertThat(mBeanServer.getAttribute(timerName, "Min")).isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "Max")).isNotNull();
    }
}
