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

package com.axonops.bitap.dropwizard;

import com.axonops.bitap.cache.BitapConfig;
import com.axonops.bitap.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for BitapConfig with Dropwizard Metrics integration.
 *
 * <p>Wires an application's {@link MetricRegistry} into the library and, unless told otherwise,
 * exposes it over JMX with a {@link JmxReporter}.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Application registry with a custom namespace:
 * MetricRegistry registry = getApplicationMetricRegistry();
 * BitapConfig config = BitapMetricsConfig.withMetrics(registry, "com.myapp.fuzzy");
 * Pattern.setGlobalCache(new PatternCache(config));
 *
 * // Registry already reported elsewhere, no JMX:
 * BitapConfig config = BitapMetricsConfig.withMetrics(registry, "com.myapp.fuzzy", false);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class BitapMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(BitapMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private BitapMetricsConfig() {
        // Utility class
    }

    /**
     * Creates BitapConfig with Dropwizard Metrics integration and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured BitapConfig with metrics enabled
     */
    public static BitapConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates BitapConfig with Dropwizard Metrics integration.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to automatically set up JMX exposure
     * @return configured BitapConfig with metrics enabled
     */
    public static BitapConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return BitapConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Creates BitapConfig with Dropwizard Metrics using default prefix.
     *
     * <p>Uses default metric prefix: {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured BitapConfig with metrics enabled
     */
    public static BitapConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates BitapConfig with metrics and a custom cache size.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param maxCacheSize maximum cached patterns
     * @return configured BitapConfig with metrics enabled
     */
    public static BitapConfig withMetrics(MetricRegistry registry, String metricPrefix, int maxCacheSize) {
        BitapConfig base = withMetrics(registry, metricPrefix, true);
        return BitapConfig.builder()
            .maxCacheSize(maxCacheSize)
            .metricsRegistry(base.metricsRegistry())
            .build();
    }

    /**
     * Whether this class has started a JmxReporter that is still running.
     */
    public static boolean isJmxReporterStarted() {
        return jmxReporter != null;
    }

    /**
     * Ensures JmxReporter is registered for the given MetricRegistry.
     *
     * <p>Idempotent: only the first registry passed here gets a reporter.
     *
     * @param registry the MetricRegistry to expose via JMX
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("Bitap: Registering JmxReporter for metrics");
                JmxReporter reporter = JmxReporter.forRegistry(registry).build();
                reporter.start();
                jmxReporter = reporter;
                logger.info("Bitap: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal - registry may already have JMX exposure
                logger.warn("Bitap: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    /**
     * Stops the JmxReporter started by this class, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("Bitap: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
