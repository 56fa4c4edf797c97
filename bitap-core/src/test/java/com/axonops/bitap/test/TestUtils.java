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

package com.axonops.bitap.test;

import com.axonops.bitap.api.Pattern;
import com.axonops.bitap.cache.BitapConfig;
import com.axonops.bitap.cache.PatternCache;
import com.axonops.bitap.metrics.DropwizardMetricsAdapter;
import com.axonops.bitap.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;

/**
 * Test utilities for global cache setup and teardown.
 *
 * <h2>Usage Patterns</h2>
 *
 * <pre>{@code
 * private PatternCache originalCache;
 * private MetricRegistry registry;
 *
 * @BeforeEach
 * void setup() {
 *     registry = new MetricRegistry();
 *     originalCache = TestUtils.replaceGlobalCacheWithMetrics(registry, "test.prefix");
 * }
 *
 * @AfterEach
 * void cleanup() {
 *     TestUtils.restoreGlobalCache(originalCache);
 * }
 * }</pre>
 */
public final class TestUtils {
    private TestUtils() {
        // Utility class
    }

    /**
     * Creates test configuration: smaller cache than production, metrics off.
     *
     * @return builder with test defaults
     */
    public static BitapConfig.Builder testConfigBuilder() {
        return BitapConfig.builder()
            .maxCacheSize(5000)
            .metricsRegistry(NoOpMetricsRegistry.INSTANCE);
    }

    /**
     * Creates test configuration with Dropwizard metrics (no JMX).
     *
     * @param registry Dropwizard MetricRegistry
     * @param prefix metric name prefix
     * @return builder with metrics enabled
     */
    public static BitapConfig.Builder testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix));
    }

    /**
     * Replaces global cache with custom configuration.
     *
     * @param config custom configuration
     * @return original cache (save for restoration)
     */
    public static PatternCache replaceGlobalCache(BitapConfig config) {
        PatternCache original = Pattern.getGlobalCache();
        Pattern.setGlobalCache(new PatternCache(config));
        return original;
    }

    /**
     * Replaces global cache with metrics-enabled configuration.
     *
     * @param registry Dropwizard MetricRegistry
     * @param prefix metric name prefix
     * @return original cache (save for restoration)
     */
    public static PatternCache replaceGlobalCacheWithMetrics(MetricRegistry registry, String prefix) {
        return replaceGlobalCache(testConfigWithMetrics(registry, prefix).build());
    }

    /**
     * Restores original global cache.
     *
     * @param originalCache cache to restore (returned from replaceGlobalCache)
     */
    public static void restoreGlobalCache(PatternCache originalCache) {
        if (originalCache != null) {
            Pattern.setGlobalCache(originalCache);
        }
    }
}
