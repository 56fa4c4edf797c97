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

package com.axonops.bitap.cache;

import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for the bitap library: pattern caching and metrics.
 *
 * <p>Immutable configuration using Java 17 records.
 *
 * <h2>Pattern Cache</h2>
 *
 * <p>{@link com.axonops.bitap.api.Pattern#compile(String)} keeps compiled patterns in a bounded
 * cache keyed by pattern text and case sensitivity. When the cache grows beyond {@code
 * maxCacheSize}, the least recently used patterns are evicted. Compiling a pattern is cheap
 * (one pass over the pattern), so the cache mostly pays off for callers that compile the same
 * query text on every request.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults (10K cached patterns, metrics disabled)
 * BitapConfig config = BitapConfig.DEFAULT;
 *
 * // Metrics enabled, smaller cache
 * BitapConfig config = BitapConfig.builder()
 *     .maxCacheSize(1_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.fuzzy"))
 *     .build();
 * Pattern.setGlobalCache(new PatternCache(config));
 * }</pre>
 *
 * @param cacheEnabled Enable pattern caching (if false, every compile builds a new pattern)
 * @param maxCacheSize Maximum patterns in cache before LRU eviction (must be > 0 if cache enabled)
 * @param metricsRegistry Metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see com.axonops.bitap.cache.PatternCache
 * @see com.axonops.bitap.metrics.MetricNames
 */
public record BitapConfig(
    boolean cacheEnabled, int maxCacheSize, BitapMetricsRegistry metricsRegistry) {

  /** Default configuration: cache of 10,000 patterns, metrics disabled. */
  public static final BitapConfig DEFAULT =
      new BitapConfig(
          true, // Cache enabled
          10000, // Max 10K cached patterns
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Configuration with caching disabled. */
  public static final BitapConfig NO_CACHE =
      new BitapConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE // Metrics disabled
          );

  /** Compact constructor with validation. */
  public BitapConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (cacheEnabled && maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
    }
    if (maxCacheSize < 0) {
      throw new IllegalArgumentException("maxCacheSize must not be negative");
    }
  }

  /**
   * Creates a builder for custom configuration, starting from the defaults.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the defaults from {@link #DEFAULT}.
   */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private BitapMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

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
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry} (zero overhead)</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(BitapMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public BitapConfig build() {
      return new BitapConfig(cacheEnabled, maxCacheSize, metricsRegistry);
    }
  }
}
