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

package com.axonops.bitap.metrics;

import java.util.function.Supplier;

/**
 * Sink for the counters, timers and gauges reported by compilation, the pattern cache and searches.
 *
 * <p>Names are the constants in {@link MetricNames}, without prefix. Searches report their
 * symbol and match counts once, when the iterator is exhausted, so an implementation sees one
 * {@link #incrementCounter(String, long)} per finished search rather than one call per symbol.
 *
 * <p>Called from any thread that compiles or searches; implementations must be thread-safe.
 *
 * @since 1.0.0
 */
public interface BitapMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "patterns.compiled.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "search.symbols.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "patterns.compilation.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Register a gauge that computes its value on-demand.
     *
     * <p>The supplier is called each time the gauge is read (e.g., via JMX) and must not block.
     * If a gauge with this name already exists, it is replaced.
     *
     * @param name metric name (e.g., "cache.patterns.current.count")
     * @param valueSupplier function that returns the current value
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Remove a previously registered gauge. No-op if absent.
     *
     * @param name metric name to remove
     */
    void removeGauge(String name);
}
