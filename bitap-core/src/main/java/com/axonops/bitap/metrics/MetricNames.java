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

/**
 * Metric name constants for bitap library instrumentation.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern Compilation</b> - Compilation count, latency and cache efficiency
 *   <li><b>Cache</b> - Current cache size and LRU evictions
 *   <li><b>Search</b> - Searches started per distance metric, symbols scanned, matches reported
 *   <li><b>Bulk and Windowed Search</b> - Multi-input and parallel searches
 *   <li><b>Errors</b> - Compilation failures
 * </ul>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <p>Searches are lazy. Symbols and matches are counted when a search iterator is exhausted, so a
 * search the caller abandons early contributes only to the operation counters.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * BitapConfig config = BitapMetricsConfig.withMetrics(registry, "myapp.fuzzy");
 * Pattern.setGlobalCache(new PatternCache(config));
 *
 * Pattern.compile("colour").levenshtein(text, 1).toList();
 *
 * Counter searches = registry.counter(
 *     MetricRegistry.name("myapp.fuzzy", MetricNames.SEARCH_LEVENSHTEIN_OPERATIONS));
 * }</pre>
 *
 * @since 1.0.0
 * @see com.axonops.bitap.cache.PatternCache
 * @see com.axonops.bitap.api.Searcher
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Pattern Compilation Metrics
  // ========================================

  /**
   * Total patterns compiled, of every kind (code point, ASCII, byte, token).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /**
   * Total cache hits (pattern found in cache).
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High hit rate (hits / (hits + misses)) indicates effective caching
   */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /**
   * Total cache misses (pattern not in cache, compilation required).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  /**
   * Pattern compilation latency histogram.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Recorded:</b> For each successful compilation (mask table construction)
   */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  // ========================================
  // Cache Metrics
  // ========================================

  /**
   * Current number of patterns in cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_PATTERNS_COUNT = "cache.patterns.current.count";

  /**
   * Patterns evicted because the cache exceeded its maximum size.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  // ========================================
  // Search Metrics
  // ========================================

  /**
   * All searches started (exact, Levenshtein and optimal string alignment).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_OPERATIONS = "search.operations.total.count";

  /**
   * Exact searches started.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_EXACT_OPERATIONS = "search.exact.operations.total.count";

  /**
   * Levenshtein searches started.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_LEVENSHTEIN_OPERATIONS =
      "search.levenshtein.operations.total.count";

  /**
   * Optimal string alignment searches started.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_OSA_OPERATIONS = "search.osa.operations.total.count";

  /**
   * Text symbols consumed by searches that ran to exhaustion.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_SYMBOLS = "search.symbols.total.count";

  /**
   * Matches reported by searches that ran to exhaustion.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> A high ratio of matches to symbols usually means the maximum
   * distance is close to the pattern length
   */
  public static final String SEARCH_MATCHES = "search.matches.total.count";

  // ========================================
  // Bulk and Windowed Search Metrics
  // ========================================

  /**
   * Bulk operations ({@code containsWithinAll}).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_BULK_OPERATIONS = "search.bulk.operations.total.count";

  /**
   * Inputs processed by bulk operations.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_BULK_ITEMS = "search.bulk.items.total.count";

  /**
   * Bulk operation latency.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String SEARCH_BULK_LATENCY = "search.bulk.latency";

  /**
   * Windowed parallel searches.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_WINDOWED_OPERATIONS = "search.windowed.operations.total.count";

  /**
   * Windows searched by windowed parallel searches.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SEARCH_WINDOWED_WINDOWS = "search.windowed.windows.total.count";

  /**
   * Windowed parallel search latency, end to end.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String SEARCH_WINDOWED_LATENCY = "search.windowed.latency";

  // ========================================
  // Error Metrics
  // ========================================

  /**
   * Pattern compilation failures (empty, too long, invalid symbols).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";
}
