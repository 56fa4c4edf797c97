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

package com.axonops.bitap.api;

import com.axonops.bitap.cache.BitapConfig;
import com.axonops.bitap.cache.CacheStatistics;
import com.axonops.bitap.cache.PatternCache;
import com.axonops.bitap.mask.CodePointMaskTable;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.MetricNames;
import com.axonops.bitap.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A compiled search pattern over the Unicode code points of a string.
 *
 * Thread-safe: Pattern instances are immutable and can be shared between threads.
 * Each search returns its own iterator, which belongs to the calling thread.
 *
 * Patterns from compile() are cached in the global {@link PatternCache}; compiling the same
 * text twice returns the same instance while it stays cached.
 *
 * Positions reported by searches are code point indexes into the text.
 *
 * @since 1.0.0
 */
public final class Pattern implements Searcher<CharSequence> {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    // Global pattern cache (mutable for testing and runtime configuration)
    private static volatile PatternCache cache = new PatternCache(BitapConfig.DEFAULT);

    /**
     * Gets the global pattern cache.
     */
    public static PatternCache getGlobalCache() {
        return cache;
    }

    private final String patternString;
    private final boolean caseSensitive;
    private final CodePointMaskTable table;

    private Pattern(String patternString, boolean caseSensitive, CodePointMaskTable table) {
        this.patternString = patternString;
        this.caseSensitive = caseSensitive;
        this.table = table;
    }

    public static Pattern compile(String pattern) {
        return compile(pattern, true);
    }

    /**
     * Compiles a pattern through the global cache.
     *
     * <p>Case-insensitive patterns match, for each pattern code point, the code point itself and
     * its {@link Character#toLowerCase(int)} and {@link Character#toUpperCase(int)} mappings. The
     * mapping is applied to the pattern only and is not symmetric: {@code "\u017F"} (long s)
     * matches {@code "S"} but not {@code "s"}, and {@code "s"} does not match long s.
     *
     * @param pattern pattern text, 1 to {@link Bitap#MAX_PATTERN_LENGTH} code points
     * @param caseSensitive false to match either case of each pattern character
     * @return cached or newly compiled pattern
     * @throws PatternCompilationException if the pattern is empty or too long
     */
    public static Pattern compile(String pattern, boolean caseSensitive) {
        Objects.requireNonNull(pattern, "pattern cannot be null");

        // Try cache first
        return cache.getOrCompile(pattern, caseSensitive, () -> doCompile(pattern, caseSensitive));
    }

    /**
     * Compiles a pattern without using the cache.
     *
     * @param pattern pattern text
     * @return uncached pattern
     */
    public static Pattern compileWithoutCache(String pattern) {
        return compileWithoutCache(pattern, true);
    }

    /**
     * Compiles a pattern without using the cache.
     *
     * @param pattern pattern text
     * @param caseSensitive false to match either case of each pattern character
     * @return uncached pattern
     */
    public static Pattern compileWithoutCache(String pattern, boolean caseSensitive) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        return doCompile(pattern, caseSensitive);
    }

    private static Pattern doCompile(String pattern, boolean caseSensitive) {
        String hash = PatternHasher.hashWithCase(pattern, caseSensitive);
        long startNanos = System.nanoTime();

        int[] codePoints = pattern.codePoints().toArray();
        checkLength(pattern, hash, codePoints.length);

        Pattern compiled = new Pattern(pattern, caseSensitive, CodePointMaskTable.build(codePoints, caseSensitive));
        long durationNanos = recordCompiled(startNanos);
        logger.trace("Bitap: Pattern compiled - hash: {}, length: {}, caseSensitive: {}, timeNs: {}",
            hash, codePoints.length, caseSensitive, durationNanos);
        return compiled;
    }

    /**
     * Rejects empty and over-long patterns, counting and logging the failure.
     */
    static void checkLength(String pattern, String hash, int length) {
        if (length == 0) {
            throw compilationFailed(new PatternCompilationException(pattern, "Pattern is empty"), hash);
        }
        if (length > Bitap.MAX_PATTERN_LENGTH) {
            throw compilationFailed(new PatternTooLongException(pattern, length), hash);
        }
    }

    static PatternCompilationException compilationFailed(PatternCompilationException e, String hash) {
        globalMetrics().incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
        logger.debug("Bitap: Pattern compilation failed - hash: {}, error: {}", hash, e.getMessage());
        return e;
    }

    static long recordCompiled(long startNanos) {
        long durationNanos = System.nanoTime() - startNanos;
        BitapMetricsRegistry metrics = globalMetrics();
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);
        return durationNanos;
    }

    static BitapMetricsRegistry globalMetrics() {
        return cache.getConfig().metricsRegistry();
    }

    @Override
    public int length() {
        return table.patternLength();
    }

    @Override
    public MaskStream masks(CharSequence text) {
        return table.stream(text);
    }

    @Override
    public BitapMetricsRegistry metricsRegistry() {
        return globalMetrics();
    }

    public String pattern() {
        return patternString;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * The symbol-to-mask table, for use with the {@link Bitap} entry points.
     */
    public CodePointMaskTable maskTable() {
        return table;
    }

    /**
     * Gets cache statistics.
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the pattern cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Fully resets the cache including statistics (for testing only).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Sets a new global cache.
     *
     * The previous cache is not shut down, so patterns it handed out stay usable.
     * Metrics are read from the new cache's configuration from this point on.
     *
     * @param newCache the new cache to use globally
     */
    public static void setGlobalCache(PatternCache newCache) {
        cache = Objects.requireNonNull(newCache, "cache cannot be null");
    }

    /**
     * Gets the current cache configuration.
     *
     * @return the current BitapConfig
     */
    public static BitapConfig getCacheConfig() {
        return cache.getConfig();
    }

    @Override
    public String toString() {
        return "Pattern[" + PatternHasher.hashWithCase(patternString, caseSensitive) + ", length=" + length() + "]";
    }
}
