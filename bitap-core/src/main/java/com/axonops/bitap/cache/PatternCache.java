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

import com.axonops.bitap.api.Pattern;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.MetricNames;
import com.axonops.bitap.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache for compiled {@link Pattern}s with least-recently-used eviction.
 *
 * <p>Performance characteristics: - Lock-free cache reads (ConcurrentHashMap) - Lock-free access
 * stamps (AtomicLong) - One compilation per key under contention (computeIfAbsent) - Soft limit:
 * while one thread evicts, others may briefly push the size above maxSize
 *
 * <p>Compiled patterns hold no external resources, so evicted patterns stay usable by callers that
 * still reference them; eviction only drops the cache's reference.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private final BitapConfig config;

  // null when caching is disabled
  private final ConcurrentHashMap<CacheKey, CachedPattern> cache;

  // Logical clock for access ordering; nanoTime can tie on coarse clocks
  private final AtomicLong accessClock = new AtomicLong(0);

  // Only one thread evicts at a time, others carry on
  private final ReentrantLock evictionLock = new ReentrantLock();

  // Statistics (all atomic, lock-free)
  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);

  /**
   * Creates a new pattern cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public PatternCache(BitapConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");

    if (config.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(config.maxCacheSize(), 1024));
      logger.debug("Bitap: Pattern cache initialized - maxSize: {}", config.maxCacheSize());
      registerCacheMetrics();
    } else {
      this.cache = null;
      logger.info("Bitap: Pattern caching disabled");
    }
  }

  public BitapConfig getConfig() {
    return config;
  }

  /**
   * Gets or compiles a pattern.
   *
   * <p>Lock-free for cache hits. Uses computeIfAbsent so that concurrent callers asking for the
   * same key compile it once. A compiler that throws leaves the cache unchanged and the exception
   * propagates to the caller.
   *
   * @param patternString pattern text
   * @param caseSensitive case sensitivity flag
   * @param compiler function to compile pattern on cache miss
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(
      String patternString, boolean caseSensitive, Supplier<Pattern> compiler) {
    BitapMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(patternString, caseSensitive);

    CachedPattern cached = cache.get(key);
    if (cached != null) {
      cached.touch(accessClock.incrementAndGet());
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Bitap: Cache hit - hash: {}", PatternHasher.hash(patternString));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("Bitap: Cache miss - hash: {}, compiling", PatternHasher.hash(patternString));

    CachedPattern newCached =
        cache.computeIfAbsent(
            key, k -> new CachedPattern(compiler.get(), accessClock.incrementAndGet()));

    if (cache.size() > config.maxCacheSize()) {
      evictLeastRecentlyUsed();
    }

    return newCached.pattern();
  }

  /**
   * Evicts the least recently used patterns until the cache is back to its maximum size.
   *
   * <p>If another thread is already evicting, returns immediately.
   */
  private void evictLeastRecentlyUsed() {
    if (!evictionLock.tryLock()) {
      return;
    }
    try {
      int toEvict = cache.size() - config.maxCacheSize();
      if (toEvict <= 0) {
        return;
      }

      List<Map.Entry<CacheKey, CachedPattern>> candidates =
          cache.entrySet().stream()
              .sorted(Comparator.comparingLong(e -> e.getValue().lastAccess()))
              .limit(toEvict)
              .collect(Collectors.toList());

      int evicted = 0;
      for (Map.Entry<CacheKey, CachedPattern> entry : candidates) {
        if (cache.remove(entry.getKey(), entry.getValue())) {
          evictionsLRU.incrementAndGet();
          config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
          logger.trace("Bitap: LRU evicting pattern: {}", entry.getKey());
          evicted++;
        }
      }

      if (evicted > 0) {
        logger.debug(
            "Bitap: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
            evicted,
            cache.size(),
            config.maxCacheSize());
      }
    } finally {
      evictionLock.unlock();
    }
  }

  /**
   * Checks whether a pattern is currently cached, without touching its access stamp.
   *
   * @param patternString pattern text
   * @param caseSensitive case sensitivity flag
   * @return true if cached
   */
  public boolean contains(String patternString, boolean caseSensitive) {
    return cache != null && cache.containsKey(new CacheKey(patternString, caseSensitive));
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    int currentSize = config.cacheEnabled() ? cache.size() : 0;
    return new CacheStatistics(
        hits.get(), misses.get(), evictionsLRU.get(), currentSize, config.maxCacheSize());
  }

  /** Removes all cached patterns. Statistics are kept. */
  public void clear() {
    if (!config.cacheEnabled()) {
      return;
    }
    logger.debug("Bitap: Clearing cache - {} cached patterns", cache.size());
    cache.clear();
  }

  /** Resets cache statistics (for testing only). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    logger.trace("Bitap: Cache statistics reset");
  }

  /** Full reset for testing (clears cache and resets statistics). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Unregisters the cache gauges and clears the cache. Called when the cache is replaced as the
   * global cache.
   */
  public void shutdown() {
    logger.debug("Bitap: Shutting down cache");
    if (config.cacheEnabled()) {
      config.metricsRegistry().removeGauge(MetricNames.CACHE_PATTERNS_COUNT);
    }
    clear();
  }

  private void registerCacheMetrics() {
    config.metricsRegistry().registerGauge(MetricNames.CACHE_PATTERNS_COUNT, cache::size);
    logger.debug("Bitap: Metrics registered - cache gauges");
  }

  /** Cache key combining pattern string and case-sensitivity. */
  private record CacheKey(String pattern, boolean caseSensitive) {
    @Override
    public String toString() {
      return PatternHasher.hashWithCase(pattern, caseSensitive);
    }
  }

  /** Cached pattern with its last access stamp. */
  private static final class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccess;

    CachedPattern(Pattern pattern, long stamp) {
      this.pattern = pattern;
      this.lastAccess = new AtomicLong(stamp);
    }

    Pattern pattern() {
      return pattern;
    }

    long lastAccess() {
      return lastAccess.get();
    }

    void touch(long stamp) {
      lastAccess.set(stamp);
    }
  }
}
