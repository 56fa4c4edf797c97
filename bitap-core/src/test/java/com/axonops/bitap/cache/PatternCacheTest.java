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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.axonops.bitap.api.Pattern;
import com.axonops.bitap.api.PatternCompilationException;
import com.axonops.bitap.test.TestUtils;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PatternCacheTest {

  private PatternCache originalCache;

  @BeforeEach
  void setUp() {
    originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
  }

  @AfterEach
  void tearDown() {
    TestUtils.restoreGlobalCache(originalCache);
  }

  @Test
  void compileReturnsCachedInstance() {
    Pattern first = Pattern.compile("colour");
    Pattern second = Pattern.compile("colour");

    assertThat(second).isSameAs(first);
    CacheStatistics stats = Pattern.getCacheStatistics();
    assertThat(stats.misses()).isEqualTo(1);
    assertThat(stats.hits()).isEqualTo(1);
    assertThat(stats.currentSize()).isEqualTo(1);
    assertThat(stats.hitRate()).isEqualTo(0.5);
  }

  @Test
  void caseSensitivityIsPartOfTheKey() {
    Pattern sensitive = Pattern.compile("Colour", true);
    Pattern insensitive = Pattern.compile("Colour", false);

    assertThat(insensitive).isNotSameAs(sensitive);
    assertThat(Pattern.getCacheStatistics().currentSize()).isEqualTo(2);
    assertThat(Pattern.getGlobalCache().contains("Colour", false)).isTrue();
    assertThat(Pattern.getGlobalCache().contains("colour", false)).isFalse();
  }

  @Test
  void compileWithoutCacheBypassesCache() {
    Pattern uncached = Pattern.compileWithoutCache("colour");

    assertThat(uncached).isNotSameAs(Pattern.compile("colour"));
    assertThat(Pattern.getCacheStatistics().totalRequests()).isEqualTo(1);
  }

  @Test
  @DisplayName("Least recently used pattern is evicted first")
  void lruEviction() {
    PatternCache cache = new PatternCache(TestUtils.testConfigBuilder().maxCacheSize(3).build());
    AtomicInteger compilations = new AtomicInteger();

    compile(cache, "a", compilations);
    compile(cache, "b", compilations);
    compile(cache, "c", compilations);
    compile(cache, "a", compilations); // refresh "a"
    compile(cache, "d", compilations); // evicts "b"

    assertThat(cache.contains("a", true)).isTrue();
    assertThat(cache.contains("b", true)).isFalse();
    assertThat(cache.contains("c", true)).isTrue();
    assertThat(cache.contains("d", true)).isTrue();
    assertThat(cache.getStatistics().evictionsLRU()).isEqualTo(1);
    assertThat(cache.getStatistics().currentSize()).isEqualTo(3);
    assertThat(cache.getStatistics().utilization()).isEqualTo(1.0);

    compile(cache, "b", compilations);
    assertThat(compilations.get()).isEqualTo(5);
    assertThat(cache.contains("c", true)).isFalse();
  }

  @Test
  void evictedPatternStaysUsable() {
    PatternCache cache = new PatternCache(TestUtils.testConfigBuilder().maxCacheSize(1).build());
    Pattern first = compile(cache, "first", new AtomicInteger());
    compile(cache, "second", new AtomicInteger());

    assertThat(cache.contains("first", true)).isFalse();
    assertThat(first.containsWithin("the firts one", 2)).isTrue();
  }

  @Test
  void failedCompilationIsNotCached() {
    assertThatThrownBy(() -> Pattern.compile("")).isInstanceOf(PatternCompilationException.class);
    assertThatThrownBy(() -> Pattern.compile("")).isInstanceOf(PatternCompilationException.class);

    CacheStatistics stats = Pattern.getCacheStatistics();
    assertThat(stats.currentSize()).isZero();
    assertThat(stats.misses()).isEqualTo(2);
  }

  @Test
  void disabledCacheCompilesEveryTime() {
    TestUtils.replaceGlobalCache(BitapConfig.NO_CACHE);

    Pattern first = Pattern.compile("colour");
    Pattern second = Pattern.compile("colour");

    assertThat(second).isNotSameAs(first);
    CacheStatistics stats = Pattern.getCacheStatistics();
    assertThat(stats.misses()).isEqualTo(2);
    assertThat(stats.hits()).isZero();
    assertThat(stats.currentSize()).isZero();
    assertThat(stats.utilization()).isZero();
    assertThat(Pattern.getGlobalCache().contains("colour", true)).isFalse();
  }

  @Test
  void clearKeepsStatisticsResetDropsThem() {
    Pattern.compile("one");
    Pattern.compile("one");

    Pattern.clearCache();
    assertThat(Pattern.getCacheStatistics().currentSize()).isZero();
    assertThat(Pattern.getCacheStatistics().hits()).isEqualTo(1);

    Pattern.compile("two");
    Pattern.resetCache();
    CacheStatistics stats = Pattern.getCacheStatistics();
    assertThat(stats.currentSize()).isZero();
    assertThat(stats.totalRequests()).isZero();
    assertThat(stats.hitRate()).isZero();
  }

  @Test
  void setGlobalCacheRejectsNull() {
    assertThatThrownBy(() -> Pattern.setGlobalCache(null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void cacheConfigVisibleThroughPattern() {
    BitapConfig config = TestUtils.testConfigBuilder().maxCacheSize(42).build();
    TestUtils.replaceGlobalCache(config);

    assertThat(Pattern.getCacheConfig()).isEqualTo(config);
    assertThat(Pattern.getCacheStatistics().maxSize()).isEqualTo(42);
  }

  private static Pattern compile(PatternCache cache, String text, AtomicInteger compilations) {
    return cache.getOrCompile(
        text,
        true,
        () -> {
          compilations.incrementAndGet();
          return Pattern.compileWithoutCache(text);
        });
  }
}
