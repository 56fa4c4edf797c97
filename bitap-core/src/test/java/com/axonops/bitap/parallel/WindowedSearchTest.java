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

package com.axonops.bitap.parallel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.axonops.bitap.api.Match;
import com.axonops.bitap.api.Pattern;
import com.axonops.bitap.test.EditDistanceOracle;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class WindowedSearchTest {

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(10, TimeUnit.SECONDS);
  }

  @ParameterizedTest
  @ValueSource(longs = {1L, 7L, 42L, 1234L})
  @DisplayName("Windowed Levenshtein search equals the sequential search")
  @Timeout(value = 60, unit = TimeUnit.SECONDS)
  void levenshteinMatchesSequential(long seed) throws InterruptedException {
    Random random = new Random(seed);
    for (int i = 0; i < 100; i++) {
      String patternText = EditDistanceOracle.randomString(random, "ab", 1 + random.nextInt(8));
      String text = EditDistanceOracle.randomString(random, "abc", random.nextInt(120));
      int k = random.nextInt(5);
      int windowSize = 1 + random.nextInt(16);
      Pattern pattern = Pattern.compileWithoutCache(patternText);

      List<Match> sequential = pattern.levenshtein(text, k).toList();
      List<Match> windowed = WindowedSearch.levenshtein(pattern, text, k, windowSize, executor);

      assertThat(windowed)
          .as("pattern=%s text=%s k=%d window=%d", patternText, text, k, windowSize)
          .isEqualTo(sequential);
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {3L, 99L})
  @DisplayName("Windowed OSA search equals the sequential search")
  @Timeout(value = 60, unit = TimeUnit.SECONDS)
  void optimalStringAlignmentMatchesSequential(long seed) throws InterruptedException {
    Random random = new Random(seed);
    for (int i = 0; i < 100; i++) {
      String patternText = EditDistanceOracle.randomString(random, "abc", 2 + random.nextInt(7));
      String text = EditDistanceOracle.randomString(random, "abc", random.nextInt(120));
      int k = random.nextInt(3);
      int windowSize = 1 + random.nextInt(16);
      Pattern pattern = Pattern.compileWithoutCache(patternText);

      List<Match> sequential = pattern.optimalStringAlignment(text, k).toList();
      List<Match> windowed =
          WindowedSearch.optimalStringAlignment(pattern, text, k, windowSize, executor);

      assertThat(windowed).isEqualTo(sequential);
    }
  }

  @Test
  void commonPoolOverloadsAgree() throws InterruptedException {
    Pattern pattern = Pattern.compile("timeout");
    String text = "connection timeuot after retry; timeout; timout ".repeat(50);

    assertThat(WindowedSearch.levenshtein(pattern, text, 1, 64))
        .isEqualTo(pattern.levenshtein(text, 1).toList());
    assertThat(WindowedSearch.optimalStringAlignment(pattern, text, 1, 64))
        .isEqualTo(pattern.optimalStringAlignment(text, 1).toList());
  }

  @Test
  void windowsSplitOnCodePoints() throws InterruptedException {
    Pattern pattern = Pattern.compile("café");
    // Surrogate pairs must never be cut in half by a window boundary
    String text = "😀cafe 🍰 café 😀😀 cafes".repeat(10);

    for (int windowSize = 1; windowSize <= 9; windowSize++) {
      assertThat(WindowedSearch.levenshtein(pattern, text, 1, windowSize, executor))
          .isEqualTo(pattern.levenshtein(text, 1).toList());
    }
  }

  @Test
  void emptyTextHasNoMatches() throws InterruptedException {
    Pattern pattern = Pattern.compile("abc");

    assertThat(WindowedSearch.levenshtein(pattern, "", 2, 10, executor)).isEmpty();
  }

  @Test
  void windowLargerThanTextIsSingleSearch() throws InterruptedException {
    Pattern pattern = Pattern.compile("needle");
    String text = "haystack needle hay";

    assertThat(WindowedSearch.levenshtein(pattern, text, 0, 1000, executor))
        .containsExactly(new Match(0, 14));
  }

  @ParameterizedTest
  @ValueSource(ints = {Integer.MAX_VALUE, Integer.MAX_VALUE - 1, 1 << 30})
  @DisplayName("Huge window sizes search the text as one window")
  void hugeWindowSizeIsSingleWindow(int windowSize) throws InterruptedException {
    Pattern pattern = Pattern.compileWithoutCache("ab");

    assertThat(WindowedSearch.levenshtein(pattern, "xxab", 0, windowSize, executor))
        .containsExactly(new Match(0, 3));
    assertThat(WindowedSearch.optimalStringAlignment(pattern, "xxba", 1, windowSize, executor))
        .isEqualTo(pattern.optimalStringAlignment("xxba", 1).toList());
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1})
  void nonPositiveWindowSizeRejected(int windowSize) {
    Pattern pattern = Pattern.compile("abc");

    assertThatThrownBy(() -> WindowedSearch.levenshtein(pattern, "abcabc", 1, windowSize, executor))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("windowSize");
  }

  @Test
  void negativeDistanceRejected() {
    Pattern pattern = Pattern.compile("abc");

    assertThatThrownBy(() -> WindowedSearch.levenshtein(pattern, "abcabc", -1, 2, executor))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectedExecutionPropagates() {
    Pattern pattern = Pattern.compile("abc");
    executor.shutdown();

    assertThatThrownBy(() -> WindowedSearch.levenshtein(pattern, "abcabc", 1, 2, executor))
        .isInstanceOf(RejectedExecutionException.class);
  }

  @ParameterizedTest
  @CsvSource({
    "5, 0, 5",
    "5, 2, 7",
    "3, 9, 6",
    "63, 63, 126"
  })
  void overlapIsPatternLengthPlusClampedDistance(int m, int k, int expected) {
    assertThat(WindowedSearch.overlap(m, k)).isEqualTo(expected);
  }
}
