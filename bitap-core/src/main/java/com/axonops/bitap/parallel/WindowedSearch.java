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

import com.axonops.bitap.api.Match;
import com.axonops.bitap.api.MatchIterator;
import com.axonops.bitap.api.Pattern;
import com.axonops.bitap.automaton.Automata;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.MetricNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a large text into windows and searches them in parallel.
 *
 * <p>The text's code points are cut into windows of {@code windowSize} symbols. Each window is
 * searched together with the {@code m + k} code points before it, where {@code m} is the pattern
 * length and {@code k} the clamped maximum distance: a match within distance {@code k} spans at
 * most {@code m + k} symbols, so the automaton reaches the same state at every position of the
 * window as a sequential search would. Matches ending in the leading overlap belong to the
 * previous window and are dropped.
 *
 * <p>The result is identical to {@code pattern.levenshtein(text, k).toList()}, sorted by end.
 *
 * @since 1.0.0
 */
public final class WindowedSearch {
  private static final Logger logger = LoggerFactory.getLogger(WindowedSearch.class);

  private WindowedSearch() {
    // Utility class
  }

  /** Levenshtein search on the common fork-join pool. */
  public static List<Match> levenshtein(
      Pattern pattern, CharSequence text, int maxDistance, int windowSize)
      throws InterruptedException {
    return levenshtein(pattern, text, maxDistance, windowSize, ForkJoinPool.commonPool());
  }

  /**
   * Levenshtein search with windows submitted to {@code executor}.
   *
   * @param pattern compiled pattern
   * @param text text to search
   * @param maxDistance maximum distance
   * @param windowSize code points per window, positive
   * @param executor runs one task per window; not shut down
   * @return every match, sorted by end
   * @throws InterruptedException if interrupted while waiting for a window
   */
  public static List<Match> levenshtein(
      Pattern pattern,
      CharSequence text,
      int maxDistance,
      int windowSize,
      ExecutorService executor)
      throws InterruptedException {
    return search(pattern, text, maxDistance, windowSize, executor, false);
  }

  /** Optimal string alignment search on the common fork-join pool. */
  public static List<Match> optimalStringAlignment(
      Pattern pattern, CharSequence text, int maxDistance, int windowSize)
      throws InterruptedException {
    return optimalStringAlignment(
        pattern, text, maxDistance, windowSize, ForkJoinPool.commonPool());
  }

  /**
   * Optimal string alignment search with windows submitted to {@code executor}.
   *
   * @see #levenshtein(Pattern, CharSequence, int, int, ExecutorService)
   */
  public static List<Match> optimalStringAlignment(
      Pattern pattern,
      CharSequence text,
      int maxDistance,
      int windowSize,
      ExecutorService executor)
      throws InterruptedException {
    return search(pattern, text, maxDistance, windowSize, executor, true);
  }

  /**
   * Number of code points a window is extended backwards by.
   *
   * @param patternLength pattern symbols
   * @param maxDistance maximum distance before clamping
   * @return overlap in code points
   */
  public static int overlap(int patternLength, int maxDistance) {
    return patternLength + Automata.clampDistance(patternLength, maxDistance);
  }

  private static List<Match> search(
      Pattern pattern,
      CharSequence text,
      int maxDistance,
      int windowSize,
      ExecutorService executor,
      boolean transpositions)
      throws InterruptedException {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Objects.requireNonNull(text, "text cannot be null");
    Objects.requireNonNull(executor, "executor cannot be null");
    if (windowSize <= 0) {
      throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
    }
    int overlap = overlap(pattern.length(), maxDistance);

    long startNanos = System.nanoTime();
    int codePoints = Character.codePointCount(text, 0, text.length());
    int windows = codePoints / windowSize + (codePoints % windowSize == 0 ? 0 : 1);

    logger.debug(
        "Bitap: Windowed search - codePoints: {}, windows: {}, windowSize: {}, overlap: {}",
        codePoints,
        windows,
        windowSize,
        overlap);

    // Both cursors only move forwards as windows advance
    CodePointCursor startCursor = new CodePointCursor(text);
    CodePointCursor endCursor = new CodePointCursor(text);

    List<Future<List<Match>>> futures = new ArrayList<>(windows);
    try {
      for (int w = 0; w < windows; w++) {
        // At most codePoints, so the product cannot overflow
        int windowStart = w * windowSize;
        int windowEnd = windowStart + Math.min(codePoints - windowStart, windowSize);
        int searchStart = Math.max(0, windowStart - overlap);

        CharSequence slice =
            text.subSequence(startCursor.charIndex(searchStart), endCursor.charIndex(windowEnd));
        futures.add(
            executor.submit(
                () ->
                    searchWindow(
                        pattern, slice, maxDistance, transpositions, searchStart, windowStart)));
      }

      List<Match> result = new ArrayList<>();
      for (Future<List<Match>> future : futures) {
        result.addAll(future.get());
      }

      BitapMetricsRegistry metrics = pattern.metricsRegistry();
      metrics.incrementCounter(MetricNames.SEARCH_WINDOWED_OPERATIONS);
      metrics.incrementCounter(MetricNames.SEARCH_WINDOWED_WINDOWS, windows);
      metrics.recordTimer(MetricNames.SEARCH_WINDOWED_LATENCY, System.nanoTime() - startNanos);
      return result;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Bitap: Window search failed", cause);
    } finally {
      for (Future<List<Match>> future : futures) {
        future.cancel(true);
      }
    }
  }

  private static List<Match> searchWindow(
      Pattern pattern,
      CharSequence slice,
      int maxDistance,
      boolean transpositions,
      long searchStart,
      long windowStart) {
    MatchIterator matches =
        transpositions
            ? pattern.optimalStringAlignment(slice, maxDistance)
            : pattern.levenshtein(slice, maxDistance);
    List<Match> owned = new ArrayList<>();
    while (matches.hasNext()) {
      Match match = matches.next();
      long end = searchStart + match.end();
      if (end >= windowStart) {
        owned.add(new Match(match.distance(), end));
      }
    }
    return owned;
  }

  /** Maps increasing code point indexes to char indexes without rescanning the text. */
  private static final class CodePointCursor {
    private final CharSequence text;
    private int codePoint;
    private int charIndex;

    CodePointCursor(CharSequence text) {
      this.text = text;
    }

    int charIndex(int targetCodePoint) {
      charIndex = Character.offsetByCodePoints(text, charIndex, targetCodePoint - codePoint);
      codePoint = targetCodePoint;
      return charIndex;
    }
  }
}
