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

import com.axonops.bitap.automaton.Automata;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.MetricNames;
import com.axonops.bitap.metrics.NoOpMetricsRegistry;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.LongStream;

/**
 * A compiled pattern that can be searched for in texts of type {@code T}.
 *
 * <p>Implementations only supply the pattern length and a way to turn a text into masks. All
 * searches are built on top of those two. Distances above the pattern length are clamped to it;
 * negative distances throw {@link IllegalArgumentException}. Searches pick the unrolled automaton
 * for distances up to 2 and the general one above.
 *
 * <p>Positions are zero-based indexes of symbols in the text, in the symbol unit of the
 * implementation (code points for {@link Pattern}, bytes for {@link BytePattern}).
 *
 * @param <T> text type
 * @since 1.0.0
 */
public interface Searcher<T> {

  /** Number of symbols in the pattern. */
  int length();

  /**
   * Maps a text to the masks of its symbols.
   *
   * @param text text to search
   * @return fresh mask stream positioned at the first symbol
   */
  MaskStream masks(T text);

  /** Registry receiving search metrics. */
  default BitapMetricsRegistry metricsRegistry() {
    return NoOpMetricsRegistry.INSTANCE;
  }

  /**
   * End positions of exact occurrences, overlapping ones included.
   *
   * @param text text to search
   * @return lazy iterator of end positions
   */
  default ExactMatchIterator exact(T text) {
    Objects.requireNonNull(text, "text cannot be null");
    BitapMetricsRegistry metrics = metricsRegistry();
    metrics.incrementCounter(MetricNames.SEARCH_OPERATIONS);
    metrics.incrementCounter(MetricNames.SEARCH_EXACT_OPERATIONS);
    return new ExactMatchIterator(masks(text), Automata.exact(length()), metrics);
  }

  /**
   * Start positions of exact occurrences, in increasing order.
   *
   * @param text text to search
   * @return start positions
   */
  default LongStream find(T text) {
    int offset = length() - 1;
    return exact(text).stream().map(end -> end - offset);
  }

  /**
   * Levenshtein search.
   *
   * @param text text to search
   * @param maxDistance maximum number of insertions, deletions and substitutions
   * @return lazy iterator of matches
   */
  default MatchIterator levenshtein(T text, int maxDistance) {
    Objects.requireNonNull(text, "text cannot be null");
    BitapMetricsRegistry metrics = metricsRegistry();
    MatchIterator matches =
        new MatchIterator(masks(text), Automata.levenshtein(length(), maxDistance), metrics);
    metrics.incrementCounter(MetricNames.SEARCH_OPERATIONS);
    metrics.incrementCounter(MetricNames.SEARCH_LEVENSHTEIN_OPERATIONS);
    return matches;
  }

  /**
   * Optimal string alignment search: Levenshtein plus transposition of two adjacent symbols, with
   * no symbol edited twice.
   *
   * @param text text to search
   * @param maxDistance maximum number of edits
   * @return lazy iterator of matches
   */
  default MatchIterator optimalStringAlignment(T text, int maxDistance) {
    Objects.requireNonNull(text, "text cannot be null");
    BitapMetricsRegistry metrics = metricsRegistry();
    MatchIterator matches =
        new MatchIterator(
            masks(text), Automata.optimalStringAlignment(length(), maxDistance), metrics);
    metrics.incrementCounter(MetricNames.SEARCH_OPERATIONS);
    metrics.incrementCounter(MetricNames.SEARCH_OSA_OPERATIONS);
    return matches;
  }

  default Optional<Match> firstLevenshtein(T text, int maxDistance) {
    MatchIterator matches = levenshtein(text, maxDistance);
    return matches.hasNext() ? Optional.of(matches.next()) : Optional.empty();
  }

  default Optional<Match> firstOptimalStringAlignment(T text, int maxDistance) {
    MatchIterator matches = optimalStringAlignment(text, maxDistance);
    return matches.hasNext() ? Optional.of(matches.next()) : Optional.empty();
  }

  /**
   * Whether the text contains a substring within the given Levenshtein distance. Stops at the
   * first match.
   */
  default boolean containsWithin(T text, int maxDistance) {
    return levenshtein(text, maxDistance).hasNext();
  }

  /**
   * Applies {@link #containsWithin} to each text.
   *
   * @param texts texts to search, in iteration order
   * @param maxDistance maximum Levenshtein distance
   * @return one result per text, in the same order
   */
  default boolean[] containsWithinAll(Collection<? extends T> texts, int maxDistance) {
    Objects.requireNonNull(texts, "texts cannot be null");
    Automata.clampDistance(length(), maxDistance);
    long startNanos = System.nanoTime();
    boolean[] results = new boolean[texts.size()];
    int i = 0;
    for (T text : texts) {
      results[i++] = containsWithin(text, maxDistance);
    }
    BitapMetricsRegistry metrics = metricsRegistry();
    metrics.incrementCounter(MetricNames.SEARCH_BULK_OPERATIONS);
    metrics.incrementCounter(MetricNames.SEARCH_BULK_ITEMS, results.length);
    metrics.recordTimer(MetricNames.SEARCH_BULK_LATENCY, System.nanoTime() - startNanos);
    return results;
  }
}
