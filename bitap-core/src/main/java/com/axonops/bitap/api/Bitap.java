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
import com.axonops.bitap.automaton.ExactAutomaton;
import com.axonops.bitap.automaton.LevenshteinAutomaton;
import com.axonops.bitap.automaton.OsaAutomaton;
import com.axonops.bitap.automaton.StaticMaxDistance;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Low-level entry points over raw mask streams.
 *
 * <p>These run the automata directly on masks supplied by the caller, for symbol domains the
 * pattern classes do not cover. Build masks with a {@link com.axonops.bitap.mask.MaskTable} or by
 * hand: bit {@code i} of the mask for symbol {@code s} is set when pattern symbol {@code i} equals
 * {@code s}.
 *
 * <pre>{@code
 * HashMaskTable<String> table = HashMaskTable.build(List.of("GET", "/index", "200"));
 * MatchIterator it = Bitap.levenshtein(table.stream(logTokens.iterator()), table.patternLength(), 1);
 * }</pre>
 *
 * <p>No metrics are recorded here; use the pattern classes for instrumented searches.
 *
 * @since 1.0.0
 */
public final class Bitap {

  /** Longest supported pattern, one bit short of a {@code long}. */
  public static final int MAX_PATTERN_LENGTH = Automata.MAX_PATTERN_LENGTH;

  private Bitap() {
    // Utility class
  }

  /**
   * End positions of exact occurrences.
   *
   * @param masks text masks
   * @param patternLength pattern symbols, 1 to {@link #MAX_PATTERN_LENGTH}
   * @return lazy iterator of end positions
   */
  public static ExactMatchIterator matchExact(MaskStream masks, int patternLength) {
    return new ExactMatchIterator(
        masks, new ExactAutomaton(patternLength), NoOpMetricsRegistry.INSTANCE);
  }

  /**
   * Levenshtein search with the general automaton, whatever the distance.
   *
   * @param masks text masks
   * @param patternLength pattern symbols, 1 to {@link #MAX_PATTERN_LENGTH}
   * @param maxDistance maximum distance, clamped to the pattern length
   * @return lazy iterator of matches
   * @throws IllegalArgumentException if maxDistance is negative or patternLength out of range
   */
  public static MatchIterator levenshtein(MaskStream masks, int patternLength, int maxDistance) {
    return new MatchIterator(
        masks,
        new LevenshteinAutomaton(patternLength, maxDistance),
        NoOpMetricsRegistry.INSTANCE);
  }

  /**
   * Optimal string alignment search with the general automaton, whatever the distance.
   *
   * @param masks text masks
   * @param patternLength pattern symbols, 1 to {@link #MAX_PATTERN_LENGTH}
   * @param maxDistance maximum distance, clamped to the pattern length
   * @return lazy iterator of matches
   * @throws IllegalArgumentException if maxDistance is negative or patternLength out of range
   */
  public static MatchIterator optimalStringAlignment(
      MaskStream masks, int patternLength, int maxDistance) {
    return new MatchIterator(
        masks, new OsaAutomaton(patternLength, maxDistance), NoOpMetricsRegistry.INSTANCE);
  }

  /**
   * Levenshtein search with an unrolled automaton for a fixed small distance.
   *
   * @param masks text masks
   * @param patternLength pattern symbols, 1 to {@link #MAX_PATTERN_LENGTH}
   * @param maxDistance ZERO, ONE or TWO
   * @return lazy iterator of matches
   */
  public static MatchIterator levenshteinStatic(
      MaskStream masks, int patternLength, StaticMaxDistance maxDistance) {
    Objects.requireNonNull(maxDistance, "maxDistance cannot be null");
    return new MatchIterator(
        masks,
        Automata.staticLevenshtein(patternLength, maxDistance),
        NoOpMetricsRegistry.INSTANCE);
  }

  /**
   * Optimal string alignment search with an unrolled automaton for a fixed small distance.
   *
   * @param masks text masks
   * @param patternLength pattern symbols, 1 to {@link #MAX_PATTERN_LENGTH}
   * @param maxDistance ZERO, ONE or TWO
   * @return lazy iterator of matches
   */
  public static MatchIterator optimalStringAlignmentStatic(
      MaskStream masks, int patternLength, StaticMaxDistance maxDistance) {
    Objects.requireNonNull(maxDistance, "maxDistance cannot be null");
    return new MatchIterator(
        masks,
        Automata.staticOptimalStringAlignment(patternLength, maxDistance),
        NoOpMetricsRegistry.INSTANCE);
  }
}
