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

package com.axonops.bitap.automaton;

/**
 * Automaton factory.
 *
 * <p>{@link #levenshtein(int, int)} and {@link #optimalStringAlignment(int, int)} pick the
 * unrolled automaton when the clamped distance is at most 2 and fall back to the array-backed one
 * otherwise. Both produce identical results.
 *
 * @since 1.0.0
 */
public final class Automata {

  /** Bits in the state word. */
  public static final int WORD_BITS = Long.SIZE;

  /** Longest pattern: one bit of the word is the always-set empty-prefix bit. */
  public static final int MAX_PATTERN_LENGTH = WORD_BITS - 1;

  private Automata() {
    // Utility class
  }

  public static EditAutomaton exact(int patternLength) {
    return new ExactAutomaton(patternLength);
  }

  /** Levenshtein automaton, unrolled when possible. */
  public static EditAutomaton levenshtein(int patternLength, int maxDistance) {
    StaticMaxDistance fixed = StaticMaxDistance.of(clampDistance(patternLength, maxDistance));
    return fixed != null
        ? staticLevenshtein(patternLength, fixed)
        : new LevenshteinAutomaton(patternLength, maxDistance);
  }

  /** Optimal string alignment automaton, unrolled when possible. */
  public static EditAutomaton optimalStringAlignment(int patternLength, int maxDistance) {
    StaticMaxDistance fixed = StaticMaxDistance.of(clampDistance(patternLength, maxDistance));
    return fixed != null
        ? staticOptimalStringAlignment(patternLength, fixed)
        : new OsaAutomaton(patternLength, maxDistance);
  }

  public static EditAutomaton staticLevenshtein(int patternLength, StaticMaxDistance maxDistance) {
    switch (maxDistance) {
      case ZERO:
        return new ExactAutomaton(patternLength);
      case ONE:
        return new StaticAutomata.LevenshteinOne(patternLength);
      case TWO:
        return new StaticAutomata.LevenshteinTwo(patternLength);
      default:
        throw new IllegalArgumentException("Unsupported static distance: " + maxDistance);
    }
  }

  public static EditAutomaton staticOptimalStringAlignment(
      int patternLength, StaticMaxDistance maxDistance) {
    switch (maxDistance) {
      case ZERO:
        return new ExactAutomaton(patternLength);
      case ONE:
        return new StaticAutomata.OsaOne(patternLength);
      case TWO:
        return new StaticAutomata.OsaTwo(patternLength);
      default:
        throw new IllegalArgumentException("Unsupported static distance: " + maxDistance);
    }
  }

  /**
   * Clamps a requested distance to the pattern length.
   *
   * <p>Replacing every pattern symbol always matches, so larger distances add nothing.
   *
   * @throws IllegalArgumentException if {@code maxDistance} is negative
   */
  public static int clampDistance(int patternLength, int maxDistance) {
    if (maxDistance < 0) {
      throw new IllegalArgumentException("maxDistance must not be negative: " + maxDistance);
    }
    return Math.min(maxDistance, patternLength);
  }

  static void checkPatternLength(int patternLength) {
    if (patternLength < 1 || patternLength > MAX_PATTERN_LENGTH) {
      throw new IllegalArgumentException(
          "patternLength must be between 1 and " + MAX_PATTERN_LENGTH + ": " + patternLength);
    }
  }

  /** Bit {@code m}: set once the whole pattern is aligned. */
  static long finalBit(int patternLength) {
    return 1L << patternLength;
  }

  /**
   * Start state of error level {@code d}: bits {@code 0..d} set, i.e. up to {@code d} leading
   * pattern symbols may be deleted before any text is read.
   */
  static long initialState(int level) {
    return -1L >>> (MAX_PATTERN_LENGTH - level);
  }
}
