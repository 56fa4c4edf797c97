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
 * Bounded optimal string alignment automaton: Levenshtein plus adjacent transpositions.
 *
 * <p>Extends the {@link LevenshteinAutomaton} recurrence with one transposition word per level
 * {@code d >= 1}. After a symbol with mask {@code M}, {@code T[d]} holds the prefixes of level
 * {@code d-1} (as they were before that symbol) whose next pattern symbol equals it. When the
 * following symbol matches the pattern position just before, both symbols are consumed for a
 * single edit:
 *
 * <pre>
 *   R'[d] |= ((T[d] &amp; ((M &lt;&lt; 1) | 1)) &lt;&lt; 1) | 1
 *   T[d]   = ((R[d-1] &lt;&lt; 1) | 1) &amp; M
 * </pre>
 *
 * <p>A transposed pair cannot take part in a further edit, which is the restriction that
 * separates optimal string alignment from unrestricted Damerau-Levenshtein distance.
 *
 * @since 1.0.0
 */
public final class OsaAutomaton implements EditAutomaton {

  private final int patternLength;
  private final long finalBit;
  private final long[] r;
  private final long[] trans;

  /**
   * @param patternLength pattern symbols, 1 to {@link Automata#MAX_PATTERN_LENGTH}
   * @param maxDistance maximum distance, clamped to {@code patternLength}
   * @throws IllegalArgumentException if either argument is out of range
   */
  public OsaAutomaton(int patternLength, int maxDistance) {
    Automata.checkPatternLength(patternLength);
    int k = Automata.clampDistance(patternLength, maxDistance);
    this.patternLength = patternLength;
    this.finalBit = Automata.finalBit(patternLength);
    this.r = new long[k + 1];
    this.trans = new long[k];
    for (int d = 0; d <= k; d++) {
      r[d] = Automata.initialState(d);
    }
    for (int d = 0; d < k; d++) {
      trans[d] = 1L;
    }
  }

  @Override
  public int step(long mask) {
    final long[] r = this.r;
    final long[] trans = this.trans;
    final long shiftedMask = (mask << 1) | 1L;
    long parent = r[0];
    long updated = ((parent & mask) << 1) | 1L;
    r[0] = updated;
    int distance = (updated & finalBit) != 0 ? 0 : NO_MATCH;

    for (int d = 1; d < r.length; d++) {
      long prev = r[d];
      long next =
          ((prev & mask) << 1)
              | (parent << 1)
              | parent
              | (updated << 1)
              | ((trans[d - 1] & shiftedMask) << 1)
              | 1L;
      trans[d - 1] = ((parent << 1) | 1L) & mask;
      r[d] = next;
      if (distance == NO_MATCH && (next & finalBit) != 0) {
        distance = d;
      }
      parent = prev;
      updated = next;
    }
    return distance;
  }

  @Override
  public int patternLength() {
    return patternLength;
  }

  @Override
  public int maxDistance() {
    return r.length - 1;
  }
}
