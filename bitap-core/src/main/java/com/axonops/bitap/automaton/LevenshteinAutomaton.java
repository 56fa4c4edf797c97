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
 * Bounded Levenshtein automaton for any maximum distance (Wu-Manber).
 *
 * <p>For each symbol with mask {@code M}, level {@code d} is rebuilt from its own previous value
 * {@code R[d]}, the previous value of the level below {@code R[d-1]} and that level's new value
 * {@code R'[d-1]}:
 *
 * <pre>
 *   R'[0] = ((R[0] &amp; M) &lt;&lt; 1) | 1
 *   R'[d] = ((R[d] &amp; M) &lt;&lt; 1)     match
 *         | (R[d-1] &lt;&lt; 1)          substitution
 *         | R[d-1]                 insertion: text symbol skipped
 *         | (R'[d-1] &lt;&lt; 1)         deletion: pattern symbol skipped
 *         | 1
 * </pre>
 *
 * @since 1.0.0
 */
public final class LevenshteinAutomaton implements EditAutomaton {

  private final int patternLength;
  private final long finalBit;
  private final long[] r;

  /**
   * @param patternLength pattern symbols, 1 to {@link Automata#MAX_PATTERN_LENGTH}
   * @param maxDistance maximum distance, clamped to {@code patternLength}
   * @throws IllegalArgumentException if either argument is out of range
   */
  public LevenshteinAutomaton(int patternLength, int maxDistance) {
    Automata.checkPatternLength(patternLength);
    int k = Automata.clampDistance(patternLength, maxDistance);
    this.patternLength = patternLength;
    this.finalBit = Automata.finalBit(patternLength);
    this.r = new long[k + 1];
    for (int d = 0; d <= k; d++) {
      r[d] = Automata.initialState(d);
    }
  }

  @Override
  public int step(long mask) {
    final long[] r = this.r;
    long parent = r[0];
    long updated = ((parent & mask) << 1) | 1L;
    r[0] = updated;
    int distance = (updated & finalBit) != 0 ? 0 : NO_MATCH;

    for (int d = 1; d < r.length; d++) {
      long prev = r[d];
      long next = ((prev & mask) << 1) | (parent << 1) | parent | (updated << 1) | 1L;
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
