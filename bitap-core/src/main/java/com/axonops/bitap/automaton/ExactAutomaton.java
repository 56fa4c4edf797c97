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
 * Shift-and automaton for exact matching.
 *
 * <p>This is the distance-0 automaton for both Levenshtein and optimal string alignment.
 *
 * @since 1.0.0
 */
public final class ExactAutomaton implements EditAutomaton {

  private final int patternLength;
  private final long finalBit;
  private long r0 = Automata.initialState(0);

  public ExactAutomaton(int patternLength) {
    Automata.checkPatternLength(patternLength);
    this.patternLength = patternLength;
    this.finalBit = Automata.finalBit(patternLength);
  }

  @Override
  public int step(long mask) {
    r0 = ((r0 & mask) << 1) | 1L;
    return (r0 & finalBit) != 0 ? 0 : NO_MATCH;
  }

  @Override
  public int patternLength() {
    return patternLength;
  }

  @Override
  public int maxDistance() {
    return 0;
  }
}
