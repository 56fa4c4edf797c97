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
 * Bit-parallel matcher advanced one text symbol at a time.
 *
 * <p>State is one 64-bit word per error level. Bit 0 stands for the empty pattern prefix and is
 * always set; bit {@code i} of level {@code d} is set when the first {@code i} pattern symbols
 * align with some substring ending at the current position using at most {@code d} edits. The
 * pattern matches when bit {@code m} is set.
 *
 * <p>NOT Thread-Safe: each search owns its automaton.
 *
 * @since 1.0.0
 */
public interface EditAutomaton {

  /** Returned by {@link #step(long)} when no level reaches the final bit. */
  int NO_MATCH = -1;

  /**
   * Consumes one text symbol.
   *
   * @param mask pattern positions holding the symbol (0 if the symbol is not in the pattern)
   * @return minimal distance of a match ending at this symbol, or {@link #NO_MATCH}
   */
  int step(long mask);

  /** Number of pattern symbols. */
  int patternLength();

  /** Largest distance this automaton reports, after clamping to the pattern length. */
  int maxDistance();
}
