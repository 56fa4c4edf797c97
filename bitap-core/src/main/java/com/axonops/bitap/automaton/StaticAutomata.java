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
 * Unrolled automata for maximum distances 1 and 2.
 *
 * <p>Same recurrences as {@link LevenshteinAutomaton} and {@link OsaAutomaton}, with the levels
 * held in fields. Distance 0 is {@link ExactAutomaton}. Obtain instances through {@link Automata}.
 *
 * @since 1.0.0
 */
public final class StaticAutomata {

  private StaticAutomata() {
    // Holder class
  }

  static final class LevenshteinOne implements EditAutomaton {
    private final int patternLength;
    private final long finalBit;
    private long r0 = Automata.initialState(0);
    private long r1 = Automata.initialState(1);

    LevenshteinOne(int patternLength) {
      Automata.checkPatternLength(patternLength);
      this.patternLength = patternLength;
      this.finalBit = Automata.finalBit(patternLength);
    }

    @Override
    public int step(long mask) {
      long p0 = r0;
      long n0 = ((p0 & mask) << 1) | 1L;
      long n1 = ((r1 & mask) << 1) | (p0 << 1) | p0 | (n0 << 1) | 1L;
      r0 = n0;
      r1 = n1;
      if ((n0 & finalBit) != 0) {
        return 0;
      }
      return (n1 & finalBit) != 0 ? 1 : NO_MATCH;
    }

    @Override
    public int patternLength() {
      return patternLength;
    }

    @Override
    public int maxDistance() {
      return Math.min(1, patternLength);
    }
  }

  static final class LevenshteinTwo implements EditAutomaton {
    private final int patternLength;
    private final long finalBit;
    private long r0 = Automata.initialState(0);
    private long r1 = Automata.initialState(1);
    private long r2 = Automata.initialState(2);

    LevenshteinTwo(int patternLength) {
      Automata.checkPatternLength(patternLength);
      this.patternLength = patternLength;
      this.finalBit = Automata.finalBit(patternLength);
    }

    @Override
    public int step(long mask) {
      long p0 = r0;
      long p1 = r1;
      long n0 = ((p0 & mask) << 1) | 1L;
      long n1 = ((p1 & mask) << 1) | (p0 << 1) | p0 | (n0 << 1) | 1L;
      long n2 = ((r2 & mask) << 1) | (p1 << 1) | p1 | (n1 << 1) | 1L;
      r0 = n0;
      r1 = n1;
      r2 = n2;
      if ((n0 & finalBit) != 0) {
        return 0;
      }
      if ((n1 & finalBit) != 0) {
        return 1;
      }
      return (n2 & finalBit) != 0 ? 2 : NO_MATCH;
    }

    @Override
    public int patternLength() {
      return patternLength;
    }

    @Override
    public int maxDistance() {
      return Math.min(2, patternLength);
    }
  }

  static final class OsaOne implements EditAutomaton {
    private final int patternLength;
    private final long finalBit;
    private long r0 = Automata.initialState(0);
    private long r1 = Automata.initialState(1);
    private long t1 = 1L;

    OsaOne(int patternLength) {
      Automata.checkPatternLength(patternLength);
      this.patternLength = patternLength;
      this.finalBit = Automata.finalBit(patternLength);
    }

    @Override
    public int step(long mask) {
      long shiftedMask = (mask << 1) | 1L;
      long p0 = r0;
      long n0 = ((p0 & mask) << 1) | 1L;
      long n1 =
          ((r1 & mask) << 1) | (p0 << 1) | p0 | (n0 << 1) | ((t1 & shiftedMask) << 1) | 1L;
      t1 = ((p0 << 1) | 1L) & mask;
      r0 = n0;
      r1 = n1;
      if ((n0 & finalBit) != 0) {
        return 0;
      }
      return (n1 & finalBit) != 0 ? 1 : NO_MATCH;
    }

    @Override
    public int patternLength() {
      return patternLength;
    }

    @Override
    public int maxDistance() {
      return Math.min(1, patternLength);
    }
  }

  static final class OsaTwo implements EditAutomaton {
    private final int patternLength;
    private final long finalBit;
    private long r0 = Automata.initialState(0);
    private long r1 = Automata.initialState(1);
    private long r2 = Automata.initialState(2);
    private long t1 = 1L;
    private long t2 = 1L;

    OsaTwo(int patternLength) {
      Automata.checkPatternLength(patternLength);
      this.patternLength = patternLength;
      this.finalBit = Automata.finalBit(patternLength);
    }

    @Override
    public int step(long mask) {
      long shiftedMask = (mask << 1) | 1L;
      long p0 = r0;
      long p1 = r1;
      long n0 = ((p0 & mask) << 1) | 1L;
      long n1 =
          ((p1 & mask) << 1) | (p0 << 1) | p0 | (n0 << 1) | ((t1 & shiftedMask) << 1) | 1L;
      long n2 =
          ((r2 & mask) << 1) | (p1 << 1) | p1 | (n1 << 1) | ((t2 & shiftedMask) << 1) | 1L;
      t1 = ((p0 << 1) | 1L) & mask;
      t2 = ((p1 << 1) | 1L) & mask;
      r0 = n0;
      r1 = n1;
      r2 = n2;
      if ((n0 & finalBit) != 0) {
        return 0;
      }
      if ((n1 & finalBit) != 0) {
        return 1;
      }
      return (n2 & finalBit) != 0 ? 2 : NO_MATCH;
    }

    @Override
    public int patternLength() {
      return patternLength;
    }

    @Override
    public int maxDistance() {
      return Math.min(2, patternLength);
    }
  }
}
