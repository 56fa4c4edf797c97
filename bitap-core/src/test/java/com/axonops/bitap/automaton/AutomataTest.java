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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AutomataTest {

  @ParameterizedTest
  @CsvSource({
    "5, 0, ExactAutomaton",
    "5, 1, LevenshteinOne",
    "5, 2, LevenshteinTwo",
    "5, 3, LevenshteinAutomaton",
    "2, 9, LevenshteinTwo",
    "1, 9, LevenshteinOne",
    "63, 40, LevenshteinAutomaton",
  })
  @DisplayName("Levenshtein selection uses the clamped distance")
  void levenshteinSelection(int m, int k, String type) {
    EditAutomaton automaton = Automata.levenshtein(m, k);

    assertThat(automaton.getClass().getSimpleName()).isEqualTo(type);
    assertThat(automaton.maxDistance()).isEqualTo(Math.min(m, k));
    assertThat(automaton.patternLength()).isEqualTo(m);
  }

  @ParameterizedTest
  @CsvSource({
    "5, 0, ExactAutomaton",
    "5, 1, OsaOne",
    "5, 2, OsaTwo",
    "5, 3, OsaAutomaton",
    "1, 2, OsaOne",
  })
  void osaSelection(int m, int k, String type) {
    assertThat(Automata.optimalStringAlignment(m, k).getClass().getSimpleName()).isEqualTo(type);
  }

  @Test
  void staticFactoriesHonourRequestedDistance() {
    assertThat(Automata.staticLevenshtein(4, StaticMaxDistance.ZERO))
        .isInstanceOf(ExactAutomaton.class);
    assertThat(Automata.staticLevenshtein(4, StaticMaxDistance.TWO))
        .isInstanceOf(StaticAutomata.LevenshteinTwo.class);
    assertThat(Automata.staticOptimalStringAlignment(4, StaticMaxDistance.ONE))
        .isInstanceOf(StaticAutomata.OsaOne.class);
    assertThat(Automata.staticOptimalStringAlignment(1, StaticMaxDistance.TWO).maxDistance())
        .isEqualTo(1);
  }

  @Test
  void staticMaxDistanceLookup() {
    assertThat(StaticMaxDistance.of(0)).isEqualTo(StaticMaxDistance.ZERO);
    assertThat(StaticMaxDistance.of(2)).isEqualTo(StaticMaxDistance.TWO);
    assertThat(StaticMaxDistance.of(3)).isNull();
    assertThat(StaticMaxDistance.of(-1)).isNull();
    assertThat(StaticMaxDistance.ONE.distance()).isEqualTo(1);
  }

  @Test
  void argumentValidation() {
    assertThatThrownBy(() -> Automata.levenshtein(0, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Automata.levenshtein(64, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new LevenshteinAutomaton(64, 5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new OsaAutomaton(3, -2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("-2");
    assertThatThrownBy(() -> Automata.exact(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThat(Automata.clampDistance(3, 10)).isEqualTo(3);
  }

  @Test
  @DisplayName("Initial state sets the low level+1 bits without overflow at the top level")
  void initialState() {
    assertThat(Automata.initialState(0)).isEqualTo(1L);
    assertThat(Automata.initialState(2)).isEqualTo(0b111L);
    assertThat(Automata.initialState(63)).isEqualTo(-1L);
    assertThat(Automata.finalBit(63)).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  void exactAutomatonSteps() {
    // pattern "ab": a -> 0b01, b -> 0b10
    EditAutomaton automaton = Automata.exact(2);

    assertThat(automaton.step(0b01L)).isEqualTo(EditAutomaton.NO_MATCH);
    assertThat(automaton.step(0b10L)).isEqualTo(0);
    assertThat(automaton.step(0b10L)).isEqualTo(EditAutomaton.NO_MATCH);
  }

  @Test
  @DisplayName("Unrolled automata step in lockstep with the general ones")
  void lockstepWithGeneric() {
    Random random = new Random(8);
    for (int round = 0; round < 200; round++) {
      int m = 1 + random.nextInt(63);
      long patternBits = m == 63 ? Long.MAX_VALUE : (1L << m) - 1;
      EditAutomaton[][] pairs = {
        {new StaticAutomata.LevenshteinOne(m), new LevenshteinAutomaton(m, 1)},
        {new StaticAutomata.LevenshteinTwo(m), new LevenshteinAutomaton(m, 2)},
        {new StaticAutomata.OsaOne(m), new OsaAutomaton(m, 1)},
        {new StaticAutomata.OsaTwo(m), new OsaAutomaton(m, 2)},
        {new ExactAutomaton(m), new LevenshteinAutomaton(m, 0)},
      };
      for (int step = 0; step < 200; step++) {
        // dense masks make matches frequent enough to exercise every level
        long mask = random.nextLong() & random.nextLong() & patternBits;
        if (random.nextInt(4) == 0) {
          mask = patternBits;
        }
        for (EditAutomaton[] pair : pairs) {
          assertThat(pair[0].step(mask))
              .as("%s m=%d step=%d", pair[0].getClass().getSimpleName(), m, step)
              .isEqualTo(pair[1].step(mask));
        }
      }
    }
  }
}
