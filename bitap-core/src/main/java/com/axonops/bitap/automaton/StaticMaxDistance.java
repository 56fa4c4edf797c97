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
 * Maximum distances that have an unrolled automaton.
 *
 * @since 1.0.0
 */
public enum StaticMaxDistance {
  ZERO(0),
  ONE(1),
  TWO(2);

  private final int distance;

  StaticMaxDistance(int distance) {
    this.distance = distance;
  }

  public int distance() {
    return distance;
  }

  /**
   * @param distance requested maximum distance
   * @return the matching constant, or null if {@code distance} has no unrolled automaton
   */
  public static StaticMaxDistance of(int distance) {
    switch (distance) {
      case 0:
        return ZERO;
      case 1:
        return ONE;
      case 2:
        return TWO;
      default:
        return null;
    }
  }
}
