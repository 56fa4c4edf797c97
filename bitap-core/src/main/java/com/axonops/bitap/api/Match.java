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

/**
 * A single approximate match of a pattern in a symbol sequence.
 *
 * <p>Only the end of the match is known: bitap is end-anchored, so several substrings of different
 * lengths may end at the same position with the same distance.
 *
 * @param distance minimal edit distance of any substring ending at {@code end}
 * @param end zero-based index of the last symbol of the matched region, counted in the symbols of
 *     the searched sequence (code points for {@link Pattern}, bytes for {@link BytePattern})
 * @since 1.0.0
 */
public record Match(int distance, long end) {

  public Match {
    if (distance < 0) {
      throw new IllegalArgumentException("distance must be non-negative: " + distance);
    }
    if (end < 0) {
      throw new IllegalArgumentException("end must be non-negative: " + end);
    }
  }
}
