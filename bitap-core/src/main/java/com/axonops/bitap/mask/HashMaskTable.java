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

package com.axonops.bitap.mask;

import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Mask table for arbitrary symbols compared with {@code equals}/{@code hashCode}.
 *
 * <p>Backed by a primitive-valued fastutil map so lookups do not box the mask. A {@code null} text
 * symbol maps to 0.
 *
 * @param <S> symbol type
 * @since 1.0.0
 */
public final class HashMaskTable<S> implements MaskTable<S> {

  private final int patternLength;
  private final Object2LongOpenHashMap<S> masks;

  private HashMaskTable(int patternLength, Object2LongOpenHashMap<S> masks) {
    this.patternLength = patternLength;
    this.masks = masks;
  }

  /**
   * Builds the table for a pattern. Length limits are checked by the caller.
   *
   * @param pattern pattern symbols, none {@code null}
   * @param <S> symbol type
   * @return immutable table
   * @throws NullPointerException if a symbol is null
   */
  public static <S> HashMaskTable<S> build(List<? extends S> pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Object2LongOpenHashMap<S> masks = new Object2LongOpenHashMap<>(pattern.size());
    masks.defaultReturnValue(0L);
    int i = 0;
    for (S symbol : pattern) {
      Objects.requireNonNull(symbol, "pattern symbols cannot be null");
      masks.put(symbol, masks.getLong(symbol) | (1L << i));
      i++;
    }
    masks.trim();
    return new HashMaskTable<>(pattern.size(), masks);
  }

  @Override
  public int patternLength() {
    return patternLength;
  }

  @Override
  public long maskFor(S symbol) {
    return symbol == null ? 0L : masks.getLong(symbol);
  }

  /** Number of distinct symbols in the pattern. */
  public int alphabetSize() {
    return masks.size();
  }
}
