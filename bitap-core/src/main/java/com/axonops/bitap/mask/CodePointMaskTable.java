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

import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Mask table keyed by Unicode code point.
 *
 * <p>Text is consumed one code point at a time, so a supplementary character counts as a single
 * symbol and match positions are code point indexes.
 *
 * <p>Case-insensitive tables register both {@link Character#toLowerCase(int)} and {@link
 * Character#toUpperCase(int)} of every pattern code point. The folding is locale-independent.
 *
 * @since 1.0.0
 */
public final class CodePointMaskTable implements MaskTable<Integer> {

  private final int patternLength;
  private final boolean caseSensitive;
  private final Int2LongOpenHashMap masks;

  private CodePointMaskTable(int patternLength, boolean caseSensitive, Int2LongOpenHashMap masks) {
    this.patternLength = patternLength;
    this.caseSensitive = caseSensitive;
    this.masks = masks;
  }

  /**
   * Builds the table for a pattern given as code points. Length limits are checked by the caller.
   *
   * @param codePoints pattern code points
   * @param caseSensitive false to fold simple upper/lower case
   * @return immutable table
   */
  public static CodePointMaskTable build(int[] codePoints, boolean caseSensitive) {
    Objects.requireNonNull(codePoints, "codePoints cannot be null");
    Int2LongOpenHashMap masks = new Int2LongOpenHashMap(codePoints.length * (caseSensitive ? 1 : 2));
    masks.defaultReturnValue(0L);
    for (int i = 0; i < codePoints.length; i++) {
      long bit = 1L << i;
      int cp = codePoints[i];
      if (caseSensitive) {
        masks.put(cp, masks.get(cp) | bit);
      } else {
        int lower = Character.toLowerCase(cp);
        int upper = Character.toUpperCase(cp);
        masks.put(cp, masks.get(cp) | bit);
        masks.put(lower, masks.get(lower) | bit);
        masks.put(upper, masks.get(upper) | bit);
      }
    }
    masks.trim();
    return new CodePointMaskTable(codePoints.length, caseSensitive, masks);
  }

  @Override
  public int patternLength() {
    return patternLength;
  }

  public boolean caseSensitive() {
    return caseSensitive;
  }

  @Override
  public long maskFor(Integer codePoint) {
    return codePoint == null ? 0L : maskFor(codePoint.intValue());
  }

  /** Primitive lookup, used on the search path. */
  public long maskFor(int codePoint) {
    return masks.get(codePoint);
  }

  /**
   * Streams the masks of the code points of {@code text}.
   *
   * <p>An unpaired surrogate is treated as a code point of its own.
   *
   * @param text text to search
   * @return lazy mask stream
   */
  public MaskStream stream(CharSequence text) {
    Objects.requireNonNull(text, "text cannot be null");
    return new MaskStream() {
      private int index;

      @Override
      public boolean hasNext() {
        return index < text.length();
      }

      @Override
      public long nextMask() {
        if (index >= text.length()) {
          throw new NoSuchElementException();
        }
        int cp = Character.codePointAt(text, index);
        index += Character.charCount(cp);
        return masks.get(cp);
      }
    };
  }
}
