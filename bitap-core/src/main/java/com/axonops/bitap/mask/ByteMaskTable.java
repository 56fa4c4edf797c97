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

import java.nio.ByteBuffer;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Direct-indexed mask table for byte alphabets.
 *
 * <p>256 entries, one per unsigned byte value. Backs raw byte patterns, and ASCII patterns searching
 * the code points of a {@link CharSequence} (code points above 0x7F map to 0).
 *
 * @since 1.0.0
 */
public final class ByteMaskTable implements MaskTable<Byte> {

  private final int patternLength;
  private final long[] masks;

  private ByteMaskTable(int patternLength, long[] masks) {
    this.patternLength = patternLength;
    this.masks = masks;
  }

  /**
   * Builds the table for a byte pattern. Length limits are checked by the caller.
   *
   * @param pattern pattern bytes
   * @return immutable table
   */
  public static ByteMaskTable build(byte[] pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    long[] masks = new long[256];
    for (int i = 0; i < pattern.length; i++) {
      masks[pattern[i] & 0xff] |= 1L << i;
    }
    return new ByteMaskTable(pattern.length, masks);
  }

  @Override
  public int patternLength() {
    return patternLength;
  }

  @Override
  public long maskFor(Byte symbol) {
    return symbol == null ? 0L : maskFor(symbol.byteValue());
  }

  public long maskFor(byte b) {
    return masks[b & 0xff];
  }

  /** Chars outside ASCII never occur in the pattern. */
  public long maskFor(char c) {
    return maskForCodePoint(c);
  }

  public long maskForCodePoint(int codePoint) {
    return codePoint >= 0 && codePoint < 0x80 ? masks[codePoint] : 0L;
  }

  /**
   * Streams the masks of the code points of {@code text}.
   *
   * <p>A supplementary character is one symbol, so positions are code point indexes. An unpaired
   * surrogate is a symbol of its own.
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
        return maskForCodePoint(cp);
      }
    };
  }

  /**
   * Streams the masks of {@code text[offset, offset + length)}.
   *
   * @throws IndexOutOfBoundsException if the range is outside {@code text}
   */
  public MaskStream stream(byte[] text, int offset, int length) {
    Objects.requireNonNull(text, "text cannot be null");
    Objects.checkFromIndexSize(offset, length, text.length);
    int end = offset + length;
    return new MaskStream() {
      private int index = offset;

      @Override
      public boolean hasNext() {
        return index < end;
      }

      @Override
      public long nextMask() {
        if (index >= end) {
          throw new NoSuchElementException();
        }
        return masks[text[index++] & 0xff];
      }
    };
  }

  /**
   * Streams the masks of the remaining bytes of {@code buffer} using absolute reads.
   *
   * <p>The buffer's position and limit are not modified. Works for heap and direct buffers.
   */
  public MaskStream stream(ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer cannot be null");
    int start = buffer.position();
    int end = buffer.limit();
    return new MaskStream() {
      private int index = start;

      @Override
      public boolean hasNext() {
        return index < end;
      }

      @Override
      public long nextMask() {
        if (index >= end) {
          throw new NoSuchElementException();
        }
        return masks[buffer.get(index++) & 0xff];
      }
    };
  }
}
