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

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;

/**
 * A sequence of symbol masks, one per symbol of the searched text.
 *
 * <p>This is the only thing the automata know about the input. Any symbol domain (bytes, code
 * points, words, amino acids) plugs in by translating each symbol into the mask of pattern
 * positions holding that symbol, or 0 when the symbol does not occur in the pattern.
 *
 * <p>NOT Thread-Safe: a stream is consumed by exactly one search.
 *
 * @since 1.0.0
 */
public interface MaskStream {

    /**
     * @return true if another symbol is available
     */
    boolean hasNext();

    /**
     * Consumes the next symbol and returns its mask.
     *
     * @return mask with bit {@code i} set where pattern position {@code i} holds this symbol
     * @throws NoSuchElementException if the stream is exhausted
     */
    long nextMask();

    /**
     * Wraps precomputed masks.
     *
     * @param masks one mask per symbol
     * @return stream over a copy of {@code masks}
     */
    static MaskStream of(long... masks) {
        long[] copy = Objects.requireNonNull(masks, "masks cannot be null").clone();
        return new MaskStream() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < copy.length;
            }

            @Override
            public long nextMask() {
                if (index >= copy.length) {
                    throw new NoSuchElementException();
                }
                return copy[index++];
            }
        };
    }

    /**
     * Adapts a primitive iterator, e.g. {@code LongStream.iterator()}.
     */
    static MaskStream from(PrimitiveIterator.OfLong masks) {
        Objects.requireNonNull(masks, "masks cannot be null");
        return new MaskStream() {
            @Override
            public boolean hasNext() {
                return masks.hasNext();
            }

            @Override
            public long nextMask() {
                return masks.nextLong();
            }
        };
    }
}
