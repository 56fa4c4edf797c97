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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Maps each symbol of an alphabet to the bitmask of pattern positions holding it.
 *
 * <p>Roughly, for the pattern {@code "abcab"} (bit 0 is the first pattern symbol):
 *
 * <pre>
 *        abcab   mask
 *   'a': X..X.   0b01001
 *   'b': .X..X   0b10010
 *   'c': ..X..   0b00100
 *   'z': .....   0
 * </pre>
 *
 * <p>Thread-safe: tables are immutable once built.
 *
 * @param <S> symbol type
 * @since 1.0.0
 */
public interface MaskTable<S> {

    /**
     * @return number of symbols in the compiled pattern
     */
    int patternLength();

    /**
     * Looks up the mask of a symbol.
     *
     * @param symbol text symbol
     * @return mask of pattern positions holding {@code symbol}, or 0 if it does not occur
     */
    long maskFor(S symbol);

    /**
     * Translates a symbol iterator into a mask stream, lazily.
     *
     * @param symbols text symbols
     * @return mask stream consuming {@code symbols}
     */
    default MaskStream stream(Iterator<? extends S> symbols) {
        Objects.requireNonNull(symbols, "symbols cannot be null");
        return new MaskStream() {
            @Override
            public boolean hasNext() {
                return symbols.hasNext();
            }

            @Override
            public long nextMask() {
                if (!symbols.hasNext()) {
                    throw new NoSuchElementException();
                }
                return maskFor(symbols.next());
            }
        };
    }
}
