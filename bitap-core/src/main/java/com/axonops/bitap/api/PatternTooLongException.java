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
 * Thrown when a pattern has more symbols than the automaton word can address.
 *
 * <p>One bit of the 64-bit state word is reserved for the empty prefix, so the longest pattern is
 * {@link Bitap#MAX_PATTERN_LENGTH} symbols.
 *
 * @since 1.0.0
 */
public final class PatternTooLongException extends PatternCompilationException {

    private final int length;

    public PatternTooLongException(String pattern, int length) {
        super(pattern, "Pattern has " + length + " symbols, maximum is " + Bitap.MAX_PATTERN_LENGTH);
        this.length = length;
    }

    public int length() {
        return length;
    }

    public int maxLength() {
        return Bitap.MAX_PATTERN_LENGTH;
    }
}
