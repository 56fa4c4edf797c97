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

package com.axonops.bitap.util;

import java.util.Arrays;
import java.util.List;

/**
 * Utility for hashing pattern text for logging purposes.
 *
 * <p>Search patterns are often user queries, so they are never written to logs verbatim. A short
 * hash keeps log lines readable and still lets the same pattern be traced across log entries.
 *
 * <p>Example: pattern "colour" → hash "af4ba2a0"
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern string for logging.
     *
     * @param pattern the pattern text
     * @return hex string (e.g., "7a3f2b1c"), or "null"
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Creates a hash with additional context for case sensitivity.
     *
     * @param pattern the pattern text
     * @param caseSensitive whether the pattern is case-sensitive
     * @return hash with case sensitivity indicator (e.g., "7a3f2b1c[CS]" or "7a3f2b1c[CI]")
     */
    public static String hashWithCase(String pattern, boolean caseSensitive) {
        return hash(pattern) + (caseSensitive ? "[CS]" : "[CI]");
    }

    /** Hash of a byte pattern. */
    public static String hash(byte[] pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(Arrays.hashCode(pattern));
    }

    /** Hash of a token pattern, using the tokens' own {@code hashCode}. */
    public static String hash(List<?> tokens) {
        if (tokens == null) {
            return "null";
        }
        return Integer.toHexString(tokens.hashCode()) + "[" + tokens.size() + " tokens]";
    }
}
