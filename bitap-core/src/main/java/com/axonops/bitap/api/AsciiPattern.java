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

import com.axonops.bitap.mask.ByteMaskTable;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.util.PatternHasher;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled ASCII pattern, searched over the code points of a text.
 *
 * <p>Uses a flat 256-entry table instead of a hash lookup, which makes it the fastest way to
 * search Latin text. Non-ASCII code points in the text never match a pattern symbol, so each one
 * costs one substitution. Positions are code point indexes, as for {@link Pattern}, so both return
 * the same matches for an ASCII pattern.
 *
 * <p>Not cached: compiling is a single pass over at most 63 characters.
 *
 * @since 1.0.0
 */
public final class AsciiPattern implements Searcher<CharSequence> {
  private static final Logger logger = LoggerFactory.getLogger(AsciiPattern.class);

  private final String patternString;
  private final ByteMaskTable table;

  private AsciiPattern(String patternString, ByteMaskTable table) {
    this.patternString = patternString;
    this.table = table;
  }

  /**
   * Compiles an ASCII pattern.
   *
   * @param pattern ASCII text, 1 to {@link Bitap#MAX_PATTERN_LENGTH} characters
   * @return compiled pattern
   * @throws PatternCompilationException if the pattern is empty, too long or not ASCII
   */
  public static AsciiPattern compile(String pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    String hash = PatternHasher.hash(pattern);
    long startNanos = System.nanoTime();

    Pattern.checkLength(pattern, hash, pattern.length());
    for (int i = 0; i < pattern.length(); i++) {
      if (pattern.charAt(i) >= 0x80) {
        throw Pattern.compilationFailed(
            new PatternCompilationException(
                pattern, "Non-ASCII character at index " + i + " in ASCII pattern"),
            hash);
      }
    }

    ByteMaskTable table = ByteMaskTable.build(pattern.getBytes(StandardCharsets.US_ASCII));
    long durationNanos = Pattern.recordCompiled(startNanos);
    logger.trace(
        "Bitap: ASCII pattern compiled - hash: {}, length: {}, timeNs: {}",
        hash,
        pattern.length(),
        durationNanos);
    return new AsciiPattern(pattern, table);
  }

  @Override
  public int length() {
    return table.patternLength();
  }

  @Override
  public MaskStream masks(CharSequence text) {
    return table.stream(text);
  }

  @Override
  public BitapMetricsRegistry metricsRegistry() {
    return Pattern.globalMetrics();
  }

  public String pattern() {
    return patternString;
  }

  public ByteMaskTable maskTable() {
    return table;
  }

  @Override
  public String toString() {
    return "AsciiPattern[" + PatternHasher.hash(patternString) + ", length=" + length() + "]";
  }
}
