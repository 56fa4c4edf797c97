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
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled pattern over raw bytes.
 *
 * <p>Searches {@code byte[]} arrays through the {@link Searcher} methods and {@link ByteBuffer}s
 * through the overloads below. Buffers are read from position to limit with absolute gets, so
 * their position, limit and mark are left untouched and both heap and direct buffers work.
 * Positions are byte offsets from the start of the array, or from the buffer's position.
 *
 * <pre>{@code
 * BytePattern pattern = BytePattern.compile("timeout".getBytes(StandardCharsets.UTF_8));
 * boolean hit = pattern.containsWithin(buffer, 1);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class BytePattern implements Searcher<byte[]> {
  private static final Logger logger = LoggerFactory.getLogger(BytePattern.class);

  private final byte[] pattern;
  private final ByteMaskTable table;
  private final Searcher<ByteBuffer> bufferSearcher;

  private BytePattern(byte[] pattern, ByteMaskTable table) {
    this.pattern = pattern;
    this.table = table;
    this.bufferSearcher =
        new Searcher<>() {
          @Override
          public int length() {
            return table.patternLength();
          }

          @Override
          public MaskStream masks(ByteBuffer text) {
            return table.stream(text);
          }

          @Override
          public BitapMetricsRegistry metricsRegistry() {
            return Pattern.globalMetrics();
          }
        };
  }

  /**
   * Compiles a byte pattern.
   *
   * @param pattern 1 to {@link Bitap#MAX_PATTERN_LENGTH} bytes; copied
   * @return compiled pattern
   * @throws PatternCompilationException if the pattern is empty or too long
   */
  public static BytePattern compile(byte[] pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    byte[] copy = pattern.clone();
    String hash = PatternHasher.hash(copy);
    long startNanos = System.nanoTime();

    Pattern.checkLength(describe(copy), hash, copy.length);

    ByteMaskTable table = ByteMaskTable.build(copy);
    long durationNanos = Pattern.recordCompiled(startNanos);
    logger.trace(
        "Bitap: Byte pattern compiled - hash: {}, length: {}, timeNs: {}",
        hash,
        copy.length,
        durationNanos);
    return new BytePattern(copy, table);
  }

  /** Compiles the UTF-8 encoding of a string. */
  public static BytePattern compileUtf8(String pattern) {
    Objects.requireNonNull(pattern, "pattern cannot be null");
    return compile(pattern.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public int length() {
    return table.patternLength();
  }

  @Override
  public MaskStream masks(byte[] text) {
    Objects.requireNonNull(text, "text cannot be null");
    return table.stream(text, 0, text.length);
  }

  /** Masks of {@code length} bytes of {@code text} starting at {@code offset}. */
  public MaskStream masks(byte[] text, int offset, int length) {
    return table.stream(text, offset, length);
  }

  @Override
  public BitapMetricsRegistry metricsRegistry() {
    return Pattern.globalMetrics();
  }

  public ExactMatchIterator exact(ByteBuffer buffer) {
    return bufferSearcher.exact(buffer);
  }

  public MatchIterator levenshtein(ByteBuffer buffer, int maxDistance) {
    return bufferSearcher.levenshtein(buffer, maxDistance);
  }

  public MatchIterator optimalStringAlignment(ByteBuffer buffer, int maxDistance) {
    return bufferSearcher.optimalStringAlignment(buffer, maxDistance);
  }

  public boolean containsWithin(ByteBuffer buffer, int maxDistance) {
    return bufferSearcher.containsWithin(buffer, maxDistance);
  }

  /** Pattern bytes (a copy). */
  public byte[] pattern() {
    return pattern.clone();
  }

  public ByteMaskTable maskTable() {
    return table;
  }

  @Override
  public String toString() {
    return "BytePattern[" + PatternHasher.hash(pattern) + ", length=" + length() + "]";
  }

  private static String describe(byte[] bytes) {
    return bytes.length > 32
        ? Arrays.toString(Arrays.copyOf(bytes, 32)) + "..."
        : Arrays.toString(bytes);
  }
}
