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

import com.axonops.bitap.mask.HashMaskTable;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.util.PatternHasher;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A compiled pattern over an arbitrary token alphabet.
 *
 * <p>Tokens are compared with {@code equals} and {@code hashCode}, so words, enum constants or
 * domain objects all work. A {@code null} token in a searched text matches nothing.
 *
 * <pre>{@code
 * TokenPattern<String> query = TokenPattern.compile(List.of("quick", "brown", "fox"));
 * query.levenshtein(List.of("the", "quick", "fox", "jumps"), 1).toList(); // [Match[distance=1, end=2]]
 * }</pre>
 *
 * @param <S> token type
 * @since 1.0.0
 */
public final class TokenPattern<S> implements Searcher<Iterable<? extends S>> {
  private static final Logger logger = LoggerFactory.getLogger(TokenPattern.class);

  private final List<S> tokens;
  private final HashMaskTable<S> table;

  private TokenPattern(List<S> tokens, HashMaskTable<S> table) {
    this.tokens = tokens;
    this.table = table;
  }

  /**
   * Compiles a token pattern.
   *
   * @param tokens 1 to {@link Bitap#MAX_PATTERN_LENGTH} non-null tokens; copied
   * @param <S> token type
   * @return compiled pattern
   * @throws PatternCompilationException if the pattern is empty, too long or has a null token
   */
  public static <S> TokenPattern<S> compile(List<? extends S> tokens) {
    Objects.requireNonNull(tokens, "tokens cannot be null");
    String hash = PatternHasher.hash(tokens);
    long startNanos = System.nanoTime();

    Pattern.checkLength(String.valueOf(tokens), hash, tokens.size());
    // List.of rejects indexOf(null), so scan
    int index = 0;
    for (S token : tokens) {
      if (token == null) {
        throw Pattern.compilationFailed(
            new PatternCompilationException(
                String.valueOf(tokens), "Null token at index " + index),
            hash);
      }
      index++;
    }

    List<S> copy = List.copyOf(tokens);
    HashMaskTable<S> table = HashMaskTable.build(copy);
    long durationNanos = Pattern.recordCompiled(startNanos);
    logger.trace(
        "Bitap: Token pattern compiled - hash: {}, distinct tokens: {}, timeNs: {}",
        hash,
        table.alphabetSize(),
        durationNanos);
    return new TokenPattern<>(copy, table);
  }

  @Override
  public int length() {
    return table.patternLength();
  }

  @Override
  public MaskStream masks(Iterable<? extends S> text) {
    Objects.requireNonNull(text, "text cannot be null");
    return table.stream(text.iterator());
  }

  @Override
  public BitapMetricsRegistry metricsRegistry() {
    return Pattern.globalMetrics();
  }

  /** Pattern tokens, unmodifiable. */
  public List<S> tokens() {
    return tokens;
  }

  public HashMaskTable<S> maskTable() {
    return table;
  }

  @Override
  public String toString() {
    return "TokenPattern[" + PatternHasher.hash(tokens) + ", length=" + length() + "]";
  }
}
