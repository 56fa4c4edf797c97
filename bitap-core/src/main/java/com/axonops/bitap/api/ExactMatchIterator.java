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

import com.axonops.bitap.automaton.EditAutomaton;
import com.axonops.bitap.mask.MaskStream;
import com.axonops.bitap.metrics.BitapMetricsRegistry;
import com.axonops.bitap.metrics.MetricNames;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.LongStream;
import java.util.stream.StreamSupport;

/**
 * Lazy iterator over the end positions of exact occurrences of a pattern.
 *
 * <p>Overlapping occurrences are all reported: "aba" in "ababa" ends at 2 and 4. The start of an
 * occurrence is {@code end - patternLength() + 1}.
 *
 * @since 1.0.0
 */
public final class ExactMatchIterator implements PrimitiveIterator.OfLong {

  private final MaskStream masks;
  private final EditAutomaton automaton;
  private final BitapMetricsRegistry metrics;

  private long position = -1;
  private long matches;
  private long lookahead = -1;
  private boolean exhausted;

  ExactMatchIterator(MaskStream masks, EditAutomaton automaton, BitapMetricsRegistry metrics) {
    this.masks = Objects.requireNonNull(masks, "masks cannot be null");
    this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  @Override
  public boolean hasNext() {
    if (lookahead >= 0) {
      return true;
    }
    if (exhausted) {
      return false;
    }
    while (masks.hasNext()) {
      long mask = masks.nextMask();
      position++;
      if (automaton.step(mask) != EditAutomaton.NO_MATCH) {
        lookahead = position;
        matches++;
        return true;
      }
    }
    exhausted = true;
    metrics.incrementCounter(MetricNames.SEARCH_SYMBOLS, position + 1);
    metrics.incrementCounter(MetricNames.SEARCH_MATCHES, matches);
    return false;
  }

  @Override
  public long nextLong() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more matches");
    }
    long end = lookahead;
    lookahead = -1;
    return end;
  }

  public int patternLength() {
    return automaton.patternLength();
  }

  /** Remaining end positions as a sequential stream. The stream consumes this iterator. */
  public LongStream stream() {
    return StreamSupport.longStream(
        Spliterators.spliteratorUnknownSize(
            this, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
        false);
  }

  /** Drains the remaining end positions. */
  public long[] toArray() {
    return stream().toArray();
  }
}
