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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy iterator over the fuzzy matches of a pattern in a symbol sequence.
 *
 * <p>Each call pulls masks from the underlying {@link MaskStream} and feeds them to the automaton
 * until a position within the maximum distance is found. Positions are reported in increasing
 * order, once each, with the smallest distance at which the pattern matches there.
 *
 * <p>Not thread-safe: an iterator belongs to the thread that consumes it. Once exhausted it stays
 * exhausted.
 *
 * <pre>{@code
 * for (Match m : Pattern.compile("wxrld").levenshtein("hello world", 1).toList()) {
 *     System.out.println(m.end() + " at distance " + m.distance());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class MatchIterator implements Iterator<Match> {

  private final MaskStream masks;
  private final EditAutomaton automaton;
  private final BitapMetricsRegistry metrics;

  // Index of the last symbol fed to the automaton
  private long position = -1;
  private long matches;
  private Match lookahead;
  private boolean exhausted;

  MatchIterator(MaskStream masks, EditAutomaton automaton, BitapMetricsRegistry metrics) {
    this.masks = Objects.requireNonNull(masks, "masks cannot be null");
    this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  @Override
  public boolean hasNext() {
    if (lookahead != null) {
      return true;
    }
    if (exhausted) {
      return false;
    }
    while (masks.hasNext()) {
      long mask = masks.nextMask();
      position++;
      int distance = automaton.step(mask);
      if (distance != EditAutomaton.NO_MATCH) {
        lookahead = new Match(distance, position);
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
  public Match next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more matches");
    }
    Match match = lookahead;
    lookahead = null;
    return match;
  }

  /** Maximum distance of the search after clamping to the pattern length. */
  public int maxDistance() {
    return automaton.maxDistance();
  }

  /** Number of symbols consumed so far. */
  public long symbolsConsumed() {
    return position + 1;
  }

  /**
   * Remaining matches as a sequential, ordered stream. The stream consumes this iterator.
   *
   * @return stream of matches
   */
  public Stream<Match> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            this, Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.DISTINCT),
        false);
  }

  /**
   * Drains the remaining matches into a list.
   *
   * @return matches in increasing end order
   */
  public List<Match> toList() {
    List<Match> result = new ArrayList<>();
    forEachRemaining(result::add);
    return result;
  }
}
