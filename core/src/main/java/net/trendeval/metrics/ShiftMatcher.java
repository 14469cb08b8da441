// This file is part of TrendEval.
// Copyright (C) 2026  The TrendEval Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.trendeval.metrics;

import java.util.List;

import net.trendeval.join.AlignedRow;

/**
 * Matches predicted events to actual events allowing a bounded shift in
 * position.
 * <p>
 * A prediction at position {@code p} may match an event at position 
 * {@code a} when {@code |p - a| <= window_size}. Matching is one-to-one:
 * events are visited in ascending order and each takes the closest 
 * unconsumed prediction in its window, the leftmost one on a tie. Events
 * without a candidate are false negatives and predictions never taken are
 * false positives. A window of 0 is exact position matching.
 * <p>
 * Positions are indices into one category's time ordered rows, not 
 * timestamps.
 * 
 * @since 1.0
 */
public final class ShiftMatcher {
  
  private ShiftMatcher() {
  }
  
  /**
   * Matches two aligned event sequences. Any non-zero entry is an event.
   * @param predicted The non-null predicted flags.
   * @param actual The non-null actual flags, same length as predicted.
   * @param window_size The allowed shift, zero or more. Windows reaching
   * past either end of the sequence are clipped.
   * @return The confusion counts.
   * @throws IllegalArgumentException if either array was null, the lengths
   * differ or the window was negative.
   */
  public static MatchResult match(final int[] predicted, 
                                  final int[] actual, 
                                  final int window_size) {
    if (predicted == null || actual == null) {
      throw new IllegalArgumentException("Sequences cannot be null.");
    }
    if (predicted.length != actual.length) {
      throw new IllegalArgumentException("Predicted length " 
          + predicted.length + " differs from actual length " 
          + actual.length);
    }
    if (window_size < 0) {
      throw new IllegalArgumentException("Window size cannot be negative: " 
          + window_size);
    }
    
    final int length = predicted.length;
    final int reach = Math.min(window_size, length);
    final boolean[] consumed = new boolean[length];
    int predicted_events = 0;
    for (int i = 0; i < length; i++) {
      if (predicted[i] != 0) {
        predicted_events++;
      }
    }
    
    int true_positives = 0;
    int false_negatives = 0;
    for (int a = 0; a < length; a++) {
      if (actual[a] == 0) {
        continue;
      }
      
      int best = -1;
      int best_distance = Integer.MAX_VALUE;
      final int end = Math.min(length - 1, a + reach);
      // ascending scan with a strict compare keeps the leftmost on ties
      for (int p = Math.max(0, a - reach); p <= end; p++) {
        if (predicted[p] == 0 || consumed[p]) {
          continue;
        }
        final int distance = Math.abs(p - a);
        if (distance < best_distance) {
          best = p;
          best_distance = distance;
        }
      }
      
      if (best >= 0) {
        consumed[best] = true;
        true_positives++;
      } else {
        false_negatives++;
      }
    }
    
    return new MatchResult(true_positives, 
        predicted_events - true_positives, 
        false_negatives);
  }
  
  /**
   * Matches the rows of a single category.
   * @param rows The non-null, time ordered rows of one category.
   * @param window_size The allowed shift, zero or more.
   * @return The confusion counts.
   */
  public static MatchResult match(final List<AlignedRow> rows, 
                                  final int window_size) {
    if (rows == null) {
      throw new IllegalArgumentException("Rows cannot be null.");
    }
    final int[] predicted = new int[rows.size()];
    final int[] actual = new int[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      predicted[i] = rows.get(i).prediction();
      actual[i] = rows.get(i).label();
    }
    return match(predicted, actual, window_size);
  }
  
  /**
   * Matches the rows of a single category and adds the counts, the row
   * count and the sum of the non-null values to the accumulator.
   * @param rows The non-null, time ordered rows of one category.
   * @param window_size The allowed shift, zero or more.
   * @param metrics The non-null accumulator to update in place.
   * @return The confusion counts of this call alone.
   */
  public static MatchResult accumulate(final List<AlignedRow> rows, 
                                       final int window_size, 
                                       final CategoryMetrics metrics) {
    if (metrics == null) {
      throw new IllegalArgumentException("Metrics cannot be null.");
    }
    final MatchResult result = match(rows, window_size);
    double value_sum = 0;
    for (final AlignedRow row : rows) {
      if (row.value() != null && !Double.isNaN(row.value())) {
        value_sum += row.value();
      }
    }
    metrics.add(result);
    metrics.addSamples(rows.size(), value_sum);
    return result;
  }
}
