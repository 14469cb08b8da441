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
package net.trendeval.join;

import java.util.List;
import java.util.Map.Entry;

import com.google.common.collect.Lists;

import net.trendeval.data.KeyedSeries;
import net.trendeval.data.SeriesKey;

/**
 * Reconciles a model's predictions with the ground truth and the raw 
 * values. The prediction keys drive the join: every predicted key yields 
 * exactly one row and keys only present in the labels or values are
 * dropped. A missing label means "no event" and is filled with 0. A 
 * missing value stays null.
 * <p>
 * Predictions and labels need not cover the same dates, e.g. a model may
 * skip the first dates of a test window it has too little history for.
 * 
 * @since 1.0
 */
public final class Joiner {
  
  private Joiner() {
  }
  
  /**
   * Joins the three series on the prediction keys.
   * @param labels The non-null ground truth labels.
   * @param predictions The non-null predictions.
   * @param values The non-null raw values.
   * @return The joined table sorted by key.
   * @throws IllegalArgumentException if any series was null.
   */
  public static AlignedTable join(final KeyedSeries<Integer> labels, 
                                  final KeyedSeries<Integer> predictions,
                                  final KeyedSeries<Double> values) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (predictions == null) {
      throw new IllegalArgumentException("Predictions cannot be null.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (predictions.isEmpty()) {
      return AlignedTable.EMPTY;
    }
    
    final List<AlignedRow> rows = 
        Lists.newArrayListWithCapacity(predictions.size());
    // predictions iterate in key order so the rows come out sorted.
    for (final Entry<SeriesKey, Integer> entry : predictions) {
      final Integer label = labels.get(entry.getKey());
      rows.add(new AlignedRow(entry.getKey(), 
          entry.getValue(), 
          label == null ? 0 : label, 
          values.get(entry.getKey())));
    }
    return new AlignedTable(rows);
  }
}
