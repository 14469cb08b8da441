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

import java.util.Collection;
import java.util.Map.Entry;
import java.util.SortedMap;

import com.google.common.collect.Maps;

/**
 * Creates the per-model accumulators and turns them into reports once
 * every fold has been scored.
 * 
 * @since 1.0
 */
public final class Aggregator {
  
  private Aggregator() {
  }
  
  /**
   * @param categories The non-null category axis of the dataset.
   * @return An accumulator with zeroed counts for every category.
   */
  public static MetricsAccumulator initialize(
      final Collection<String> categories) {
    return MetricsAccumulator.initialize(categories);
  }
  
  /**
   * Computes the final scores. The accumulator is not modified.
   * @param accumulator A non-null accumulator.
   * @return The report with per-category and overall scores.
   */
  public static MetricsReport finalizeMetrics(
      final MetricsAccumulator accumulator) {
    if (accumulator == null) {
      throw new IllegalArgumentException("Accumulator cannot be null.");
    }
    final SortedMap<String, FinalMetrics> categories = Maps.newTreeMap();
    final CategoryMetrics totals = new CategoryMetrics();
    for (final Entry<String, CategoryMetrics> entry : 
        accumulator.asMap().entrySet()) {
      categories.put(entry.getKey(), 
          FinalMetrics.fromAccumulator(entry.getValue()));
      totals.merge(entry.getValue());
    }
    return new MetricsReport(categories, 
        FinalMetrics.fromAccumulator(totals));
  }
}
