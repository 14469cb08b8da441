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
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;

import com.google.common.collect.Maps;

import net.trendeval.exceptions.IllegalDataException;

/**
 * The per-category accumulators for one model's evaluation, keyed and
 * iterated in category order. Every category of the dataset is registered
 * up front so categories without events still show up in the report.
 * 
 * @since 1.0
 */
public final class MetricsAccumulator {
  private final NavigableMap<String, CategoryMetrics> metrics;
  
  private MetricsAccumulator() {
    metrics = Maps.newTreeMap();
  }
  
  /**
   * Creates an accumulator with a zeroed entry per category.
   * @param categories The non-null categories to register.
   * @return A new accumulator.
   * @throws IllegalArgumentException if the categories were null or 
   * contained a null or empty category.
   */
  public static MetricsAccumulator initialize(
      final Collection<String> categories) {
    if (categories == null) {
      throw new IllegalArgumentException("Categories cannot be null.");
    }
    final MetricsAccumulator accumulator = new MetricsAccumulator();
    for (final String category : categories) {
      if (category == null || category.isEmpty()) {
        throw new IllegalArgumentException("Category cannot be null or "
            + "empty.");
      }
      accumulator.metrics.put(category, new CategoryMetrics());
    }
    return accumulator;
  }
  
  /**
   * @param category The category to fetch.
   * @return The accumulator for the category.
   * @throws IllegalDataException if the category was never registered.
   */
  public CategoryMetrics get(final String category) {
    final CategoryMetrics entry = metrics.get(category);
    if (entry == null) {
      throw new IllegalDataException("Category was not part of the "
          + "dataset: " + category);
    }
    return entry;
  }
  
  /**
   * @param category The category to look for.
   * @return True if the category is registered.
   */
  public boolean contains(final String category) {
    return metrics.containsKey(category);
  }
  
  /** @return The sorted, registered categories. */
  public Set<String> categories() {
    return Collections.unmodifiableSet(metrics.keySet());
  }
  
  /** @return A sorted, unmodifiable view of the accumulators. */
  public Map<String, CategoryMetrics> asMap() {
    return Collections.unmodifiableMap(metrics);
  }
  
  /**
   * Adds another accumulator's counts to this one, registering categories
   * this one has not seen.
   * @param other A non-null accumulator.
   * @return This accumulator.
   */
  public MetricsAccumulator merge(final MetricsAccumulator other) {
    if (other == null) {
      throw new IllegalArgumentException("Other cannot be null.");
    }
    for (final Entry<String, CategoryMetrics> entry : 
        other.metrics.entrySet()) {
      CategoryMetrics mine = metrics.get(entry.getKey());
      if (mine == null) {
        mine = new CategoryMetrics();
        metrics.put(entry.getKey(), mine);
      }
      mine.merge(entry.getValue());
    }
    return this;
  }
  
  @Override
  public String toString() {
    return metrics.toString();
  }
}
