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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.trendeval.config.EvaluationConfig;

/**
 * The output of {@link Joiner}: rows sorted by (timestamp, category) with
 * exactly one row per key.
 * 
 * @since 1.0
 */
public final class AlignedTable {
  /** An empty table. */
  public static final AlignedTable EMPTY = 
      new AlignedTable(Collections.<AlignedRow>emptyList());
  
  private final List<AlignedRow> rows;
  
  /**
   * Package private ctor. Rows must already be sorted and unique.
   * @param rows The non-null rows.
   */
  AlignedTable(final List<AlignedRow> rows) {
    this.rows = ImmutableList.copyOf(rows);
  }
  
  /** @return The sorted, immutable rows. */
  public List<AlignedRow> rows() {
    return rows;
  }
  
  public int size() {
    return rows.size();
  }
  
  public boolean isEmpty() {
    return rows.isEmpty();
  }
  
  /** @return The distinct categories present in the table. */
  public SortedSet<String> categories() {
    final ImmutableSortedSet.Builder<String> categories = 
        ImmutableSortedSet.naturalOrder();
    for (final AlignedRow row : rows) {
      categories.add(row.key().category());
    }
    return categories.build();
  }
  
  /**
   * @param category The category to filter on.
   * @return The rows for the category in time order, possibly empty.
   */
  public List<AlignedRow> forCategory(final String category) {
    final List<AlignedRow> filtered = Lists.newArrayList();
    for (final AlignedRow row : rows) {
      if (row.key().category().equals(category)) {
        filtered.add(row);
      }
    }
    return filtered;
  }
  
  /**
   * Exports the table as records keyed by the column aliases of the config
   * plus {@code timestamp} and {@code category}. A missing value is left 
   * out of its record rather than written as 0.
   * @param config The non-null config to pull aliases from.
   * @return A list of records in row order.
   */
  public List<Map<String, Object>> asRecords(final EvaluationConfig config) {
    final List<Map<String, Object>> records = 
        Lists.newArrayListWithCapacity(rows.size());
    for (final AlignedRow row : rows) {
      final Map<String, Object> record = Maps.newLinkedHashMap();
      record.put("timestamp", row.key().timestamp());
      record.put("category", row.key().category());
      record.put(config.getPredictionColName(), row.prediction());
      record.put(config.getLabelColName(), row.label());
      if (row.value() != null) {
        record.put(config.getValueColName(), row.value());
      }
      records.add(record);
    }
    return records;
  }
}
