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
package net.trendeval.data;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.SortedSet;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.trendeval.exceptions.IllegalDataException;

/**
 * A collection of values keyed on (timestamp, category). Rows are kept
 * sorted by {@link SeriesKey} so iteration always walks the date axis in
 * ascending order and, within a date, the categories in lexical order.
 * <p>
 * A key may only appear once. Attempting to add a second row for the same
 * key throws an {@link IllegalDataException} rather than overwriting the
 * first.
 * <p>
 * Features are typically {@code KeyedSeries<Double>} and labels or
 * predictions {@code KeyedSeries<Integer>}.
 * <p>
 * This class is not thread-safe.
 *
 * @param <V> The type of value stored per key.
 * 
 * @since 1.0
 */
public class KeyedSeries<V> implements Iterable<Entry<SeriesKey, V>> {

  /** The sorted rows. */
  private final NavigableMap<SeriesKey, V> rows;
  
  /** Protected ctor, use {@link #newSeries()}. */
  protected KeyedSeries() {
    rows = Maps.newTreeMap();
  }
  
  /** @return A new, empty series. */
  public static <V> KeyedSeries<V> newSeries() {
    return new KeyedSeries<V>();
  }
  
  /**
   * Adds a row to the series.
   * @param timestamp The time bucket.
   * @param category A non-null and non-empty category.
   * @param value A non-null value.
   * @return The series for chaining.
   * @throws IllegalArgumentException if the category or value was null.
   * @throws IllegalDataException if the key already exists.
   */
  public KeyedSeries<V> put(final long timestamp, 
                            final String category, 
                            final V value) {
    return put(new SeriesKey(timestamp, category), value);
  }
  
  /**
   * Adds a row to the series.
   * @param key A non-null key.
   * @param value A non-null value.
   * @return The series for chaining.
   * @throws IllegalArgumentException if the key or value was null.
   * @throws IllegalDataException if the key already exists.
   */
  public KeyedSeries<V> put(final SeriesKey key, final V value) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null for key: " 
          + key);
    }
    if (rows.containsKey(key)) {
      throw new IllegalDataException("Duplicate key in series: " + key);
    }
    rows.put(key, value);
    return this;
  }
  
  /**
   * @param key A key to look up.
   * @return The value if present, null if not.
   */
  public V get(final SeriesKey key) {
    return rows.get(key);
  }
  
  /**
   * @param timestamp The time bucket.
   * @param category The category.
   * @return The value if present, null if not.
   */
  public V get(final long timestamp, final String category) {
    return rows.get(new SeriesKey(timestamp, category));
  }
  
  /**
   * @param key A key to look up.
   * @return True if the series has a row for the key.
   */
  public boolean containsKey(final SeriesKey key) {
    return rows.containsKey(key);
  }
  
  /** @return The number of rows in the series. */
  public int size() {
    return rows.size();
  }
  
  /** @return True if the series has no rows. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }
  
  /** @return An unmodifiable, sorted view of the rows. */
  public Map<SeriesKey, V> entries() {
    return Collections.unmodifiableMap(rows);
  }
  
  @Override
  public Iterator<Entry<SeriesKey, V>> iterator() {
    return Collections.unmodifiableMap(rows).entrySet().iterator();
  }
  
  /** @return The sorted, distinct timestamps in the series. */
  public SortedSet<Long> dates() {
    final ImmutableSortedSet.Builder<Long> dates = 
        ImmutableSortedSet.naturalOrder();
    for (final SeriesKey key : rows.keySet()) {
      dates.add(key.timestamp());
    }
    return dates.build();
  }
  
  /** @return The sorted, distinct categories in the series. */
  public SortedSet<String> categories() {
    final ImmutableSortedSet.Builder<String> categories = 
        ImmutableSortedSet.naturalOrder();
    for (final SeriesKey key : rows.keySet()) {
      categories.add(key.category());
    }
    return categories.build();
  }
  
  /**
   * Returns a new series with only the rows whose timestamp is in the given
   * collection. Dates absent from this series are ignored.
   * @param dates A non-null collection of timestamps.
   * @return A new series, possibly empty.
   * @throws IllegalArgumentException if the dates were null.
   */
  public KeyedSeries<V> slice(final Collection<Long> dates) {
    if (dates == null) {
      throw new IllegalArgumentException("Dates cannot be null.");
    }
    final Set<Long> wanted = dates instanceof Set 
        ? (Set<Long>) dates : Sets.newHashSet(dates);
    final KeyedSeries<V> slice = new KeyedSeries<V>();
    for (final Entry<SeriesKey, V> entry : rows.entrySet()) {
      if (wanted.contains(entry.getKey().timestamp())) {
        slice.rows.put(entry.getKey(), entry.getValue());
      }
    }
    return slice;
  }
  
  /**
   * Returns the rows of a single category in time order.
   * @param category The category to fetch.
   * @return A new series with only that category, possibly empty.
   */
  public KeyedSeries<V> forCategory(final String category) {
    final KeyedSeries<V> slice = new KeyedSeries<V>();
    for (final Entry<SeriesKey, V> entry : rows.entrySet()) {
      if (entry.getKey().category().equals(category)) {
        slice.rows.put(entry.getKey(), entry.getValue());
      }
    }
    return slice;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("size=")
        .append(rows.size())
        .append(", rows=")
        .append(rows)
        .toString();
  }
}
