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

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ComparisonChain;

/**
 * The composite key of a keyed series: a time bucket and the category
 * observed in that bucket. Keys sort by timestamp first, then by category,
 * so iterating a sorted collection of keys walks the date axis in order and
 * every category within each date.
 * 
 * @since 1.0
 */
public final class SeriesKey implements Comparable<SeriesKey> {

  /** The time bucket, e.g. a Unix epoch in seconds. */
  private final long timestamp;
  
  /** The non-null and non-empty category. */
  private final String category;
  
  /**
   * Default ctor.
   * @param timestamp The time bucket.
   * @param category A non-null and non-empty category.
   * @throws IllegalArgumentException if the category was null or empty.
   */
  public SeriesKey(final long timestamp, final String category) {
    if (Strings.isNullOrEmpty(category)) {
      throw new IllegalArgumentException("Category cannot be null or empty.");
    }
    this.timestamp = timestamp;
    this.category = category;
  }
  
  /** @return The time bucket. */
  public long timestamp() {
    return timestamp;
  }
  
  /** @return The category. */
  public String category() {
    return category;
  }
  
  @Override
  public int compareTo(final SeriesKey other) {
    return ComparisonChain.start()
        .compare(timestamp, other.timestamp)
        .compare(category, other.category)
        .result();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof SeriesKey)) {
      return false;
    }
    final SeriesKey other = (SeriesKey) o;
    return timestamp == other.timestamp && 
        category.equals(other.category);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, category);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("timestamp=")
        .append(timestamp)
        .append(", category=")
        .append(category)
        .toString();
  }
}
