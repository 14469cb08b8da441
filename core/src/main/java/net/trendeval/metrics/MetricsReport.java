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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The finalized scores of one model: one entry per category of the 
 * dataset plus an {@code overall} row micro-averaged over the summed 
 * counts of every category.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "overall", "categories" })
public final class MetricsReport {
  private final SortedMap<String, FinalMetrics> categories;
  private final FinalMetrics overall;
  
  MetricsReport(final SortedMap<String, FinalMetrics> categories, 
                final FinalMetrics overall) {
    this.categories = Collections.unmodifiableSortedMap(categories);
    this.overall = overall;
  }
  
  /** @return The per-category scores sorted by category. */
  @JsonProperty("categories")
  public Map<String, FinalMetrics> getCategories() {
    return categories;
  }
  
  /**
   * @param category The category to fetch.
   * @return The scores or null if the category was not in the dataset.
   */
  public FinalMetrics get(final String category) {
    return categories.get(category);
  }
  
  /** @return The scores over all categories. */
  @JsonProperty("overall")
  public FinalMetrics getOverall() {
    return overall;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("overall=")
        .append(overall)
        .append(", categories=")
        .append(categories)
        .toString();
  }
}
