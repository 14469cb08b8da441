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

import com.google.common.base.MoreObjects;

/**
 * Running confusion counts and supports for one category over one model's
 * evaluation. Counts only ever grow until the accumulator is finalized.
 * <p>
 * This class is not thread-safe. When folds are scored in parallel, give
 * each fold its own instance and {@link #merge(CategoryMetrics)} them.
 * 
 * @since 1.0
 */
public final class CategoryMetrics {
  private long true_positives;
  private long false_positives;
  private long false_negatives;
  
  /** Rows seen for the category. */
  private long num_samples;
  
  /** Sum of the raw values seen for the category. */
  private double num_values;
  
  /**
   * Adds match counts.
   * @param result A non-null result.
   * @return This accumulator.
   */
  public CategoryMetrics add(final MatchResult result) {
    true_positives += result.truePositives();
    false_positives += result.falsePositives();
    false_negatives += result.falseNegatives();
    return this;
  }
  
  /**
   * Adds supports.
   * @param samples The number of rows seen, zero or more.
   * @param value_sum The sum of their raw values.
   * @return This accumulator.
   */
  public CategoryMetrics addSamples(final long samples, 
                                    final double value_sum) {
    if (samples < 0) {
      throw new IllegalArgumentException("Sample count cannot be negative: " 
          + samples);
    }
    num_samples += samples;
    num_values += value_sum;
    return this;
  }
  
  /**
   * Adds every count of another accumulator to this one.
   * @param other A non-null accumulator.
   * @return This accumulator.
   */
  public CategoryMetrics merge(final CategoryMetrics other) {
    true_positives += other.true_positives;
    false_positives += other.false_positives;
    false_negatives += other.false_negatives;
    num_samples += other.num_samples;
    num_values += other.num_values;
    return this;
  }
  
  public long truePositives() {
    return true_positives;
  }
  
  public long falsePositives() {
    return false_positives;
  }
  
  public long falseNegatives() {
    return false_negatives;
  }
  
  public long numSamples() {
    return num_samples;
  }
  
  public double numValues() {
    return num_values;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tp", true_positives)
        .add("fp", false_positives)
        .add("fn", false_negatives)
        .add("numSamples", num_samples)
        .add("numValues", num_values)
        .toString();
  }
}
