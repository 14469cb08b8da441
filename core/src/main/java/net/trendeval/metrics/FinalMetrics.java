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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;

/**
 * Read only scores for one category, or for all categories combined.
 * Ratios with a zero denominator are reported as 0, never NaN.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "precision", "recall", "f1", "f0.5", "tp", "fp", "fn",
  "numSamples", "numValues" })
public final class FinalMetrics {
  private final double precision;
  private final double recall;
  private final double f1;
  private final double f05;
  private final long true_positives;
  private final long false_positives;
  private final long false_negatives;
  private final long num_samples;
  private final double num_values;
  
  private FinalMetrics(final long true_positives, 
                       final long false_positives, 
                       final long false_negatives, 
                       final long num_samples, 
                       final double num_values) {
    this.true_positives = true_positives;
    this.false_positives = false_positives;
    this.false_negatives = false_negatives;
    this.num_samples = num_samples;
    this.num_values = num_values;
    precision = ratio(true_positives, true_positives + false_positives);
    recall = ratio(true_positives, true_positives + false_negatives);
    f1 = fScore(precision, recall, 1.0);
    f05 = fScore(precision, recall, 0.5);
  }
  
  /**
   * Computes the scores from raw counts.
   * @param true_positives Matched events.
   * @param false_positives Unmatched predictions.
   * @param false_negatives Unmatched events.
   * @param num_samples Rows seen.
   * @param num_values Sum of the raw values seen.
   * @return The scores.
   */
  public static FinalMetrics fromCounts(final long true_positives, 
                                        final long false_positives, 
                                        final long false_negatives, 
                                        final long num_samples, 
                                        final double num_values) {
    return new FinalMetrics(true_positives, false_positives, 
        false_negatives, num_samples, num_values);
  }
  
  /**
   * Computes the scores from an accumulator.
   * @param metrics A non-null accumulator.
   * @return The scores.
   */
  public static FinalMetrics fromAccumulator(final CategoryMetrics metrics) {
    return new FinalMetrics(metrics.truePositives(), 
        metrics.falsePositives(), 
        metrics.falseNegatives(), 
        metrics.numSamples(), 
        metrics.numValues());
  }
  
  @JsonProperty("precision")
  public double getPrecision() {
    return precision;
  }
  
  @JsonProperty("recall")
  public double getRecall() {
    return recall;
  }
  
  @JsonProperty("f1")
  public double getF1() {
    return f1;
  }
  
  /** @return The F-beta score with beta 0.5, favoring precision. */
  @JsonProperty("f0.5")
  public double getF05() {
    return f05;
  }
  
  @JsonProperty("tp")
  public long getTruePositives() {
    return true_positives;
  }
  
  @JsonProperty("fp")
  public long getFalsePositives() {
    return false_positives;
  }
  
  @JsonProperty("fn")
  public long getFalseNegatives() {
    return false_negatives;
  }
  
  @JsonProperty("numSamples")
  public long getNumSamples() {
    return num_samples;
  }
  
  @JsonProperty("numValues")
  public double getNumValues() {
    return num_values;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("precision", precision)
        .add("recall", recall)
        .add("f1", f1)
        .add("f0.5", f05)
        .add("tp", true_positives)
        .add("fp", false_positives)
        .add("fn", false_negatives)
        .add("numSamples", num_samples)
        .add("numValues", num_values)
        .toString();
  }
  
  static double ratio(final long numerator, final long denominator) {
    return denominator == 0 ? 0 : (double) numerator / denominator;
  }
  
  /**
   * The weighted harmonic mean of precision and recall:
   * {@code (1 + b^2) * p * r / (b^2 * p + r)}.
   */
  static double fScore(final double precision, 
                       final double recall, 
                       final double beta) {
    final double beta_squared = beta * beta;
    final double denominator = beta_squared * precision + recall;
    if (denominator == 0) {
      return 0;
    }
    return (1 + beta_squared) * precision * recall / denominator;
  }
}
