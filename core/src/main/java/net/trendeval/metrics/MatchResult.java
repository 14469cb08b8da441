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
import com.google.common.base.Objects;

/**
 * The confusion counts from matching one category's predictions against
 * its labels over one fold.
 * 
 * @since 1.0
 */
public final class MatchResult {
  private final int true_positives;
  private final int false_positives;
  private final int false_negatives;
  
  /**
   * Default ctor.
   * @param true_positives Events matched by a prediction.
   * @param false_positives Predictions left unmatched.
   * @param false_negatives Events left unmatched.
   */
  public MatchResult(final int true_positives, 
                     final int false_positives, 
                     final int false_negatives) {
    this.true_positives = true_positives;
    this.false_positives = false_positives;
    this.false_negatives = false_negatives;
  }
  
  public int truePositives() {
    return true_positives;
  }
  
  public int falsePositives() {
    return false_positives;
  }
  
  public int falseNegatives() {
    return false_negatives;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof MatchResult)) {
      return false;
    }
    final MatchResult other = (MatchResult) o;
    return true_positives == other.true_positives &&
        false_positives == other.false_positives &&
        false_negatives == other.false_negatives;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(true_positives, false_positives, false_negatives);
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tp", true_positives)
        .add("fp", false_positives)
        .add("fn", false_negatives)
        .toString();
  }
}
