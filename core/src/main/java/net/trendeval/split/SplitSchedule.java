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
package net.trendeval.split;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The folds produced by a split along with any warnings raised while
 * building them.
 * 
 * @since 1.0
 */
public final class SplitSchedule {
  private final List<Fold> folds;
  private final List<ScheduleWarning> warnings;
  
  SplitSchedule(final List<Fold> folds, 
                final List<ScheduleWarning> warnings) {
    this.folds = ImmutableList.copyOf(folds);
    this.warnings = ImmutableList.copyOf(warnings);
  }
  
  /** @return The folds in chronological order. */
  public List<Fold> getFolds() {
    return folds;
  }
  
  /** @return Warnings raised while building the schedule, may be empty. */
  public List<ScheduleWarning> getWarnings() {
    return warnings;
  }
  
  /** @return The number of folds. */
  public int size() {
    return folds.size();
  }
}
