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
package net.trendeval.eval;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import net.trendeval.metrics.MetricsReport;
import net.trendeval.split.ScheduleWarning;
import net.trendeval.utils.JSON;

/**
 * The outcome of an evaluation: one report per model in the order the 
 * models were given, plus any recoverable warnings.
 * 
 * @since 1.0
 */
public final class EvaluationResult {
  private final Map<String, MetricsReport> reports;
  private final List<ScheduleWarning> warnings;
  
  EvaluationResult(final Map<String, MetricsReport> reports, 
                   final List<ScheduleWarning> warnings) {
    this.reports = Collections.unmodifiableMap(reports);
    this.warnings = ImmutableList.copyOf(warnings);
  }
  
  /** @return The reports keyed by model name, in model order. */
  public Map<String, MetricsReport> getReports() {
    return reports;
  }
  
  /**
   * @param model The model name.
   * @return The report or null if no such model was evaluated.
   */
  public MetricsReport get(final String model) {
    return reports.get(model);
  }
  
  /** @return The warnings raised during evaluation, may be empty. */
  public List<ScheduleWarning> getWarnings() {
    return warnings;
  }
  
  /** @return The reports serialized as a JSON object keyed by model. */
  public String toJson() {
    return JSON.serializeToString(reports);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("reports=")
        .append(reports)
        .append(", warnings=")
        .append(warnings)
        .toString();
  }
}
