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

import net.trendeval.metrics.MetricsAccumulator;
import net.trendeval.metrics.MetricsReport;
import net.trendeval.split.Fold;
import net.trendeval.split.ScheduleWarning;

/**
 * Receives progress and diagnostics from an {@link EvaluationHarness}.
 * Callbacks run synchronously on the evaluating thread, in chronological
 * fold order. Extend {@link BaseEvaluationListener} to only override the
 * callbacks of interest.
 * 
 * @since 1.0
 */
public interface EvaluationListener {

  /**
   * Called once per evaluation when the split schedule had to be adjusted.
   * @param warning The non-null warning.
   */
  public void onWarning(final ScheduleWarning warning);
  
  /**
   * Called before the first fold of a model.
   * @param model The model name.
   */
  public void onModelStart(final String model);
  
  /**
   * Called before a fold is fit.
   * @param model The model name.
   * @param fold The fold.
   */
  public void onFoldStart(final String model, final Fold fold);
  
  /**
   * Called instead of {@link #onFoldStart(String, Fold)} for a fold whose
   * test dates have no labels. The fold contributes nothing.
   * @param model The model name.
   * @param fold The fold.
   */
  public void onFoldSkipped(final String model, final Fold fold);
  
  /**
   * Called after a fold has been scored.
   * @param model The model name.
   * @param fold The fold.
   * @param metrics The running accumulator. Do not modify.
   */
  public void onFoldComplete(final String model, 
                             final Fold fold, 
                             final MetricsAccumulator metrics);
  
  /**
   * Called once a model's report is final.
   * @param model The model name.
   * @param report The report.
   */
  public void onModelComplete(final String model, final MetricsReport report);
  
}
