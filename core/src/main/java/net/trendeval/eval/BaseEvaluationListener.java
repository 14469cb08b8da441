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
 * A listener that ignores every callback.
 * 
 * @since 1.0
 */
public abstract class BaseEvaluationListener implements EvaluationListener {

  @Override
  public void onWarning(final ScheduleWarning warning) {
  }

  @Override
  public void onModelStart(final String model) {
  }

  @Override
  public void onFoldStart(final String model, final Fold fold) {
  }

  @Override
  public void onFoldSkipped(final String model, final Fold fold) {
  }

  @Override
  public void onFoldComplete(final String model, 
                             final Fold fold, 
                             final MetricsAccumulator metrics) {
  }

  @Override
  public void onModelComplete(final String model, 
                              final MetricsReport report) {
  }

}
