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
package net.trendeval.model;

import net.trendeval.data.KeyedSeries;

/**
 * A trend or anomaly detection model under evaluation. The harness treats
 * implementations as black boxes: it calls {@link #fit(KeyedSeries, KeyedSeries)}
 * with the training slice of a fold, then {@link #predict(KeyedSeries)} with
 * the test slice. Calls are sequential and never overlap for a given model.
 * <p>
 * Exceptions thrown by a model are not caught by the harness.
 * 
 * @since 1.0
 */
public interface TrendModel {

  /** @return The non-null, unique name results are reported under. */
  public String getName();
  
  /**
   * Trains the model. May be called once per fold, with each call's
   * training window covering every date of the previous call.
   * @param features The non-null training values.
   * @param labels The non-null training labels, each -1, 0 or 1.
   */
  public void fit(final KeyedSeries<Double> features, 
                  final KeyedSeries<Integer> labels);
  
  /**
   * Predicts events for the test values. Keys should be a subset of the
   * feature keys; a non-zero value marks a predicted event.
   * @param features The non-null test values.
   * @return A non-null series of predictions, possibly sparse.
   */
  public KeyedSeries<Integer> predict(final KeyedSeries<Double> features);
  
}
