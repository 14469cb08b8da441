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
import java.util.Set;
import java.util.SortedSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.trendeval.config.EvaluationConfig;
import net.trendeval.config.EvaluationMode;
import net.trendeval.data.KeyedSeries;
import net.trendeval.exceptions.IllegalDataException;
import net.trendeval.exceptions.InvalidInputException;
import net.trendeval.join.AlignedTable;
import net.trendeval.join.Joiner;
import net.trendeval.metrics.Aggregator;
import net.trendeval.metrics.MetricsAccumulator;
import net.trendeval.metrics.MetricsReport;
import net.trendeval.metrics.ShiftMatcher;
import net.trendeval.model.TrendModel;
import net.trendeval.split.Fold;
import net.trendeval.split.ScheduleWarning;
import net.trendeval.split.SplitSchedule;
import net.trendeval.split.Splitter;

/**
 * Evaluates one or more {@link TrendModel}s against labeled data.
 * <p>
 * For each model, in order: a fresh accumulator is registered for every
 * category of the dataset, then for each fold of the schedule the model is
 * fit on the training slice, asked to predict the test slice, and its
 * predictions are joined with the test labels and values and matched per
 * category. Folds whose test dates carry no labels are skipped. Once the
 * folds are exhausted the accumulator is finalized into the model's report.
 * <p>
 * Inputs are validated before any model runs. Exceptions thrown by a model
 * propagate to the caller and abort the evaluation.
 * <p>
 * Evaluation is sequential and a harness holds no per-run state, so an 
 * instance may be reused. Models however are stateful and must not be 
 * evaluated concurrently.
 * 
 * @since 1.0
 */
public class EvaluationHarness {
  private static final Logger LOG = 
      LoggerFactory.getLogger(EvaluationHarness.class);
  
  /** Used when the caller does not care for callbacks. */
  private static final EvaluationListener NOOP_LISTENER = 
      new BaseEvaluationListener() { };
  
  /** The validated config. */
  protected final EvaluationConfig config;
  
  /** The non-null listener. */
  protected final EvaluationListener listener;
  
  /**
   * Ctor without callbacks.
   * @param config A non-null config.
   * @throws InvalidInputException if the config was null or invalid.
   */
  public EvaluationHarness(final EvaluationConfig config) {
    this(config, null);
  }
  
  /**
   * Default ctor.
   * @param config A non-null config.
   * @param listener An optional listener.
   * @throws InvalidInputException if the config was null or invalid.
   */
  public EvaluationHarness(final EvaluationConfig config, 
                           final EvaluationListener listener) {
    if (config == null) {
      throw new InvalidInputException("Config cannot be null.");
    }
    config.validate();
    this.config = config;
    this.listener = listener == null ? NOOP_LISTENER : listener;
  }
  
  /** @return The config. */
  public EvaluationConfig config() {
    return config;
  }
  
  /**
   * Evaluates with a single chronological split at the configured train
   * percentage.
   * @see #evaluate(KeyedSeries, KeyedSeries, List, EvaluationMode)
   */
  public EvaluationResult evaluatePercentSplit(
      final KeyedSeries<Double> features, 
      final KeyedSeries<Integer> labels,
      final List<? extends TrendModel> models) {
    return evaluate(features, labels, models, EvaluationMode.PERCENT_SPLIT);
  }
  
  /**
   * Evaluates with expanding window cross validation using the configured
   * number of splits.
   * @see #evaluate(KeyedSeries, KeyedSeries, List, EvaluationMode)
   */
  public EvaluationResult evaluateCrossValidation(
      final KeyedSeries<Double> features, 
      final KeyedSeries<Integer> labels,
      final List<? extends TrendModel> models) {
    return evaluate(features, labels, models, 
        EvaluationMode.CROSS_VALIDATION);
  }
  
  /**
   * Evaluates every model over the folds of the given mode.
   * @param features The non-null, non-empty raw values.
   * @param labels The non-null, non-empty ground truth labels.
   * @param models The non-null models, each with a unique name.
   * @param mode The non-null split mode.
   * @return The result with one report per model.
   * @throws InvalidInputException if an input was missing or unusable.
   * @throws IllegalDataException if a model predicted for an unknown 
   * category or returned null predictions.
   */
  public EvaluationResult evaluate(final KeyedSeries<Double> features,
                                   final KeyedSeries<Integer> labels,
                                   final List<? extends TrendModel> models,
                                   final EvaluationMode mode) {
    validateInputs(features, labels, models, mode);
    
    final SortedSet<Long> dates = features.dates();
    final Set<String> categories = 
        Sets.union(features.categories(), labels.categories());
    
    final List<Fold> folds;
    final List<ScheduleWarning> warnings;
    if (mode == EvaluationMode.PERCENT_SPLIT) {
      folds = Collections.singletonList(
          Splitter.splitPercent(dates, config.getTrainPercent()));
      warnings = Collections.emptyList();
    } else {
      final SplitSchedule schedule = 
          Splitter.splitCv(dates, config.getNSplits());
      folds = schedule.getFolds();
      warnings = schedule.getWarnings();
      narrate("Running {} splits over {} dates", folds.size(), dates.size());
    }
    for (final ScheduleWarning warning : warnings) {
      listener.onWarning(warning);
    }
    
    final Map<String, MetricsReport> reports = Maps.newLinkedHashMap();
    for (final TrendModel model : models) {
      reports.put(model.getName(), 
          evaluateModel(model, features, labels, folds, categories));
    }
    return new EvaluationResult(reports, warnings);
  }
  
  /**
   * Scores predictions that were already computed: joins them with the 
   * labels and values and adds each category's matches to the accumulator.
   * @param values The non-null raw values of the scored dates.
   * @param predictions The non-null predictions.
   * @param labels The non-null labels of the scored dates.
   * @param accumulator An optional accumulator to add to. When null a new
   * one is registered over the predicted categories.
   * @return The accumulator that was updated.
   * @throws IllegalDataException if a predicted category is not registered
   * in the given accumulator.
   */
  public MetricsAccumulator scorePredictions(
      final KeyedSeries<Double> values,
      final KeyedSeries<Integer> predictions,
      final KeyedSeries<Integer> labels,
      final MetricsAccumulator accumulator) {
    if (predictions == null) {
      throw new IllegalArgumentException("Predictions cannot be null.");
    }
    final MetricsAccumulator metrics = accumulator != null ? accumulator : 
      Aggregator.initialize(predictions.categories());
    final AlignedTable table = Joiner.join(labels, predictions, values);
    for (final String category : table.categories()) {
      ShiftMatcher.accumulate(table.forCategory(category), 
          config.getWindowSizeForMetrics(), 
          metrics.get(category));
    }
    return metrics;
  }
  
  /**
   * Runs a single model over every fold.
   * @return The finalized report.
   */
  protected MetricsReport evaluateModel(final TrendModel model,
                                        final KeyedSeries<Double> features,
                                        final KeyedSeries<Integer> labels,
                                        final List<Fold> folds,
                                        final Set<String> categories) {
    final String name = model.getName();
    final MetricsAccumulator metrics = Aggregator.initialize(categories);
    narrate("Model: {}", name);
    listener.onModelStart(name);
    
    int iteration = 0;
    for (final Fold fold : folds) {
      final KeyedSeries<Integer> test_labels = labels.slice(fold.test());
      if (test_labels.isEmpty()) {
        LOG.debug("Skipping fold {} of model {} without test labels", 
            fold.index(), name);
        listener.onFoldSkipped(name, fold);
        continue;
      }
      
      narrate("Iteration: {}, Fold: {}, Train size: {}, Test size: {}", 
          iteration, fold.index(), fold.train().size(), fold.test().size());
      listener.onFoldStart(name, fold);
      
      final KeyedSeries<Double> test_features = features.slice(fold.test());
      model.fit(features.slice(fold.train()), labels.slice(fold.train()));
      final KeyedSeries<Integer> predictions = model.predict(test_features);
      if (predictions == null) {
        throw new IllegalDataException("Model " + name 
            + " returned null predictions for fold " + fold.index());
      }
      
      scorePredictions(test_features, predictions, test_labels, metrics);
      listener.onFoldComplete(name, fold, metrics);
      iteration++;
    }
    
    final MetricsReport report = Aggregator.finalizeMetrics(metrics);
    narrate("Model {} finished after {} scored folds: {}", 
        name, iteration, report.getOverall());
    listener.onModelComplete(name, report);
    return report;
  }
  
  /**
   * Validates everything up front so a bad input never leaves a partial
   * evaluation behind.
   */
  private void validateInputs(final KeyedSeries<Double> features,
                              final KeyedSeries<Integer> labels,
                              final List<? extends TrendModel> models,
                              final EvaluationMode mode) {
    if (features == null || features.isEmpty()) {
      throw new InvalidInputException("Features cannot be null or empty.");
    }
    if (labels == null || labels.isEmpty()) {
      throw new InvalidInputException("Labels cannot be null or empty.");
    }
    if (models == null) {
      throw new InvalidInputException("Models cannot be null.");
    }
    if (mode == null) {
      throw new InvalidInputException("Evaluation mode cannot be null.");
    }
    final Set<String> names = Sets.newHashSet();
    final List<String> duplicates = Lists.newArrayList();
    for (final TrendModel model : models) {
      if (model == null) {
        throw new InvalidInputException("Models cannot contain null.");
      }
      if (Strings.isNullOrEmpty(model.getName())) {
        throw new InvalidInputException("Model names cannot be null or "
            + "empty.");
      }
      if (!names.add(model.getName())) {
        duplicates.add(model.getName());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new InvalidInputException("Duplicate model names: " 
          + duplicates);
    }
  }
  
  /** Fold narration is advisory, INFO when verbose and DEBUG otherwise. */
  private void narrate(final String format, final Object... args) {
    if (config.getVerbose()) {
      LOG.info(format, args);
    } else if (LOG.isDebugEnabled()) {
      LOG.debug(format, args);
    }
  }
}
