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
package net.trendeval.config;

import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.trendeval.exceptions.InvalidInputException;
import net.trendeval.utils.YAML;

/**
 * Settings for an evaluation run. All fields are optional and defaulted so
 * an empty YAML document yields a usable config. Build one with
 * {@link #newBuilder()} or load it with {@link #parse(String)}.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = EvaluationConfig.Builder.class)
public class EvaluationConfig {
  public static final String DEFAULT_LABEL_COL = "label";
  public static final String DEFAULT_PREDICTION_COL = "prediction";
  public static final String DEFAULT_VALUE_COL = "value";
  public static final int DEFAULT_WINDOW_SIZE = 3;
  public static final int DEFAULT_TRAIN_PERCENT = 70;
  
  /** Column alias for the ground truth labels. */
  private final String label_col_name;
  
  /** Column alias for the model's predictions. */
  private final String prediction_col_name;
  
  /** Column alias for the raw series values. */
  private final String value_col_name;
  
  /** How many buckets a prediction may sit from its event. */
  private final int window_size_for_metrics;
  
  /** Percentage of dates used for training in percent split mode. */
  private final int train_percent;
  
  /** The number of CV folds, null to derive from the date count. */
  private final Integer n_splits;
  
  /** Whether or not to narrate folds at INFO. */
  private final boolean verbose;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder to pull values from.
   */
  protected EvaluationConfig(final Builder builder) {
    label_col_name = Strings.isNullOrEmpty(builder.labelColName) 
        ? DEFAULT_LABEL_COL : builder.labelColName;
    prediction_col_name = Strings.isNullOrEmpty(builder.predictionColName)
        ? DEFAULT_PREDICTION_COL : builder.predictionColName;
    value_col_name = Strings.isNullOrEmpty(builder.valueColName) 
        ? DEFAULT_VALUE_COL : builder.valueColName;
    window_size_for_metrics = builder.windowSizeForMetrics;
    train_percent = builder.trainPercent;
    n_splits = builder.nSplits;
    verbose = builder.verbose;
  }
  
  /** @return The label column alias. */
  public String getLabelColName() {
    return label_col_name;
  }
  
  /** @return The prediction column alias. */
  public String getPredictionColName() {
    return prediction_col_name;
  }
  
  /** @return The value column alias. */
  public String getValueColName() {
    return value_col_name;
  }
  
  /** @return The allowed shift, in buckets, between a prediction and an
   * event. */
  public int getWindowSizeForMetrics() {
    return window_size_for_metrics;
  }
  
  /** @return The training percentage for percent split mode. */
  public int getTrainPercent() {
    return train_percent;
  }
  
  /** @return The requested number of CV folds, may be null. */
  @JsonProperty("nSplits")
  public Integer getNSplits() {
    return n_splits;
  }
  
  /** @return Whether or not fold narration is logged at INFO. */
  public boolean getVerbose() {
    return verbose;
  }
  
  /**
   * Validates the config.
   * @throws InvalidInputException if a value is out of range.
   */
  public void validate() {
    if (window_size_for_metrics < 0) {
      throw new InvalidInputException("Window size must be zero or "
          + "greater: " + window_size_for_metrics);
    }
    if (train_percent < 0 || train_percent > 100) {
      throw new InvalidInputException("Train percent must be between 0 "
          + "and 100: " + train_percent);
    }
    if (n_splits != null && n_splits < 1) {
      throw new InvalidInputException("Number of splits must be at least "
          + "1: " + n_splits);
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final EvaluationConfig other = (EvaluationConfig) o;
    return Objects.equal(label_col_name, other.label_col_name) &&
        Objects.equal(prediction_col_name, other.prediction_col_name) &&
        Objects.equal(value_col_name, other.value_col_name) &&
        window_size_for_metrics == other.window_size_for_metrics &&
        train_percent == other.train_percent &&
        Objects.equal(n_splits, other.n_splits) &&
        verbose == other.verbose;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(label_col_name, prediction_col_name, 
        value_col_name, window_size_for_metrics, train_percent, n_splits, 
        verbose);
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("labelColName", label_col_name)
        .add("predictionColName", prediction_col_name)
        .add("valueColName", value_col_name)
        .add("windowSizeForMetrics", window_size_for_metrics)
        .add("trainPercent", train_percent)
        .add("nSplits", n_splits)
        .add("verbose", verbose)
        .toString();
  }
  
  /**
   * Parses and validates a YAML or JSON config.
   * @param yaml A non-null and non-empty document.
   * @return The validated config.
   * @throws IllegalArgumentException if the document could not be parsed.
   * @throws InvalidInputException if a value is out of range.
   */
  public static EvaluationConfig parse(final String yaml) {
    final EvaluationConfig config = 
        YAML.parseToObject(yaml, EvaluationConfig.class);
    config.validate();
    return config;
  }
  
  /**
   * Parses and validates a YAML or JSON config from a stream. The stream 
   * is not closed.
   * @param stream A non-null stream.
   * @return The validated config.
   * @throws IllegalArgumentException if the document could not be parsed.
   * @throws InvalidInputException if a value is out of range.
   */
  public static EvaluationConfig parse(final InputStream stream) {
    final EvaluationConfig config = 
        YAML.parseToObject(stream, EvaluationConfig.class);
    config.validate();
    return config;
  }
  
  /** @return A new builder with defaults set. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * Copies a config into a new builder.
   * @param config A non-null config to pull values from.
   * @return A new builder populated with values from the given config.
   */
  public static Builder newBuilder(final EvaluationConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    return new Builder()
        .setLabelColName(config.label_col_name)
        .setPredictionColName(config.prediction_col_name)
        .setValueColName(config.value_col_name)
        .setWindowSizeForMetrics(config.window_size_for_metrics)
        .setTrainPercent(config.train_percent)
        .setNSplits(config.n_splits)
        .setVerbose(config.verbose);
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder {
    @JsonProperty
    private String labelColName = DEFAULT_LABEL_COL;
    @JsonProperty
    private String predictionColName = DEFAULT_PREDICTION_COL;
    @JsonProperty
    private String valueColName = DEFAULT_VALUE_COL;
    @JsonProperty
    private int windowSizeForMetrics = DEFAULT_WINDOW_SIZE;
    @JsonProperty
    private int trainPercent = DEFAULT_TRAIN_PERCENT;
    @JsonProperty("nSplits")
    private Integer nSplits;
    @JsonProperty
    private boolean verbose;
    
    public Builder setLabelColName(final String label_col_name) {
      labelColName = label_col_name;
      return this;
    }
    
    public Builder setPredictionColName(final String prediction_col_name) {
      predictionColName = prediction_col_name;
      return this;
    }
    
    public Builder setValueColName(final String value_col_name) {
      valueColName = value_col_name;
      return this;
    }
    
    public Builder setWindowSizeForMetrics(final int window_size) {
      windowSizeForMetrics = window_size;
      return this;
    }
    
    public Builder setTrainPercent(final int train_percent) {
      trainPercent = train_percent;
      return this;
    }
    
    public Builder setNSplits(final Integer n_splits) {
      nSplits = n_splits;
      return this;
    }
    
    public Builder setVerbose(final boolean verbose) {
      this.verbose = verbose;
      return this;
    }
    
    public EvaluationConfig build() {
      return new EvaluationConfig(this);
    }
  }
}
