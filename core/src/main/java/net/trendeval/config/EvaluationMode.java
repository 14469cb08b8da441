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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the date axis is partitioned into training and test data.
 * @since 1.0
 */
public enum EvaluationMode {
  /** A single chronological split at a percentage of the dates. */
  PERCENT_SPLIT("percent"),
  
  /** Walk-forward cross validation with an expanding training window. */
  CROSS_VALIDATION("cv");
  
  /** The short name used in config files. */
  private final String name;
  
  EvaluationMode(final String name) {
    this.name = name;
  }
  
  /** @return The short name used in config files. */
  @JsonValue
  public String getName() {
    return name;
  }
  
  /**
   * Matches either the short name or the enum name, ignoring case.
   * @param name The name to find a mode for.
   * @return The mode if found.
   * @throws IllegalArgumentException if the mode wasn't found.
   */
  @JsonCreator
  public static EvaluationMode fromString(final String name) {
    for (final EvaluationMode mode : EvaluationMode.values()) {
      if (mode.name.equalsIgnoreCase(name) || 
          mode.name().equalsIgnoreCase(name)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unrecognized evaluation mode: " 
        + name);
  }
}
