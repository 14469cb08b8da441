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
package net.trendeval.join;

import com.google.common.base.MoreObjects;

import net.trendeval.data.SeriesKey;

/**
 * A single joined row: the prediction for a key with the label and raw 
 * value found at the same key.
 * 
 * @since 1.0
 */
public final class AlignedRow {
  private final SeriesKey key;
  private final int prediction;
  private final int label;
  
  /** The raw value, null when the key had no value. */
  private final Double value;
  
  /**
   * Default ctor.
   * @param key The non-null key.
   * @param prediction The prediction at the key.
   * @param label The label at the key, 0 if none was present.
   * @param value The raw value at the key, may be null.
   */
  public AlignedRow(final SeriesKey key, 
                    final int prediction, 
                    final int label, 
                    final Double value) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null.");
    }
    this.key = key;
    this.prediction = prediction;
    this.label = label;
    this.value = value;
  }
  
  public SeriesKey key() {
    return key;
  }
  
  public int prediction() {
    return prediction;
  }
  
  public int label() {
    return label;
  }
  
  /** @return The raw value or null if the key had none. */
  public Double value() {
    return value;
  }
  
  /** @return True if the model flagged an event at this key. */
  public boolean isPredictedEvent() {
    return prediction != 0;
  }
  
  /** @return True if the ground truth has an event at this key. */
  public boolean isActualEvent() {
    return label != 0;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("key", key)
        .add("prediction", prediction)
        .add("label", label)
        .add("value", value)
        .toString();
  }
}
