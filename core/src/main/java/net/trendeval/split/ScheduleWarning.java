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

import com.google.common.base.MoreObjects;

/**
 * A recoverable problem with a requested split schedule. The schedule was
 * adjusted and evaluation continues.
 * 
 * @since 1.0
 */
public final class ScheduleWarning {

  public static enum Type {
    /** More folds were requested than there are dates. */
    SPLITS_CLAMPED,
  }
  
  private final Type type;
  private final int requested;
  private final int applied;
  private final String message;
  
  /**
   * Default ctor.
   * @param type The non-null type of warning.
   * @param requested The requested number of splits.
   * @param applied The number of splits actually used.
   * @param message A human readable description.
   */
  public ScheduleWarning(final Type type, 
                         final int requested, 
                         final int applied, 
                         final String message) {
    this.type = type;
    this.requested = requested;
    this.applied = applied;
    this.message = message;
  }
  
  /** @return The type of warning. */
  public Type getType() {
    return type;
  }
  
  /** @return The requested number of splits. */
  public int getRequested() {
    return requested;
  }
  
  /** @return The number of splits actually used. */
  public int getApplied() {
    return applied;
  }
  
  /** @return A human readable description. */
  public String getMessage() {
    return message;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("type", type)
        .add("requested", requested)
        .add("applied", applied)
        .add("message", message)
        .toString();
  }
}
