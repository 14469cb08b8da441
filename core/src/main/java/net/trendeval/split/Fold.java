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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * One train/test partition of the date axis. Every test date is later than
 * every train date.
 * 
 * @since 1.0
 */
public final class Fold {
  
  /** The zero based, chronological index of this fold. */
  private final int index;
  
  /** The sorted training dates. */
  private final List<Long> train;
  
  /** The sorted test dates. */
  private final List<Long> test;
  
  /**
   * Package private ctor.
   * @param index The fold index.
   * @param train The sorted training dates.
   * @param test The sorted test dates.
   */
  Fold(final int index, final List<Long> train, final List<Long> test) {
    this.index = index;
    this.train = ImmutableList.copyOf(train);
    this.test = ImmutableList.copyOf(test);
  }
  
  /** @return The zero based, chronological index of this fold. */
  public int index() {
    return index;
  }
  
  /** @return The sorted, immutable training dates. */
  public List<Long> train() {
    return train;
  }
  
  /** @return The sorted, immutable test dates. */
  public List<Long> test() {
    return test;
  }
  
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("index", index)
        .add("trainSize", train.size())
        .add("testSize", test.size())
        .toString();
  }
}
