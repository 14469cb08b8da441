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

import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;

import net.trendeval.exceptions.InvalidInputException;

/**
 * Partitions a date axis into chronological train/test folds. Both modes
 * are pure functions of the dates; nothing is shuffled.
 * <p>
 * The cross validation mode walks forward with an expanding training 
 * window: for {@code n} dates and {@code k} splits, each test block holds
 * {@code n / (k + 1)} dates, the last block ends at the last date and each
 * fold trains on every date before its test block. Leading dates that do
 * not divide evenly only ever appear in training sets.
 * 
 * @since 1.0
 */
public final class Splitter {
  private static final Logger LOG = LoggerFactory.getLogger(Splitter.class);
  
  private Splitter() {
  }
  
  /**
   * Splits the dates once, training on the first {@code train_percent} of
   * them (rounded down) and testing on the rest.
   * @param dates The non-null, non-empty date axis. Sorted and de-duplicated
   * if not already.
   * @param train_percent The percentage of dates to train on, 0 to 100.
   * @return A single fold with index 0.
   * @throws InvalidInputException if the dates were null or empty or the
   * percentage was out of range.
   */
  public static Fold splitPercent(final Collection<Long> dates, 
                                  final int train_percent) {
    final List<Long> sorted = sortedDates(dates);
    if (train_percent < 0 || train_percent > 100) {
      throw new InvalidInputException("Train percent must be between 0 "
          + "and 100: " + train_percent);
    }
    final int cut = (int) ((long) sorted.size() * train_percent / 100);
    return new Fold(0, sorted.subList(0, cut), 
        sorted.subList(cut, sorted.size()));
  }
  
  /**
   * Builds an expanding window cross validation schedule.
   * @param dates The non-null, non-empty date axis. Sorted and de-duplicated
   * if not already.
   * @param n_splits The number of folds or null to use half the number of
   * dates. A value larger than the number of dates is clamped to half the
   * number of dates and a {@link ScheduleWarning} is attached to the 
   * schedule.
   * @return The schedule with folds in chronological order.
   * @throws InvalidInputException if the dates were null or empty, the
   * requested splits were less than 1 or there are too few dates for the 
   * effective number of splits.
   */
  public static SplitSchedule splitCv(final Collection<Long> dates, 
                                      final Integer n_splits) {
    final List<Long> sorted = sortedDates(dates);
    final int num_dates = sorted.size();
    final List<ScheduleWarning> warnings = Lists.newArrayList();
    
    int splits;
    if (n_splits == null) {
      splits = num_dates / 2;
      LOG.debug("No split count given, running {} splits", splits);
    } else if (n_splits < 1) {
      throw new InvalidInputException("Number of splits must be at least 1: " 
          + n_splits);
    } else {
      splits = n_splits;
    }
    
    if (splits > num_dates) {
      final int clamped = num_dates / 2;
      final String message = "Number of splits (" + splits 
          + ") cannot be larger than the number of dates (" + num_dates 
          + "). Reducing splits to " + clamped;
      LOG.warn(message);
      warnings.add(new ScheduleWarning(ScheduleWarning.Type.SPLITS_CLAMPED, 
          splits, clamped, message));
      splits = clamped;
    }
    
    if (splits < 1) {
      throw new InvalidInputException("Not enough dates (" + num_dates 
          + ") for cross validation.");
    }
    final int test_size = num_dates / (splits + 1);
    if (test_size < 1) {
      throw new InvalidInputException("Cannot run " + splits 
          + " splits over " + num_dates + " dates.");
    }
    
    final List<Fold> folds = Lists.newArrayListWithCapacity(splits);
    for (int i = 0; i < splits; i++) {
      final int test_start = num_dates - (splits - i) * test_size;
      folds.add(new Fold(i, sorted.subList(0, test_start), 
          sorted.subList(test_start, test_start + test_size)));
    }
    return new SplitSchedule(folds, warnings);
  }
  
  private static List<Long> sortedDates(final Collection<Long> dates) {
    if (dates == null || dates.isEmpty()) {
      throw new InvalidInputException("Dates cannot be null or empty.");
    }
    return ImmutableSortedSet.copyOf(dates).asList();
  }
}
