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
package net.trendeval.metrics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.trendeval.data.SeriesKey;
import net.trendeval.join.AlignedRow;

public class TestShiftMatcher {
  
  /** Builds a sequence of the given length with events at the indices. */
  private static int[] events(final int length, final int... indices) {
    final int[] sequence = new int[length];
    for (final int index : indices) {
      sequence[index] = 1;
    }
    return sequence;
  }
  
  private static void assertCounts(final int tp, final int fp, final int fn, 
      final MatchResult result) {
    assertEquals(new MatchResult(tp, fp, fn), result);
  }
  
  @Test
  public void matchWithinWindow() throws Exception {
    final int[] actual = events(10, 2, 5, 8);
    final int[] predicted = events(10, 2, 6, 8);
    assertCounts(3, 0, 0, ShiftMatcher.match(predicted, actual, 1));
  }
  
  @Test
  public void matchExactOnly() throws Exception {
    final int[] actual = events(10, 2, 5, 8);
    final int[] predicted = events(10, 2, 6, 8);
    assertCounts(2, 1, 1, ShiftMatcher.match(predicted, actual, 0));
  }
  
  @Test
  public void matchPerfect() throws Exception {
    final int[] sequence = events(12, 0, 3, 4, 11);
    for (int window = 0; window < 5; window++) {
      assertCounts(4, 0, 0, ShiftMatcher.match(sequence, sequence, window));
    }
  }
  
  @Test
  public void matchTolerance() throws Exception {
    final int[] predicted = events(10, 3);
    assertCounts(1, 0, 0, ShiftMatcher.match(predicted, events(10, 5), 2));
    assertCounts(0, 1, 1, ShiftMatcher.match(predicted, events(10, 6), 2));
  }
  
  @Test
  public void matchOneToOne() throws Exception {
    // a single prediction cannot satisfy two events
    final int[] predicted = events(10, 5);
    final int[] actual = events(10, 4, 6);
    assertCounts(1, 0, 1, ShiftMatcher.match(predicted, actual, 2));
  }
  
  @Test
  public void matchClosestFirst() throws Exception {
    // prediction 4 is closer to the event than prediction 1
    final int[] predicted = events(10, 1, 4);
    final int[] actual = events(10, 3);
    assertCounts(1, 1, 0, ShiftMatcher.match(predicted, actual, 3));
    
    final MatchResult result = ShiftMatcher.match(
        events(10, 3, 7), events(10, 2, 6), 1);
    assertCounts(2, 0, 0, result);
  }
  
  @Test
  public void matchLeftmostOnTie() throws Exception {
    // actual 4 takes prediction 3 leaving 5 for actual 6
    final int[] predicted = events(10, 3, 5);
    final int[] actual = events(10, 4, 6);
    assertCounts(2, 0, 0, ShiftMatcher.match(predicted, actual, 1));
  }
  
  @Test
  public void matchNoActualEvents() throws Exception {
    assertCounts(0, 3, 0, 
        ShiftMatcher.match(events(8, 1, 2, 7), new int[8], 2));
  }
  
  @Test
  public void matchNoPredictedEvents() throws Exception {
    assertCounts(0, 0, 2, 
        ShiftMatcher.match(new int[8], events(8, 0, 7), 2));
  }
  
  @Test
  public void matchEmpty() throws Exception {
    assertCounts(0, 0, 0, ShiftMatcher.match(new int[0], new int[0], 3));
  }
  
  @Test
  public void matchWindowLargerThanSequence() throws Exception {
    assertCounts(2, 0, 0, ShiftMatcher.match(events(5, 0, 1), 
        events(5, 3, 4), Integer.MAX_VALUE));
  }
  
  @Test
  public void matchNonZeroIsEvent() throws Exception {
    final int[] predicted = new int[] { 0, -1, 0, 2 };
    final int[] actual = new int[] { -1, 0, 0, 1 };
    assertCounts(2, 0, 0, ShiftMatcher.match(predicted, actual, 1));
  }
  
  @Test
  public void matchBadArguments() throws Exception {
    try {
      ShiftMatcher.match(null, new int[1], 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      ShiftMatcher.match(new int[1], null, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      ShiftMatcher.match(new int[2], new int[3], 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      ShiftMatcher.match(new int[2], new int[2], -1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void matchRows() throws Exception {
    final List<AlignedRow> rows = Lists.newArrayList(
        new AlignedRow(new SeriesKey(1L, "a"), 0, 1, 4.0),
        new AlignedRow(new SeriesKey(2L, "a"), 1, 0, 2.5),
        new AlignedRow(new SeriesKey(3L, "a"), 1, 0, null));
    assertCounts(1, 1, 0, ShiftMatcher.match(rows, 1));
    assertCounts(0, 2, 1, ShiftMatcher.match(rows, 0));
  }
  
  @Test
  public void accumulate() throws Exception {
    final List<AlignedRow> rows = Lists.newArrayList(
        new AlignedRow(new SeriesKey(1L, "a"), 0, 1, 4.0),
        new AlignedRow(new SeriesKey(2L, "a"), 1, 0, 2.5),
        new AlignedRow(new SeriesKey(3L, "a"), 1, 0, null),
        new AlignedRow(new SeriesKey(4L, "a"), 0, 0, Double.NaN));
    final CategoryMetrics metrics = new CategoryMetrics();
    
    assertCounts(1, 1, 0, ShiftMatcher.accumulate(rows, 1, metrics));
    assertCounts(1, 1, 0, ShiftMatcher.accumulate(rows, 1, metrics));
    assertEquals(2, metrics.truePositives());
    assertEquals(2, metrics.falsePositives());
    assertEquals(0, metrics.falseNegatives());
    assertEquals(8, metrics.numSamples());
    assertEquals(13.0, metrics.numValues(), 0.0001);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void accumulateNullMetrics() throws Exception {
    ShiftMatcher.accumulate(Lists.<AlignedRow>newArrayList(), 1, null);
  }
}
