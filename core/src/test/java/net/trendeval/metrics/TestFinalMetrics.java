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
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.trendeval.utils.JSON;

public class TestFinalMetrics {
  private static final double EPSILON = 0.000001;
  
  @Test
  public void fromCounts() throws Exception {
    final FinalMetrics metrics = FinalMetrics.fromCounts(2, 1, 1, 10, 42.5);
    assertEquals(2.0 / 3.0, metrics.getPrecision(), EPSILON);
    assertEquals(2.0 / 3.0, metrics.getRecall(), EPSILON);
    assertEquals(2.0 / 3.0, metrics.getF1(), EPSILON);
    assertEquals(2.0 / 3.0, metrics.getF05(), EPSILON);
    assertEquals(2, metrics.getTruePositives());
    assertEquals(1, metrics.getFalsePositives());
    assertEquals(1, metrics.getFalseNegatives());
    assertEquals(10, metrics.getNumSamples());
    assertEquals(42.5, metrics.getNumValues(), EPSILON);
  }
  
  @Test
  public void fromCountsPrecisionWeighted() throws Exception {
    final FinalMetrics metrics = FinalMetrics.fromCounts(1, 0, 3, 8, 0);
    assertEquals(1.0, metrics.getPrecision(), EPSILON);
    assertEquals(0.25, metrics.getRecall(), EPSILON);
    assertEquals(0.4, metrics.getF1(), EPSILON);
    assertEquals(0.625, metrics.getF05(), EPSILON);
  }
  
  @Test
  public void fromCountsAllZero() throws Exception {
    final FinalMetrics metrics = FinalMetrics.fromCounts(0, 0, 0, 0, 0);
    assertEquals(0, metrics.getPrecision(), EPSILON);
    assertEquals(0, metrics.getRecall(), EPSILON);
    assertEquals(0, metrics.getF1(), EPSILON);
    assertEquals(0, metrics.getF05(), EPSILON);
  }
  
  @Test
  public void fromCountsNoMatches() throws Exception {
    // both ratios have a non-zero denominator but the F score does not
    final FinalMetrics metrics = FinalMetrics.fromCounts(0, 4, 2, 6, 0);
    assertEquals(0, metrics.getPrecision(), EPSILON);
    assertEquals(0, metrics.getRecall(), EPSILON);
    assertEquals(0, metrics.getF1(), EPSILON);
    assertEquals(0, metrics.getF05(), EPSILON);
  }
  
  @Test
  public void fromAccumulator() throws Exception {
    final CategoryMetrics accumulator = new CategoryMetrics()
        .add(new MatchResult(3, 1, 0))
        .addSamples(7, 12.0);
    final FinalMetrics metrics = FinalMetrics.fromAccumulator(accumulator);
    assertEquals(0.75, metrics.getPrecision(), EPSILON);
    assertEquals(1.0, metrics.getRecall(), EPSILON);
    assertEquals(7, metrics.getNumSamples());
    assertEquals(12.0, metrics.getNumValues(), EPSILON);
  }
  
  @Test
  public void ratio() throws Exception {
    assertEquals(0.5, FinalMetrics.ratio(1, 2), EPSILON);
    assertEquals(0, FinalMetrics.ratio(0, 0), EPSILON);
    assertEquals(0, FinalMetrics.ratio(5, 0), EPSILON);
  }
  
  @Test
  public void fScore() throws Exception {
    assertEquals(0.5, FinalMetrics.fScore(0.5, 0.5, 1.0), EPSILON);
    assertEquals(0, FinalMetrics.fScore(0, 0, 0.5), EPSILON);
    // beta 2 favors recall
    assertEquals(5.0 / 6.0, FinalMetrics.fScore(0.5, 1.0, 2.0), EPSILON);
  }
  
  @Test
  public void serialize() throws Exception {
    final String json = JSON.serializeToString(
        FinalMetrics.fromCounts(1, 0, 0, 3, 2));
    assertTrue(json.startsWith("{\"precision\":1.0,\"recall\":1.0,"));
    assertTrue(json.contains("\"f0.5\":1.0"));
    assertTrue(json.contains("\"tp\":1"));
    assertTrue(json.contains("\"numSamples\":3"));
    assertTrue(json.contains("\"numValues\":2.0"));
  }
}
