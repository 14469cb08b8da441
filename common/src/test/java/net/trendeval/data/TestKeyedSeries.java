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
package net.trendeval.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map.Entry;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import net.trendeval.exceptions.IllegalDataException;

public class TestKeyedSeries {
  private static final long BASE_TIME = 1356998400L;
  
  @Test
  public void putAndGet() throws Exception {
    final KeyedSeries<Double> series = KeyedSeries.newSeries();
    assertTrue(series.isEmpty());
    series.put(BASE_TIME, "a", 42.5)
          .put(new SeriesKey(BASE_TIME + 60, "a"), 24.0);
    
    assertEquals(2, series.size());
    assertFalse(series.isEmpty());
    assertEquals(42.5, series.get(BASE_TIME, "a"), 0.0001);
    assertEquals(24.0, series.get(new SeriesKey(BASE_TIME + 60, "a")), 
        0.0001);
    assertTrue(series.containsKey(new SeriesKey(BASE_TIME, "a")));
    assertNull(series.get(BASE_TIME, "b"));
  }
  
  @Test
  public void putDuplicateKey() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME, "a", 1);
    try {
      series.put(BASE_TIME, "a", 0);
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    assertEquals(1, series.size());
    assertEquals(1, (int) series.get(BASE_TIME, "a"));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void putNullValue() throws Exception {
    KeyedSeries.<Integer>newSeries().put(BASE_TIME, "a", null);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void putNullKey() throws Exception {
    KeyedSeries.<Integer>newSeries().put(null, 1);
  }
  
  @Test
  public void iterationIsSorted() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME + 60, "b", 3)
          .put(BASE_TIME, "z", 2)
          .put(BASE_TIME, "a", 1);
    
    final Iterator<Entry<SeriesKey, Integer>> iterator = series.iterator();
    assertEquals(new SeriesKey(BASE_TIME, "a"), iterator.next().getKey());
    assertEquals(new SeriesKey(BASE_TIME, "z"), iterator.next().getKey());
    assertEquals(new SeriesKey(BASE_TIME + 60, "b"), 
        iterator.next().getKey());
    assertFalse(iterator.hasNext());
  }
  
  @Test
  public void datesAndCategories() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME + 120, "b", 0)
          .put(BASE_TIME, "c", 0)
          .put(BASE_TIME, "a", 0)
          .put(BASE_TIME + 60, "a", 0);
    
    assertEquals(Arrays.asList(BASE_TIME, BASE_TIME + 60, BASE_TIME + 120), 
        Arrays.asList(series.dates().toArray()));
    assertEquals(Arrays.asList("a", "b", "c"), 
        Arrays.asList(series.categories().toArray()));
    
    assertTrue(KeyedSeries.newSeries().dates().isEmpty());
    assertTrue(KeyedSeries.newSeries().categories().isEmpty());
  }
  
  @Test
  public void slice() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME, "a", 1)
          .put(BASE_TIME, "b", 2)
          .put(BASE_TIME + 60, "a", 3)
          .put(BASE_TIME + 120, "a", 4);
    
    KeyedSeries<Integer> slice = series.slice(
        Arrays.asList(BASE_TIME, BASE_TIME + 120, BASE_TIME + 999));
    assertEquals(3, slice.size());
    assertEquals(1, (int) slice.get(BASE_TIME, "a"));
    assertEquals(2, (int) slice.get(BASE_TIME, "b"));
    assertEquals(4, (int) slice.get(BASE_TIME + 120, "a"));
    assertNull(slice.get(BASE_TIME + 60, "a"));
    
    slice = series.slice(ImmutableSet.of(BASE_TIME + 60));
    assertEquals(1, slice.size());
    
    assertTrue(series.slice(Collections.<Long>emptyList()).isEmpty());
    // source untouched
    assertEquals(4, series.size());
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void sliceNull() throws Exception {
    KeyedSeries.<Integer>newSeries().slice(null);
  }
  
  @Test
  public void forCategory() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME + 60, "a", 3)
          .put(BASE_TIME, "b", 2)
          .put(BASE_TIME, "a", 1);
    
    final KeyedSeries<Integer> a = series.forCategory("a");
    assertEquals(2, a.size());
    final Iterator<Entry<SeriesKey, Integer>> iterator = a.iterator();
    assertEquals(1, (int) iterator.next().getValue());
    assertEquals(3, (int) iterator.next().getValue());
    
    assertTrue(series.forCategory("nosuchcategory").isEmpty());
  }
  
  @Test (expected = UnsupportedOperationException.class)
  public void entriesUnmodifiable() throws Exception {
    final KeyedSeries<Integer> series = KeyedSeries.newSeries();
    series.put(BASE_TIME, "a", 1);
    series.entries().put(new SeriesKey(BASE_TIME, "a"), 2);
  }
}
