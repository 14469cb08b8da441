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
package net.trendeval.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableMap;

public final class TestJSON {

  @Test
  public void getMapperNotNull() {
    assertNotNull(JSON.getMapper());
  }
  
  @Test
  public void serializeNonNumerics() throws Exception {
    final Map<String, Double> map = ImmutableMap.of("recall", Double.NaN);
    assertEquals("{\"recall\":NaN}", JSON.serializeToString(map));
    
    final Map<String, Double> parsed = JSON.parseToObject(
        "{\"recall\":NaN,\"precision\":0.5}", 
        new TypeReference<Map<String, Double>>() { });
    assertTrue(Double.isNaN(parsed.get("recall")));
    assertEquals(0.5, parsed.get("precision"), 0.0001);
  }
  
  @Test
  @SuppressWarnings("unchecked")
  public void parseToObjectString() throws Exception {
    final HashMap<String, Object> map = JSON.parseToObject(
        "{\"model\":\"stl\",\"f1\":0.75}", HashMap.class);
    assertEquals("stl", map.get("model"));
    assertEquals(0.75, (Double) map.get("f1"), 0.0001);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectStringNull() throws Exception {
    JSON.parseToObject((String) null, HashMap.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectStringBad() throws Exception {
    JSON.parseToObject("{\"model\":\"stl\"", HashMap.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectBadMap() throws Exception {
    JSON.parseToObject("{\"model\":\"stl\"}", HashSet.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectTypeNull() throws Exception {
    JSON.parseToObject("{}", (TypeReference<Map<String, Double>>) null);
  }
  
  @Test
  public void serializeToBytes() throws Exception {
    assertArrayEquals("{\"tp\":3}".getBytes("UTF-8"), 
        JSON.serializeToBytes(ImmutableMap.of("tp", 3)));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void serializeToStringNull() throws Exception {
    JSON.serializeToString(null);
  }
}
