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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.util.HashMap;
import java.util.HashSet;

import org.junit.Test;

import com.fasterxml.jackson.core.JsonParser;

public final class TestYAML {

  @Test
  public void getMapperNotNull() {
    assertNotNull(YAML.getMapper());
    assertTrue(YAML.getMapper().isEnabled(JsonParser.Feature.ALLOW_COMMENTS));
  }
  
  @Test
  @SuppressWarnings("unchecked")
  public void parseToObjectString() throws Exception {
    final HashMap<String, Object> map = YAML.parseToObject(
        "# window in buckets\nwindowSizeForMetrics: 2\nlabelColName: truth", 
        HashMap.class);
    assertEquals(2, map.get("windowSizeForMetrics"));
    assertEquals("truth", map.get("labelColName"));
  }
  
  @Test
  @SuppressWarnings("unchecked")
  public void parseToObjectStream() throws Exception {
    final HashMap<String, Object> map = YAML.parseToObject(
        new ByteArrayInputStream("verbose: true".getBytes("UTF-8")), 
        HashMap.class);
    assertEquals(true, map.get("verbose"));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectStringNull() throws Exception {
    YAML.parseToObject((String) null, HashMap.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectStringEmpty() throws Exception {
    YAML.parseToObject("", HashMap.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectStreamNull() throws Exception {
    YAML.parseToObject((ByteArrayInputStream) null, HashMap.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectMissingClass() throws Exception {
    YAML.parseToObject("a: b", (Class<HashMap>) null);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectBadMap() throws Exception {
    YAML.parseToObject("a: b\nc: d", HashSet.class);
  }
  
  @Test
  public void serializeToString() throws Exception {
    final HashMap<String, Object> map = new HashMap<String, Object>();
    map.put("trainPercent", 70);
    assertTrue(YAML.serializeToString(map).contains("trainPercent: 70"));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void serializeToStringNull() throws Exception {
    YAML.serializeToString(null);
  }
}
