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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static holder for the JSON configured Jackson mapper used to serialize
 * evaluation reports and to read JSON configs. The mapper is thread safe 
 * and expensive to build so it's shared.
 * <p>
 * Metrics may legitimately be NaN for categories without a value column 
 * so non-numeric numbers are allowed on both read and write.
 * @since 1.0
 */
public final class JSON {
  /** The shared, thread safe mapper. */
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonGenerator.Feature.QUOTE_NON_NUMERIC_NUMBERS, false);
  }
  
  private JSON() {
  }
  
  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or 
   * parsing failed.
   * @throws JSONException if the data could not be read.
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String json, 
                                    final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Deserializes a JSON formatted string to a complex type.
   * @param json The string to deserialize.
   * @param type A type definition for a complex object.
   * @return An object of the given type.
   * @throws IllegalArgumentException if the data or type was null or 
   * parsing failed.
   * @throws JSONException if the data could not be read.
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String json, 
                                    final TypeReference<T> type) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (type == null) {
      throw new IllegalArgumentException("Missing type reference");
    }
    try {
      return MAPPER.readValue(json, type);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON byte array.
   * @param object The object to serialize.
   * @return A JSON formatted byte array.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static byte[] serializeToBytes(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsBytes(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }
  
  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
