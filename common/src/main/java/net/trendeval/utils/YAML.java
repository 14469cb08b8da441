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
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Static holder for a YAML configured Jackson mapper. Evaluation configs
 * are usually kept as YAML files next to the datasets they describe, so
 * this class only offers the read side plus a string writer for
 * round-tripping configs in logs.
 * <p>
 * Parsing problems with the document itself surface as
 * {@link IllegalArgumentException}s. I/O failures are wrapped in
 * {@link YAMLException}.
 * @since 1.0
 */
public final class YAML {
  /** The shared, thread safe mapper. */
  private static final ObjectMapper MAPPER = 
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  private YAML() {
  }
  
  /**
   * Deserializes a YAML formatted string to a specific class type.
   * @param yaml The string to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or 
   * parsing failed.
   * @throws YAMLException if the data could not be read.
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final String yaml, 
                                    final Class<T> pojo) {
    if (yaml == null || yaml.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(yaml, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }
  
  /**
   * Deserializes a YAML formatted input stream to a specific class type.
   * The stream is not closed.
   * @param stream The stream to deserialize.
   * @param pojo The class type of the object used for deserialization.
   * @return An object of the {@code pojo} type.
   * @throws IllegalArgumentException if the data or class was null or 
   * parsing failed.
   * @throws YAMLException if the data could not be read.
   * @param <T> The type of object to parse to.
   */
  public static <T> T parseToObject(final InputStream stream, 
                                    final Class<T> pojo) {
    if (stream == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return MAPPER.readValue(stream, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }
  
  /**
   * Serializes the given object to a YAML string.
   * @param object The object to serialize.
   * @return A YAML formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws YAMLException if the object could not be serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (IOException e) {
      throw new YAMLException(e);
    }
  }
  
  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
