// This file is part of TSReads.
// Copyright (C) 2021  The TSReads Authors.
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
package net.tsreads.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;

/**
 * Shared Jackson mapper with a few helpers that convert Jackson's checked 
 * exceptions into {@link IllegalArgumentException}s.
 */
public final class JSON {
  
  /** Thread safe once configured. */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, 
        false);
  }
  
  private JSON() { }
  
  /**
   * Deserializes a JSON byte array into the given class.
   * @param json The bytes to parse.
   * @param pojo The class to parse into.
   * @return The object.
   * @throws IllegalArgumentException if the data was null or empty or 
   * could not be parsed.
   */
  public static <T> T parseToObject(final byte[] json, final Class<T> pojo) {
    if (json == null || json.length < 1) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /**
   * Deserializes a JSON string into the given class.
   * @param json The string to parse.
   * @param pojo The class to parse into.
   * @return The object.
   * @throws IllegalArgumentException if the data was null or empty or 
   * could not be parsed.
   */
  public static <T> T parseToObject(final String json, final Class<T> pojo) {
    if (Strings.isNullOrEmpty(json)) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /**
   * @param object The object to serialize.
   * @return The UTF-8 JSON bytes.
   * @throws IllegalArgumentException if the object was null or could not
   * be serialized.
   */
  public static byte[] serializeToBytes(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsBytes(object);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /**
   * @param object The object to serialize.
   * @return The JSON string.
   * @throws IllegalArgumentException if the object was null or could not
   * be serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
