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
package net.tsreads.storage;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The tag key and value pairs of a measurement as returned by the engine's
 * index.
 * 
 * @since 1.0
 */
public class TagValues {
  
  private final String measurement;
  
  private final List<KeyValue> values;
  
  public TagValues(final String measurement, final List<KeyValue> values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.measurement = measurement;
    this.values = ImmutableList.copyOf(values);
  }
  
  /** @return The measurement name. */
  public String measurement() {
    return measurement;
  }
  
  /** @return The key value pairs. */
  public List<KeyValue> values() {
    return values;
  }
  
  /** A tag key and one of its values. */
  public static class KeyValue {
    private final String key;
    private final String value;
    
    public KeyValue(final String key, final String value) {
      this.key = key;
      this.value = value;
    }
    
    public String key() {
      return key;
    }
    
    public String value() {
      return value;
    }
  }
}
