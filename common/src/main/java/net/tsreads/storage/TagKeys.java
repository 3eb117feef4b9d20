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
 * The tag keys of a measurement as returned by the engine's index.
 * 
 * @since 1.0
 */
public class TagKeys {
  
  private final String measurement;
  
  private final List<String> keys;
  
  public TagKeys(final String measurement, final List<String> keys) {
    if (keys == null) {
      throw new IllegalArgumentException("Keys cannot be null.");
    }
    this.measurement = measurement;
    this.keys = ImmutableList.copyOf(keys);
  }
  
  /** @return The measurement name. */
  public String measurement() {
    return measurement;
  }
  
  /** @return The keys, possibly unsorted and with duplicates across 
   * measurements. */
  public List<String> keys() {
    return keys;
  }
}
