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
package net.tsreads.data;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSortedMap;

/**
 * The sorted tag set of a series. Includes the engine's measurement and
 * field entries when the storage engine provides them.
 * 
 * @since 1.0
 */
public class SeriesTags {
  
  /** An empty tag set. */
  public static final SeriesTags EMPTY = new SeriesTags(
      ImmutableSortedMap.<String, String>of());
  
  private final ImmutableSortedMap<String, String> tags;
  
  private SeriesTags(final ImmutableSortedMap<String, String> tags) {
    this.tags = tags;
  }
  
  /**
   * @param tags A non-null map of tag keys to values.
   * @return A sorted, immutable copy of the tags.
   */
  public static SeriesTags of(final Map<String, String> tags) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    return new SeriesTags(ImmutableSortedMap.copyOf(tags));
  }
  
  /**
   * @param key A non-null tag key.
   * @return The tag value or an empty string if the key is not present.
   */
  public String get(final String key) {
    final String value = tags.get(key);
    return value == null ? "" : value;
  }
  
  /**
   * @param key A non-null tag key.
   * @return True if the key is present.
   */
  public boolean has(final String key) {
    return tags.containsKey(key);
  }
  
  /** @return The sorted tag keys. */
  public Set<String> keys() {
    return tags.keySet();
  }
  
  /** @return The number of tags. */
  public int size() {
    return tags.size();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesTags)) {
      return false;
    }
    return tags.equals(((SeriesTags) o).tags);
  }
  
  @Override
  public int hashCode() {
    return tags.hashCode();
  }
  
  @Override
  public String toString() {
    return tags.toString();
  }
}
