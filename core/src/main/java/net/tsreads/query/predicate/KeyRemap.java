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
package net.tsreads.query.predicate;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import net.tsreads.common.Const;

/**
 * An immutable table mapping wire level tag keys to the storage engine's
 * internal key names. Keys without an entry pass through unchanged.
 * 
 * @since 1.0
 */
public final class KeyRemap {
  
  /** Maps the measurement references to {@code _name} and the field key
   * marker to {@code _field}. */
  public static final KeyRemap MEASUREMENT = new KeyRemap(
      ImmutableMap.of(
          Const.MEASUREMENT_KEY, Const.NAME_KEY,
          Const.MEASUREMENT_TAG_KEY, Const.NAME_KEY,
          Const.FIELD_KEY_TAG_KEY, Const.FIELD_KEY));
  
  /** Leaves every key alone. */
  public static final KeyRemap IDENTITY = new KeyRemap(
      ImmutableMap.<String, String>of());
  
  private final ImmutableMap<String, String> mapping;
  
  private KeyRemap(final ImmutableMap<String, String> mapping) {
    this.mapping = mapping;
  }
  
  /**
   * @param mapping A non-null map of wire keys to internal keys.
   * @return A remap table over a copy of the map.
   */
  public static KeyRemap of(final Map<String, String> mapping) {
    if (mapping == null) {
      throw new IllegalArgumentException("Mapping cannot be null.");
    }
    return new KeyRemap(ImmutableMap.copyOf(mapping));
  }
  
  /**
   * @param key The wire key.
   * @return The internal key or the key itself if there isn't a mapping.
   */
  public String remap(final String key) {
    final String mapped = mapping.get(key);
    return mapped == null ? key : mapped;
  }
  
  @Override
  public String toString() {
    return mapping.toString();
  }
}
