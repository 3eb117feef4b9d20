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

import java.util.Arrays;

/**
 * An opaque, typed payload as carried by read requests. The type URL names
 * the message encoded in the value bytes.
 * 
 * @since 1.0
 */
public class Envelope {
  
  /** The type of the encoded message. */
  private final String type_url;
  
  /** The encoded message. */
  private final byte[] value;
  
  /**
   * Default ctor.
   * @param type_url A non-null type URL.
   * @param value The non-null encoded payload.
   * @throws IllegalArgumentException if either argument was null.
   */
  public Envelope(final String type_url, final byte[] value) {
    if (type_url == null) {
      throw new IllegalArgumentException("Type URL cannot be null.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    this.type_url = type_url;
    this.value = value;
  }
  
  /** @return The type URL. */
  public String typeUrl() {
    return type_url;
  }
  
  /** @return The encoded payload. Do not modify. */
  public byte[] value() {
    return value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Envelope)) {
      return false;
    }
    final Envelope other = (Envelope) o;
    return type_url.equals(other.type_url) && Arrays.equals(value, other.value);
  }
  
  @Override
  public int hashCode() {
    return 31 * type_url.hashCode() + Arrays.hashCode(value);
  }
}
