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

import com.google.common.base.Strings;

/**
 * Helpers for the unsigned 64 bit identifiers used for organizations and 
 * buckets. IDs are rendered as 16 lower case hex digits, zero padded.
 * 
 * @since 1.0
 */
public final class Ids {
  
  /** Length of a rendered ID. */
  public static final int ID_LENGTH = 16;
  
  private Ids() {
    // static only
  }
  
  /**
   * Renders the unsigned ID as a zero padded hex string.
   * @param id The ID, treated as unsigned.
   * @return A 16 character hex string.
   */
  public static String toHex(final long id) {
    return Strings.padStart(Long.toHexString(id), ID_LENGTH, '0');
  }
  
  /**
   * Parses a hex encoded ID.
   * @param hex A non-null hex string of exactly 16 characters.
   * @return The ID as a long, possibly negative if the high bit was set.
   * @throws IllegalArgumentException if the string was null, of the wrong
   * length or not hex.
   */
  public static long fromHex(final String hex) {
    if (Strings.isNullOrEmpty(hex)) {
      throw new IllegalArgumentException("ID cannot be null or empty.");
    }
    if (hex.length() != ID_LENGTH) {
      throw new IllegalArgumentException("ID must be " + ID_LENGTH 
          + " characters long: " + hex);
    }
    try {
      return Long.parseUnsignedLong(hex, 16);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid ID: " + hex, e);
    }
  }
}
