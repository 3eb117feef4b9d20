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
package net.tsreads.data.cursors;

/**
 * A block of values read from a cursor, ordered by timestamp. Subclasses
 * hold a parallel array of values of their {@link DataType}.
 * 
 * @since 1.0
 */
public abstract class TimestampArray {
  
  /** Timestamps in nanoseconds. */
  protected final long[] timestamps;
  
  /**
   * @param timestamps A non-null array of timestamps.
   */
  protected TimestampArray(final long[] timestamps) {
    if (timestamps == null) {
      throw new IllegalArgumentException("Timestamps cannot be null.");
    }
    this.timestamps = timestamps;
  }
  
  /** @return The number of values in this block. Zero if the cursor was 
   * exhausted. */
  public int len() {
    return timestamps.length;
  }
  
  /** @return The timestamps. Do not modify. */
  public long[] timestamps() {
    return timestamps;
  }
  
  /** @return The type of values in this block. */
  public abstract DataType type();
  
  /**
   * Helper for subclasses to verify the value array lines up.
   * @param values The length of the values array.
   */
  protected void checkLength(final int values) {
    if (values != timestamps.length) {
      throw new IllegalArgumentException("Values length " + values 
          + " does not match timestamps length " + timestamps.length);
    }
  }
}
