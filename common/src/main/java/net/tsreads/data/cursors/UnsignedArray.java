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
 * A block of unsigned values. Stored as longs and treated as unsigned.
 * 
 * @since 1.0
 */
public class UnsignedArray extends TimestampArray {
  
  private final long[] values;
  
  /**
   * Default ctor.
   * @param timestamps A non-null array of timestamps.
   * @param values A non-null array of values the same length as the
   * timestamps.
   */
  public UnsignedArray(final long[] timestamps, final long[] values) {
    super(timestamps);
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    checkLength(values.length);
    this.values = values;
  }
  
  /** @return The values. Do not modify. */
  public long[] values() {
    return values;
  }

  @Override
  public DataType type() {
    return DataType.UNSIGNED;
  }
}
