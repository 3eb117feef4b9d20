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

import net.tsreads.query.InvariantViolationException;

/**
 * Reads the values of one series and field from the storage engine in 
 * blocks. Single consumer and forward only.
 * 
 * @param <T> The type of block returned.
 * 
 * @since 1.0
 */
public interface ArrayCursor<T extends TimestampArray> extends Cursor {

  /** @return The type of data this cursor returns. */
  public DataType type();
  
  /**
   * Reads the next block of values.
   * @return A non-null block. A block of length zero means the cursor has
   * been exhausted.
   */
  public T next();
  
  /**
   * Reads the next block and reports whether it held any points. The block
   * is consumed so this is only useful to test a fresh cursor for data.
   * @return True if the next block had at least one point.
   * @throws InvariantViolationException if the cursor returned a null block.
   */
  public default boolean hasData() {
    final T block = next();
    if (block == null) {
      throw new InvariantViolationException("Cursor of type " + type() 
          + " returned a null block.");
    }
    return block.len() != 0;
  }
  
}
