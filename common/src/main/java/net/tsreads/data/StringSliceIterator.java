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

import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

/**
 * A {@link StringIterator} over a list that has already been computed.
 * 
 * @since 1.0
 */
public class StringSliceIterator implements StringIterator {
  
  /** Shared empty instance. Stateless since there is nothing to advance. */
  static final StringSliceIterator EMPTY = 
      new StringSliceIterator(ImmutableList.<String>of());
  
  private final List<String> values;
  
  private int index;
  
  /**
   * Default ctor.
   * @param values A non-null list of values. Copied.
   */
  public StringSliceIterator(final List<String> values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    this.values = ImmutableList.copyOf(values);
  }
  
  @Override
  public boolean hasNext() {
    return index < values.size();
  }

  @Override
  public String next() {
    if (index >= values.size()) {
      throw new NoSuchElementException();
    }
    return values.get(index++);
  }
  
  @Override
  public int remaining() {
    return values.size() - index;
  }
}
