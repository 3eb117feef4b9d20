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

import java.util.Iterator;

/**
 * A lazy, forward only sequence of strings such as tag keys, tag values,
 * measurement names or field names. Implementations returned by the read
 * path are sorted and free of duplicates. Not thread safe.
 * 
 * @since 1.0
 */
public interface StringIterator extends Iterator<String> {

  /** @return The number of strings remaining. */
  public int remaining();
  
  /** @return An iterator with no entries. */
  public static StringIterator empty() {
    return StringSliceIterator.EMPTY;
  }
}
