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

import net.tsreads.query.ReadContext;

/**
 * A set of shards that can be queried as one through the engine's iterator
 * construction.
 * 
 * @since 1.0
 */
public interface ShardGroup {

  /**
   * Creates an iterator over the source.
   * @param context The non-null read context.
   * @param source The non-null source.
   * @param options The non-null options.
   * @return A non-null iterator the caller must close.
   */
  public PointIterator createIterator(final ReadContext context, 
                                      final IteratorSource source, 
                                      final IteratorOptions options);
  
}
