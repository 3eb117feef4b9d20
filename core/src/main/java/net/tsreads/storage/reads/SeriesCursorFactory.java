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
package net.tsreads.storage.reads;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadException;
import net.tsreads.query.StoreUpstreamException;
import net.tsreads.query.predicate.Predicate;
import net.tsreads.storage.Shard;
import net.tsreads.storage.TsdbStore;

/**
 * Opens fresh series cursors over a fixed set of shards and predicate.
 * Immutable so grouped reads can re-open cursors as often as they need.
 * 
 * @since 1.0
 */
public final class SeriesCursorFactory {
  
  private final TsdbStore store;
  
  private final Predicate predicate;
  
  private final List<Shard> shards;
  
  /**
   * Default ctor.
   * @param store The non-null storage engine.
   * @param predicate The wire predicate, may be null.
   * @param shards The non-null shards to read.
   */
  public SeriesCursorFactory(final TsdbStore store, 
                             final Predicate predicate, 
                             final List<Shard> shards) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (shards == null) {
      throw new IllegalArgumentException("Shards cannot be null.");
    }
    this.store = store;
    this.predicate = predicate;
    this.shards = ImmutableList.copyOf(shards);
  }
  
  /**
   * @param context The non-null read context.
   * @return A new series cursor or an empty optional if the storage 
   * engine had nothing to iterate.
   * @throws StoreUpstreamException if the storage engine failed.
   */
  public Optional<SeriesCursor> newCursor(final ReadContext context) {
    context.checkCancelled();
    try {
      return store.newSeriesCursor(context, predicate, shards);
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed opening series cursor", e);
    }
  }
  
  public Predicate predicate() {
    return predicate;
  }
  
  public List<Shard> shards() {
    return shards;
  }
}
