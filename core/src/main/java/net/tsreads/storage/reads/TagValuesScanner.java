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
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.tsreads.data.StringIterator;
import net.tsreads.data.StringSliceIterator;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadException;
import net.tsreads.query.StoreUpstreamException;
import net.tsreads.storage.TsdbStore;

/**
 * Finds the values of a tag by scanning series data when the index can't
 * answer the predicate. Only series with at least one point in the range
 * contribute their value. Costs a read of the first block of every 
 * candidate series.
 * 
 * @since 1.0
 */
public class TagValuesScanner {
  private static final Logger LOG = LoggerFactory.getLogger(
      TagValuesScanner.class);
  
  private final TsdbStore store;
  
  private final ShardLocator locator;
  
  /** How many series to read between cancellation checks. */
  private final int check_interval;
  
  /**
   * Default ctor.
   * @param store The non-null storage engine.
   * @param locator The non-null shard locator.
   * @param check_interval How many series to read between cancellation 
   * checks, at least 1.
   */
  public TagValuesScanner(final TsdbStore store, 
                          final ShardLocator locator, 
                          final int check_interval) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (locator == null) {
      throw new IllegalArgumentException("Locator cannot be null.");
    }
    if (check_interval < 1) {
      throw new IllegalArgumentException("Check interval must be at least 1.");
    }
    this.store = store;
    this.locator = locator;
    this.check_interval = check_interval;
  }
  
  /**
   * Scans the series matching the attributes' predicate.
   * @param context The non-null read context.
   * @param attributes The non-null attributes.
   * @param tag_key The tag to collect values of.
   * @return A sorted, de-duplicated iterator, empty if nothing matched.
   * @throws net.tsreads.query.ReadCancelledException if the read was 
   * cancelled. Every open cursor is closed first.
   * @throws StoreUpstreamException if the storage engine failed.
   * @throws net.tsreads.query.InvariantViolationException if a cursor 
   * misbehaved.
   */
  public StringIterator scan(final ReadContext context, 
                             final MetaqueryAttributes attributes, 
                             final String tag_key) {
    final List<Long> shard_ids = locator.findShards(context, 
        attributes.database(), attributes.retentionPolicy(), false, 
        attributes.start(), attributes.end());
    if (shard_ids.isEmpty()) {
      return StringIterator.empty();
    }
    
    final Optional<SeriesCursor> cursor;
    try {
      cursor = store.newConditionSeriesCursor(context, 
          attributes.predicate(), store.shards(shard_ids));
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed opening series cursor for "
          + "tag value scan", e);
    }
    if (!cursor.isPresent()) {
      return StringIterator.empty();
    }
    
    final Set<String> values = new TreeSet<String>();
    int series = 0;
    final FilteredResultSet results = new FilteredResultSet(context, 
        attributes.start(), attributes.end(), false, cursor.get(), 
        check_interval);
    try {
      while (results.next()) {
        series++;
        final Optional<ArrayCursor<?>> data = results.cursor();
        if (!data.isPresent()) {
          // no data for this series and field
          continue;
        }
        try {
          if (data.get().hasData() && results.tags().has(tag_key)) {
            values.add(results.tags().get(tag_key));
          }
        } finally {
          data.get().close();
        }
      }
    } finally {
      results.close();
    }
    
    if (LOG.isDebugEnabled()) {
      LOG.debug("Scanned " + series + " series over shards " + shard_ids 
          + " for " + values.size() + " values of " + tag_key);
    }
    return new StringSliceIterator(ImmutableList.copyOf(values));
  }
}
