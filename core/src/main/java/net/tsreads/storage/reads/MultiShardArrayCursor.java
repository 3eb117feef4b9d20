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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.CursorIterator;
import net.tsreads.data.cursors.CursorRequest;
import net.tsreads.data.cursors.DataType;
import net.tsreads.data.cursors.SeriesRow;
import net.tsreads.data.cursors.TimestampArray;
import net.tsreads.query.InvariantViolationException;

/**
 * Concatenates the cursors of one series and field across shards. The 
 * next shard's cursor is only opened once the current one is exhausted.
 * Shards whose data type differs from the first shard's are skipped.
 * 
 * @since 1.0
 */
public class MultiShardArrayCursor implements ArrayCursor<TimestampArray> {
  private static final Logger LOG = LoggerFactory.getLogger(
      MultiShardArrayCursor.class);
  
  private final CursorRequest request;
  
  private final List<CursorIterator> iterators;
  
  private final DataType type;
  
  /** Index of the next iterator to open. */
  private int next_iterator;
  
  /** The open shard cursor, null once exhausted or closed. */
  private ArrayCursor<?> current;
  
  /** The last empty block, returned once every shard is drained. */
  private TimestampArray exhausted;
  
  private MultiShardArrayCursor(final CursorRequest request, 
                                final List<CursorIterator> iterators, 
                                final int next_iterator, 
                                final ArrayCursor<?> first) {
    this.request = request;
    this.iterators = iterators;
    this.next_iterator = next_iterator;
    current = first;
    type = first.type();
  }
  
  /**
   * Opens the first shard cursor that has data for the request.
   * @param request The non-null cursor request.
   * @param iterators The per shard cursor iterators in read order.
   * @return A cursor or an empty optional if no shard had a cursor for
   * the series and field.
   */
  public static Optional<ArrayCursor<?>> open(
      final CursorRequest request, 
      final List<CursorIterator> iterators) {
    for (int i = 0; i < iterators.size(); i++) {
      final Optional<ArrayCursor<?>> cursor = iterators.get(i).next(request);
      if (cursor.isPresent()) {
        return Optional.<ArrayCursor<?>>of(
            new MultiShardArrayCursor(request, iterators, i + 1, cursor.get()));
      }
    }
    return Optional.empty();
  }
  
  /**
   * @param row The series row.
   * @param start The start of the range in nanoseconds.
   * @param end The end of the range in nanoseconds.
   * @param descending Whether to read latest first.
   * @return A cursor request for the row's series and field.
   */
  public static CursorRequest request(final SeriesRow row, 
                                      final long start, 
                                      final long end, 
                                      final boolean descending) {
    return CursorRequest.newBuilder()
        .setName(row.name())
        .setTags(row.seriesTags())
        .setField(row.field())
        .setAscending(!descending)
        .setStart(start)
        .setEnd(end)
        .build();
  }
  
  @Override
  public DataType type() {
    return type;
  }

  @Override
  public TimestampArray next() {
    while (current != null) {
      final TimestampArray block = current.next();
      if (block == null) {
        throw new InvariantViolationException("Shard cursor for " 
            + request + " returned a null block.");
      }
      if (block.len() > 0) {
        return block;
      }
      exhausted = block;
      current.close();
      current = nextShard();
    }
    if (exhausted == null) {
      throw new IllegalStateException("Cursor was closed before reading.");
    }
    return exhausted;
  }

  @Override
  public void close() {
    if (current != null) {
      current.close();
      current = null;
    }
    next_iterator = iterators.size();
  }
  
  private ArrayCursor<?> nextShard() {
    while (next_iterator < iterators.size()) {
      final Optional<ArrayCursor<?>> cursor = 
          iterators.get(next_iterator++).next(request);
      if (!cursor.isPresent()) {
        continue;
      }
      if (cursor.get().type() != type) {
        LOG.warn("Skipping shard cursor of type " + cursor.get().type() 
            + " for " + request + " as the series is of type " + type);
        cursor.get().close();
        continue;
      }
      return cursor.get();
    }
    return null;
  }
}
