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

import java.util.Optional;

import net.tsreads.data.SeriesTags;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.data.cursors.SeriesRow;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ResultSet;

/**
 * Walks a series cursor one series at a time, opening a data cursor over
 * the range for the current series on demand. The data cursor last handed
 * out is closed when the set advances or is closed.
 * 
 * @since 1.0
 */
public class FilteredResultSet implements ResultSet {
  
  private final ReadContext context;
  
  private final long start;
  
  private final long end;
  
  private final boolean descending;
  
  private final SeriesCursor series;
  
  /** How many series to read between cancellation checks. */
  private final int check_interval;
  
  private int read;
  
  private SeriesRow row;
  
  private ArrayCursor<?> handed_out;
  
  private boolean closed;
  
  /**
   * Ctor checking for cancellation on every series.
   * @param context The non-null read context.
   * @param start The start of the range in nanoseconds.
   * @param end The end of the range in nanoseconds.
   * @param descending Whether data cursors read latest first.
   * @param series The non-null series cursor. Closed with this set.
   */
  public FilteredResultSet(final ReadContext context, 
                           final long start, 
                           final long end, 
                           final boolean descending, 
                           final SeriesCursor series) {
    this(context, start, end, descending, series, 1);
  }
  
  /**
   * Full ctor.
   * @param context The non-null read context.
   * @param start The start of the range in nanoseconds.
   * @param end The end of the range in nanoseconds.
   * @param descending Whether data cursors read latest first.
   * @param series The non-null series cursor. Closed with this set.
   * @param check_interval How many series to read between cancellation
   * checks, at least 1.
   */
  public FilteredResultSet(final ReadContext context, 
                           final long start, 
                           final long end, 
                           final boolean descending, 
                           final SeriesCursor series, 
                           final int check_interval) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (series == null) {
      throw new IllegalArgumentException("Series cursor cannot be null.");
    }
    if (check_interval < 1) {
      throw new IllegalArgumentException("Check interval must be at least 1.");
    }
    this.context = context;
    this.start = start;
    this.end = end;
    this.descending = descending;
    this.series = series;
    this.check_interval = check_interval;
  }
  
  @Override
  public boolean next() {
    closeHandedOut();
    if (closed) {
      return false;
    }
    if (++read % check_interval == 0) {
      try {
        context.checkCancelled();
      } catch (RuntimeException e) {
        close();
        throw e;
      }
    }
    if (!series.hasNext()) {
      row = null;
      return false;
    }
    row = series.next();
    return true;
  }

  @Override
  public Optional<ArrayCursor<?>> cursor() {
    if (row == null) {
      throw new IllegalStateException("No current series.");
    }
    closeHandedOut();
    final Optional<ArrayCursor<?>> cursor = MultiShardArrayCursor.open(
        MultiShardArrayCursor.request(row, start, end, descending), 
        row.query());
    if (cursor.isPresent()) {
      handed_out = cursor.get();
    }
    return cursor;
  }

  @Override
  public SeriesTags tags() {
    if (row == null) {
      throw new IllegalStateException("No current series.");
    }
    return row.tags();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    row = null;
    try {
      closeHandedOut();
    } finally {
      series.close();
    }
  }
  
  private void closeHandedOut() {
    if (handed_out != null) {
      final ArrayCursor<?> cursor = handed_out;
      handed_out = null;
      cursor.close();
    }
  }
}
