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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.ImmutableList;

import net.tsreads.data.SeriesTags;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.data.cursors.SeriesRow;
import net.tsreads.query.GroupCursor;
import net.tsreads.query.GroupResultSet;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadGroupRequest;
import net.tsreads.query.ReadGroupRequest.GroupMode;

/**
 * Splits the series of a read into groups.
 * <p>
 * With {@link GroupMode#NONE} every series lands in a single group. A 
 * first pass over a series cursor computes the union of tag keys, then 
 * the group re-opens a cursor through the factory to stream the series.
 * <p>
 * With {@link GroupMode#BY} the series rows (not their points) are read
 * into memory, sorted by the values of the group keys with missing values
 * last, and each run of equal values becomes a group.
 * 
 * @since 1.0
 */
public class GroupedResultSet implements GroupResultSet {
  
  private final ReadContext context;
  
  private final ReadGroupRequest request;
  
  private final SeriesCursorFactory factory;
  
  /** Tag keys of the single group in NONE mode. */
  private final List<String> all_keys;
  
  /** The sorted groups in BY mode. */
  private final List<List<SeriesRow>> partitions;
  
  private int next_partition;
  
  private Group current;
  
  private boolean closed;
  
  private GroupedResultSet(final ReadContext context, 
                           final ReadGroupRequest request, 
                           final SeriesCursorFactory factory, 
                           final List<String> all_keys, 
                           final List<List<SeriesRow>> partitions) {
    this.context = context;
    this.request = request;
    this.factory = factory;
    this.all_keys = all_keys;
    this.partitions = partitions;
  }
  
  /**
   * Builds the grouped result set. The request's range must already be
   * clamped.
   * @param context The non-null read context.
   * @param request The non-null request.
   * @param factory The non-null series cursor factory.
   * @return The result set, explicitly empty if there were no series.
   */
  public static GroupResultSet create(final ReadContext context, 
                                      final ReadGroupRequest request, 
                                      final SeriesCursorFactory factory) {
    final Optional<SeriesCursor> cursor = factory.newCursor(context);
    if (!cursor.isPresent()) {
      return GroupResultSet.empty();
    }
    
    if (request.group() == GroupMode.NONE) {
      final Set<String> keys = new TreeSet<String>();
      int rows = 0;
      try {
        while (cursor.get().hasNext()) {
          context.checkCancelled();
          keys.addAll(cursor.get().next().tags().keys());
          rows++;
        }
      } finally {
        cursor.get().close();
      }
      if (rows == 0) {
        return GroupResultSet.empty();
      }
      return new GroupedResultSet(context, request, factory, 
          ImmutableList.copyOf(keys), null);
    }
    
    final List<SeriesRow> rows = new ArrayList<SeriesRow>();
    try {
      while (cursor.get().hasNext()) {
        context.checkCancelled();
        rows.add(cursor.get().next());
      }
    } finally {
      cursor.get().close();
    }
    if (rows.isEmpty()) {
      return GroupResultSet.empty();
    }
    return new GroupedResultSet(context, request, factory, null, 
        partition(rows, request.groupKeys()));
  }
  
  @Override
  public boolean next() {
    closeCurrent();
    if (closed) {
      return false;
    }
    context.checkCancelled();
    
    if (partitions == null) {
      // NONE, a single group re-read through the factory.
      if (next_partition++ > 0) {
        return false;
      }
      final Optional<SeriesCursor> cursor = factory.newCursor(context);
      if (!cursor.isPresent()) {
        return false;
      }
      current = new Group(new FilteredResultSet(context, 
            request.range().start(), request.range().end(), 
            request.descending(), cursor.get()), 
          all_keys, 
          ImmutableList.<String>of());
      return true;
    }
    
    if (next_partition >= partitions.size()) {
      return false;
    }
    final List<SeriesRow> rows = partitions.get(next_partition++);
    current = new Group(new FilteredResultSet(context, 
          request.range().start(), request.range().end(), 
          request.descending(), new RowListCursor(rows)), 
        keysOf(rows), 
        partitionValues(rows.get(0), request.groupKeys()));
    return true;
  }

  @Override
  public GroupCursor group() {
    if (current == null) {
      throw new IllegalStateException("No current group.");
    }
    return current;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    closeCurrent();
  }
  
  private void closeCurrent() {
    if (current != null) {
      final Group group = current;
      current = null;
      group.close();
    }
  }
  
  /**
   * Sorts the rows by the group key values and splits them into runs.
   * @param rows The rows, sorted in place.
   * @param group_keys The group keys.
   * @return The runs in order.
   */
  static List<List<SeriesRow>> partition(final List<SeriesRow> rows, 
                                         final List<String> group_keys) {
    final Comparator<SeriesRow> comparator = new GroupKeyComparator(group_keys);
    Collections.sort(rows, comparator);
    
    final List<List<SeriesRow>> partitions = new ArrayList<List<SeriesRow>>();
    List<SeriesRow> run = null;
    SeriesRow run_start = null;
    for (final SeriesRow row : rows) {
      if (run_start == null || comparator.compare(run_start, row) != 0) {
        run = new ArrayList<SeriesRow>();
        partitions.add(run);
        run_start = row;
      }
      run.add(row);
    }
    return partitions;
  }
  
  private static List<String> keysOf(final List<SeriesRow> rows) {
    final Set<String> keys = new TreeSet<String>();
    for (final SeriesRow row : rows) {
      keys.addAll(row.tags().keys());
    }
    return ImmutableList.copyOf(keys);
  }
  
  /** Missing values are rendered as empty strings. */
  private static List<String> partitionValues(final SeriesRow row, 
                                              final List<String> group_keys) {
    final ImmutableList.Builder<String> values = ImmutableList.builder();
    for (final String key : group_keys) {
      values.add(row.tags().get(key));
    }
    return values.build();
  }
  
  /** Orders rows by their group key values, missing values last. */
  private static class GroupKeyComparator implements Comparator<SeriesRow> {
    private final List<String> group_keys;
    
    GroupKeyComparator(final List<String> group_keys) {
      this.group_keys = group_keys;
    }
    
    @Override
    public int compare(final SeriesRow a, final SeriesRow b) {
      for (final String key : group_keys) {
        final boolean has_a = a.tags().has(key);
        final boolean has_b = b.tags().has(key);
        if (!has_a || !has_b) {
          if (has_a != has_b) {
            return has_a ? -1 : 1;
          }
          continue;
        }
        final int cmp = a.tags().get(key).compareTo(b.tags().get(key));
        if (cmp != 0) {
          return cmp;
        }
      }
      return 0;
    }
  }
  
  /** An in memory series cursor over one partition's rows. */
  private static class RowListCursor implements SeriesCursor {
    private final Iterator<SeriesRow> iterator;
    
    RowListCursor(final List<SeriesRow> rows) {
      iterator = rows.iterator();
    }
    
    @Override
    public boolean hasNext() {
      return iterator.hasNext();
    }

    @Override
    public SeriesRow next() {
      return iterator.next();
    }
    
    @Override
    public void close() {
      // nothing held
    }
  }
  
  /** A group backed by a filtered result set over its series. */
  private static class Group implements GroupCursor {
    private final FilteredResultSet series;
    private final List<String> keys;
    private final List<String> partition_key_values;
    
    Group(final FilteredResultSet series, 
          final List<String> keys, 
          final List<String> partition_key_values) {
      this.series = series;
      this.keys = keys;
      this.partition_key_values = partition_key_values;
    }
    
    @Override
    public boolean next() {
      return series.next();
    }

    @Override
    public Optional<ArrayCursor<?>> cursor() {
      return series.cursor();
    }

    @Override
    public SeriesTags tags() {
      return series.tags();
    }

    @Override
    public List<String> keys() {
      return keys;
    }

    @Override
    public List<String> partitionKeyValues() {
      return partition_key_values;
    }
    
    @Override
    public void close() {
      series.close();
    }
  }
}
