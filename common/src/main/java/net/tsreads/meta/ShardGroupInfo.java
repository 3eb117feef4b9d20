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
package net.tsreads.meta;

import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A set of shards covering the same time span of a retention policy. Owned
 * by the metadata service, read only here.
 * 
 * @since 1.0
 */
public class ShardGroupInfo {
  
  /** Orders groups by start time, then end time. */
  public static final Comparator<ShardGroupInfo> START_TIME_ORDER = 
      new Comparator<ShardGroupInfo>() {
        @Override
        public int compare(final ShardGroupInfo a, final ShardGroupInfo b) {
          final int cmp = Long.compare(a.start_time, b.start_time);
          if (cmp != 0) {
            return cmp;
          }
          return Long.compare(a.end_time, b.end_time);
        }
  };
  
  private final long id;
  
  private final long start_time;
  
  private final long end_time;
  
  private final List<ShardInfo> shards;
  
  /**
   * Default ctor.
   * @param id The group ID.
   * @param start_time The start of the span in nanoseconds, inclusive.
   * @param end_time The end of the span in nanoseconds, exclusive.
   * @param shards A non-null list of shards in the group.
   */
  public ShardGroupInfo(final long id, 
                        final long start_time, 
                        final long end_time, 
                        final List<ShardInfo> shards) {
    if (shards == null) {
      throw new IllegalArgumentException("Shards cannot be null.");
    }
    this.id = id;
    this.start_time = start_time;
    this.end_time = end_time;
    this.shards = ImmutableList.copyOf(shards);
  }
  
  /** @return The group ID. */
  public long id() {
    return id;
  }
  
  /** @return The start of the span in nanoseconds. */
  public long startTime() {
    return start_time;
  }
  
  /** @return The end of the span in nanoseconds. */
  public long endTime() {
    return end_time;
  }
  
  /** @return The shards in the order the metadata service returned them. */
  public List<ShardInfo> shards() {
    return shards;
  }
  
  /**
   * @param start The start of a range in nanoseconds.
   * @param end The end of a range in nanoseconds.
   * @return True if the group's span intersects the range.
   */
  public boolean overlaps(final long start, final long end) {
    return start_time <= end && end_time > start;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{id=")
        .append(id)
        .append(", start=")
        .append(start_time)
        .append(", end=")
        .append(end_time)
        .append(", shards=")
        .append(shards)
        .append("}")
        .toString();
  }
}
