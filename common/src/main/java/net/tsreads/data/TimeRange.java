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

import com.google.common.base.Objects;

/**
 * A range of nanosecond timestamps from {@link #start()} to {@link #end()}.
 * A zero or negative bound means "unset" until the range is clamped to the
 * engine's limits.
 * 
 * @since 1.0
 */
public class TimeRange {
  
  private final long start;
  
  private final long end;
  
  public TimeRange(final long start, final long end) {
    this.start = start;
    this.end = end;
  }
  
  /** @return The start timestamp in nanoseconds. */
  public long start() {
    return start;
  }
  
  /** @return The end timestamp in nanoseconds. */
  public long end() {
    return end;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start == other.start && end == other.end;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(start, end);
  }
  
  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
