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

import net.tsreads.data.TimeRange;

/**
 * The database, retention policy and clamped time range a read source 
 * resolved to.
 * 
 * @since 1.0
 */
public class ResolvedSource {
  
  private final long org_id;
  
  private final String database;
  
  private final String retention_policy;
  
  private final long start;
  
  private final long end;
  
  public ResolvedSource(final long org_id, 
                        final String database, 
                        final String retention_policy, 
                        final long start, 
                        final long end) {
    this.org_id = org_id;
    this.database = database;
    this.retention_policy = retention_policy;
    this.start = start;
    this.end = end;
  }
  
  public long orgId() {
    return org_id;
  }
  
  public String database() {
    return database;
  }
  
  public String retentionPolicy() {
    return retention_policy;
  }
  
  public long start() {
    return start;
  }
  
  public long end() {
    return end;
  }
  
  /** @return The clamped range as a new time range. */
  public TimeRange range() {
    return new TimeRange(start, end);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{database=")
        .append(database)
        .append(", retentionPolicy=")
        .append(retention_policy)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append("}")
        .toString();
  }
}
