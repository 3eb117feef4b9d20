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

import java.util.List;

import com.stumbleupon.async.Deferred;

/**
 * The cluster metadata service as seen by the read path.
 * 
 * @since 1.0
 */
public interface MetaClient {

  /**
   * Looks up a database.
   * @param name The non-null database name.
   * @return A deferred resolving to the database or null if it does not
   * exist. May resolve to an exception.
   */
  public Deferred<DatabaseInfo> database(final String name);
  
  /**
   * Fetches the shard groups of a retention policy whose span intersects 
   * the given range.
   * @param database The non-null database name.
   * @param policy The non-null retention policy name.
   * @param min The start of the range in nanoseconds.
   * @param max The end of the range in nanoseconds.
   * @return A deferred resolving to a non-null, possibly empty list of groups
   * in no particular order. May resolve to an exception.
   */
  public Deferred<List<ShardGroupInfo>> shardGroupsByTimeRange(
      final String database, 
      final String policy, 
      final long min, 
      final long max);
  
}
