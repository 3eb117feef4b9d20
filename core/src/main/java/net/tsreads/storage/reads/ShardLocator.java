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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.tsreads.meta.MetaClient;
import net.tsreads.meta.ShardGroupInfo;
import net.tsreads.meta.ShardInfo;
import net.tsreads.query.ReadContext;

/**
 * Finds the shards of a retention policy that overlap a time range.
 * 
 * @since 1.0
 */
public class ShardLocator {
  private static final Logger LOG = LoggerFactory.getLogger(
      ShardLocator.class);
  
  private final MetaClient meta_client;
  
  private final long meta_timeout;
  
  /**
   * Default ctor.
   * @param meta_client The non-null meta client.
   * @param meta_timeout Max wait on the shard group lookup in 
   * milliseconds, 0 for the request deadline only.
   */
  public ShardLocator(final MetaClient meta_client, final long meta_timeout) {
    if (meta_client == null) {
      throw new IllegalArgumentException("Meta client cannot be null.");
    }
    this.meta_client = meta_client;
    this.meta_timeout = meta_timeout;
  }
  
  /**
   * Fetches the shard groups overlapping the range, sorts them by start 
   * time and flattens their shard IDs in that order. Shards within a 
   * group keep the order the meta service returned.
   * @param context The non-null read context.
   * @param database The database.
   * @param retention_policy The retention policy.
   * @param descending Whether to order groups latest first.
   * @param start The start of the range in nanoseconds.
   * @param end The end of the range in nanoseconds.
   * @return A non-null, possibly empty, list of shard IDs.
   * @throws net.tsreads.query.StoreUpstreamException if the lookup failed.
   * @throws net.tsreads.query.ReadCancelledException if the read was 
   * cancelled while waiting.
   */
  public List<Long> findShards(final ReadContext context, 
                               final String database, 
                               final String retention_policy, 
                               final boolean descending, 
                               final long start, 
                               final long end) {
    final List<ShardGroupInfo> groups = context.join(
        "shard group lookup for " + database + "." + retention_policy, 
        meta_client.shardGroupsByTimeRange(database, retention_policy, 
            start, end), meta_timeout);
    if (groups == null || groups.isEmpty()) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("No shard groups in " + database + "." + retention_policy 
            + " for [" + start + ", " + end + "]");
      }
      return ImmutableList.of();
    }
    
    final List<ShardGroupInfo> sorted = new ArrayList<ShardGroupInfo>(groups);
    Collections.sort(sorted, descending ? 
        Collections.reverseOrder(ShardGroupInfo.START_TIME_ORDER) : 
          ShardGroupInfo.START_TIME_ORDER);
    
    final ImmutableList.Builder<Long> ids = ImmutableList.builder();
    for (final ShardGroupInfo group : sorted) {
      for (final ShardInfo shard : group.shards()) {
        ids.add(shard.id());
      }
    }
    final List<Long> shard_ids = ids.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Found shards " + shard_ids + " in " + database + "." 
          + retention_policy + " for [" + start + ", " + end + "]");
    }
    return shard_ids;
  }
}
