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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsreads.common.Const;
import net.tsreads.meta.DatabaseInfo;
import net.tsreads.meta.MetaClient;
import net.tsreads.query.DatabaseNotFoundException;
import net.tsreads.query.InvalidRetentionPolicyException;
import net.tsreads.query.ReadContext;
import net.tsreads.utils.Config;
import net.tsreads.utils.Ids;

/**
 * Validates an organization and bucket against the meta service and maps
 * them to a database and retention policy. Unset time bounds are clamped
 * to the storage engine's limits.
 * 
 * @since 1.0
 */
public class SourceResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      SourceResolver.class);
  
  private final MetaClient meta_client;
  
  /** The policy every bucket maps to. */
  private final String retention_policy;
  
  /** Max wait on the database lookup, 0 for the request deadline only. */
  private final long meta_timeout;
  
  /**
   * Default ctor.
   * @param meta_client The non-null meta client.
   * @param config The non-null config.
   */
  public SourceResolver(final MetaClient meta_client, final Config config) {
    if (meta_client == null) {
      throw new IllegalArgumentException("Meta client cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.meta_client = meta_client;
    retention_policy = config.getString(Config.DEFAULT_RETENTION_POLICY_KEY);
    meta_timeout = config.getLong(Config.META_TIMEOUT_KEY);
  }
  
  /**
   * Resolves the source.
   * @param context The non-null read context.
   * @param org_id The organization ID.
   * @param bucket_id The bucket ID.
   * @param start The requested start in nanoseconds, non-positive if unset.
   * @param end The requested end in nanoseconds, non-positive if unset.
   * @return The resolved source.
   * @throws DatabaseNotFoundException if the bucket has no database.
   * @throws InvalidRetentionPolicyException if the database lacks the 
   * default retention policy.
   * @throws net.tsreads.query.StoreUpstreamException if the meta lookup
   * failed.
   * @throws net.tsreads.query.ReadCancelledException if the read was 
   * cancelled while waiting on the meta service.
   */
  public ResolvedSource resolve(final ReadContext context, 
                                final long org_id, 
                                final long bucket_id, 
                                final long start, 
                                final long end) {
    final String database = databaseName(bucket_id);
    final DatabaseInfo info = context.join("database lookup for " + database, 
        meta_client.database(database), meta_timeout);
    if (info == null) {
      throw new DatabaseNotFoundException("No database for bucket " 
          + database);
    }
    
    if (info.retentionPolicy(retention_policy) == null) {
      throw new InvalidRetentionPolicyException("Database " + database 
          + " has no retention policy named " + retention_policy);
    }
    
    final ResolvedSource resolved = new ResolvedSource(org_id, database, 
        retention_policy, clampStart(start), clampEnd(end));
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved bucket " + database + " to " + resolved);
    }
    return resolved;
  }
  
  /** @return The retention policy buckets map to. */
  public String retentionPolicy() {
    return retention_policy;
  }
  
  /**
   * @param bucket_id The bucket ID.
   * @return The 16 digit hex database name for the bucket.
   */
  public static String databaseName(final long bucket_id) {
    return Ids.toHex(bucket_id);
  }
  
  /**
   * @param start A start time in nanoseconds.
   * @return The start or the engine's min time if it was not positive.
   */
  public static long clampStart(final long start) {
    return start <= 0 ? Const.MIN_NANO_TIME : start;
  }
  
  /**
   * @param end An end time in nanoseconds.
   * @return The end or the engine's max time if it was not positive.
   */
  public static long clampEnd(final long end) {
    return end <= 0 ? Const.MAX_NANO_TIME : end;
  }
}
