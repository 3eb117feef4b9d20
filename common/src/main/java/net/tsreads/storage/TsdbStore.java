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
package net.tsreads.storage;

import java.util.List;
import java.util.Optional;

import net.tsreads.auth.Authorizer;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.ExprVisitor;
import net.tsreads.query.ReadContext;
import net.tsreads.query.predicate.Predicate;

/**
 * The sharded storage engine as seen by the read path. Conditions are 
 * expressed in the engine's native expression language; a null condition
 * means no filtering.
 * 
 * @since 1.0
 */
public interface TsdbStore {

  /**
   * @param ids A non-null list of shard IDs.
   * @return Handles on the shards that exist, in the given order.
   */
  public List<Shard> shards(final List<Long> ids);
  
  /**
   * @param ids A non-null list of shard IDs.
   * @return A non-null group over the shards.
   */
  public ShardGroup shardGroup(final List<Long> ids);
  
  /**
   * Lists tag keys from the index of the given shards.
   * @param authorizer A non-null authorizer.
   * @param shard_ids A non-null list of shard IDs.
   * @param condition An optional condition, may be null.
   * @return A non-null list of keys per measurement, possibly with 
   * duplicates and unsorted.
   */
  public List<TagKeys> tagKeys(final Authorizer authorizer, 
                               final List<Long> shard_ids, 
                               final Node<ExprVisitor> condition);
  
  /**
   * Lists tag values from the index of the given shards. The condition
   * names the tag key through an equality on the {@code _tagKey} pseudo key.
   * @param authorizer A non-null authorizer.
   * @param shard_ids A non-null list of shard IDs.
   * @param condition A non-null condition.
   * @return A non-null list of values per measurement.
   */
  public List<TagValues> tagValues(final Authorizer authorizer, 
                                   final List<Long> shard_ids, 
                                   final Node<ExprVisitor> condition);
  
  /**
   * Lists measurement names of a database from the index.
   * @param authorizer A non-null authorizer.
   * @param database The non-null database name.
   * @param condition An optional condition, may be null.
   * @return A non-null list of names.
   */
  public List<String> measurementNames(final Authorizer authorizer, 
                                       final String database, 
                                       final Node<ExprVisitor> condition);
  
  /**
   * Builds a series cursor from the index of the shards using a wire
   * predicate.
   * @param context The non-null read context.
   * @param predicate An optional predicate, may be null.
   * @param shards The non-null list of shards.
   * @return The cursor or an empty optional if nothing can match.
   */
  public Optional<SeriesCursor> newSeriesCursor(final ReadContext context, 
                                                final Predicate predicate, 
                                                final List<Shard> shards);
  
  /**
   * Builds a series cursor from the index of the shards using a native
   * condition.
   * @param context The non-null read context.
   * @param condition An optional condition, may be null.
   * @param shards The non-null list of shards.
   * @return The cursor or an empty optional if nothing can match.
   */
  public Optional<SeriesCursor> newConditionSeriesCursor(
      final ReadContext context, 
      final Node<ExprVisitor> condition, 
      final List<Shard> shards);
  
}
