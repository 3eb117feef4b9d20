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
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.tsreads.auth.Authorizer;
import net.tsreads.auth.OpenAuthorizer;
import net.tsreads.common.Const;
import net.tsreads.data.Envelope;
import net.tsreads.data.ReadSource;
import net.tsreads.data.StringIterator;
import net.tsreads.data.StringSliceIterator;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.meta.MetaClient;
import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.ExprVisitor;
import net.tsreads.query.BaseReadRequest;
import net.tsreads.query.GroupResultSet;
import net.tsreads.query.InvariantViolationException;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadException;
import net.tsreads.query.ReadFilterRequest;
import net.tsreads.query.ReadGroupRequest;
import net.tsreads.query.ResultSet;
import net.tsreads.query.StoreUpstreamException;
import net.tsreads.query.TagKeysRequest;
import net.tsreads.query.TagValuesRequest;
import net.tsreads.query.predicate.KeyRemap;
import net.tsreads.query.predicate.PredicateTranslator;
import net.tsreads.storage.AuxPoint;
import net.tsreads.storage.IteratorOptions;
import net.tsreads.storage.IteratorSource;
import net.tsreads.storage.PointIterator;
import net.tsreads.storage.Shard;
import net.tsreads.storage.ShardGroup;
import net.tsreads.storage.TagKeys;
import net.tsreads.storage.TagValues;
import net.tsreads.storage.TsdbStore;
import net.tsreads.utils.Config;

/**
 * The read path entry point. Resolves the read source of each request to
 * a database and the shards covering its range, then either builds a 
 * lazy result set over the storage engine's series cursors or answers 
 * metadata lookups from the tag index, falling back to a data scan when 
 * the predicate references something the index doesn't hold.
 * <p>
 * Every method runs on the caller's thread and honors the given 
 * {@link ReadContext}. Zero shards or zero series yield explicitly empty
 * results, never null.
 * 
 * @since 1.0
 */
public class ReadStore {
  private static final Logger LOG = LoggerFactory.getLogger(ReadStore.class);
  
  /** Keys always present in tag key listings. */
  private static final List<String> SYNTHETIC_TAG_KEYS = ImmutableList.of(
      Const.MEASUREMENT_KEY, Const.FIELD_KEY);
  
  private final TsdbStore store;
  
  private final Authorizer authorizer;
  
  private final SourceResolver resolver;
  
  private final ShardLocator locator;
  
  private final PredicateTranslator translator;
  
  private final TagValuesScanner scanner;
  
  /**
   * Ctor using the always allow authorizer.
   * @param store The non-null storage engine.
   * @param meta_client The non-null meta client.
   * @param config The non-null config.
   */
  public ReadStore(final TsdbStore store, 
                   final MetaClient meta_client, 
                   final Config config) {
    this(store, meta_client, config, OpenAuthorizer.INSTANCE);
  }
  
  /**
   * Full ctor.
   * @param store The non-null storage engine.
   * @param meta_client The non-null meta client.
   * @param config The non-null config.
   * @param authorizer The non-null authorizer passed to the storage engine.
   */
  public ReadStore(final TsdbStore store, 
                   final MetaClient meta_client, 
                   final Config config, 
                   final Authorizer authorizer) {
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    if (authorizer == null) {
      throw new IllegalArgumentException("Authorizer cannot be null.");
    }
    this.store = store;
    this.authorizer = authorizer;
    resolver = new SourceResolver(meta_client, config);
    locator = new ShardLocator(meta_client, 
        config.getLong(Config.META_TIMEOUT_KEY));
    translator = new PredicateTranslator(KeyRemap.MEASUREMENT);
    scanner = new TagValuesScanner(store, locator, 
        config.getInt(Config.CANCEL_CHECK_INTERVAL_KEY));
  }
  
  /**
   * Reads the series matching the request's wire predicate. The clamped 
   * range is written back to the request.
   * @param context The non-null read context.
   * @param request The non-null request.
   * @return A lazy result set, empty if no shard or series matched.
   * @throws ReadException of the matching kind on failure.
   */
  public ResultSet readFilter(final ReadContext context, 
                              final ReadFilterRequest request) {
    final ResolvedSource source = resolve(context, request);
    final List<Long> shard_ids = locator.findShards(context, 
        source.database(), source.retentionPolicy(), false, source.start(), 
        source.end());
    if (shard_ids.isEmpty()) {
      return ResultSet.empty();
    }
    
    final Optional<SeriesCursor> cursor = new SeriesCursorFactory(store, 
        request.predicate(), shards(shard_ids)).newCursor(context);
    if (!cursor.isPresent()) {
      return ResultSet.empty();
    }
    return new FilteredResultSet(context, source.start(), source.end(), 
        request.descending(), cursor.get());
  }
  
  /**
   * Reads the series matching the request's wire predicate in groups. The
   * clamped range is written back to the request.
   * @param context The non-null read context.
   * @param request The non-null request.
   * @return A lazy grouped result set, empty if no shard or series 
   * matched.
   * @throws ReadException of the matching kind on failure.
   */
  public GroupResultSet readGroup(final ReadContext context, 
                                  final ReadGroupRequest request) {
    final ResolvedSource source = resolve(context, request);
    final List<Long> shard_ids = locator.findShards(context, 
        source.database(), source.retentionPolicy(), false, source.start(), 
        source.end());
    if (shard_ids.isEmpty()) {
      return GroupResultSet.empty();
    }
    
    return GroupedResultSet.create(context, request, 
        new SeriesCursorFactory(store, request.predicate(), 
            shards(shard_ids)));
  }
  
  /**
   * Lists the tag keys of series matching the predicate. The measurement
   * and field keys are always included.
   * @param context The non-null read context.
   * @param request The non-null request.
   * @return A sorted, de-duplicated iterator.
   * @throws ReadException of the matching kind on failure.
   */
  public StringIterator tagKeys(final ReadContext context, 
                                final TagKeysRequest request) {
    final ResolvedSource source = resolve(context, request);
    final Node<ExprVisitor> expr = 
        translator.translateForIndex(request.predicate());
    final List<Long> shard_ids = locator.findShards(context, 
        source.database(), source.retentionPolicy(), false, source.start(), 
        source.end());
    
    final Set<String> keys = new TreeSet<String>(SYNTHETIC_TAG_KEYS);
    if (shard_ids.isEmpty()) {
      return new StringSliceIterator(ImmutableList.copyOf(keys));
    }
    
    context.checkCancelled();
    final List<TagKeys> results;
    try {
      results = store.tagKeys(authorizer, shard_ids, expr);
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed fetching tag keys", e);
    }
    if (results != null) {
      for (final TagKeys tag_keys : results) {
        keys.addAll(tag_keys.keys());
      }
    }
    return new StringSliceIterator(ImmutableList.copyOf(keys));
  }
  
  /**
   * Lists the values of a tag on series matching the predicate. Values of
   * the measurement and field keys are routed to 
   * {@link #measurementNames(ReadContext, MetaqueryAttributes)} and 
   * {@link #fieldNames(ReadContext, MetaqueryAttributes)}.
   * @param context The non-null read context.
   * @param request The non-null request.
   * @return A sorted, de-duplicated iterator.
   * @throws ReadException of the matching kind on failure.
   */
  public StringIterator tagValues(final ReadContext context, 
                                  final TagValuesRequest request) {
    final ResolvedSource source = resolve(context, request);
    final MetaqueryAttributes attributes = 
        MetaqueryAttributes.newBuilder(source)
          .setPredicate(translator.translate(request.predicate()))
          .build();
    
    final String tag_key = translator.remap().remap(request.tagKey());
    if (tag_key.equals(Const.NAME_KEY)) {
      return measurementNames(context, attributes);
    }
    if (tag_key.equals(Const.FIELD_KEY)) {
      return fieldNames(context, attributes);
    }
    
    final Node<ExprVisitor> expr = PredicateTranslator.withTagKey(
        request.tagKey(), translator.translateForIndex(request.predicate()));
    final List<Long> shard_ids = locator.findShards(context, 
        source.database(), source.retentionPolicy(), false, source.start(), 
        source.end());
    if (shard_ids.isEmpty()) {
      return StringIterator.empty();
    }
    
    context.checkCancelled();
    final List<TagValues> results;
    try {
      results = store.tagValues(authorizer, shard_ids, expr);
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed fetching tag values for " 
          + request.tagKey(), e);
    }
    final Set<String> values = new TreeSet<String>();
    if (results != null) {
      for (final TagValues tag_values : results) {
        for (final TagValues.KeyValue kv : tag_values.values()) {
          values.add(kv.value());
        }
      }
    }
    return new StringSliceIterator(ImmutableList.copyOf(values));
  }
  
  /**
   * Lists measurement names. Scans series data when the predicate 
   * references the field key or a field value.
   * @param context The non-null read context.
   * @param attributes The non-null attributes.
   * @return A sorted, de-duplicated iterator.
   * @throws ReadException of the matching kind on failure.
   */
  public StringIterator measurementNames(final ReadContext context, 
                                         final MetaqueryAttributes attributes) {
    if (PredicateTranslator.hasFieldKeyOrValue(attributes.predicate())) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Scanning for measurement names with predicate " 
            + attributes.predicate());
      }
      return scanner.scan(context, attributes, Const.MEASUREMENT_KEY);
    }
    
    context.checkCancelled();
    final List<String> names;
    try {
      names = store.measurementNames(authorizer, attributes.database(), 
          attributes.predicate());
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed fetching measurement names", 
          e);
    }
    if (names == null || names.isEmpty()) {
      return StringIterator.empty();
    }
    return new StringSliceIterator(
        ImmutableList.copyOf(new TreeSet<String>(names)));
  }
  
  /**
   * Lists field names. Scans series data when the predicate references the
   * field key, a field value or any tag key, otherwise drains the storage
   * engine's field keys iterator.
   * @param context The non-null read context.
   * @param attributes The non-null attributes.
   * @return A sorted, de-duplicated iterator.
   * @throws ReadException of the matching kind on failure.
   */
  public StringIterator fieldNames(final ReadContext context, 
                                   final MetaqueryAttributes attributes) {
    if (PredicateTranslator.hasFieldKeyOrValue(attributes.predicate()) || 
        PredicateTranslator.hasTagKey(attributes.predicate())) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Scanning for field names with predicate " 
            + attributes.predicate());
      }
      return scanner.scan(context, attributes, Const.FIELD_KEY);
    }
    
    final List<Long> shard_ids = locator.findShards(context, 
        attributes.database(), attributes.retentionPolicy(), false, 
        attributes.start(), attributes.end());
    if (shard_ids.isEmpty()) {
      return StringIterator.empty();
    }
    
    final PointIterator iterator;
    try {
      final ShardGroup group = store.shardGroup(shard_ids);
      iterator = group.createIterator(context, 
          new IteratorSource(attributes.database(), 
              attributes.retentionPolicy(), 
              IteratorSource.FIELD_KEYS_ITERATOR), 
          new IteratorOptions(attributes.orgId(), attributes.predicate(), 
              authorizer));
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed creating field keys iterator", 
          e);
    }
    
    final List<String> names = new ArrayList<String>();
    try {
      while (iterator.hasNext()) {
        context.checkCancelled();
        final AuxPoint point = iterator.next();
        if (point.aux().isEmpty()) {
          continue;
        }
        final Object name = point.aux().get(0);
        if (!(name instanceof String)) {
          throw new InvariantViolationException("Field keys iterator "
              + "returned a non-string field name: " + name);
        }
        names.add((String) name);
      }
    } finally {
      iterator.close();
    }
    
    Collections.sort(names);
    return new StringSliceIterator(mergeSorted(names));
  }
  
  /**
   * Builds the envelope a serving layer hands back in requests.
   * @param org_id The organization ID.
   * @param bucket_id The bucket ID.
   * @return The encoded read source.
   */
  public Envelope getSource(final long org_id, final long bucket_id) {
    return ReadSources.encode(org_id, bucket_id);
  }
  
  /**
   * Decodes and resolves the request's source then writes the clamped 
   * range back to the request.
   */
  private ResolvedSource resolve(final ReadContext context, 
                                 final BaseReadRequest request) {
    final ReadSource source = ReadSources.decode(request.source());
    final ResolvedSource resolved = resolver.resolve(context, 
        source.organizationId(), source.bucketId(), request.range().start(), 
        request.range().end());
    request.setRange(resolved.range());
    return resolved;
  }
  
  private List<Shard> shards(final List<Long> shard_ids) {
    try {
      final List<Shard> shards = store.shards(shard_ids);
      return shards == null ? ImmutableList.<Shard>of() : shards;
    } catch (ReadException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUpstreamException("Failed fetching shards " 
          + shard_ids, e);
    }
  }
  
  /**
   * Drops adjacent duplicates from a sorted list.
   * @param sorted The sorted list.
   * @return The de-duplicated list in the same order.
   */
  static List<String> mergeSorted(final List<String> sorted) {
    final ImmutableList.Builder<String> merged = ImmutableList.builder();
    String last = null;
    for (final String value : sorted) {
      if (!value.equals(last)) {
        merged.add(value);
        last = value;
      }
    }
    return merged.build();
  }
}
