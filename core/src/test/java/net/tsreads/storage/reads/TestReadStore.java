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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.tsreads.auth.OpenAuthorizer;
import net.tsreads.common.Const;
import net.tsreads.data.Envelope;
import net.tsreads.data.StringIterator;
import net.tsreads.data.TimeRange;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.CursorIterator;
import net.tsreads.data.cursors.MockArrayCursor;
import net.tsreads.data.cursors.MockCursorIterator;
import net.tsreads.data.cursors.MockSeriesCursor;
import net.tsreads.data.cursors.SeriesCursor;
import net.tsreads.meta.DatabaseInfo;
import net.tsreads.meta.MetaClient;
import net.tsreads.meta.RetentionPolicyInfo;
import net.tsreads.meta.ShardGroupInfo;
import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.And;
import net.tsreads.ql.ast.expr.Comparison;
import net.tsreads.ql.ast.expr.ExprVisitor;
import net.tsreads.ql.ast.expr.Key;
import net.tsreads.ql.ast.expr.Paren;
import net.tsreads.ql.ast.expr.StringLiteral;
import net.tsreads.query.DatabaseNotFoundException;
import net.tsreads.query.GroupCursor;
import net.tsreads.query.GroupResultSet;
import net.tsreads.query.InvariantViolationException;
import net.tsreads.query.MissingReadSourceException;
import net.tsreads.query.ReadCancelledException;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadFilterRequest;
import net.tsreads.query.ReadGroupRequest;
import net.tsreads.query.ReadGroupRequest.GroupMode;
import net.tsreads.query.ResultSet;
import net.tsreads.query.StoreUpstreamException;
import net.tsreads.query.TagKeysRequest;
import net.tsreads.query.TagValuesRequest;
import net.tsreads.query.UnsupportedPredicateException;
import net.tsreads.query.predicate.Predicate;
import net.tsreads.query.predicate.PredicateNode;
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

public class TestReadStore {
  private static final long ORG = 42;
  private static final long BUCKET = 0x0a0b0c0d01020304L;
  private static final String DATABASE = "0a0b0c0d01020304";
  private static final long DAY = 86400;
  
  private TsdbStore store;
  private MetaClient meta_client;
  private Config config;
  private ReadContext context;
  private Envelope source;
  private Shard shard;
  private MockCursorIterator cursors;
  private List<CursorIterator> iterators;
  
  @Before
  public void before() throws Exception {
    store = mock(TsdbStore.class);
    meta_client = mock(MetaClient.class);
    config = new Config(false);
    context = ReadContext.background();
    source = ReadSources.encode(ORG, BUCKET);
    shard = mock(Shard.class);
    cursors = new MockCursorIterator();
    iterators = Lists.<CursorIterator>newArrayList(cursors);
    
    when(meta_client.database(DATABASE)).thenReturn(
        Deferred.fromResult(new DatabaseInfo(DATABASE, Lists.newArrayList(
            new RetentionPolicyInfo("autogen", DAY)))));
    when(meta_client.shardGroupsByTimeRange(eq(DATABASE), eq("autogen"), 
        anyLong(), anyLong()))
      .thenReturn(Deferred.fromResult(Lists.newArrayList(
          TestShardLocator.group(1, 0, DAY, 1))));
    when(store.shards(ImmutableList.of(1L)))
      .thenReturn(Lists.newArrayList(shard));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new ReadStore(null, meta_client, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new ReadStore(store, null, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new ReadStore(store, meta_client, config, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void readFilter() throws Exception {
    cursors.put("cpu", "usage", MockArrayCursor.floats(10, 20));
    when(store.newSeriesCursor(any(ReadContext.class), any(), 
        eq(Lists.newArrayList(shard))))
      .thenReturn(Optional.<SeriesCursor>of(new MockSeriesCursor(
          MockSeriesCursor.row("cpu", "usage", iterators, "host", "a"))));
    
    final ReadFilterRequest request = ReadFilterRequest.newBuilder()
        .setSource(source)
        .setRange(new TimeRange(1, DAY))
        .build();
    final ResultSet results = store().readFilter(context, request);
    assertTrue(results.next());
    assertEquals("a", results.tags().get("host"));
    final Optional<ArrayCursor<?>> cursor = results.cursor();
    assertTrue(cursor.isPresent());
    assertArrayEquals(new long[] { 10, 20 }, 
        cursor.get().next().timestamps());
    assertFalse(results.next());
    results.close();
    
    verify(meta_client).shardGroupsByTimeRange(DATABASE, "autogen", 1, DAY);
    assertEquals(1, cursors.requests.size());
    assertEquals(1, cursors.requests.get(0).start());
    assertEquals(DAY, cursors.requests.get(0).end());
  }
  
  @Test
  public void readFilterWritesBackClampedRange() throws Exception {
    when(store.newSeriesCursor(any(ReadContext.class), any(), anyList()))
      .thenReturn(Optional.<SeriesCursor>empty());
    final ReadFilterRequest request = ReadFilterRequest.newBuilder()
        .setSource(source)
        .setRange(new TimeRange(0, 0))
        .build();
    assertSame(ResultSet.empty(), store().readFilter(context, request));
    assertEquals(new TimeRange(Const.MIN_NANO_TIME, Const.MAX_NANO_TIME), 
        request.range());
  }
  
  @Test
  public void readFilterDatabaseNotFound() throws Exception {
    when(meta_client.database(DATABASE))
      .thenReturn(Deferred.<DatabaseInfo>fromResult(null));
    try {
      store().readFilter(context, ReadFilterRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
      fail("Expected DatabaseNotFoundException");
    } catch (DatabaseNotFoundException e) { }
    verifyNoInteractions(store);
    verify(meta_client, never()).shardGroupsByTimeRange(anyString(), 
        anyString(), anyLong(), anyLong());
  }
  
  @Test
  public void readFilterMissingSource() throws Exception {
    try {
      store().readFilter(context, ReadFilterRequest.newBuilder()
          .setRange(new TimeRange(1, DAY))
          .build());
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
    verifyNoInteractions(meta_client);
    verifyNoInteractions(store);
  }
  
  @Test
  public void readFilterNoShards() throws Exception {
    noShards();
    assertSame(ResultSet.empty(), store().readFilter(context, 
        ReadFilterRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build()));
    verifyNoInteractions(store);
  }
  
  @Test
  public void readFilterStoreFailure() throws Exception {
    when(store.newSeriesCursor(any(ReadContext.class), any(), anyList()))
      .thenThrow(new IllegalStateException("Boo!"));
    try {
      store().readFilter(context, ReadFilterRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
      fail("Expected StoreUpstreamException");
    } catch (StoreUpstreamException e) { }
  }
  
  @Test
  public void readFilterCancelled() throws Exception {
    context.cancel();
    try {
      store().readFilter(context, ReadFilterRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
      fail("Expected ReadCancelledException");
    } catch (ReadCancelledException e) { }
    verifyNoInteractions(store);
  }
  
  @Test
  public void readGroup() throws Exception {
    cursors.put("cpu", "usage", MockArrayCursor.floats(10));
    when(store.newSeriesCursor(any(ReadContext.class), any(), anyList()))
      .thenReturn(Optional.<SeriesCursor>of(new MockSeriesCursor(
          MockSeriesCursor.row("cpu", "usage", iterators, "host", "a"))));
    
    final GroupResultSet results = store().readGroup(context, 
        ReadGroupRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setGroup(GroupMode.BY)
          .setGroupKeys(Lists.newArrayList("host"))
          .build());
    assertTrue(results.next());
    final GroupCursor group = results.group();
    assertEquals(Lists.newArrayList("a"), group.partitionKeyValues());
    assertTrue(group.next());
    assertTrue(group.cursor().isPresent());
    assertFalse(group.next());
    assertFalse(results.next());
    results.close();
  }
  
  @Test
  public void readGroupNoShards() throws Exception {
    noShards();
    assertSame(GroupResultSet.empty(), store().readGroup(context, 
        ReadGroupRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build()));
    verifyNoInteractions(store);
  }
  
  @Test
  public void tagKeys() throws Exception {
    when(store.tagKeys(eq(OpenAuthorizer.INSTANCE), 
        eq(ImmutableList.of(1L)), any()))
      .thenReturn(Lists.newArrayList(
          new TagKeys("cpu", Lists.newArrayList("host", "dc")), 
          new TagKeys("mem", Lists.newArrayList("zone", "host"))));
    final StringIterator it = store().tagKeys(context, 
        TagKeysRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
    assertEquals(Lists.newArrayList(
        "_field", "_measurement", "dc", "host", "zone"), drain(it));
  }
  
  @Test
  public void tagKeysNoShards() throws Exception {
    noShards();
    final StringIterator it = store().tagKeys(context, 
        TagKeysRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
    assertEquals(Lists.newArrayList("_field", "_measurement"), drain(it));
    verifyNoInteractions(store);
  }
  
  @Test
  public void tagKeysDropsFieldComparisons() throws Exception {
    when(store.tagKeys(eq(OpenAuthorizer.INSTANCE), 
        eq(ImmutableList.of(1L)), any()))
      .thenReturn(Lists.<TagKeys>newArrayList());
    store().tagKeys(context, TagKeysRequest.newBuilder()
        .setSource(source)
        .setRange(new TimeRange(1, DAY))
        .setPredicate(new Predicate(PredicateNode.logical(
            PredicateNode.Logical.AND, 
            equal("_field", "idle"), 
            equal("host", "a"))))
        .build());
    
    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Node<ExprVisitor>> captor = 
        ArgumentCaptor.forClass(Node.class);
    verify(store).tagKeys(eq(OpenAuthorizer.INSTANCE), 
        eq(ImmutableList.of(1L)), captor.capture());
    assertEquals(new Comparison(Comparison.Op.EQ, new Key("host"), 
        new StringLiteral("a")), captor.getValue());
  }
  
  @Test
  public void tagKeysStoreFailure() throws Exception {
    when(store.tagKeys(eq(OpenAuthorizer.INSTANCE), anyList(), any()))
      .thenThrow(new IllegalStateException("Boo!"));
    try {
      store().tagKeys(context, TagKeysRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .build());
      fail("Expected StoreUpstreamException");
    } catch (StoreUpstreamException e) { }
  }
  
  @Test
  public void tagValues() throws Exception {
    when(store.tagValues(eq(OpenAuthorizer.INSTANCE), 
        eq(ImmutableList.of(1L)), any()))
      .thenReturn(Lists.newArrayList(
          new TagValues("cpu", Lists.newArrayList(
              new TagValues.KeyValue("host", "web02"), 
              new TagValues.KeyValue("host", "web01"))), 
          new TagValues("mem", Lists.newArrayList(
              new TagValues.KeyValue("host", "web02")))));
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey("host")
          .setPredicate(new Predicate(equal("dc", "lga")))
          .build());
    assertEquals(Lists.newArrayList("web01", "web02"), drain(it));
    
    @SuppressWarnings("unchecked")
    final ArgumentCaptor<Node<ExprVisitor>> captor = 
        ArgumentCaptor.forClass(Node.class);
    verify(store).tagValues(eq(OpenAuthorizer.INSTANCE), 
        eq(ImmutableList.of(1L)), captor.capture());
    assertEquals(new And(
        new Comparison(Comparison.Op.EQ, new Key(Const.TAG_KEY_KEY), 
            new StringLiteral("host")), 
        new Paren(new Comparison(Comparison.Op.EQ, new Key("dc"), 
            new StringLiteral("lga")))), captor.getValue());
  }
  
  @Test
  public void tagValuesNoShards() throws Exception {
    noShards();
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey("host")
          .build());
    assertFalse(it.hasNext());
    verifyNoInteractions(store);
  }
  
  @Test
  public void tagValuesFieldValuePredicate() throws Exception {
    try {
      store().tagValues(context, TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey("host")
          .setPredicate(new Predicate(PredicateNode.comparison(
              PredicateNode.Comparison.GT, 
              PredicateNode.tagRef(Const.VALUE_KEY), 
              PredicateNode.integerLiteral(10))))
          .build());
      fail("Expected UnsupportedPredicateException");
    } catch (UnsupportedPredicateException e) { }
    verifyNoInteractions(store);
  }
  
  @Test
  public void tagValuesMeasurementFromIndex() throws Exception {
    when(store.measurementNames(OpenAuthorizer.INSTANCE, DATABASE, null))
      .thenReturn(Lists.newArrayList("mem", "cpu", "mem"));
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey(Const.MEASUREMENT_KEY)
          .build());
    assertEquals(Lists.newArrayList("cpu", "mem"), drain(it));
    verify(store, never()).newConditionSeriesCursor(any(ReadContext.class), 
        any(), anyList());
  }
  
  @Test
  public void tagValuesMeasurementByScan() throws Exception {
    cursors.put("cpu", "idle", MockArrayCursor.floats(10))
           .put("mem", "idle", MockArrayCursor.floats());
    when(store.newConditionSeriesCursor(any(ReadContext.class), any(), 
        eq(Lists.newArrayList(shard))))
      .thenReturn(Optional.<SeriesCursor>of(new MockSeriesCursor(
          MockSeriesCursor.row("cpu", "idle", iterators), 
          MockSeriesCursor.row("mem", "idle", iterators))));
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey(Const.MEASUREMENT_TAG_KEY)
          .setPredicate(new Predicate(equal(Const.FIELD_KEY, "idle")))
          .build());
    assertEquals(Lists.newArrayList("cpu"), drain(it));
    verify(store, never()).measurementNames(any(), anyString(), any());
  }
  
  @Test
  public void tagValuesFieldFromIterator() throws Exception {
    final PointIterator iterator = iterator(
        new AuxPoint("cpu", 0, Lists.<Object>newArrayList("load")), 
        new AuxPoint("cpu", 0, Lists.<Object>newArrayList("idle")), 
        new AuxPoint("mem", 0, Lists.<Object>newArrayList("load")));
    final ShardGroup group = mock(ShardGroup.class);
    when(store.shardGroup(ImmutableList.of(1L))).thenReturn(group);
    when(group.createIterator(any(ReadContext.class), 
        any(IteratorSource.class), any(IteratorOptions.class)))
      .thenReturn(iterator);
    
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey(Const.FIELD_KEY_TAG_KEY)
          .build());
    assertEquals(Lists.newArrayList("idle", "load"), drain(it));
    verify(iterator).close();
    
    final ArgumentCaptor<IteratorSource> captor = 
        ArgumentCaptor.forClass(IteratorSource.class);
    verify(group).createIterator(any(ReadContext.class), captor.capture(), 
        any(IteratorOptions.class));
    assertEquals(DATABASE, captor.getValue().database());
    assertEquals("autogen", captor.getValue().retentionPolicy());
    assertEquals(IteratorSource.FIELD_KEYS_ITERATOR, 
        captor.getValue().systemIterator());
  }
  
  @Test
  public void tagValuesFieldNonStringName() throws Exception {
    final PointIterator iterator = iterator(
        new AuxPoint("cpu", 0, Lists.<Object>newArrayList(42L)));
    final ShardGroup group = mock(ShardGroup.class);
    when(store.shardGroup(ImmutableList.of(1L))).thenReturn(group);
    when(group.createIterator(any(ReadContext.class), 
        any(IteratorSource.class), any(IteratorOptions.class)))
      .thenReturn(iterator);
    try {
      store().tagValues(context, TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey(Const.FIELD_KEY)
          .build());
      fail("Expected InvariantViolationException");
    } catch (InvariantViolationException e) { }
    verify(iterator).close();
  }
  
  @Test
  public void tagValuesFieldByScan() throws Exception {
    cursors.put("cpu", "idle", MockArrayCursor.floats(10))
           .put("cpu", "user", MockArrayCursor.integers(10));
    when(store.newConditionSeriesCursor(any(ReadContext.class), any(), 
        anyList()))
      .thenReturn(Optional.<SeriesCursor>of(new MockSeriesCursor(
          MockSeriesCursor.row("cpu", "user", iterators, "host", "a"), 
          MockSeriesCursor.row("cpu", "idle", iterators, "host", "a"))));
    final StringIterator it = store().tagValues(context, 
        TagValuesRequest.newBuilder()
          .setSource(source)
          .setRange(new TimeRange(1, DAY))
          .setTagKey(Const.FIELD_KEY)
          .setPredicate(new Predicate(equal("host", "a")))
          .build());
    assertEquals(Lists.newArrayList("idle", "user"), drain(it));
    verify(store, never()).shardGroup(anyList());
  }
  
  @Test
  public void getSource() throws Exception {
    assertEquals(ReadSources.encode(ORG, BUCKET), 
        store().getSource(ORG, BUCKET));
  }
  
  @Test
  public void mergeSorted() throws Exception {
    assertEquals(Lists.newArrayList("a", "b", "c"), ReadStore.mergeSorted(
        Lists.newArrayList("a", "a", "b", "c", "c", "c")));
    assertTrue(ReadStore.mergeSorted(new ArrayList<String>()).isEmpty());
  }
  
  private ReadStore store() {
    return new ReadStore(store, meta_client, config);
  }
  
  private void noShards() {
    when(meta_client.shardGroupsByTimeRange(anyString(), anyString(), 
        anyLong(), anyLong()))
      .thenReturn(Deferred.fromResult(Lists.<ShardGroupInfo>newArrayList()));
  }
  
  private static PredicateNode equal(final String key, final String value) {
    return PredicateNode.comparison(PredicateNode.Comparison.EQUAL, 
        PredicateNode.tagRef(key), PredicateNode.stringLiteral(value));
  }
  
  private static PointIterator iterator(final AuxPoint... points) {
    final PointIterator iterator = mock(PointIterator.class);
    final Boolean[] more = new Boolean[points.length];
    for (int i = 0; i < more.length; i++) {
      more[i] = i < points.length - 1;
    }
    when(iterator.hasNext()).thenReturn(true, more);
    when(iterator.next()).thenReturn(points[0], 
        java.util.Arrays.copyOfRange(points, 1, points.length));
    return iterator;
  }
  
  private static List<String> drain(final StringIterator it) {
    final List<String> values = new ArrayList<String>();
    while (it.hasNext()) {
      values.add(it.next());
    }
    return values;
  }
}
