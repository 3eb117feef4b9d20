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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Optional;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.tsreads.data.SeriesTags;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.CursorIterator;
import net.tsreads.data.cursors.CursorRequest;
import net.tsreads.data.cursors.DataType;
import net.tsreads.data.cursors.MockArrayCursor;
import net.tsreads.data.cursors.MockCursorIterator;
import net.tsreads.data.cursors.MockSeriesCursor;
import net.tsreads.data.cursors.SeriesRow;
import net.tsreads.data.cursors.TimestampArray;
import net.tsreads.query.InvariantViolationException;

public class TestMultiShardArrayCursor {
  
  private static final CursorRequest REQUEST = CursorRequest.newBuilder()
      .setName("cpu")
      .setField("idle")
      .setStart(0)
      .setEnd(1000)
      .build();
  
  @Test
  public void openNoShardHasCursor() throws Exception {
    final MockCursorIterator shard_1 = new MockCursorIterator();
    final MockCursorIterator shard_2 = new MockCursorIterator();
    assertFalse(MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(shard_1, shard_2)).isPresent());
    assertEquals(1, shard_1.requests.size());
    assertEquals(1, shard_2.requests.size());
    
    assertFalse(MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList()).isPresent());
  }
  
  @Test
  public void concatenatesLazily() throws Exception {
    final MockArrayCursor c1 = MockArrayCursor.floats(1, 2);
    final MockArrayCursor c3 = MockArrayCursor.floats(5);
    final MockCursorIterator shard_1 = new MockCursorIterator()
        .put("cpu", "idle", c1);
    final MockCursorIterator shard_2 = new MockCursorIterator();
    final MockCursorIterator shard_3 = new MockCursorIterator()
        .put("cpu", "idle", c3);
    
    final Optional<ArrayCursor<?>> opened = MultiShardArrayCursor.open(
        REQUEST, Lists.<CursorIterator>newArrayList(shard_1, shard_2, shard_3));
    assertTrue(opened.isPresent());
    final ArrayCursor<?> cursor = opened.get();
    assertEquals(DataType.FLOAT, cursor.type());
    // later shards untouched until needed
    assertTrue(shard_2.requests.isEmpty());
    assertTrue(shard_3.requests.isEmpty());
    
    TimestampArray block = cursor.next();
    assertArrayEquals(new long[] { 1, 2 }, block.timestamps());
    assertTrue(shard_2.requests.isEmpty());
    
    block = cursor.next();
    assertArrayEquals(new long[] { 5 }, block.timestamps());
    assertEquals(1, c1.closed);
    assertEquals(1, shard_2.requests.size());
    assertEquals(1, shard_3.requests.size());
    
    block = cursor.next();
    assertEquals(0, block.len());
    assertEquals(1, c3.closed);
    assertEquals(0, cursor.next().len());
    
    cursor.close();
    cursor.close();
    assertEquals(1, c1.closed);
    assertEquals(1, c3.closed);
  }
  
  @Test
  public void skipsTypeConflicts() throws Exception {
    final MockArrayCursor c1 = MockArrayCursor.floats();
    final MockArrayCursor c2 = MockArrayCursor.integers(3, 4);
    final MockArrayCursor c3 = MockArrayCursor.floats(7);
    final ArrayCursor<?> cursor = MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(
            new MockCursorIterator().put("cpu", "idle", c1), 
            new MockCursorIterator().put("cpu", "idle", c2), 
            new MockCursorIterator().put("cpu", "idle", c3))).get();
    
    final TimestampArray block = cursor.next();
    assertEquals(DataType.FLOAT, block.type());
    assertArrayEquals(new long[] { 7 }, block.timestamps());
    assertEquals(1, c1.closed);
    assertEquals(1, c2.closed);
    assertEquals(0, c2.reads);
    
    cursor.close();
    assertEquals(1, c3.closed);
  }
  
  @Test
  public void closeBeforeExhausted() throws Exception {
    final MockArrayCursor c1 = MockArrayCursor.floats(1);
    final MockArrayCursor c2 = MockArrayCursor.floats(2);
    final MockCursorIterator shard_2 = new MockCursorIterator()
        .put("cpu", "idle", c2);
    final ArrayCursor<?> cursor = MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(
            new MockCursorIterator().put("cpu", "idle", c1), shard_2)).get();
    cursor.next();
    cursor.close();
    assertEquals(1, c1.closed);
    assertTrue(shard_2.requests.isEmpty());
    assertEquals(0, c2.closed);
  }
  
  @Test
  public void hasData() throws Exception {
    ArrayCursor<?> cursor = MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(
            new MockCursorIterator().put("cpu", "idle", 
                MockArrayCursor.floats()), 
            new MockCursorIterator().put("cpu", "idle", 
                MockArrayCursor.floats(42)))).get();
    assertTrue(cursor.hasData());
    cursor.close();
    
    cursor = MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(
            new MockCursorIterator().put("cpu", "idle", 
                MockArrayCursor.floats()))).get();
    assertFalse(cursor.hasData());
    cursor.close();
  }
  
  @Test
  public void nullBlock() throws Exception {
    final MockArrayCursor c1 = new MockArrayCursor(DataType.STRING) {
      @Override
      public TimestampArray next() {
        return null;
      }
    };
    final ArrayCursor<?> cursor = MultiShardArrayCursor.open(REQUEST, 
        Lists.<CursorIterator>newArrayList(
            new MockCursorIterator().put("cpu", "idle", c1))).get();
    try {
      cursor.next();
      fail("Expected InvariantViolationException");
    } catch (InvariantViolationException e) { }
    
    try {
      c1.hasData();
      fail("Expected InvariantViolationException");
    } catch (InvariantViolationException e) { }
  }
  
  @Test
  public void request() throws Exception {
    final List<CursorIterator> iterators = Lists.newArrayList();
    final SeriesRow row = MockSeriesCursor.row("cpu", "idle", iterators, 
        "host", "web01");
    CursorRequest request = MultiShardArrayCursor.request(row, 10, 20, false);
    assertEquals("cpu", request.name());
    assertEquals("idle", request.field());
    assertEquals(SeriesTags.of(java.util.Collections.singletonMap(
        "host", "web01")), request.tags());
    assertEquals(10, request.start());
    assertEquals(20, request.end());
    assertTrue(request.ascending());
    
    request = MultiShardArrayCursor.request(row, 10, 20, true);
    assertFalse(request.ascending());
  }
}
