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

import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.CursorIterator;
import net.tsreads.data.cursors.MockArrayCursor;
import net.tsreads.data.cursors.MockCursorIterator;
import net.tsreads.data.cursors.MockSeriesCursor;
import net.tsreads.query.ReadCancelledException;
import net.tsreads.query.ReadContext;

public class TestFilteredResultSet {
  
  private ReadContext context;
  private MockArrayCursor cpu_idle;
  private MockArrayCursor mem_free;
  private MockCursorIterator shard;
  private MockSeriesCursor series;
  
  @Before
  public void before() throws Exception {
    context = ReadContext.background();
    cpu_idle = MockArrayCursor.floats(10, 20);
    mem_free = MockArrayCursor.integers(15);
    shard = new MockCursorIterator()
        .put("cpu", "idle", cpu_idle)
        .put("mem", "free", mem_free);
    series = new MockSeriesCursor(
        MockSeriesCursor.row("cpu", "idle", 
            Lists.<CursorIterator>newArrayList(shard), "host", "web01"),
        MockSeriesCursor.row("disk", "used", 
            Lists.<CursorIterator>newArrayList(shard), "host", "web01"),
        MockSeriesCursor.row("mem", "free", 
            Lists.<CursorIterator>newArrayList(shard), "host", "web02"));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new FilteredResultSet(null, 0, 100, false, series);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new FilteredResultSet(context, 0, 100, false, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new FilteredResultSet(context, 0, 100, false, series, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void iterate() throws Exception {
    final FilteredResultSet results = 
        new FilteredResultSet(context, 5, 100, true, series);
    
    assertTrue(results.next());
    assertEquals("web01", results.tags().get("host"));
    assertEquals("cpu", results.tags().get("_measurement"));
    Optional<ArrayCursor<?>> cursor = results.cursor();
    assertTrue(cursor.isPresent());
    assertArrayEquals(new long[] { 10, 20 }, cursor.get().next().timestamps());
    assertEquals(5, shard.requests.get(0).start());
    assertEquals(100, shard.requests.get(0).end());
    assertFalse(shard.requests.get(0).ascending());
    
    // no data for this series and field
    assertTrue(results.next());
    assertEquals(1, cpu_idle.closed);
    assertEquals("disk", results.tags().get("_measurement"));
    assertFalse(results.cursor().isPresent());
    
    assertTrue(results.next());
    assertEquals("web02", results.tags().get("host"));
    cursor = results.cursor();
    assertTrue(cursor.get().hasData());
    
    assertFalse(results.next());
    assertEquals(1, mem_free.closed);
    assertEquals(0, series.closed);
    
    results.close();
    results.close();
    assertEquals(1, series.closed);
    assertFalse(results.next());
  }
  
  @Test
  public void closeWithCursorOut() throws Exception {
    final FilteredResultSet results = 
        new FilteredResultSet(context, 5, 100, false, series);
    assertTrue(results.next());
    results.cursor();
    results.close();
    assertEquals(1, cpu_idle.closed);
    assertEquals(1, series.closed);
  }
  
  @Test
  public void accessorsWithoutSeries() throws Exception {
    final FilteredResultSet results = 
        new FilteredResultSet(context, 5, 100, false, series);
    try {
      results.tags();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    try {
      results.cursor();
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }
  
  @Test
  public void cancelled() throws Exception {
    final FilteredResultSet results = 
        new FilteredResultSet(context, 5, 100, false, series);
    assertTrue(results.next());
    results.cursor();
    context.cancel();
    try {
      results.next();
      fail("Expected ReadCancelledException");
    } catch (ReadCancelledException e) { }
    assertEquals(1, cpu_idle.closed);
    assertEquals(1, series.closed);
  }
  
  @Test
  public void cancelCheckInterval() throws Exception {
    final FilteredResultSet results = 
        new FilteredResultSet(context, 5, 100, false, series, 2);
    context.cancel();
    // first series is read without a check
    assertTrue(results.next());
    try {
      results.next();
      fail("Expected ReadCancelledException");
    } catch (ReadCancelledException e) { }
    assertEquals(1, series.closed);
  }
}
