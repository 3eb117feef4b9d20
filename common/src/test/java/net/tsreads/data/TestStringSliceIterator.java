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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestStringSliceIterator {

  @Test
  public void iterate() throws Exception {
    final List<String> values = Lists.newArrayList("a", "b");
    final StringSliceIterator it = new StringSliceIterator(values);
    values.add("c");
    
    assertEquals(2, it.remaining());
    assertTrue(it.hasNext());
    assertEquals("a", it.next());
    assertEquals(1, it.remaining());
    assertEquals("b", it.next());
    assertEquals(0, it.remaining());
    assertFalse(it.hasNext());
    try {
      it.next();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }
  }
  
  @Test
  public void empty() throws Exception {
    final StringIterator it = StringIterator.empty();
    assertFalse(it.hasNext());
    assertEquals(0, it.remaining());
    try {
      it.next();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException e) { }
    
    try {
      new StringSliceIterator(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
