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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

public class TestSeriesTags {

  @Test
  public void of() throws Exception {
    final Map<String, String> map = Maps.newHashMap();
    map.put("host", "web01");
    map.put("dc", "phx");
    final SeriesTags tags = SeriesTags.of(map);
    map.put("zone", "a");
    
    assertEquals(2, tags.size());
    assertEquals(Lists.newArrayList("dc", "host"), 
        Lists.newArrayList(tags.keys()));
    assertEquals("web01", tags.get("host"));
    assertTrue(tags.has("dc"));
    assertFalse(tags.has("zone"));
    assertEquals("", tags.get("zone"));
    
    try {
      SeriesTags.of(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void equality() throws Exception {
    final Map<String, String> map = Maps.newHashMap();
    map.put("host", "web01");
    assertEquals(SeriesTags.of(map), SeriesTags.of(map));
    assertEquals(SeriesTags.of(map).hashCode(), SeriesTags.of(map).hashCode());
    assertNotEquals(SeriesTags.EMPTY, SeriesTags.of(map));
    assertEquals(0, SeriesTags.EMPTY.size());
  }
}
