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
package net.tsreads.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class TestIds {

  @Test
  public void toHex() throws Exception {
    assertEquals("0000000000000000", Ids.toHex(0));
    assertEquals("0000000000001234", Ids.toHex(0x1234));
    assertEquals("ffffffffffffffff", Ids.toHex(-1));
    assertEquals("8000000000000000", Ids.toHex(Long.MIN_VALUE));
  }
  
  @Test
  public void fromHex() throws Exception {
    assertEquals(0x1234, Ids.fromHex("0000000000001234"));
    assertEquals(-1, Ids.fromHex("ffffffffffffffff"));
    assertEquals(-1, Ids.fromHex("FFFFFFFFFFFFFFFF"));
    assertEquals(Long.MIN_VALUE, Ids.fromHex(Ids.toHex(Long.MIN_VALUE)));
    
    try {
      Ids.fromHex(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Ids.fromHex("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Ids.fromHex("1234");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Ids.fromHex("000000000000123g");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
