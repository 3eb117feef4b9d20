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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.tsreads.common.Const;
import net.tsreads.data.Envelope;
import net.tsreads.data.ReadSource;
import net.tsreads.query.MissingReadSourceException;
import net.tsreads.query.ReadException;

public class TestReadSources {
  
  @Test
  public void encode() throws Exception {
    final Envelope envelope = ReadSources.encode(0x1234L, -1L);
    assertEquals(ReadSources.TYPE_URL, envelope.typeUrl());
    assertEquals("{\"orgId\":\"0000000000001234\","
        + "\"bucketId\":\"ffffffffffffffff\"}", 
        new String(envelope.value(), Const.UTF8_CHARSET));
    
    final ReadSource source = ReadSources.decode(envelope);
    assertEquals(0x1234L, source.organizationId());
    assertEquals(-1L, source.bucketId());
  }
  
  @Test
  public void decode() throws Exception {
    final ReadSource source = ReadSources.decode(new Envelope(
        ReadSources.TYPE_URL, 
        ("{\"bucketId\":\"00000000000000ff\",\"orgId\":\"0000000000000001\","
            + "\"extra\":true}").getBytes(Const.UTF8_CHARSET)));
    assertEquals(1, source.organizationId());
    assertEquals(255, source.bucketId());
  }
  
  @Test
  public void decodeMissing() throws Exception {
    try {
      ReadSources.decode(null);
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { 
      assertEquals(ReadException.Kind.MISSING_SOURCE, e.kind());
    }
  }
  
  @Test
  public void decodeBadType() throws Exception {
    try {
      ReadSources.decode(new Envelope("type.tsreads.net/Other", 
          ReadSources.encode(1, 2).value()));
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
  }
  
  @Test
  public void decodeBadPayload() throws Exception {
    try {
      ReadSources.decode(new Envelope(ReadSources.TYPE_URL, 
          "not json".getBytes(Const.UTF8_CHARSET)));
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
    
    try {
      ReadSources.decode(new Envelope(ReadSources.TYPE_URL, new byte[0]));
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
    
    // bad id
    try {
      ReadSources.decode(new Envelope(ReadSources.TYPE_URL, 
          "{\"orgId\":\"12\",\"bucketId\":\"00000000000000ff\"}"
            .getBytes(Const.UTF8_CHARSET)));
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
    
    // missing id
    try {
      ReadSources.decode(new Envelope(ReadSources.TYPE_URL, 
          "{\"bucketId\":\"00000000000000ff\"}".getBytes(Const.UTF8_CHARSET)));
      fail("Expected MissingReadSourceException");
    } catch (MissingReadSourceException e) { }
  }
}
