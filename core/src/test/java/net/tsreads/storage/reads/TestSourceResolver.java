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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.tsreads.common.Const;
import net.tsreads.meta.DatabaseInfo;
import net.tsreads.meta.MetaClient;
import net.tsreads.meta.RetentionPolicyInfo;
import net.tsreads.query.DatabaseNotFoundException;
import net.tsreads.query.InvalidRetentionPolicyException;
import net.tsreads.query.ReadCancelledException;
import net.tsreads.query.ReadContext;
import net.tsreads.query.ReadException;
import net.tsreads.query.StoreUpstreamException;
import net.tsreads.utils.Config;

public class TestSourceResolver {
  private static final long BUCKET = 0x0a0b0c0d01020304L;
  private static final String DATABASE = "0a0b0c0d01020304";
  
  private MetaClient meta_client;
  private Config config;
  private ReadContext context;
  
  @Before
  public void before() throws Exception {
    meta_client = mock(MetaClient.class);
    config = new Config(false);
    context = ReadContext.background();
    when(meta_client.database(DATABASE)).thenReturn(
        Deferred.fromResult(new DatabaseInfo(DATABASE, Lists.newArrayList(
            new RetentionPolicyInfo("autogen", 86400000000000L)))));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new SourceResolver(null, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new SourceResolver(meta_client, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void resolve() throws Exception {
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    final ResolvedSource source = resolver.resolve(context, 42, BUCKET, 
        1000, 86400);
    assertEquals(42, source.orgId());
    assertEquals(DATABASE, source.database());
    assertEquals("autogen", source.retentionPolicy());
    assertEquals(1000, source.start());
    assertEquals(86400, source.end());
    assertEquals(1000, source.range().start());
    assertEquals(86400, source.range().end());
  }
  
  @Test
  public void resolveClampsUnsetBounds() throws Exception {
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    ResolvedSource source = resolver.resolve(context, 42, BUCKET, 0, 0);
    assertEquals(Const.MIN_NANO_TIME, source.start());
    assertEquals(Const.MAX_NANO_TIME, source.end());
    
    source = resolver.resolve(context, 42, BUCKET, -5, 100);
    assertEquals(Const.MIN_NANO_TIME, source.start());
    assertEquals(100, source.end());
    
    source = resolver.resolve(context, 42, BUCKET, 100, -1);
    assertEquals(100, source.start());
    assertEquals(Const.MAX_NANO_TIME, source.end());
    
    // inverted ranges are passed through
    source = resolver.resolve(context, 42, BUCKET, 500, 100);
    assertEquals(500, source.start());
    assertEquals(100, source.end());
  }
  
  @Test
  public void resolveNoDatabase() throws Exception {
    when(meta_client.database(anyString())).thenReturn(
        Deferred.<DatabaseInfo>fromResult(null));
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    try {
      resolver.resolve(context, 42, BUCKET, 0, 0);
      fail("Expected DatabaseNotFoundException");
    } catch (DatabaseNotFoundException e) { 
      assertEquals(ReadException.Kind.NOT_FOUND, e.kind());
    }
  }
  
  @Test
  public void resolveNoRetentionPolicy() throws Exception {
    when(meta_client.database(DATABASE)).thenReturn(
        Deferred.fromResult(new DatabaseInfo(DATABASE, Lists.newArrayList(
            new RetentionPolicyInfo("weekly", 86400000000000L)))));
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    try {
      resolver.resolve(context, 42, BUCKET, 0, 0);
      fail("Expected InvalidRetentionPolicyException");
    } catch (InvalidRetentionPolicyException e) { 
      assertEquals(ReadException.Kind.INVALID_CONFIG, e.kind());
    }
    
    // configured policy
    config.overrideConfig(Config.DEFAULT_RETENTION_POLICY_KEY, "weekly");
    assertEquals("weekly", new SourceResolver(meta_client, config)
        .resolve(context, 42, BUCKET, 0, 0).retentionPolicy());
  }
  
  @Test
  public void resolveMetaFailure() throws Exception {
    final IllegalStateException ex = new IllegalStateException("Boo!");
    when(meta_client.database(DATABASE)).thenReturn(
        Deferred.<DatabaseInfo>fromError(ex));
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    try {
      resolver.resolve(context, 42, BUCKET, 0, 0);
      fail("Expected StoreUpstreamException");
    } catch (StoreUpstreamException e) { 
      assertEquals(ReadException.Kind.UPSTREAM_FAILURE, e.kind());
      assertSame(ex, e.getCause());
    }
  }
  
  @Test
  public void resolveCancelled() throws Exception {
    when(meta_client.database(DATABASE)).thenReturn(
        new Deferred<DatabaseInfo>());
    final SourceResolver resolver = new SourceResolver(meta_client, config);
    context.cancel();
    try {
      resolver.resolve(context, 42, BUCKET, 0, 0);
      fail("Expected ReadCancelledException");
    } catch (ReadCancelledException e) { }
  }
  
  @Test
  public void databaseName() throws Exception {
    assertEquals("0000000000000001", SourceResolver.databaseName(1));
    assertEquals(DATABASE, SourceResolver.databaseName(BUCKET));
    assertEquals("ffffffffffffffff", SourceResolver.databaseName(-1));
  }
}
