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

import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.ExprVisitor;

/**
 * The request scoped state of a tag value, measurement name or field name
 * lookup: where to look, over what range and with which translated 
 * predicate.
 * 
 * @since 1.0
 */
public class MetaqueryAttributes {
  
  private final long org_id;
  
  private final String database;
  
  private final String retention_policy;
  
  private final long start;
  
  private final long end;
  
  /** The translated predicate, null for none. */
  private final Node<ExprVisitor> predicate;
  
  protected MetaqueryAttributes(final Builder builder) {
    if (builder.database == null) {
      throw new IllegalArgumentException("Database cannot be null.");
    }
    if (builder.retentionPolicy == null) {
      throw new IllegalArgumentException("Retention policy cannot be null.");
    }
    org_id = builder.orgId;
    database = builder.database;
    retention_policy = builder.retentionPolicy;
    start = builder.start;
    end = builder.end;
    predicate = builder.predicate;
  }
  
  public long orgId() {
    return org_id;
  }
  
  public String database() {
    return database;
  }
  
  public String retentionPolicy() {
    return retention_policy;
  }
  
  public long start() {
    return start;
  }
  
  public long end() {
    return end;
  }
  
  /** @return The translated predicate or null if there isn't one. */
  public Node<ExprVisitor> predicate() {
    return predicate;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{database=")
        .append(database)
        .append(", retentionPolicy=")
        .append(retention_policy)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", predicate=")
        .append(predicate)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * @param source A resolved source.
   * @return A builder populated from the source.
   */
  public static Builder newBuilder(final ResolvedSource source) {
    return new Builder()
        .setOrgId(source.orgId())
        .setDatabase(source.database())
        .setRetentionPolicy(source.retentionPolicy())
        .setStart(source.start())
        .setEnd(source.end());
  }
  
  public static class Builder {
    private long orgId;
    private String database;
    private String retentionPolicy;
    private long start;
    private long end;
    private Node<ExprVisitor> predicate;
    
    public Builder setOrgId(final long org_id) {
      orgId = org_id;
      return this;
    }
    
    public Builder setDatabase(final String database) {
      this.database = database;
      return this;
    }
    
    public Builder setRetentionPolicy(final String retention_policy) {
      retentionPolicy = retention_policy;
      return this;
    }
    
    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }
    
    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }
    
    public Builder setPredicate(final Node<ExprVisitor> predicate) {
      this.predicate = predicate;
      return this;
    }
    
    public MetaqueryAttributes build() {
      return new MetaqueryAttributes(this);
    }
  }
}
