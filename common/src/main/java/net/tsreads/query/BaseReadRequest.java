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
package net.tsreads.query;

import net.tsreads.data.Envelope;
import net.tsreads.data.TimeRange;
import net.tsreads.query.predicate.Predicate;

/**
 * Fields shared by all read requests. The range is replaced with the 
 * effective, clamped range once the request has been resolved so that 
 * downstream consumers see what was actually read.
 * 
 * @since 1.0
 */
public abstract class BaseReadRequest {
  
  /** The encoded read source, may be null. */
  protected final Envelope source;
  
  /** The requested or, once resolved, effective range. */
  protected TimeRange range;
  
  /** The optional predicate. */
  protected final Predicate predicate;
  
  protected BaseReadRequest(final Builder<?> builder) {
    source = builder.source;
    range = builder.range == null ? new TimeRange(0, 0) : builder.range;
    predicate = builder.predicate;
  }
  
  /** @return The encoded read source or null if the request had none. */
  public Envelope source() {
    return source;
  }
  
  /** @return The time range. */
  public TimeRange range() {
    return range;
  }
  
  /**
   * Replaces the range with the effective one.
   * @param range The non-null range.
   */
  public void setRange(final TimeRange range) {
    if (range == null) {
      throw new IllegalArgumentException("Range cannot be null.");
    }
    this.range = range;
  }
  
  /** @return The predicate or null if the request had none. */
  public Predicate predicate() {
    return predicate;
  }
  
  public static abstract class Builder<B extends Builder<B>> {
    private Envelope source;
    private TimeRange range;
    private Predicate predicate;
    
    public B setSource(final Envelope source) {
      this.source = source;
      return self();
    }
    
    public B setRange(final TimeRange range) {
      this.range = range;
      return self();
    }
    
    public B setPredicate(final Predicate predicate) {
      this.predicate = predicate;
      return self();
    }
    
    protected abstract B self();
  }
}
