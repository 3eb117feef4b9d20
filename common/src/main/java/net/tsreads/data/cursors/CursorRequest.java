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
package net.tsreads.data.cursors;

import net.tsreads.data.SeriesTags;

/**
 * Parameters used to open an {@link ArrayCursor} on a shard for one series
 * and field.
 * 
 * @since 1.0
 */
public class CursorRequest {
  
  private final String name;
  
  private final SeriesTags tags;
  
  private final String field;
  
  private final boolean ascending;
  
  private final long start;
  
  private final long end;
  
  protected CursorRequest(final Builder builder) {
    if (builder.name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    if (builder.field == null) {
      throw new IllegalArgumentException("Field cannot be null.");
    }
    name = builder.name;
    tags = builder.tags == null ? SeriesTags.EMPTY : builder.tags;
    field = builder.field;
    ascending = builder.ascending;
    start = builder.start;
    end = builder.end;
  }
  
  /** @return The measurement name. */
  public String name() {
    return name;
  }
  
  /** @return The series tags. */
  public SeriesTags tags() {
    return tags;
  }
  
  /** @return The field name. */
  public String field() {
    return field;
  }
  
  /** @return Whether values are read in ascending time order. */
  public boolean ascending() {
    return ascending;
  }
  
  /** @return The start of the range in nanoseconds, inclusive. */
  public long start() {
    return start;
  }
  
  /** @return The end of the range in nanoseconds. */
  public long end() {
    return end;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{name=")
        .append(name)
        .append(", tags=")
        .append(tags)
        .append(", field=")
        .append(field)
        .append(", ascending=")
        .append(ascending)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String name;
    private SeriesTags tags;
    private String field;
    private boolean ascending = true;
    private long start;
    private long end;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setTags(final SeriesTags tags) {
      this.tags = tags;
      return this;
    }
    
    public Builder setField(final String field) {
      this.field = field;
      return this;
    }
    
    public Builder setAscending(final boolean ascending) {
      this.ascending = ascending;
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
    
    public CursorRequest build() {
      return new CursorRequest(this);
    }
  }
}
