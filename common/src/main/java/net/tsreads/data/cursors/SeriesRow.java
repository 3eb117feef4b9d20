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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.tsreads.data.SeriesTags;

/**
 * One series and field combination yielded by a {@link SeriesCursor}.
 * 
 * @since 1.0
 */
public class SeriesRow {
  
  private final String name;
  
  private final SeriesTags series_tags;
  
  private final SeriesTags tags;
  
  private final String field;
  
  private final List<CursorIterator> query;
  
  protected SeriesRow(final Builder builder) {
    if (builder.name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    if (builder.field == null) {
      throw new IllegalArgumentException("Field cannot be null.");
    }
    name = builder.name;
    field = builder.field;
    series_tags = builder.seriesTags == null ? SeriesTags.EMPTY : 
      builder.seriesTags;
    tags = builder.tags == null ? series_tags : builder.tags;
    query = builder.query == null ? ImmutableList.<CursorIterator>of() : 
      ImmutableList.copyOf(builder.query);
  }
  
  /** @return The measurement name. */
  public String name() {
    return name;
  }
  
  /** @return The tags as stored in the series key. */
  public SeriesTags seriesTags() {
    return series_tags;
  }
  
  /** @return The tags including the measurement and field entries. */
  public SeriesTags tags() {
    return tags;
  }
  
  /** @return The field name. */
  public String field() {
    return field;
  }
  
  /** @return The per shard cursor iterators in shard order. */
  public List<CursorIterator> query() {
    return query;
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
        .append(", shards=")
        .append(query.size())
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private String name;
    private SeriesTags seriesTags;
    private SeriesTags tags;
    private String field;
    private List<CursorIterator> query;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setSeriesTags(final SeriesTags series_tags) {
      seriesTags = series_tags;
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
    
    public Builder setQuery(final List<CursorIterator> query) {
      this.query = query;
      return this;
    }
    
    public SeriesRow build() {
      return new SeriesRow(this);
    }
  }
}
