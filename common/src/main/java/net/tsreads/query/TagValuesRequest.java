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

import com.google.common.base.Strings;

/**
 * Lists the values of one tag key across series matching a predicate 
 * within a range. The keys {@code _measurement} and {@code _field} list
 * measurement and field names.
 * 
 * @since 1.0
 */
public class TagValuesRequest extends BaseReadRequest {
  
  private final String tag_key;
  
  protected TagValuesRequest(final Builder builder) {
    super(builder);
    if (Strings.isNullOrEmpty(builder.tagKey)) {
      throw new IllegalArgumentException("Tag key cannot be null or empty.");
    }
    tag_key = builder.tagKey;
  }
  
  /** @return The tag key whose values are listed. */
  public String tagKey() {
    return tag_key;
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder extends BaseReadRequest.Builder<Builder> {
    private String tagKey;
    
    public Builder setTagKey(final String tag_key) {
      tagKey = tag_key;
      return this;
    }
    
    public TagValuesRequest build() {
      return new TagValuesRequest(this);
    }

    @Override
    protected Builder self() {
      return this;
    }
  }
}
