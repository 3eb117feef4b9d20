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

/**
 * Lists the tag keys of series matching a predicate within a range.
 * 
 * @since 1.0
 */
public class TagKeysRequest extends BaseReadRequest {
  
  protected TagKeysRequest(final Builder builder) {
    super(builder);
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder extends BaseReadRequest.Builder<Builder> {
    
    public TagKeysRequest build() {
      return new TagKeysRequest(this);
    }

    @Override
    protected Builder self() {
      return this;
    }
  }
}
