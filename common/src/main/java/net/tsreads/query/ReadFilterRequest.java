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
 * Reads every series matching a predicate within a range.
 * 
 * @since 1.0
 */
public class ReadFilterRequest extends BaseReadRequest {
  
  private final boolean descending;
  
  protected ReadFilterRequest(final Builder builder) {
    super(builder);
    descending = builder.descending;
  }
  
  /** @return Whether values are read in descending time order. */
  public boolean descending() {
    return descending;
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder extends BaseReadRequest.Builder<Builder> {
    private boolean descending;
    
    public Builder setDescending(final boolean descending) {
      this.descending = descending;
      return this;
    }
    
    public ReadFilterRequest build() {
      return new ReadFilterRequest(this);
    }

    @Override
    protected Builder self() {
      return this;
    }
  }
}
