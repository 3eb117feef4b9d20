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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Reads every series matching a predicate within a range, grouped by the
 * values of a list of tag keys.
 * 
 * @since 1.0
 */
public class ReadGroupRequest extends BaseReadRequest {
  
  /** How series are grouped. */
  public static enum GroupMode {
    /** All series form a single group. */
    NONE,
    /** Series are grouped by the values of the group keys. */
    BY
  }
  
  private final GroupMode group;
  
  private final List<String> group_keys;
  
  private final boolean descending;
  
  protected ReadGroupRequest(final Builder builder) {
    super(builder);
    group = builder.group == null ? GroupMode.NONE : builder.group;
    group_keys = builder.groupKeys == null ? ImmutableList.<String>of() : 
      ImmutableList.copyOf(builder.groupKeys);
    if (group == GroupMode.BY && group_keys.isEmpty()) {
      throw new IllegalArgumentException("Group keys cannot be empty when "
          + "grouping by keys.");
    }
    descending = builder.descending;
  }
  
  /** @return The group mode. */
  public GroupMode group() {
    return group;
  }
  
  /** @return The group keys, empty when not grouping by keys. */
  public List<String> groupKeys() {
    return group_keys;
  }
  
  /** @return Whether values are read in descending time order. */
  public boolean descending() {
    return descending;
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder extends BaseReadRequest.Builder<Builder> {
    private GroupMode group;
    private List<String> groupKeys;
    private boolean descending;
    
    public Builder setGroup(final GroupMode group) {
      this.group = group;
      return this;
    }
    
    public Builder setGroupKeys(final List<String> group_keys) {
      groupKeys = group_keys;
      return this;
    }
    
    public Builder setDescending(final boolean descending) {
      this.descending = descending;
      return this;
    }
    
    public ReadGroupRequest build() {
      return new ReadGroupRequest(this);
    }

    @Override
    protected Builder self() {
      return this;
    }
  }
}
