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
package net.tsreads.meta;

/**
 * A named retention policy of a database.
 * 
 * @since 1.0
 */
public class RetentionPolicyInfo {
  
  private final String name;
  
  private final long shard_group_duration;
  
  /**
   * Default ctor.
   * @param name The non-null name of the policy.
   * @param shard_group_duration The span of each shard group in nanoseconds.
   */
  public RetentionPolicyInfo(final String name, 
                             final long shard_group_duration) {
    if (name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    this.name = name;
    this.shard_group_duration = shard_group_duration;
  }
  
  /** @return The policy name. */
  public String name() {
    return name;
  }
  
  /** @return The span of each shard group in nanoseconds. */
  public long shardGroupDuration() {
    return shard_group_duration;
  }
}
