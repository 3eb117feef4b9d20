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
 * Metadata about a single shard.
 * 
 * @since 1.0
 */
public class ShardInfo {
  
  private final long id;
  
  public ShardInfo(final long id) {
    this.id = id;
  }
  
  /** @return The shard ID. */
  public long id() {
    return id;
  }
  
  @Override
  public String toString() {
    return "{shard=" + id + "}";
  }
}
