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
package net.tsreads.storage;

/**
 * Names the source an engine iterator reads from. When the system iterator
 * is set, the engine produces metadata (such as field keys) instead of 
 * series data.
 * 
 * @since 1.0
 */
public class IteratorSource {
  
  /** System iterator that yields the field keys of the source. */
  public static final String FIELD_KEYS_ITERATOR = "_fieldKeys";
  
  private final String database;
  
  private final String retention_policy;
  
  private final String system_iterator;
  
  public IteratorSource(final String database, 
                        final String retention_policy,
                        final String system_iterator) {
    this.database = database;
    this.retention_policy = retention_policy;
    this.system_iterator = system_iterator;
  }
  
  public String database() {
    return database;
  }
  
  public String retentionPolicy() {
    return retention_policy;
  }
  
  public String systemIterator() {
    return system_iterator;
  }
  
  @Override
  public String toString() {
    return database + "." + retention_policy + "." + system_iterator;
  }
}
