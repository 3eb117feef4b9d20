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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A database and its retention policies.
 * 
 * @since 1.0
 */
public class DatabaseInfo {
  
  private final String name;
  
  private final List<RetentionPolicyInfo> retention_policies;
  
  /**
   * Default ctor.
   * @param name The non-null name of the database.
   * @param retention_policies A non-null list of policies.
   */
  public DatabaseInfo(final String name, 
                      final List<RetentionPolicyInfo> retention_policies) {
    if (name == null) {
      throw new IllegalArgumentException("Name cannot be null.");
    }
    if (retention_policies == null) {
      throw new IllegalArgumentException("Retention policies cannot be null.");
    }
    this.name = name;
    this.retention_policies = ImmutableList.copyOf(retention_policies);
  }
  
  /** @return The database name. */
  public String name() {
    return name;
  }
  
  /** @return The retention policies. */
  public List<RetentionPolicyInfo> retentionPolicies() {
    return retention_policies;
  }
  
  /**
   * @param name The policy name to look for.
   * @return The policy or null if the database has no policy by that name.
   */
  public RetentionPolicyInfo retentionPolicy(final String name) {
    for (final RetentionPolicyInfo rp : retention_policies) {
      if (rp.name().equals(name)) {
        return rp;
      }
    }
    return null;
  }
}
