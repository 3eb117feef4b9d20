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
package net.tsreads.query.predicate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Objects;

/**
 * A wire predicate. The root may be null, meaning no filtering.
 * 
 * @since 1.0
 */
public class Predicate {
  
  private final PredicateNode root;
  
  @JsonCreator
  public Predicate(@JsonProperty("root") final PredicateNode root) {
    this.root = root;
  }
  
  /** @return The root node or null if the predicate is empty. */
  @JsonProperty("root")
  public PredicateNode root() {
    return root;
  }
  
  /**
   * Null safe accessor for the root.
   * @param predicate A predicate, may be null.
   * @return The root or null if either the predicate or its root is null.
   */
  public static PredicateNode rootOf(final Predicate predicate) {
    return predicate == null ? null : predicate.root;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Predicate)) {
      return false;
    }
    return Objects.equal(root, ((Predicate) o).root);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(root);
  }
  
  @Override
  public String toString() {
    return "{root=" + root + "}";
  }
}
