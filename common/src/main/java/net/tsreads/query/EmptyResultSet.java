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

import java.util.Optional;

import net.tsreads.data.SeriesTags;
import net.tsreads.data.cursors.ArrayCursor;

/**
 * The explicit empty result. Stateless so a single instance is shared.
 * 
 * @since 1.0
 */
final class EmptyResultSet implements ResultSet, GroupResultSet {
  
  static final EmptyResultSet INSTANCE = new EmptyResultSet();
  
  private EmptyResultSet() {
    // singleton
  }
  
  @Override
  public boolean next() {
    return false;
  }

  @Override
  public Optional<ArrayCursor<?>> cursor() {
    throw new IllegalStateException("Empty result set has no series.");
  }

  @Override
  public SeriesTags tags() {
    throw new IllegalStateException("Empty result set has no series.");
  }

  @Override
  public GroupCursor group() {
    throw new IllegalStateException("Empty result set has no groups.");
  }
  
  @Override
  public void close() {
    // nothing to release
  }
  
  @Override
  public String toString() {
    return "EmptyResultSet";
  }
}
