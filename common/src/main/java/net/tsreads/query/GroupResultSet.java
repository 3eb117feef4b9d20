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

import net.tsreads.data.cursors.Cursor;

/**
 * A lazy sequence of groups of series. Advancing closes the previous group.
 * 
 * @since 1.0
 */
public interface GroupResultSet extends Cursor {

  /**
   * Advances to the next group.
   * @return True if there is a group, false when exhausted.
   */
  public boolean next();
  
  /** @return The current group. */
  public GroupCursor group();
  
  /** @return A result set with no groups. */
  public static GroupResultSet empty() {
    return EmptyResultSet.INSTANCE;
  }
}
