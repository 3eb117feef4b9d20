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
import java.util.Optional;

import net.tsreads.data.SeriesTags;
import net.tsreads.data.cursors.ArrayCursor;
import net.tsreads.data.cursors.Cursor;

/**
 * The series of one group of a {@link GroupResultSet}.
 * 
 * @since 1.0
 */
public interface GroupCursor extends Cursor {

  /** @return True if the group has another series. */
  public boolean next();
  
  /** @return The cursor over the current series or an empty optional if 
   * there is no data for it. */
  public Optional<ArrayCursor<?>> cursor();
  
  /** @return The tags of the current series. */
  public SeriesTags tags();
  
  /** @return The sorted union of tag keys in the group. */
  public List<String> keys();
  
  /** @return The values of the group keys shared by every series in the 
   * group, empty when not grouping by keys. A missing value is an empty 
   * string. */
  public List<String> partitionKeyValues();
  
}
