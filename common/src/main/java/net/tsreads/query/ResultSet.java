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
import net.tsreads.data.cursors.Cursor;

/**
 * A lazy sequence of series, each with a cursor over its values. Single
 * consumer, forward only and not rewindable. Closing the result set, or
 * advancing it, releases the cursor of the current series.
 * 
 * @since 1.0
 */
public interface ResultSet extends Cursor {

  /**
   * Advances to the next series.
   * @return True if there is a series, false when exhausted.
   * @throws ReadCancelledException if the read was cancelled.
   */
  public boolean next();
  
  /**
   * Opens the cursor over the current series. Closing it is optional, the 
   * result set closes it when advancing.
   * @return The cursor or an empty optional if no shard holds data for the
   * series and field.
   */
  public Optional<ArrayCursor<?>> cursor();
  
  /** @return The tags of the current series. */
  public SeriesTags tags();
  
  /** @return A result set with no series. */
  public static ResultSet empty() {
    return EmptyResultSet.INSTANCE;
  }
}
