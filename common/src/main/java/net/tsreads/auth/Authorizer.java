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
package net.tsreads.auth;

import net.tsreads.data.SeriesTags;

/**
 * Decides what a request may read. Passed through to the storage engine
 * which applies it while walking its index.
 * 
 * @since 1.0
 */
public interface Authorizer {

  /**
   * @param database The database name.
   * @return True if the database may be read.
   */
  public boolean authorizeDatabase(final String database);
  
  /**
   * @param database The database name.
   * @param measurement The measurement name.
   * @param tags The series tags.
   * @return True if the series may be read.
   */
  public boolean authorizeSeriesRead(final String database, 
                                     final String measurement, 
                                     final SeriesTags tags);
  
}
