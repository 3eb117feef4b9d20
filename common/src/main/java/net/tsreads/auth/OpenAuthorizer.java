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
 * An {@link Authorizer} that allows everything.
 * 
 * @since 1.0
 */
public final class OpenAuthorizer implements Authorizer {
  
  /** The singleton instance. */
  public static final OpenAuthorizer INSTANCE = new OpenAuthorizer();
  
  private OpenAuthorizer() {
    // singleton
  }

  @Override
  public boolean authorizeDatabase(final String database) {
    return true;
  }

  @Override
  public boolean authorizeSeriesRead(final String database, 
                                     final String measurement,
                                     final SeriesTags tags) {
    return true;
  }
  
  @Override
  public String toString() {
    return "OpenAuthorizer";
  }
}
