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

/**
 * Thrown when a bucket does not map to an existing database.
 * 
 * @since 1.0
 */
public class DatabaseNotFoundException extends ReadException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -2289164452318675514L;

  public DatabaseNotFoundException(final String msg) {
    super(msg);
  }
  
  public DatabaseNotFoundException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  @Override
  public Kind kind() {
    return Kind.NOT_FOUND;
  }
}
