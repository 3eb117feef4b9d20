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
 * Base class for all errors raised by the read path. The {@link Kind} lets
 * a serving layer map errors to its own status codes.
 * 
 * @since 1.0
 */
public abstract class ReadException extends RuntimeException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = -3101872263505183227L;

  /** The kinds of failures. */
  public static enum Kind {
    /** The request carried no usable read source. */
    MISSING_SOURCE,
    /** The organization and bucket do not map to a database. */
    NOT_FOUND,
    /** The database lacks the expected retention policy. */
    INVALID_CONFIG,
    /** The predicate cannot be evaluated for this request. */
    UNSUPPORTED_PREDICATE,
    /** The metadata service or storage engine failed. */
    UPSTREAM_FAILURE,
    /** The caller cancelled or the deadline passed. */
    CANCELLED,
    /** A collaborator broke its contract. */
    INTERNAL
  }
  
  protected ReadException(final String msg) {
    super(msg);
  }
  
  protected ReadException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
  
  /** @return The kind of failure. */
  public abstract Kind kind();
  
}
