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
 * Thrown when a request carries no read source or one that cannot be decoded.
 * 
 * @since 1.0
 */
public class MissingReadSourceException extends ReadException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = 5720318861937240121L;

  public MissingReadSourceException(final String msg) {
    super(msg);
  }
  
  public MissingReadSourceException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  @Override
  public Kind kind() {
    return Kind.MISSING_SOURCE;
  }
}
