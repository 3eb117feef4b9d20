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
 * Wraps a failure of the metadata service or storage engine. The message
 * names the stage that failed.
 * 
 * @since 1.0
 */
public class StoreUpstreamException extends ReadException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = 1470836257146633390L;

  public StoreUpstreamException(final String msg) {
    super(msg);
  }
  
  public StoreUpstreamException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  @Override
  public Kind kind() {
    return Kind.UPSTREAM_FAILURE;
  }
}
