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
package net.tsreads.data.cursors;

/**
 * A handle on resources held by the storage engine, such as open files or
 * mapped blocks. Whoever obtains a cursor must close it on every exit path.
 * Closing an already closed cursor is a no-op.
 * 
 * @since 1.0
 */
public interface Cursor extends AutoCloseable {

  /** Releases the resources held by this cursor. */
  @Override
  public void close();
  
}
