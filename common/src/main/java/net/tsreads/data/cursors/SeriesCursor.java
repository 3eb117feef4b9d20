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

import java.util.Iterator;

/**
 * Lazily yields the series and field combinations matching a predicate
 * across a set of shards. Produced by the storage engine from its index.
 * 
 * @since 1.0
 */
public interface SeriesCursor extends Cursor, Iterator<SeriesRow> {

}
