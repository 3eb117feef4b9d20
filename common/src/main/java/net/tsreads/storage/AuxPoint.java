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
package net.tsreads.storage;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A point emitted by an engine iterator carrying auxiliary values, such as
 * the field name for a field key listing.
 * 
 * @since 1.0
 */
public class AuxPoint {
  
  private final String name;
  
  private final long time;
  
  private final List<Object> aux;
  
  public AuxPoint(final String name, final long time, final List<Object> aux) {
    this.name = name;
    this.time = time;
    this.aux = aux == null ? ImmutableList.of() : ImmutableList.copyOf(aux);
  }
  
  public String name() {
    return name;
  }
  
  public long time() {
    return time;
  }
  
  /** @return The auxiliary values, never null. */
  public List<Object> aux() {
    return aux;
  }
}
