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
package net.tsreads.common;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Constants shared by the read path.
 * 
 * @since 1.0
 */
public final class Const {
  
  /** Charset used to convert Strings to byte arrays and back. */
  public static final Charset UTF8_CHARSET = StandardCharsets.UTF_8;
  
  /** The smallest timestamp in nanoseconds the storage engine accepts. */
  public static final long MIN_NANO_TIME = Long.MIN_VALUE + 2;
  
  /** The largest timestamp in nanoseconds the storage engine accepts. */
  public static final long MAX_NANO_TIME = Long.MAX_VALUE - 1;
  
  /** Wire level tag key that refers to the measurement of a series. */
  public static final String MEASUREMENT_KEY = "_measurement";
  
  /** Wire level tag key that refers to the field of a series. */
  public static final String FIELD_KEY = "_field";
  
  /** Wire level tag key that refers to the value of a field. */
  public static final String VALUE_KEY = "_value";
  
  /** The engine's internal key for the measurement name. */
  public static final String NAME_KEY = "_name";
  
  /** The engine's pseudo key used to push a tag key down to the index. */
  public static final String TAG_KEY_KEY = "_tagKey";
  
  /** The engine's reference to a field value. */
  public static final String FIELD_REF = "$";
  
  /** Key the engine uses for the measurement tag in a series key. */
  public static final String MEASUREMENT_TAG_KEY = "\0";
  
  /** Key the engine uses for the field tag in a series key. */
  public static final String FIELD_KEY_TAG_KEY = "\u00ff";
  
  /** The single retention policy every bucket maps to. */
  public static final String DEFAULT_RETENTION_POLICY = "autogen";
  
  private Const() {
    // static only
  }
}
