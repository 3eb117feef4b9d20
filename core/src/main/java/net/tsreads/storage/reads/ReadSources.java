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
package net.tsreads.storage.reads;

import net.tsreads.data.Envelope;
import net.tsreads.data.ReadSource;
import net.tsreads.query.MissingReadSourceException;
import net.tsreads.utils.JSON;

/**
 * Encodes and decodes the opaque read source envelopes that serving 
 * layers pass through requests. The payload is JSON with both IDs 
 * rendered as 16 digit hex strings.
 * 
 * @since 1.0
 */
public final class ReadSources {
  
  /** The type URL every read source envelope carries. */
  public static final String TYPE_URL = 
      "type.tsreads.net/net.tsreads.data.ReadSource";
  
  private ReadSources() { }
  
  /**
   * @param org_id The organization ID.
   * @param bucket_id The bucket ID.
   * @return An envelope wrapping the encoded source.
   */
  public static Envelope encode(final long org_id, final long bucket_id) {
    final ReadSource source = ReadSource.newBuilder()
        .setOrganizationId(org_id)
        .setBucketId(bucket_id)
        .build();
    return new Envelope(TYPE_URL, JSON.serializeToBytes(source));
  }
  
  /**
   * @param envelope The envelope from a request, may be null.
   * @return The decoded source.
   * @throws MissingReadSourceException if the envelope was null, of the 
   * wrong type or could not be decoded.
   */
  public static ReadSource decode(final Envelope envelope) {
    if (envelope == null) {
      throw new MissingReadSourceException("Missing read source.");
    }
    if (!TYPE_URL.equals(envelope.typeUrl())) {
      throw new MissingReadSourceException("Unexpected read source type: " 
          + envelope.typeUrl());
    }
    try {
      return JSON.parseToObject(envelope.value(), ReadSource.class);
    } catch (IllegalArgumentException e) {
      throw new MissingReadSourceException("Unable to decode read source.", 
          e);
    }
  }
}
