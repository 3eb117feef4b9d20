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
package net.tsreads.data;

import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Objects;

import net.tsreads.utils.Ids;

/**
 * Identifies the organization and bucket a read is scoped to. Both IDs are
 * unsigned 64 bit values. Decoded once per request from an {@link Envelope}.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "orgId", "bucketId" })
@JsonDeserialize(builder = ReadSource.Builder.class)
public class ReadSource {
  
  /** The organization ID. */
  private final long organization_id;
  
  /** The bucket ID. */
  private final long bucket_id;
  
  protected ReadSource(final Builder builder) {
    if (builder.orgId == null) {
      throw new IllegalArgumentException("Organization ID cannot be null.");
    }
    if (builder.bucketId == null) {
      throw new IllegalArgumentException("Bucket ID cannot be null.");
    }
    organization_id = Ids.fromHex(builder.orgId);
    bucket_id = Ids.fromHex(builder.bucketId);
  }
  
  /** @return The organization ID. */
  public long organizationId() {
    return organization_id;
  }
  
  /** @return The bucket ID. */
  public long bucketId() {
    return bucket_id;
  }
  
  @JsonGetter("orgId")
  public String getOrgIdHex() {
    return Ids.toHex(organization_id);
  }
  
  @JsonGetter("bucketId")
  public String getBucketIdHex() {
    return Ids.toHex(bucket_id);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ReadSource other = (ReadSource) o;
    return organization_id == other.organization_id 
        && bucket_id == other.bucket_id;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(organization_id, bucket_id);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{orgId=")
        .append(getOrgIdHex())
        .append(", bucketId=")
        .append(getBucketIdHex())
        .append("}")
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private String orgId;
    @JsonProperty
    private String bucketId;
    
    public Builder setOrganizationId(final long organization_id) {
      orgId = Ids.toHex(organization_id);
      return this;
    }
    
    public Builder setBucketId(final long bucket_id) {
      bucketId = Ids.toHex(bucket_id);
      return this;
    }
    
    public ReadSource build() {
      return new ReadSource(this);
    }
  }
}
