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
package net.tsreads.query.predicate;

import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A node of a predicate tree as received on the wire. Logical and 
 * comparison nodes have two children, a paren node has one and the 
 * reference and literal nodes are leaves carrying a value.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_DEFAULT)
@JsonDeserialize(builder = PredicateNode.Builder.class)
public class PredicateNode {
  
  /** The types of nodes. */
  public static enum NodeType {
    LOGICAL_EXPRESSION,
    COMPARISON_EXPRESSION,
    PAREN_EXPRESSION,
    TAG_REF,
    FIELD_REF,
    STRING_LITERAL,
    BOOLEAN_LITERAL,
    INTEGER_LITERAL,
    UNSIGNED_LITERAL,
    FLOAT_LITERAL,
    REGEX_LITERAL
  }
  
  /** Logical operators. */
  public static enum Logical {
    AND,
    OR
  }
  
  /** Comparison operators. */
  public static enum Comparison {
    EQUAL,
    NOT_EQUAL,
    STARTS_WITH,
    REGEX,
    NOT_REGEX,
    LT,
    LTE,
    GT,
    GTE
  }
  
  private final NodeType type;
  
  private final List<PredicateNode> children;
  
  private final Logical logical;
  
  private final Comparison comparison;
  
  /** Value of refs, string and regex literals. */
  private final String string_value;
  
  /** Value of integer and unsigned literals. */
  private final long int_value;
  
  private final double float_value;
  
  private final boolean bool_value;
  
  protected PredicateNode(final Builder builder) {
    if (builder.type == null) {
      throw new IllegalArgumentException("Node type cannot be null.");
    }
    type = builder.type;
    children = builder.children == null ? ImmutableList.<PredicateNode>of() 
        : ImmutableList.copyOf(builder.children);
    logical = builder.logical;
    comparison = builder.comparison;
    string_value = builder.stringValue;
    int_value = builder.intValue;
    float_value = builder.floatValue;
    bool_value = builder.boolValue;
  }
  
  @JsonProperty("type")
  public NodeType type() {
    return type;
  }
  
  @JsonProperty("children")
  public List<PredicateNode> children() {
    return children;
  }
  
  /** @return The logical operator of a logical node, otherwise null. */
  @JsonProperty("logical")
  public Logical logical() {
    return logical;
  }
  
  /** @return The operator of a comparison node, otherwise null. */
  @JsonProperty("comparison")
  public Comparison comparison() {
    return comparison;
  }
  
  /** @return The reference name or string/regex literal value. */
  @JsonProperty("stringValue")
  public String stringValue() {
    return string_value;
  }
  
  @JsonProperty("intValue")
  public long intValue() {
    return int_value;
  }
  
  @JsonProperty("floatValue")
  public double floatValue() {
    return float_value;
  }
  
  @JsonProperty("boolValue")
  public boolean boolValue() {
    return bool_value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PredicateNode)) {
      return false;
    }
    final PredicateNode other = (PredicateNode) o;
    return type == other.type
        && logical == other.logical
        && comparison == other.comparison
        && int_value == other.int_value
        && Double.compare(float_value, other.float_value) == 0
        && bool_value == other.bool_value
        && Objects.equal(string_value, other.string_value)
        && children.equals(other.children);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, logical, comparison, string_value, 
        int_value, float_value, bool_value, children);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{type=")
        .append(type)
        .append(", logical=")
        .append(logical)
        .append(", comparison=")
        .append(comparison)
        .append(", stringValue=")
        .append(string_value)
        .append(", intValue=")
        .append(int_value)
        .append(", floatValue=")
        .append(float_value)
        .append(", boolValue=")
        .append(bool_value)
        .append(", children=")
        .append(children)
        .append("}")
        .toString();
  }
  
  public static PredicateNode logical(final Logical op, 
                                      final PredicateNode lhs, 
                                      final PredicateNode rhs) {
    return newBuilder()
        .setType(NodeType.LOGICAL_EXPRESSION)
        .setLogical(op)
        .setChildren(Arrays.asList(lhs, rhs))
        .build();
  }
  
  public static PredicateNode comparison(final Comparison op, 
                                         final PredicateNode lhs, 
                                         final PredicateNode rhs) {
    return newBuilder()
        .setType(NodeType.COMPARISON_EXPRESSION)
        .setComparison(op)
        .setChildren(Arrays.asList(lhs, rhs))
        .build();
  }
  
  public static PredicateNode paren(final PredicateNode child) {
    return newBuilder()
        .setType(NodeType.PAREN_EXPRESSION)
        .setChildren(Arrays.asList(child))
        .build();
  }
  
  public static PredicateNode tagRef(final String key) {
    return newBuilder()
        .setType(NodeType.TAG_REF)
        .setStringValue(key)
        .build();
  }
  
  public static PredicateNode fieldRef(final String field) {
    return newBuilder()
        .setType(NodeType.FIELD_REF)
        .setStringValue(field)
        .build();
  }
  
  public static PredicateNode stringLiteral(final String value) {
    return newBuilder()
        .setType(NodeType.STRING_LITERAL)
        .setStringValue(value)
        .build();
  }
  
  public static PredicateNode regexLiteral(final String pattern) {
    return newBuilder()
        .setType(NodeType.REGEX_LITERAL)
        .setStringValue(pattern)
        .build();
  }
  
  public static PredicateNode booleanLiteral(final boolean value) {
    return newBuilder()
        .setType(NodeType.BOOLEAN_LITERAL)
        .setBoolValue(value)
        .build();
  }
  
  public static PredicateNode integerLiteral(final long value) {
    return newBuilder()
        .setType(NodeType.INTEGER_LITERAL)
        .setIntValue(value)
        .build();
  }
  
  public static PredicateNode unsignedLiteral(final long value) {
    return newBuilder()
        .setType(NodeType.UNSIGNED_LITERAL)
        .setIntValue(value)
        .build();
  }
  
  public static PredicateNode floatLiteral(final double value) {
    return newBuilder()
        .setType(NodeType.FLOAT_LITERAL)
        .setFloatValue(value)
        .build();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Builder {
    @JsonProperty
    private NodeType type;
    @JsonProperty
    private List<PredicateNode> children;
    @JsonProperty
    private Logical logical;
    @JsonProperty
    private Comparison comparison;
    @JsonProperty
    private String stringValue;
    @JsonProperty
    private long intValue;
    @JsonProperty
    private double floatValue;
    @JsonProperty
    private boolean boolValue;
    
    public Builder setType(final NodeType type) {
      this.type = type;
      return this;
    }
    
    public Builder setChildren(final List<PredicateNode> children) {
      this.children = children;
      return this;
    }
    
    public Builder setLogical(final Logical logical) {
      this.logical = logical;
      return this;
    }
    
    public Builder setComparison(final Comparison comparison) {
      this.comparison = comparison;
      return this;
    }
    
    public Builder setStringValue(final String string_value) {
      stringValue = string_value;
      return this;
    }
    
    public Builder setIntValue(final long int_value) {
      intValue = int_value;
      return this;
    }
    
    public Builder setFloatValue(final double float_value) {
      floatValue = float_value;
      return this;
    }
    
    public Builder setBoolValue(final boolean bool_value) {
      boolValue = bool_value;
      return this;
    }
    
    public PredicateNode build() {
      return new PredicateNode(this);
    }
  }
}
