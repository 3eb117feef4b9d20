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
package net.tsreads.ql.ast;

import com.google.common.base.Objects;

/**
 * Abstract representation of a literal in any grammar.
 * The implementation of {@link Node#accept} is deferred to subclasses.
 *
 * @param T The type of data this literal will represent.
 * @param Visitor The interface that will visit instances of this literal.
 * @since 1.0
 */
public abstract class Literal<T, Visitor> implements Node<Visitor> {
  private final T value;

  /**
   * Construct a literal that represents the given value.
   *
   * @param value The value that this literal represents.
   */
  public Literal(final T value) {
    if (null == value) {
      throw new IllegalArgumentException();
    }

    this.value = value;
  }

  /**
   * @return The value that this literal represents.
   */
  public T getValue() {
    return value;
  }

  @Override
  @SuppressWarnings("unchecked")
  public boolean equals(Object other) {
    if (null == other) {
      return false;
    }
    if (this == other) {
      return true;
    }
    if (getClass() != other.getClass()) {
      return false;
    }

    final Literal<T, Visitor> literal = (Literal<T, Visitor>)other;
    return Objects.equal(value, literal.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(getClass(), value);
  }

  @Override
  public boolean shouldParenthesize() {
    return false;
  }

  @Override
  public String toString() {
    return getValue().toString();
  }
}
