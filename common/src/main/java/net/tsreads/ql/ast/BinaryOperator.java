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
 * Abstract representation of a binary operator in any grammar.
 * All binary operators have arity two. They have an identifying symbol and
 * both a left-hand side and a right-hand side. Consequently, they have a
 * canonical string representation.
 * <p>
 * The implementation of {@link Node#accept} is deferred to subclasses.
 *
 * @param Visitor The interface that will visit instances of this operator.
 * @since 1.0
 */
public abstract class BinaryOperator<Visitor> implements Node<Visitor> {
  private final String symbol;
  private final Node<Visitor> lhs;
  private final Node<Visitor> rhs;

  /**
   * Construct a binary operator that will use the given symbol in its
   * stringified form.
   *
   * @param symbol The symbol that defines this operator.
   * @param lhs The left-hand operand.
   * @param rhs The right-hand operand.
   */
  public BinaryOperator(
    final String symbol,
    final Node<Visitor> lhs,
    final Node<Visitor> rhs) {
    if (null == symbol || symbol.isEmpty() || null == lhs ||
      null == rhs) {
      throw new IllegalArgumentException();
    }

    this.symbol = symbol;
    this.lhs = lhs;
    this.rhs = rhs;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(symbol, lhs, rhs);
  }

  @Override
  public boolean equals(final Object other) {
    if (null == other) {
      return false;
    }
    if (this == other) {
      return true;
    }
    if (getClass() != other.getClass()) {
      return false;
    }

    @SuppressWarnings("rawtypes")
    final BinaryOperator op = (BinaryOperator)other;
    return Objects.equal(symbol, op.symbol)
        && Objects.equal(lhs, op.lhs)
        && Objects.equal(rhs, op.rhs);
  }

  @Override
  public String toString() {
    final StringBuilder buffer = new StringBuilder();

    writeExpression(buffer, getLhs());
    buffer.append(" ").append(getSymbol()).append(" ");
    writeExpression(buffer, getRhs());

    return buffer.toString();
  }

  protected void writeExpression(
    final StringBuilder buffer,
    final Node<Visitor> expression) {
    if (expression.shouldParenthesize()) {
      buffer.append("(");
    }

    buffer.append(expression.toString());

    if (expression.shouldParenthesize()) {
      buffer.append(")");
    }
  }

  @Override
  public boolean shouldParenthesize() {
    return true;
  }

  /**
   * @return This operator's defining symbol.
   */
  public String getSymbol() {
    return symbol;
  }

  /**
   * @return This operator's left-hand operand.
   */
  public Node<Visitor> getLhs() {
    return lhs;
  }

  /**
   * @return This operator's right-hand operand.
   */
  public Node<Visitor> getRhs() {
    return rhs;
  }
}
