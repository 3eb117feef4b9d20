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
package net.tsreads.ql.ast.expr;

import com.google.common.base.Objects;

import net.tsreads.ql.ast.Node;

/**
 * An explicitly parenthesized expression.
 *
 * @since 1.0
 */
public class Paren implements Node<ExprVisitor> {
  private final Node<ExprVisitor> expr;
  
  /**
   * @param expr The non-null wrapped expression.
   */
  public Paren(final Node<ExprVisitor> expr) {
    if (null == expr) {
      throw new IllegalArgumentException();
    }
    this.expr = expr;
  }
  
  /** @return The wrapped expression. */
  public Node<ExprVisitor> getExpr() {
    return expr;
  }
  
  @Override
  public boolean shouldParenthesize() {
    // we render our own.
    return false;
  }

  @Override
  public void accept(final ExprVisitor visitor) {
    visitor.enter(this);
    expr.accept(visitor);
    visitor.leave(this);
  }
  
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Paren)) {
      return false;
    }
    return Objects.equal(expr, ((Paren) other).expr);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode("()", expr);
  }
  
  @Override
  public String toString() {
    return "(" + expr + ")";
  }
}
