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

import net.tsreads.ql.ast.BinaryOperator;
import net.tsreads.ql.ast.Node;

/**
 * Representation of the logical AND operator in an expression.
 *
 * @since 1.0
 */
public class And extends BinaryOperator<ExprVisitor> {
  public static final String SYMBOL = "AND";

  /**
   * Construct a new logical AND instance.
   *
   * @param lhs Left-hand side expression.
   * @param rhs Right-hand side expression.
   */
  public And(final Node<ExprVisitor> lhs, final Node<ExprVisitor> rhs) {
    super(SYMBOL, lhs, rhs);
  }

  @Override
  public void accept(final ExprVisitor visitor) {
    visitor.enter(this);

    getLhs().accept(visitor);
    getRhs().accept(visitor);

    visitor.leave(this);
  }
}
