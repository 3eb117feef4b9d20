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
 * Representation of a comparison between two operands, usually a 
 * {@link Key} on the left and a literal on the right.
 *
 * @since 1.0
 */
public class Comparison extends BinaryOperator<ExprVisitor> {
  
  /** The supported comparison operators. */
  public static enum Op {
    EQ("="),
    NEQ("!="),
    EQREGEX("=~"),
    NEQREGEX("!~"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">=");
    
    private final String symbol;
    
    Op(final String symbol) {
      this.symbol = symbol;
    }
    
    /** @return The symbol used when rendering the operator. */
    public String symbol() {
      return symbol;
    }
  }
  
  private final Op op;

  /**
   * Construct a new comparison.
   *
   * @param op The non-null operator.
   * @param lhs Left-hand side expression.
   * @param rhs Right-hand side expression.
   */
  public Comparison(final Op op, 
                    final Node<ExprVisitor> lhs, 
                    final Node<ExprVisitor> rhs) {
    super(op == null ? null : op.symbol(), lhs, rhs);
    this.op = op;
  }
  
  /** @return The comparison operator. */
  public Op getOp() {
    return op;
  }

  @Override
  public void accept(final ExprVisitor visitor) {
    visitor.enter(this);

    getLhs().accept(visitor);
    getRhs().accept(visitor);

    visitor.leave(this);
  }
}
