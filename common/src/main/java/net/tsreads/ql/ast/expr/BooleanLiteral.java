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

import net.tsreads.ql.ast.Literal;

/**
 * Representation of a Boolean literal in an expression.
 *
 * @since 1.0
 */
public class BooleanLiteral extends Literal<Boolean, ExprVisitor> {

  /** Shared true literal. */
  public static final BooleanLiteral TRUE = new BooleanLiteral(true);
  
  /** Shared false literal. */
  public static final BooleanLiteral FALSE = new BooleanLiteral(false);

  /**
   * Construct a new literal instance.
   *
   * @param value The value this literal should contain.
   */
  public BooleanLiteral(final Boolean value) {
    super(value);
  }

  @Override
  public void accept(final ExprVisitor visitor) {
    visitor.visit(this);
  }
}
