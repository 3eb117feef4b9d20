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
 * Representation of a reference to a key (tag key, measurement, field or 
 * field value) in an expression.
 *
 * @since 1.0
 */
public class Key extends Literal<String, ExprVisitor> {
  /**
   * Construct a new key instance.
   *
   * @param value The name of the key.
   */
  public Key(final String value) {
    super(value);
  }

  @Override
  public void accept(final ExprVisitor visitor) {
    visitor.visit(this);
  }
}
