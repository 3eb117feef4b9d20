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

/**
 * This class provides no-op implementations for each visitor event.
 * Extend this class if you only wish to specify actions for a small subset of
 * visitor events.
 *
 * @since 1.0
 */
public abstract class DefaultExprVisitor implements ExprVisitor {
  @Override public void enter(And and) { }
  @Override public void leave(And and) { }

  @Override public void enter(Or or) { }
  @Override public void leave(Or or) { }

  @Override public void enter(Comparison comparison) { }
  @Override public void leave(Comparison comparison) { }

  @Override public void enter(Paren paren) { }
  @Override public void leave(Paren paren) { }

  @Override public void visit(Key key) { }

  @Override public void visit(StringLiteral string) { }

  @Override public void visit(RegexLiteral regex) { }

  @Override public void visit(IntegerLiteral integer) { }

  @Override public void visit(UnsignedLiteral unsigned) { }

  @Override public void visit(NumberLiteral number) { }

  @Override public void visit(BooleanLiteral bool) { }
}
