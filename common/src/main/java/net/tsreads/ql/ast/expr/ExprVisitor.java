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
 * Implement this interface to visit native expression nodes.
 * This interface provides both an enter and a leave event for non-terminal
 * nodes but only a visit event for terminal nodes.
 *
 * @since 1.0
 */
public interface ExprVisitor {
  void enter(And and);
  void leave(And and);

  void enter(Or or);
  void leave(Or or);

  void enter(Comparison comparison);
  void leave(Comparison comparison);

  void enter(Paren paren);
  void leave(Paren paren);

  void visit(Key key);

  void visit(StringLiteral string);

  void visit(RegexLiteral regex);

  void visit(IntegerLiteral integer);

  void visit(UnsignedLiteral unsigned);

  void visit(NumberLiteral number);

  void visit(BooleanLiteral bool);
}
