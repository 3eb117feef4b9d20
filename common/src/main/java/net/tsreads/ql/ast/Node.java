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

/**
 * All AST nodes must implement this interface.
 * <p>
 * Nodes are immutable. Passes that transform a tree (rewrites, reductions)
 * build new nodes rather than modifying the input so the same tree can be
 * shared by several passes of a request.
 * <p>
 * Each AST has its own visitor, so the visitor type is passed into the node
 * interface.
 *
 * @param Visitor The class/interface that defines a visitor for this node.
 * @since 1.0
 */
public interface Node<Visitor> {
  /**
   * Indicates whether this node represents an expression that should be
   * parenthesized during stringification.
   *
   * @return true if this node requires parentheses; otherwise, false.
   */
  boolean shouldParenthesize();

  /**
   * Critical part of visitor pattern: each node must be able to accept an
   * instance of the appropriate visitor.
   * Any node with at least one child node should instruct each child to 
   * accept the visitor. All nodes should notify the visitor that it has been
   * visited. Non-terminal nodes notify the visitor before their first 
   * operand and after their last operand.
   *
   * @param visitor The visitor instance that this node should accept.
   */
  void accept(Visitor visitor);
}
