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

import net.tsreads.ql.ast.Node;

/**
 * Replaces a node of a native expression during a bottom up walk. See
 * {@link Exprs#rewrite(Node, ExprRewriter)}.
 * 
 * @since 1.0
 */
public interface ExprRewriter {

  /**
   * @param node The non-null node whose children have been rewritten.
   * @return The non-null replacement, or the node itself to keep it.
   */
  public Node<ExprVisitor> rewrite(final Node<ExprVisitor> node);
  
}
