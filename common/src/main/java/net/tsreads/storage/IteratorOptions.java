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
package net.tsreads.storage;

import net.tsreads.auth.Authorizer;
import net.tsreads.auth.OpenAuthorizer;
import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.ExprVisitor;

/**
 * Options for engine iterator construction.
 * 
 * @since 1.0
 */
public class IteratorOptions {
  
  private final long org_id;
  
  private final Node<ExprVisitor> condition;
  
  private final Authorizer authorizer;
  
  /**
   * Default ctor.
   * @param org_id The organization ID.
   * @param condition An optional condition, may be null.
   * @param authorizer The authorizer, if null the {@link OpenAuthorizer}.
   */
  public IteratorOptions(final long org_id, 
                         final Node<ExprVisitor> condition,
                         final Authorizer authorizer) {
    this.org_id = org_id;
    this.condition = condition;
    this.authorizer = authorizer == null ? OpenAuthorizer.INSTANCE : authorizer;
  }
  
  public long orgId() {
    return org_id;
  }
  
  /** @return The condition or null if there is none. */
  public Node<ExprVisitor> condition() {
    return condition;
  }
  
  public Authorizer authorizer() {
    return authorizer;
  }
}
