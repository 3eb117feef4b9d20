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

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import net.tsreads.ql.ast.BinaryOperator;
import net.tsreads.ql.ast.Literal;
import net.tsreads.ql.ast.Node;

/**
 * Static helpers for walking, rewriting and reducing native expressions.
 * Nodes are immutable so every rewrite returns a new tree, sharing the
 * untouched branches with the input.
 * 
 * @since 1.0
 */
public final class Exprs {
  
  private Exprs() { }
  
  /**
   * Rewrites the tree bottom up. Children are rewritten first, then the 
   * rewriter is applied to the rebuilt parent.
   * @param node A node, may be null.
   * @param rewriter The non-null rewriter applied to each node.
   * @return The rewritten tree or null if the node was null.
   */
  public static Node<ExprVisitor> rewrite(
      final Node<ExprVisitor> node, 
      final ExprRewriter rewriter) {
    if (node == null) {
      return null;
    }
    
    Node<ExprVisitor> rebuilt = node;
    if (node instanceof BinaryOperator) {
      final BinaryOperator<ExprVisitor> op = (BinaryOperator<ExprVisitor>) node;
      final Node<ExprVisitor> lhs = rewrite(op.getLhs(), rewriter);
      final Node<ExprVisitor> rhs = rewrite(op.getRhs(), rewriter);
      if (lhs != op.getLhs() || rhs != op.getRhs()) {
        rebuilt = withChildren(op, lhs, rhs);
      }
    } else if (node instanceof Paren) {
      final Node<ExprVisitor> inner = 
          rewrite(((Paren) node).getExpr(), rewriter);
      if (inner != ((Paren) node).getExpr()) {
        rebuilt = new Paren(inner);
      }
    }
    return rewriter.rewrite(rebuilt);
  }
  
  /**
   * Algebraically simplifies the expression. Boolean literals are folded 
   * out of AND and OR nodes, comparisons between two literals are 
   * evaluated where possible and parens are dropped unless they wrap a 
   * binary operator. Keys are left untouched.
   * @param node A node, may be null.
   * @return The reduced tree or null if the node was null.
   */
  public static Node<ExprVisitor> reduce(final Node<ExprVisitor> node) {
    if (node == null) {
      return null;
    }
    
    if (node instanceof And) {
      final Node<ExprVisitor> lhs = reduce(((And) node).getLhs());
      final Node<ExprVisitor> rhs = reduce(((And) node).getRhs());
      if (lhs instanceof BooleanLiteral) {
        return ((BooleanLiteral) lhs).getValue() ? rhs : BooleanLiteral.FALSE;
      }
      if (rhs instanceof BooleanLiteral) {
        return ((BooleanLiteral) rhs).getValue() ? lhs : BooleanLiteral.FALSE;
      }
      return new And(lhs, rhs);
    }
    
    if (node instanceof Or) {
      final Node<ExprVisitor> lhs = reduce(((Or) node).getLhs());
      final Node<ExprVisitor> rhs = reduce(((Or) node).getRhs());
      if (lhs instanceof BooleanLiteral) {
        return ((BooleanLiteral) lhs).getValue() ? BooleanLiteral.TRUE : rhs;
      }
      if (rhs instanceof BooleanLiteral) {
        return ((BooleanLiteral) rhs).getValue() ? BooleanLiteral.TRUE : lhs;
      }
      return new Or(lhs, rhs);
    }
    
    if (node instanceof Comparison) {
      final Comparison comparison = (Comparison) node;
      final Node<ExprVisitor> lhs = reduce(comparison.getLhs());
      final Node<ExprVisitor> rhs = reduce(comparison.getRhs());
      final Boolean result = evaluate(comparison.getOp(), lhs, rhs);
      if (result != null) {
        return result ? BooleanLiteral.TRUE : BooleanLiteral.FALSE;
      }
      return new Comparison(comparison.getOp(), lhs, rhs);
    }
    
    if (node instanceof Paren) {
      final Node<ExprVisitor> inner = reduce(((Paren) node).getExpr());
      if (inner instanceof BinaryOperator) {
        return new Paren(inner);
      }
      return inner;
    }
    
    return node;
  }
  
  /**
   * @param node A node, may be null.
   * @return True if the node is the boolean literal true.
   */
  public static boolean isTrueLiteral(final Node<ExprVisitor> node) {
    return node instanceof BooleanLiteral && 
        ((BooleanLiteral) node).getValue();
  }
  
  /**
   * @param node A node, may be null.
   * @return The sorted set of every key referenced in the tree. Empty if
   * the node was null.
   */
  public static Set<String> keys(final Node<ExprVisitor> node) {
    final Set<String> keys = new TreeSet<String>();
    if (node != null) {
      node.accept(new DefaultExprVisitor() {
        @Override
        public void visit(final Key key) {
          keys.add(key.getValue());
        }
      });
    }
    return keys;
  }
  
  private static Node<ExprVisitor> withChildren(
      final BinaryOperator<ExprVisitor> op, 
      final Node<ExprVisitor> lhs, 
      final Node<ExprVisitor> rhs) {
    if (op instanceof And) {
      return new And(lhs, rhs);
    }
    if (op instanceof Or) {
      return new Or(lhs, rhs);
    }
    if (op instanceof Comparison) {
      return new Comparison(((Comparison) op).getOp(), lhs, rhs);
    }
    throw new IllegalStateException("Unknown binary operator: " 
        + op.getClass());
  }
  
  /**
   * Evaluates a comparison between two literals.
   * @return The result or null if the operands can't be evaluated.
   */
  private static Boolean evaluate(final Comparison.Op op, 
                                  final Node<ExprVisitor> lhs, 
                                  final Node<ExprVisitor> rhs) {
    if (!(lhs instanceof Literal) || !(rhs instanceof Literal) || 
        lhs instanceof Key || rhs instanceof Key) {
      return null;
    }
    
    if (lhs instanceof StringLiteral && rhs instanceof RegexLiteral) {
      final boolean found;
      try {
        found = Pattern.compile(((RegexLiteral) rhs).getValue())
            .matcher(((StringLiteral) lhs).getValue())
            .find();
      } catch (PatternSyntaxException e) {
        return null;
      }
      switch (op) {
      case EQREGEX:
        return found;
      case NEQREGEX:
        return !found;
      default:
        return null;
      }
    }
    
    final int cmp;
    if (lhs instanceof StringLiteral && rhs instanceof StringLiteral) {
      cmp = ((StringLiteral) lhs).getValue().compareTo(
          ((StringLiteral) rhs).getValue());
    } else if (lhs instanceof BooleanLiteral && rhs instanceof BooleanLiteral) {
      if (op != Comparison.Op.EQ && op != Comparison.Op.NEQ) {
        return null;
      }
      cmp = ((BooleanLiteral) lhs).getValue().equals(
          ((BooleanLiteral) rhs).getValue()) ? 0 : 1;
    } else if (lhs instanceof IntegerLiteral && rhs instanceof IntegerLiteral) {
      cmp = Long.compare(((IntegerLiteral) lhs).getValue(), 
          ((IntegerLiteral) rhs).getValue());
    } else if (lhs instanceof UnsignedLiteral && 
        rhs instanceof UnsignedLiteral) {
      cmp = Long.compareUnsigned(((UnsignedLiteral) lhs).getValue(), 
          ((UnsignedLiteral) rhs).getValue());
    } else if (isFloating(lhs, rhs)) {
      cmp = Double.compare(toDouble(lhs), toDouble(rhs));
    } else {
      return null;
    }
    
    switch (op) {
    case EQ:
      return cmp == 0;
    case NEQ:
      return cmp != 0;
    case LT:
      return cmp < 0;
    case LTE:
      return cmp <= 0;
    case GT:
      return cmp > 0;
    case GTE:
      return cmp >= 0;
    default:
      return null;
    }
  }
  
  /** One side is a float and the other a float or signed integer. */
  private static boolean isFloating(final Node<ExprVisitor> lhs, 
                                    final Node<ExprVisitor> rhs) {
    if (lhs instanceof NumberLiteral) {
      return rhs instanceof NumberLiteral || rhs instanceof IntegerLiteral;
    }
    return rhs instanceof NumberLiteral && lhs instanceof IntegerLiteral;
  }
  
  private static double toDouble(final Node<ExprVisitor> node) {
    if (node instanceof NumberLiteral) {
      return ((NumberLiteral) node).getValue();
    }
    return ((IntegerLiteral) node).getValue();
  }
}
