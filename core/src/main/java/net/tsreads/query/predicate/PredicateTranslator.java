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
package net.tsreads.query.predicate;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import net.tsreads.common.Const;
import net.tsreads.ql.ast.Node;
import net.tsreads.ql.ast.expr.And;
import net.tsreads.ql.ast.expr.BooleanLiteral;
import net.tsreads.ql.ast.expr.Comparison;
import net.tsreads.ql.ast.expr.ExprRewriter;
import net.tsreads.ql.ast.expr.ExprVisitor;
import net.tsreads.ql.ast.expr.Exprs;
import net.tsreads.ql.ast.expr.IntegerLiteral;
import net.tsreads.ql.ast.expr.Key;
import net.tsreads.ql.ast.expr.NumberLiteral;
import net.tsreads.ql.ast.expr.Or;
import net.tsreads.ql.ast.expr.Paren;
import net.tsreads.ql.ast.expr.RegexLiteral;
import net.tsreads.ql.ast.expr.StringLiteral;
import net.tsreads.ql.ast.expr.UnsignedLiteral;
import net.tsreads.query.UnsupportedPredicateException;

/**
 * Converts wire predicates into the storage engine's native expressions.
 * <p>
 * Tag references are renamed through the {@link KeyRemap} given at 
 * construction, field references become the {@code $} key and a tag 
 * reference to {@code _value} is treated as a field value reference too.
 * Translated predicates that reduce to the literal {@code true} are 
 * returned as null so callers only ever see "no predicate".
 * <p>
 * Instances are immutable and thread safe.
 * 
 * @since 1.0
 */
public class PredicateTranslator {
  
  /** Storage engine operators for the wire comparisons that have one. */
  private static final Comparison.Op[] OPS = new Comparison.Op[
      PredicateNode.Comparison.values().length];
  static {
    OPS[PredicateNode.Comparison.EQUAL.ordinal()] = Comparison.Op.EQ;
    OPS[PredicateNode.Comparison.NOT_EQUAL.ordinal()] = Comparison.Op.NEQ;
    OPS[PredicateNode.Comparison.REGEX.ordinal()] = Comparison.Op.EQREGEX;
    OPS[PredicateNode.Comparison.NOT_REGEX.ordinal()] = Comparison.Op.NEQREGEX;
    OPS[PredicateNode.Comparison.LT.ordinal()] = Comparison.Op.LT;
    OPS[PredicateNode.Comparison.LTE.ordinal()] = Comparison.Op.LTE;
    OPS[PredicateNode.Comparison.GT.ordinal()] = Comparison.Op.GT;
    OPS[PredicateNode.Comparison.GTE.ordinal()] = Comparison.Op.GTE;
  }
  
  /** Replaces comparisons on the field key or value with {@code true}. */
  private static final ExprRewriter REMOVE_FIELD_KEY_AND_VALUE = 
      new ExprRewriter() {
        @Override
        public Node<ExprVisitor> rewrite(final Node<ExprVisitor> node) {
          if (node instanceof Comparison && 
              (isFieldKeyOrValue(((Comparison) node).getLhs()) || 
               isFieldKeyOrValue(((Comparison) node).getRhs()))) {
            return BooleanLiteral.TRUE;
          }
          return node;
        }
  };
  
  private final KeyRemap remap;
  
  /**
   * Default ctor.
   * @param remap The non-null key remap table.
   */
  public PredicateTranslator(final KeyRemap remap) {
    if (remap == null) {
      throw new IllegalArgumentException("Remap cannot be null.");
    }
    this.remap = remap;
  }
  
  /** @return The key remap table. */
  public KeyRemap remap() {
    return remap;
  }
  
  /**
   * Translates a predicate for metadata requests. Field value references
   * are rejected and the result is reduced.
   * @param predicate The predicate, may be null.
   * @return The reduced expression or null if the predicate was absent or
   * reduced to true.
   * @throws UnsupportedPredicateException if the predicate references a 
   * field value or has no native equivalent.
   */
  public Node<ExprVisitor> translate(final Predicate predicate) {
    final Node<ExprVisitor> expr = checkedExpr(predicate);
    if (expr == null) {
      return null;
    }
    return normalize(Exprs.reduce(expr));
  }
  
  /**
   * Translates a predicate for the tag key and tag value indices. As with
   * {@link #translate(Predicate)}, but comparisons on the field key or
   * value are removed before reducing since the indices don't hold them.
   * @param predicate The predicate, may be null.
   * @return The reduced expression or null if the predicate was absent or
   * reduced to true.
   * @throws UnsupportedPredicateException if the predicate references a 
   * field value or has no native equivalent.
   */
  public Node<ExprVisitor> translateForIndex(final Predicate predicate) {
    final Node<ExprVisitor> expr = checkedExpr(predicate);
    if (expr == null) {
      return null;
    }
    return normalize(Exprs.reduce(removeFieldKeyAndValue(expr)));
  }
  
  /**
   * Converts the wire tree into a native tree without any checks or 
   * reduction.
   * @param node The root node, may be null.
   * @return The native expression or null if the node was null.
   * @throws UnsupportedPredicateException if a node has no native 
   * equivalent or is malformed.
   */
  public Node<ExprVisitor> toExpr(final PredicateNode node) {
    if (node == null) {
      return null;
    }
    
    final List<PredicateNode> children = node.children();
    switch (node.type()) {
    case LOGICAL_EXPRESSION:
      checkChildren(node, 2);
      if (node.logical() == null) {
        throw new UnsupportedPredicateException(
            "Logical expression is missing an operator: " + node);
      }
      final Node<ExprVisitor> left = toExpr(children.get(0));
      final Node<ExprVisitor> right = toExpr(children.get(1));
      return node.logical() == PredicateNode.Logical.AND ? 
          new And(left, right) : new Or(left, right);
      
    case COMPARISON_EXPRESSION:
      checkChildren(node, 2);
      if (node.comparison() == null) {
        throw new UnsupportedPredicateException(
            "Comparison is missing an operator: " + node);
      }
      final Comparison.Op op = OPS[node.comparison().ordinal()];
      if (op == null) {
        throw new UnsupportedPredicateException("Comparison operator " 
            + node.comparison() + " is not supported.");
      }
      return new Comparison(op, toExpr(children.get(0)), 
          toExpr(children.get(1)));
      
    case PAREN_EXPRESSION:
      checkChildren(node, 1);
      return new Paren(toExpr(children.get(0)));
      
    case TAG_REF:
      final String key = remap.remap(checkString(node));
      return new Key(key.equals(Const.VALUE_KEY) ? Const.FIELD_REF : key);
      
    case FIELD_REF:
      return new Key(Const.FIELD_REF);
      
    case STRING_LITERAL:
      return new StringLiteral(checkString(node));
      
    case REGEX_LITERAL:
      final String pattern = checkString(node);
      try {
        Pattern.compile(pattern);
      } catch (PatternSyntaxException e) {
        throw new UnsupportedPredicateException("Invalid regular expression: " 
            + pattern, e);
      }
      return new RegexLiteral(pattern);
      
    case BOOLEAN_LITERAL:
      return node.boolValue() ? BooleanLiteral.TRUE : BooleanLiteral.FALSE;
      
    case INTEGER_LITERAL:
      return new IntegerLiteral(node.intValue());
      
    case UNSIGNED_LITERAL:
      return new UnsignedLiteral(node.intValue());
      
    case FLOAT_LITERAL:
      return new NumberLiteral(node.floatValue());
      
    default:
      throw new UnsupportedPredicateException("Unsupported node type: " 
          + node.type());
    }
  }
  
  /**
   * Builds {@code _tagKey = 'tag_key' AND (expr)}, or just the equality 
   * when the expression is null.
   * @param tag_key The non-null tag key to list values for.
   * @param expr An optional expression.
   * @return The conjoined expression.
   */
  public static Node<ExprVisitor> withTagKey(final String tag_key, 
                                             final Node<ExprVisitor> expr) {
    final Node<ExprVisitor> tag_key_expr = new Comparison(Comparison.Op.EQ, 
        new Key(Const.TAG_KEY_KEY), new StringLiteral(tag_key));
    if (expr == null) {
      return tag_key_expr;
    }
    return new And(tag_key_expr, new Paren(expr));
  }
  
  /**
   * @param expr An expression, may be null.
   * @return True if the expression references a field value.
   */
  public static boolean hasFieldValueKey(final Node<ExprVisitor> expr) {
    for (final String key : Exprs.keys(expr)) {
      if (isFieldValueKey(key)) {
        return true;
      }
    }
    return false;
  }
  
  /**
   * @param expr An expression, may be null.
   * @return True if the expression references the field key.
   */
  public static boolean hasFieldKey(final Node<ExprVisitor> expr) {
    return Exprs.keys(expr).contains(Const.FIELD_KEY);
  }
  
  /**
   * @param expr An expression, may be null.
   * @return True if the expression references the field key or a field
   * value.
   */
  public static boolean hasFieldKeyOrValue(final Node<ExprVisitor> expr) {
    return hasFieldKey(expr) || hasFieldValueKey(expr);
  }
  
  /**
   * @param expr An expression, may be null.
   * @return True if the expression references any ordinary tag key, i.e.
   * anything other than the measurement, field key or field value.
   */
  public static boolean hasTagKey(final Node<ExprVisitor> expr) {
    final Set<String> keys = Exprs.keys(expr);
    for (final String key : keys) {
      if (!key.equals(Const.NAME_KEY) && 
          !key.equals(Const.FIELD_KEY) && 
          !isFieldValueKey(key)) {
        return true;
      }
    }
    return false;
  }
  
  /**
   * Replaces every comparison with the field key or a field value on 
   * either side with {@code true}. The result is not reduced.
   * @param expr An expression, may be null.
   * @return The rewritten expression.
   */
  public static Node<ExprVisitor> removeFieldKeyAndValue(
      final Node<ExprVisitor> expr) {
    return Exprs.rewrite(expr, REMOVE_FIELD_KEY_AND_VALUE);
  }
  
  private static boolean isFieldKeyOrValue(final Node<ExprVisitor> node) {
    if (!(node instanceof Key)) {
      return false;
    }
    final String key = ((Key) node).getValue();
    return key.equals(Const.FIELD_KEY) || isFieldValueKey(key);
  }
  
  private Node<ExprVisitor> checkedExpr(final Predicate predicate) {
    final PredicateNode root = Predicate.rootOf(predicate);
    if (root == null) {
      return null;
    }
    final Node<ExprVisitor> expr = toExpr(root);
    if (hasFieldValueKey(expr)) {
      throw new UnsupportedPredicateException("Field values unsupported: " 
          + expr);
    }
    return expr;
  }
  
  private static Node<ExprVisitor> normalize(final Node<ExprVisitor> expr) {
    return Exprs.isTrueLiteral(expr) ? null : expr;
  }
  
  private static boolean isFieldValueKey(final String key) {
    return key.equals(Const.FIELD_REF) || key.equals(Const.VALUE_KEY);
  }
  
  private static void checkChildren(final PredicateNode node, 
                                    final int expected) {
    if (node.children().size() != expected) {
      throw new UnsupportedPredicateException(node.type() + " expects " 
          + expected + " children but had " + node.children().size());
    }
  }
  
  private static String checkString(final PredicateNode node) {
    if (node.stringValue() == null) {
      throw new UnsupportedPredicateException(node.type() 
          + " is missing a value.");
    }
    return node.stringValue();
  }
}
