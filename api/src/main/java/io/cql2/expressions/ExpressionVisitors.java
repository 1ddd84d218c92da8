/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.cql2.expressions;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/** Utils for traversing {@link Expression expressions}. */
public class ExpressionVisitors {

  private ExpressionVisitors() {}

  public abstract static class ExpressionVisitor<R> {
    public R property(Property ref) {
      return null;
    }

    public R literal(Literal<?> lit) {
      return null;
    }

    public R not(Not not, R result) {
      return null;
    }

    public R and(Logical and, List<R> results) {
      return null;
    }

    public R or(Logical or, List<R> results) {
      return null;
    }

    public R comparison(Comparison comparison, R leftResult, R rightResult) {
      return null;
    }

    public R between(Between between, R valueResult, R lowerResult, R upperResult) {
      return null;
    }

    public R like(Like like, R valueResult) {
      return null;
    }

    public R in(In in, R valueResult, List<R> candidateResults) {
      return null;
    }

    public R isNull(IsNull isNull, R valueResult) {
      return null;
    }

    public R spatial(SpatialPredicate pred, R leftResult, R rightResult) {
      return null;
    }

    public R temporal(TemporalPredicate pred, R leftResult, R rightResult) {
      return null;
    }

    public R function(FunctionCall call, List<R> argResults) {
      throw new UnsupportedOperationException("Cannot visit function call: " + call.name());
    }
  }

  /**
   * A visitor that controls the order in which child nodes are visited.
   *
   * <p>Each child result is passed as a {@link Supplier} that traverses the child when called.
   * This is used by visitors that stream output, such as JSON generation.
   */
  public abstract static class CustomOrderExpressionVisitor<R> {
    public R property(Property ref) {
      return null;
    }

    public R literal(Literal<?> lit) {
      return null;
    }

    public R not(Not not, Supplier<R> child) {
      return null;
    }

    public R and(Logical and, List<Supplier<R>> children) {
      return null;
    }

    public R or(Logical or, List<Supplier<R>> children) {
      return null;
    }

    public R predicate(Predicate pred, List<Supplier<R>> operands) {
      return null;
    }

    public R function(FunctionCall call, List<Supplier<R>> args) {
      throw new UnsupportedOperationException("Cannot visit function call: " + call.name());
    }
  }

  /**
   * Traverses the given {@link Expression expression} with a {@link ExpressionVisitor visitor}.
   *
   * <p>The visitor will be called to handle each node in the expression tree in postfix order.
   * Result values produced by child nodes are passed when parent nodes are handled.
   *
   * @param expr an expression to traverse
   * @param visitor a visitor that will be called to handle each node in the expression tree
   * @param <R> the return type produced by the expression visitor
   * @return the value returned by the visitor for the root expression node
   */
  public static <R> R visit(Expression expr, ExpressionVisitor<R> visitor) {
    switch (expr.op()) {
      case PROPERTY:
        return visitor.property((Property) expr);
      case LITERAL:
        return visitor.literal((Literal<?>) expr);
      case NOT:
        Not not = (Not) expr;
        return visitor.not(not, visit(not.child(), visitor));
      case AND:
        Logical and = (Logical) expr;
        return visitor.and(and, visitAll(and.children(), visitor));
      case OR:
        Logical or = (Logical) expr;
        return visitor.or(or, visitAll(or.children(), visitor));
      case BETWEEN:
        Between between = (Between) expr;
        return visitor.between(
            between,
            visit(between.value(), visitor),
            visit(between.lower(), visitor),
            visit(between.upper(), visitor));
      case LIKE:
        Like like = (Like) expr;
        return visitor.like(like, visit(like.value(), visitor));
      case IN:
        In in = (In) expr;
        return visitor.in(in, visit(in.value(), visitor), visitAll(in.candidates(), visitor));
      case IS_NULL:
        IsNull isNull = (IsNull) expr;
        return visitor.isNull(isNull, visit(isNull.value(), visitor));
      case FUNCTION:
        FunctionCall call = (FunctionCall) expr;
        return visitor.function(call, visitAll(call.args(), visitor));
      default:
        if (expr instanceof Comparison) {
          Comparison cmp = (Comparison) expr;
          return visitor.comparison(cmp, visit(cmp.left(), visitor), visit(cmp.right(), visitor));
        } else if (expr instanceof SpatialPredicate) {
          SpatialPredicate pred = (SpatialPredicate) expr;
          return visitor.spatial(pred, visit(pred.left(), visitor), visit(pred.right(), visitor));
        } else if (expr instanceof TemporalPredicate) {
          TemporalPredicate pred = (TemporalPredicate) expr;
          return visitor.temporal(pred, visit(pred.left(), visitor), visit(pred.right(), visitor));
        }

        throw new UnsupportedOperationException("Unknown operation: " + expr.op());
    }
  }

  /**
   * Traverses the given {@link Expression expression} with a {@link CustomOrderExpressionVisitor
   * visitor}.
   *
   * @param expr an expression to traverse
   * @param visitor a visitor that decides when each child node is traversed
   * @param <R> the return type produced by the expression visitor
   * @return the value returned by the visitor for the root expression node
   */
  public static <R> R visit(Expression expr, CustomOrderExpressionVisitor<R> visitor) {
    switch (expr.op()) {
      case PROPERTY:
        return visitor.property((Property) expr);
      case LITERAL:
        return visitor.literal((Literal<?>) expr);
      case NOT:
        Not not = (Not) expr;
        return visitor.not(not, () -> visit(not.child(), visitor));
      case AND:
        Logical and = (Logical) expr;
        return visitor.and(and, suppliers(and.children(), visitor));
      case OR:
        Logical or = (Logical) expr;
        return visitor.or(or, suppliers(or.children(), visitor));
      case FUNCTION:
        FunctionCall call = (FunctionCall) expr;
        return visitor.function(call, suppliers(call.args(), visitor));
      default:
        if (expr instanceof Predicate) {
          Predicate pred = (Predicate) expr;
          return visitor.predicate(pred, suppliers(pred.operands(), visitor));
        }

        throw new UnsupportedOperationException("Unknown operation: " + expr.op());
    }
  }

  private static <R> List<R> visitAll(List<Expression> exprs, ExpressionVisitor<R> visitor) {
    return exprs.stream().map(expr -> visit(expr, visitor)).collect(Collectors.toList());
  }

  private static <R> List<Supplier<R>> suppliers(
      List<Expression> exprs, CustomOrderExpressionVisitor<R> visitor) {
    return exprs.stream()
        .<Supplier<R>>map(expr -> () -> visit(expr, visitor))
        .collect(Collectors.toList());
  }
}
