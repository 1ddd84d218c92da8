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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.cql2.expressions.Expression.Operation;
import java.util.Arrays;
import java.util.List;

/** Factory methods for creating {@link Expression expressions}. */
public class Expressions {
  private Expressions() {}

  public static Expression and(Expression left, Expression right, Expression... expressions) {
    return logical(Operation.AND, Lists.asList(left, right, expressions));
  }

  /**
   * Combines expressions with AND.
   *
   * <p>Children that are themselves conjunctions are spliced into the result, and a single
   * expression is returned unchanged.
   *
   * @param expressions one or more expressions
   * @return a canonical conjunction
   */
  public static Expression and(List<? extends Expression> expressions) {
    return logical(Operation.AND, expressions);
  }

  public static Expression or(Expression left, Expression right, Expression... expressions) {
    return logical(Operation.OR, Lists.asList(left, right, expressions));
  }

  public static Expression or(List<? extends Expression> expressions) {
    return logical(Operation.OR, expressions);
  }

  public static Expression logical(Operation op, List<? extends Expression> expressions) {
    Preconditions.checkArgument(op.isLogical(), "Invalid logical operation: %s", op);
    Preconditions.checkArgument(
        expressions != null && !expressions.isEmpty(), "Cannot create %s without children", op);

    List<Expression> children = Lists.newArrayList();
    for (Expression expr : expressions) {
      Preconditions.checkNotNull(expr, "Child expression cannot be null.");
      if (expr.op() == op) {
        children.addAll(((Logical) expr).children());
      } else {
        children.add(expr);
      }
    }

    if (children.size() == 1) {
      return children.get(0);
    }

    return new Logical(op, children);
  }

  public static Not not(Expression child) {
    return new Not(child);
  }

  public static Property ref(String name) {
    return new Property(name);
  }

  public static Literal<?> lit(Object value) {
    return Literals.from(value);
  }

  public static Comparison equal(String name, Object value) {
    return comparison(Operation.EQ, ref(name), operand(value));
  }

  public static Comparison equal(Expression term, Object value) {
    return comparison(Operation.EQ, term, operand(value));
  }

  public static Comparison notEqual(String name, Object value) {
    return comparison(Operation.NOT_EQ, ref(name), operand(value));
  }

  public static Comparison notEqual(Expression term, Object value) {
    return comparison(Operation.NOT_EQ, term, operand(value));
  }

  public static Comparison lessThan(String name, Object value) {
    return comparison(Operation.LT, ref(name), operand(value));
  }

  public static Comparison lessThan(Expression term, Object value) {
    return comparison(Operation.LT, term, operand(value));
  }

  public static Comparison lessThanOrEqual(String name, Object value) {
    return comparison(Operation.LT_EQ, ref(name), operand(value));
  }

  public static Comparison lessThanOrEqual(Expression term, Object value) {
    return comparison(Operation.LT_EQ, term, operand(value));
  }

  public static Comparison greaterThan(String name, Object value) {
    return comparison(Operation.GT, ref(name), operand(value));
  }

  public static Comparison greaterThan(Expression term, Object value) {
    return comparison(Operation.GT, term, operand(value));
  }

  public static Comparison greaterThanOrEqual(String name, Object value) {
    return comparison(Operation.GT_EQ, ref(name), operand(value));
  }

  public static Comparison greaterThanOrEqual(Expression term, Object value) {
    return comparison(Operation.GT_EQ, term, operand(value));
  }

  public static Comparison comparison(Operation op, Expression left, Expression right) {
    return new Comparison(op, left, right);
  }

  public static Between between(String name, Object lower, Object upper) {
    return new Between(ref(name), operand(lower), operand(upper));
  }

  public static Between between(Expression value, Expression lower, Expression upper) {
    return new Between(value, lower, upper);
  }

  public static Like like(String name, String pattern) {
    return new Like(ref(name), pattern);
  }

  public static Like like(Expression value, String pattern) {
    return new Like(value, pattern);
  }

  public static In in(String name, Object... values) {
    return in(name, Arrays.asList(values));
  }

  public static In in(String name, List<?> values) {
    Preconditions.checkNotNull(values, "Values cannot be null for IN predicate.");
    ImmutableList.Builder<Expression> candidates = ImmutableList.builder();
    for (Object value : values) {
      candidates.add(operand(value));
    }

    return new In(ref(name), candidates.build());
  }

  public static In in(Expression value, List<? extends Expression> candidates) {
    return new In(value, candidates);
  }

  public static IsNull isNull(String name) {
    return new IsNull(ref(name));
  }

  public static IsNull isNull(Expression value) {
    return new IsNull(value);
  }

  public static SpatialPredicate spatial(Operation op, String name, Geometry geometry) {
    return new SpatialPredicate(op, ref(name), Literal.of(geometry));
  }

  public static SpatialPredicate spatial(Operation op, Expression left, Expression right) {
    return new SpatialPredicate(op, left, right);
  }

  public static SpatialPredicate intersects(String name, Geometry geometry) {
    return spatial(Operation.S_INTERSECTS, name, geometry);
  }

  public static SpatialPredicate within(String name, Geometry geometry) {
    return spatial(Operation.S_WITHIN, name, geometry);
  }

  public static SpatialPredicate contains(String name, Geometry geometry) {
    return spatial(Operation.S_CONTAINS, name, geometry);
  }

  public static TemporalPredicate temporal(Operation op, String name, Object instantOrInterval) {
    return new TemporalPredicate(op, ref(name), operand(instantOrInterval));
  }

  public static TemporalPredicate temporal(Operation op, Expression left, Expression right) {
    return new TemporalPredicate(op, left, right);
  }

  public static TemporalPredicate after(String name, Object instant) {
    return temporal(Operation.T_AFTER, name, instant);
  }

  public static TemporalPredicate before(String name, Object instant) {
    return temporal(Operation.T_BEFORE, name, instant);
  }

  public static TemporalPredicate during(String name, Interval interval) {
    return temporal(Operation.T_DURING, name, interval);
  }

  public static TemporalPredicate temporalIntersects(String name, Object instantOrInterval) {
    return temporal(Operation.T_INTERSECTS, name, instantOrInterval);
  }

  public static FunctionCall function(String name, Object... args) {
    ImmutableList.Builder<Expression> operands = ImmutableList.builder();
    for (Object arg : args) {
      operands.add(operand(arg));
    }

    return new FunctionCall(name, operands.build());
  }

  public static FunctionCall function(String name, List<? extends Expression> args) {
    return new FunctionCall(name, args);
  }

  /** Returns an expression unchanged, or wraps any other value as a {@link Literal}. */
  static Expression operand(Object value) {
    if (value instanceof Expression) {
      return (Expression) value;
    }

    return Literals.from(value);
  }
}
