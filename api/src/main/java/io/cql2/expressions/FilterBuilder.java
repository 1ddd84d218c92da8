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
import com.google.common.collect.Lists;
import io.cql2.expressions.Expression.Operation;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates a filter expression through chained calls.
 *
 * <p>Each predicate method adds a conjunct to the accumulated expression, so
 *
 * <pre>
 *   new FilterBuilder().equal("type", "satellite").lessThan("cloud_cover", 20).build()
 * </pre>
 *
 * produces {@code type = "satellite" AND cloud_cover < 20}. Values are converted with {@link
 * Literals#from(Object)}.
 *
 * <p>Builders are not thread-safe. The expressions they produce are immutable.
 */
public class FilterBuilder {
  private Expression current = null;

  public FilterBuilder equal(String name, Object value) {
    return where(Expressions.equal(name, value));
  }

  public FilterBuilder notEqual(String name, Object value) {
    return where(Expressions.notEqual(name, value));
  }

  public FilterBuilder lessThan(String name, Object value) {
    return where(Expressions.lessThan(name, value));
  }

  public FilterBuilder lessThanOrEqual(String name, Object value) {
    return where(Expressions.lessThanOrEqual(name, value));
  }

  public FilterBuilder greaterThan(String name, Object value) {
    return where(Expressions.greaterThan(name, value));
  }

  public FilterBuilder greaterThanOrEqual(String name, Object value) {
    return where(Expressions.greaterThanOrEqual(name, value));
  }

  public FilterBuilder between(String name, Object lower, Object upper) {
    return where(Expressions.between(name, lower, upper));
  }

  public FilterBuilder like(String name, String pattern) {
    return where(Expressions.like(name, pattern));
  }

  public FilterBuilder in(String name, Object... values) {
    return where(Expressions.in(name, values));
  }

  public FilterBuilder in(String name, List<?> values) {
    return where(Expressions.in(name, values));
  }

  public FilterBuilder isNull(String name) {
    return where(Expressions.isNull(name));
  }

  public FilterBuilder spatial(Operation op, String name, Geometry geometry) {
    return where(Expressions.spatial(op, name, geometry));
  }

  public FilterBuilder intersects(String name, Geometry geometry) {
    return where(Expressions.intersects(name, geometry));
  }

  public FilterBuilder within(String name, Geometry geometry) {
    return where(Expressions.within(name, geometry));
  }

  public FilterBuilder contains(String name, Geometry geometry) {
    return where(Expressions.contains(name, geometry));
  }

  public FilterBuilder temporal(Operation op, String name, Object instantOrInterval) {
    return where(Expressions.temporal(op, name, instantOrInterval));
  }

  public FilterBuilder temporalIntersects(String name, Object instantOrInterval) {
    return where(Expressions.temporalIntersects(name, instantOrInterval));
  }

  public FilterBuilder after(String name, Object instant) {
    return where(Expressions.after(name, instant));
  }

  public FilterBuilder before(String name, Object instant) {
    return where(Expressions.before(name, instant));
  }

  public FilterBuilder during(String name, Interval interval) {
    return where(Expressions.during(name, interval));
  }

  public FilterBuilder function(String name, Object... args) {
    return where(Expressions.function(name, args));
  }

  /** Adds an expression as a conjunct of the accumulated filter. */
  public FilterBuilder where(Expression expr) {
    Preconditions.checkArgument(expr != null, "Invalid expression: null");
    this.current = current == null ? expr : Expressions.and(current, expr);
    return this;
  }

  /** Adds each expression as a conjunct of the accumulated filter. */
  public FilterBuilder and(Expression... expressions) {
    for (Expression expr : expressions) {
      where(expr);
    }

    return this;
  }

  /**
   * Replaces the accumulated filter with a disjunction of it and the given alternatives.
   *
   * <p>When nothing has been accumulated yet, the result is the disjunction of the alternatives.
   */
  public FilterBuilder or(Expression... alternatives) {
    Preconditions.checkArgument(alternatives.length > 0, "Cannot create OR without alternatives");
    List<Expression> children = Lists.newArrayList();
    if (current != null) {
      children.add(current);
    }

    children.addAll(Arrays.asList(alternatives));
    this.current = Expressions.or(children);
    return this;
  }

  /** Negates the accumulated filter. */
  public FilterBuilder not() {
    Preconditions.checkState(current != null, "Cannot negate an empty filter");
    this.current = Expressions.not(current);
    return this;
  }

  public FilterBuilder reset() {
    this.current = null;
    return this;
  }

  /** Returns the accumulated filter, or empty if no expression was added. */
  public Optional<Expression> build() {
    return Optional.ofNullable(current);
  }
}
