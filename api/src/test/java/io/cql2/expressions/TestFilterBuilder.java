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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cql2.expressions.Expression.Operation;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

public class TestFilterBuilder {

  @Test
  public void testConjunctionOfTerminalPredicates() {
    Expression expr =
        new FilterBuilder()
            .equal("type", "satellite")
            .lessThan("cloud_cover", 20)
            .build()
            .orElseThrow();

    List<Predicate> predicates = ExpressionUtil.flattenConjunction(expr);
    assertThat(predicates)
        .containsExactly(
            Expressions.equal("type", "satellite"), Expressions.lessThan("cloud_cover", 20));
    assertThat(((Comparison) predicates.get(1)).right()).isEqualTo(Literal.of(20.0));
  }

  @Test
  public void testEmptyBuilder() {
    assertThat(new FilterBuilder().build()).isEmpty();
  }

  @Test
  public void testSinglePredicateIsNotWrapped() {
    Expression expr = new FilterBuilder().isNull("end").build().orElseThrow();
    assertThat(expr).isEqualTo(Expressions.isNull("end"));
  }

  @Test
  public void testAllTerminalMethods() {
    Geometry point = Geometry.point(1, 2);
    Instant instant = Instant.parse("2021-04-08T04:39:23Z");
    Interval interval = Interval.of(LocalDate.of(2021, 1, 1), null);

    Expression expr =
        new FilterBuilder()
            .notEqual("a", 1)
            .lessThanOrEqual("b", 2)
            .greaterThan("c", 3)
            .greaterThanOrEqual("d", 4)
            .between("e", 1, 9)
            .like("f", "abc%")
            .in("g", "x", "y")
            .intersects("h", point)
            .within("i", point)
            .contains("j", point)
            .spatial(Operation.S_TOUCHES, "k", point)
            .after("l", instant)
            .before("m", instant)
            .during("n", interval)
            .temporalIntersects("o", interval)
            .temporal(Operation.T_MEETS, "p", instant)
            .build()
            .orElseThrow();

    List<Predicate> predicates = ExpressionUtil.flattenConjunction(expr);
    assertThat(predicates).hasSize(16);
    assertThat(predicates)
        .extracting(Predicate::op)
        .containsExactly(
            Operation.NOT_EQ,
            Operation.LT_EQ,
            Operation.GT,
            Operation.GT_EQ,
            Operation.BETWEEN,
            Operation.LIKE,
            Operation.IN,
            Operation.S_INTERSECTS,
            Operation.S_WITHIN,
            Operation.S_CONTAINS,
            Operation.S_TOUCHES,
            Operation.T_AFTER,
            Operation.T_BEFORE,
            Operation.T_DURING,
            Operation.T_INTERSECTS,
            Operation.T_MEETS);
    assertThat(predicates)
        .extracting(Predicate::propertyName)
        .containsExactly(
            "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m", "n", "o", "p");
  }

  @Test
  public void testOrWrapsAccumulated() {
    Expression expr =
        new FilterBuilder()
            .equal("a", 1)
            .equal("b", 2)
            .or(Expressions.equal("c", 3))
            .build()
            .orElseThrow();

    assertThat(expr)
        .isEqualTo(
            Expressions.or(
                Expressions.and(Expressions.equal("a", 1), Expressions.equal("b", 2)),
                Expressions.equal("c", 3)));
  }

  @Test
  public void testOrWithoutAccumulated() {
    Expression expr =
        new FilterBuilder()
            .or(Expressions.equal("a", 1), Expressions.equal("b", 2))
            .build()
            .orElseThrow();
    assertThat(expr)
        .isEqualTo(Expressions.or(Expressions.equal("a", 1), Expressions.equal("b", 2)));
  }

  @Test
  public void testNot() {
    Expression expr = new FilterBuilder().equal("a", 1).not().build().orElseThrow();
    assertThat(expr).isEqualTo(Expressions.not(Expressions.equal("a", 1)));

    assertThatThrownBy(() -> new FilterBuilder().not())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Cannot negate an empty filter");
  }

  @Test
  public void testAndAndWhere() {
    Expression expr =
        new FilterBuilder()
            .where(Expressions.equal("a", 1))
            .and(Expressions.equal("b", 2), Expressions.equal("c", 3))
            .build()
            .orElseThrow();

    assertThat(((Logical) expr).children()).hasSize(3);
  }

  @Test
  public void testFunction() {
    Expression expr = new FilterBuilder().function("casei", "abc").build().orElseThrow();
    assertThat(expr).isEqualTo(Expressions.function("casei", Literal.of("abc")));
  }

  @Test
  public void testReset() {
    FilterBuilder builder = new FilterBuilder().equal("a", 1);
    assertThat(builder.reset().build()).isEmpty();
  }

  @Test
  public void testUnsupportedValue() {
    assertThatThrownBy(() -> new FilterBuilder().equal("a", new Object()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Cannot create expression literal from java.lang.Object");
  }
}
