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

import static io.cql2.expressions.Expressions.and;
import static io.cql2.expressions.Expressions.equal;
import static io.cql2.expressions.Expressions.greaterThan;
import static io.cql2.expressions.Expressions.lessThan;
import static io.cql2.expressions.Expressions.not;
import static io.cql2.expressions.Expressions.or;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import io.cql2.expressions.Expression.Operation;
import org.junit.jupiter.api.Test;

public class TestExpressions {

  @Test
  public void testAndSplicesNestedConjunctions() {
    Expression a = equal("a", 1);
    Expression b = equal("b", 2);
    Expression c = equal("c", 3);

    Expression left = and(and(a, b), c);
    Expression right = and(a, and(b, c));

    assertThat(left).isInstanceOf(Logical.class).isEqualTo(right);
    assertThat(((Logical) left).children()).containsExactly(a, b, c);
  }

  @Test
  public void testMixedOperationsAreNotSpliced() {
    Expression a = equal("a", 1);
    Expression b = equal("b", 2);
    Expression c = equal("c", 3);

    Logical expr = (Logical) and(or(a, b), c);
    assertThat(expr.op()).isEqualTo(Operation.AND);
    assertThat(expr.children()).hasSize(2);
    assertThat(expr.children().get(0).op()).isEqualTo(Operation.OR);
  }

  @Test
  public void testSingleChildCollapses() {
    Expression a = greaterThan("temp", 30);
    assertThat(Expressions.and(ImmutableList.of(a))).isSameAs(a);
    assertThat(Expressions.or(ImmutableList.of(a))).isSameAs(a);
  }

  @Test
  public void testLogicalRequiresChildren() {
    assertThatThrownBy(() -> Expressions.and(ImmutableList.<Expression>of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot create AND without children");

    assertThatThrownBy(() -> Expressions.logical(Operation.NOT, ImmutableList.of(equal("a", 1))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid logical operation: NOT");
  }

  @Test
  public void testStructuralEquality() {
    assertThat(lessThan("cloud_cover", 20)).isEqualTo(lessThan("cloud_cover", 20.0));
    assertThat(lessThan("cloud_cover", 20)).isNotEqualTo(lessThan("cloud_cover", 21));
    assertThat(lessThan("cloud_cover", 20)).isNotEqualTo(greaterThan("cloud_cover", 20));
    assertThat(not(equal("a", "x"))).isEqualTo(not(equal("a", "x")));
    assertThat(not(equal("a", "x")).hashCode()).isEqualTo(not(equal("a", "x")).hashCode());
  }

  @Test
  public void testPredicateOperands() {
    Between between = Expressions.between("x", 1, 5);
    assertThat(between.operands())
        .containsExactly(Expressions.ref("x"), Literal.of(1.0), Literal.of(5.0));
    assertThat(between.propertyName()).isEqualTo("x");

    In in = Expressions.in("color", "red", "blue");
    assertThat(in.candidates()).containsExactly(Literal.of("red"), Literal.of("blue"));

    FunctionCall casei = Expressions.function("casei", Expressions.ref("name"));
    Comparison cmp = Expressions.equal(casei, Literal.of("x"));
    assertThat(cmp.term()).isEqualTo(casei);
    assertThat(cmp.propertyName()).isNull();
  }

  @Test
  public void testInvalidPredicateOperations() {
    assertThatThrownBy(
            () ->
                Expressions.comparison(
                    Operation.S_INTERSECTS, Expressions.ref("a"), Literal.of(1.0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid comparison operation: S_INTERSECTS");

    assertThatThrownBy(
            () -> Expressions.temporal(Operation.EQ, Expressions.ref("a"), Literal.of(1.0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid temporal operation: EQ");
  }

  @Test
  public void testPredicateTermMustBePropertyOrFunction() {
    assertThatThrownBy(() -> equal(Literals.from(5), Expressions.ref("x")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid left operand for = (must be a property or function)");

    assertThatThrownBy(() -> Expressions.isNull(Literals.nullLiteral()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid isNull value for isNull (must be a property or function)");

    assertThatThrownBy(() -> Expressions.like(Literals.from("abc"), "a%"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid like value for like");

    assertThatThrownBy(
            () ->
                Expressions.spatial(
                    Operation.S_INTERSECTS,
                    Literals.from(Geometry.point(1, 2)),
                    Expressions.ref("g")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid left operand for s_intersects");

    Expression byFunction = equal(Expressions.function("casei", Expressions.ref("name")), "x");
    assertThat(((Predicate) byFunction).term()).isInstanceOf(FunctionCall.class);
    assertThat(((Predicate) byFunction).propertyName()).isNull();
  }

  @Test
  public void testInvalidPropertyName() {
    assertThatThrownBy(() -> Expressions.ref(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid property name: empty");
  }

  @Test
  public void testOperationNames() {
    assertThat(Operation.fromJsonName("s_intersects")).isEqualTo(Operation.S_INTERSECTS);
    assertThat(Operation.fromJsonName("isNull")).isEqualTo(Operation.IS_NULL);
    assertThat(Operation.fromJsonName("S_INTERSECTS")).isNull();
    assertThat(Operation.fromJsonName("property")).isNull();
    assertThat(Operation.fromTextName("t_metby")).isEqualTo(Operation.T_MET_BY);
    assertThat(Operation.fromTextName("AND")).isNull();
  }

  @Test
  public void testArity() {
    assertThat(Operation.NOT.arity()).isEqualTo(1);
    assertThat(Operation.BETWEEN.arity()).isEqualTo(3);
    assertThat(Operation.T_DURING.arity()).isEqualTo(2);
    assertThat(Operation.AND.arity()).isEqualTo(-1);
  }

  @Test
  public void testToString() {
    Expression expr = and(greaterThan("temp", 30), or(lessThan("humidity", 50), equal("s", "on")));
    assertThat(expr.toString()).isEqualTo("(temp > 30.0 AND (humidity < 50.0 OR s = \"on\"))");
  }
}
