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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

public class TestExpressionVisitors {

  private static class PropertyCollector extends ExpressionVisitors.ExpressionVisitor<Set<String>> {
    @Override
    public Set<String> property(Property ref) {
      return ImmutableSet.of(ref.name());
    }

    @Override
    public Set<String> literal(Literal<?> lit) {
      return ImmutableSet.of();
    }

    @Override
    public Set<String> not(Not not, Set<String> result) {
      return result;
    }

    @Override
    public Set<String> and(Logical and, List<Set<String>> results) {
      return union(results);
    }

    @Override
    public Set<String> or(Logical or, List<Set<String>> results) {
      return union(results);
    }

    @Override
    public Set<String> comparison(Comparison comparison, Set<String> left, Set<String> right) {
      return Sets.union(left, right);
    }

    @Override
    public Set<String> between(
        Between between, Set<String> value, Set<String> lower, Set<String> upper) {
      return Sets.union(value, Sets.union(lower, upper));
    }

    @Override
    public Set<String> isNull(IsNull isNull, Set<String> value) {
      return value;
    }

    private static Set<String> union(List<Set<String>> results) {
      Set<String> names = Sets.newTreeSet();
      results.forEach(names::addAll);
      return names;
    }
  }

  @Test
  public void testPostfixVisitor() {
    Expression expr =
        Expressions.and(
            Expressions.greaterThan("temp", 30),
            Expressions.or(
                Expressions.between("humidity", 10, 50), Expressions.not(Expressions.isNull("s"))));

    assertThat(ExpressionVisitors.visit(expr, new PropertyCollector()))
        .containsExactly("humidity", "s", "temp");
  }

  @Test
  public void testFunctionCallsAreRejectedByDefault() {
    Expression expr = Expressions.function("casei", Expressions.ref("name"));
    assertThatThrownBy(() -> ExpressionVisitors.visit(expr, new PropertyCollector()))
        .isInstanceOf(UnsupportedOperationException.class)
        .hasMessage("Cannot visit function call: casei");
  }

  @Test
  public void testCustomOrderVisitorSkipsUnvisitedChildren() {
    StringBuilder visited = new StringBuilder();
    ExpressionVisitors.CustomOrderExpressionVisitor<Void> firstOnly =
        new ExpressionVisitors.CustomOrderExpressionVisitor<Void>() {
          @Override
          public Void and(Logical and, List<Supplier<Void>> children) {
            return children.get(0).get();
          }

          @Override
          public Void predicate(Predicate pred, List<Supplier<Void>> operands) {
            visited.append(pred.propertyName()).append(';');
            return null;
          }
        };

    ExpressionVisitors.visit(
        Expressions.and(Expressions.equal("a", 1), Expressions.equal("b", 2)), firstOnly);
    assertThat(visited.toString()).isEqualTo("a;");
  }
}
