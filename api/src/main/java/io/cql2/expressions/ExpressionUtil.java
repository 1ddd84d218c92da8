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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import io.cql2.exceptions.PolicyException;
import io.cql2.expressions.Expression.Operation;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Expression utility methods. */
public class ExpressionUtil {

  private ExpressionUtil() {}

  /**
   * Flattens a pure conjunction into its terminal predicates.
   *
   * <p>Predicates are returned in left-to-right order. A null expression means that no filter is
   * configured and produces an empty list.
   *
   * @param expr an expression tree made only of AND nodes and terminal predicates, or null
   * @return an immutable list of the terminal predicates in the tree
   * @throws PolicyException if the tree contains OR, NOT, or a leaf that is not a predicate
   */
  public static List<Predicate> flattenConjunction(Expression expr) {
    if (expr == null) {
      return Collections.emptyList();
    }

    ImmutableList.Builder<Predicate> predicates = ImmutableList.builder();
    flatten(expr, predicates);
    return predicates.build();
  }

  private static void flatten(Expression expr, ImmutableList.Builder<Predicate> predicates) {
    switch (expr.op()) {
      case AND:
        for (Expression child : ((Logical) expr).children()) {
          flatten(child, predicates);
        }
        break;
      case OR:
      case NOT:
        throw new PolicyException(
            expr.op().textName(),
            "Cannot flatten %s: only AND is supported",
            expr.op().textName());
      default:
        if (expr instanceof Predicate) {
          predicates.add((Predicate) expr);
        } else {
          throw new PolicyException(
              expr.op().jsonName(), "Cannot flatten non-predicate expression: %s", expr);
        }
    }
  }

  /**
   * Groups predicates by the property each one tests.
   *
   * <p>Keys keep the order in which each property is first seen, and each bucket keeps the input
   * order. A predicate whose term is not a property is grouped under the term's string form.
   *
   * @param predicates a list of predicates, such as the result of {@link
   *     #flattenConjunction(Expression)}
   * @return an ordered map from property name to the predicates on that property
   */
  public static Map<String, List<Predicate>> groupByProperty(List<Predicate> predicates) {
    return group(
        predicates,
        pred -> pred.propertyName() != null ? pred.propertyName() : String.valueOf(pred.term()));
  }

  /**
   * Groups predicates by operation.
   *
   * @param predicates a list of predicates
   * @return an ordered map from operation to the predicates with that operation
   */
  public static Map<Operation, List<Predicate>> groupByOperation(List<Predicate> predicates) {
    return group(predicates, Predicate::op);
  }

  private static <K> Map<K, List<Predicate>> group(
      List<Predicate> predicates, Function<Predicate, K> keyFunc) {
    Map<K, List<Predicate>> groups = Maps.newLinkedHashMap();
    for (Predicate pred : predicates) {
      groups.computeIfAbsent(keyFunc.apply(pred), key -> Lists.newArrayList()).add(pred);
    }

    return groups;
  }
}
