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
package io.cql2.expressions.text;

import io.cql2.exceptions.UnsupportedOperatorException;
import io.cql2.expressions.Between;
import io.cql2.expressions.Comparison;
import io.cql2.expressions.Expression;
import io.cql2.expressions.FunctionCall;
import io.cql2.expressions.FunctionRegistry;
import io.cql2.expressions.Geometry;
import io.cql2.expressions.In;
import io.cql2.expressions.Interval;
import io.cql2.expressions.IsNull;
import io.cql2.expressions.Like;
import io.cql2.expressions.Literal;
import io.cql2.expressions.Logical;
import io.cql2.expressions.Not;
import io.cql2.expressions.Property;
import io.cql2.expressions.SpatialPredicate;
import io.cql2.expressions.TemporalPredicate;
import io.cql2.util.DateTimeUtil;
import io.cql2.util.GeometryUtil;
import io.cql2.util.NumberUtil;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expressions as CQL2-Text.
 *
 * <p>A child is wrapped in parentheses only when its precedence is lower than its parent's, so the
 * output has the fewest parentheses that preserve the tree.
 */
class TextSerializer {
  static final String TARGET = "CQL2-Text";

  private static final int OR_PRECEDENCE = 1;
  private static final int AND_PRECEDENCE = 2;
  private static final int NOT_PRECEDENCE = 3;
  private static final int PREDICATE_PRECEDENCE = 4;

  private final FunctionRegistry functions;

  TextSerializer(FunctionRegistry functions) {
    this.functions = functions;
  }

  String serialize(Expression expr) {
    return render(expr, 0);
  }

  private String render(Expression expr, int enclosing) {
    int precedence = precedence(expr);
    String text;
    switch (expr.op()) {
      case AND:
      case OR:
        Logical logical = (Logical) expr;
        text =
            logical.children().stream()
                .map(child -> render(child, precedence))
                .collect(Collectors.joining(" " + expr.op().textName() + " "));
        break;
      case NOT:
        text = "NOT " + render(((Not) expr).child(), NOT_PRECEDENCE);
        break;
      default:
        text = predicate(expr);
    }

    return precedence < enclosing ? "(" + text + ")" : text;
  }

  private static int precedence(Expression expr) {
    switch (expr.op()) {
      case OR:
        return OR_PRECEDENCE;
      case AND:
        return AND_PRECEDENCE;
      case NOT:
        return NOT_PRECEDENCE;
      default:
        return PREDICATE_PRECEDENCE;
    }
  }

  private String predicate(Expression expr) {
    switch (expr.op()) {
      case BETWEEN:
        Between between = (Between) expr;
        return String.format(
            "%s BETWEEN %s AND %s",
            operand(between.value()), operand(between.lower()), operand(between.upper()));
      case LIKE:
        Like like = (Like) expr;
        return operand(like.value()) + " LIKE " + quote(like.pattern());
      case IN:
        In in = (In) expr;
        return operand(in.value()) + " IN (" + operands(in.candidates()) + ")";
      case IS_NULL:
        return operand(((IsNull) expr).value()) + " IS NULL";
      default:
        if (expr instanceof Comparison) {
          Comparison cmp = (Comparison) expr;
          return String.format(
              "%s %s %s", operand(cmp.left()), cmp.op().textName(), operand(cmp.right()));
        } else if (expr instanceof SpatialPredicate) {
          SpatialPredicate pred = (SpatialPredicate) expr;
          return String.format(
              "%s %s (%s)", operand(pred.left()), pred.op().textName(), operand(pred.right()));
        } else if (expr instanceof TemporalPredicate) {
          TemporalPredicate pred = (TemporalPredicate) expr;
          return String.format(
              "%s %s %s", operand(pred.left()), pred.op().textName(), operand(pred.right()));
        }

        return operand(expr);
    }
  }

  private String operands(List<Expression> exprs) {
    return exprs.stream().map(this::operand).collect(Collectors.joining(", "));
  }

  private String operand(Expression expr) {
    if (expr instanceof Property) {
      String name = ((Property) expr).name();
      if (!Tokenizer.isIdentifier(name)) {
        throw new UnsupportedOperatorException("property name '" + name + "'", TARGET);
      }
      return name;
    } else if (expr instanceof Literal) {
      return literal((Literal<?>) expr);
    } else if (expr instanceof FunctionCall) {
      FunctionCall call = (FunctionCall) expr;
      if (!functions.contains(call.name())) {
        throw new UnsupportedOperatorException(call.name(), TARGET);
      }
      return call.name() + "(" + operands(call.args()) + ")";
    }

    // boolean expressions cannot appear as operands in text
    throw new UnsupportedOperatorException(expr.op().jsonName() + " as an operand", TARGET);
  }

  private static String literal(Literal<?> lit) {
    switch (lit.kind()) {
      case STRING:
        return quote((String) lit.value());
      case NUMBER:
        return NumberUtil.toString((Double) lit.value());
      case BOOLEAN:
        return ((Boolean) lit.value()) ? "TRUE" : "FALSE";
      case NULL:
        return "NULL";
      case TIMESTAMP:
        return "TIMESTAMP(" + quote(DateTimeUtil.formatTimestamp((Instant) lit.value())) + ")";
      case DATE:
        return "DATE(" + quote(DateTimeUtil.formatDate((LocalDate) lit.value())) + ")";
      case INTERVAL:
        Interval interval = (Interval) lit.value();
        return String.format(
            "[%s / %s]",
            quote(DateTimeUtil.formatTemporal(interval.start())),
            quote(DateTimeUtil.formatTemporal(interval.end())));
      case GEOMETRY:
        return GeometryUtil.toWKT((Geometry) lit.value());
      default:
        throw new UnsupportedOperatorException("literal " + lit.kind(), TARGET);
    }
  }

  static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i += 1) {
      char ch = value.charAt(i);
      if (ch == '"' || ch == '\\') {
        sb.append('\\');
      }
      sb.append(ch);
    }
    sb.append('"');
    return sb.toString();
  }
}
