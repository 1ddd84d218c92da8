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
package io.cql2.translate;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.cql2.exceptions.UnsupportedOperatorException;
import io.cql2.expressions.Between;
import io.cql2.expressions.Comparison;
import io.cql2.expressions.Expression;
import io.cql2.expressions.Expression.Operation;
import io.cql2.expressions.ExpressionVisitors;
import io.cql2.expressions.FunctionCall;
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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates expressions into query fragments of a {@link Dialect}. */
public class DialectTranslator {
  private static final Logger LOG = LoggerFactory.getLogger(DialectTranslator.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\d+)\\}");
  private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Joiner COMMA = Joiner.on(", ");

  private DialectTranslator() {}

  /**
   * Translates an expression.
   *
   * @param expr an expression
   * @param dialect the target dialect
   * @return the query fragment
   * @throws UnsupportedOperatorException if any node in the tree has no mapping in the dialect
   */
  public static String translate(Expression expr, Dialect dialect) {
    Preconditions.checkArgument(expr != null, "Invalid expression: null");
    Preconditions.checkArgument(dialect != null, "Invalid dialect: null");
    String fragment = ExpressionVisitors.visit(expr, new FragmentVisitor(dialect));
    LOG.debug("Translated {} to {}: {}", expr, dialect.name(), fragment);
    return fragment;
  }

  /**
   * Substitutes positional placeholders in a template.
   *
   * @param template a template with {@code {n}} placeholders
   * @param args values for the placeholders
   * @return the filled template
   * @throws IllegalArgumentException if a placeholder has no value
   */
  static String fill(String template, List<String> args) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      int index = Integer.parseInt(matcher.group(1));
      Preconditions.checkArgument(
          index < args.size(), "Invalid template (no value for {%s}): %s", index, template);
      matcher.appendReplacement(result, Matcher.quoteReplacement(args.get(index)));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static class FragmentVisitor extends ExpressionVisitors.ExpressionVisitor<String> {
    private final Dialect dialect;

    private FragmentVisitor(Dialect dialect) {
      this.dialect = dialect;
    }

    @Override
    public String property(Property ref) {
      String name = ref.name();
      if (PLAIN_NAME.matcher(name).matches()) {
        return fill(dialect.property(), ImmutableList.of(name));
      }

      String template = dialect.quotedProperty();
      if (template == null) {
        throw unsupported("property name '" + name + "'");
      }

      String quote = String.valueOf(dialect.identifierQuote());
      return fill(template, ImmutableList.of(name.replace(quote, quote + quote)));
    }

    @Override
    public String literal(Literal<?> lit) {
      String template = dialect.literal(lit.kind());
      if (template == null) {
        throw unsupported("literal " + lit.kind().name().toLowerCase(Locale.ROOT));
      }

      return fill(template, ImmutableList.of(value(lit)));
    }

    @Override
    public String not(Not not, String result) {
      return fill(template(Operation.NOT), ImmutableList.of(result));
    }

    @Override
    public String and(Logical and, List<String> results) {
      return join(and, results);
    }

    @Override
    public String or(Logical or, List<String> results) {
      return join(or, results);
    }

    @Override
    public String comparison(Comparison comparison, String leftResult, String rightResult) {
      return fill(template(comparison.op()), ImmutableList.of(leftResult, rightResult));
    }

    @Override
    public String between(
        Between between, String valueResult, String lowerResult, String upperResult) {
      return fill(
          template(Operation.BETWEEN), ImmutableList.of(valueResult, lowerResult, upperResult));
    }

    @Override
    public String like(Like like, String valueResult) {
      String pattern = literal(Literal.of(like.pattern()));
      return fill(template(Operation.LIKE), ImmutableList.of(valueResult, pattern));
    }

    @Override
    public String in(In in, String valueResult, List<String> candidateResults) {
      String template = template(Operation.IN);
      if (candidateResults.isEmpty()) {
        throw unsupported("in with no candidates");
      }

      return fill(template, ImmutableList.of(valueResult, COMMA.join(candidateResults)));
    }

    @Override
    public String isNull(IsNull isNull, String valueResult) {
      return fill(template(Operation.IS_NULL), ImmutableList.of(valueResult));
    }

    @Override
    public String spatial(SpatialPredicate pred, String leftResult, String rightResult) {
      return fill(template(pred.op()), ImmutableList.of(leftResult, rightResult));
    }

    @Override
    public String temporal(TemporalPredicate pred, String leftResult, String rightResult) {
      return fill(template(pred.op()), ImmutableList.of(leftResult, rightResult));
    }

    @Override
    public String function(FunctionCall call, List<String> argResults) {
      String template = dialect.function(call.name());
      if (template == null) {
        throw unsupported(call.name());
      }

      return fill(template, argResults);
    }

    private String join(Logical logical, List<String> results) {
      String joiner = " " + template(logical.op()) + " ";
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < results.size(); i += 1) {
        if (i > 0) {
          sb.append(joiner);
        }

        if (logical.children().get(i) instanceof Logical) {
          sb.append('(').append(results.get(i)).append(')');
        } else {
          sb.append(results.get(i));
        }
      }

      return sb.toString();
    }

    private String template(Operation op) {
      String template = dialect.operator(op);
      if (template == null) {
        throw unsupported(op.jsonName());
      }

      return template;
    }

    private String value(Literal<?> lit) {
      switch (lit.kind()) {
        case STRING:
          String quote = String.valueOf(dialect.stringQuote());
          return ((String) lit.value()).replace(quote, quote + quote);
        case NUMBER:
          return NumberUtil.toString((Double) lit.value());
        case BOOLEAN:
          return String.valueOf(lit.value());
        case NULL:
          return "";
        case TIMESTAMP:
          return DateTimeUtil.formatTimestamp((Instant) lit.value());
        case DATE:
          return DateTimeUtil.formatDate((LocalDate) lit.value());
        case INTERVAL:
          Interval interval = (Interval) lit.value();
          return DateTimeUtil.formatTemporal(interval.start())
              + "/"
              + DateTimeUtil.formatTemporal(interval.end());
        case GEOMETRY:
          return GeometryUtil.toWKT((Geometry) lit.value());
        default:
          throw unsupported("literal " + lit.kind().name().toLowerCase(Locale.ROOT));
      }
    }

    private UnsupportedOperatorException unsupported(String operator) {
      return new UnsupportedOperatorException(operator, dialect.name());
    }
  }
}
