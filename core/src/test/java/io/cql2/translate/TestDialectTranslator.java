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

import static io.cql2.expressions.Expressions.and;
import static io.cql2.expressions.Expressions.equal;
import static io.cql2.expressions.Expressions.not;
import static io.cql2.expressions.Expressions.or;
import static io.cql2.expressions.Expressions.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.cql2.exceptions.UnsupportedOperatorException;
import io.cql2.expressions.Expression;
import io.cql2.expressions.Expression.Operation;
import io.cql2.expressions.Expressions;
import io.cql2.expressions.Geometry;
import io.cql2.expressions.Interval;
import io.cql2.expressions.Literals;
import io.cql2.expressions.text.ExpressionText;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

public class TestDialectTranslator {
  private static String sql(Expression expr) {
    return DialectTranslator.translate(expr, Dialects.sql());
  }

  private static String odata(Expression expr) {
    return DialectTranslator.translate(expr, Dialects.odata());
  }

  @Test
  public void testSqlComparisons() {
    assertThat(sql(equal("a", "x"))).isEqualTo("a = 'x'");
    assertThat(sql(equal("name", "O'Brien"))).isEqualTo("name = 'O''Brien'");
    assertThat(sql(Expressions.notEqual("n", 2.5))).isEqualTo("n <> 2.5");
    assertThat(sql(Expressions.lessThanOrEqual("n", 10))).isEqualTo("n <= 10");
    assertThat(sql(equal("f", true))).isEqualTo("f = true");
    assertThat(sql(equal(ref("a"), Literals.nullLiteral()))).isEqualTo("a = NULL");
    assertThat(sql(equal("price", "$5"))).isEqualTo("price = '$5'");
    assertThat(sql(equal("path", "C:\\{1}"))).isEqualTo("path = 'C:\\{1}'");
  }

  @Test
  public void testSqlNesting() {
    Expression expr = ExpressionText.fromText("temp > 30 AND (h < 50 OR NOT s = 'active')");
    assertThat(sql(expr)).isEqualTo("temp > 30 AND (h < 50 OR NOT (s = 'active'))");

    Expression flat = and(equal("a", 1), equal("b", 2), equal("c", 3));
    assertThat(sql(flat)).isEqualTo("a = 1 AND b = 2 AND c = 3");

    Expression negatedOr = not(or(equal("a", 1), equal("b", 2)));
    assertThat(sql(negatedOr)).isEqualTo("NOT (a = 1 OR b = 2)");
  }

  @Test
  public void testSqlPredicates() {
    assertThat(sql(Expressions.between("x", 1, 5))).isEqualTo("x BETWEEN 1 AND 5");
    assertThat(sql(Expressions.like("name", "a%"))).isEqualTo("name LIKE 'a%'");
    assertThat(sql(Expressions.in("color", "red", "blue"))).isEqualTo("color IN ('red', 'blue')");
    assertThat(sql(Expressions.isNull("a"))).isEqualTo("a IS NULL");
    assertThat(sql(not(Expressions.isNull("a")))).isEqualTo("NOT (a IS NULL)");
  }

  @Test
  public void testSqlSpatialAndTemporal() {
    assertThat(sql(Expressions.intersects("geom", Geometry.point(1, 2))))
        .isEqualTo("ST_Intersects(geom, ST_GeomFromText('POINT (1 2)'))");
    assertThat(sql(Expressions.after("t", Instant.parse("2021-04-08T04:39:23Z"))))
        .isEqualTo("t > TIMESTAMP '2021-04-08T04:39:23Z'");
    assertThat(sql(Expressions.before("d", LocalDate.of(2020, 2, 29))))
        .isEqualTo("d < DATE '2020-02-29'");
  }

  @Test
  public void testSqlFunctions() {
    Expression expr =
        equal(Expressions.function("casei", ref("name")), Expressions.function("casei", "X"));
    assertThat(sql(expr)).isEqualTo("LOWER(name) = LOWER('X')");
    assertThat(sql(Expressions.like(Expressions.function("ACCENTI", ref("name")), "caf%")))
        .isEqualTo("unaccent(name) LIKE 'caf%'");
  }

  @Test
  public void testSqlUnsupported() {
    assertThatThrownBy(() -> sql(Expressions.temporal(Operation.T_DURING, ref("a"), ref("b"))))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for sql: t_during");

    assertThatThrownBy(() -> sql(equal(Expressions.function("foo", ref("a")), 1)))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for sql: foo");

    Interval interval = Interval.of(LocalDate.of(2021, 1, 1), null);
    assertThatThrownBy(() -> sql(Expressions.during("t", interval)))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for sql: literal interval");

    assertThatThrownBy(() -> sql(Expressions.in("color")))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for sql: in with no candidates")
        .satisfies(
            e -> {
              UnsupportedOperatorException unsupported = (UnsupportedOperatorException) e;
              assertThat(unsupported.operator()).isEqualTo("in with no candidates");
              assertThat(unsupported.target()).isEqualTo("sql");
            });
  }

  @Test
  public void testPropertyNameQuoting() {
    assertThat(sql(Expressions.lessThan("eo:cloud_cover", 20)))
        .isEqualTo("\"eo:cloud_cover\" < 20");
    assertThat(sql(equal("a = 1 OR b", 5))).isEqualTo("\"a = 1 OR b\" = 5");
    assertThat(sql(equal("say \"hi\"", 1))).isEqualTo("\"say \"\"hi\"\"\" = 1");

    assertThatThrownBy(() -> odata(equal("cloud-cover", 5)))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for odata: property name 'cloud-cover'");

    Dialect backticks =
        Dialect.fromProperties(
            "backticks",
            ImmutableMap.of(
                "op.=", "{0} = {1}",
                "literal.number", "{0}",
                "quoted-property", "`{0}`",
                "identifier-quote", "`"));
    assertThat(DialectTranslator.translate(equal("a`b c", 1), backticks)).isEqualTo("`a``b c` = 1");
    assertThat(DialectTranslator.translate(equal("plain_name", 1), backticks))
        .isEqualTo("plain_name = 1");
  }

  @Test
  public void testOData() {
    assertThat(odata(and(equal("a", "x"), Expressions.lessThan("b", 5))))
        .isEqualTo("a eq 'x' and b lt 5");
    assertThat(odata(Expressions.between("x", 1, 5))).isEqualTo("(x ge 1 and x le 5)");
    assertThat(odata(Expressions.intersects("geom", Geometry.point(1, 2))))
        .isEqualTo("geo.intersects(geom, geography'POINT (1 2)')");
    assertThat(odata(not(equal("a", 1)))).isEqualTo("not (a eq 1)");
    assertThat(odata(Expressions.isNull("a"))).isEqualTo("a eq null");
    assertThat(odata(Expressions.in("n", 1, 2))).isEqualTo("n in (1, 2)");
    assertThat(odata(equal(Expressions.function("casei", ref("name")), "x")))
        .isEqualTo("tolower(name) eq 'x'");
  }

  @Test
  public void testODataUnsupported() {
    assertThatThrownBy(() -> odata(Expressions.like("name", "a%")))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for odata: like");

    assertThatThrownBy(() -> odata(Expressions.within("geom", Geometry.point(1, 2))))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for odata: s_within");
  }

  @Test
  public void testDialectFromProperties() {
    Dialect solr =
        Dialect.fromProperties(
            "solr",
            ImmutableMap.<String, String>builder()
                .put("op.=", "{0}:{1}")
                .put("op.and", "AND")
                .put("op.between", "{0}:[{1} TO {2}]")
                .put("literal.string", "\"{0}\"")
                .put("literal.number", "{0}")
                .put("string-quote", "\"")
                .put("property", "f_{0}")
                .put("op.unknown", "ignored")
                .build());

    assertThat(solr.name()).isEqualTo("solr");
    Expression expr = and(equal("a", "say \"hi\""), Expressions.between("n", 1, 2.5));
    assertThat(DialectTranslator.translate(expr, solr))
        .isEqualTo("f_a:\"say \"\"hi\"\"\" AND f_n:[1 TO 2.5]");

    assertThatThrownBy(() -> DialectTranslator.translate(equal("a", true), solr))
        .isInstanceOf(UnsupportedOperatorException.class)
        .hasMessage("Unsupported operator for solr: literal boolean");
  }

  @Test
  public void testOverrideBuiltInDialect() {
    Dialect ilike =
        Dialects.sql()
            .toBuilder()
            .withProperties(ImmutableMap.of("op.like", "{0} ILIKE {1}"))
            .build();

    assertThat(DialectTranslator.translate(Expressions.like("name", "a%"), ilike))
        .isEqualTo("name ILIKE 'a%'");
    assertThat(sql(Expressions.like("name", "a%"))).isEqualTo("name LIKE 'a%'");
  }

  @Test
  public void testInvalidDialectProperties() {
    assertThatThrownBy(
            () -> Dialect.fromProperties("bad", ImmutableMap.of("string-quote", "''")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid string quote for dialect bad: ''");

    assertThatThrownBy(() -> Dialect.builder(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid dialect name: ");
  }

  @Test
  public void testFill() {
    assertThat(DialectTranslator.fill("{1} {0} {1}", ImmutableList.of("a", "b")))
        .isEqualTo("b a b");
    assertThatThrownBy(() -> DialectTranslator.fill("{0} {3}", ImmutableList.of("a")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid template (no value for {3}): {0} {3}");
  }
}
