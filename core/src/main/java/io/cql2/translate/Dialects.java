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

import io.cql2.expressions.Expression.Operation;
import io.cql2.expressions.Literal;

/** Built-in {@link Dialect dialects}. */
public class Dialects {
  public static final String SQL = "sql";
  public static final String ODATA = "odata";

  private static final Dialect SQL_DIALECT =
      Dialect.builder(SQL)
          .operator(Operation.EQ, "{0} = {1}")
          .operator(Operation.NOT_EQ, "{0} <> {1}")
          .operator(Operation.LT, "{0} < {1}")
          .operator(Operation.LT_EQ, "{0} <= {1}")
          .operator(Operation.GT, "{0} > {1}")
          .operator(Operation.GT_EQ, "{0} >= {1}")
          .operator(Operation.AND, "AND")
          .operator(Operation.OR, "OR")
          .operator(Operation.NOT, "NOT ({0})")
          .operator(Operation.BETWEEN, "{0} BETWEEN {1} AND {2}")
          .operator(Operation.LIKE, "{0} LIKE {1}")
          .operator(Operation.IN, "{0} IN ({1})")
          .operator(Operation.IS_NULL, "{0} IS NULL")
          .operator(Operation.S_INTERSECTS, "ST_Intersects({0}, {1})")
          .operator(Operation.S_CONTAINS, "ST_Contains({0}, {1})")
          .operator(Operation.S_WITHIN, "ST_Within({0}, {1})")
          .operator(Operation.S_EQUALS, "ST_Equals({0}, {1})")
          .operator(Operation.S_DISJOINT, "ST_Disjoint({0}, {1})")
          .operator(Operation.S_TOUCHES, "ST_Touches({0}, {1})")
          .operator(Operation.S_OVERLAPS, "ST_Overlaps({0}, {1})")
          .operator(Operation.S_CROSSES, "ST_Crosses({0}, {1})")
          .operator(Operation.T_AFTER, "{0} > {1}")
          .operator(Operation.T_BEFORE, "{0} < {1}")
          .operator(Operation.T_EQUALS, "{0} = {1}")
          .literal(Literal.Kind.STRING, "'{0}'")
          .literal(Literal.Kind.NUMBER, "{0}")
          .literal(Literal.Kind.BOOLEAN, "{0}")
          .literal(Literal.Kind.NULL, "NULL")
          .literal(Literal.Kind.TIMESTAMP, "TIMESTAMP '{0}'")
          .literal(Literal.Kind.DATE, "DATE '{0}'")
          .literal(Literal.Kind.GEOMETRY, "ST_GeomFromText('{0}')")
          .function("casei", "LOWER({0})")
          .function("accenti", "unaccent({0})")
          .quotedProperty("\"{0}\"")
          .stringQuote('\'')
          .identifierQuote('"')
          .build();

  private static final Dialect ODATA_DIALECT =
      Dialect.builder(ODATA)
          .operator(Operation.EQ, "{0} eq {1}")
          .operator(Operation.NOT_EQ, "{0} ne {1}")
          .operator(Operation.LT, "{0} lt {1}")
          .operator(Operation.LT_EQ, "{0} le {1}")
          .operator(Operation.GT, "{0} gt {1}")
          .operator(Operation.GT_EQ, "{0} ge {1}")
          .operator(Operation.AND, "and")
          .operator(Operation.OR, "or")
          .operator(Operation.NOT, "not ({0})")
          .operator(Operation.BETWEEN, "({0} ge {1} and {0} le {2})")
          .operator(Operation.IN, "{0} in ({1})")
          .operator(Operation.IS_NULL, "{0} eq null")
          .operator(Operation.S_INTERSECTS, "geo.intersects({0}, {1})")
          .operator(Operation.T_AFTER, "{0} gt {1}")
          .operator(Operation.T_BEFORE, "{0} lt {1}")
          .operator(Operation.T_EQUALS, "{0} eq {1}")
          .literal(Literal.Kind.STRING, "'{0}'")
          .literal(Literal.Kind.NUMBER, "{0}")
          .literal(Literal.Kind.BOOLEAN, "{0}")
          .literal(Literal.Kind.NULL, "null")
          .literal(Literal.Kind.TIMESTAMP, "{0}")
          .literal(Literal.Kind.DATE, "{0}")
          .literal(Literal.Kind.GEOMETRY, "geography'{0}'")
          .function("casei", "tolower({0})")
          .stringQuote('\'')
          .build();

  private Dialects() {}

  /** Returns the ANSI SQL dialect with PostGIS-style spatial functions. */
  public static Dialect sql() {
    return SQL_DIALECT;
  }

  /**
   * Returns the OData v4 {@code $filter} dialect.
   *
   * <p>OData has no pattern operator, so LIKE cannot be translated.
   */
  public static Dialect odata() {
    return ODATA_DIALECT;
  }
}
