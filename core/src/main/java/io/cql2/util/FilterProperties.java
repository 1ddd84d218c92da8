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
package io.cql2.util;

/** Configuration keys read by the filter codec. */
public class FilterProperties {

  private FilterProperties() {}

  /** Comma-separated names of the functions accepted by the text and JSON parsers. */
  public static final String FUNCTIONS = "cql2.functions";

  public static final String FUNCTIONS_DEFAULT = "casei,accenti";

  /** Maximum nesting depth of parentheses and NOT in CQL2-Text input. */
  public static final String TEXT_MAX_DEPTH = "cql2.text.max-depth";

  public static final int TEXT_MAX_DEPTH_DEFAULT = 256;

  public static final String JSON_PRETTY = "cql2.json.pretty";

  public static final boolean JSON_PRETTY_DEFAULT = false;

  /** Name of the dialect used when translating without an explicit dialect. */
  public static final String DEFAULT_DIALECT = "cql2.dialect.default";

  public static final String DEFAULT_DIALECT_DEFAULT = "sql";

  /**
   * Prefix for externally defined dialect tables.
   *
   * <p>A key {@code cql2.dialect.<name>.<entry>} adds {@code <entry>} to the table of dialect
   * {@code <name>}. See {@code Dialect#fromProperties} for the entry keys.
   */
  public static final String DIALECT_PREFIX = "cql2.dialect.";
}
