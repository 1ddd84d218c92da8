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
package io.cql2;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.cql2.expressions.Expression;
import io.cql2.expressions.ExpressionParser;
import io.cql2.expressions.FunctionRegistry;
import io.cql2.expressions.text.ExpressionText;
import io.cql2.translate.Dialect;
import io.cql2.translate.DialectTranslator;
import io.cql2.translate.Dialects;
import io.cql2.util.FilterProperties;
import io.cql2.util.PropertyUtil;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing, serializing and translating CQL2 filters.
 *
 * <p>A codec is configured once from a string property map (see {@link FilterProperties}) and is
 * immutable afterwards, so a single instance can be shared across threads.
 */
public class FilterCodec {
  private static final Logger LOG = LoggerFactory.getLogger(FilterCodec.class);

  private final FunctionRegistry functions;
  private final int maxDepth;
  private final boolean pretty;
  private final Map<String, Dialect> dialects;
  private final String defaultDialect;

  private FilterCodec(
      FunctionRegistry functions,
      int maxDepth,
      boolean pretty,
      Map<String, Dialect> dialects,
      String defaultDialect) {
    this.functions = functions;
    this.maxDepth = maxDepth;
    this.pretty = pretty;
    this.dialects = dialects;
    this.defaultDialect = defaultDialect;
  }

  /** Creates a codec with default settings. */
  public static FilterCodec create() {
    return create(ImmutableMap.of());
  }

  /**
   * Creates a codec from configuration properties.
   *
   * @param properties configuration keyed by the constants in {@link FilterProperties}
   * @return a configured codec
   * @throws IllegalArgumentException if a setting is invalid or the default dialect is unknown
   */
  public static FilterCodec create(Map<String, String> properties) {
    Preconditions.checkArgument(properties != null, "Invalid properties: null");

    FunctionRegistry functions =
        FunctionRegistry.of(
            PropertyUtil.propertyAsList(
                properties, FilterProperties.FUNCTIONS, FilterProperties.FUNCTIONS_DEFAULT));
    int maxDepth =
        PropertyUtil.propertyAsInt(
            properties, FilterProperties.TEXT_MAX_DEPTH, FilterProperties.TEXT_MAX_DEPTH_DEFAULT);
    Preconditions.checkArgument(
        maxDepth > 0,
        "Invalid %s (must be positive): %s",
        FilterProperties.TEXT_MAX_DEPTH,
        maxDepth);
    boolean pretty =
        PropertyUtil.propertyAsBoolean(
            properties, FilterProperties.JSON_PRETTY, FilterProperties.JSON_PRETTY_DEFAULT);

    Map<String, Dialect> dialects = loadDialects(properties);
    String defaultDialect =
        PropertyUtil.propertyAsString(
            properties, FilterProperties.DEFAULT_DIALECT, FilterProperties.DEFAULT_DIALECT_DEFAULT);
    Preconditions.checkArgument(
        dialects.containsKey(defaultDialect),
        "Invalid default dialect %s, not one of %s",
        defaultDialect,
        dialects.keySet());

    LOG.debug(
        "Created filter codec: functions={}, maxDepth={}, pretty={}, dialects={}, default={}",
        functions,
        maxDepth,
        pretty,
        dialects.keySet(),
        defaultDialect);

    return new FilterCodec(functions, maxDepth, pretty, dialects, defaultDialect);
  }

  private static Map<String, Dialect> loadDialects(Map<String, String> properties) {
    Map<String, Dialect> dialects = Maps.newLinkedHashMap();
    dialects.put(Dialects.SQL, Dialects.sql());
    dialects.put(Dialects.ODATA, Dialects.odata());

    // group cql2.dialect.<name>.<entry> by name; keys without an entry, like "default", are skipped
    Map<String, Map<String, String>> tables = Maps.newLinkedHashMap();
    Map<String, String> dialectProps =
        PropertyUtil.propertiesWithPrefix(properties, FilterProperties.DIALECT_PREFIX);
    for (Map.Entry<String, String> entry : dialectProps.entrySet()) {
      String key = entry.getKey();
      int dot = key.indexOf('.');
      if (dot > 0 && dot < key.length() - 1) {
        tables
            .computeIfAbsent(key.substring(0, dot), name -> Maps.newLinkedHashMap())
            .put(key.substring(dot + 1), entry.getValue());
      }
    }

    for (Map.Entry<String, Map<String, String>> table : tables.entrySet()) {
      String name = table.getKey();
      Dialect base = dialects.get(name);
      Dialect dialect;
      if (base != null) {
        dialect = base.toBuilder().withProperties(table.getValue()).build();
      } else {
        dialect = Dialect.fromProperties(name, table.getValue());
      }

      LOG.info("Loaded dialect {} with {} configured entries", name, table.getValue().size());
      dialects.put(name, dialect);
    }

    return ImmutableMap.copyOf(dialects);
  }

  public FunctionRegistry functions() {
    return functions;
  }

  /** Returns the names of the dialects this codec can translate to. */
  public Set<String> dialects() {
    return dialects.keySet();
  }

  /**
   * Returns a dialect by name.
   *
   * @throws IllegalArgumentException if no dialect has the name
   */
  public Dialect dialect(String name) {
    Dialect dialect = dialects.get(name);
    Preconditions.checkArgument(
        dialect != null, "Unknown dialect %s, not one of %s", name, dialects.keySet());
    return dialect;
  }

  public Expression parseText(String text) {
    return ExpressionText.fromText(text, functions, maxDepth);
  }

  public Expression parseJson(String json) {
    return ExpressionParser.fromJson(json, functions);
  }

  public String toText(Expression expr) {
    return ExpressionText.toText(expr, functions);
  }

  /** Serializes an expression to CQL2-JSON, pretty-printed when {@code cql2.json.pretty} is set. */
  public String toJson(Expression expr) {
    return ExpressionParser.toJson(expr, pretty);
  }

  /** Translates an expression using the default dialect. */
  public String translate(Expression expr) {
    return translate(expr, defaultDialect);
  }

  public String translate(Expression expr, String dialectName) {
    return DialectTranslator.translate(expr, dialect(dialectName));
  }

  /** Converts CQL2-Text to CQL2-JSON. */
  public String textToJson(String text) {
    return toJson(parseText(text));
  }

  /** Converts CQL2-JSON to CQL2-Text. */
  public String jsonToText(String json) {
    return toText(parseJson(json));
  }
}
