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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.cql2.expressions.Expression.Operation;
import io.cql2.expressions.Literal;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable table that maps expression nodes to query fragments of a backend dialect.
 *
 * <p>Templates use positional placeholders {@code {0}}, {@code {1}} and {@code {2}}:
 *
 * <ul>
 *   <li>predicate and NOT templates receive translated operands in argument order; the IN
 *       template receives the candidate list, joined with {@code ", "}, as {@code {1}}
 *   <li>AND and OR map to the keyword that joins their children
 *   <li>literal templates receive the value text; string values are escaped by doubling the
 *       dialect's quote character
 *   <li>function templates receive translated arguments
 *   <li>the property template receives a plain identifier name; any other name goes to the
 *       quoted-property template
 * </ul>
 *
 * <p>Any node without a mapping cannot be translated.
 */
public class Dialect {
  private static final Logger LOG = LoggerFactory.getLogger(Dialect.class);

  public static final String OP_PREFIX = "op.";
  public static final String LITERAL_PREFIX = "literal.";
  public static final String FUNCTION_PREFIX = "function.";
  public static final String PROPERTY = "property";
  public static final String STRING_QUOTE = "string-quote";
  public static final String QUOTED_PROPERTY = "quoted-property";
  public static final String IDENTIFIER_QUOTE = "identifier-quote";

  private final String name;
  private final Map<Operation, String> operators;
  private final Map<Literal.Kind, String> literals;
  private final Map<String, String> functions;
  private final String property;
  private final String quotedProperty;
  private final char stringQuote;
  private final char identifierQuote;

  private Dialect(
      String name,
      Map<Operation, String> operators,
      Map<Literal.Kind, String> literals,
      Map<String, String> functions,
      String property,
      String quotedProperty,
      char stringQuote,
      char identifierQuote) {
    this.name = name;
    this.operators = ImmutableMap.copyOf(operators);
    this.literals = ImmutableMap.copyOf(literals);
    this.functions = ImmutableMap.copyOf(functions);
    this.property = property;
    this.quotedProperty = quotedProperty;
    this.stringQuote = stringQuote;
    this.identifierQuote = identifierQuote;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Creates a dialect from a string table.
   *
   * <p>Recognized keys are {@code op.<operator>} where the operator is the CQL2-JSON name (for
   * example {@code op.s_intersects}), {@code literal.<kind>} where the kind is one of {@link
   * Literal.Kind} in lower case, {@code function.<name>}, {@code property}, {@code
   * quoted-property}, {@code string-quote} and {@code identifier-quote}. Unrecognized keys are
   * ignored with a warning.
   *
   * @param name the dialect name
   * @param properties the mapping table
   * @return a dialect
   */
  public static Dialect fromProperties(String name, Map<String, String> properties) {
    return builder(name).withProperties(properties).build();
  }

  public String name() {
    return name;
  }

  /** Returns the template for an operation, or null if the dialect has no mapping for it. */
  public String operator(Operation op) {
    return operators.get(op);
  }

  /** Returns the template for a literal kind, or null if the dialect has no mapping for it. */
  public String literal(Literal.Kind kind) {
    return literals.get(kind);
  }

  /** Returns the template for a function, matched without regard to case, or null. */
  public String function(String functionName) {
    return functions.get(functionName.toLowerCase(Locale.ROOT));
  }

  /** Returns the template for property names that are plain identifiers. */
  public String property() {
    return property;
  }

  /**
   * Returns the template for any other property name, or null if the dialect cannot express one.
   *
   * <p>The name is filled in with each identifier quote character doubled.
   */
  public String quotedProperty() {
    return quotedProperty;
  }

  public char stringQuote() {
    return stringQuote;
  }

  public char identifierQuote() {
    return identifierQuote;
  }

  /** Returns a builder initialized with this dialect's mappings. */
  public Builder toBuilder() {
    Builder builder = new Builder(name);
    builder.operators.putAll(operators);
    builder.literals.putAll(literals);
    builder.functions.putAll(functions);
    builder.property = property;
    builder.quotedProperty = quotedProperty;
    builder.stringQuote = stringQuote;
    builder.identifierQuote = identifierQuote;
    return builder;
  }

  @Override
  public String toString() {
    return "Dialect(" + name + ")";
  }

  public static class Builder {
    private final String name;
    private final Map<Operation, String> operators = new EnumMap<>(Operation.class);
    private final Map<Literal.Kind, String> literals = new EnumMap<>(Literal.Kind.class);
    private final Map<String, String> functions = Maps.newHashMap();
    private String property = "{0}";
    private String quotedProperty = null;
    private char stringQuote = '\'';
    private char identifierQuote = '"';

    private Builder(String name) {
      Preconditions.checkArgument(
          name != null && !name.isEmpty(), "Invalid dialect name: %s", name);
      this.name = name;
    }

    public Builder operator(Operation op, String template) {
      Preconditions.checkArgument(
          op != null && op.textName() != null, "Invalid dialect operator: %s", op);
      Preconditions.checkArgument(template != null, "Invalid template for %s: null", op);
      operators.put(op, template);
      return this;
    }

    public Builder literal(Literal.Kind kind, String template) {
      Preconditions.checkArgument(kind != null, "Invalid literal kind: null");
      Preconditions.checkArgument(template != null, "Invalid template for %s: null", kind);
      literals.put(kind, template);
      return this;
    }

    public Builder function(String functionName, String template) {
      Preconditions.checkArgument(
          functionName != null && !functionName.isEmpty(),
          "Invalid function name: %s",
          functionName);
      Preconditions.checkArgument(template != null, "Invalid template for %s: null", functionName);
      functions.put(functionName.toLowerCase(Locale.ROOT), template);
      return this;
    }

    public Builder property(String template) {
      Preconditions.checkArgument(template != null, "Invalid property template: null");
      this.property = template;
      return this;
    }

    public Builder quotedProperty(String template) {
      Preconditions.checkArgument(template != null, "Invalid quoted property template: null");
      this.quotedProperty = template;
      return this;
    }

    public Builder stringQuote(char quote) {
      this.stringQuote = quote;
      return this;
    }

    public Builder identifierQuote(char quote) {
      this.identifierQuote = quote;
      return this;
    }

    /** Adds the entries of a string table, as described by {@link #fromProperties}. */
    public Builder withProperties(Map<String, String> properties) {
      Preconditions.checkArgument(properties != null, "Invalid dialect properties: null");
      for (Map.Entry<String, String> entry : properties.entrySet()) {
        String key = entry.getKey();
        String value = entry.getValue();
        if (key.startsWith(OP_PREFIX)) {
          Operation op = Operation.fromJsonName(key.substring(OP_PREFIX.length()));
          if (op != null) {
            operator(op, value);
          } else {
            LOG.warn("Ignoring unknown operator in dialect {}: {}", name, key);
          }
        } else if (key.startsWith(LITERAL_PREFIX)) {
          Literal.Kind kind = kind(key.substring(LITERAL_PREFIX.length()));
          if (kind != null) {
            literal(kind, value);
          } else {
            LOG.warn("Ignoring unknown literal kind in dialect {}: {}", name, key);
          }
        } else if (key.startsWith(FUNCTION_PREFIX)) {
          function(key.substring(FUNCTION_PREFIX.length()), value);
        } else if (PROPERTY.equals(key)) {
          property(value);
        } else if (QUOTED_PROPERTY.equals(key)) {
          quotedProperty(value);
        } else if (STRING_QUOTE.equals(key)) {
          stringQuote(quoteChar("string quote", value));
        } else if (IDENTIFIER_QUOTE.equals(key)) {
          identifierQuote(quoteChar("identifier quote", value));
        } else {
          LOG.warn("Ignoring unknown dialect property for {}: {}", name, key);
        }
      }

      return this;
    }

    private char quoteChar(String description, String value) {
      Preconditions.checkArgument(
          value != null && value.length() == 1,
          "Invalid %s for dialect %s: %s",
          description,
          name,
          value);
      return value.charAt(0);
    }

    private static Literal.Kind kind(String kindName) {
      for (Literal.Kind kind : Literal.Kind.values()) {
        if (kind.name().equalsIgnoreCase(kindName)) {
          return kind;
        }
      }

      return null;
    }

    public Dialect build() {
      return new Dialect(
          name,
          operators,
          literals,
          functions,
          property,
          quotedProperty,
          stringQuote,
          identifierQuote);
    }
  }
}
