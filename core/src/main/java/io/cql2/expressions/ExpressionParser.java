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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.cql2.exceptions.SemanticException;
import io.cql2.expressions.Expression.Operation;
import io.cql2.util.DateTimeUtil;
import io.cql2.util.JsonUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads and writes CQL2-JSON.
 *
 * <p>Every expression is written as {@code {"op": <name>, "args": [...]}}. Properties are written
 * as {@code {"property": <name>}}, temporal values as {@code {"timestamp": ...}}, {@code {"date":
 * ...}} or {@code {"interval": [start, end]}}, and geometries as GeoJSON.
 */
public class ExpressionParser {

  private static final String OP = "op";
  private static final String ARGS = "args";
  private static final String PROPERTY = "property";
  private static final String TIMESTAMP = "timestamp";
  private static final String DATE = "date";
  private static final String INTERVAL = "interval";
  private static final String BBOX = "bbox";
  private static final String TYPE = "type";
  private static final String COORDINATES = "coordinates";
  private static final String GEOMETRIES = "geometries";

  private ExpressionParser() {}

  public static String toJson(Expression expression) {
    return toJson(expression, false);
  }

  public static String toJson(Expression expression, boolean pretty) {
    Preconditions.checkArgument(expression != null, "Invalid expression: null");
    return JsonUtil.generate(gen -> toJson(expression, gen), pretty);
  }

  public static void toJson(Expression expression, JsonGenerator gen) {
    ExpressionVisitors.visit(expression, new JsonGeneratorVisitor(gen));
  }

  private static class JsonGeneratorVisitor
      extends ExpressionVisitors.CustomOrderExpressionVisitor<Void> {
    private final JsonGenerator gen;

    private JsonGeneratorVisitor(JsonGenerator gen) {
      this.gen = gen;
    }

    /**
     * A convenience method to make code more readable by calling {@code toJson} instead of {@code
     * get()}
     */
    private void toJson(Supplier<Void> child) {
      child.get();
    }

    @FunctionalInterface
    private interface Task {
      void run() throws IOException;
    }

    private Void generate(Task task) {
      try {
        task.run();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }

      return null;
    }

    @Override
    public Void property(Property ref) {
      return generate(
          () -> {
            gen.writeStartObject();
            gen.writeStringField(PROPERTY, ref.name());
            gen.writeEndObject();
          });
    }

    @Override
    public Void literal(Literal<?> lit) {
      return generate(() -> writeLiteral(lit));
    }

    @Override
    public Void not(Not not, Supplier<Void> child) {
      return generate(() -> operation(Operation.NOT.jsonName(), ImmutableList.of(child)));
    }

    @Override
    public Void and(Logical and, List<Supplier<Void>> children) {
      return generate(() -> operation(Operation.AND.jsonName(), children));
    }

    @Override
    public Void or(Logical or, List<Supplier<Void>> children) {
      return generate(() -> operation(Operation.OR.jsonName(), children));
    }

    @Override
    public Void predicate(Predicate pred, List<Supplier<Void>> operands) {
      return generate(
          () -> {
            if (pred.op() == Operation.IN) {
              // the candidates follow the term as a nested array
              gen.writeStartObject();
              gen.writeStringField(OP, pred.op().jsonName());
              gen.writeArrayFieldStart(ARGS);
              toJson(operands.get(0));
              gen.writeStartArray();
              for (Supplier<Void> candidate : operands.subList(1, operands.size())) {
                toJson(candidate);
              }
              gen.writeEndArray();
              gen.writeEndArray();
              gen.writeEndObject();
            } else {
              operation(pred.op().jsonName(), operands);
            }
          });
    }

    @Override
    public Void function(FunctionCall call, List<Supplier<Void>> args) {
      return generate(() -> operation(call.name(), args));
    }

    private void operation(String op, List<Supplier<Void>> args) throws IOException {
      gen.writeStartObject();
      gen.writeStringField(OP, op);
      gen.writeArrayFieldStart(ARGS);
      for (Supplier<Void> arg : args) {
        toJson(arg);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }

    private void writeLiteral(Literal<?> lit) throws IOException {
      switch (lit.kind()) {
        case STRING:
          gen.writeString((String) lit.value());
          break;
        case NUMBER:
          JsonUtil.writeNumber((Double) lit.value(), gen);
          break;
        case BOOLEAN:
          gen.writeBoolean((Boolean) lit.value());
          break;
        case NULL:
          gen.writeNull();
          break;
        case TIMESTAMP:
          gen.writeStartObject();
          gen.writeStringField(TIMESTAMP, DateTimeUtil.formatTimestamp((Instant) lit.value()));
          gen.writeEndObject();
          break;
        case DATE:
          gen.writeStartObject();
          gen.writeStringField(DATE, DateTimeUtil.formatDate((LocalDate) lit.value()));
          gen.writeEndObject();
          break;
        case INTERVAL:
          Interval interval = (Interval) lit.value();
          gen.writeStartObject();
          gen.writeArrayFieldStart(INTERVAL);
          writeBound(interval.start());
          writeBound(interval.end());
          gen.writeEndArray();
          gen.writeEndObject();
          break;
        case GEOMETRY:
          writeGeometry((Geometry) lit.value());
          break;
        default:
          throw new UnsupportedOperationException("Cannot write unsupported literal: " + lit);
      }
    }

    private void writeBound(Temporal bound) throws IOException {
      if (bound == null) {
        gen.writeNull();
      } else {
        gen.writeString(DateTimeUtil.formatTemporal(bound));
      }
    }

    private void writeGeometry(Geometry geometry) throws IOException {
      gen.writeStartObject();
      gen.writeStringField(TYPE, geometry.type());
      if (geometry.isCollection()) {
        gen.writeArrayFieldStart(GEOMETRIES);
        for (Geometry member : geometry.geometries()) {
          writeGeometry(member);
        }
        gen.writeEndArray();
      } else {
        gen.writeFieldName(COORDINATES);
        writeCoordinates(geometry.coordinates());
      }
      gen.writeEndObject();
    }

    private void writeCoordinates(List<?> coordinates) throws IOException {
      gen.writeStartArray();
      for (Object value : coordinates) {
        if (value instanceof List) {
          writeCoordinates((List<?>) value);
        } else {
          JsonUtil.writeNumber((Double) value, gen);
        }
      }
      gen.writeEndArray();
    }
  }

  public static Expression fromJson(String json) {
    return fromJson(json, FunctionRegistry.defaults());
  }

  public static Expression fromJson(JsonNode json) {
    return fromJson(json, FunctionRegistry.defaults());
  }

  public static Expression fromJson(String json, FunctionRegistry functions) {
    return JsonUtil.parse(json, node -> fromJson(node, functions));
  }

  /**
   * Parses a CQL2-JSON expression tree.
   *
   * @param json a JSON object with {@code op} and {@code args} fields
   * @param functions names accepted as function operators
   * @return the expression tree
   * @throws SemanticException if the JSON does not describe a valid expression
   */
  public static Expression fromJson(JsonNode json, FunctionRegistry functions) {
    Preconditions.checkArgument(null != json, "Cannot parse expression from null object");
    Preconditions.checkArgument(functions != null, "Invalid function registry: null");
    if (!json.isObject() || !json.has(OP)) {
      throw new SemanticException(null, "Cannot parse expression from non-expression: %s", json);
    }

    return expression(json, functions);
  }

  private static Expression expression(JsonNode node, FunctionRegistry functions) {
    JsonNode opNode = node.get(OP);
    if (!opNode.isTextual()) {
      throw new SemanticException(null, "Cannot parse op from non-string: %s", opNode);
    }

    String name = opNode.asText();
    List<JsonNode> args = args(name, node);
    Operation op = Operation.fromJsonName(name);
    if (op == null) {
      if (functions.contains(name)) {
        return Expressions.function(name, operands(name, args, functions));
      }

      throw new SemanticException(name, "Unknown operator: %s", name);
    }

    switch (op) {
      case AND:
      case OR:
        if (args.isEmpty()) {
          throw SemanticException.minArity(name, 1, 0);
        }
        List<Expression> children = Lists.newArrayList();
        for (JsonNode arg : args) {
          children.add(booleanExpression(name, arg, functions));
        }
        return Expressions.logical(op, children);
      case NOT:
        checkArity(name, 1, args);
        return Expressions.not(booleanExpression(name, args.get(0), functions));
      case BETWEEN:
        checkArity(name, 3, args);
        return Expressions.between(
            term(name, args.get(0), functions),
            operand(name, args.get(1), functions),
            operand(name, args.get(2), functions));
      case LIKE:
        checkArity(name, 2, args);
        Expression value = term(name, args.get(0), functions);
        if (!args.get(1).isTextual()) {
          throw new SemanticException(
              name, "Invalid pattern for %s (not a string): %s", name, args.get(1));
        }
        return Expressions.like(value, args.get(1).asText());
      case IN:
        checkArity(name, 2, args);
        Expression item = term(name, args.get(0), functions);
        if (!args.get(1).isArray()) {
          throw new SemanticException(
              name, "Invalid candidates for %s (not an array): %s", name, args.get(1));
        }
        return Expressions.in(item, operands(name, Lists.newArrayList(args.get(1)), functions));
      case IS_NULL:
        checkArity(name, 1, args);
        return Expressions.isNull(term(name, args.get(0), functions));
      default:
        checkArity(name, 2, args);
        Expression left = term(name, args.get(0), functions);
        Expression right = operand(name, args.get(1), functions);
        if (op.isSpatial()) {
          return Expressions.spatial(op, left, right);
        } else if (op.isTemporal()) {
          return Expressions.temporal(op, left, right);
        }
        return Expressions.comparison(op, left, right);
    }
  }

  private static List<JsonNode> args(String name, JsonNode node) {
    if (!node.hasNonNull(ARGS)) {
      throw new SemanticException(name, "Cannot parse %s: missing args", name);
    }

    JsonNode argsNode = node.get(ARGS);
    if (!argsNode.isArray()) {
      throw new SemanticException(name, "Cannot parse %s args from non-array: %s", name, argsNode);
    }

    return Lists.newArrayList(argsNode);
  }

  private static void checkArity(String name, int expected, List<JsonNode> args) {
    if (args.size() != expected) {
      throw SemanticException.arity(name, expected, args.size());
    }
  }

  private static Expression booleanExpression(
      String name, JsonNode node, FunctionRegistry functions) {
    if (!node.isObject() || !node.has(OP)) {
      throw new SemanticException(
          name, "Invalid argument for %s: expected an expression, got %s", name, node);
    }

    return expression(node, functions);
  }

  private static Expression term(String name, JsonNode node, FunctionRegistry functions) {
    Expression term = operand(name, node, functions);
    if (!(term instanceof Property) && !(term instanceof FunctionCall)) {
      throw new SemanticException(
          name,
          "Invalid first argument for %s: expected a property or function, got %s",
          name,
          node);
    }

    return term;
  }

  private static List<Expression> operands(
      String name, List<JsonNode> nodes, FunctionRegistry functions) {
    ImmutableList.Builder<Expression> operands = ImmutableList.builder();
    for (JsonNode node : nodes) {
      operands.add(operand(name, node, functions));
    }

    return operands.build();
  }

  private static Expression operand(String name, JsonNode node, FunctionRegistry functions) {
    if (node.isNull()) {
      return Literals.nullLiteral();
    } else if (node.isTextual()) {
      return Literal.of(node.asText());
    } else if (node.isNumber()) {
      return Literal.of(node.asDouble());
    } else if (node.isBoolean()) {
      return Literal.of(node.asBoolean());
    } else if (node.isArray()) {
      throw new SemanticException(
          name, "Invalid argument for %s: arrays are only allowed as in candidates", name);
    } else if (!node.isObject()) {
      throw new SemanticException(name, "Invalid argument for %s: %s", name, node);
    }

    if (node.has(PROPERTY)) {
      JsonNode property = node.get(PROPERTY);
      if (node.size() != 1 || !property.isTextual() || property.asText().isEmpty()) {
        throw new SemanticException(name, "Invalid property reference for %s: %s", name, node);
      }
      return Expressions.ref(property.asText());
    } else if (node.has(OP)) {
      Expression nested = expression(node, functions);
      if (!(nested instanceof FunctionCall)) {
        throw new SemanticException(
            name, "Invalid argument for %s: %s is not a value", name, nested.op().jsonName());
      }
      return nested;
    } else if (node.has(TIMESTAMP)) {
      return Literals.timestamp(
          (Instant) temporal(name, node.get(TIMESTAMP), TIMESTAMP, false));
    } else if (node.has(DATE)) {
      return Literals.date((LocalDate) temporal(name, node.get(DATE), DATE, false));
    } else if (node.has(INTERVAL)) {
      return Literal.of(interval(name, node.get(INTERVAL)));
    } else if (node.has(TYPE)) {
      // a GeoJSON bbox member is optional metadata and is not read
      return Literal.of(geometry(name, node));
    } else if (node.has(BBOX) && node.size() == 1) {
      return Literal.of(bbox(name, node.get(BBOX)));
    }

    throw new SemanticException(name, "Invalid argument for %s: %s", name, node);
  }

  private static Temporal temporal(String name, JsonNode node, String kind, boolean allowOpen) {
    if (allowOpen && node.isNull()) {
      return null;
    } else if (!node.isTextual()) {
      throw new SemanticException(name, "Invalid %s for %s (not a string): %s", kind, name, node);
    }

    try {
      switch (kind) {
        case TIMESTAMP:
          return DateTimeUtil.parseTimestamp(node.asText());
        case DATE:
          return DateTimeUtil.parseDate(node.asText());
        default:
          return DateTimeUtil.parseTemporal(node.asText());
      }
    } catch (DateTimeParseException e) {
      throw new SemanticException(e, name, "Invalid %s for %s: %s", kind, name, node.asText());
    }
  }

  private static Interval interval(String name, JsonNode node) {
    if (!node.isArray() || node.size() != 2) {
      throw new SemanticException(
          name, "Invalid interval for %s (requires 2 bounds): %s", name, node);
    }

    return Interval.of(
        temporal(name, node.get(0), INTERVAL, true), temporal(name, node.get(1), INTERVAL, true));
  }

  private static Geometry bbox(String name, JsonNode node) {
    if (!node.isArray() || (node.size() != 4 && node.size() != 6)) {
      throw new SemanticException(
          name, "Invalid bbox for %s (requires 4 or 6 numbers): %s", name, node);
    }

    double[] values = new double[node.size()];
    for (int i = 0; i < values.length; i += 1) {
      if (!node.get(i).isNumber()) {
        throw new SemanticException(name, "Invalid bbox for %s (not a number): %s", name, node);
      }
      values[i] = node.get(i).asDouble();
    }

    return Geometry.bbox(values);
  }

  private static Geometry geometry(String name, JsonNode node) {
    try {
      String type = JsonUtil.getString(TYPE, node);
      if (Geometry.GEOMETRY_COLLECTION.equals(type)) {
        JsonNode members = JsonUtil.get(GEOMETRIES, node);
        Preconditions.checkArgument(
            members.isArray(), "Cannot parse geometries from non-array: %s", members);
        ImmutableList.Builder<Geometry> geometries = ImmutableList.builder();
        for (JsonNode member : members) {
          geometries.add(geometry(name, member));
        }
        return Geometry.collection(geometries.build());
      }

      return Geometry.of(type, coordinates(JsonUtil.get(COORDINATES, node)));
    } catch (IllegalArgumentException e) {
      throw new SemanticException(e, name, "Invalid geometry for %s: %s", name, e.getMessage());
    }
  }

  private static List<Object> coordinates(JsonNode node) {
    Preconditions.checkArgument(
        node.isArray(), "Cannot parse coordinates from non-array: %s", node);
    ImmutableList.Builder<Object> values = ImmutableList.builder();
    for (JsonNode element : node) {
      if (element.isArray()) {
        values.add(coordinates(element));
      } else {
        Preconditions.checkArgument(element.isNumber(), "Invalid coordinate: %s", element);
        values.add(element.asDouble());
      }
    }

    return values.build();
  }
}
