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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import io.cql2.exceptions.SyntaxException;
import io.cql2.expressions.Expression;
import io.cql2.expressions.Expression.Operation;
import io.cql2.expressions.Expressions;
import io.cql2.expressions.FunctionCall;
import io.cql2.expressions.FunctionRegistry;
import io.cql2.expressions.Geometry;
import io.cql2.expressions.Interval;
import io.cql2.expressions.Literal;
import io.cql2.expressions.Literals;
import io.cql2.expressions.Property;
import io.cql2.util.DateTimeUtil;
import io.cql2.util.GeometryUtil;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for CQL2-Text.
 *
 * <p>Precedence from lowest to highest is OR, AND, NOT, then predicates. Parsers are single-use.
 */
class TextParser {
  private static final Set<String> GEOMETRY_TYPES =
      ImmutableSet.of(
          "POINT",
          "LINESTRING",
          "POLYGON",
          "MULTIPOINT",
          "MULTILINESTRING",
          "MULTIPOLYGON",
          "GEOMETRYCOLLECTION");
  private static final Set<String> GEOMETRY_MARKERS = ImmutableSet.of("EMPTY", "Z", "M", "ZM");

  private final Tokenizer tokenizer;
  private final FunctionRegistry functions;
  private final int maxDepth;
  private Token current = null;
  private int depth = 0;

  TextParser(String text, FunctionRegistry functions, int maxDepth) {
    this.tokenizer = new Tokenizer(text);
    this.functions = functions;
    this.maxDepth = maxDepth;
  }

  Expression parse() {
    advance();
    if (current.is(Token.Type.EOF)) {
      throw error("Expected expression");
    }

    Expression expr = parseOr();
    if (!current.is(Token.Type.EOF)) {
      throw error("Unexpected token after expression");
    }

    return expr;
  }

  private Expression parseOr() {
    List<Expression> children = Lists.newArrayList(parseAnd());
    while (current.isKeyword("OR")) {
      advance();
      children.add(parseAnd());
    }

    return Expressions.or(children);
  }

  private Expression parseAnd() {
    List<Expression> children = Lists.newArrayList(parseUnary());
    while (current.isKeyword("AND")) {
      advance();
      children.add(parseUnary());
    }

    return Expressions.and(children);
  }

  private Expression parseUnary() {
    if (current.isKeyword("NOT")) {
      enter();
      advance();
      Expression child = parseUnary();
      exit();
      return Expressions.not(child);
    }

    return parsePrimary();
  }

  private Expression parsePrimary() {
    if (current.is(Token.Type.LEFT_PAREN)) {
      enter();
      advance();
      Expression expr = parseOr();
      expect(Token.Type.RIGHT_PAREN, "Expected ')' to close group");
      exit();
      return expr;
    }

    return parsePredicate();
  }

  private Expression parsePredicate() {
    if (current.is(Token.Type.IDENTIFIER) && tokenizer.peekChar() == '(') {
      Operation op = Operation.fromTextName(current.text());
      if (op != null) {
        return parsePrefixPredicate(op);
      }
    }

    Token termToken = current;
    Expression term = parseOperand();
    switch (current.type()) {
      case COMPARISON:
        Operation op = comparison(current.value());
        checkTerm(termToken, term);
        advance();
        return Expressions.comparison(op, term, parseOperand());
      case KEYWORD:
        return parseKeywordPredicate(termToken, term);
      case IDENTIFIER:
        Operation named = Operation.fromTextName(current.text());
        if (named == null) {
          throw error("Expected predicate operator");
        }
        checkTerm(termToken, term);
        advance();
        if (named.isSpatial()) {
          return Expressions.spatial(named, term, parseSpatialOperand());
        }
        return Expressions.temporal(named, term, parseOperand());
      default:
        if (term instanceof FunctionCall) {
          return term;
        }
        throw error("Expected predicate operator");
    }
  }

  private Expression parseKeywordPredicate(Token termToken, Expression term) {
    boolean negate = false;
    if (current.isKeyword("NOT")) {
      advance();
      if (!current.isKeyword("LIKE") && !current.isKeyword("IN") && !current.isKeyword("BETWEEN")) {
        throw error("Expected LIKE, IN or BETWEEN after NOT");
      }
      negate = true;
    }

    Expression pred;
    switch (current.value()) {
      case "BETWEEN":
        checkTerm(termToken, term);
        advance();
        Expression lower = parseOperand();
        expectKeyword("AND");
        pred = Expressions.between(term, lower, parseOperand());
        break;
      case "LIKE":
        checkTerm(termToken, term);
        advance();
        Token pattern = expect(Token.Type.STRING, "Expected quoted pattern after LIKE");
        pred = Expressions.like(term, pattern.value());
        break;
      case "IN":
        checkTerm(termToken, term);
        advance();
        pred = Expressions.in(term, parseList());
        break;
      case "IS":
        checkTerm(termToken, term);
        advance();
        if (current.isKeyword("NOT")) {
          advance();
          negate = true;
        }
        expectKeyword("NULL");
        pred = Expressions.isNull(term);
        break;
      default:
        if (term instanceof FunctionCall) {
          return term;
        }
        throw error("Expected predicate operator");
    }

    return negate ? Expressions.not(pred) : pred;
  }

  private Expression parsePrefixPredicate(Operation op) {
    advance();
    expect(Token.Type.LEFT_PAREN, "Expected '('");
    Token termToken = current;
    Expression term = parseOperand();
    checkTerm(termToken, term);
    expect(Token.Type.COMMA, "Expected ','");
    Expression right = parseOperand();
    expect(Token.Type.RIGHT_PAREN, "Expected ')'");
    if (op.isSpatial()) {
      return Expressions.spatial(op, term, right);
    }
    return Expressions.temporal(op, term, right);
  }

  private Expression parseSpatialOperand() {
    if (current.is(Token.Type.LEFT_PAREN)) {
      advance();
      Expression operand = parseOperand();
      expect(Token.Type.RIGHT_PAREN, "Expected ')' after geometry");
      return operand;
    }

    return parseOperand();
  }

  private List<Expression> parseList() {
    expect(Token.Type.LEFT_PAREN, "Expected '(' to start list");
    ImmutableList.Builder<Expression> values = ImmutableList.builder();
    if (!current.is(Token.Type.RIGHT_PAREN)) {
      values.add(parseOperand());
      while (current.is(Token.Type.COMMA)) {
        advance();
        values.add(parseOperand());
      }
    }
    expect(Token.Type.RIGHT_PAREN, "Expected ')' to close list");
    return values.build();
  }

  private Expression parseOperand() {
    Token token = current;
    switch (token.type()) {
      case IDENTIFIER:
        return parseIdentifierOperand();
      case NUMBER:
        advance();
        return number(token);
      case STRING:
        advance();
        return Literal.of(token.value());
      case BOOLEAN:
        advance();
        return Literal.of("TRUE".equals(token.value()));
      case LEFT_BRACKET:
        return parseInterval();
      case KEYWORD:
        if (token.isKeyword("NULL")) {
          advance();
          return Literals.nullLiteral();
        }
        break;
      default:
        break;
    }

    throw error("Expected operand");
  }

  private Expression parseIdentifierOperand() {
    Token token = current;
    String upper = token.text().toUpperCase(Locale.ROOT);
    char next = tokenizer.peekChar();
    if (GEOMETRY_TYPES.contains(upper)
        && (next == '(' || GEOMETRY_MARKERS.contains(tokenizer.peekWord()))) {
      String wkt = tokenizer.readGeometry(token.position());
      advance();
      try {
        return Literal.of(GeometryUtil.fromWKT(wkt));
      } catch (IllegalArgumentException e) {
        throw new SyntaxException(
            e, token.text(), token.position(), "Invalid geometry: %s", e.getMessage());
      }
    }

    if (next == '(') {
      switch (upper) {
        case "TIMESTAMP":
        case "DATE":
          return Literals.from(parseTemporalCall());
        case "BBOX":
          return Literal.of(parseBbox());
        default:
          if (functions.contains(token.text())) {
            return parseFunction();
          }
          throw error("Unknown function");
      }
    }

    advance();
    return Expressions.ref(token.text());
  }

  /** Parses {@code TIMESTAMP("...")} or {@code DATE("...")}. */
  private Temporal parseTemporalCall() {
    Token name = current;
    advance();
    expect(Token.Type.LEFT_PAREN, "Expected '('");
    Token value = expect(Token.Type.STRING, "Expected quoted date or timestamp");
    expect(Token.Type.RIGHT_PAREN, "Expected ')'");
    boolean isDate = "DATE".equalsIgnoreCase(name.text());
    try {
      if (isDate) {
        return DateTimeUtil.parseDate(value.value());
      }
      return DateTimeUtil.parseTimestamp(value.value());
    } catch (DateTimeParseException e) {
      throw new SyntaxException(
          e, value.text(), value.position(), "Invalid %s", isDate ? "date" : "timestamp");
    }
  }

  private Geometry parseBbox() {
    Token name = current;
    advance();
    expect(Token.Type.LEFT_PAREN, "Expected '('");
    List<Double> values = Lists.newArrayList();
    values.add(Double.parseDouble(expect(Token.Type.NUMBER, "Expected number").value()));
    while (current.is(Token.Type.COMMA)) {
      advance();
      values.add(Double.parseDouble(expect(Token.Type.NUMBER, "Expected number").value()));
    }
    expect(Token.Type.RIGHT_PAREN, "Expected ')'");

    if (values.size() != 4 && values.size() != 6) {
      throw new SyntaxException(
          name.text(),
          name.position(),
          "Invalid bbox: expected 4 or 6 values, got %s",
          values.size());
    }

    return Geometry.bbox(values.stream().mapToDouble(Double::doubleValue).toArray());
  }

  private Expression parseInterval() {
    advance();
    Temporal start = parseInstant();
    expect(Token.Type.SLASH, "Expected '/' in interval");
    Temporal end = parseInstant();
    expect(Token.Type.RIGHT_BRACKET, "Expected ']' to close interval");
    return Literal.of(Interval.of(start, end));
  }

  private Temporal parseInstant() {
    Token token = current;
    if (token.is(Token.Type.STRING)) {
      advance();
      try {
        return DateTimeUtil.parseTemporal(token.value());
      } catch (DateTimeParseException e) {
        throw new SyntaxException(e, token.text(), token.position(), "Invalid instant");
      }
    } else if (token.is(Token.Type.IDENTIFIER) && tokenizer.peekChar() == '(') {
      String upper = token.text().toUpperCase(Locale.ROOT);
      if ("TIMESTAMP".equals(upper) || "DATE".equals(upper)) {
        return parseTemporalCall();
      }
    }

    throw error("Expected instant");
  }

  private Expression parseFunction() {
    Token name = current;
    advance();
    expect(Token.Type.LEFT_PAREN, "Expected '('");
    enter();
    ImmutableList.Builder<Expression> args = ImmutableList.builder();
    if (!current.is(Token.Type.RIGHT_PAREN)) {
      args.add(parseOperand());
      while (current.is(Token.Type.COMMA)) {
        advance();
        args.add(parseOperand());
      }
    }
    expect(Token.Type.RIGHT_PAREN, "Expected ')' to close function arguments");
    exit();
    return Expressions.function(name.text(), args.build());
  }

  private Expression number(Token token) {
    double value = Double.parseDouble(token.value());
    if (Double.isInfinite(value)) {
      throw new SyntaxException(token.text(), token.position(), "Number out of range");
    }

    return Literal.of(value);
  }

  private static Operation comparison(String operator) {
    switch (operator) {
      case "=":
        return Operation.EQ;
      case "<>":
        return Operation.NOT_EQ;
      case "<":
        return Operation.LT;
      case "<=":
        return Operation.LT_EQ;
      case ">":
        return Operation.GT;
      case ">=":
        return Operation.GT_EQ;
      default:
        throw new IllegalArgumentException("Unknown comparison operator: " + operator);
    }
  }

  private static void checkTerm(Token token, Expression term) {
    if (!(term instanceof Property) && !(term instanceof FunctionCall)) {
      throw new SyntaxException(
          token.text(), token.position(), "Expected property or function as predicate term");
    }
  }

  private void advance() {
    this.current = tokenizer.next();
  }

  private Token expect(Token.Type type, String message) {
    if (!current.is(type)) {
      throw error(message);
    }

    Token token = current;
    advance();
    return token;
  }

  private void expectKeyword(String keyword) {
    if (!current.isKeyword(keyword)) {
      throw error("Expected " + keyword);
    }

    advance();
  }

  private void enter() {
    this.depth += 1;
    if (depth > maxDepth) {
      throw new SyntaxException(
          current.text(),
          current.position(),
          "Expression nesting exceeds maximum depth %s",
          maxDepth);
    }
  }

  private void exit() {
    this.depth -= 1;
  }

  private SyntaxException error(String message) {
    return new SyntaxException(current.text(), current.position(), "%s", message);
  }
}
