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

/**
 * Represents a literal fixed value in an expression predicate.
 *
 * @param <T> The Java type of the value
 */
public interface Literal<T> extends Expression {
  enum Kind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    TIMESTAMP,
    DATE,
    INTERVAL,
    GEOMETRY
  }

  static Literal<String> of(String value) {
    return new Literals.StringLiteral(value);
  }

  static Literal<Double> of(double value) {
    return new Literals.NumberLiteral(value);
  }

  static Literal<Boolean> of(boolean value) {
    return new Literals.BooleanLiteral(value);
  }

  static Literal<Geometry> of(Geometry value) {
    return new Literals.GeometryLiteral(value);
  }

  static Literal<Interval> of(Interval value) {
    return new Literals.IntervalLiteral(value);
  }

  /** Returns the value wrapped by this literal, which is null only for {@link Kind#NULL}. */
  T value();

  /** Returns the kind of value held by this literal. */
  Kind kind();

  @Override
  default Operation op() {
    return Operation.LITERAL;
  }
}
