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

import java.util.Objects;

/** A lexical token of CQL2-Text. */
class Token {
  enum Type {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING,
    BOOLEAN,
    COMPARISON,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    SLASH,
    EOF
  }

  private final Type type;
  private final String text;
  private final String value;
  private final int position;

  Token(Type type, String text, String value, int position) {
    this.type = type;
    this.text = text;
    this.value = value;
    this.position = position;
  }

  Type type() {
    return type;
  }

  /** Returns the source text of the token, or null at the end of input. */
  String text() {
    return text;
  }

  /**
   * Returns the normalized value: upper-case keywords and booleans, unescaped strings, and
   * canonical comparison operators.
   */
  String value() {
    return value;
  }

  int position() {
    return position;
  }

  boolean is(Type expected) {
    return type == expected;
  }

  boolean isKeyword(String keyword) {
    return type == Type.KEYWORD && value.equals(keyword);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Token)) {
      return false;
    }

    Token that = (Token) other;
    return type == that.type
        && position == that.position
        && Objects.equals(text, that.text)
        && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, text, value, position);
  }

  @Override
  public String toString() {
    return type + "(" + (text == null ? "" : text) + ")@" + position;
  }
}
