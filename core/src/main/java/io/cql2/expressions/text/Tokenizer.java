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
import io.cql2.exceptions.LexerException;
import io.cql2.exceptions.SyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits CQL2-Text into {@link Token tokens} on demand.
 *
 * <p>Keywords and booleans are matched without regard to case. Identifiers may contain {@code :}
 * and {@code .} after the first character, so names like {@code eo:cloud_cover} are a single
 * token. Strings are double-quoted with backslash escapes, or single-quoted with {@code ''} for a
 * quote.
 */
class Tokenizer {
  private static final Set<String> KEYWORDS =
      ImmutableSet.of("AND", "OR", "NOT", "LIKE", "IN", "IS", "NULL", "BETWEEN");

  private final String input;
  private int pos = 0;

  Tokenizer(String input) {
    this.input = input;
  }

  /** Returns all remaining tokens, ending with {@link Token.Type#EOF}. */
  List<Token> tokenize() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Token token;
    do {
      token = next();
      tokens.add(token);
    } while (!token.is(Token.Type.EOF));

    return tokens.build();
  }

  Token next() {
    skipWhitespace();
    if (pos >= input.length()) {
      return new Token(Token.Type.EOF, null, null, input.length());
    }

    int start = pos;
    char ch = input.charAt(pos);
    switch (ch) {
      case '(':
        return single(Token.Type.LEFT_PAREN);
      case ')':
        return single(Token.Type.RIGHT_PAREN);
      case ',':
        return single(Token.Type.COMMA);
      case '[':
        return single(Token.Type.LEFT_BRACKET);
      case ']':
        return single(Token.Type.RIGHT_BRACKET);
      case '/':
        return single(Token.Type.SLASH);
      case '=':
        return single(Token.Type.COMPARISON);
      case '<':
        if (charAt(pos + 1) == '=' || charAt(pos + 1) == '>') {
          pos += 2;
          return token(Token.Type.COMPARISON, start, input.substring(start, pos));
        }
        return single(Token.Type.COMPARISON);
      case '>':
        if (charAt(pos + 1) == '=') {
          pos += 2;
          return token(Token.Type.COMPARISON, start, ">=");
        }
        return single(Token.Type.COMPARISON);
      case '!':
        if (charAt(pos + 1) == '=') {
          pos += 2;
          return new Token(Token.Type.COMPARISON, "!=", "<>", start);
        }
        throw new LexerException(ch, start);
      case '"':
        return doubleQuoted();
      case '\'':
        return singleQuoted();
      default:
        if (startsNumber(pos)) {
          return number();
        } else if (Character.isLetter(ch) || ch == '_') {
          return word();
        }

        throw new LexerException(ch, start);
    }
  }

  /** Returns the next non-whitespace character without consuming it, or 0 at the end of input. */
  char peekChar() {
    int next = skip(pos);
    return charAt(next);
  }

  /** Returns the next run of letters, in upper case, without consuming it. */
  String peekWord() {
    int start = skip(pos);
    int end = start;
    while (end < input.length() && Character.isLetter(input.charAt(end))) {
      end += 1;
    }

    return input.substring(start, end).toUpperCase(Locale.ROOT);
  }

  /**
   * Consumes the remainder of a Well-Known Text geometry whose type keyword was the last token.
   *
   * <p>The geometry ends after {@code EMPTY} or after the parenthesis that closes its coordinate
   * list. Nested parentheses, as in a geometry collection, are balanced.
   *
   * @param start the position of the geometry type keyword
   * @return the source text of the geometry
   */
  String readGeometry(int start) {
    String marker = peekWord();
    if ("EMPTY".equals(marker)) {
      pos = skip(pos) + marker.length();
      return input.substring(start, pos);
    } else if ("Z".equals(marker) || "M".equals(marker) || "ZM".equals(marker)) {
      pos = skip(pos) + marker.length();
    }

    pos = skip(pos);
    if (charAt(pos) != '(') {
      throw new SyntaxException(
          pos < input.length() ? String.valueOf(charAt(pos)) : null,
          pos,
          "Expected '(' in geometry");
    }

    int depth = 0;
    do {
      char ch = input.charAt(pos);
      if (ch == '(') {
        depth += 1;
      } else if (ch == ')') {
        depth -= 1;
      }
      pos += 1;
    } while (depth > 0 && pos < input.length());

    if (depth > 0) {
      throw new SyntaxException(null, pos, "Unclosed geometry");
    }

    return input.substring(start, pos);
  }

  private Token single(Token.Type type) {
    int start = pos;
    pos += 1;
    return token(type, start, input.substring(start, pos));
  }

  private Token token(Token.Type type, int start, String value) {
    return new Token(type, input.substring(start, pos), value, start);
  }

  private Token doubleQuoted() {
    int start = pos;
    StringBuilder value = new StringBuilder();
    pos += 1;
    while (pos < input.length()) {
      char ch = input.charAt(pos);
      if (ch == '"') {
        pos += 1;
        return token(Token.Type.STRING, start, value.toString());
      } else if (ch == '\\' && pos + 1 < input.length()) {
        value.append(input.charAt(pos + 1));
        pos += 2;
      } else {
        value.append(ch);
        pos += 1;
      }
    }

    throw new LexerException('"', start, "Unterminated string");
  }

  private Token singleQuoted() {
    int start = pos;
    StringBuilder value = new StringBuilder();
    pos += 1;
    while (pos < input.length()) {
      char ch = input.charAt(pos);
      if (ch == '\'') {
        if (charAt(pos + 1) == '\'') {
          value.append('\'');
          pos += 2;
          continue;
        }
        pos += 1;
        return token(Token.Type.STRING, start, value.toString());
      }
      value.append(ch);
      pos += 1;
    }

    throw new LexerException('\'', start, "Unterminated string");
  }

  private boolean startsNumber(int at) {
    char ch = charAt(at);
    if (ch == '-' || ch == '+') {
      return startsUnsigned(at + 1);
    }
    return startsUnsigned(at);
  }

  private boolean startsUnsigned(int at) {
    return Character.isDigit(charAt(at))
        || (charAt(at) == '.' && Character.isDigit(charAt(at + 1)));
  }

  private Token number() {
    int start = pos;
    if (charAt(pos) == '-' || charAt(pos) == '+') {
      pos += 1;
    }
    skipDigits();
    if (charAt(pos) == '.' && Character.isDigit(charAt(pos + 1))) {
      pos += 1;
      skipDigits();
    }
    if (charAt(pos) == 'e' || charAt(pos) == 'E') {
      int exp = pos + 1;
      if (charAt(exp) == '-' || charAt(exp) == '+') {
        exp += 1;
      }
      if (Character.isDigit(charAt(exp))) {
        pos = exp;
        skipDigits();
      }
    }

    return token(Token.Type.NUMBER, start, input.substring(start, pos));
  }

  private Token word() {
    int start = pos;
    while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
      pos += 1;
    }

    String text = input.substring(start, pos);
    String upper = text.toUpperCase(Locale.ROOT);
    if (KEYWORDS.contains(upper)) {
      return new Token(Token.Type.KEYWORD, text, upper, start);
    } else if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
      return new Token(Token.Type.BOOLEAN, text, upper, start);
    }

    return new Token(Token.Type.IDENTIFIER, text, text, start);
  }

  /**
   * Returns whether a name reads back as a single identifier token.
   *
   * <p>Keywords, booleans and names with characters outside the identifier set do not.
   */
  static boolean isIdentifier(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }

    char first = name.charAt(0);
    if (!Character.isLetter(first) && first != '_') {
      return false;
    }

    for (int i = 1; i < name.length(); i += 1) {
      if (!isIdentifierPart(name.charAt(i))) {
        return false;
      }
    }

    String upper = name.toUpperCase(Locale.ROOT);
    return !KEYWORDS.contains(upper) && !"TRUE".equals(upper) && !"FALSE".equals(upper);
  }

  private static boolean isIdentifierPart(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == ':' || ch == '.';
  }

  private void skipDigits() {
    while (Character.isDigit(charAt(pos))) {
      pos += 1;
    }
  }

  private void skipWhitespace() {
    this.pos = skip(pos);
  }

  private int skip(int from) {
    int at = from;
    while (at < input.length() && Character.isWhitespace(input.charAt(at))) {
      at += 1;
    }
    return at;
  }

  private char charAt(int at) {
    return at < input.length() ? input.charAt(at) : 0;
  }
}
