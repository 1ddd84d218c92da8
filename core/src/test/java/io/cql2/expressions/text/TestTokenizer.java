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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cql2.exceptions.LexerException;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class TestTokenizer {

  private static List<Token.Type> types(String text) {
    return new Tokenizer(text).tokenize().stream().map(Token::type).collect(Collectors.toList());
  }

  private static List<String> values(String text) {
    return new Tokenizer(text).tokenize().stream().map(Token::value).collect(Collectors.toList());
  }

  @Test
  public void testPredicateTokens() {
    assertThat(types("eo:cloud_cover <= 10.5 AND name LIKE 'abc%'"))
        .containsExactly(
            Token.Type.IDENTIFIER,
            Token.Type.COMPARISON,
            Token.Type.NUMBER,
            Token.Type.KEYWORD,
            Token.Type.IDENTIFIER,
            Token.Type.KEYWORD,
            Token.Type.STRING,
            Token.Type.EOF);
    assertThat(values("eo:cloud_cover <= 10.5 AND name LIKE 'abc%'"))
        .containsExactly("eo:cloud_cover", "<=", "10.5", "AND", "name", "LIKE", "abc%", null);
  }

  @Test
  public void testKeywordsIgnoreCase() {
    List<Token> tokens = new Tokenizer("a is not null or b = true").tokenize();
    assertThat(tokens.get(1).isKeyword("IS")).isTrue();
    assertThat(tokens.get(2).isKeyword("NOT")).isTrue();
    assertThat(tokens.get(3).isKeyword("NULL")).isTrue();
    assertThat(tokens.get(4).isKeyword("OR")).isTrue();
    assertThat(tokens.get(7).type()).isEqualTo(Token.Type.BOOLEAN);
    assertThat(tokens.get(7).value()).isEqualTo("TRUE");
    assertThat(tokens.get(7).text()).isEqualTo("true");
  }

  @Test
  public void testComparisonOperators() {
    assertThat(values("= <> < <= > >= !="))
        .containsExactly("=", "<>", "<", "<=", ">", ">=", "<>", null);

    Token notEqual = new Tokenizer("!=").next();
    assertThat(notEqual.text()).isEqualTo("!=");
    assertThat(notEqual.value()).isEqualTo("<>");
  }

  @Test
  public void testNumbers() {
    assertThat(values("-1.5e3 +2 .25 7E-2"))
        .containsExactly("-1.5e3", "+2", ".25", "7E-2", null);
    assertThat(types("-1.5e3")).containsExactly(Token.Type.NUMBER, Token.Type.EOF);
  }

  @Test
  public void testStrings() {
    assertThat(values("\"say \\\"hi\\\"\" 'O''Brien'"))
        .containsExactly("say \"hi\"", "O'Brien", null);
  }

  @Test
  public void testPunctuation() {
    assertThat(types("( ) , [ ] /"))
        .containsExactly(
            Token.Type.LEFT_PAREN,
            Token.Type.RIGHT_PAREN,
            Token.Type.COMMA,
            Token.Type.LEFT_BRACKET,
            Token.Type.RIGHT_BRACKET,
            Token.Type.SLASH,
            Token.Type.EOF);
  }

  @Test
  public void testPositions() {
    List<Token> tokens = new Tokenizer("  temp   >  30").tokenize();
    assertThat(tokens).extracting(Token::position).containsExactly(2, 9, 12, 14);
  }

  @Test
  public void testInvalidCharacter() {
    assertThatThrownBy(() -> new Tokenizer("a = #").tokenize())
        .isInstanceOf(LexerException.class)
        .hasMessage("Invalid character '#' at position 4")
        .satisfies(
            e -> {
              LexerException lex = (LexerException) e;
              assertThat(lex.character()).isEqualTo('#');
              assertThat(lex.position()).isEqualTo(4);
            });

    assertThatThrownBy(() -> new Tokenizer("a ! b").tokenize())
        .isInstanceOf(LexerException.class)
        .hasMessage("Invalid character '!' at position 2");
  }

  @Test
  public void testUnterminatedString() {
    assertThatThrownBy(() -> new Tokenizer("a = \"abc").tokenize())
        .isInstanceOf(LexerException.class)
        .hasMessage("Unterminated string at position 4");

    assertThatThrownBy(() -> new Tokenizer("a = 'abc").tokenize())
        .isInstanceOf(LexerException.class)
        .hasMessage("Unterminated string at position 4");
  }

  @Test
  public void testReadGeometry() {
    Tokenizer tokenizer = new Tokenizer("GEOMETRYCOLLECTION (POINT (1 2), POINT (3 4)) AND");
    Token keyword = tokenizer.next();
    assertThat(tokenizer.readGeometry(keyword.position()))
        .isEqualTo("GEOMETRYCOLLECTION (POINT (1 2), POINT (3 4))");
    assertThat(tokenizer.next().isKeyword("AND")).isTrue();

    Tokenizer empty = new Tokenizer("POINT EMPTY");
    assertThat(empty.readGeometry(empty.next().position())).isEqualTo("POINT EMPTY");

    Tokenizer withZ = new Tokenizer("POINT Z (1 2 3)");
    assertThat(withZ.readGeometry(withZ.next().position())).isEqualTo("POINT Z (1 2 3)");
  }
}
