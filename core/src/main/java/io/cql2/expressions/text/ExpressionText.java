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

import com.google.common.base.Preconditions;
import io.cql2.expressions.Expression;
import io.cql2.expressions.FunctionRegistry;
import io.cql2.util.FilterProperties;

/**
 * Reads and writes CQL2-Text.
 *
 * <p>For example, {@code temp > 30 AND (humidity < 50 OR NOT status = "active")}.
 */
public class ExpressionText {

  private ExpressionText() {}

  /**
   * Parses CQL2-Text using the default functions and nesting limit.
   *
   * @param text a CQL2-Text filter
   * @return the expression tree
   * @throws io.cql2.exceptions.LexerException if the text contains an invalid character
   * @throws io.cql2.exceptions.SyntaxException if the text does not follow the grammar
   */
  public static Expression fromText(String text) {
    return fromText(text, FunctionRegistry.defaults(), FilterProperties.TEXT_MAX_DEPTH_DEFAULT);
  }

  /**
   * Parses CQL2-Text.
   *
   * @param text a CQL2-Text filter
   * @param functions names accepted as function calls
   * @param maxDepth the maximum nesting of groups, NOT and function calls
   * @return the expression tree
   */
  public static Expression fromText(String text, FunctionRegistry functions, int maxDepth) {
    Preconditions.checkArgument(text != null, "Invalid filter text: null");
    Preconditions.checkArgument(functions != null, "Invalid function registry: null");
    Preconditions.checkArgument(maxDepth > 0, "Invalid max depth: %s (must be > 0)", maxDepth);
    return new TextParser(text, functions, maxDepth).parse();
  }

  public static String toText(Expression expr) {
    return toText(expr, FunctionRegistry.defaults());
  }

  /**
   * Serializes an expression to CQL2-Text.
   *
   * @param expr an expression
   * @param functions names that may be written as function calls
   * @return the CQL2-Text form
   * @throws io.cql2.exceptions.UnsupportedOperatorException if the tree contains an unregistered
   *     function or a boolean expression in operand position; property names must be plain
   *     identifiers, so {@code cloud-cover} also fails
   */
  public static String toText(Expression expr, FunctionRegistry functions) {
    Preconditions.checkArgument(expr != null, "Invalid expression: null");
    return new TextSerializer(functions).serialize(expr);
  }
}
