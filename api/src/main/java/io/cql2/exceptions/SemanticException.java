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
package io.cql2.exceptions;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Exception raised when a CQL2-JSON document is valid JSON but does not describe a valid
 * expression: an unknown operator, a wrong argument count or a malformed operand.
 */
public class SemanticException extends FilterException {
  private final String operator;
  private final int expectedArgs;
  private final int actualArgs;

  @FormatMethod
  public SemanticException(String operator, String message, Object... args) {
    super(message, args);
    this.operator = operator;
    this.expectedArgs = -1;
    this.actualArgs = -1;
  }

  @FormatMethod
  public SemanticException(Throwable cause, String operator, String message, Object... args) {
    super(cause, message, args);
    this.operator = operator;
    this.expectedArgs = -1;
    this.actualArgs = -1;
  }

  private SemanticException(String operator, int expectedArgs, String expected, int actualArgs) {
    super("Invalid arguments for %s: expected %s, got %s", operator, expected, actualArgs);
    this.operator = operator;
    this.expectedArgs = expectedArgs;
    this.actualArgs = actualArgs;
  }

  public static SemanticException arity(String operator, int expectedArgs, int actualArgs) {
    return new SemanticException(operator, expectedArgs, String.valueOf(expectedArgs), actualArgs);
  }

  public static SemanticException minArity(String operator, int minimumArgs, int actualArgs) {
    return new SemanticException(operator, minimumArgs, "at least " + minimumArgs, actualArgs);
  }

  /** Returns the operator being parsed when the failure occurred, or null if unknown. */
  public String operator() {
    return operator;
  }

  /** Returns the expected (or minimum) argument count, or -1 if arity was not the problem. */
  public int expectedArgs() {
    return expectedArgs;
  }

  /** Returns the actual argument count, or -1 if arity was not the problem. */
  public int actualArgs() {
    return actualArgs;
  }
}
