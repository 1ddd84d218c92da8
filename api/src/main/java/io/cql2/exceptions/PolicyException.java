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
 * Exception raised when an expression is valid but uses a construct that an operation does not
 * allow, such as OR inside a tree that must be a pure conjunction.
 */
public class PolicyException extends FilterException {
  private final String operator;

  @FormatMethod
  public PolicyException(String operator, String message, Object... args) {
    super(message, args);
    this.operator = operator;
  }

  /** Returns the operator that violated the policy. */
  public String operator() {
    return operator;
  }
}
