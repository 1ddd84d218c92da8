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

/** Exception raised when an expression node cannot be expressed in a target syntax or dialect. */
public class UnsupportedOperatorException extends FilterException {
  private final String operator;
  private final String target;

  public UnsupportedOperatorException(String operator, String target) {
    super("Unsupported operator for %s: %s", target, operator);
    this.operator = operator;
    this.target = target;
  }

  public String operator() {
    return operator;
  }

  /** Returns the name of the dialect or syntax that cannot express the operator. */
  public String target() {
    return target;
  }
}
