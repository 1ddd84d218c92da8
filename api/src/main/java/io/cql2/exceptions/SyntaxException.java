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
 * Exception raised when filter text is well-formed at the token level but does not follow the
 * CQL2-Text grammar.
 */
public class SyntaxException extends FilterException {
  private final String token;
  private final int position;

  @FormatMethod
  public SyntaxException(String token, int position, String message, Object... args) {
    super(
        "%s at position %s (found %s)",
        String.format(message, args), position, token == null ? "end of input" : "'" + token + "'");
    this.token = token;
    this.position = position;
  }

  @FormatMethod
  public SyntaxException(
      Throwable cause, String token, int position, String message, Object... args) {
    super(
        cause,
        "%s at position %s (found %s)",
        String.format(message, args),
        position,
        token == null ? "end of input" : "'" + token + "'");
    this.token = token;
    this.position = position;
  }

  /** Returns the text of the offending token, or null if the input ended unexpectedly. */
  public String token() {
    return token;
  }

  /** Returns the zero-based offset of the offending token in the input. */
  public int position() {
    return position;
  }
}
