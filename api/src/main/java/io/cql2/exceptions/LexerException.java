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

/** Exception raised when filter text cannot be split into tokens. */
public class LexerException extends FilterException {
  private final char character;
  private final int position;

  public LexerException(char character, int position) {
    super("Invalid character '%s' at position %s", character, position);
    this.character = character;
    this.position = position;
  }

  @FormatMethod
  public LexerException(char character, int position, String message, Object... args) {
    super("%s at position %s", String.format(message, args), position);
    this.character = character;
    this.position = position;
  }

  public char character() {
    return character;
  }

  /** Returns the zero-based offset of the character in the input. */
  public int position() {
    return position;
  }
}
