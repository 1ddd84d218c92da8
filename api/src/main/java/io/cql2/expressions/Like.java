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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Matches a string value against a pattern where % matches any run and _ any one character. */
public class Like extends Predicate {
  private final Expression value;
  private final String pattern;

  Like(Expression value, String pattern) {
    super(Operation.LIKE);
    Preconditions.checkNotNull(pattern, "Invalid like pattern: null");
    this.value = checkTerm(value, "like value");
    this.pattern = pattern;
  }

  public Expression value() {
    return value;
  }

  public String pattern() {
    return pattern;
  }

  @Override
  public Expression term() {
    return value;
  }

  @Override
  public List<Expression> operands() {
    return ImmutableList.of(value, Literal.of(pattern));
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Like)) {
      return false;
    }

    Like that = (Like) other;
    return value.equals(that.value) && pattern.equals(that.pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, pattern);
  }

  @Override
  public String toString() {
    return String.format("%s LIKE \"%s\"", value, pattern);
  }
}
