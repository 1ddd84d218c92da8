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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Tests that a value lies in an inclusive range. */
public class Between extends Predicate {
  private final Expression value;
  private final Expression lower;
  private final Expression upper;

  Between(Expression value, Expression lower, Expression upper) {
    super(Operation.BETWEEN);
    this.value = checkTerm(value, "between value");
    this.lower = checkOperand(lower, "lower bound");
    this.upper = checkOperand(upper, "upper bound");
  }

  public Expression value() {
    return value;
  }

  public Expression lower() {
    return lower;
  }

  public Expression upper() {
    return upper;
  }

  @Override
  public Expression term() {
    return value;
  }

  @Override
  public List<Expression> operands() {
    return ImmutableList.of(value, lower, upper);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Between)) {
      return false;
    }

    Between that = (Between) other;
    return value.equals(that.value) && lower.equals(that.lower) && upper.equals(that.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, lower, upper);
  }

  @Override
  public String toString() {
    return String.format("%s BETWEEN %s AND %s", value, lower, upper);
  }
}
