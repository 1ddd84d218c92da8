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
import java.util.stream.Collectors;

/**
 * A call to a named function that is not one of the fixed operators, such as {@code casei}.
 *
 * <p>A function call may be used as an operand or, when the function returns a boolean, as a
 * predicate on its own.
 */
public class FunctionCall implements Expression {
  private final String name;
  private final List<Expression> args;

  FunctionCall(String name, List<? extends Expression> args) {
    Preconditions.checkArgument(
        name != null && !name.isEmpty(), "Invalid function name: %s", name);
    Preconditions.checkNotNull(args, "Invalid function arguments: null");
    this.name = name;
    this.args = ImmutableList.copyOf(args);
  }

  public String name() {
    return name;
  }

  public List<Expression> args() {
    return args;
  }

  @Override
  public Operation op() {
    return Operation.FUNCTION;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof FunctionCall)) {
      return false;
    }

    FunctionCall that = (FunctionCall) other;
    return name.equals(that.name) && args.equals(that.args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public String toString() {
    return args.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", name + "(", ")"));
  }
}
