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
 * An n-ary conjunction or disjunction.
 *
 * <p>Instances created through {@link Expressions#and} and {@link Expressions#or} are canonical:
 * no child has the same operation as its parent and there are at least two children.
 */
public class Logical implements Expression {
  private final Operation op;
  private final List<Expression> children;

  Logical(Operation op, List<Expression> children) {
    Preconditions.checkArgument(op.isLogical(), "Invalid logical operation: %s", op);
    Preconditions.checkArgument(
        children != null && !children.isEmpty(), "Cannot create %s without children", op);
    this.op = op;
    this.children = ImmutableList.copyOf(children);
  }

  @Override
  public Operation op() {
    return op;
  }

  public List<Expression> children() {
    return children;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Logical)) {
      return false;
    }

    Logical that = (Logical) other;
    return op == that.op && children.equals(that.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op, children);
  }

  @Override
  public String toString() {
    return children.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(" " + op.textName() + " ", "(", ")"));
  }
}
