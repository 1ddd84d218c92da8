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

/** A spatial relationship test, usually between a property and a geometry literal. */
public class SpatialPredicate extends Predicate {
  private final Expression left;
  private final Expression right;

  SpatialPredicate(Operation op, Expression left, Expression right) {
    super(op);
    Preconditions.checkArgument(op.isSpatial(), "Invalid spatial operation: %s", op);
    this.left = checkTerm(left, "left operand");
    this.right = checkOperand(right, "right operand");
  }

  public Expression left() {
    return left;
  }

  public Expression right() {
    return right;
  }

  @Override
  public Expression term() {
    return left;
  }

  @Override
  public List<Expression> operands() {
    return ImmutableList.of(left, right);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof SpatialPredicate)) {
      return false;
    }

    SpatialPredicate that = (SpatialPredicate) other;
    return op() == that.op() && left.equals(that.left) && right.equals(that.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(op(), left, right);
  }

  @Override
  public String toString() {
    return String.format("%s %s %s", left, op().textName(), right);
  }
}
