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

/** Tests membership of a value in an ordered, possibly empty, list of candidates. */
public class In extends Predicate {
  private final Expression value;
  private final List<Expression> candidates;

  In(Expression value, List<? extends Expression> candidates) {
    super(Operation.IN);
    this.value = checkTerm(value, "in value");
    Preconditions.checkNotNull(candidates, "Invalid candidate list: null");
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    for (Expression candidate : candidates) {
      builder.add(checkOperand(candidate, "in candidate"));
    }
    this.candidates = builder.build();
  }

  public Expression value() {
    return value;
  }

  public List<Expression> candidates() {
    return candidates;
  }

  @Override
  public Expression term() {
    return value;
  }

  @Override
  public List<Expression> operands() {
    return ImmutableList.<Expression>builder().add(value).addAll(candidates).build();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof In)) {
      return false;
    }

    In that = (In) other;
    return value.equals(that.value) && candidates.equals(that.candidates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, candidates);
  }

  @Override
  public String toString() {
    return candidates.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", value + " IN (", ")"));
  }
}
