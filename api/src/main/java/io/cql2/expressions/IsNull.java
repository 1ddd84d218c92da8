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

/** Tests that a value is null. */
public class IsNull extends Predicate {
  private final Expression value;

  IsNull(Expression value) {
    super(Operation.IS_NULL);
    this.value = checkTerm(value, "isNull value");
  }

  public Expression value() {
    return value;
  }

  @Override
  public Expression term() {
    return value;
  }

  @Override
  public List<Expression> operands() {
    return ImmutableList.of(value);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof IsNull)) {
      return false;
    }

    return value.equals(((IsNull) other).value);
  }

  @Override
  public int hashCode() {
    return 31 * Operation.IS_NULL.hashCode() + value.hashCode();
  }

  @Override
  public String toString() {
    return value + " IS NULL";
  }
}
