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

public class Not implements Expression {
  private final Expression child;

  Not(Expression child) {
    Preconditions.checkNotNull(child, "Child expression cannot be null.");
    this.child = child;
  }

  public Expression child() {
    return child;
  }

  @Override
  public Operation op() {
    return Operation.NOT;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Not)) {
      return false;
    }

    return child.equals(((Not) other).child);
  }

  @Override
  public int hashCode() {
    return 31 * Operation.NOT.hashCode() + child.hashCode();
  }

  @Override
  public String toString() {
    return String.format("NOT (%s)", child);
  }
}
