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
import java.util.List;

/**
 * Base class for terminal predicates: comparisons, range, pattern, set, null, spatial and
 * temporal tests.
 *
 * <p>The first operand of a predicate is its term, usually a {@link Property}.
 */
public abstract class Predicate implements Expression {
  private final Operation op;

  Predicate(Operation op) {
    Preconditions.checkArgument(op.isPredicate(), "Invalid predicate operation: %s", op);
    this.op = op;
  }

  @Override
  public Operation op() {
    return op;
  }

  /** Returns the first operand of this predicate. */
  public abstract Expression term();

  /** Returns all operands, in argument order. */
  public abstract List<Expression> operands();

  /** Returns the property name of the term, or null if the term is not a {@link Property}. */
  public String propertyName() {
    Expression term = term();
    return term instanceof Property ? ((Property) term).name() : null;
  }

  /** Checks that a first operand is a {@link Property} or a {@link FunctionCall}. */
  Expression checkTerm(Expression term, String description) {
    checkOperand(term, description);
    Preconditions.checkArgument(
        term instanceof Property || term instanceof FunctionCall,
        "Invalid %s for %s (must be a property or function): %s",
        description,
        op.jsonName(),
        term);
    return term;
  }

  static <E extends Expression> E checkOperand(E operand, String description) {
    Preconditions.checkNotNull(operand, "Invalid %s: null", description);
    return operand;
  }
}
