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
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Set;

/**
 * The set of function names that the parsers accept as {@link FunctionCall function calls}.
 *
 * <p>Names are matched without regard to case.
 */
public class FunctionRegistry {
  private static final FunctionRegistry DEFAULT = of("casei", "accenti");

  private final Set<String> names;

  private FunctionRegistry(Set<String> names) {
    this.names = names;
  }

  /** Returns the registry of the standard CQL2 functions, {@code casei} and {@code accenti}. */
  public static FunctionRegistry defaults() {
    return DEFAULT;
  }

  public static FunctionRegistry of(String... names) {
    return of(ImmutableSet.copyOf(names));
  }

  public static FunctionRegistry of(Iterable<String> names) {
    Preconditions.checkArgument(names != null, "Invalid function names: null");
    ImmutableSet.Builder<String> normalized = ImmutableSet.builder();
    for (String name : names) {
      Preconditions.checkArgument(
          name != null && !name.isEmpty(), "Invalid function name: %s", name);
      normalized.add(name.toLowerCase(Locale.ROOT));
    }

    return new FunctionRegistry(normalized.build());
  }

  public boolean contains(String name) {
    return name != null && names.contains(name.toLowerCase(Locale.ROOT));
  }

  /** Returns the registered names, in lower case. */
  public Set<String> names() {
    return names;
  }

  @Override
  public String toString() {
    return "FunctionRegistry" + names;
  }
}
