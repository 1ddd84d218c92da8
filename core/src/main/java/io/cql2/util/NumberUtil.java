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
package io.cql2.util;

/** Formatting helpers for the double values carried by number literals. */
public class NumberUtil {
  // 2^53, the largest magnitude below which every integer is exactly representable
  private static final double MAX_EXACT_INTEGRAL = 9007199254740992.0;

  private NumberUtil() {}

  /** Returns whether a value is a whole number within the exactly-representable range. */
  public static boolean isExactIntegral(double value) {
    return value == Math.rint(value)
        && Math.abs(value) <= MAX_EXACT_INTEGRAL
        && !isNegativeZero(value);
  }

  /**
   * Returns the shortest text form of a value that parses back to the same double.
   *
   * <p>Whole numbers are written without a fraction, for example {@code 30} rather than {@code
   * 30.0}.
   */
  public static String toString(double value) {
    if (isExactIntegral(value)) {
      return Long.toString((long) value);
    }

    return Double.toString(value);
  }

  private static boolean isNegativeZero(double value) {
    return value == 0.0 && Double.doubleToRawLongBits(value) != 0L;
  }
}
