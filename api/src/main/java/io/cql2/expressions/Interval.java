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
import io.cql2.util.DateTimeUtil;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.Temporal;
import java.util.Objects;

/**
 * A temporal interval between two instants or dates.
 *
 * <p>Either end may be null, which means the interval is open (unbounded) on that side.
 */
public class Interval implements Serializable {
  private final Temporal start;
  private final Temporal end;

  private Interval(Temporal start, Temporal end) {
    checkBound(start);
    checkBound(end);
    this.start = start;
    this.end = end;
  }

  public static Interval of(Temporal start, Temporal end) {
    return new Interval(start, end);
  }

  /** Creates an interval from ISO-8601 strings, where ".." or null marks an open end. */
  public static Interval parse(String start, String end) {
    return new Interval(DateTimeUtil.parseTemporal(start), DateTimeUtil.parseTemporal(end));
  }

  private static void checkBound(Temporal bound) {
    Preconditions.checkArgument(
        bound == null || bound instanceof Instant || bound instanceof LocalDate,
        "Invalid interval bound (must be Instant or LocalDate): %s",
        bound);
  }

  /** Returns the start, or null if the interval is open at the start. */
  public Temporal start() {
    return start;
  }

  /** Returns the end, or null if the interval is open at the end. */
  public Temporal end() {
    return end;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Interval)) {
      return false;
    }

    Interval that = (Interval) other;
    return Objects.equals(start, that.start) && Objects.equals(end, that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + DateTimeUtil.formatTemporal(start) + "/" + DateTimeUtil.formatTemporal(end) + "]";
  }
}
