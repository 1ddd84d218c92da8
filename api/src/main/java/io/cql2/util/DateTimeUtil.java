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

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;

public class DateTimeUtil {
  private DateTimeUtil() {}

  /** Marker for an open (unbounded) interval end, as used by CQL2. */
  public static final String OPEN_BOUND = "..";

  /**
   * Parses an ISO-8601 timestamp to an {@link Instant}.
   *
   * <p>Timestamps with a zone offset are converted to UTC. Timestamps without an offset are
   * interpreted as UTC.
   *
   * @param text an ISO-8601 date-time string
   * @return the instant
   * @throws DateTimeParseException if the text is not a timestamp
   */
  public static Instant parseTimestamp(String text) {
    Preconditions.checkArgument(text != null, "Invalid timestamp: null");
    try {
      return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .toInstant(ZoneOffset.UTC);
    }
  }

  public static LocalDate parseDate(String text) {
    Preconditions.checkArgument(text != null, "Invalid date: null");
    return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
  }

  /**
   * Parses an interval bound: a timestamp when the text has a time part, otherwise a date.
   *
   * @param text an ISO-8601 timestamp or date, or {@link #OPEN_BOUND}
   * @return an {@link Instant}, a {@link LocalDate}, or null for an open bound
   */
  public static Temporal parseTemporal(String text) {
    if (text == null || OPEN_BOUND.equals(text)) {
      return null;
    } else if (text.indexOf('T') >= 0 || text.indexOf('t') >= 0) {
      return parseTimestamp(text);
    }

    return parseDate(text);
  }

  public static String formatTimestamp(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant);
  }

  public static String formatDate(LocalDate date) {
    return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
  }

  /**
   * Formats an interval bound or instant.
   *
   * @param temporal an {@link Instant}, a {@link LocalDate}, or null
   * @return the ISO-8601 form, or {@link #OPEN_BOUND} for null
   */
  public static String formatTemporal(Temporal temporal) {
    if (temporal == null) {
      return OPEN_BOUND;
    } else if (temporal instanceof Instant) {
      return formatTimestamp((Instant) temporal);
    } else if (temporal instanceof LocalDate) {
      return formatDate((LocalDate) temporal);
    }

    throw new IllegalArgumentException("Unsupported temporal value: " + temporal);
  }
}
