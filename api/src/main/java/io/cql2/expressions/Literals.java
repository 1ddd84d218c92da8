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
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/** Factory and implementations of {@link Literal} values. */
public class Literals {
  private Literals() {}

  /**
   * Create a {@link Literal} from an Object.
   *
   * <p>Numbers of any Java type are stored as doubles. Offset and zoned date-times are normalized
   * to an {@link Instant}. A null value produces the null literal.
   *
   * @param value a value
   * @return a Literal for the given value
   * @throws IllegalArgumentException if the value's type cannot be represented
   */
  public static Literal<?> from(Object value) {
    if (value == null) {
      return NullLiteral.INSTANCE;
    } else if (value instanceof Literal) {
      return (Literal<?>) value;
    } else if (value instanceof CharSequence) {
      return new StringLiteral(value.toString());
    } else if (value instanceof Boolean) {
      return new BooleanLiteral((Boolean) value);
    } else if (value instanceof Number) {
      return new NumberLiteral(((Number) value).doubleValue());
    } else if (value instanceof Instant) {
      return new TimestampLiteral((Instant) value);
    } else if (value instanceof OffsetDateTime) {
      return new TimestampLiteral(((OffsetDateTime) value).toInstant());
    } else if (value instanceof ZonedDateTime) {
      return new TimestampLiteral(((ZonedDateTime) value).toInstant());
    } else if (value instanceof LocalDate) {
      return new DateLiteral((LocalDate) value);
    } else if (value instanceof Interval) {
      return new IntervalLiteral((Interval) value);
    } else if (value instanceof Geometry) {
      return new GeometryLiteral((Geometry) value);
    }

    throw new IllegalArgumentException(
        String.format(
            "Cannot create expression literal from %s: %s", value.getClass().getName(), value));
  }

  public static Literal<Void> nullLiteral() {
    return NullLiteral.INSTANCE;
  }

  public static Literal<Instant> timestamp(Instant value) {
    return new TimestampLiteral(value);
  }

  public static Literal<LocalDate> date(LocalDate value) {
    return new DateLiteral(value);
  }

  private abstract static class BaseLiteral<T> implements Literal<T> {
    private final T value;

    BaseLiteral(T value) {
      Preconditions.checkNotNull(value, "Literal values cannot be null");
      this.value = value;
    }

    @Override
    public T value() {
      return value;
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      } else if (other == null || getClass() != other.getClass()) {
        return false;
      }

      BaseLiteral<?> that = (BaseLiteral<?>) other;
      return value.equals(that.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), value);
    }

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  static class StringLiteral extends BaseLiteral<String> {
    StringLiteral(String value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public String toString() {
      return "\"" + value() + "\"";
    }
  }

  static class NumberLiteral extends BaseLiteral<Double> {
    NumberLiteral(double value) {
      super(value);
      Preconditions.checkArgument(
          !Double.isNaN(value) && !Double.isInfinite(value),
          "Cannot create expression literal from %s",
          value);
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }
  }

  static class BooleanLiteral extends BaseLiteral<Boolean> {
    BooleanLiteral(boolean value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }
  }

  static class TimestampLiteral extends BaseLiteral<Instant> {
    TimestampLiteral(Instant value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.TIMESTAMP;
    }

    @Override
    public String toString() {
      return "timestamp(" + DateTimeUtil.formatTemporal(value()) + ")";
    }
  }

  static class DateLiteral extends BaseLiteral<LocalDate> {
    DateLiteral(LocalDate value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.DATE;
    }

    @Override
    public String toString() {
      return "date(" + DateTimeUtil.formatTemporal(value()) + ")";
    }
  }

  static class IntervalLiteral extends BaseLiteral<Interval> {
    IntervalLiteral(Interval value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.INTERVAL;
    }
  }

  static class GeometryLiteral extends BaseLiteral<Geometry> {
    GeometryLiteral(Geometry value) {
      super(value);
    }

    @Override
    public Kind kind() {
      return Kind.GEOMETRY;
    }
  }

  static class NullLiteral implements Literal<Void> {
    private static final NullLiteral INSTANCE = new NullLiteral();

    private NullLiteral() {}

    @Override
    public Void value() {
      return null;
    }

    @Override
    public Kind kind() {
      return Kind.NULL;
    }

    @Override
    public String toString() {
      return "null";
    }

    Object readResolve() {
      return INSTANCE;
    }
  }
}
