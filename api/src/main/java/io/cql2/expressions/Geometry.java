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
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A GeoJSON-shaped geometry value: a type tag and nested coordinate lists.
 *
 * <p>Geometries are opaque to the filter engine. They are carried through parsing and
 * serialization but never evaluated.
 */
public class Geometry implements Serializable {
  public static final String POINT = "Point";
  public static final String MULTI_POINT = "MultiPoint";
  public static final String LINE_STRING = "LineString";
  public static final String MULTI_LINE_STRING = "MultiLineString";
  public static final String POLYGON = "Polygon";
  public static final String MULTI_POLYGON = "MultiPolygon";
  public static final String GEOMETRY_COLLECTION = "GeometryCollection";

  // number of list levels above a single coordinate value
  private static final Map<String, Integer> COORDINATE_DEPTH =
      ImmutableMap.<String, Integer>builder()
          .put(POINT, 1)
          .put(MULTI_POINT, 2)
          .put(LINE_STRING, 2)
          .put(MULTI_LINE_STRING, 3)
          .put(POLYGON, 3)
          .put(MULTI_POLYGON, 4)
          .build();

  private final String type;
  private final List<Object> coordinates;
  private final List<Geometry> geometries;

  private Geometry(String type, List<Object> coordinates, List<Geometry> geometries) {
    this.type = type;
    this.coordinates = coordinates;
    this.geometries = geometries;
  }

  /**
   * Creates a geometry from a GeoJSON type and coordinates.
   *
   * @param type a GeoJSON geometry type, such as "Polygon"
   * @param coordinates nested lists of numbers, nested as required by the type; positions have 2
   *     or 3 values and polygon rings must be closed
   * @return a geometry
   * @throws IllegalArgumentException if the type is unknown or the coordinates do not match it
   */
  public static Geometry of(String type, List<?> coordinates) {
    Integer depth = COORDINATE_DEPTH.get(type);
    Preconditions.checkArgument(depth != null, "Invalid geometry type: %s", type);
    Preconditions.checkArgument(coordinates != null, "Invalid %s coordinates: null", type);
    List<Object> copy = copyCoordinates(type, coordinates, depth);
    checkShape(type, copy);
    return new Geometry(type, copy, ImmutableList.of());
  }

  public static Geometry collection(List<Geometry> geometries) {
    Preconditions.checkArgument(geometries != null, "Invalid geometry collection: null");
    return new Geometry(GEOMETRY_COLLECTION, ImmutableList.of(), ImmutableList.copyOf(geometries));
  }

  public static Geometry point(double x, double y) {
    return of(POINT, ImmutableList.of(x, y));
  }

  public static Geometry lineString(double[]... points) {
    return of(LINE_STRING, positions(points));
  }

  /** Creates a polygon with a single exterior ring. */
  public static Geometry polygon(double[]... ring) {
    return of(POLYGON, ImmutableList.of(positions(ring)));
  }

  /**
   * Creates the polygon covering a bounding box.
   *
   * @param bbox 4 values (minX, minY, maxX, maxY) or 6 values with elevation
   *     (minX, minY, minZ, maxX, maxY, maxZ); elevation is dropped
   * @return a closed rectangular polygon
   */
  public static Geometry bbox(double... bbox) {
    Preconditions.checkArgument(
        bbox != null && (bbox.length == 4 || bbox.length == 6),
        "Invalid bbox (requires 4 or 6 values): %s",
        Arrays.toString(bbox));
    int half = bbox.length / 2;
    double minX = bbox[0];
    double minY = bbox[1];
    double maxX = bbox[half];
    double maxY = bbox[half + 1];
    return polygon(
        new double[] {minX, minY},
        new double[] {maxX, minY},
        new double[] {maxX, maxY},
        new double[] {minX, maxY},
        new double[] {minX, minY});
  }

  private static List<Object> positions(double[]... points) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (double[] point : points) {
      ImmutableList.Builder<Object> position = ImmutableList.builder();
      for (double value : point) {
        position.add(value);
      }
      builder.add(position.build());
    }

    return builder.build();
  }

  private static List<Object> copyCoordinates(String type, List<?> values, int depth) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (Object value : values) {
      if (depth == 1) {
        Preconditions.checkArgument(
            value instanceof Number, "Invalid %s coordinate (not a number): %s", type, value);
        builder.add(((Number) value).doubleValue());
      } else {
        Preconditions.checkArgument(
            value instanceof List, "Invalid %s coordinates (expected a list): %s", type, value);
        builder.add(copyCoordinates(type, (List<?>) value, depth - 1));
      }
    }

    List<Object> copy = builder.build();
    if (depth == 1) {
      Preconditions.checkArgument(
          copy.size() == 2 || copy.size() == 3,
          "Invalid %s position (requires 2 or 3 values): %s",
          type,
          copy);
    }

    return copy;
  }

  @SuppressWarnings("unchecked")
  private static void checkShape(String type, List<Object> coordinates) {
    switch (type) {
      case LINE_STRING:
        checkLine(type, coordinates);
        break;
      case MULTI_LINE_STRING:
        for (Object line : coordinates) {
          checkLine(type, (List<Object>) line);
        }
        break;
      case POLYGON:
        checkRings(type, coordinates);
        break;
      case MULTI_POLYGON:
        for (Object polygon : coordinates) {
          checkRings(type, (List<Object>) polygon);
        }
        break;
      default:
        break;
    }
  }

  private static void checkLine(String type, List<Object> line) {
    Preconditions.checkArgument(
        line.size() != 1, "Invalid %s line (requires 0 or at least 2 positions): %s", type, line);
  }

  private static void checkRings(String type, List<Object> rings) {
    for (Object value : rings) {
      List<?> ring = (List<?>) value;
      Preconditions.checkArgument(
          ring.size() >= 4, "Invalid %s ring (requires at least 4 positions): %s", type, ring);
      Preconditions.checkArgument(
          ring.get(0).equals(ring.get(ring.size() - 1)),
          "Invalid %s ring (not closed): %s",
          type,
          ring);
    }
  }

  /** Returns the GeoJSON type tag. */
  public String type() {
    return type;
  }

  /**
   * Returns the coordinates as nested immutable lists of {@link Double}.
   *
   * <p>Empty for a geometry collection.
   */
  public List<Object> coordinates() {
    return coordinates;
  }

  /** Returns the member geometries of a geometry collection, empty for other types. */
  public List<Geometry> geometries() {
    return geometries;
  }

  public boolean isCollection() {
    return GEOMETRY_COLLECTION.equals(type);
  }

  /**
   * Returns the list nesting depth of coordinates for a geometry type.
   *
   * @param type a GeoJSON geometry type
   * @return the depth, or null if the type is not a simple geometry type
   */
  public static Integer coordinateDepth(String type) {
    return COORDINATE_DEPTH.get(type);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Geometry)) {
      return false;
    }

    Geometry that = (Geometry) other;
    return type.equals(that.type)
        && coordinates.equals(that.coordinates)
        && geometries.equals(that.geometries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, coordinates, geometries);
  }

  @Override
  public String toString() {
    if (isCollection()) {
      return type + geometries;
    }

    return type + coordinates;
  }
}
