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
import com.google.common.collect.ImmutableList;
import io.cql2.expressions.Geometry;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/** Converts {@link Geometry} values to and from Well-Known Text. */
public class GeometryUtil {
  private static final GeometryFactory FACTORY = new GeometryFactory();

  private GeometryUtil() {}

  public static String toWKT(Geometry geom) {
    Preconditions.checkArgument(geom != null, "Invalid geometry: null");
    org.locationtech.jts.geom.Geometry jts = toJts(geom);
    WKTWriter wktWriter = new WKTWriter(getOutputDimension(jts));
    return wktWriter.write(jts);
  }

  /**
   * Parses Well-Known Text.
   *
   * @param wkt a WKT string, such as {@code POINT (1 2)}
   * @return the geometry
   * @throws IllegalArgumentException if the text is not valid WKT or describes a geometry that
   *     cannot be represented, such as an empty point
   */
  public static Geometry fromWKT(String wkt) {
    WKTReader reader = new WKTReader(FACTORY);
    try {
      return fromJts(reader.read(wkt));
    } catch (ParseException e) {
      throw new IllegalArgumentException("Failed to parse WKT: " + e.getMessage(), e);
    }
  }

  public static int getOutputDimension(org.locationtech.jts.geom.Geometry geom) {
    Coordinate coordinate = geom.getCoordinate();
    if (coordinate != null && !Double.isNaN(coordinate.getZ())) {
      return 3;
    }
    return 2;
  }

  static org.locationtech.jts.geom.Geometry toJts(Geometry geom) {
    List<Object> coords = geom.coordinates();
    switch (geom.type()) {
      case Geometry.POINT:
        return FACTORY.createPoint(coordinate(coords));
      case Geometry.MULTI_POINT:
        return FACTORY.createMultiPoint(
            coords.stream().map(pos -> FACTORY.createPoint(coordinate(pos))).toArray(Point[]::new));
      case Geometry.LINE_STRING:
        return lineString(coords);
      case Geometry.MULTI_LINE_STRING:
        return FACTORY.createMultiLineString(
            coords.stream().map(GeometryUtil::lineString).toArray(LineString[]::new));
      case Geometry.POLYGON:
        return polygon(coords);
      case Geometry.MULTI_POLYGON:
        return FACTORY.createMultiPolygon(
            coords.stream().map(GeometryUtil::polygon).toArray(Polygon[]::new));
      case Geometry.GEOMETRY_COLLECTION:
        return FACTORY.createGeometryCollection(
            geom.geometries().stream()
                .map(GeometryUtil::toJts)
                .toArray(org.locationtech.jts.geom.Geometry[]::new));
      default:
        throw new IllegalArgumentException("Unsupported geometry type: " + geom.type());
    }
  }

  static Geometry fromJts(org.locationtech.jts.geom.Geometry geom) {
    switch (geom.getGeometryType()) {
      case Geometry.POINT:
        Preconditions.checkArgument(!geom.isEmpty(), "Invalid point: empty");
        return Geometry.of(Geometry.POINT, position(geom.getCoordinate()));
      case Geometry.MULTI_POINT:
        ImmutableList.Builder<Object> points = ImmutableList.builder();
        for (int i = 0; i < geom.getNumGeometries(); i += 1) {
          Preconditions.checkArgument(
              !geom.getGeometryN(i).isEmpty(), "Invalid multi-point member: empty");
          points.add(position(geom.getGeometryN(i).getCoordinate()));
        }
        return Geometry.of(Geometry.MULTI_POINT, points.build());
      case Geometry.LINE_STRING:
      case "LinearRing":
        return Geometry.of(Geometry.LINE_STRING, positions(geom.getCoordinates()));
      case Geometry.MULTI_LINE_STRING:
        ImmutableList.Builder<Object> lines = ImmutableList.builder();
        for (int i = 0; i < geom.getNumGeometries(); i += 1) {
          lines.add(positions(geom.getGeometryN(i).getCoordinates()));
        }
        return Geometry.of(Geometry.MULTI_LINE_STRING, lines.build());
      case Geometry.POLYGON:
        return Geometry.of(Geometry.POLYGON, rings((Polygon) geom));
      case Geometry.MULTI_POLYGON:
        ImmutableList.Builder<Object> polygons = ImmutableList.builder();
        for (int i = 0; i < geom.getNumGeometries(); i += 1) {
          polygons.add(rings((Polygon) geom.getGeometryN(i)));
        }
        return Geometry.of(Geometry.MULTI_POLYGON, polygons.build());
      case Geometry.GEOMETRY_COLLECTION:
        GeometryCollection collection = (GeometryCollection) geom;
        ImmutableList.Builder<Geometry> members = ImmutableList.builder();
        for (int i = 0; i < collection.getNumGeometries(); i += 1) {
          members.add(fromJts(collection.getGeometryN(i)));
        }
        return Geometry.collection(members.build());
      default:
        throw new IllegalArgumentException("Unsupported geometry type: " + geom.getGeometryType());
    }
  }

  private static Coordinate coordinate(Object position) {
    List<?> values = (List<?>) position;
    double x = (Double) values.get(0);
    double y = (Double) values.get(1);
    if (values.size() > 2) {
      return new Coordinate(x, y, (Double) values.get(2));
    }
    return new Coordinate(x, y);
  }

  private static Coordinate[] coordinates(Object positions) {
    return ((List<?>) positions)
        .stream().map(GeometryUtil::coordinate).toArray(Coordinate[]::new);
  }

  private static LineString lineString(Object positions) {
    return FACTORY.createLineString(coordinates(positions));
  }

  private static Polygon polygon(Object rings) {
    List<?> ringList = (List<?>) rings;
    if (ringList.isEmpty()) {
      return FACTORY.createPolygon();
    }

    LinearRing shell = FACTORY.createLinearRing(coordinates(ringList.get(0)));
    LinearRing[] holes =
        ringList.subList(1, ringList.size()).stream()
            .map(ring -> FACTORY.createLinearRing(coordinates(ring)))
            .toArray(LinearRing[]::new);
    return FACTORY.createPolygon(shell, holes);
  }

  private static List<Object> position(Coordinate coord) {
    if (Double.isNaN(coord.getZ())) {
      return ImmutableList.of(coord.getX(), coord.getY());
    }
    return ImmutableList.of(coord.getX(), coord.getY(), coord.getZ());
  }

  private static List<Object> positions(Coordinate[] coords) {
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (Coordinate coord : coords) {
      builder.add(position(coord));
    }
    return builder.build();
  }

  private static List<Object> rings(Polygon polygon) {
    if (polygon.isEmpty()) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<Object> rings = ImmutableList.builder();
    rings.add(positions(polygon.getExteriorRing().getCoordinates()));
    for (int i = 0; i < polygon.getNumInteriorRing(); i += 1) {
      rings.add(positions(polygon.getInteriorRingN(i).getCoordinates()));
    }
    return rings.build();
  }
}
