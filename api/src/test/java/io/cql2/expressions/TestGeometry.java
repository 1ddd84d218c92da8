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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

public class TestGeometry {

  @Test
  public void testPoint() {
    Geometry point = Geometry.point(1, 2);
    assertThat(point.type()).isEqualTo(Geometry.POINT);
    assertThat(point.coordinates()).containsExactly(1.0, 2.0);
    assertThat(point.isCollection()).isFalse();
    assertThat(point).isEqualTo(Geometry.of("Point", ImmutableList.of(1, 2)));
  }

  @Test
  public void testBbox() {
    Geometry expected =
        Geometry.polygon(
            new double[] {0, 1},
            new double[] {10, 1},
            new double[] {10, 11},
            new double[] {0, 11},
            new double[] {0, 1});
    assertThat(Geometry.bbox(0, 1, 10, 11)).isEqualTo(expected);
    assertThat(Geometry.bbox(0, 1, -5, 10, 11, 5)).isEqualTo(expected);

    assertThatThrownBy(() -> Geometry.bbox(0, 1, 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid bbox (requires 4 or 6 values): [0.0, 1.0, 2.0]");
  }

  @Test
  public void testInvalidType() {
    assertThatThrownBy(() -> Geometry.of("Circle", ImmutableList.of(1, 2)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid geometry type: Circle");
  }

  @Test
  public void testInvalidPositions() {
    assertThatThrownBy(() -> Geometry.of("Point", ImmutableList.of(1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid Point position (requires 2 or 3 values)");

    assertThatThrownBy(() -> Geometry.of("Point", ImmutableList.of("a", "b")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid Point coordinate (not a number): a");

    assertThatThrownBy(() -> Geometry.of("LineString", ImmutableList.of(1, 2)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid LineString coordinates (expected a list): 1");
  }

  @Test
  public void testInvalidShapes() {
    assertThatThrownBy(() -> Geometry.lineString(new double[] {0, 0}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid LineString line");

    assertThatThrownBy(
            () ->
                Geometry.polygon(
                    new double[] {0, 0},
                    new double[] {1, 0},
                    new double[] {1, 1},
                    new double[] {0, 1}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid Polygon ring (not closed)");

    assertThatThrownBy(
            () -> Geometry.polygon(new double[] {0, 0}, new double[] {1, 0}, new double[] {0, 0}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid Polygon ring (requires at least 4 positions)");
  }

  @Test
  public void testCollection() {
    Geometry collection =
        Geometry.collection(
            ImmutableList.of(
                Geometry.point(1, 2),
                Geometry.lineString(new double[] {0, 0}, new double[] {1, 1})));
    assertThat(collection.isCollection()).isTrue();
    assertThat(collection.coordinates()).isEmpty();
    assertThat(collection.geometries()).hasSize(2);
  }

  @Test
  public void testCoordinatesAreImmutable() {
    Geometry point = Geometry.point(1, 2);
    assertThatThrownBy(() -> point.coordinates().add(3.0))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
