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

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class TestPropertyUtil {
  private static final Map<String, String> PROPERTIES =
      ImmutableMap.of(
          "cql2.functions", " casei, , upper ",
          "cql2.text.max-depth", "12",
          "cql2.json.pretty", "true",
          "cql2.dialect.solr.op.=", "{0}:{1}",
          "cql2.dialect.solr.op.and", "AND");

  @Test
  public void testTypedValues() {
    assertThat(PropertyUtil.propertyAsInt(PROPERTIES, FilterProperties.TEXT_MAX_DEPTH, 3))
        .isEqualTo(12);
    assertThat(PropertyUtil.propertyAsInt(PROPERTIES, "missing", 3)).isEqualTo(3);
    assertThat(PropertyUtil.propertyAsBoolean(PROPERTIES, FilterProperties.JSON_PRETTY, false))
        .isTrue();
    assertThat(PropertyUtil.propertyAsBoolean(PROPERTIES, "missing", false)).isFalse();
    assertThat(PropertyUtil.propertyAsString(PROPERTIES, "missing", "sql")).isEqualTo("sql");
  }

  @Test
  public void testPropertyAsList() {
    assertThat(PropertyUtil.propertyAsList(PROPERTIES, FilterProperties.FUNCTIONS, null))
        .containsExactly("casei", "upper");
    assertThat(PropertyUtil.propertyAsList(PROPERTIES, "missing", "a,b")).containsExactly("a", "b");
    assertThat(PropertyUtil.propertyAsList(PROPERTIES, "missing", null)).isEmpty();
  }

  @Test
  public void testPropertiesWithPrefix() {
    assertThat(PropertyUtil.propertiesWithPrefix(PROPERTIES, "cql2.dialect.solr."))
        .containsExactly(entry("op.=", "{0}:{1}"), entry("op.and", "AND"));
    assertThat(PropertyUtil.propertiesWithPrefix(PROPERTIES, "other.")).isEmpty();
    assertThat(PropertyUtil.propertiesWithPrefix(ImmutableMap.of(), "cql2.")).isEmpty();
  }

  private static Map.Entry<String, String> entry(String key, String value) {
    return Maps.immutableEntry(key, value);
  }
}
