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

import org.junit.jupiter.api.Test;

public class TestNumberUtil {
  @Test
  public void testWholeNumbers() {
    assertThat(NumberUtil.toString(30.0)).isEqualTo("30");
    assertThat(NumberUtil.toString(-7.0)).isEqualTo("-7");
    assertThat(NumberUtil.toString(0.0)).isEqualTo("0");
    assertThat(NumberUtil.toString(9007199254740992.0)).isEqualTo("9007199254740992");
  }

  @Test
  public void testFractionsAndLargeValues() {
    assertThat(NumberUtil.toString(0.1)).isEqualTo("0.1");
    assertThat(NumberUtil.toString(-0.0)).isEqualTo("-0.0");
    assertThat(NumberUtil.toString(1e21)).isEqualTo("1.0E21");
    assertThat(NumberUtil.isExactIntegral(18014398509481984.0)).isFalse();
    assertThat(NumberUtil.isExactIntegral(Double.NaN)).isFalse();
    assertThat(NumberUtil.isExactIntegral(Double.POSITIVE_INFINITY)).isFalse();
  }
}
