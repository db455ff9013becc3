/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weatherdemand.energy.stats;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link DemandQuantiles}.
 */
@Tag("unit")
public class DemandQuantilesTest {
  private final DemandQuantiles quantiles =
      DemandQuantiles.of(ImmutableList.of(500.0, 100.0, 300.0, 200.0, 400.0));

  @Test void testLinearInterpolation() {
    assertEquals(200.0, quantiles.getQ1(), 1e-9);
    assertEquals(400.0, quantiles.getQ3(), 1e-9);
    assertEquals(200.0, quantiles.getIqr(), 1e-9);
    assertEquals(5, quantiles.getCount());

    DemandQuantiles four = DemandQuantiles.of(ImmutableList.of(10.0, 20.0, 30.0, 40.0));
    assertEquals(17.5, four.getQ1(), 1e-9);
    assertEquals(32.5, four.getQ3(), 1e-9);
  }

  @Test void testClassification() {
    assertEquals(DemandLevel.LOW, quantiles.classify(200.0));
    assertEquals(DemandLevel.LOW, quantiles.classify(50.0));
    assertEquals(DemandLevel.HIGH, quantiles.classify(400.0));
    assertEquals(DemandLevel.HIGH, quantiles.classify(450.0));
    assertEquals(DemandLevel.MODERATE, quantiles.classify(300.0));
    assertEquals(DemandLevel.UNKNOWN, quantiles.classify(null));
  }

  @Test void testUpperFence() {
    assertEquals(1000.0, quantiles.upperFence(3.0), 1e-9);
  }

  @Test void testNullsIgnored() {
    DemandQuantiles withGaps = DemandQuantiles.of(Arrays.asList(null, 100.0, 300.0, null));

    assertEquals(2, withGaps.getCount());
    assertEquals(150.0, withGaps.getQ1(), 1e-9);
  }

  @Test void testSingleValue() {
    DemandQuantiles one = DemandQuantiles.of(Collections.singletonList(42.0));

    assertEquals(DemandLevel.HIGH, one.classify(42.0));
    assertEquals(DemandLevel.LOW, one.classify(41.0));
  }

  @Test void testNoValues() {
    assertThrows(IllegalArgumentException.class,
        () -> DemandQuantiles.of(Collections.<Double>emptyList()));
  }
}
