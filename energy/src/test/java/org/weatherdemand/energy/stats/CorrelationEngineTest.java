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

import org.weatherdemand.energy.config.PipelineConfig.CorrelationSettings;
import org.weatherdemand.energy.config.PipelineConfig.QualitySettings;
import org.weatherdemand.energy.model.MergedRecord;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CorrelationEngine}.
 */
@Tag("unit")
public class CorrelationEngineTest {
  private static final LocalDate START = LocalDate.of(2024, 6, 1);

  private final CorrelationEngine engine = new CorrelationEngine(CorrelationSettings.defaults());

  private static List<MergedRecord> city(String name, double[] temperature, double[] demand) {
    List<MergedRecord> rows = new ArrayList<MergedRecord>();
    for (int i = 0; i < temperature.length; i++) {
      rows.add(new MergedRecord(name, START.plusDays(i), temperature[i], demand[i]));
    }
    return rows;
  }

  /** One city tracks temperature closely, the other barely at all. */
  private static List<MergedRecord> divergentCities() {
    List<MergedRecord> rows = new ArrayList<MergedRecord>();
    rows.addAll(city("Phoenix",
        new double[] {30, 40, 50, 60, 70, 80},
        new double[] {1000, 1125, 1080, 1300, 1250, 1420}));
    rows.addAll(city("Seattle",
        new double[] {60, 65, 70, 75, 80, 85},
        new double[] {2000, 2300, 1900, 2250, 1950, 2110}));
    return rows;
  }

  @Test void testSegmentsReportedUnmodifiedBesidePooledFigure() {
    CorrelationReport report = engine.analyze(divergentCities());

    CorrelationResult phoenix = report.getCity("Phoenix");
    CorrelationResult seattle = report.getCity("Seattle");
    assertThat(phoenix.getR(), closeTo(0.9267, 1e-4));
    assertEquals(CorrelationStrength.STRONG, phoenix.getStrength());
    assertThat(seattle.getR(), closeTo(-0.0490, 1e-4));
    assertEquals(CorrelationStrength.WEAK, seattle.getStrength());

    CorrelationResult global = report.getGlobal();
    assertTrue(global.isGlobal());
    assertEquals(12, global.getSampleSize());
    assertThat(global.getR(), closeTo(0.6619, 1e-4));
    assertEquals(CorrelationStrength.MODERATE, global.getStrength());
    assertThat(report.getPerCity().keySet(), contains("Phoenix", "Seattle"));
  }

  @Test void testCombinedEstimateIsFisherWeighted() {
    CorrelationReport report = engine.analyze(divergentCities());

    assertNotNull(report.getCombinedEstimate());
    assertThat(report.getCombinedEstimate(), closeTo(0.6599, 1e-4));
  }

  @Test void testCombinedEstimateDisabled() {
    CorrelationEngine plain = new CorrelationEngine(new CorrelationSettings(0.7, 0.4, 3, false));

    assertNull(plain.analyze(divergentCities()).getCombinedEstimate());
  }

  @Test void testTwoValidRowsInsufficient() {
    List<MergedRecord> rows = city("Houston", new double[] {70, 90}, new double[] {500, 900});

    CorrelationResult houston = engine.analyze(rows).getCity("Houston");

    assertEquals(CorrelationStrength.INSUFFICIENT, houston.getStrength());
    assertNull(houston.getR());
    assertEquals(2, houston.getSampleSize());
  }

  @Test void testOutOfRangeRowsIgnoredWithoutValidation() {
    List<MergedRecord> rows = city("Denver",
        new double[] {40, 55, 200, 70, 60},
        new double[] {900, 1000, 1100, -500, 1050});

    CorrelationReport report = engine.analyze(rows);

    assertEquals(3, report.getGlobal().getSampleSize());
    assertEquals(3, report.getCity("Denver").getSampleSize());
    assertThat(report.getCity("Denver").getR(), closeTo(0.9959, 1e-4));
  }

  @Test void testConfiguredBoundsApply() {
    CorrelationEngine narrow = new CorrelationEngine(CorrelationSettings.defaults(),
        new QualitySettings(50, 100, 3.0, 2));
    List<MergedRecord> rows = city("Denver",
        new double[] {40, 55, 60, 65, 70},
        new double[] {900, 1000, 1050, 1080, 1100});

    assertEquals(4, narrow.analyze(rows).getGlobal().getSampleSize());
  }

  @Test void testExcludedAndIncompleteRowsIgnored() {
    List<MergedRecord> rows = new ArrayList<MergedRecord>(
        city("Chicago", new double[] {20, 40, 60}, new double[] {900, 800, 700}));
    rows.add(new MergedRecord("Chicago", START.plusDays(3), 200.0, 100.0)
        .excluded("temperature:range"));
    rows.add(new MergedRecord("Chicago", START.plusDays(4), null, 650.0));

    CorrelationResult chicago = engine.analyze(rows).getCity("Chicago");

    assertEquals(3, chicago.getSampleSize());
    assertThat(chicago.getR(), closeTo(-1.0, 1e-9));
    assertEquals(CorrelationStrength.STRONG, chicago.getStrength());
  }

  @Test void testZeroVarianceInsufficient() {
    List<MergedRecord> rows = city("Seattle", new double[] {55, 55, 55, 55},
        new double[] {1000, 1100, 1200, 1300});

    CorrelationResult seattle = engine.analyze(rows).getCity("Seattle");

    assertEquals(CorrelationStrength.INSUFFICIENT, seattle.getStrength());
    assertNull(seattle.getR());
  }

  @Test void testCityWithNoValidRowsStillListed() {
    List<MergedRecord> rows = ImmutableList.of(
        new MergedRecord("Boise", START, null, null));

    CorrelationReport report = engine.analyze(rows);

    assertEquals(0, report.getCity("Boise").getSampleSize());
    assertEquals(CorrelationStrength.INSUFFICIENT, report.getGlobal().getStrength());
    assertNull(report.getCombinedEstimate());
  }

  @Test void testClassificationCutoffs() {
    assertEquals(CorrelationStrength.STRONG, engine.classify(0.7));
    assertEquals(CorrelationStrength.STRONG, engine.classify(-0.85));
    assertEquals(CorrelationStrength.MODERATE, engine.classify(0.4));
    assertEquals(CorrelationStrength.MODERATE, engine.classify(-0.69));
    assertEquals(CorrelationStrength.WEAK, engine.classify(0.39));
  }

  @Test void testFisherSkipsSmallAndPerfectSamples() {
    List<CorrelationResult> results = ImmutableList.of(
        new CorrelationResult("A", 0.5, 3, CorrelationStrength.MODERATE),
        new CorrelationResult("B", 1.0, 10, CorrelationStrength.STRONG),
        new CorrelationResult("C", null, 1, CorrelationStrength.INSUFFICIENT),
        new CorrelationResult("D", 0.3, 8, CorrelationStrength.WEAK));

    assertThat(CorrelationEngine.fisherCombined(results), closeTo(0.3, 1e-12));
  }

  @Test void testResultRejectsCoefficientForInsufficient() {
    assertThrows(IllegalArgumentException.class,
        () -> new CorrelationResult("X", 0.2, 2, CorrelationStrength.INSUFFICIENT));
  }
}
