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
package org.weatherdemand.energy.pipeline;

import org.weatherdemand.energy.PipelineCancelledException;
import org.weatherdemand.energy.RoutingTransport;
import org.weatherdemand.energy.SourceFixtures;
import org.weatherdemand.energy.config.PipelineConfig;
import org.weatherdemand.energy.config.SourceDefaults;
import org.weatherdemand.energy.merge.RecordMerger;
import org.weatherdemand.energy.quality.ValidationWarning;
import org.weatherdemand.energy.stats.CorrelationResult;
import org.weatherdemand.energy.stats.CorrelationStrength;
import org.weatherdemand.energy.stats.DemandLevel;
import org.weatherdemand.etl.SourceResult;
import org.weatherdemand.etl.storage.LocalFileStorageProvider;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end runs of {@link WeatherDemandPipeline} against canned upstream
 * responses and a temporary directory.
 */
@Tag("integration")
public class WeatherDemandPipelineTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);
  private static final LocalDate START = LocalDate.of(2024, 3, 1);
  private static final LocalDate END = LocalDate.of(2024, 3, 8);

  private static final double[] TMAX = {40, 43, 46, 49, 52, 55, 58, 61};
  private static final double[] TMIN = {30, 33, 36, 39, 42, 45, 48, 51};
  private static final double[] NY_DEMAND = {1000, 1030, 1035, 1070, 1080, 1095, 1130, 1150};
  private static final double[] CHICAGO_DEMAND = {900, 880, 870, 860, 845, 830, 820, 800};

  private static String noaa(double offset) {
    double[] tmax = new double[TMAX.length];
    double[] tmin = new double[TMIN.length];
    for (int i = 0; i < TMAX.length; i++) {
      tmax[i] = TMAX[i] + offset;
      tmin[i] = TMIN[i] + offset;
    }
    return SourceFixtures.noaaPage().days(START, tmax, tmin).json();
  }

  /** New York fully served; Chicago weather only. */
  private static RoutingTransport upstream() {
    return new RoutingTransport()
        .route(SourceDefaults.NOAA_URL, "USW00094728", 200, noaa(0))
        .route(SourceDefaults.NOAA_URL, "USW00094846", 200, noaa(-10))
        .route(SourceDefaults.EIA_URL, "NYIS", 200,
            SourceFixtures.eiaPage().days(START, NY_DEMAND).json());
  }

  private static RoutingTransport withChicagoDemand(RoutingTransport transport) {
    return transport.route(SourceDefaults.EIA_URL, "PJM", 200,
        SourceFixtures.eiaPage().days(START, CHICAGO_DEMAND).json());
  }

  private static WeatherDemandPipeline pipeline(PipelineConfig config,
      RoutingTransport transport) {
    return new WeatherDemandPipeline(config, transport, new LocalFileStorageProvider(), CLOCK);
  }

  @Test void testPartialFailureStillProducesOutputs(@TempDir Path dir) throws IOException {
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).build();

    RunSummary summary = pipeline(config, upstream()).run(START, END);

    assertEquals("20240310T120000Z", summary.getRunId());
    assertEquals(CityStatus.OK, summary.getCityStatus("New York"));
    assertEquals(CityStatus.PARTIAL, summary.getCityStatus("Chicago"));
    assertEquals(4, summary.getSourceResults().size());
    assertEquals(1, summary.getFailedFetches());
    SourceResult failed = null;
    for (SourceResult result : summary.getSourceResults()) {
      if (result.isError()) {
        failed = result;
      }
    }
    assertNotNull(failed);
    assertEquals("eia", failed.getSource());
    assertEquals("Chicago", failed.getKey());
    assertEquals("fetch", failed.getErrorKind());

    assertEquals(8, summary.getQualityReport().getTotalRows());
    assertEquals(Integer.valueOf(8),
        summary.getQualityReport().getJoinLosses().get(RecordMerger.UNMATCHED_WEATHER));

    CorrelationResult newYork = summary.getCorrelation().getCity("New York");
    assertEquals(8, newYork.getSampleSize());
    assertEquals(CorrelationStrength.STRONG, newYork.getStrength());
    assertNull(summary.getCorrelation().getCity("Chicago"));
    assertEquals(DemandLevel.HIGH, summary.getLatestDemandLevels().get("New York"));
  }

  @Test void testArtifactsWritten(@TempDir Path dir) throws IOException {
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).build();

    RunSummary summary = pipeline(config, withChicagoDemand(upstream())).run(START, END);

    Path csv = Paths.get(summary.getProcessedPath());
    assertEquals(dir.resolve("processed").resolve("merged_data.csv"), csv);
    List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
    assertEquals(17, lines.size());
    assertEquals("city,date,temperature,demand,is_weekend,excluded_from_stats", lines.get(0));
    assertEquals("Chicago,2024-03-01,25.0,900.0,false,false", lines.get(1));
    assertEquals("Chicago,2024-03-02,28.0,880.0,true,false", lines.get(2));
    assertThat(lines.get(16), containsString("New York,2024-03-08,"));

    Path report = Paths.get(summary.getReportPath());
    assertThat(report.getFileName().toString(), endsWith("quality_report_20240310T120000Z.json"));
    String json = new String(Files.readAllBytes(report), StandardCharsets.UTF_8);
    assertThat(json, containsString("\"runId\" : \"20240310T120000Z\""));
    assertThat(json, containsString("\"status\" : \"FRESH\""));

    assertEquals(CityStatus.OK, summary.getCityStatus("Chicago"));
    assertEquals(CorrelationStrength.STRONG,
        summary.getCorrelation().getCity("Chicago").getStrength());
    assertTrue(summary.getCorrelation().getCity("Chicago").getR() < 0);
    assertEquals(DemandLevel.LOW, summary.getLatestDemandLevels().get("Chicago"));
  }

  @Test void testEverySourceFailing(@TempDir Path dir) throws IOException {
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).build();

    RunSummary summary = pipeline(config, new RoutingTransport()).run(START, END);

    assertEquals(CityStatus.FAILED, summary.getCityStatus("New York"));
    assertEquals(CityStatus.FAILED, summary.getCityStatus("Chicago"));
    assertEquals(4, summary.getFailedFetches());
    assertEquals(0, summary.getQualityReport().getTotalRows());
    List<String> codes = new ArrayList<String>();
    for (ValidationWarning warning : summary.getQualityReport().getWarnings()) {
      codes.add(warning.getCode());
    }
    assertTrue(codes.contains(ValidationWarning.EMPTY_TABLE));
    assertEquals(CorrelationStrength.INSUFFICIENT,
        summary.getCorrelation().getGlobal().getStrength());
    assertEquals(1, Files.readAllLines(Paths.get(summary.getProcessedPath())).size());
    assertTrue(Files.exists(Paths.get(summary.getReportPath())));
  }

  @Test void testCancelBeforeRun(@TempDir Path dir) {
    RoutingTransport transport = upstream();
    WeatherDemandPipeline pipeline =
        pipeline(SourceFixtures.pipelineConfig(dir).build(), transport);
    pipeline.cancel();

    PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
        () -> pipeline.run(START, END));
    assertEquals("fetch", e.getStage());
    assertEquals(0, transport.requestCount());
    assertTrue(pipeline.isCancelled());
  }

  @Test void testCancelDuringFetchStopsBeforeMerge(@TempDir Path dir) {
    RoutingTransport transport = upstream();
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).fetchWorkers(1).build();
    WeatherDemandPipeline pipeline = pipeline(config, transport);
    transport.onRequest(url -> pipeline.cancel());

    PipelineCancelledException e = assertThrows(PipelineCancelledException.class,
        () -> pipeline.run(START, END));
    assertEquals("merge", e.getStage());
    assertEquals(1, transport.requestCount());
    assertTrue(Files.notExists(dir.resolve("processed").resolve("merged_data.csv")));
  }

  @Test void testRerunReusesStoredPayloads(@TempDir Path dir) throws IOException {
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).reuseRawPayloads(true).build();
    RunSummary first = pipeline(config, withChicagoDemand(upstream())).run(START, END);

    RoutingTransport offline = new RoutingTransport();
    RunSummary second = pipeline(config, offline).run(START, END);

    assertEquals(0, offline.requestCount());
    for (SourceResult result : second.getSourceResults()) {
      assertEquals(SourceResult.Status.REUSED, result.getStatus());
    }
    assertEquals(CityStatus.OK, second.getCityStatus("Chicago"));
    assertEquals(first.getCorrelation().getGlobal(), second.getCorrelation().getGlobal());
    assertEquals(first.getQualityReport().getTotalRows(),
        second.getQualityReport().getTotalRows());
  }

  @Test void testLookbackWindowEndsToday(@TempDir Path dir) throws IOException {
    PipelineConfig config = SourceFixtures.pipelineConfig(dir).lookbackDays(7).build();
    RoutingTransport transport = new RoutingTransport();

    RunSummary summary = pipeline(config, transport).run();

    assertEquals(LocalDate.of(2024, 3, 3), summary.getStartDate());
    assertEquals(LocalDate.of(2024, 3, 10), summary.getEndDate());
    assertThat(transport.requestCount(), greaterThan(0));
    for (String url : transport.getUrls()) {
      assertThat(url, containsString("2024-03-03"));
    }
  }

  @Test void testInvertedRangeRejected(@TempDir Path dir) {
    WeatherDemandPipeline pipeline =
        pipeline(SourceFixtures.pipelineConfig(dir).build(), new RoutingTransport());

    assertThrows(IllegalArgumentException.class, () -> pipeline.run(END, START));
  }
}
