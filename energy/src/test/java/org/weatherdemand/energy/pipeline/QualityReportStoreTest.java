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

import org.weatherdemand.energy.config.PipelineConfig.QualitySettings;
import org.weatherdemand.energy.model.MergedRecord;
import org.weatherdemand.energy.quality.QualityReport;
import org.weatherdemand.energy.quality.QualityValidator;
import org.weatherdemand.etl.storage.LocalFileStorageProvider;

import com.google.common.collect.ImmutableList;

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
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link QualityReportStore} and {@link ProcessedTableWriter}.
 */
@Tag("unit")
public class QualityReportStoreTest {
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-03-10T00:00:00Z"), ZoneOffset.UTC);

  private static QualityReport report(String runId, int rows) {
    ImmutableList.Builder<MergedRecord> records = ImmutableList.builder();
    for (int i = 0; i < rows; i++) {
      records.add(new MergedRecord("Houston", LocalDate.of(2024, 3, 1).plusDays(i), 70.0,
          40_000.0));
    }
    return new QualityValidator(QualitySettings.defaults(), CLOCK)
        .validate(records.build(), runId).getReport();
  }

  @Test void testExistingReportNeverOverwritten(@TempDir Path dir) throws IOException {
    QualityReportStore store =
        new QualityReportStore(new LocalFileStorageProvider(), dir.toString());

    String path = store.write(report("run-1", 3));
    String again = store.write(report("run-1", 5));

    assertEquals(path, again);
    assertEquals(dir.resolve("quality_report_run-1.json"), Paths.get(path));
    String json = new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8);
    assertThat(json, containsString("\"totalRows\" : 3"));
    assertThat(json, not(containsString("\"totalRows\" : 5")));
  }

  @Test void testOneFilePerRun(@TempDir Path dir) throws IOException {
    QualityReportStore store =
        new QualityReportStore(new LocalFileStorageProvider(), dir.toString());

    store.write(report("run-1", 1));
    store.write(report("run-2", 1));

    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(2, files.count());
    }
  }

  @Test void testProcessedTableReplacedEachRun(@TempDir Path dir) throws IOException {
    ProcessedTableWriter writer =
        new ProcessedTableWriter(new LocalFileStorageProvider(), dir.toString());
    MergedRecord excluded = new MergedRecord("New York", LocalDate.of(2024, 3, 2), null, -4.0)
        .excluded("demand:negative");

    writer.write(ImmutableList.of(
        new MergedRecord("New York", LocalDate.of(2024, 3, 1), 41.5, 1200.0), excluded));
    String path = writer.write(ImmutableList.of(excluded));

    assertEquals(ImmutableList.of(
            "city,date,temperature,demand,is_weekend,excluded_from_stats",
            "New York,2024-03-02,,-4.0,true,true"),
        Files.readAllLines(Paths.get(path), StandardCharsets.UTF_8));
  }

  @Test void testFailedWriteKeepsPreviousTable(@TempDir Path dir) throws IOException {
    new ProcessedTableWriter(new LocalFileStorageProvider(), dir.toString())
        .write(ImmutableList.of(
            new MergedRecord("New York", LocalDate.of(2024, 3, 1), 41.5, 1200.0)));
    LocalFileStorageProvider full = new LocalFileStorageProvider() {
      @Override public void writeFile(String path, byte[] content) throws IOException {
        throw new IOException("No space left on device");
      }
    };
    ProcessedTableWriter writer = new ProcessedTableWriter(full, dir.toString());

    assertThrows(IOException.class, () -> writer.write(ImmutableList.of(
        new MergedRecord("Chicago", LocalDate.of(2024, 3, 1), 20.0, 900.0))));

    assertEquals(ImmutableList.of(
            "city,date,temperature,demand,is_weekend,excluded_from_stats",
            "New York,2024-03-01,41.5,1200.0,false,false"),
        Files.readAllLines(Paths.get(writer.pathFor()), StandardCharsets.UTF_8));
  }
}
