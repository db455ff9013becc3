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

import org.weatherdemand.energy.model.MergedRecord;
import org.weatherdemand.etl.storage.StorageProvider;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the validated table as CSV, replacing the previous run's file.
 *
 * <p>Columns: {@code city,date,temperature,demand,is_weekend,excluded_from_stats}.
 * Missing values are written as empty fields.
 */
public class ProcessedTableWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessedTableWriter.class);

  public static final String FILE_NAME = "merged_data.csv";

  static final String[] HEADER = {
      "city", "date", "temperature", "demand", "is_weekend", "excluded_from_stats"
  };

  private final StorageProvider storage;
  private final String directory;

  public ProcessedTableWriter(StorageProvider storage, String directory) {
    this.storage = storage;
    this.directory = directory;
  }

  public String pathFor() {
    return storage.resolvePath(directory, FILE_NAME);
  }

  /**
   * Writes the records in the order given. The table is rendered in memory
   * and handed to the storage provider as one write, so a failure leaves the
   * previous run's file in place.
   *
   * @return path of the written file
   */
  public String write(List<MergedRecord> records) throws IOException {
    String path = pathFor();
    StringWriter buffer = new StringWriter();
    try (ICSVWriter csv = new CSVWriterBuilder(buffer).withLineEnd("\n").build()) {
      csv.writeNext(HEADER, false);
      for (MergedRecord r : records) {
        csv.writeNext(new String[] {
            r.getCity(),
            r.getDate().toString(),
            format(r.getTemperatureF()),
            format(r.getDemandMw()),
            Boolean.toString(r.isWeekend()),
            Boolean.toString(r.isExcludedFromStats())
        }, false);
      }
      csv.flush();
    }
    storage.writeFile(path, buffer.toString().getBytes(StandardCharsets.UTF_8));
    LOGGER.info("Wrote {} rows to {}", records.size(), path);
    return path;
  }

  private static String format(@Nullable Double value) {
    return value == null ? "" : value.toString();
  }
}
