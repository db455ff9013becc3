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

import org.weatherdemand.energy.quality.QualityReport;
import org.weatherdemand.energy.quality.QualityReportJson;
import org.weatherdemand.etl.storage.StorageProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Archives quality reports, one JSON file per run id. An existing report is
 * never overwritten.
 */
public class QualityReportStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(QualityReportStore.class);

  private final StorageProvider storage;
  private final String directory;

  public QualityReportStore(StorageProvider storage, String directory) {
    this.storage = storage;
    this.directory = directory;
  }

  public String pathFor(String runId) {
    return storage.resolvePath(directory, "quality_report_" + runId + ".json");
  }

  /**
   * Writes the report unless one already exists for its run id.
   *
   * @return path of the report file
   */
  public String write(QualityReport report) throws IOException {
    String path = pathFor(report.getRunId());
    if (storage.writeFileIfAbsent(path, QualityReportJson.toBytes(report))) {
      LOGGER.info("Wrote quality report {}", path);
    } else {
      LOGGER.warn("Quality report {} already exists; keeping the archived copy", path);
    }
    return path;
  }
}
