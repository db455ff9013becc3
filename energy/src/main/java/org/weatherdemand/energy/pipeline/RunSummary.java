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
import org.weatherdemand.energy.stats.CorrelationReport;
import org.weatherdemand.energy.stats.DemandLevel;
import org.weatherdemand.etl.SourceResult;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one pipeline run.
 *
 * <p>Lists the outcome of every (source, city) fetch, a status per city,
 * the quality report, the correlation report, the demand level of each
 * city's latest day, and where the artifacts were written.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RunSummary summary = pipeline.run();
 * for (Map.Entry<String, CityStatus> e : summary.getCityStatus().entrySet()) {
 *   System.out.println(e.getKey() + ": " + e.getValue());
 * }
 * System.out.println(summary.getCorrelation().getGlobal());
 * }</pre>
 *
 * @see WeatherDemandPipeline
 */
public final class RunSummary {
  private final String runId;
  private final LocalDate startDate;
  private final LocalDate endDate;
  private final ImmutableList<SourceResult> sourceResults;
  private final ImmutableSortedMap<String, CityStatus> cityStatus;
  private final QualityReport qualityReport;
  private final CorrelationReport correlation;
  private final ImmutableSortedMap<String, DemandLevel> latestDemandLevels;
  private final String processedPath;
  private final String reportPath;
  private final long elapsedMs;

  private RunSummary(Builder builder) {
    this.runId = builder.runId;
    this.startDate = builder.startDate;
    this.endDate = builder.endDate;
    this.sourceResults = ImmutableList.copyOf(builder.sourceResults);
    this.cityStatus = ImmutableSortedMap.copyOf(builder.cityStatus);
    this.qualityReport = builder.qualityReport;
    this.correlation = builder.correlation;
    this.latestDemandLevels = ImmutableSortedMap.copyOf(builder.latestDemandLevels);
    this.processedPath = builder.processedPath;
    this.reportPath = builder.reportPath;
    this.elapsedMs = builder.elapsedMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getRunId() {
    return runId;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public ImmutableList<SourceResult> getSourceResults() {
    return sourceResults;
  }

  public ImmutableSortedMap<String, CityStatus> getCityStatus() {
    return cityStatus;
  }

  public CityStatus getCityStatus(String city) {
    CityStatus status = cityStatus.get(city);
    if (status == null) {
      throw new IllegalArgumentException("City not part of this run: " + city);
    }
    return status;
  }

  public int getFailedFetches() {
    int failed = 0;
    for (SourceResult result : sourceResults) {
      if (result.isError()) {
        failed++;
      }
    }
    return failed;
  }

  public QualityReport getQualityReport() {
    return qualityReport;
  }

  public CorrelationReport getCorrelation() {
    return correlation;
  }

  /** Demand level of each city's most recent row; cities with no rows are absent. */
  public ImmutableSortedMap<String, DemandLevel> getLatestDemandLevels() {
    return latestDemandLevels;
  }

  public String getProcessedPath() {
    return processedPath;
  }

  public String getReportPath() {
    return reportPath;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    return "RunSummary{runId=" + runId
        + ", range=" + startDate + ".." + endDate
        + ", fetches=" + sourceResults.size()
        + ", failed=" + getFailedFetches()
        + ", cities=" + cityStatus
        + ", rows=" + qualityReport.getTotalRows()
        + ", elapsed=" + elapsedMs + "ms}";
  }

  /**
   * Builder for RunSummary.
   */
  public static class Builder {
    private String runId;
    private LocalDate startDate;
    private LocalDate endDate;
    private final List<SourceResult> sourceResults = new ArrayList<SourceResult>();
    private final Map<String, CityStatus> cityStatus = new TreeMap<String, CityStatus>();
    private QualityReport qualityReport;
    private CorrelationReport correlation;
    private final Map<String, DemandLevel> latestDemandLevels =
        new TreeMap<String, DemandLevel>();
    private String processedPath;
    private String reportPath;
    private long elapsedMs;

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public Builder dateRange(LocalDate startDate, LocalDate endDate) {
      this.startDate = startDate;
      this.endDate = endDate;
      return this;
    }

    public Builder sourceResults(List<SourceResult> results) {
      this.sourceResults.addAll(results);
      return this;
    }

    public Builder cityStatus(String city, CityStatus status) {
      this.cityStatus.put(city, status);
      return this;
    }

    public Builder qualityReport(QualityReport qualityReport) {
      this.qualityReport = qualityReport;
      return this;
    }

    public Builder correlation(CorrelationReport correlation) {
      this.correlation = correlation;
      return this;
    }

    public Builder latestDemandLevel(String city, DemandLevel level) {
      this.latestDemandLevels.put(city, level);
      return this;
    }

    public Builder processedPath(String processedPath) {
      this.processedPath = processedPath;
      return this;
    }

    public Builder reportPath(String reportPath) {
      this.reportPath = reportPath;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public RunSummary build() {
      return new RunSummary(this);
    }
  }
}
