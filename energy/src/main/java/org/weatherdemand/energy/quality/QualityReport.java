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
package org.weatherdemand.energy.quality;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable summary of one validation run.
 *
 * <p>Outlier totals are always the sum of the per-city counts.
 *
 * @see QualityReportJson
 */
public final class QualityReport {
  private final String runId;
  private final Instant generatedAt;
  private final int totalRows;
  private final int flaggedRows;
  private final ImmutableSortedMap<String, Integer> missingValues;
  private final OutlierCounts outliers;
  private final ImmutableSortedMap<String, OutlierCounts> outliersByCity;
  private final FreshnessCheck freshness;
  private final ImmutableSortedMap<String, Integer> joinLosses;
  private final ImmutableList<ValidationWarning> warnings;

  private QualityReport(Builder builder) {
    this.runId = Objects.requireNonNull(builder.runId, "runId");
    this.generatedAt = Objects.requireNonNull(builder.generatedAt, "generatedAt");
    this.totalRows = builder.totalRows;
    this.flaggedRows = builder.flaggedRows;
    this.missingValues = ImmutableSortedMap.copyOf(builder.missingValues);
    this.outliersByCity = ImmutableSortedMap.copyOf(builder.outliersByCity);
    this.outliers = OutlierCounts.sum(outliersByCity.values());
    this.freshness = Objects.requireNonNull(builder.freshness, "freshness");
    this.joinLosses = ImmutableSortedMap.copyOf(builder.joinLosses);
    this.warnings = ImmutableList.copyOf(builder.warnings);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getRunId() {
    return runId;
  }

  public Instant getGeneratedAt() {
    return generatedAt;
  }

  public int getTotalRows() {
    return totalRows;
  }

  public int getFlaggedRows() {
    return flaggedRows;
  }

  /** Null counts per column ({@code temperature}, {@code demand}). */
  public ImmutableSortedMap<String, Integer> getMissingValues() {
    return missingValues;
  }

  public int getMissing(String column) {
    Integer count = missingValues.get(column);
    return count == null ? 0 : count;
  }

  /** Outlier totals across all cities. */
  public OutlierCounts getOutliers() {
    return outliers;
  }

  public ImmutableSortedMap<String, OutlierCounts> getOutliersByCity() {
    return outliersByCity;
  }

  public FreshnessCheck getFreshness() {
    return freshness;
  }

  public ImmutableSortedMap<String, Integer> getJoinLosses() {
    return joinLosses;
  }

  public ImmutableList<ValidationWarning> getWarnings() {
    return warnings;
  }

  @Override public String toString() {
    return "QualityReport{runId=" + runId
        + ", rows=" + totalRows
        + ", flagged=" + flaggedRows
        + ", missing=" + missingValues
        + ", outliers=" + outliers
        + ", freshness=" + freshness
        + ", warnings=" + warnings.size() + "}";
  }

  /**
   * Builder for QualityReport.
   */
  public static class Builder {
    private String runId;
    private Instant generatedAt;
    private int totalRows;
    private int flaggedRows;
    private final Map<String, Integer> missingValues = new TreeMap<String, Integer>();
    private final Map<String, OutlierCounts> outliersByCity = new TreeMap<String, OutlierCounts>();
    private FreshnessCheck freshness;
    private final Map<String, Integer> joinLosses = new TreeMap<String, Integer>();
    private final List<ValidationWarning> warnings = new ArrayList<ValidationWarning>();

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public Builder generatedAt(Instant generatedAt) {
      this.generatedAt = generatedAt;
      return this;
    }

    public Builder totalRows(int totalRows) {
      this.totalRows = totalRows;
      return this;
    }

    public Builder flaggedRows(int flaggedRows) {
      this.flaggedRows = flaggedRows;
      return this;
    }

    public Builder missing(String column, int count) {
      this.missingValues.put(column, count);
      return this;
    }

    public Builder cityOutliers(String city, OutlierCounts counts) {
      this.outliersByCity.put(city, counts);
      return this;
    }

    public Builder freshness(FreshnessCheck freshness) {
      this.freshness = freshness;
      return this;
    }

    public Builder joinLosses(Map<String, Integer> joinLosses) {
      this.joinLosses.putAll(joinLosses);
      return this;
    }

    public Builder warning(ValidationWarning warning) {
      this.warnings.add(warning);
      return this;
    }

    public QualityReport build() {
      return new QualityReport(this);
    }
  }
}
