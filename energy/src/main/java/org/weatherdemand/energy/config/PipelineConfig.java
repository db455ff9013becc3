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
package org.weatherdemand.energy.config;

import org.weatherdemand.etl.HttpSourceConfig;
import org.weatherdemand.etl.RetryPolicy;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable configuration for a pipeline run, built once and passed to every
 * component.
 *
 * <p>Build it in code with {@link #builder()} or from YAML with
 * {@link PipelineConfigReader}. The pipeline-level {@link RetryPolicy} is
 * applied to both source endpoints.
 */
public final class PipelineConfig {

  private final ImmutableList<CityEntry> cities;
  private final CityRegistry cityRegistry;
  private final QualitySettings quality;
  private final CorrelationSettings correlation;
  private final RetryPolicy retry;
  private final HttpSourceConfig noaaSource;
  private final HttpSourceConfig eiaSource;
  private final int fetchWorkers;
  private final int lookbackDays;
  private final boolean reuseRawPayloads;
  private final String rawDirectory;
  private final String processedDirectory;
  private final String reportDirectory;

  private PipelineConfig(Builder builder) {
    this.cities = ImmutableList.copyOf(builder.cities);
    this.cityRegistry = new CityRegistry(cities);
    this.quality = builder.quality;
    this.correlation = builder.correlation;
    this.retry = builder.retry;
    this.noaaSource = builder.noaaSource.toBuilder().retry(builder.retry).build();
    this.eiaSource = builder.eiaSource.toBuilder().retry(builder.retry).build();
    this.fetchWorkers = builder.fetchWorkers;
    this.lookbackDays = builder.lookbackDays;
    this.reuseRawPayloads = builder.reuseRawPayloads;
    this.rawDirectory = builder.rawDirectory;
    this.processedDirectory = builder.processedDirectory;
    this.reportDirectory = builder.reportDirectory;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .cities(cities)
        .quality(quality)
        .correlation(correlation)
        .retry(retry)
        .noaaSource(noaaSource)
        .eiaSource(eiaSource)
        .fetchWorkers(fetchWorkers)
        .lookbackDays(lookbackDays)
        .reuseRawPayloads(reuseRawPayloads)
        .rawDirectory(rawDirectory)
        .processedDirectory(processedDirectory)
        .reportDirectory(reportDirectory);
  }

  public ImmutableList<CityEntry> getCities() {
    return cities;
  }

  public CityRegistry getCityRegistry() {
    return cityRegistry;
  }

  public QualitySettings getQuality() {
    return quality;
  }

  public CorrelationSettings getCorrelation() {
    return correlation;
  }

  public RetryPolicy getRetry() {
    return retry;
  }

  public HttpSourceConfig getNoaaSource() {
    return noaaSource;
  }

  public HttpSourceConfig getEiaSource() {
    return eiaSource;
  }

  public int getFetchWorkers() {
    return fetchWorkers;
  }

  public int getLookbackDays() {
    return lookbackDays;
  }

  public boolean isReuseRawPayloads() {
    return reuseRawPayloads;
  }

  public String getRawDirectory() {
    return rawDirectory;
  }

  public String getProcessedDirectory() {
    return processedDirectory;
  }

  public String getReportDirectory() {
    return reportDirectory;
  }

  /**
   * Thresholds used by the quality validator.
   */
  public static final class QualitySettings {
    private static final QualitySettings DEFAULTS = new QualitySettings(-50, 130, 3.0, 2);

    private final double temperatureMinF;
    private final double temperatureMaxF;
    private final double demandSpikeMultiplier;
    private final int freshnessMaxAgeDays;

    public QualitySettings(double temperatureMinF, double temperatureMaxF,
        double demandSpikeMultiplier, int freshnessMaxAgeDays) {
      if (temperatureMinF >= temperatureMaxF) {
        throw new IllegalArgumentException("temperatureMinF must be below temperatureMaxF");
      }
      if (demandSpikeMultiplier <= 0) {
        throw new IllegalArgumentException("demandSpikeMultiplier must be positive");
      }
      if (freshnessMaxAgeDays < 0) {
        throw new IllegalArgumentException("freshnessMaxAgeDays must not be negative");
      }
      this.temperatureMinF = temperatureMinF;
      this.temperatureMaxF = temperatureMaxF;
      this.demandSpikeMultiplier = demandSpikeMultiplier;
      this.freshnessMaxAgeDays = freshnessMaxAgeDays;
    }

    /** [-50, 130] °F, spike multiplier 3, fresh within 2 days. */
    public static QualitySettings defaults() {
      return DEFAULTS;
    }

    public double getTemperatureMinF() {
      return temperatureMinF;
    }

    public double getTemperatureMaxF() {
      return temperatureMaxF;
    }

    public double getDemandSpikeMultiplier() {
      return demandSpikeMultiplier;
    }

    public int getFreshnessMaxAgeDays() {
      return freshnessMaxAgeDays;
    }
  }

  /**
   * Cutoffs and guards used by the correlation engine.
   */
  public static final class CorrelationSettings {
    private static final CorrelationSettings DEFAULTS =
        new CorrelationSettings(0.7, 0.4, 3, true);

    private final double strongCutoff;
    private final double moderateCutoff;
    private final int minSampleSize;
    private final boolean combinedEstimate;

    public CorrelationSettings(double strongCutoff, double moderateCutoff, int minSampleSize,
        boolean combinedEstimate) {
      if (!(moderateCutoff > 0 && moderateCutoff < strongCutoff && strongCutoff <= 1)) {
        throw new IllegalArgumentException(
            "Cutoffs must satisfy 0 < moderate < strong <= 1, got moderate=" + moderateCutoff
                + ", strong=" + strongCutoff);
      }
      if (minSampleSize < 3) {
        throw new IllegalArgumentException("minSampleSize must be at least 3");
      }
      this.strongCutoff = strongCutoff;
      this.moderateCutoff = moderateCutoff;
      this.minSampleSize = minSampleSize;
      this.combinedEstimate = combinedEstimate;
    }

    /** |r| ≥ 0.7 strong, ≥ 0.4 moderate, at least 3 rows, combined estimate on. */
    public static CorrelationSettings defaults() {
      return DEFAULTS;
    }

    public double getStrongCutoff() {
      return strongCutoff;
    }

    public double getModerateCutoff() {
      return moderateCutoff;
    }

    public int getMinSampleSize() {
      return minSampleSize;
    }

    public boolean isCombinedEstimate() {
      return combinedEstimate;
    }
  }

  /**
   * Builder for PipelineConfig.
   */
  public static class Builder {
    private final List<CityEntry> cities = new ArrayList<CityEntry>();
    private QualitySettings quality = QualitySettings.defaults();
    private CorrelationSettings correlation = CorrelationSettings.defaults();
    private RetryPolicy retry = RetryPolicy.defaults();
    private HttpSourceConfig noaaSource = SourceDefaults.noaa();
    private HttpSourceConfig eiaSource = SourceDefaults.eia();
    private int fetchWorkers = 4;
    private int lookbackDays = 90;
    private boolean reuseRawPayloads;
    private String rawDirectory = "data/raw";
    private String processedDirectory = "data/processed";
    private String reportDirectory = "data/reports";

    public Builder city(CityEntry city) {
      this.cities.add(city);
      return this;
    }

    public Builder cities(List<CityEntry> cities) {
      this.cities.clear();
      this.cities.addAll(cities);
      return this;
    }

    public Builder quality(QualitySettings quality) {
      this.quality = quality;
      return this;
    }

    public Builder correlation(CorrelationSettings correlation) {
      this.correlation = correlation;
      return this;
    }

    public Builder retry(RetryPolicy retry) {
      this.retry = retry;
      return this;
    }

    public Builder noaaSource(HttpSourceConfig noaaSource) {
      this.noaaSource = noaaSource;
      return this;
    }

    public Builder eiaSource(HttpSourceConfig eiaSource) {
      this.eiaSource = eiaSource;
      return this;
    }

    public Builder fetchWorkers(int fetchWorkers) {
      this.fetchWorkers = fetchWorkers;
      return this;
    }

    public Builder lookbackDays(int lookbackDays) {
      this.lookbackDays = lookbackDays;
      return this;
    }

    public Builder reuseRawPayloads(boolean reuseRawPayloads) {
      this.reuseRawPayloads = reuseRawPayloads;
      return this;
    }

    public Builder rawDirectory(String rawDirectory) {
      this.rawDirectory = rawDirectory;
      return this;
    }

    public Builder processedDirectory(String processedDirectory) {
      this.processedDirectory = processedDirectory;
      return this;
    }

    public Builder reportDirectory(String reportDirectory) {
      this.reportDirectory = reportDirectory;
      return this;
    }

    public PipelineConfig build() {
      if (cities.isEmpty()) {
        throw new IllegalArgumentException("At least one city is required");
      }
      if (fetchWorkers < 1) {
        throw new IllegalArgumentException("fetchWorkers must be at least 1");
      }
      if (lookbackDays < 0) {
        throw new IllegalArgumentException("lookbackDays must not be negative");
      }
      if (quality == null || correlation == null || retry == null
          || noaaSource == null || eiaSource == null) {
        throw new IllegalArgumentException("Settings must not be null");
      }
      return new PipelineConfig(this);
    }
  }
}
