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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes temperature/demand correlation over valid rows, pooled and per
 * city.
 *
 * <p>A row is valid when it is not excluded from statistics, has both a
 * temperature and a demand value, the temperature lies within the quality
 * bounds and the demand is not negative. The bounds hold here whether or not
 * the rows were validated first. Strength is classified on |r| against the
 * configured cutoffs; fewer valid rows than the minimum sample size, or zero
 * variance, gives {@link CorrelationStrength#INSUFFICIENT}.
 */
public class CorrelationEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationEngine.class);

  private final CorrelationSettings settings;
  private final QualitySettings bounds;

  public CorrelationEngine(CorrelationSettings settings) {
    this(settings, QualitySettings.defaults());
  }

  public CorrelationEngine(CorrelationSettings settings, QualitySettings bounds) {
    this.settings = settings;
    this.bounds = bounds;
  }

  public CorrelationReport analyze(List<MergedRecord> records) {
    List<MergedRecord> pooled = new ArrayList<MergedRecord>();
    Map<String, List<MergedRecord>> byCity = new TreeMap<String, List<MergedRecord>>();
    for (MergedRecord r : records) {
      List<MergedRecord> cityRows = byCity.get(r.getCity());
      if (cityRows == null) {
        cityRows = new ArrayList<MergedRecord>();
        byCity.put(r.getCity(), cityRows);
      }
      if (usable(r)) {
        pooled.add(r);
        cityRows.add(r);
      }
    }

    CorrelationResult global = correlate(CorrelationResult.GLOBAL, pooled);
    Map<String, CorrelationResult> perCity = new TreeMap<String, CorrelationResult>();
    for (Map.Entry<String, List<MergedRecord>> e : byCity.entrySet()) {
      perCity.put(e.getKey(), correlate(e.getKey(), e.getValue()));
    }
    Double combined = settings.isCombinedEstimate() ? fisherCombined(perCity.values()) : null;

    LOGGER.info("Correlation: {}", global);
    for (CorrelationResult result : perCity.values()) {
      LOGGER.info("Correlation: {}", result);
    }
    if (combined != null) {
      LOGGER.info("Combined per-city estimate (Fisher z): {}", String.format("%.3f", combined));
    }
    return new CorrelationReport(global, perCity, combined);
  }

  boolean usable(MergedRecord r) {
    if (!r.isValidForStats()) {
      return false;
    }
    double temperature = r.getTemperatureF();
    return temperature >= bounds.getTemperatureMinF()
        && temperature <= bounds.getTemperatureMaxF()
        && r.getDemandMw() >= 0;
  }

  CorrelationResult correlate(String scope, List<MergedRecord> valid) {
    int n = valid.size();
    if (n < settings.getMinSampleSize()) {
      return new CorrelationResult(scope, null, n, CorrelationStrength.INSUFFICIENT);
    }
    double[] temperature = new double[n];
    double[] demand = new double[n];
    for (int i = 0; i < n; i++) {
      temperature[i] = valid.get(i).getTemperatureF();
      demand[i] = valid.get(i).getDemandMw();
    }
    Double r = PearsonCorrelation.compute(temperature, demand);
    if (r == null) {
      return new CorrelationResult(scope, null, n, CorrelationStrength.INSUFFICIENT);
    }
    return new CorrelationResult(scope, r, n, classify(r));
  }

  public CorrelationStrength classify(double r) {
    double magnitude = Math.abs(r);
    if (magnitude >= settings.getStrongCutoff()) {
      return CorrelationStrength.STRONG;
    }
    if (magnitude >= settings.getModerateCutoff()) {
      return CorrelationStrength.MODERATE;
    }
    return CorrelationStrength.WEAK;
  }

  /**
   * Weighted mean of {@code atanh(r)} with weights {@code n - 3}, mapped back
   * through {@code tanh}. Cities with {@code n <= 3}, no coefficient, or
   * {@code |r| = 1} do not contribute. Returns null when none do.
   */
  static @Nullable Double fisherCombined(Iterable<CorrelationResult> results) {
    double weightedZ = 0;
    double totalWeight = 0;
    for (CorrelationResult result : results) {
      Double r = result.getR();
      if (r == null || result.getSampleSize() <= 3 || Math.abs(r) >= 1.0) {
        continue;
      }
      double z = 0.5 * Math.log((1 + r) / (1 - r));
      double weight = result.getSampleSize() - 3;
      weightedZ += weight * z;
      totalWeight += weight;
    }
    if (totalWeight == 0) {
      return null;
    }
    return Math.tanh(weightedZ / totalWeight);
  }
}
