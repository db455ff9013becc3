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

import org.weatherdemand.energy.config.PipelineConfig.QualitySettings;
import org.weatherdemand.energy.merge.MergeResult;
import org.weatherdemand.energy.model.MergedRecord;
import org.weatherdemand.energy.stats.DemandQuantiles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checks the merged table and produces a {@link QualityReport}.
 *
 * <p>Checks run in a fixed order:
 * <ol>
 *   <li>Missing values: nulls per column; rows are not changed.</li>
 *   <li>Outliers: temperature outside the configured bounds
 *       ({@code temperature:range}), negative demand
 *       ({@code demand:negative}), and demand above
 *       {@code Q3 + multiplier * IQR} of the city's non-negative demand
 *       ({@code demand:spike}). Flagged rows stay in the table, excluded
 *       from statistics, with the reasons joined by {@code ;}.</li>
 *   <li>Freshness: days from the newest date to today. Stale data is a
 *       warning only.</li>
 * </ol>
 *
 * <p>The result depends only on the input, the settings, the run id and the
 * clock.
 */
public class QualityValidator {
  private static final Logger LOGGER = LoggerFactory.getLogger(QualityValidator.class);

  public static final String TEMPERATURE = "temperature";
  public static final String DEMAND = "demand";

  /** Fewer non-negative demand values than this and the spike check is skipped. */
  static final int MIN_SPIKE_SAMPLE = 4;

  private final QualitySettings settings;
  private final Clock clock;

  public QualityValidator(QualitySettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
  }

  public ValidationOutcome validate(MergeResult merged, String runId) {
    return validate(merged.getRecords(), merged.getJoinLosses(), runId);
  }

  public ValidationOutcome validate(List<MergedRecord> records, String runId) {
    return validate(records, Collections.<String, Integer>emptyMap(), runId);
  }

  private ValidationOutcome validate(List<MergedRecord> records,
      Map<String, Integer> joinLosses, String runId) {
    QualityReport.Builder report = QualityReport.builder()
        .runId(runId)
        .generatedAt(Instant.now(clock))
        .totalRows(records.size())
        .joinLosses(joinLosses);

    // 1. Missing values
    int missingTemperature = 0;
    int missingDemand = 0;
    for (MergedRecord r : records) {
      if (r.getTemperatureF() == null) {
        missingTemperature++;
      }
      if (r.getDemandMw() == null) {
        missingDemand++;
      }
    }
    report.missing(TEMPERATURE, missingTemperature).missing(DEMAND, missingDemand);

    // 2. Outliers
    Map<String, Double> spikeFences = spikeFences(records, report);
    Map<String, OutlierCounts.Builder> byCity = new TreeMap<String, OutlierCounts.Builder>();
    List<MergedRecord> checked = new ArrayList<MergedRecord>(records.size());
    int flaggedRows = 0;

    for (MergedRecord r : records) {
      OutlierCounts.Builder cityCounts = byCity.get(r.getCity());
      if (cityCounts == null) {
        cityCounts = OutlierCounts.builder();
        byCity.put(r.getCity(), cityCounts);
      }

      List<OutlierKey> reasons = new ArrayList<OutlierKey>(2);
      Double temperature = r.getTemperatureF();
      if (temperature != null
          && (temperature < settings.getTemperatureMinF()
              || temperature > settings.getTemperatureMaxF())) {
        reasons.add(OutlierKey.TEMPERATURE_RANGE);
      }
      Double demand = r.getDemandMw();
      if (demand != null) {
        Double fence = spikeFences.get(r.getCity());
        if (demand < 0) {
          reasons.add(OutlierKey.DEMAND_NEGATIVE);
        } else if (fence != null && demand > fence) {
          reasons.add(OutlierKey.DEMAND_SPIKE);
        }
      }

      if (reasons.isEmpty()) {
        checked.add(r);
        continue;
      }
      StringBuilder reason = new StringBuilder();
      for (OutlierKey key : reasons) {
        cityCounts.increment(key);
        if (reason.length() > 0) {
          reason.append(';');
        }
        reason.append(key);
      }
      checked.add(r.excluded(reason.toString()));
      flaggedRows++;
    }
    for (Map.Entry<String, OutlierCounts.Builder> e : byCity.entrySet()) {
      report.cityOutliers(e.getKey(), e.getValue().build());
    }
    report.flaggedRows(flaggedRows);

    // 3. Freshness
    FreshnessCheck freshness = checkFreshness(records);
    report.freshness(freshness);
    if (records.isEmpty()) {
      report.warning(new ValidationWarning(ValidationWarning.EMPTY_TABLE,
          "Merged table has no rows"));
    } else if (freshness.getStatus() == FreshnessStatus.STALE) {
      report.warning(new ValidationWarning(ValidationWarning.STALE_DATA,
          "Latest date " + freshness.getLatestDate() + " is " + freshness.getAgeDays()
              + " days old (limit " + settings.getFreshnessMaxAgeDays() + ")"));
    }
    int lost = 0;
    for (int count : joinLosses.values()) {
      lost += count;
    }
    if (lost > 0) {
      report.warning(new ValidationWarning(ValidationWarning.JOIN_LOSS,
          lost + " source rows dropped by the join: " + new TreeMap<String, Integer>(joinLosses)));
    }

    QualityReport built = report.build();
    LOGGER.info("Validated {} rows: {} flagged, missing {}, outliers {}, {}",
        records.size(), flaggedRows, built.getMissingValues(), built.getOutliers(),
        freshness.getStatus());
    return new ValidationOutcome(checked, built);
  }

  /**
   * Spike fence per city, over the city's non-negative demand values.
   */
  private Map<String, Double> spikeFences(List<MergedRecord> records,
      QualityReport.Builder report) {
    Map<String, List<Double>> demandByCity = new TreeMap<String, List<Double>>();
    for (MergedRecord r : records) {
      List<Double> values = demandByCity.get(r.getCity());
      if (values == null) {
        values = new ArrayList<Double>();
        demandByCity.put(r.getCity(), values);
      }
      Double demand = r.getDemandMw();
      if (demand != null && demand >= 0) {
        values.add(demand);
      }
    }

    Map<String, Double> fences = new TreeMap<String, Double>();
    for (Map.Entry<String, List<Double>> e : demandByCity.entrySet()) {
      if (e.getValue().size() < MIN_SPIKE_SAMPLE) {
        report.warning(new ValidationWarning(ValidationWarning.SPIKE_CHECK_SKIPPED,
            e.getKey() + " has " + e.getValue().size()
                + " demand values; spike check needs " + MIN_SPIKE_SAMPLE));
        continue;
      }
      fences.put(e.getKey(),
          DemandQuantiles.of(e.getValue()).upperFence(settings.getDemandSpikeMultiplier()));
    }
    return fences;
  }

  private FreshnessCheck checkFreshness(List<MergedRecord> records) {
    int maxAge = settings.getFreshnessMaxAgeDays();
    LocalDate latest = null;
    for (MergedRecord r : records) {
      if (latest == null || r.getDate().isAfter(latest)) {
        latest = r.getDate();
      }
    }
    if (latest == null) {
      return new FreshnessCheck(FreshnessStatus.STALE, null, null, maxAge);
    }
    long age = ChronoUnit.DAYS.between(latest, LocalDate.now(clock));
    FreshnessStatus status = age <= maxAge ? FreshnessStatus.FRESH : FreshnessStatus.STALE;
    return new FreshnessCheck(status, latest, age, maxAge);
  }
}
