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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a {@link QualityReport} to JSON.
 *
 * <p>Map keys are written in sorted order and timestamps as ISO-8601 text,
 * so equal reports produce identical bytes.
 */
public final class QualityReportJson {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .enable(SerializationFeature.INDENT_OUTPUT);

  private QualityReportJson() {
  }

  public static byte[] toBytes(QualityReport report) throws JsonProcessingException {
    return MAPPER.writeValueAsBytes(toMap(report));
  }

  public static String toJson(QualityReport report) throws JsonProcessingException {
    return MAPPER.writeValueAsString(toMap(report));
  }

  static Map<String, Object> toMap(QualityReport report) {
    Map<String, Object> root = new TreeMap<String, Object>();
    root.put("runId", report.getRunId());
    root.put("generatedAt", report.getGeneratedAt());
    root.put("totalRows", report.getTotalRows());
    root.put("flaggedRows", report.getFlaggedRows());
    root.put("missingValues", report.getMissingValues());
    root.put("outliers", outlierMap(report.getOutliers()));

    Map<String, Object> byCity = new TreeMap<String, Object>();
    for (Map.Entry<String, OutlierCounts> e : report.getOutliersByCity().entrySet()) {
      byCity.put(e.getKey(), outlierMap(e.getValue()));
    }
    root.put("outliersByCity", byCity);

    FreshnessCheck freshness = report.getFreshness();
    Map<String, Object> fresh = new TreeMap<String, Object>();
    fresh.put("status", freshness.getStatus().name());
    fresh.put("latestDate", freshness.getLatestDate());
    fresh.put("ageDays", freshness.getAgeDays());
    fresh.put("maxAgeDays", freshness.getMaxAgeDays());
    root.put("freshness", fresh);

    root.put("joinLosses", report.getJoinLosses());

    List<Map<String, Object>> warnings = new ArrayList<Map<String, Object>>();
    for (ValidationWarning warning : report.getWarnings()) {
      Map<String, Object> w = new LinkedHashMap<String, Object>();
      w.put("code", warning.getCode());
      w.put("message", warning.getMessage());
      warnings.add(w);
    }
    root.put("warnings", warnings);
    return root;
  }

  private static Map<String, Integer> outlierMap(OutlierCounts counts) {
    Map<String, Integer> map = new TreeMap<String, Integer>();
    for (Map.Entry<OutlierKey, Integer> e : counts.asMap().entrySet()) {
      map.put(e.getKey().toString(), e.getValue());
    }
    return map;
  }
}
