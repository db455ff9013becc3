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
package org.weatherdemand.energy.source;

import org.weatherdemand.energy.config.CityEntry;
import org.weatherdemand.energy.config.CityRegistry;
import org.weatherdemand.energy.model.DemandRecord;
import org.weatherdemand.etl.HttpSource;
import org.weatherdemand.etl.SchemaException;
import org.weatherdemand.etl.storage.RawPayloadStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches daily electricity demand from the EIA Open Data v2 API.
 *
 * <p>Rows whose {@code type} is present and not {@code D} (demand) are
 * ignored. The date comes from {@code date} or, as EIA sends it,
 * {@code period}. Repeated dates are passed through; the merger keeps the
 * first and counts the rest.
 */
public class EiaDemandFetcher extends AbstractSourceFetcher<DemandRecord> {

  static final String DEMAND_TYPE = "D";

  /** EIA timezone facet values for the IANA zones of configured cities. */
  private static final Map<String, String> EIA_TIMEZONES = ImmutableMap.<String, String>builder()
      .put("America/New_York", "Eastern")
      .put("America/Chicago", "Central")
      .put("America/Denver", "Mountain")
      .put("America/Phoenix", "Arizona")
      .put("America/Los_Angeles", "Pacific")
      .build();

  public EiaDemandFetcher(HttpSource httpSource, CityRegistry cityRegistry,
      @Nullable RawPayloadStore payloadStore, boolean reusePayloads) {
    super(SourceType.EIA, httpSource, cityRegistry, payloadStore, reusePayloads);
  }

  @Override protected Map<String, String> variables(CityEntry city, LocalDate startDate,
      LocalDate endDate) {
    return ImmutableMap.of(
        "regionId", city.getRegionId(),
        "eiaTimezone", eiaTimezone(city.getTimezone()),
        "startDate", startDate.toString(),
        "endDate", endDate.toString());
  }

  static String eiaTimezone(String ianaZone) {
    String zone = EIA_TIMEZONES.get(ianaZone);
    return zone != null ? zone : "Eastern";
  }

  @Override protected List<DemandRecord> parse(CityEntry city, List<JsonNode> rows)
      throws SchemaException {
    List<DemandRecord> records = new ArrayList<DemandRecord>(rows.size());
    for (JsonNode row : rows) {
      JsonNode type = row.get("type");
      if (type != null && !type.isNull() && !DEMAND_TYPE.equals(type.asText())) {
        continue;
      }
      CanonicalDate date = DateCanonicalizer.canonicalize(row);
      records.add(
          new DemandRecord(city.getName(), date.getDate(), numericValue(row.get("value")),
              city.getRegionId(), date.getProvenance()));
    }
    return records;
  }
}
