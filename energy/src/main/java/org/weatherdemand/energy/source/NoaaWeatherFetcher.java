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
import org.weatherdemand.energy.model.WeatherObservation;
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
import java.util.TreeMap;

/**
 * Fetches daily weather from NOAA Climate Data Online.
 *
 * <p>NOAA returns one row per (date, datatype). Rows are pivoted into one
 * {@link WeatherObservation} per date carrying {@code TMAX}, {@code TMIN}
 * and {@code PRCP}; the first value seen for a (date, datatype) wins and
 * other datatypes are ignored.
 */
public class NoaaWeatherFetcher extends AbstractSourceFetcher<WeatherObservation> {

  static final String TMAX = "TMAX";
  static final String TMIN = "TMIN";
  static final String PRCP = "PRCP";

  public NoaaWeatherFetcher(HttpSource httpSource, CityRegistry cityRegistry,
      @Nullable RawPayloadStore payloadStore, boolean reusePayloads) {
    super(SourceType.NOAA, httpSource, cityRegistry, payloadStore, reusePayloads);
  }

  @Override protected Map<String, String> variables(CityEntry city, LocalDate startDate,
      LocalDate endDate) {
    return ImmutableMap.of(
        "stationId", city.getStationId(),
        "startDate", startDate.toString(),
        "endDate", endDate.toString());
  }

  @Override protected List<WeatherObservation> parse(CityEntry city, List<JsonNode> rows)
      throws SchemaException {
    Map<LocalDate, DayValues> byDate = new TreeMap<LocalDate, DayValues>();

    for (JsonNode row : rows) {
      CanonicalDate date = DateCanonicalizer.canonicalize(row);
      JsonNode datatype = row.get("datatype");
      if (datatype == null || datatype.isNull()) {
        throw new SchemaException("NOAA row without 'datatype' for " + city.getName()
            + " on " + date.getDate());
      }
      DayValues day = byDate.get(date.getDate());
      if (day == null) {
        day = new DayValues(date.getProvenance());
        byDate.put(date.getDate(), day);
      }
      day.offer(datatype.asText(), numericValue(row.get("value")));
    }

    List<WeatherObservation> observations = new ArrayList<WeatherObservation>(byDate.size());
    for (Map.Entry<LocalDate, DayValues> e : byDate.entrySet()) {
      DayValues day = e.getValue();
      observations.add(
          new WeatherObservation(city.getName(), e.getKey(), day.values.get(TMAX),
              day.values.get(TMIN), day.values.get(PRCP), city.getStationId(),
              day.provenance));
    }
    return observations;
  }

  /** Values collected for one date. */
  private static class DayValues {
    final DateProvenance provenance;
    final Map<String, Double> values = new TreeMap<String, Double>();

    DayValues(DateProvenance provenance) {
      this.provenance = provenance;
    }

    void offer(String datatype, @Nullable Double value) {
      if (value == null) {
        return;
      }
      if (TMAX.equals(datatype) || TMIN.equals(datatype) || PRCP.equals(datatype)) {
        values.putIfAbsent(datatype, value);
      }
    }
  }
}
