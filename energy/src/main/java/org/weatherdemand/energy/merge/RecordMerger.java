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
package org.weatherdemand.energy.merge;

import org.weatherdemand.energy.model.DemandRecord;
import org.weatherdemand.energy.model.MergedRecord;
import org.weatherdemand.energy.model.WeatherObservation;
import org.weatherdemand.energy.source.SourceType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Inner-joins weather and demand on (city, date).
 *
 * <p>A (city, date) repeated within one source keeps its first occurrence;
 * later ones are counted as {@code duplicate_<dataset>}. Dates present on
 * only one side are dropped and counted as {@code unmatched_<dataset>}.
 * The output is ordered by city, then date.
 */
public class RecordMerger {
  private static final Logger LOGGER = LoggerFactory.getLogger(RecordMerger.class);

  public static final String UNMATCHED_WEATHER = "unmatched_" + SourceType.NOAA.dataset();
  public static final String UNMATCHED_DEMAND = "unmatched_" + SourceType.EIA.dataset();
  public static final String DUPLICATE_WEATHER = "duplicate_" + SourceType.NOAA.dataset();
  public static final String DUPLICATE_DEMAND = "duplicate_" + SourceType.EIA.dataset();

  public MergeResult merge(List<WeatherObservation> weather, List<DemandRecord> demand) {
    Map<Map.Entry<String, LocalDate>, WeatherObservation> weatherByKey =
        new LinkedHashMap<Map.Entry<String, LocalDate>, WeatherObservation>();
    int duplicateWeather = 0;
    for (WeatherObservation w : weather) {
      if (weatherByKey.putIfAbsent(key(w.getCity(), w.getDate()), w) != null) {
        duplicateWeather++;
      }
    }

    Map<Map.Entry<String, LocalDate>, DemandRecord> demandByKey =
        new LinkedHashMap<Map.Entry<String, LocalDate>, DemandRecord>();
    int duplicateDemand = 0;
    for (DemandRecord d : demand) {
      if (demandByKey.putIfAbsent(key(d.getCity(), d.getDate()), d) != null) {
        duplicateDemand++;
      }
    }

    List<MergedRecord> merged = new ArrayList<MergedRecord>();
    int unmatchedWeather = 0;
    for (Map.Entry<Map.Entry<String, LocalDate>, WeatherObservation> e : weatherByKey.entrySet()) {
      DemandRecord d = demandByKey.get(e.getKey());
      if (d == null) {
        unmatchedWeather++;
        continue;
      }
      WeatherObservation w = e.getValue();
      merged.add(new MergedRecord(w.getCity(), w.getDate(), w.getTemperatureF(), d.getDemandMw()));
    }
    int unmatchedDemand = demandByKey.size() - (weatherByKey.size() - unmatchedWeather);
    merged.sort(MergedRecord.CITY_DATE_ORDER);

    Map<String, Integer> losses = new TreeMap<String, Integer>();
    losses.put(UNMATCHED_WEATHER, unmatchedWeather);
    losses.put(UNMATCHED_DEMAND, unmatchedDemand);
    losses.put(DUPLICATE_WEATHER, duplicateWeather);
    losses.put(DUPLICATE_DEMAND, duplicateDemand);

    LOGGER.info("Merged {} weather and {} demand records into {} rows; losses {}",
        weather.size(), demand.size(), merged.size(), losses);
    return new MergeResult(merged, losses);
  }

  private static Map.Entry<String, LocalDate> key(String city, LocalDate date) {
    return new AbstractMap.SimpleImmutableEntry<String, LocalDate>(city, date);
  }
}
