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
import org.weatherdemand.etl.HttpSourceConfig.AuthConfig;
import org.weatherdemand.etl.HttpSourceConfig.AuthLocation;
import org.weatherdemand.etl.HttpSourceConfig.PaginationConfig;
import org.weatherdemand.etl.HttpSourceConfig.ResponseConfig;

/**
 * Built-in endpoint definitions for the two upstream APIs.
 *
 * <p>Both use the variables {@code {startDate}} and {@code {endDate}}
 * (ISO dates); NOAA also uses {@code {stationId}}, EIA {@code {regionId}} and
 * {@code {eiaTimezone}}.
 * Credentials come from the {@code NOAA_API_KEY} and {@code EIA_API_KEY}
 * environment variables.
 */
public final class SourceDefaults {

  public static final String NOAA_URL = "https://www.ncei.noaa.gov/cdo-web/api/v2/data";
  public static final String EIA_URL =
      "https://api.eia.gov/v2/electricity/rto/daily-region-data/data/";

  private SourceDefaults() {
  }

  /** NOAA Climate Data Online v2, GHCND daily summaries. */
  public static HttpSourceConfig noaa() {
    return HttpSourceConfig.builder()
        .url(NOAA_URL)
        .parameter("datasetid", "GHCND")
        .parameter("stationid", "{stationId}")
        .parameter("startdate", "{startDate}")
        .parameter("enddate", "{endDate}")
        .parameter("datatypeid", "TMAX", "TMIN", "PRCP")
        .parameter("units", "standard")
        .auth(AuthConfig.apiKey(AuthLocation.HEADER, "token", "{env:NOAA_API_KEY}"))
        .response(ResponseConfig.of("$.results",
            PaginationConfig.offset("limit", "offset", 1000, 1, "$.metadata.resultset.count")))
        .requestsPerSecond(5)
        .build();
  }

  /** EIA Open Data v2, daily demand by balancing authority. */
  public static HttpSourceConfig eia() {
    return HttpSourceConfig.builder()
        .url(EIA_URL)
        .parameter("frequency", "daily")
        .parameter("data[0]", "value")
        .parameter("facets[respondent][]", "{regionId}")
        .parameter("facets[type][]", "D")
        .parameter("facets[timezone][]", "{eiaTimezone}")
        .parameter("start", "{startDate}")
        .parameter("end", "{endDate}")
        .parameter("sort[0][column]", "period")
        .parameter("sort[0][direction]", "asc")
        .auth(AuthConfig.apiKey(AuthLocation.QUERY, "api_key", "{env:EIA_API_KEY}"))
        .response(ResponseConfig.of("$.response.data",
            PaginationConfig.offset("length", "offset", 5000, 0, "$.response.total")))
        .requestsPerSecond(5)
        .build();
  }
}
