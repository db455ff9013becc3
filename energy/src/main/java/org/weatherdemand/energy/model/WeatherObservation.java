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
package org.weatherdemand.energy.model;

import org.weatherdemand.energy.source.DateProvenance;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of weather for a city, pivoted from the per-datatype rows NOAA
 * returns. Temperatures are °F and precipitation inches.
 */
public final class WeatherObservation {
  private final String city;
  private final LocalDate date;
  private final @Nullable Double tempMaxF;
  private final @Nullable Double tempMinF;
  private final @Nullable Double precipitationIn;
  private final String stationId;
  private final DateProvenance provenance;

  public WeatherObservation(String city, LocalDate date, @Nullable Double tempMaxF,
      @Nullable Double tempMinF, @Nullable Double precipitationIn, String stationId,
      DateProvenance provenance) {
    this.city = Objects.requireNonNull(city, "city");
    this.date = Objects.requireNonNull(date, "date");
    this.tempMaxF = tempMaxF;
    this.tempMinF = tempMinF;
    this.precipitationIn = precipitationIn;
    this.stationId = stationId;
    this.provenance = provenance;
  }

  public String getCity() {
    return city;
  }

  public LocalDate getDate() {
    return date;
  }

  /**
   * Daily temperature: mean of max and min, whichever of them is present, or
   * null when neither is.
   */
  public @Nullable Double getTemperatureF() {
    if (tempMaxF != null && tempMinF != null) {
      return (tempMaxF + tempMinF) / 2;
    }
    return tempMaxF != null ? tempMaxF : tempMinF;
  }

  public @Nullable Double getTempMaxF() {
    return tempMaxF;
  }

  public @Nullable Double getTempMinF() {
    return tempMinF;
  }

  public @Nullable Double getPrecipitationIn() {
    return precipitationIn;
  }

  public String getStationId() {
    return stationId;
  }

  public DateProvenance getProvenance() {
    return provenance;
  }

  @Override public String toString() {
    return "WeatherObservation{" + city + " " + date + ", max=" + tempMaxF
        + ", min=" + tempMinF + ", prcp=" + precipitationIn + "}";
  }
}
