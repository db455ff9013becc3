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
 * One day of electricity demand (MW) for a city's balancing authority.
 * Demand is null when the source value was null or not numeric.
 */
public final class DemandRecord {
  private final String city;
  private final LocalDate date;
  private final @Nullable Double demandMw;
  private final String regionId;
  private final DateProvenance provenance;

  public DemandRecord(String city, LocalDate date, @Nullable Double demandMw, String regionId,
      DateProvenance provenance) {
    this.city = Objects.requireNonNull(city, "city");
    this.date = Objects.requireNonNull(date, "date");
    this.demandMw = demandMw;
    this.regionId = regionId;
    this.provenance = provenance;
  }

  public String getCity() {
    return city;
  }

  public LocalDate getDate() {
    return date;
  }

  public @Nullable Double getDemandMw() {
    return demandMw;
  }

  public String getRegionId() {
    return regionId;
  }

  public DateProvenance getProvenance() {
    return provenance;
  }

  @Override public String toString() {
    return "DemandRecord{" + city + " " + date + ", demand=" + demandMw + "}";
  }
}
