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

import java.util.Locale;
import java.util.Objects;

/**
 * One configured city: the NOAA station that reports its weather, the EIA
 * balancing authority that reports its demand, and where it is.
 */
public final class CityEntry {
  private final String name;
  private final String stationId;
  private final String regionId;
  private final String timezone;
  private final double latitude;
  private final double longitude;

  public CityEntry(String name, String stationId, String regionId, String timezone,
      double latitude, double longitude) {
    this.name = requireText(name, "name");
    this.stationId = requireText(stationId, "stationId");
    this.regionId = requireText(regionId, "regionId");
    this.timezone = timezone == null ? "UTC" : timezone;
    this.latitude = latitude;
    this.longitude = longitude;
  }

  private static String requireText(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalArgumentException("City " + field + " is required");
    }
    return value.trim();
  }

  public String getName() {
    return name;
  }

  public String getStationId() {
    return stationId;
  }

  public String getRegionId() {
    return regionId;
  }

  public String getTimezone() {
    return timezone;
  }

  public double getLatitude() {
    return latitude;
  }

  public double getLongitude() {
    return longitude;
  }

  /** Lookup key: trimmed and lower-cased. */
  String key() {
    return normalize(name);
  }

  static String normalize(String city) {
    return city.trim().toLowerCase(Locale.ROOT);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CityEntry)) {
      return false;
    }
    CityEntry that = (CityEntry) o;
    return name.equals(that.name)
        && stationId.equals(that.stationId)
        && regionId.equals(that.regionId);
  }

  @Override public int hashCode() {
    return Objects.hash(name, stationId, regionId);
  }

  @Override public String toString() {
    return name + "{station=" + stationId + ", region=" + regionId + "}";
  }
}
