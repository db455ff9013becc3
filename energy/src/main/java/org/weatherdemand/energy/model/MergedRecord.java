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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * One row of the unified table: a city's temperature and demand on one
 * date.
 *
 * <p>Instances are immutable. The quality validator does not drop suspect
 * rows; it returns copies marked {@link #isExcludedFromStats() excluded}
 * with a reason.
 */
public final class MergedRecord {

  /** Table order: city, then date. */
  public static final Comparator<MergedRecord> CITY_DATE_ORDER =
      Comparator.comparing(MergedRecord::getCity).thenComparing(MergedRecord::getDate);

  private final String city;
  private final LocalDate date;
  private final @Nullable Double temperatureF;
  private final @Nullable Double demandMw;
  private final boolean excludedFromStats;
  private final @Nullable String exclusionReason;

  public MergedRecord(String city, LocalDate date, @Nullable Double temperatureF,
      @Nullable Double demandMw) {
    this(city, date, temperatureF, demandMw, false, null);
  }

  private MergedRecord(String city, LocalDate date, @Nullable Double temperatureF,
      @Nullable Double demandMw, boolean excludedFromStats, @Nullable String exclusionReason) {
    this.city = Objects.requireNonNull(city, "city");
    this.date = Objects.requireNonNull(date, "date");
    this.temperatureF = temperatureF;
    this.demandMw = demandMw;
    this.excludedFromStats = excludedFromStats;
    this.exclusionReason = exclusionReason;
  }

  /**
   * Returns a copy excluded from statistics for the given reason.
   */
  public MergedRecord excluded(String reason) {
    return new MergedRecord(city, date, temperatureF, demandMw, true, reason);
  }

  public String getCity() {
    return city;
  }

  public LocalDate getDate() {
    return date;
  }

  public @Nullable Double getTemperatureF() {
    return temperatureF;
  }

  public @Nullable Double getDemandMw() {
    return demandMw;
  }

  public boolean isWeekend() {
    DayOfWeek day = date.getDayOfWeek();
    return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
  }

  public boolean isExcludedFromStats() {
    return excludedFromStats;
  }

  public @Nullable String getExclusionReason() {
    return exclusionReason;
  }

  /** Usable for correlation: not excluded and both values present. */
  public boolean isValidForStats() {
    return !excludedFromStats && temperatureF != null && demandMw != null;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MergedRecord)) {
      return false;
    }
    MergedRecord that = (MergedRecord) o;
    return excludedFromStats == that.excludedFromStats
        && city.equals(that.city)
        && date.equals(that.date)
        && Objects.equals(temperatureF, that.temperatureF)
        && Objects.equals(demandMw, that.demandMw)
        && Objects.equals(exclusionReason, that.exclusionReason);
  }

  @Override public int hashCode() {
    return Objects.hash(city, date, temperatureF, demandMw, excludedFromStats, exclusionReason);
  }

  @Override public String toString() {
    return "MergedRecord{" + city + " " + date + ", temp=" + temperatureF
        + ", demand=" + demandMw
        + (excludedFromStats ? ", excluded=" + exclusionReason : "") + "}";
  }
}
