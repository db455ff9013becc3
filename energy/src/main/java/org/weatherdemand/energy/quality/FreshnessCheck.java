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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;

/**
 * Result of the freshness check: the newest date in the table and how many
 * days old it was when checked. Both are null for an empty table, which is
 * always {@link FreshnessStatus#STALE}.
 */
public final class FreshnessCheck {
  private final FreshnessStatus status;
  private final @Nullable LocalDate latestDate;
  private final @Nullable Long ageDays;
  private final int maxAgeDays;

  public FreshnessCheck(FreshnessStatus status, @Nullable LocalDate latestDate,
      @Nullable Long ageDays, int maxAgeDays) {
    this.status = status;
    this.latestDate = latestDate;
    this.ageDays = ageDays;
    this.maxAgeDays = maxAgeDays;
  }

  public FreshnessStatus getStatus() {
    return status;
  }

  public @Nullable LocalDate getLatestDate() {
    return latestDate;
  }

  public @Nullable Long getAgeDays() {
    return ageDays;
  }

  public int getMaxAgeDays() {
    return maxAgeDays;
  }

  @Override public String toString() {
    return status + "{latest=" + latestDate + ", ageDays=" + ageDays + "}";
  }
}
