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
package org.weatherdemand.energy.stats;

import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Global and per-city correlation results.
 *
 * <p>The pooled figure and the per-city figures are separate outputs and
 * neither is derived from the other. The combined estimate, when present,
 * is a Fisher z weighted average of the per-city coefficients and is
 * reported in addition to them.
 */
public final class CorrelationReport {
  private final CorrelationResult global;
  private final ImmutableSortedMap<String, CorrelationResult> perCity;
  private final @Nullable Double combinedEstimate;

  public CorrelationReport(CorrelationResult global, Map<String, CorrelationResult> perCity,
      @Nullable Double combinedEstimate) {
    this.global = global;
    this.perCity = ImmutableSortedMap.copyOf(perCity);
    this.combinedEstimate = combinedEstimate;
  }

  public CorrelationResult getGlobal() {
    return global;
  }

  /** Per-city results, ordered by city. */
  public ImmutableSortedMap<String, CorrelationResult> getPerCity() {
    return perCity;
  }

  public @Nullable CorrelationResult getCity(String city) {
    return perCity.get(city);
  }

  public @Nullable Double getCombinedEstimate() {
    return combinedEstimate;
  }

  @Override public String toString() {
    return "CorrelationReport{global=" + global + ", perCity=" + perCity.values()
        + ", combined=" + combinedEstimate + "}";
  }
}
