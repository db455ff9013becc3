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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Correlation between temperature and demand for one scope: every city
 * pooled ({@link #GLOBAL}) or a single city.
 */
public final class CorrelationResult {
  public static final String GLOBAL = "GLOBAL";

  private final String scope;
  private final @Nullable Double r;
  private final int sampleSize;
  private final CorrelationStrength strength;

  CorrelationResult(String scope, @Nullable Double r, int sampleSize,
      CorrelationStrength strength) {
    this.scope = Objects.requireNonNull(scope, "scope");
    this.r = r;
    this.sampleSize = sampleSize;
    this.strength = Objects.requireNonNull(strength, "strength");
    if ((r == null) != (strength == CorrelationStrength.INSUFFICIENT)) {
      throw new IllegalArgumentException("r must be absent exactly when strength is INSUFFICIENT");
    }
  }

  public String getScope() {
    return scope;
  }

  public boolean isGlobal() {
    return GLOBAL.equals(scope);
  }

  /** Pearson r; null when {@link CorrelationStrength#INSUFFICIENT}. */
  public @Nullable Double getR() {
    return r;
  }

  public int getSampleSize() {
    return sampleSize;
  }

  public CorrelationStrength getStrength() {
    return strength;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CorrelationResult)) {
      return false;
    }
    CorrelationResult that = (CorrelationResult) o;
    return sampleSize == that.sampleSize
        && scope.equals(that.scope)
        && Objects.equals(r, that.r)
        && strength == that.strength;
  }

  @Override public int hashCode() {
    return Objects.hash(scope, r, sampleSize, strength);
  }

  @Override public String toString() {
    return scope + ": r=" + (r == null ? "n/a" : String.format("%.3f", r))
        + " n=" + sampleSize + " " + strength;
  }
}
