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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * First and third quartiles of a set of demand values.
 *
 * <p>Quantiles use linear interpolation between closest ranks: for sorted
 * values {@code x[0..n-1]} the p-quantile sits at position {@code p * (n - 1)}.
 */
public final class DemandQuantiles {
  private final double q1;
  private final double q3;
  private final int count;

  private DemandQuantiles(double q1, double q3, int count) {
    this.q1 = q1;
    this.q3 = q3;
    this.count = count;
  }

  /**
   * Computes quartiles over the non-null values.
   *
   * @throws IllegalArgumentException if there are no values
   */
  public static DemandQuantiles of(Iterable<Double> values) {
    List<Double> sorted = new ArrayList<Double>();
    for (Double v : values) {
      if (v != null && !v.isNaN()) {
        sorted.add(v);
      }
    }
    if (sorted.isEmpty()) {
      throw new IllegalArgumentException("No values to compute quantiles from");
    }
    Collections.sort(sorted);
    return new DemandQuantiles(quantile(sorted, 0.25), quantile(sorted, 0.75), sorted.size());
  }

  static double quantile(List<Double> sorted, double p) {
    double position = p * (sorted.size() - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    double fraction = position - lower;
    return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
  }

  public double getQ1() {
    return q1;
  }

  public double getQ3() {
    return q3;
  }

  public double getIqr() {
    return q3 - q1;
  }

  public int getCount() {
    return count;
  }

  /** {@code Q3 + multiplier * IQR}. */
  public double upperFence(double multiplier) {
    return q3 + multiplier * getIqr();
  }

  /**
   * Classifies a value; the HIGH test runs first, so when Q1 equals Q3 a
   * value at the quartile is HIGH.
   */
  public DemandLevel classify(@Nullable Double value) {
    if (value == null || value.isNaN()) {
      return DemandLevel.UNKNOWN;
    }
    if (value >= q3) {
      return DemandLevel.HIGH;
    }
    if (value <= q1) {
      return DemandLevel.LOW;
    }
    return DemandLevel.MODERATE;
  }

  @Override public String toString() {
    return "DemandQuantiles{q1=" + q1 + ", q3=" + q3 + ", n=" + count + "}";
  }
}
