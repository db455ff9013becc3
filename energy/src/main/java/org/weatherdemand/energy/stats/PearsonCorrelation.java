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

/**
 * Pearson product-moment correlation over paired samples.
 */
public final class PearsonCorrelation {

  private PearsonCorrelation() {
  }

  /**
   * Returns r for the paired values, or null when there are fewer than two
   * pairs or either variable has zero variance.
   *
   * @throws IllegalArgumentException if the arrays differ in length
   */
  public static @Nullable Double compute(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException("Sample lengths differ: " + x.length + " vs " + y.length);
    }
    int n = x.length;
    if (n < 2) {
      return null;
    }
    double meanX = 0;
    double meanY = 0;
    for (int i = 0; i < n; i++) {
      meanX += x[i];
      meanY += y[i];
    }
    meanX /= n;
    meanY /= n;

    double sxy = 0;
    double sxx = 0;
    double syy = 0;
    for (int i = 0; i < n; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      sxy += dx * dy;
      sxx += dx * dx;
      syy += dy * dy;
    }
    if (sxx == 0 || syy == 0) {
      return null;
    }
    double r = sxy / Math.sqrt(sxx * syy);
    // Rounding can push |r| a hair past 1.
    return Math.max(-1.0, Math.min(1.0, r));
  }
}
