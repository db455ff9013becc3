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
package org.weatherdemand.etl;

import com.google.common.math.LongMath;

import java.util.Map;

/**
 * Bounded retry policy with exponential backoff.
 *
 * <p>The delay after the n-th failed attempt is
 * {@code baseDelayMs * 2^(n-1)}, capped at {@code maxDelayMs}, then spread by
 * up to {@code jitter} (a fraction, e.g. 0.1 for +/-10%). The policy also
 * carries an overall timeout: a call that has not succeeded within
 * {@code timeoutMs} fails rather than sleeping again.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 1000
 *   maxDelayMs: 30000
 *   jitter: 0.1
 *   timeoutMs: 120000
 * }</pre>
 *
 * @see RetryExecutor
 */
public final class RetryPolicy {

  private static final RetryPolicy DEFAULTS = builder().build();

  private final int maxAttempts;
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;
  private final long timeoutMs;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.baseDelayMs = builder.baseDelayMs;
    this.maxDelayMs = builder.maxDelayMs;
    this.jitter = builder.jitter;
    this.timeoutMs = builder.timeoutMs;
  }

  public static RetryPolicy defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getBaseDelayMs() {
    return baseDelayMs;
  }

  public long getMaxDelayMs() {
    return maxDelayMs;
  }

  public double getJitter() {
    return jitter;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  /**
   * Computes the backoff delay after a failed attempt.
   *
   * @param failedAttempts number of attempts made so far (1-based)
   * @param random uniform value in [0, 1) used for jitter
   * @return delay in milliseconds, never negative
   */
  public long backoffDelayMs(int failedAttempts, double random) {
    int exponent = Math.min(Math.max(failedAttempts - 1, 0), 30);
    long delay = Math.min(maxDelayMs,
        LongMath.saturatedMultiply(baseDelayMs, 1L << exponent));
    if (jitter > 0) {
      double spread = delay * jitter * (2 * random - 1);
      delay = Math.round(delay + spread);
    }
    return Math.max(0, delay);
  }

  @Override public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts
        + ", baseDelayMs=" + baseDelayMs
        + ", maxDelayMs=" + maxDelayMs
        + ", jitter=" + jitter
        + ", timeoutMs=" + timeoutMs + "}";
  }

  public static RetryPolicy fromMap(Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Builder builder = builder();
    Object attempts = map.get("maxAttempts");
    if (attempts instanceof Number) {
      builder.maxAttempts(((Number) attempts).intValue());
    }
    Object base = map.get("baseDelayMs");
    if (base instanceof Number) {
      builder.baseDelayMs(((Number) base).longValue());
    }
    Object max = map.get("maxDelayMs");
    if (max instanceof Number) {
      builder.maxDelayMs(((Number) max).longValue());
    }
    Object jitter = map.get("jitter");
    if (jitter instanceof Number) {
      builder.jitter(((Number) jitter).doubleValue());
    }
    Object timeout = map.get("timeoutMs");
    if (timeout instanceof Number) {
      builder.timeoutMs(((Number) timeout).longValue());
    }
    return builder.build();
  }

  /**
   * Builder for RetryPolicy.
   */
  public static class Builder {
    private int maxAttempts = 3;
    private long baseDelayMs = 1000;
    private long maxDelayMs = 30_000;
    private double jitter = 0.1;
    private long timeoutMs = 120_000;

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    public Builder jitter(double jitter) {
      this.jitter = jitter;
      return this;
    }

    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    public RetryPolicy build() {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("maxAttempts must be at least 1");
      }
      if (baseDelayMs < 0 || maxDelayMs < 0 || timeoutMs <= 0) {
        throw new IllegalArgumentException("Delays must be >= 0 and timeout > 0");
      }
      if (jitter < 0 || jitter >= 1) {
        throw new IllegalArgumentException("jitter must be in [0, 1)");
      }
      return new RetryPolicy(this);
    }
  }
}
