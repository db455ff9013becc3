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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of a call executed through {@link RetryExecutor}: either the value
 * produced by the last attempt, or the failure that ended the retries.
 *
 * @param <T> value type
 */
public final class RetryOutcome<T> {

  private final @Nullable T value;
  private final @Nullable SourceException failure;
  private final int attempts;

  private RetryOutcome(@Nullable T value, @Nullable SourceException failure, int attempts) {
    this.value = value;
    this.failure = failure;
    this.attempts = attempts;
  }

  public static <T> RetryOutcome<T> success(T value, int attempts) {
    return new RetryOutcome<T>(value, null, attempts);
  }

  public static <T> RetryOutcome<T> failure(SourceException failure, int attempts) {
    return new RetryOutcome<T>(null, failure, attempts);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public @Nullable T getValue() {
    return value;
  }

  public @Nullable SourceException getFailure() {
    return failure;
  }

  public int getAttempts() {
    return attempts;
  }

  /**
   * Returns the value, or throws the failure.
   *
   * @return value of the successful attempt
   * @throws SourceException if the call failed
   */
  public T getOrThrow() throws SourceException {
    if (failure != null) {
      throw failure;
    }
    return value;
  }

  @Override public String toString() {
    if (isSuccess()) {
      return "RetryOutcome{SUCCESS, attempts=" + attempts + "}";
    }
    return "RetryOutcome{FAILURE, attempts=" + attempts + ", failure=" + failure.getMessage() + "}";
  }
}
