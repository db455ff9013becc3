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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Executes a call under a {@link RetryPolicy}.
 *
 * <p>Only transient failures are retried: a {@link SourceException} whose
 * {@link SourceException#isTransient()} is true, or a plain
 * {@link IOException} from the transport. {@link AuthException} and
 * {@link SchemaException} end the call on the first attempt.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RetryExecutor executor = new RetryExecutor(RetryPolicy.defaults());
 * RetryOutcome<String> outcome = executor.execute("weather NYC", () -> client.get(url));
 * String body = outcome.getOrThrow();
 * }</pre>
 */
public class RetryExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final LongSupplier clockMillis;
  private final Random random;

  public RetryExecutor(RetryPolicy policy) {
    this(policy, Sleeper.SYSTEM, System::currentTimeMillis, new Random());
  }

  public RetryExecutor(RetryPolicy policy, Sleeper sleeper, LongSupplier clockMillis,
      Random random) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.clockMillis = clockMillis;
    this.random = random;
  }

  public RetryPolicy getPolicy() {
    return policy;
  }

  /**
   * A unit of work that may fail with an I/O error.
   *
   * @param <T> result type
   */
  @FunctionalInterface
  public interface RetryableCall<T> {
    T call() throws IOException;
  }

  /**
   * Current time on the clock used for timeout accounting. Callers that make
   * several calls under one ceiling take their start time from here.
   */
  public long now() {
    return clockMillis.getAsLong();
  }

  /**
   * Runs the call until it succeeds, fails permanently, exhausts the attempt
   * budget, or would exceed the overall timeout.
   *
   * @param description label used in log messages
   * @param call the work to run
   * @param <T> result type
   * @return outcome carrying the value or the final failure
   */
  public <T> RetryOutcome<T> execute(String description, RetryableCall<T> call) {
    return execute(description, call, now());
  }

  /**
   * Runs the call under a timeout measured from {@code startedAt} rather
   * than from this invocation, so that several calls making up one fetch
   * share a single ceiling.
   *
   * @param description label used in log messages
   * @param call the work to run
   * @param startedAt time, on {@link #now()}, at which the enclosing fetch began
   * @param <T> result type
   * @return outcome carrying the value or the final failure
   */
  public <T> RetryOutcome<T> execute(String description, RetryableCall<T> call,
      long startedAt) {
    int attempt = 0;

    while (true) {
      long spent = now() - startedAt;
      if (spent >= policy.getTimeoutMs()) {
        LOGGER.warn("{} abandoned: {}ms spent, timeout is {}ms", description, spent,
            policy.getTimeoutMs());
        FetchException timedOut = new FetchException(description + " exceeded the "
            + policy.getTimeoutMs() + "ms timeout", FetchException.NO_STATUS, true);
        return RetryOutcome.failure(timedOut.exhausted(attempt), attempt);
      }
      attempt++;
      SourceException failure;
      try {
        T value = call.call();
        if (attempt > 1) {
          LOGGER.info("{} succeeded on attempt {}/{}", description, attempt,
              policy.getMaxAttempts());
        }
        return RetryOutcome.success(value, attempt);
      } catch (SourceException e) {
        failure = e;
      } catch (IOException e) {
        failure = new FetchException("I/O error: " + e.getMessage(),
            FetchException.NO_STATUS, true, e);
      }

      if (!failure.isTransient()) {
        LOGGER.debug("{} failed permanently ({}): {}", description, failure.getKind(),
            failure.getMessage());
        return RetryOutcome.failure(failure, attempt);
      }

      if (attempt >= policy.getMaxAttempts()) {
        LOGGER.warn("{} failed after {} attempt(s): {}", description, attempt,
            failure.getMessage());
        return RetryOutcome.failure(exhausted(failure, attempt), attempt);
      }

      long delay = policy.backoffDelayMs(attempt, random.nextDouble());
      long elapsed = now() - startedAt;
      if (elapsed + delay > policy.getTimeoutMs()) {
        LOGGER.warn("{} abandoned after {} attempt(s): next retry would exceed {}ms timeout",
            description, attempt, policy.getTimeoutMs());
        return RetryOutcome.failure(exhausted(failure, attempt), attempt);
      }

      LOGGER.warn("{} failed, retrying in {}ms (attempt {}/{}): {}",
          description, delay, attempt, policy.getMaxAttempts(), failure.getMessage());
      try {
        sleeper.sleep(delay);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        return RetryOutcome.failure(
            new FetchException("Interrupted during retry backoff for " + description,
                FetchException.NO_STATUS, false, ie), attempt);
      }
    }
  }

  private static SourceException exhausted(SourceException failure, int attempts) {
    if (failure instanceof FetchException) {
      return ((FetchException) failure).exhausted(attempts);
    }
    return failure;
  }
}
