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

/**
 * Network or API failure while fetching from a remote source.
 *
 * <p>Rate limiting (HTTP 429), server errors (HTTP 5xx) and transport-level
 * I/O errors are transient and retried by {@link RetryExecutor}. Other
 * non-success statuses (400, 404, ...) are reported as non-transient.
 * Once the retry budget is exhausted the last transient failure is rethrown
 * with the number of attempts made.
 */
public class FetchException extends SourceException {

  private static final long serialVersionUID = 1L;

  /** Status code used when the failure did not come from an HTTP response. */
  public static final int NO_STATUS = -1;

  private final int statusCode;
  private final boolean transientFailure;
  private final int attempts;

  public FetchException(String message, int statusCode, boolean transientFailure) {
    this(message, statusCode, transientFailure, 1, null);
  }

  public FetchException(String message, int statusCode, boolean transientFailure,
      Throwable cause) {
    this(message, statusCode, transientFailure, 1, cause);
  }

  private FetchException(String message, int statusCode, boolean transientFailure,
      int attempts, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.transientFailure = transientFailure;
    this.attempts = attempts;
  }

  /**
   * Creates a failure for an HTTP status, classifying 429 and 5xx as transient.
   */
  public static FetchException forStatus(int statusCode, String url, String body) {
    boolean retryable = statusCode == 429 || statusCode >= 500;
    String snippet = body == null ? "" : body.length() > 200 ? body.substring(0, 200) : body;
    return new FetchException("HTTP " + statusCode + " from " + url + ": " + snippet,
        statusCode, retryable);
  }

  /**
   * Returns a copy of this failure recording that the retry budget was spent.
   *
   * @param attempts number of attempts made
   * @return exhausted failure, never transient
   */
  public FetchException exhausted(int attempts) {
    return new FetchException("Gave up after " + attempts + " attempt(s): " + getMessage(),
        statusCode, false, attempts, this);
  }

  public int getStatusCode() {
    return statusCode;
  }

  public int getAttempts() {
    return attempts;
  }

  @Override public boolean isTransient() {
    return transientFailure;
  }

  @Override public String getKind() {
    return "fetch";
  }
}
