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
 * Outcome of fetching one source for one key (for example, weather for one
 * city).
 *
 * <p>Contains statistics about the records fetched, or the kind and message
 * of the failure that ended the fetch.
 */
public class SourceResult {

  public enum Status {
    SUCCESS,
    REUSED,
    ERROR
  }

  private final Status status;
  private final String source;
  private final String key;
  private final long recordCount;
  private final long bytesRead;
  private final int attempts;
  private final long durationMs;
  private final @Nullable String errorKind;
  private final @Nullable String errorMessage;

  private SourceResult(Status status, String source, String key, long recordCount,
      long bytesRead, int attempts, long durationMs, @Nullable String errorKind,
      @Nullable String errorMessage) {
    this.status = status;
    this.source = source;
    this.key = key;
    this.recordCount = recordCount;
    this.bytesRead = bytesRead;
    this.attempts = attempts;
    this.durationMs = durationMs;
    this.errorKind = errorKind;
    this.errorMessage = errorMessage;
  }

  public Status getStatus() {
    return status;
  }

  public String getSource() {
    return source;
  }

  public String getKey() {
    return key;
  }

  public long getRecordCount() {
    return recordCount;
  }

  public long getBytesRead() {
    return bytesRead;
  }

  public int getAttempts() {
    return attempts;
  }

  public long getDurationMs() {
    return durationMs;
  }

  public @Nullable String getErrorKind() {
    return errorKind;
  }

  public @Nullable String getErrorMessage() {
    return errorMessage;
  }

  public boolean isSuccess() {
    return status != Status.ERROR;
  }

  public boolean isError() {
    return status == Status.ERROR;
  }

  public static SourceResult success(String source, String key, long recordCount,
      long bytesRead, int attempts, long durationMs) {
    return new SourceResult(Status.SUCCESS, source, key, recordCount, bytesRead,
        attempts, durationMs, null, null);
  }

  public static SourceResult reused(String source, String key, long recordCount,
      long bytesRead, long durationMs) {
    return new SourceResult(Status.REUSED, source, key, recordCount, bytesRead,
        0, durationMs, null, null);
  }

  /**
   * Records a failed fetch. The kind is taken from a {@link SourceException}
   * where there is one.
   */
  public static SourceResult error(String source, String key, Throwable failure,
      long durationMs) {
    String kind = failure instanceof SourceException
        ? ((SourceException) failure).getKind()
        : failure.getClass().getSimpleName();
    int attempts = failure instanceof FetchException
        ? ((FetchException) failure).getAttempts()
        : 1;
    return new SourceResult(Status.ERROR, source, key, 0, 0, attempts, durationMs, kind,
        failure.getMessage());
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("SourceResult{status=").append(status);
    sb.append(", source=").append(source);
    sb.append(", key=").append(key);
    if (status != Status.ERROR) {
      sb.append(", records=").append(recordCount);
      sb.append(", bytes=").append(bytesRead);
      sb.append(", duration=").append(durationMs).append("ms");
    }
    if (attempts > 0) {
      sb.append(", attempts=").append(attempts);
    }
    if (errorMessage != null) {
      sb.append(", error=").append(errorKind).append(": ").append(errorMessage);
    }
    sb.append("}");
    return sb.toString();
  }
}
