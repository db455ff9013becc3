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

import java.util.Objects;

/**
 * A non-fatal finding recorded in the quality report. Never thrown.
 */
public final class ValidationWarning {

  public static final String STALE_DATA = "stale_data";
  public static final String EMPTY_TABLE = "empty_table";
  public static final String SPIKE_CHECK_SKIPPED = "spike_check_skipped";
  public static final String JOIN_LOSS = "join_loss";

  private final String code;
  private final String message;

  public ValidationWarning(String code, String message) {
    this.code = Objects.requireNonNull(code, "code");
    this.message = Objects.requireNonNull(message, "message");
  }

  public String getCode() {
    return code;
  }

  public String getMessage() {
    return message;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ValidationWarning)) {
      return false;
    }
    ValidationWarning that = (ValidationWarning) o;
    return code.equals(that.code) && message.equals(that.message);
  }

  @Override public int hashCode() {
    return Objects.hash(code, message);
  }

  @Override public String toString() {
    return code + ": " + message;
  }
}
