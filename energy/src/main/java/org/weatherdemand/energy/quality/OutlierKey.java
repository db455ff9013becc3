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
 * Identifies a class of outlier: the column checked and why the value was
 * rejected, for example {@code temperature:range}.
 */
public final class OutlierKey implements Comparable<OutlierKey> {

  public static final OutlierKey TEMPERATURE_RANGE = new OutlierKey("temperature", "range");
  public static final OutlierKey DEMAND_NEGATIVE = new OutlierKey("demand", "negative");
  public static final OutlierKey DEMAND_SPIKE = new OutlierKey("demand", "spike");

  private final String column;
  private final String reason;

  public OutlierKey(String column, String reason) {
    this.column = Objects.requireNonNull(column, "column");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String getColumn() {
    return column;
  }

  public String getReason() {
    return reason;
  }

  @Override public int compareTo(OutlierKey o) {
    int c = column.compareTo(o.column);
    return c != 0 ? c : reason.compareTo(o.reason);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OutlierKey)) {
      return false;
    }
    OutlierKey that = (OutlierKey) o;
    return column.equals(that.column) && reason.equals(that.reason);
  }

  @Override public int hashCode() {
    return Objects.hash(column, reason);
  }

  /** {@code column:reason}, the form used in exclusion reasons and reports. */
  @Override public String toString() {
    return column + ":" + reason;
  }
}
