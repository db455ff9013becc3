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
package org.weatherdemand.energy.source;

import java.util.Objects;

/**
 * Which source field supplied a record's canonical date, and the value it
 * held before canonicalization.
 */
public final class DateProvenance {

  /** Source fields a date may come from, in order of preference. */
  public enum Field {
    DATE("date"),
    PERIOD("period");

    private final String jsonName;

    Field(String jsonName) {
      this.jsonName = jsonName;
    }

    public String jsonName() {
      return jsonName;
    }
  }

  private final Field field;
  private final String rawValue;

  public DateProvenance(Field field, String rawValue) {
    this.field = Objects.requireNonNull(field, "field");
    this.rawValue = Objects.requireNonNull(rawValue, "rawValue");
  }

  public Field getField() {
    return field;
  }

  public String getRawValue() {
    return rawValue;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DateProvenance)) {
      return false;
    }
    DateProvenance that = (DateProvenance) o;
    return field == that.field && rawValue.equals(that.rawValue);
  }

  @Override public int hashCode() {
    return Objects.hash(field, rawValue);
  }

  @Override public String toString() {
    return field.jsonName() + "=" + rawValue;
  }
}
