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
package org.weatherdemand.etl.storage;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable key identifying one raw payload: the source it came from, the
 * entity it was fetched for (a city), and the inclusive date range.
 *
 * <p>Two fetches with the same key are interchangeable, which is what lets a
 * re-run reuse a stored payload instead of calling the network again.
 *
 * <p>This class is immutable and thread-safe.
 */
public final class PayloadKey {
  private final String source;
  private final String entity;
  private final LocalDate startDate;
  private final LocalDate endDate;
  private final String keyString;

  /**
   * Creates a payload key.
   *
   * @param source The source name (e.g., "noaa", "eia")
   * @param entity The entity fetched (e.g., a city name)
   * @param startDate First date of the range
   * @param endDate Last date of the range, inclusive
   */
  public PayloadKey(String source, String entity, LocalDate startDate, LocalDate endDate) {
    if (source == null || source.isEmpty()) {
      throw new IllegalArgumentException("source cannot be null or empty");
    }
    if (entity == null || entity.isEmpty()) {
      throw new IllegalArgumentException("entity cannot be null or empty");
    }
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("endDate " + endDate + " is before startDate "
          + startDate);
    }

    this.source = source;
    this.entity = entity;
    this.startDate = startDate;
    this.endDate = endDate;
    this.keyString = source + ":entity=" + entity + ":end=" + endDate + ":start=" + startDate;
  }

  /**
   * Get the key as a string.
   * Format: "source:entity=value:end=yyyy-MM-dd:start=yyyy-MM-dd"
   *
   * @return The key string
   */
  public String asString() {
    return keyString;
  }

  /**
   * Relative storage path for this key:
   * {@code <source>/<entity-slug>/<start>_<end>.json}.
   *
   * @return relative path using '/' separators
   */
  public String relativePath() {
    return slug(source) + "/" + slug(entity) + "/" + startDate + "_" + endDate + ".json";
  }

  public String getSource() {
    return source;
  }

  public String getEntity() {
    return entity;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  static String slug(String value) {
    String lower = value.trim().toLowerCase(Locale.ROOT);
    String slug = lower.replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    return slug.isEmpty() ? "_" : slug;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    PayloadKey that = (PayloadKey) o;
    return keyString.equals(that.keyString);
  }

  @Override public int hashCode() {
    return keyString.hashCode();
  }

  @Override public String toString() {
    return "PayloadKey{" + keyString + "}";
  }
}
