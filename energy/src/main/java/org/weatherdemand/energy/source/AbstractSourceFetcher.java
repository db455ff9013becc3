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

import org.weatherdemand.energy.UnknownCityException;
import org.weatherdemand.energy.config.CityEntry;
import org.weatherdemand.energy.config.CityRegistry;
import org.weatherdemand.etl.DataSource;
import org.weatherdemand.etl.HttpSource;
import org.weatherdemand.etl.SchemaException;
import org.weatherdemand.etl.SourcePayload;
import org.weatherdemand.etl.storage.PayloadKey;
import org.weatherdemand.etl.storage.RawPayloadStore;
import org.weatherdemand.etl.storage.StoredPayloadSource;

import com.fasterxml.jackson.databind.JsonNode;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Base class for the per-source fetchers.
 *
 * <p>Provides the shared flow only: resolve the city, fetch the raw payload
 * (from the network, or from the {@link RawPayloadStore} when reuse is on
 * and a payload for the same key exists), persist what was fetched, and hand
 * the raw rows to {@link #parse} for source-specific shaping.
 *
 * <p>Retry, rate limiting, pagination and status classification happen in
 * the {@link HttpSource} each fetcher is given.
 *
 * @param <T> record type produced
 */
public abstract class AbstractSourceFetcher<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractSourceFetcher.class);

  private final SourceType sourceType;
  private final HttpSource httpSource;
  private final CityRegistry cityRegistry;
  private final @Nullable RawPayloadStore payloadStore;
  private final boolean reusePayloads;

  protected AbstractSourceFetcher(SourceType sourceType, HttpSource httpSource,
      CityRegistry cityRegistry, @Nullable RawPayloadStore payloadStore,
      boolean reusePayloads) {
    this.sourceType = sourceType;
    this.httpSource = httpSource;
    this.cityRegistry = cityRegistry;
    this.payloadStore = payloadStore;
    this.reusePayloads = reusePayloads;
  }

  public SourceType getSourceType() {
    return sourceType;
  }

  /**
   * Fetches the records for one city over an inclusive date range.
   *
   * @throws UnknownCityException if the city is not configured
   * @throws org.weatherdemand.etl.AuthException if credentials are missing or rejected
   * @throws org.weatherdemand.etl.FetchException if the request failed after retries
   * @throws SchemaException if the payload or a record has an unexpected shape
   */
  public FetchResult<T> fetch(String city, LocalDate startDate, LocalDate endDate)
      throws IOException {
    CityEntry entry = cityRegistry.resolve(city);
    PayloadKey key = new PayloadKey(sourceType.id(), entry.getName(), startDate, endDate);

    DataSource source = httpSource;
    if (reusePayloads && payloadStore != null && payloadStore.contains(key)) {
      LOGGER.info("Reusing stored {} payload for {}", sourceType.id(), key.asString());
      source = new StoredPayloadSource(payloadStore, key,
          httpSource.getConfig().getResponse().getDataPath());
    }

    SourcePayload payload = source.fetch(variables(entry, startDate, endDate));
    if (!payload.isFromStore() && payloadStore != null) {
      payloadStore.save(key, payload);
    }

    List<T> records = parse(entry, payload.getRecords());
    LOGGER.info("{} {}: {} raw rows -> {} records ({} to {})", sourceType.id(),
        entry.getName(), payload.getRecords().size(), records.size(), startDate, endDate);
    return new FetchResult<T>(records, payload);
  }

  /**
   * Variables substituted into the endpoint definition for one city.
   */
  protected abstract Map<String, String> variables(CityEntry city, LocalDate startDate,
      LocalDate endDate);

  /**
   * Shapes raw rows into records.
   *
   * @throws SchemaException if a row cannot be interpreted
   */
  protected abstract List<T> parse(CityEntry city, List<JsonNode> rows) throws SchemaException;

  /**
   * Reads a numeric field that may arrive as a JSON number or a string.
   * Returns null for null, missing or non-numeric values.
   */
  protected static @Nullable Double numericValue(@Nullable JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    String text = node.asText().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(text);
      return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    } catch (NumberFormatException e) {
      LOGGER.debug("Non-numeric value '{}' treated as missing", text);
      return null;
    }
  }
}
