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

import org.weatherdemand.etl.SchemaException;
import org.weatherdemand.etl.SourcePayload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;

/**
 * Persists the raw pages of each fetch, keyed by {@link PayloadKey}.
 *
 * <p>Each payload is one JSON document:
 * <pre>{@code
 * {
 *   "source": "noaa",
 *   "entity": "New York",
 *   "startDate": "2024-01-01",
 *   "endDate": "2024-03-31",
 *   "fetchedAt": "2024-04-01T06:00:00Z",
 *   "pages": ["{...page 1 body...}", "{...page 2 body...}"]
 * }
 * }</pre>
 *
 * <p>Pages are stored as the exact strings received so that a stored payload
 * parses to the same records as the original fetch.
 */
public class RawPayloadStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RawPayloadStore.class);

  private final StorageProvider storage;
  private final String baseDirectory;
  private final ObjectMapper mapper;
  private final Clock clock;

  public RawPayloadStore(StorageProvider storage, String baseDirectory) {
    this(storage, baseDirectory, Clock.systemUTC());
  }

  public RawPayloadStore(StorageProvider storage, String baseDirectory, Clock clock) {
    this.storage = storage;
    this.baseDirectory = baseDirectory;
    this.clock = clock;
    this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  public String pathFor(PayloadKey key) {
    return storage.resolvePath(baseDirectory, key.relativePath());
  }

  public boolean contains(PayloadKey key) throws IOException {
    return storage.exists(pathFor(key));
  }

  /**
   * Writes the pages of a payload, replacing any earlier payload for the key.
   *
   * @return the path written
   */
  public String save(PayloadKey key, SourcePayload payload) throws IOException {
    ObjectNode root = mapper.createObjectNode();
    root.put("source", key.getSource());
    root.put("entity", key.getEntity());
    root.put("startDate", key.getStartDate().toString());
    root.put("endDate", key.getEndDate().toString());
    root.put("fetchedAt", Instant.now(clock).toString());
    ArrayNode pages = root.putArray("pages");
    for (String page : payload.getPages()) {
      pages.add(page);
    }

    String path = pathFor(key);
    storage.writeFile(path, mapper.writeValueAsBytes(root));
    LOGGER.debug("Stored {} page(s) for {} at {}", payload.getPages().size(), key, path);
    return path;
  }

  /**
   * Reads the stored pages for a key.
   *
   * @return the pages, or null if nothing is stored for the key
   * @throws SchemaException if the stored document is malformed
   */
  public @Nullable ImmutableList<String> loadPages(PayloadKey key) throws IOException {
    String path = pathFor(key);
    if (!storage.exists(path)) {
      return null;
    }

    JsonNode root;
    try (InputStream in = storage.openInputStream(path)) {
      root = mapper.readTree(in);
    } catch (JsonProcessingException e) {
      throw new SchemaException("Stored payload " + path + " is not valid JSON", e);
    }

    JsonNode pages = root.path("pages");
    if (!pages.isArray()) {
      throw new SchemaException("Stored payload " + path + " has no 'pages' array");
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonNode page : pages) {
      result.add(page.asText());
    }
    return result.build();
  }
}
