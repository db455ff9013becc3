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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Everything one fetch returned: the raw body of every page, exactly as
 * received, and the records extracted from them.
 *
 * <p>The raw pages are what gets persisted for audit and re-runs; the
 * records are what downstream normalization consumes.
 */
public final class SourcePayload {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<String> pages;
  private final ImmutableList<JsonNode> records;
  private final int attempts;
  private final boolean fromStore;

  private SourcePayload(List<String> pages, List<JsonNode> records, int attempts,
      boolean fromStore) {
    this.pages = ImmutableList.copyOf(pages);
    this.records = ImmutableList.copyOf(records);
    this.attempts = attempts;
    this.fromStore = fromStore;
  }

  /**
   * Creates a payload from pages fetched over the network.
   */
  public static SourcePayload fetched(List<String> pages, List<JsonNode> records, int attempts) {
    return new SourcePayload(pages, records, attempts, false);
  }

  /**
   * Rebuilds a payload from previously stored pages, re-extracting records
   * with the same data path the fetch used.
   *
   * @throws SchemaException if a stored page is not valid JSON
   */
  public static SourcePayload restored(List<String> pages, @Nullable String dataPath)
      throws SchemaException {
    ImmutableList.Builder<JsonNode> records = ImmutableList.builder();
    for (String page : pages) {
      records.addAll(extractRecords(page, dataPath));
    }
    return new SourcePayload(pages, records.build(), 0, true);
  }

  /**
   * Parses a response body and returns the records found at the data path.
   * A missing path yields no records; a single object is wrapped in a list.
   *
   * @throws SchemaException if the body is not JSON
   */
  public static List<JsonNode> extractRecords(String body, @Nullable String dataPath)
      throws SchemaException {
    JsonNode node = navigate(parse(body), dataPath);
    if (node.isMissingNode() || node.isNull()) {
      return ImmutableList.of();
    }
    if (node.isArray()) {
      return ImmutableList.copyOf(node);
    }
    if (node.isObject()) {
      return node.isEmpty() ? ImmutableList.<JsonNode>of() : ImmutableList.of(node);
    }
    throw new SchemaException("Expected array or object at '" + dataPath + "' but found "
        + node.getNodeType());
  }

  static JsonNode parse(String body) throws SchemaException {
    if (body == null || body.trim().isEmpty()) {
      return MAPPER.createObjectNode();
    }
    try {
      return MAPPER.readTree(body);
    } catch (IOException e) {
      throw new SchemaException("Response is not valid JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Navigates a simple JSONPath-like expression ({@code $.a.b} or
   * {@code a.b}). Returns a missing node when any segment is absent.
   */
  static JsonNode navigate(JsonNode root, @Nullable String path) {
    if (path == null || path.isEmpty() || "$".equals(path)) {
      return root;
    }
    String cleanPath = path.startsWith("$.") ? path.substring(2)
        : path.startsWith("$") ? path.substring(1) : path;

    JsonNode current = root;
    for (String part : cleanPath.split("\\.")) {
      current = current.path(part);
      if (current.isMissingNode()) {
        return current;
      }
    }
    return current;
  }

  public ImmutableList<String> getPages() {
    return pages;
  }

  public ImmutableList<JsonNode> getRecords() {
    return records;
  }

  public int getAttempts() {
    return attempts;
  }

  public boolean isFromStore() {
    return fromStore;
  }

  public long getBytes() {
    long total = 0;
    for (String page : pages) {
      total += page.getBytes(StandardCharsets.UTF_8).length;
    }
    return total;
  }

  @Override public String toString() {
    return "SourcePayload{pages=" + pages.size() + ", records=" + records.size()
        + ", attempts=" + attempts + ", fromStore=" + fromStore + "}";
  }
}
