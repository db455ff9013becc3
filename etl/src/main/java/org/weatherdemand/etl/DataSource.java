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

import java.io.IOException;
import java.util.Map;

/**
 * Interface for sources of raw records.
 *
 * <h3>Implementations</h3>
 * <ul>
 *   <li>{@link HttpSource} - REST API responses, with retry and pagination</li>
 *   <li>{@link org.weatherdemand.etl.storage.StoredPayloadSource} - payloads
 *       persisted by an earlier fetch</li>
 * </ul>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * DataSource source = new HttpSource(config);
 * SourcePayload payload = source.fetch(Map.of("stationId", "GHCND:USW00094728"));
 * }</pre>
 */
public interface DataSource {

  /**
   * Fetches data from the source with variable substitution.
   *
   * @param variables Variable values for substitution (e.g., stationId, startDate)
   * @return raw pages and extracted records
   * @throws SourceException If data cannot be fetched or parsed
   * @throws IOException If an I/O error occurs outside the source protocol
   */
  SourcePayload fetch(Map<String, String> variables) throws IOException;

  /**
   * Returns the source type identifier.
   *
   * @return Source type (e.g., "http", "stored")
   */
  String getType();

  /**
   * Closes resources associated with this data source.
   */
  default void close() throws IOException {
    // Default: no-op
  }
}
