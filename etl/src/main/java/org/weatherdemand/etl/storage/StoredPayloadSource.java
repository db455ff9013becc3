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

import org.weatherdemand.etl.DataSource;
import org.weatherdemand.etl.SchemaException;
import org.weatherdemand.etl.SourcePayload;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Map;

/**
 * {@link DataSource} that replays a payload saved by {@link RawPayloadStore}.
 *
 * <p>Records are re-extracted from the stored pages with the same data path
 * the live source uses. Variables are ignored; the key fixes what is read.
 */
public class StoredPayloadSource implements DataSource {

  private final RawPayloadStore store;
  private final PayloadKey key;
  private final @Nullable String dataPath;

  public StoredPayloadSource(RawPayloadStore store, PayloadKey key, @Nullable String dataPath) {
    this.store = store;
    this.key = key;
    this.dataPath = dataPath;
  }

  @Override public SourcePayload fetch(Map<String, String> variables) throws IOException {
    ImmutableList<String> pages = store.loadPages(key);
    if (pages == null) {
      throw new SchemaException("No stored payload for " + key);
    }
    return SourcePayload.restored(pages, dataPath);
  }

  @Override public String getType() {
    return "stored";
  }
}
