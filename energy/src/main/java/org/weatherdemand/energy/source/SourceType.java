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

/**
 * Upstream data sources.
 */
public enum SourceType {
  NOAA("noaa", "weather"),
  EIA("eia", "demand");

  private final String id;
  private final String dataset;

  SourceType(String id, String dataset) {
    this.id = id;
    this.dataset = dataset;
  }

  /** Short identifier used in storage paths and report keys. */
  public String id() {
    return id;
  }

  /** What the source provides. */
  public String dataset() {
    return dataset;
  }
}
