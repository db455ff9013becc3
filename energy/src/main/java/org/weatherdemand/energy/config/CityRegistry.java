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
package org.weatherdemand.energy.config;

import org.weatherdemand.energy.UnknownCityException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves city names to their configured entry. Lookups ignore case and
 * surrounding whitespace.
 */
public final class CityRegistry {

  private final ImmutableMap<String, CityEntry> byKey;

  public CityRegistry(List<CityEntry> cities) {
    Map<String, CityEntry> map = new LinkedHashMap<String, CityEntry>();
    for (CityEntry city : cities) {
      CityEntry previous = map.put(city.key(), city);
      if (previous != null) {
        throw new IllegalArgumentException("City configured twice: " + city.getName());
      }
    }
    this.byKey = ImmutableMap.copyOf(map);
  }

  /**
   * Returns the entry for a city.
   *
   * @throws UnknownCityException if no configured city matches
   */
  public CityEntry resolve(String city) {
    if (city == null) {
      throw new UnknownCityException("null");
    }
    CityEntry entry = byKey.get(CityEntry.normalize(city));
    if (entry == null) {
      throw new UnknownCityException(city);
    }
    return entry;
  }

  public boolean contains(String city) {
    return city != null && byKey.containsKey(CityEntry.normalize(city));
  }

  /** Cities in configuration order. */
  public ImmutableList<CityEntry> all() {
    return byKey.values().asList();
  }

  public int size() {
    return byKey.size();
  }
}
