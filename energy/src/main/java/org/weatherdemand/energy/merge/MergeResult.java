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
package org.weatherdemand.energy.merge;

import org.weatherdemand.energy.model.MergedRecord;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.List;
import java.util.Map;

/**
 * The merged table plus what the join discarded.
 */
public final class MergeResult {
  private final ImmutableList<MergedRecord> records;
  private final ImmutableSortedMap<String, Integer> joinLosses;

  public MergeResult(List<MergedRecord> records, Map<String, Integer> joinLosses) {
    this.records = ImmutableList.copyOf(records);
    this.joinLosses = ImmutableSortedMap.copyOf(joinLosses);
  }

  /** Rows in (city, date) order. */
  public ImmutableList<MergedRecord> getRecords() {
    return records;
  }

  /**
   * Rows dropped by the join: {@code unmatched_weather},
   * {@code unmatched_demand}, {@code duplicate_weather} and
   * {@code duplicate_demand}.
   */
  public ImmutableSortedMap<String, Integer> getJoinLosses() {
    return joinLosses;
  }

  public int getJoinLoss(String key) {
    Integer count = joinLosses.get(key);
    return count == null ? 0 : count;
  }
}
