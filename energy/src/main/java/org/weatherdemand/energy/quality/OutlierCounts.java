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
package org.weatherdemand.energy.quality;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Map;
import java.util.TreeMap;

/**
 * Outlier counts keyed by {@link OutlierKey}. Flat by construction, so
 * totals across cities are plain sums.
 */
public final class OutlierCounts {

  private static final OutlierCounts EMPTY = new OutlierCounts(new TreeMap<OutlierKey, Integer>());

  private final ImmutableSortedMap<OutlierKey, Integer> counts;

  private OutlierCounts(Map<OutlierKey, Integer> counts) {
    this.counts = ImmutableSortedMap.copyOf(counts);
  }

  public static OutlierCounts empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Sums counts key by key.
   */
  public static OutlierCounts sum(Iterable<OutlierCounts> parts) {
    Builder builder = builder();
    for (OutlierCounts part : parts) {
      builder.addAll(part);
    }
    return builder.build();
  }

  public int get(OutlierKey key) {
    Integer count = counts.get(key);
    return count == null ? 0 : count;
  }

  public int total() {
    int total = 0;
    for (int count : counts.values()) {
      total += count;
    }
    return total;
  }

  public ImmutableSortedMap<OutlierKey, Integer> asMap() {
    return counts;
  }

  public boolean isEmpty() {
    return counts.isEmpty();
  }

  @Override public boolean equals(Object o) {
    return this == o || (o instanceof OutlierCounts && counts.equals(((OutlierCounts) o).counts));
  }

  @Override public int hashCode() {
    return counts.hashCode();
  }

  @Override public String toString() {
    return counts.toString();
  }

  /**
   * Builder for OutlierCounts.
   */
  public static class Builder {
    private final Map<OutlierKey, Integer> counts = new TreeMap<OutlierKey, Integer>();

    public Builder increment(OutlierKey key) {
      return add(key, 1);
    }

    public Builder add(OutlierKey key, int count) {
      if (count < 0) {
        throw new IllegalArgumentException("count must not be negative");
      }
      counts.merge(key, count, Integer::sum);
      return this;
    }

    public Builder addAll(OutlierCounts other) {
      for (Map.Entry<OutlierKey, Integer> e : other.counts.entrySet()) {
        add(e.getKey(), e.getValue());
      }
      return this;
    }

    public OutlierCounts build() {
      return new OutlierCounts(counts);
    }
  }
}
