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

import org.weatherdemand.energy.model.MergedRecord;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The validated table, with suspect rows flagged rather than removed, and
 * the report describing it.
 */
public final class ValidationOutcome {
  private final ImmutableList<MergedRecord> records;
  private final QualityReport report;

  public ValidationOutcome(List<MergedRecord> records, QualityReport report) {
    this.records = ImmutableList.copyOf(records);
    this.report = report;
  }

  public ImmutableList<MergedRecord> getRecords() {
    return records;
  }

  public QualityReport getReport() {
    return report;
  }
}
