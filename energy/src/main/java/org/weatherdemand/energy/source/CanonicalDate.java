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

import java.time.LocalDate;

/**
 * A record's date after canonicalization, with where it came from.
 */
public final class CanonicalDate {
  private final LocalDate date;
  private final DateProvenance provenance;

  public CanonicalDate(LocalDate date, DateProvenance provenance) {
    this.date = date;
    this.provenance = provenance;
  }

  public LocalDate getDate() {
    return date;
  }

  public DateProvenance getProvenance() {
    return provenance;
  }

  @Override public String toString() {
    return date + " (" + provenance + ")";
  }
}
