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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link PayloadKey}.
 */
@Tag("unit")
public class PayloadKeyTest {

  private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
  private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);

  @Test void testKeyStringAndPath() {
    PayloadKey key = new PayloadKey("eia", "Los Angeles", JAN_1, JAN_31);

    assertEquals("eia:entity=Los Angeles:end=2024-01-31:start=2024-01-01", key.asString());
    assertEquals("eia/los_angeles/2024-01-01_2024-01-31.json", key.relativePath());
  }

  @Test void testEquality() {
    assertEquals(new PayloadKey("eia", "Chicago", JAN_1, JAN_31),
        new PayloadKey("eia", "Chicago", JAN_1, JAN_31));
    assertNotEquals(new PayloadKey("eia", "Chicago", JAN_1, JAN_31),
        new PayloadKey("noaa", "Chicago", JAN_1, JAN_31));
  }

  @Test void testReversedRangeRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new PayloadKey("eia", "Chicago", JAN_31, JAN_1));
  }

  @Test void testSlugStripsPunctuation() {
    assertEquals("st_louis_mo", PayloadKey.slug("  St. Louis, MO "));
  }
}
