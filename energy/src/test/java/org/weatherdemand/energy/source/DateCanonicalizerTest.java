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

import org.weatherdemand.etl.SchemaException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link DateCanonicalizer}.
 */
@Tag("unit")
public class DateCanonicalizerTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static JsonNode json(String text) throws IOException {
    return MAPPER.readTree(text);
  }

  @Test void testDateFieldWithTimeSuffix() throws IOException {
    CanonicalDate date = DateCanonicalizer.canonicalize(
        json("{\"date\":\"2024-01-01T00:00:00\",\"value\":3}"));

    assertEquals(LocalDate.of(2024, 1, 1), date.getDate());
    assertEquals(DateProvenance.Field.DATE, date.getProvenance().getField());
    assertEquals("2024-01-01T00:00:00", date.getProvenance().getRawValue());
  }

  @Test void testFallsBackToPeriod() throws IOException {
    CanonicalDate date = DateCanonicalizer.canonicalize(json("{\"period\":\"2024-02-29\"}"));

    assertEquals(LocalDate.of(2024, 2, 29), date.getDate());
    assertEquals(DateProvenance.Field.PERIOD, date.getProvenance().getField());
  }

  @Test void testNullDateUsesPeriod() throws IOException {
    CanonicalDate date = DateCanonicalizer.canonicalize(
        json("{\"date\":null,\"period\":\"2024-03-05T05\"}"));

    assertEquals(LocalDate.of(2024, 3, 5), date.getDate());
    assertEquals(DateProvenance.Field.PERIOD, date.getProvenance().getField());
    assertEquals("2024-03-05T05", date.getProvenance().getRawValue());
  }

  @Test void testDatePreferredWhenBothPresent() throws IOException {
    CanonicalDate date = DateCanonicalizer.canonicalize(
        json("{\"date\":\"2024-03-05\",\"period\":\"2024-03-06\"}"));

    assertEquals(LocalDate.of(2024, 3, 5), date.getDate());
    assertEquals(DateProvenance.Field.DATE, date.getProvenance().getField());
  }

  @Test void testMissingBothFieldsIsSchemaError() throws IOException {
    JsonNode row = json("{\"value\":12}");

    SchemaException e = assertThrows(SchemaException.class,
        () -> DateCanonicalizer.canonicalize(row));
    assertThat(e.getMessage(), containsString("neither 'date' nor 'period'"));
  }

  @Test void testUnparseableValueIsSchemaError() throws IOException {
    JsonNode row = json("{\"period\":\"March 5\"}");

    assertThrows(SchemaException.class, () -> DateCanonicalizer.canonicalize(row));
  }
}
