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

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Resolves the date of a raw source record.
 *
 * <p>The {@code date} field is used when present and non-null; otherwise
 * {@code period}. Values may carry a time part ({@code 2024-01-01T00:00:00},
 * {@code 2024-01-01T05}); only the leading ISO date is kept. A record with
 * neither field, or with a value that does not start with an ISO date, is a
 * schema error. Retrying will not fix it.
 */
public final class DateCanonicalizer {

  private static final int ISO_DATE_LENGTH = 10;

  private DateCanonicalizer() {
  }

  public static CanonicalDate canonicalize(JsonNode record) throws SchemaException {
    for (DateProvenance.Field field : DateProvenance.Field.values()) {
      JsonNode value = record.get(field.jsonName());
      if (value != null && !value.isNull() && !value.asText().trim().isEmpty()) {
        String raw = value.asText();
        return new CanonicalDate(parse(raw, field), new DateProvenance(field, raw));
      }
    }
    throw new SchemaException("Record has neither 'date' nor 'period': " + abbreviate(record));
  }

  private static LocalDate parse(String raw, DateProvenance.Field field) throws SchemaException {
    String trimmed = raw.trim();
    String datePart = trimmed.length() > ISO_DATE_LENGTH
        ? trimmed.substring(0, ISO_DATE_LENGTH)
        : trimmed;
    try {
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException e) {
      throw new SchemaException("Unparseable " + field.jsonName() + " value '" + raw + "'", e);
    }
  }

  private static String abbreviate(JsonNode record) {
    String text = record.toString();
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
