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
package org.weatherdemand.etl;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HttpSource} against a scripted transport.
 */
@Tag("unit")
public class HttpSourceTest {

  private static final String URL = "https://api.example.com/data";

  @AfterEach void clearProperties() {
    System.clearProperty("WD_TEST_TOKEN");
  }

  private static HttpSourceConfig.Builder baseConfig() {
    return HttpSourceConfig.builder()
        .url(URL)
        .requestsPerSecond(0)
        .retry(RetryPolicy.builder().maxAttempts(3).baseDelayMs(100).jitter(0).build())
        .response(HttpSourceConfig.ResponseConfig.of("$.results",
            HttpSourceConfig.PaginationConfig.none()));
  }

  @Test void testSingleRequestExtractsRecords() throws IOException {
    ScriptedTransport transport = new ScriptedTransport()
        .respond(200, "{\"results\":[{\"v\":1},{\"v\":2}]}");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    SourcePayload payload = source.fetch(Collections.<String, String>emptyMap());

    assertEquals(2, payload.getRecords().size());
    assertEquals(1, payload.getPages().size());
    assertEquals(1, payload.getAttempts());
    assertEquals(2, payload.getRecords().get(1).path("v").asInt());
    assertFalse(payload.isFromStore());
  }

  @Test void testRepeatedParametersAndVariables() throws IOException {
    HttpSourceConfig config = baseConfig()
        .parameter("stationid", "{stationId}")
        .parameter("datatypeid", "TMAX", "TMIN", "PRCP")
        .build();
    ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");
    HttpSource source = HttpSource.withSleeper(config, transport, new RecordingSleeper());

    source.fetch(ImmutableMap.of("stationId", "GHCND:USW00094728"));

    assertEquals(URL + "?stationid=GHCND%3AUSW00094728"
        + "&datatypeid=TMAX&datatypeid=TMIN&datatypeid=PRCP", transport.getUrls().get(0));
  }

  @Test void testEmptyObjectBodyYieldsNoRecords() throws IOException {
    ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    assertTrue(source.fetch(null).getRecords().isEmpty());
  }

  @Test void testHeaderApiKeyFromSystemProperty() throws IOException {
    System.setProperty("WD_TEST_TOKEN", "secret-token");
    HttpSourceConfig config = baseConfig()
        .auth(HttpSourceConfig.AuthConfig.apiKey(HttpSourceConfig.AuthLocation.HEADER,
            "token", "{env:WD_TEST_TOKEN}"))
        .build();
    ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");

    HttpSource.withSleeper(config, transport, new RecordingSleeper()).fetch(null);

    assertEquals("secret-token", transport.getHeaders().get(0).get("token"));
    assertThat(transport.getUrls().get(0), not(containsString("secret-token")));
  }

  @Test void testQueryApiKey() throws IOException {
    System.setProperty("WD_TEST_TOKEN", "k1");
    HttpSourceConfig config = baseConfig()
        .auth(HttpSourceConfig.AuthConfig.apiKey(HttpSourceConfig.AuthLocation.QUERY,
            "api_key", "{env:WD_TEST_TOKEN}"))
        .build();
    ScriptedTransport transport = new ScriptedTransport().respond(200, "{}");

    HttpSource.withSleeper(config, transport, new RecordingSleeper()).fetch(null);

    assertEquals(URL + "?api_key=k1", transport.getUrls().get(0));
  }

  @Test void testMissingCredentialFailsBeforeAnyRequest() {
    HttpSourceConfig config = baseConfig()
        .auth(HttpSourceConfig.AuthConfig.apiKey(HttpSourceConfig.AuthLocation.HEADER,
            "token", "{env:WD_TEST_TOKEN}"))
        .build();
    ScriptedTransport transport = new ScriptedTransport();

    assertThrows(AuthException.class,
        () -> HttpSource.withSleeper(config, transport, new RecordingSleeper()).fetch(null));
    assertEquals(0, transport.requestCount());
  }

  @Test void testUnauthorizedIsNotRetried() {
    ScriptedTransport transport = new ScriptedTransport()
        .respond(401, "{\"error\":\"bad token\"}");
    RecordingSleeper sleeper = new RecordingSleeper();
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport, sleeper);

    AuthException e = assertThrows(AuthException.class, () -> source.fetch(null));

    assertEquals(401, e.getStatusCode());
    assertEquals(1, transport.requestCount());
    assertTrue(sleeper.getSleeps().isEmpty());
  }

  @Test void testForbiddenIsAuthFailure() {
    ScriptedTransport transport = new ScriptedTransport().respond(403, "");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    assertThrows(AuthException.class, () -> source.fetch(null));
    assertEquals(1, transport.requestCount());
  }

  @Test void testServerErrorsRetriedThenSucceed() throws IOException {
    ScriptedTransport transport = new ScriptedTransport()
        .respond(503, "unavailable")
        .fail(new IOException("connection reset"))
        .respond(200, "{\"results\":[{\"v\":1}]}");
    RecordingSleeper sleeper = new RecordingSleeper();
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport, sleeper);

    SourcePayload payload = source.fetch(null);

    assertEquals(1, payload.getRecords().size());
    assertEquals(3, payload.getAttempts());
    assertEquals(Arrays.asList(100L, 200L), sleeper.getSleeps());
  }

  @Test void testServerErrorsExhaustBudget() {
    ScriptedTransport transport = new ScriptedTransport()
        .respond(500, "a")
        .respond(500, "b")
        .respond(500, "c");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    FetchException e = assertThrows(FetchException.class, () -> source.fetch(null));

    assertEquals(3, e.getAttempts());
    assertEquals(3, transport.requestCount());
  }

  @Test void testNotFoundIsPermanent() {
    ScriptedTransport transport = new ScriptedTransport().respond(404, "missing");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    FetchException e = assertThrows(FetchException.class, () -> source.fetch(null));

    assertEquals(404, e.getStatusCode());
    assertFalse(e.isTransient());
    assertEquals(1, transport.requestCount());
  }

  @Test void testMalformedBodyIsSchemaFailure() {
    ScriptedTransport transport = new ScriptedTransport().respond(200, "<html>oops</html>");
    HttpSource source = HttpSource.withSleeper(baseConfig().build(), transport,
        new RecordingSleeper());

    assertThrows(SchemaException.class, () -> source.fetch(null));
    assertEquals(1, transport.requestCount());
  }

  @Test void testOffsetPaginationStopsAtReportedTotal() throws IOException {
    HttpSourceConfig config = baseConfig()
        .response(HttpSourceConfig.ResponseConfig.of("$.results",
            HttpSourceConfig.PaginationConfig.offset("limit", "offset", 2, 1,
                "$.metadata.resultset.count")))
        .build();
    ScriptedTransport transport = new ScriptedTransport()
        .respond(200, "{\"metadata\":{\"resultset\":{\"count\":4}},"
            + "\"results\":[{\"v\":1},{\"v\":2}]}")
        .respond(200, "{\"metadata\":{\"resultset\":{\"count\":4}},"
            + "\"results\":[{\"v\":3},{\"v\":4}]}");
    HttpSource source = HttpSource.withSleeper(config, transport, new RecordingSleeper());

    SourcePayload payload = source.fetch(null);

    assertEquals(4, payload.getRecords().size());
    assertEquals(2, payload.getPages().size());
    assertEquals(URL + "?limit=2&offset=1", transport.getUrls().get(0));
    assertEquals(URL + "?limit=2&offset=3", transport.getUrls().get(1));
  }

  @Test void testOffsetPaginationStopsOnShortPage() throws IOException {
    HttpSourceConfig config = baseConfig()
        .response(HttpSourceConfig.ResponseConfig.of("$.response.data",
            HttpSourceConfig.PaginationConfig.offset("length", "offset", 2, 0, null)))
        .build();
    ScriptedTransport transport = new ScriptedTransport()
        .respond(200, "{\"response\":{\"data\":[{\"v\":1},{\"v\":2}]}}")
        .respond(200, "{\"response\":{\"data\":[{\"v\":3}]}}");
    HttpSource source = HttpSource.withSleeper(config, transport, new RecordingSleeper());

    SourcePayload payload = source.fetch(null);

    assertEquals(3, payload.getRecords().size());
    assertEquals(2, transport.requestCount());
    assertThat(transport.getUrls().get(1), containsString("offset=2"));
  }

  @Test void testTimeoutCoversAllPagesOfOneFetch() {
    HttpSourceConfig config = baseConfig()
        .retry(RetryPolicy.builder().maxAttempts(3).baseDelayMs(100).jitter(0)
            .timeoutMs(250).build())
        .response(HttpSourceConfig.ResponseConfig.of("$.results",
            HttpSourceConfig.PaginationConfig.offset("limit", "offset", 1, 0, null)))
        .build();
    ScriptedTransport transport = new ScriptedTransport();
    for (int page = 0; page < 5; page++) {
      transport.respond(503, "busy").respond(200, "{\"results\":[{\"v\":" + page + "}]}");
    }
    RecordingSleeper sleeper = new RecordingSleeper();
    HttpSource source = new HttpSource(config, transport,
        new RetryExecutor(config.getRetry(), sleeper, sleeper::now, new Random(0)),
        sleeper, sleeper::now);

    FetchException e = assertThrows(FetchException.class, () -> source.fetch(null));

    // Two pages fit in 250ms with one 100ms backoff each; the third cannot retry.
    assertEquals(Arrays.asList(100L, 100L), sleeper.getSleeps());
    assertEquals(5, transport.requestCount());
    assertEquals(503, e.getStatusCode());
    assertFalse(e.isTransient());
  }

  @Test void testRateLimitSpacesRequests() throws IOException {
    HttpSourceConfig config = baseConfig().requestsPerSecond(5).build();
    ScriptedTransport transport = new ScriptedTransport()
        .respond(200, "{}")
        .respond(200, "{}");
    RecordingSleeper sleeper = new RecordingSleeper();
    HttpSource source = new HttpSource(config, transport,
        new RetryExecutor(config.getRetry(), sleeper, sleeper::now, new Random(0)),
        sleeper, sleeper::now);

    source.fetch(null);
    source.fetch(null);

    assertEquals(Collections.singletonList(200L), sleeper.getSleeps());
  }

  @Test void testSubstituteVariablesKeepsUnknownPlaceholders() {
    Map<String, String> vars = new LinkedHashMap<String, String>();
    vars.put("start", "2024-01-01");

    assertEquals("2024-01-01..{end}",
        HttpSource.substituteVariables("{start}..{end}", vars));
  }

  @Test void testBuildUrlAppendsToExistingQuery() {
    Map<String, List<String>> params = new LinkedHashMap<String, List<String>>();
    params.put("facets[type][]", Collections.singletonList("D"));

    assertEquals("https://h/p?x=1&facets%5Btype%5D%5B%5D=D",
        HttpSource.buildUrlWithParams("https://h/p?x=1", params));
  }
}
