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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.LongSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP data source that fetches JSON records from REST APIs.
 *
 * <p>HttpSource implements the {@link DataSource} interface with support for:
 * <ul>
 *   <li>Variable substitution in URL, parameters, and headers</li>
 *   <li>Environment variable references ({@code {env:VAR_NAME}})</li>
 *   <li>Offset pagination, bounded by a reported total or a short page</li>
 *   <li>Rate limiting, and per-page retries through {@link RetryExecutor} under
 *       one timeout for the whole fetch</li>
 *   <li>JSONPath data extraction</li>
 * </ul>
 *
 * <p>Response statuses are classified before any retry decision: 401 and
 * 403 raise {@link AuthException}; 429 and 5xx raise a transient
 * {@link FetchException}; any other non-2xx raises a permanent one. A 2xx
 * body that is not JSON raises {@link SchemaException}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * HttpSourceConfig config = HttpSourceConfig.builder()
 *     .url("https://api.eia.gov/v2/electricity/rto/daily-region-data/data/")
 *     .parameter("facets[respondent][]", "{respondent}")
 *     .auth(AuthConfig.apiKey(AuthLocation.QUERY, "api_key", "{env:EIA_API_KEY}"))
 *     .build();
 *
 * HttpSource source = new HttpSource(config);
 * SourcePayload payload = source.fetch(Map.of("respondent", "NYIS"));
 * }</pre>
 *
 * @see HttpSourceConfig
 * @see DataSource
 */
public class HttpSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSource.class);
  private static final Pattern VAR_PATTERN = Pattern.compile("\\{([^}]+)\\}");
  private static final Pattern ENV_PATTERN = Pattern.compile("env:(.+)");

  /** Upper bound on pages per fetch, in case a server ignores the offset. */
  private static final int MAX_PAGES = 10_000;

  private final HttpSourceConfig config;
  private final HttpTransport transport;
  private final RetryExecutor retryExecutor;
  private final Sleeper sleeper;
  private final LongSupplier clockMillis;
  private long lastRequestTime;

  /**
   * Creates a new HttpSource with the given configuration.
   *
   * @param config HTTP source configuration
   */
  public HttpSource(HttpSourceConfig config) {
    this(config, new JdkHttpTransport());
  }

  public HttpSource(HttpSourceConfig config, HttpTransport transport) {
    this(config, transport, new RetryExecutor(config.getRetry()), Sleeper.SYSTEM,
        System::currentTimeMillis);
  }

  /**
   * Creates a source with explicit collaborators; tests supply a scripted
   * transport and a sleeper that does not block.
   */
  public HttpSource(HttpSourceConfig config, HttpTransport transport,
      RetryExecutor retryExecutor, Sleeper sleeper, LongSupplier clockMillis) {
    this.config = config;
    this.transport = transport;
    this.retryExecutor = retryExecutor;
    this.sleeper = sleeper;
    this.clockMillis = clockMillis;
    this.lastRequestTime = 0;
  }

  /**
   * Convenience factory for tests: non-blocking sleeper, fixed seed.
   */
  @VisibleForTesting
  static HttpSource withSleeper(HttpSourceConfig config, HttpTransport transport,
      Sleeper sleeper) {
    return new HttpSource(config, transport,
        new RetryExecutor(config.getRetry(), sleeper, System::currentTimeMillis, new Random(0)),
        sleeper, System::currentTimeMillis);
  }

  public HttpSourceConfig getConfig() {
    return config;
  }

  @Override public SourcePayload fetch(Map<String, String> variables) throws IOException {
    long startedAt = retryExecutor.now();
    String url = substituteVariables(config.getUrl(), variables);

    Map<String, List<String>> params = new LinkedHashMap<String, List<String>>();
    for (Map.Entry<String, List<String>> e : config.getParameters().entrySet()) {
      List<String> values = new ArrayList<String>(e.getValue().size());
      for (String v : e.getValue()) {
        values.add(substituteVariables(v, variables));
      }
      params.put(e.getKey(), values);
    }

    Map<String, String> headers = new LinkedHashMap<String, String>();
    for (Map.Entry<String, String> e : config.getHeaders().entrySet()) {
      headers.put(e.getKey(), substituteVariables(e.getValue(), variables));
    }
    applyAuth(headers, params, variables);

    String dataPath = config.getResponse().getDataPath();
    HttpSourceConfig.PaginationConfig pagination = config.getResponse().getPagination();
    List<String> pages = new ArrayList<String>();
    List<JsonNode> records = new ArrayList<JsonNode>();
    int attempts = 0;

    if (pagination.getType() == HttpSourceConfig.PaginationType.NONE) {
      RetryOutcome<String> outcome = executeRequest(url, params, headers, startedAt);
      attempts += outcome.getAttempts();
      String body = outcome.getOrThrow();
      pages.add(body);
      records.addAll(SourcePayload.extractRecords(body, dataPath));
    } else {
      int pageSize = pagination.getPageSize();
      int offset = pagination.getFirstOffset();
      long total = -1;
      boolean hasMore = true;

      while (hasMore) {
        Map<String, List<String>> pageParams = new LinkedHashMap<String, List<String>>(params);
        pageParams.put(pagination.getLimitParam(),
            Collections.singletonList(String.valueOf(pageSize)));
        pageParams.put(pagination.getOffsetParam(),
            Collections.singletonList(String.valueOf(offset)));

        RetryOutcome<String> outcome = executeRequest(url, pageParams, headers, startedAt);
        attempts += outcome.getAttempts();
        String body = outcome.getOrThrow();
        List<JsonNode> pageData = SourcePayload.extractRecords(body, dataPath);
        pages.add(body);
        records.addAll(pageData);

        if (total < 0 && pagination.getTotalPath() != null) {
          total = readTotal(body, pagination.getTotalPath());
        }

        if (pageData.isEmpty() || pageData.size() < pageSize) {
          hasMore = false;
        } else if (total >= 0 && records.size() >= total) {
          hasMore = false;
        } else if (pages.size() >= MAX_PAGES) {
          LOGGER.warn("Stopping pagination of {} after {} pages", config.getUrl(), MAX_PAGES);
          hasMore = false;
        }
        offset += pageSize;
      }
    }

    LOGGER.info("Fetched {} records in {} page(s) from {}", records.size(), pages.size(), url);
    return SourcePayload.fetched(pages, records, attempts);
  }

  @Override public String getType() {
    return "http";
  }

  /**
   * Executes one logical request, retrying transient failures. The retry
   * timeout counts from the start of the whole fetch, not of this page.
   */
  private RetryOutcome<String> executeRequest(final String baseUrl,
      Map<String, List<String>> params, final Map<String, String> headers, long startedAt) {
    final String fullUrl = buildUrlWithParams(baseUrl, params);
    return retryExecutor.execute("GET " + baseUrl, () -> doRequest(fullUrl, baseUrl, headers),
        startedAt);
  }

  /**
   * Performs the actual HTTP request and classifies the status.
   */
  private String doRequest(String fullUrl, String displayUrl, Map<String, String> headers)
      throws IOException {
    enforceRateLimit();

    HttpTransport.Response response;
    try {
      response = transport.get(fullUrl, headers,
          Duration.ofSeconds(config.getRequestTimeoutSeconds()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("Interrupted while requesting " + displayUrl,
          FetchException.NO_STATUS, false, e);
    }

    int status = response.getStatusCode();
    LOGGER.debug("HTTP GET {} -> {}", displayUrl, status);

    if (response.isSuccess()) {
      // Malformed JSON is permanent.
      SourcePayload.parse(response.getBody());
      return response.getBody();
    }
    if (status == 401 || status == 403) {
      throw new AuthException("HTTP " + status + " from " + displayUrl
          + ": credentials rejected", status);
    }
    throw FetchException.forStatus(status, displayUrl, response.getBody());
  }

  /**
   * Applies authentication to the headers or the query parameters.
   */
  private void applyAuth(Map<String, String> headers, Map<String, List<String>> params,
      Map<String, String> variables) throws AuthException {
    HttpSourceConfig.AuthConfig auth = config.getAuth();
    if (auth.getType() == HttpSourceConfig.AuthType.NONE) {
      return;
    }

    String value = substituteVariables(auth.getValue(), variables);
    if (value == null || value.isEmpty()) {
      throw new AuthException("No credential configured for " + config.getUrl()
          + " (expected " + auth.getValue() + ")");
    }

    if (auth.getLocation() == HttpSourceConfig.AuthLocation.QUERY) {
      params.put(auth.getName(), Collections.singletonList(value));
    } else {
      headers.put(auth.getName(), value);
    }
  }

  private static long readTotal(String body, String totalPath) throws SchemaException {
    JsonNode node = SourcePayload.navigate(SourcePayload.parse(body), totalPath);
    if (node.isNumber()) {
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (NumberFormatException e) {
        throw new SchemaException("Total at '" + totalPath + "' is not a number: "
            + node.asText(), e);
      }
    }
    return -1;
  }

  /**
   * Substitutes variables in a string.
   * Supports {varName} for variables and {env:VAR_NAME} for environment variables.
   */
  @VisibleForTesting
  static @Nullable String substituteVariables(@Nullable String template,
      @Nullable Map<String, String> variables) {
    if (template == null || template.isEmpty()) {
      return template;
    }

    StringBuilder result = new StringBuilder();
    Matcher matcher = VAR_PATTERN.matcher(template);

    while (matcher.find()) {
      String varExpr = matcher.group(1);
      String replacement;

      Matcher envMatcher = ENV_PATTERN.matcher(varExpr);
      if (envMatcher.matches()) {
        String envName = envMatcher.group(1);
        replacement = System.getenv(envName);
        if (replacement == null) {
          replacement = System.getProperty(envName, "");
        }
      } else {
        replacement = variables != null ? variables.get(varExpr) : null;
        if (replacement == null) {
          replacement = matcher.group(0); // Keep original if not found
        }
      }

      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);

    return result.toString();
  }

  /**
   * Builds URL with query parameters; a parameter with several values is
   * repeated.
   */
  @VisibleForTesting
  static String buildUrlWithParams(String baseUrl, Map<String, List<String>> params) {
    if (params == null || params.isEmpty()) {
      return baseUrl;
    }

    StringBuilder url = new StringBuilder(baseUrl);
    char separator = baseUrl.contains("?") ? '&' : '?';

    for (Map.Entry<String, List<String>> e : params.entrySet()) {
      String name = URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8);
      for (String value : e.getValue()) {
        url.append(separator)
            .append(name)
            .append('=')
            .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
        separator = '&';
      }
    }

    return url.toString();
  }

  /**
   * Enforces rate limiting across all requests made by this source.
   */
  private synchronized void enforceRateLimit() throws FetchException {
    int rps = config.getRequestsPerSecond();
    if (rps <= 0) {
      return;
    }

    long minInterval = 1000 / rps;
    long now = clockMillis.getAsLong();
    long elapsed = now - lastRequestTime;

    if (lastRequestTime > 0 && elapsed < minInterval) {
      try {
        sleeper.sleep(minInterval - elapsed);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FetchException("Interrupted while rate limiting " + config.getUrl(),
            FetchException.NO_STATUS, false, e);
      }
    }

    lastRequestTime = clockMillis.getAsLong();
  }
}
