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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for an HTTP data source.
 *
 * <p>HttpSourceConfig defines how to fetch data from a REST API: URL, query
 * parameters (a parameter may repeat), headers, authentication, response
 * parsing, offset pagination, rate limiting and the retry policy.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * source:
 *   url: "https://www.ncei.noaa.gov/cdo-web/api/v2/data"
 *   parameters:
 *     datasetid: GHCND
 *     stationid: "{stationId}"
 *     datatypeid: [TMAX, TMIN, PRCP]
 *   auth:
 *     type: apiKey
 *     location: header
 *     name: token
 *     value: "{env:NOAA_API_KEY}"
 *   response:
 *     dataPath: "$.results"
 *     pagination:
 *       type: offset
 *       limitParam: limit
 *       offsetParam: offset
 *       pageSize: 1000
 *       firstOffset: 1
 *       totalPath: "$.metadata.resultset.count"
 *   rateLimit:
 *     requestsPerSecond: 5
 *   retry:
 *     maxAttempts: 3
 *     baseDelayMs: 1000
 * }</pre>
 *
 * @see HttpSource
 */
public class HttpSourceConfig {

  /**
   * Authentication types.
   */
  public enum AuthType {
    NONE, API_KEY
  }

  /**
   * Authentication location.
   */
  public enum AuthLocation {
    HEADER, QUERY
  }

  /**
   * Pagination types.
   */
  public enum PaginationType {
    NONE, OFFSET
  }

  private final String url;
  private final Map<String, List<String>> parameters;
  private final Map<String, String> headers;
  private final AuthConfig auth;
  private final ResponseConfig response;
  private final int requestsPerSecond;
  private final int requestTimeoutSeconds;
  private final RetryPolicy retry;

  private HttpSourceConfig(Builder builder) {
    this.url = builder.url;
    Map<String, List<String>> params = new LinkedHashMap<String, List<String>>();
    for (Map.Entry<String, List<String>> e : builder.parameters.entrySet()) {
      params.put(e.getKey(), Collections.unmodifiableList(new ArrayList<String>(e.getValue())));
    }
    this.parameters = Collections.unmodifiableMap(params);
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.headers));
    this.auth = builder.auth != null ? builder.auth : AuthConfig.none();
    this.response = builder.response != null ? builder.response : ResponseConfig.defaults();
    this.requestsPerSecond = builder.requestsPerSecond;
    this.requestTimeoutSeconds = builder.requestTimeoutSeconds;
    this.retry = builder.retry != null ? builder.retry : RetryPolicy.defaults();
  }

  public String getUrl() {
    return url;
  }

  public Map<String, List<String>> getParameters() {
    return parameters;
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  public AuthConfig getAuth() {
    return auth;
  }

  public ResponseConfig getResponse() {
    return response;
  }

  public int getRequestsPerSecond() {
    return requestsPerSecond;
  }

  public int getRequestTimeoutSeconds() {
    return requestTimeoutSeconds;
  }

  public RetryPolicy getRetry() {
    return retry;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-populated with this configuration.
   */
  public Builder toBuilder() {
    Builder builder = new Builder()
        .url(url)
        .headers(headers)
        .auth(auth)
        .response(response)
        .requestsPerSecond(requestsPerSecond)
        .requestTimeoutSeconds(requestTimeoutSeconds)
        .retry(retry);
    for (Map.Entry<String, List<String>> e : parameters.entrySet()) {
      builder.parameter(e.getKey(), e.getValue().toArray(new String[0]));
    }
    return builder;
  }

  @SuppressWarnings("unchecked")
  public static @Nullable HttpSourceConfig fromMap(@Nullable Map<String, Object> map) {
    if (map == null) {
      return null;
    }

    Builder builder = builder();
    builder.url((String) map.get("url"));

    Object paramsObj = map.get("parameters");
    if (paramsObj instanceof Map) {
      for (Map.Entry<?, ?> e : ((Map<?, ?>) paramsObj).entrySet()) {
        String name = String.valueOf(e.getKey());
        if (e.getValue() instanceof List) {
          List<String> values = new ArrayList<String>();
          for (Object v : (List<?>) e.getValue()) {
            values.add(String.valueOf(v));
          }
          builder.parameter(name, values.toArray(new String[0]));
        } else {
          builder.parameter(name, String.valueOf(e.getValue()));
        }
      }
    }

    Object headersObj = map.get("headers");
    if (headersObj instanceof Map) {
      Map<String, String> hdrs = new LinkedHashMap<String, String>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) headersObj).entrySet()) {
        hdrs.put(String.valueOf(e.getKey()), String.valueOf(e.getValue()));
      }
      builder.headers(hdrs);
    }

    Object authObj = map.get("auth");
    if (authObj instanceof Map) {
      builder.auth(AuthConfig.fromMap((Map<String, Object>) authObj));
    }

    Object responseObj = map.get("response");
    if (responseObj instanceof Map) {
      builder.response(ResponseConfig.fromMap((Map<String, Object>) responseObj));
    }

    Object rateLimitObj = map.get("rateLimit");
    if (rateLimitObj instanceof Map) {
      Object rps = ((Map<String, Object>) rateLimitObj).get("requestsPerSecond");
      if (rps instanceof Number) {
        builder.requestsPerSecond(((Number) rps).intValue());
      }
    }

    Object timeoutObj = map.get("requestTimeoutSeconds");
    if (timeoutObj instanceof Number) {
      builder.requestTimeoutSeconds(((Number) timeoutObj).intValue());
    }

    Object retryObj = map.get("retry");
    if (retryObj instanceof Map) {
      builder.retry(RetryPolicy.fromMap((Map<String, Object>) retryObj));
    }

    return builder.build();
  }

  /**
   * Authentication configuration.
   */
  public static class AuthConfig {
    private final AuthType type;
    private final AuthLocation location;
    private final @Nullable String name;
    private final @Nullable String value;

    private AuthConfig(AuthType type, AuthLocation location, @Nullable String name,
        @Nullable String value) {
      this.type = type;
      this.location = location;
      this.name = name;
      this.value = value;
    }

    public static AuthConfig none() {
      return new AuthConfig(AuthType.NONE, AuthLocation.HEADER, null, null);
    }

    public static AuthConfig apiKey(AuthLocation location, String name, String value) {
      return new AuthConfig(AuthType.API_KEY, location, name, value);
    }

    public AuthType getType() {
      return type;
    }

    public AuthLocation getLocation() {
      return location;
    }

    public @Nullable String getName() {
      return name;
    }

    public @Nullable String getValue() {
      return value;
    }

    public static AuthConfig fromMap(@Nullable Map<String, Object> map) {
      if (map == null) {
        return none();
      }
      String typeStr = (String) map.get("type");
      if (typeStr == null) {
        return none();
      }

      AuthType type;
      try {
        // camelCase or kebab-case -> UPPER_SNAKE_CASE
        String normalized = typeStr
            .replaceAll("([a-z])([A-Z])", "$1_$2")
            .replace("-", "_")
            .toUpperCase();
        type = AuthType.valueOf(normalized);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown auth type: " + typeStr, e);
      }

      String locationStr = (String) map.get("location");
      AuthLocation location = locationStr != null
          ? AuthLocation.valueOf(locationStr.toUpperCase())
          : AuthLocation.HEADER;

      return new AuthConfig(type, location, (String) map.get("name"), (String) map.get("value"));
    }
  }

  /**
   * Response parsing configuration.
   */
  public static class ResponseConfig {
    private final @Nullable String dataPath;
    private final PaginationConfig pagination;

    private ResponseConfig(@Nullable String dataPath, PaginationConfig pagination) {
      this.dataPath = dataPath;
      this.pagination = pagination;
    }

    public static ResponseConfig defaults() {
      return new ResponseConfig(null, PaginationConfig.none());
    }

    public static ResponseConfig of(@Nullable String dataPath, PaginationConfig pagination) {
      return new ResponseConfig(dataPath, pagination);
    }

    public @Nullable String getDataPath() {
      return dataPath;
    }

    public PaginationConfig getPagination() {
      return pagination;
    }

    @SuppressWarnings("unchecked")
    public static ResponseConfig fromMap(@Nullable Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      Object paginationObj = map.get("pagination");
      PaginationConfig pagination = paginationObj instanceof Map
          ? PaginationConfig.fromMap((Map<String, Object>) paginationObj)
          : PaginationConfig.none();
      return new ResponseConfig((String) map.get("dataPath"), pagination);
    }
  }

  /**
   * Offset pagination configuration.
   *
   * <p>{@code firstOffset} is 1 for APIs with 1-based offsets (NOAA) and 0
   * otherwise. When {@code totalPath} is set, paging stops once the reported
   * total has been read; otherwise it stops on a short page.
   */
  public static class PaginationConfig {
    private final PaginationType type;
    private final @Nullable String limitParam;
    private final @Nullable String offsetParam;
    private final int pageSize;
    private final int firstOffset;
    private final @Nullable String totalPath;

    private PaginationConfig(PaginationType type, @Nullable String limitParam,
        @Nullable String offsetParam, int pageSize, int firstOffset,
        @Nullable String totalPath) {
      this.type = type;
      this.limitParam = limitParam;
      this.offsetParam = offsetParam;
      this.pageSize = pageSize;
      this.firstOffset = firstOffset;
      this.totalPath = totalPath;
    }

    public static PaginationConfig none() {
      return new PaginationConfig(PaginationType.NONE, null, null, 0, 0, null);
    }

    public static PaginationConfig offset(String limitParam, String offsetParam, int pageSize,
        int firstOffset, @Nullable String totalPath) {
      if (pageSize <= 0) {
        throw new IllegalArgumentException("pageSize must be positive");
      }
      return new PaginationConfig(PaginationType.OFFSET, limitParam, offsetParam,
          pageSize, firstOffset, totalPath);
    }

    public PaginationType getType() {
      return type;
    }

    public @Nullable String getLimitParam() {
      return limitParam;
    }

    public @Nullable String getOffsetParam() {
      return offsetParam;
    }

    public int getPageSize() {
      return pageSize;
    }

    public int getFirstOffset() {
      return firstOffset;
    }

    public @Nullable String getTotalPath() {
      return totalPath;
    }

    public static PaginationConfig fromMap(@Nullable Map<String, Object> map) {
      if (map == null) {
        return none();
      }
      String typeStr = (String) map.get("type");
      PaginationType type = typeStr != null
          ? PaginationType.valueOf(typeStr.toUpperCase())
          : PaginationType.NONE;
      if (type == PaginationType.NONE) {
        return none();
      }

      int pageSize = 1000;
      Object pageSizeObj = map.get("pageSize");
      if (pageSizeObj instanceof Number) {
        pageSize = ((Number) pageSizeObj).intValue();
      }
      int firstOffset = 0;
      Object firstOffsetObj = map.get("firstOffset");
      if (firstOffsetObj instanceof Number) {
        firstOffset = ((Number) firstOffsetObj).intValue();
      }

      return offset(
          (String) map.get("limitParam"),
          (String) map.get("offsetParam"),
          pageSize,
          firstOffset,
          (String) map.get("totalPath"));
    }
  }

  /**
   * Builder for HttpSourceConfig.
   */
  public static class Builder {
    private String url;
    private final Map<String, List<String>> parameters = new LinkedHashMap<String, List<String>>();
    private final Map<String, String> headers = new LinkedHashMap<String, String>();
    private AuthConfig auth;
    private ResponseConfig response;
    private int requestsPerSecond = 5;
    private int requestTimeoutSeconds = 60;
    private RetryPolicy retry;

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    /** Adds a query parameter; several values repeat the parameter. */
    public Builder parameter(String name, String... values) {
      parameters.put(name, Arrays.asList(values));
      return this;
    }

    public Builder parameters(Map<String, String> parameters) {
      for (Map.Entry<String, String> e : parameters.entrySet()) {
        parameter(e.getKey(), e.getValue());
      }
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(name, value);
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      this.headers.putAll(headers);
      return this;
    }

    public Builder auth(AuthConfig auth) {
      this.auth = auth;
      return this;
    }

    public Builder response(ResponseConfig response) {
      this.response = response;
      return this;
    }

    public Builder requestsPerSecond(int requestsPerSecond) {
      this.requestsPerSecond = requestsPerSecond;
      return this;
    }

    public Builder requestTimeoutSeconds(int requestTimeoutSeconds) {
      this.requestTimeoutSeconds = requestTimeoutSeconds;
      return this;
    }

    public Builder retry(RetryPolicy retry) {
      this.retry = retry;
      return this;
    }

    public HttpSourceConfig build() {
      if (url == null || url.isEmpty()) {
        throw new IllegalArgumentException("URL is required");
      }
      return new HttpSourceConfig(this);
    }
  }
}
