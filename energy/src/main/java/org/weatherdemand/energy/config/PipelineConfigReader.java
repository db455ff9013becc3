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
package org.weatherdemand.energy.config;

import org.weatherdemand.energy.WeatherDemandException;
import org.weatherdemand.etl.HttpSourceConfig;
import org.weatherdemand.etl.RetryPolicy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@link PipelineConfig} from YAML.
 *
 * <p>String values may reference the environment as {@code {env:NAME}};
 * the environment variable wins, then a system property of the same name.
 * References that resolve to nothing are left in place, so credentials are
 * reported missing when a request is about to be made rather than at load
 * time.
 *
 * <h3>Layout</h3>
 * <pre>{@code
 * cities:
 *   - name: New York
 *     stationId: GHCND:USW00094728
 *     regionId: NYIS
 *     timezone: America/New_York
 *     latitude: 40.7128
 *     longitude: -74.0060
 * quality:
 *   temperatureMinF: -50
 *   temperatureMaxF: 130
 *   demandSpikeMultiplier: 3.0
 *   freshnessMaxAgeDays: 2
 * correlation:
 *   strongCutoff: 0.7
 *   moderateCutoff: 0.4
 *   minSampleSize: 3
 *   combinedEstimate: true
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 1000
 * fetch:
 *   workers: 4
 *   lookbackDays: 90
 *   reuseRawPayloads: false
 * storage:
 *   rawDirectory: "{env:WD_DATA_DIR}/raw"
 * sources:
 *   noaa: { url: ..., parameters: ..., auth: ..., response: ... }
 * }</pre>
 *
 * <p>A {@code sources.noaa} or {@code sources.eia} block replaces the
 * built-in endpoint definition from {@link SourceDefaults} entirely.
 */
public class PipelineConfigReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineConfigReader.class);

  /** Bundled configuration with the default cities. */
  public static final String DEFAULT_RESOURCE = "weather-demand.yaml";

  private static final Pattern ENV_PATTERN = Pattern.compile("\\{env:([^}]+)\\}");
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private final ObjectMapper yamlMapper = new YAMLMapper();
  private final ObjectMapper jsonMapper = new ObjectMapper();
  private final UnaryOperator<String> environment;

  public PipelineConfigReader() {
    this(PipelineConfigReader::lookupEnvironment);
  }

  /**
   * Creates a reader with an explicit environment lookup.
   *
   * @param environment returns the value of a variable, or null if unset
   */
  public PipelineConfigReader(UnaryOperator<String> environment) {
    this.environment = environment;
  }

  private static String lookupEnvironment(String name) {
    String value = System.getenv(name);
    return value != null ? value : System.getProperty(name);
  }

  /**
   * Reads the bundled {@value #DEFAULT_RESOURCE}.
   */
  public PipelineConfig readDefault() {
    try (InputStream in = PipelineConfigReader.class.getResourceAsStream("/" + DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new WeatherDemandException(DEFAULT_RESOURCE + " not found on the classpath");
      }
      return read(in, DEFAULT_RESOURCE);
    } catch (IOException e) {
      throw new WeatherDemandException("Failed to read " + DEFAULT_RESOURCE, e);
    }
  }

  public PipelineConfig read(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in, path.toString());
    } catch (IOException e) {
      throw new WeatherDemandException("Failed to read configuration " + path, e);
    }
  }

  /**
   * Reads a configuration document.
   *
   * @param in YAML (or JSON) content
   * @param name label used in error messages
   * @throws WeatherDemandException if the document is malformed or invalid
   */
  public PipelineConfig read(InputStream in, String name) throws IOException {
    Map<String, Object> raw = yamlMapper.readValue(in, MAP_TYPE);
    if (raw == null) {
      throw new WeatherDemandException("Configuration " + name + " is empty");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> resolved = (Map<String, Object>) substitute(raw);
    JsonNode root = jsonMapper.valueToTree(resolved);

    try {
      PipelineConfig config = build(root, resolved);
      LOGGER.info("Loaded configuration {} with {} cities", name, config.getCities().size());
      return config;
    } catch (IllegalArgumentException e) {
      throw new WeatherDemandException("Invalid configuration " + name + ": " + e.getMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private PipelineConfig build(JsonNode root, Map<String, Object> resolved) {
    PipelineConfig.Builder builder = PipelineConfig.builder();

    for (JsonNode city : root.path("cities")) {
      builder.city(
          new CityEntry(
              text(city, "name"),
              text(city, "stationId"),
              text(city, "regionId"),
              city.path("timezone").asText("UTC"),
              city.path("latitude").asDouble(0),
              city.path("longitude").asDouble(0)));
    }

    JsonNode quality = root.path("quality");
    PipelineConfig.QualitySettings q = PipelineConfig.QualitySettings.defaults();
    if (!quality.isMissingNode()) {
      builder.quality(
          new PipelineConfig.QualitySettings(
              quality.path("temperatureMinF").asDouble(q.getTemperatureMinF()),
              quality.path("temperatureMaxF").asDouble(q.getTemperatureMaxF()),
              quality.path("demandSpikeMultiplier").asDouble(q.getDemandSpikeMultiplier()),
              quality.path("freshnessMaxAgeDays").asInt(q.getFreshnessMaxAgeDays())));
    }

    JsonNode correlation = root.path("correlation");
    PipelineConfig.CorrelationSettings c = PipelineConfig.CorrelationSettings.defaults();
    if (!correlation.isMissingNode()) {
      builder.correlation(
          new PipelineConfig.CorrelationSettings(
              correlation.path("strongCutoff").asDouble(c.getStrongCutoff()),
              correlation.path("moderateCutoff").asDouble(c.getModerateCutoff()),
              correlation.path("minSampleSize").asInt(c.getMinSampleSize()),
              correlation.path("combinedEstimate").asBoolean(c.isCombinedEstimate())));
    }

    Object retry = resolved.get("retry");
    if (retry instanceof Map) {
      builder.retry(RetryPolicy.fromMap((Map<String, Object>) retry));
    }

    JsonNode fetch = root.path("fetch");
    builder.fetchWorkers(fetch.path("workers").asInt(4));
    builder.lookbackDays(fetch.path("lookbackDays").asInt(90));
    builder.reuseRawPayloads(fetch.path("reuseRawPayloads").asBoolean(false));

    JsonNode storage = root.path("storage");
    builder.rawDirectory(storage.path("rawDirectory").asText("data/raw"));
    builder.processedDirectory(storage.path("processedDirectory").asText("data/processed"));
    builder.reportDirectory(storage.path("reportDirectory").asText("data/reports"));

    Object sources = resolved.get("sources");
    if (sources instanceof Map) {
      Map<String, Object> sourceMap = (Map<String, Object>) sources;
      HttpSourceConfig noaa = HttpSourceConfig.fromMap((Map<String, Object>) sourceMap.get("noaa"));
      if (noaa != null) {
        builder.noaaSource(noaa);
      }
      HttpSourceConfig eia = HttpSourceConfig.fromMap((Map<String, Object>) sourceMap.get("eia"));
      if (eia != null) {
        builder.eiaSource(eia);
      }
    }

    return builder.build();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("City entry is missing '" + field + "'");
    }
    return value.asText();
  }

  /**
   * Replaces {@code {env:NAME}} references in every string of a parsed
   * document.
   */
  private Object substitute(Object value) {
    if (value instanceof String) {
      return substituteString((String) value);
    }
    if (value instanceof Map) {
      Map<String, Object> result = new LinkedHashMap<String, Object>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        result.put(String.valueOf(e.getKey()), substitute(e.getValue()));
      }
      return result;
    }
    if (value instanceof List) {
      List<Object> result = new ArrayList<Object>();
      for (Object item : (List<?>) value) {
        result.add(substitute(item));
      }
      return result;
    }
    return value;
  }

  String substituteString(String template) {
    Matcher matcher = ENV_PATTERN.matcher(template);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String replacement = environment.apply(matcher.group(1));
      matcher.appendReplacement(result,
          Matcher.quoteReplacement(replacement != null ? replacement : matcher.group(0)));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
