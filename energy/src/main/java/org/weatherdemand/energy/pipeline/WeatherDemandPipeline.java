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
package org.weatherdemand.energy.pipeline;

import org.weatherdemand.energy.PipelineCancelledException;
import org.weatherdemand.energy.WeatherDemandException;
import org.weatherdemand.energy.config.CityEntry;
import org.weatherdemand.energy.config.PipelineConfig;
import org.weatherdemand.energy.merge.MergeResult;
import org.weatherdemand.energy.merge.RecordMerger;
import org.weatherdemand.energy.model.DemandRecord;
import org.weatherdemand.energy.model.MergedRecord;
import org.weatherdemand.energy.model.WeatherObservation;
import org.weatherdemand.energy.quality.QualityReport;
import org.weatherdemand.energy.quality.QualityValidator;
import org.weatherdemand.energy.quality.ValidationOutcome;
import org.weatherdemand.energy.source.AbstractSourceFetcher;
import org.weatherdemand.energy.source.EiaDemandFetcher;
import org.weatherdemand.energy.source.FetchResult;
import org.weatherdemand.energy.source.NoaaWeatherFetcher;
import org.weatherdemand.energy.stats.CorrelationEngine;
import org.weatherdemand.energy.stats.CorrelationReport;
import org.weatherdemand.energy.stats.DemandLevel;
import org.weatherdemand.energy.stats.DemandQuantiles;
import org.weatherdemand.etl.HttpSource;
import org.weatherdemand.etl.HttpTransport;
import org.weatherdemand.etl.JdkHttpTransport;
import org.weatherdemand.etl.SourceResult;
import org.weatherdemand.etl.storage.LocalFileStorageProvider;
import org.weatherdemand.etl.storage.RawPayloadStore;
import org.weatherdemand.etl.storage.StorageProvider;

import com.google.common.annotations.VisibleForTesting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one batch: fetch weather and demand for every configured city, merge,
 * validate, write the artifacts and compute correlations.
 *
 * <h3>Stages</h3>
 * <ol>
 *   <li><b>fetch</b> - one task per (source, city) on a fixed pool of
 *       {@code fetchWorkers} threads; the stage ends when every task has
 *       finished. A failed fetch is recorded as an error {@link SourceResult}
 *       and the other tasks carry on.</li>
 *   <li><b>merge</b> - inner join on (city, date).</li>
 *   <li><b>validate</b> - missing values, outliers, freshness.</li>
 *   <li><b>write</b> - processed CSV (replaced) and quality report JSON
 *       (one per run id, never replaced).</li>
 *   <li><b>correlate</b> - pooled and per-city Pearson r.</li>
 * </ol>
 *
 * <p>{@link #cancel()} is checked before each stage starts.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineConfig config = new PipelineConfigReader().readDefault();
 * RunSummary summary = new WeatherDemandPipeline(config).run();
 * }</pre>
 */
public class WeatherDemandPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(WeatherDemandPipeline.class);

  static final DateTimeFormatter RUN_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  private final PipelineConfig config;
  private final NoaaWeatherFetcher weatherFetcher;
  private final EiaDemandFetcher demandFetcher;
  private final ProcessedTableWriter tableWriter;
  private final QualityReportStore reportStore;
  private final RecordMerger merger;
  private final QualityValidator validator;
  private final CorrelationEngine correlationEngine;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public WeatherDemandPipeline(PipelineConfig config) {
    this(config, new JdkHttpTransport(), new LocalFileStorageProvider(), Clock.systemUTC());
  }

  public WeatherDemandPipeline(PipelineConfig config, HttpTransport transport,
      StorageProvider storage, Clock clock) {
    this(config,
        new NoaaWeatherFetcher(new HttpSource(config.getNoaaSource(), transport),
            config.getCityRegistry(), payloadStore(config, storage, clock),
            config.isReuseRawPayloads()),
        new EiaDemandFetcher(new HttpSource(config.getEiaSource(), transport),
            config.getCityRegistry(), payloadStore(config, storage, clock),
            config.isReuseRawPayloads()),
        storage, clock);
  }

  /**
   * Creates a pipeline around prebuilt fetchers; tests supply fetchers whose
   * HTTP sources do not block.
   */
  @VisibleForTesting
  WeatherDemandPipeline(PipelineConfig config, NoaaWeatherFetcher weatherFetcher,
      EiaDemandFetcher demandFetcher, StorageProvider storage, Clock clock) {
    this.config = config;
    this.weatherFetcher = weatherFetcher;
    this.demandFetcher = demandFetcher;
    this.tableWriter = new ProcessedTableWriter(storage, config.getProcessedDirectory());
    this.reportStore = new QualityReportStore(storage, config.getReportDirectory());
    this.merger = new RecordMerger();
    this.validator = new QualityValidator(config.getQuality(), clock);
    this.correlationEngine = new CorrelationEngine(config.getCorrelation(), config.getQuality());
    this.clock = clock;
  }

  private static RawPayloadStore payloadStore(PipelineConfig config, StorageProvider storage,
      Clock clock) {
    return new RawPayloadStore(storage, config.getRawDirectory(), clock);
  }

  /**
   * Requests cancellation. The stage in progress finishes; the next one
   * fails with {@link PipelineCancelledException}.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      LOGGER.info("Cancellation requested");
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Runs over the configured look-back window ending today.
   */
  public RunSummary run() throws IOException {
    LocalDate today = LocalDate.now(clock);
    return run(today.minusDays(config.getLookbackDays()), today);
  }

  /**
   * Runs over an inclusive date range.
   *
   * @throws PipelineCancelledException if cancelled before a stage starts
   * @throws IOException if an artifact cannot be written
   */
  public RunSummary run(LocalDate startDate, LocalDate endDate) throws IOException {
    if (endDate.isBefore(startDate)) {
      throw new IllegalArgumentException("End date " + endDate + " is before start " + startDate);
    }
    long startMs = clock.millis();
    String runId = RUN_ID_FORMAT.format(clock.instant());
    List<CityEntry> cities = config.getCities();
    LOGGER.info("Starting run {}: {} cities, {} to {}", runId, cities.size(), startDate, endDate);

    checkCancelled("fetch");
    Queue<SourceResult> results = new ConcurrentLinkedQueue<SourceResult>();
    ConcurrentMap<String, List<WeatherObservation>> weatherByCity =
        new ConcurrentSkipListMap<String, List<WeatherObservation>>();
    ConcurrentMap<String, List<DemandRecord>> demandByCity =
        new ConcurrentSkipListMap<String, List<DemandRecord>>();

    List<Callable<Void>> tasks = new ArrayList<Callable<Void>>();
    for (CityEntry city : cities) {
      tasks.add(fetchTask(weatherFetcher, city, startDate, endDate, weatherByCity, results));
      tasks.add(fetchTask(demandFetcher, city, startDate, endDate, demandByCity, results));
    }
    runFetchTasks(tasks);

    List<SourceResult> sourceResults = new ArrayList<SourceResult>(results);
    sourceResults.sort(Comparator.comparing(SourceResult::getKey)
        .thenComparing(SourceResult::getSource));

    checkCancelled("merge");
    MergeResult merged = merger.merge(flatten(weatherByCity), flatten(demandByCity));
    LOGGER.info("Merged {} rows; join losses {}", merged.getRecords().size(),
        merged.getJoinLosses());

    checkCancelled("validate");
    ValidationOutcome validated = validator.validate(merged, runId);
    QualityReport report = validated.getReport();

    checkCancelled("write");
    String processedPath = tableWriter.write(validated.getRecords());
    String reportPath = reportStore.write(report);

    checkCancelled("correlate");
    CorrelationReport correlation = correlationEngine.analyze(validated.getRecords());

    RunSummary.Builder summary = RunSummary.builder()
        .runId(runId)
        .dateRange(startDate, endDate)
        .sourceResults(sourceResults)
        .qualityReport(report)
        .correlation(correlation)
        .processedPath(processedPath)
        .reportPath(reportPath);
    for (CityEntry city : cities) {
      summary.cityStatus(city.getName(), cityStatus(city.getName(), sourceResults));
    }
    for (Map.Entry<String, DemandLevel> e
        : latestDemandLevels(validated.getRecords()).entrySet()) {
      summary.latestDemandLevel(e.getKey(), e.getValue());
    }
    RunSummary built = summary.elapsedMs(clock.millis() - startMs).build();
    LOGGER.info("Run {} complete: {}", runId, built);
    return built;
  }

  private <T> Callable<Void> fetchTask(final AbstractSourceFetcher<T> fetcher,
      final CityEntry city, final LocalDate startDate, final LocalDate endDate,
      final ConcurrentMap<String, List<T>> sink, final Queue<SourceResult> results) {
    return new Callable<Void>() {
      @Override public Void call() {
        String source = fetcher.getSourceType().id();
        long taskStart = clock.millis();
        if (cancelled.get()) {
          LOGGER.debug("Skipping {} {}: run cancelled", source, city.getName());
          return null;
        }
        try {
          FetchResult<T> fetched = fetcher.fetch(city.getName(), startDate, endDate);
          sink.put(city.getName(), fetched.getRecords());
          long duration = clock.millis() - taskStart;
          long bytes = fetched.getPayload().getBytes();
          int count = fetched.getRecords().size();
          results.add(fetched.getPayload().isFromStore()
              ? SourceResult.reused(source, city.getName(), count, bytes, duration)
              : SourceResult.success(source, city.getName(), count, bytes,
                  fetched.getPayload().getAttempts(), duration));
        } catch (IOException e) {
          LOGGER.warn("Fetching {} for {} failed: {}", source, city.getName(), e.getMessage());
          results.add(SourceResult.error(source, city.getName(), e,
              clock.millis() - taskStart));
        }
        return null;
      }
    };
  }

  private void runFetchTasks(List<Callable<Void>> tasks) {
    int workers = Math.min(config.getFetchWorkers(), Math.max(1, tasks.size()));
    ExecutorService executor = Executors.newFixedThreadPool(workers);
    try {
      List<Future<Void>> futures = executor.invokeAll(tasks);
      for (Future<Void> future : futures) {
        future.get();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelled.set(true);
      throw new PipelineCancelledException("fetch");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof WeatherDemandException) {
        throw (WeatherDemandException) cause;
      }
      throw new WeatherDemandException("Fetch task failed: " + cause, cause);
    } finally {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
          LOGGER.warn("Fetch workers did not stop within a minute");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void checkCancelled(String stage) {
    if (cancelled.get()) {
      LOGGER.info("Run cancelled before stage '{}'", stage);
      throw new PipelineCancelledException(stage);
    }
  }

  private static <T> List<T> flatten(Map<String, List<T>> byCity) {
    List<T> all = new ArrayList<T>();
    for (List<T> records : byCity.values()) {
      all.addAll(records);
    }
    return all;
  }

  static CityStatus cityStatus(String city, List<SourceResult> results) {
    int succeeded = 0;
    int failed = 0;
    for (SourceResult result : results) {
      if (!result.getKey().equals(city)) {
        continue;
      }
      if (result.isSuccess()) {
        succeeded++;
      } else {
        failed++;
      }
    }
    if (failed == 0 && succeeded > 0) {
      return CityStatus.OK;
    }
    return succeeded > 0 ? CityStatus.PARTIAL : CityStatus.FAILED;
  }

  /**
   * Classifies each city's most recent row against the quartiles of the
   * city's usable demand values.
   */
  static Map<String, DemandLevel> latestDemandLevels(List<MergedRecord> records) {
    Map<String, List<Double>> demandByCity = new TreeMap<String, List<Double>>();
    Map<String, MergedRecord> latest = new TreeMap<String, MergedRecord>();
    for (MergedRecord r : records) {
      List<Double> values = demandByCity.get(r.getCity());
      if (values == null) {
        values = new ArrayList<Double>();
        demandByCity.put(r.getCity(), values);
      }
      if (!r.isExcludedFromStats() && r.getDemandMw() != null) {
        values.add(r.getDemandMw());
      }
      MergedRecord current = latest.get(r.getCity());
      if (current == null || r.getDate().isAfter(current.getDate())) {
        latest.put(r.getCity(), r);
      }
    }

    Map<String, DemandLevel> levels = new TreeMap<String, DemandLevel>();
    for (Map.Entry<String, MergedRecord> e : latest.entrySet()) {
      List<Double> values = demandByCity.get(e.getKey());
      MergedRecord row = e.getValue();
      if (values.isEmpty() || row.isExcludedFromStats()) {
        levels.put(e.getKey(), DemandLevel.UNKNOWN);
      } else {
        levels.put(e.getKey(), DemandQuantiles.of(values).classify(row.getDemandMw()));
      }
    }
    return levels;
  }
}
