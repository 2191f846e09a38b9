package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.config.LaiProperties;
import com.ospicorp.laiforecast.io.BoundarySource;
import com.ospicorp.laiforecast.io.DatedFileCatalog;
import com.ospicorp.laiforecast.io.FileRasterSource;
import com.ospicorp.laiforecast.io.RasterStore;
import com.ospicorp.laiforecast.io.RasterWriteException;
import com.ospicorp.laiforecast.io.RunReportWriter;
import com.ospicorp.laiforecast.io.StatisticsCsvWriter;
import com.ospicorp.laiforecast.normalization.UndefinedFactorWarning;
import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.CrsRegistry;
import com.ospicorp.laiforecast.raster.Raster;
import com.ospicorp.laiforecast.raster.Reclassifier;
import com.ospicorp.laiforecast.raster.StudyAreaMask;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Wires the configured files into pipeline runs and writes their outputs. Every forecast class
 * map gets its own run against the shared base period: one normalized GeoTIFF per processed
 * date plus {@code statistics.csv}. The reclassified class maps and {@code run-summary.json}
 * go to the output directory itself.
 */
@Service
public class LaiForecastService {

  private static final Logger log = LoggerFactory.getLogger(LaiForecastService.class);

  static final String STATISTICS_FILE = "statistics.csv";
  static final String SUMMARY_FILE = "run-summary.json";
  static final String SINGLE_FORECAST = "forecast";
  private static final DateTimeFormatter OUTPUT_DATE = DateTimeFormatter.ofPattern("uuuuDDD");

  private final LaiProperties properties;
  private final RasterStore rasterStore;
  private final BoundarySource boundarySource;
  private final DatedFileCatalog fileCatalog;
  private final Reclassifier reclassifier;
  private final CrsRegistry crsRegistry;
  private final DailyPipelineDriver driver;
  private final StatisticsCsvWriter statisticsWriter;
  private final RunReportWriter reportWriter;
  private final AtomicReference<RunReport> latest = new AtomicReference<>();

  public LaiForecastService(LaiProperties properties, RasterStore rasterStore,
      BoundarySource boundarySource, DatedFileCatalog fileCatalog, Reclassifier reclassifier,
      CrsRegistry crsRegistry, DailyPipelineDriver driver, StatisticsCsvWriter statisticsWriter,
      RunReportWriter reportWriter) {
    this.properties = properties;
    this.rasterStore = rasterStore;
    this.boundarySource = boundarySource;
    this.fileCatalog = fileCatalog;
    this.reclassifier = reclassifier;
    this.crsRegistry = crsRegistry;
    this.driver = driver;
    this.statisticsWriter = statisticsWriter;
    this.reportWriter = reportWriter;
  }

  public synchronized RunReport run() {
    Instant startedAt = Instant.now();
    properties.requireInputs();
    ClassCatalog catalog = properties.toCatalog();
    List<ForecastClassMap> forecastMaps = forecastClassMaps();
    Path outputDir = properties.outputDir();
    log.info("Starting LAI normalization run for {} vegetation classes and {} forecast(s)",
        catalog.size(), forecastMaps.size());

    List<String> classMapOutputs = new ArrayList<>();
    VegetationClassMap baseClasses = reclassify(properties.baseClassMap(), "base", outputDir,
        classMapOutputs);
    StudyAreaMask mask = properties.boundary() == null
        ? null
        : boundarySource.loadBoundary(properties.boundary())
            .rasterize(baseClasses.grid(), crsRegistry);
    if (mask != null) {
      log.info("Study area covers {} of {} pixels", mask.insideCount(), mask.grid().size());
    }

    boolean negativeAsNodata = properties.input().negativeAsNodata();
    FileRasterSource baseLai = new FileRasterSource(fileCatalog.scan(properties.baseLaiDir()),
        rasterStore, negativeAsNodata);
    FileRasterSource forecastLai = new FileRasterSource(
        fileCatalog.scan(properties.forecastLaiDir()), rasterStore, negativeAsNodata);

    List<ForecastReport> forecasts = new ArrayList<>(forecastMaps.size());
    for (ForecastClassMap forecastMap : forecastMaps) {
      VegetationClassMap forecastClasses = reclassify(forecastMap.file(), SINGLE_FORECAST,
          outputDir, classMapOutputs);
      PipelineInputs inputs = new PipelineInputs(baseClasses, forecastClasses, mask, baseLai,
          forecastLai, catalog);
      forecasts.add(runForecast(forecastMap, inputs));
    }

    RunReport report = new RunReport(startedAt, Instant.now(),
        outputDir.toAbsolutePath().toString(), classMapOutputs, forecasts);
    reportWriter.write(outputDir.resolve(SUMMARY_FILE), report);
    latest.set(report);
    log.info("Run finished in {} with {} forecast(s)", outputDir, forecasts.size());
    return report;
  }

  public Optional<RunReport> latest() {
    return Optional.ofNullable(latest.get());
  }

  static String outputFileName(LocalDate date) {
    return "LAI_" + OUTPUT_DATE.format(date) + ".tif";
  }

  /** {@code landuse_<year>.tif}, or {@code landuse_<fallback>.tif} for names without a year. */
  String classMapFileName(Path source, String fallback) {
    Integer year = fileCatalog.yearOf(source);
    return "landuse_" + (year == null ? fallback : year.toString()) + ".tif";
  }

  private List<ForecastClassMap> forecastClassMaps() {
    Path outputDir = properties.outputDir();
    if (properties.forecastClassMap() != null) {
      Path file = properties.forecastClassMap();
      return List.of(new ForecastClassMap(SINGLE_FORECAST, fileCatalog.yearOf(file), file,
          outputDir));
    }
    NavigableMap<Integer, Path> byYear = fileCatalog.scanYears(properties.forecastClassMapDir());
    if (byYear.isEmpty()) {
      throw new IllegalStateException("No forecast class maps with a year in their name in "
          + properties.forecastClassMapDir());
    }
    List<ForecastClassMap> maps = new ArrayList<>(byYear.size());
    for (Map.Entry<Integer, Path> entry : byYear.entrySet()) {
      String name = entry.getKey().toString();
      maps.add(new ForecastClassMap(name, entry.getKey(), entry.getValue(),
          outputDir.resolve("forecast_" + name)));
    }
    return maps;
  }

  private VegetationClassMap reclassify(Path source, String fallback, Path outputDir,
      List<String> written) {
    VegetationClassMap classes = reclassifier.reclassify(rasterStore.read(source));
    Path file = outputDir.resolve(classMapFileName(source, fallback));
    rasterStore.write(file, classes.raster());
    log.info("Wrote reclassified {} to {}", source, file);
    written.add(file.toAbsolutePath().toString());
    return classes;
  }

  private ForecastReport runForecast(ForecastClassMap forecastMap, PipelineInputs inputs) {
    log.info("Normalizing forecast {} with class map {}", forecastMap.name(), forecastMap.file());
    PipelineResult result = driver.run(inputs);

    Path outputDir = forecastMap.outputDir();
    Set<LocalDate> writeFailures = writeRasters(outputDir, result.normalizedRasters());
    RunSummary summary = result.summary();
    List<StatisticsRow> statistics = result.statistics();
    if (!writeFailures.isEmpty()) {
      summary = markFailed(summary, writeFailures);
      statistics = statistics.stream().filter(row -> !writeFailures.contains(row.date())).toList();
    }
    List<UndefinedFactorWarning> warnings = result.warnings().stream()
        .filter(warning -> !writeFailures.contains(warning.date()))
        .toList();

    statisticsWriter.write(outputDir.resolve(STATISTICS_FILE), statistics);
    log.info("Forecast {} written to {}: {} processed, {} skipped, {} failed, {} statistics rows",
        forecastMap.name(), outputDir, summary.processed(), summary.skipped(), summary.failed(),
        statistics.size());
    return new ForecastReport(forecastMap.name(), forecastMap.year(),
        forecastMap.file().toAbsolutePath().toString(), outputDir.toAbsolutePath().toString(),
        summary, warnings, statistics);
  }

  private Set<LocalDate> writeRasters(Path outputDir, Map<LocalDate, Raster> rasters) {
    Set<LocalDate> failures = new HashSet<>();
    for (Map.Entry<LocalDate, Raster> entry : rasters.entrySet()) {
      Path file = outputDir.resolve(outputFileName(entry.getKey()));
      try {
        rasterStore.write(file, entry.getValue());
        log.info("Wrote {}", file);
      } catch (RasterWriteException ex) {
        log.error("Writing {} failed: {}", file, ex.getMessage(), ex);
        failures.add(entry.getKey());
        deletePartial(file);
      }
    }
    return failures;
  }

  private static void deletePartial(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Could not delete partial output {}: {}", file, ex.getMessage());
    }
  }

  private static RunSummary markFailed(RunSummary summary, Set<LocalDate> dates) {
    List<DateOutcome> outcomes = new ArrayList<>(summary.outcomes().size());
    for (DateOutcome outcome : summary.outcomes()) {
      outcomes.add(dates.contains(outcome.date())
          ? DateOutcome.failed(outcome.date(), "output raster could not be written")
          : outcome);
    }
    return RunSummary.of(outcomes);
  }

  private record ForecastClassMap(String name, Integer year, Path file, Path outputDir) {}
}
