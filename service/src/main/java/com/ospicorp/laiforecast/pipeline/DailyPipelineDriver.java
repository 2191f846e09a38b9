package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.normalization.NormalizationEngine;
import com.ospicorp.laiforecast.normalization.NormalizationFactors;
import com.ospicorp.laiforecast.normalization.UndefinedFactorWarning;
import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.GridAligner;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.GridMismatchException;
import com.ospicorp.laiforecast.raster.Raster;
import com.ospicorp.laiforecast.raster.StudyAreaMask;
import com.ospicorp.laiforecast.raster.VegetationClass;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import com.ospicorp.laiforecast.zonal.ClassStatistics;
import com.ospicorp.laiforecast.zonal.ZonalAggregator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs align, aggregate, derive and apply for every date found in both LAI collections.
 *
 * <p>Dates are independent: each produces a {@link DailyResult} on its own and the fragments
 * are merged after all dates finish. A failing date is recorded and never stops its siblings.
 */
public class DailyPipelineDriver {

  private static final Logger log = LoggerFactory.getLogger(DailyPipelineDriver.class);

  private final GridAligner aligner;
  private final ZonalAggregator aggregator;
  private final NormalizationEngine engine;
  private final int parallelism;

  public DailyPipelineDriver(GridAligner aligner, ZonalAggregator aggregator,
      NormalizationEngine engine, int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
    }
    this.aligner = aligner;
    this.aggregator = aggregator;
    this.engine = engine;
    this.parallelism = parallelism;
  }

  public PipelineResult run(PipelineInputs inputs) {
    return run(inputs, () -> false);
  }

  /**
   * @param abortRequested polled before each date starts; once true, the remaining dates are
   *     reported as skipped
   */
  public PipelineResult run(PipelineInputs inputs, BooleanSupplier abortRequested) {
    RunContext context = prepare(inputs);

    NavigableSet<LocalDate> baseDates = inputs.baseLai().dates();
    NavigableSet<LocalDate> forecastDates = inputs.forecastLai().dates();
    TreeSet<LocalDate> allDates = new TreeSet<>(baseDates);
    allDates.addAll(forecastDates);

    List<LocalDate> shared = new ArrayList<>();
    List<DailyResult> results = new ArrayList<>();
    for (LocalDate date : allDates) {
      boolean inBase = baseDates.contains(date);
      boolean inForecast = forecastDates.contains(date);
      if (inBase && inForecast) {
        shared.add(date);
      } else {
        String reason = inBase ? DateOutcome.NO_FORECAST_DATE : DateOutcome.NO_BASE_DATE;
        log.warn("Skipping {}: {}", date, reason);
        results.add(DailyResult.skipped(date, reason));
      }
    }
    log.info("Processing {} shared dates ({} skipped) with parallelism {}",
        shared.size(), results.size(), parallelism);

    results.addAll(execute(shared, context, abortRequested));
    PipelineResult result = merge(results);
    RunSummary summary = result.summary();
    log.info("Pipeline finished: {} processed, {} skipped, {} failed",
        summary.processed(), summary.skipped(), summary.failed());
    return result;
  }

  private RunContext prepare(PipelineInputs inputs) {
    GridGeometry reference = inputs.baseClasses().grid();
    VegetationClassMap forecastClasses =
        aligner.alignClasses(reference, inputs.forecastClasses());
    StudyAreaMask mask = inputs.mask() != null ? inputs.mask() : StudyAreaMask.all(reference);
    GridMismatchException.requireCoRegistered(reference, mask.grid(), "study-area mask");
    return new RunContext(reference, inputs.baseClasses(), forecastClasses, mask, inputs);
  }

  private List<DailyResult> execute(List<LocalDate> dates, RunContext context,
      BooleanSupplier abortRequested) {
    List<DailyResult> results = new ArrayList<>(dates.size());
    if (parallelism == 1 || dates.size() <= 1) {
      for (LocalDate date : dates) {
        results.add(processDate(date, context, abortRequested));
      }
      return results;
    }

    ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, dates.size()));
    try {
      List<Future<DailyResult>> futures = new ArrayList<>(dates.size());
      for (LocalDate date : dates) {
        futures.add(pool.submit(() -> processDate(date, context, abortRequested)));
      }
      for (int i = 0; i < futures.size(); i++) {
        LocalDate date = dates.get(i);
        try {
          results.add(futures.get(i).get());
        } catch (ExecutionException ex) {
          log.error("Worker for {} failed", date, ex.getCause());
          results.add(DailyResult.failed(date, describe(ex.getCause())));
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          results.add(DailyResult.failed(date, "interrupted"));
        }
      }
    } finally {
      pool.shutdownNow();
    }
    return results;
  }

  DailyResult processDate(LocalDate date, RunContext context, BooleanSupplier abortRequested) {
    if (abortRequested.getAsBoolean()) {
      return DailyResult.skipped(date, DateOutcome.ABORTED);
    }
    try {
      Raster baseLai = aligner.alignLai(context.reference(), context.inputs().baseLai().load(date));
      Raster forecastLai =
          aligner.alignLai(context.reference(), context.inputs().forecastLai().load(date));
      ClassCatalog catalog = context.inputs().catalog();

      Map<Integer, ClassStatistics> baseStats =
          aggregator.aggregate(baseLai, context.baseClasses(), context.mask(), catalog);
      Map<Integer, ClassStatistics> predictedStats =
          aggregator.aggregate(forecastLai, context.forecastClasses(), context.mask(), catalog);

      NormalizationFactors factors =
          engine.deriveFactors(date, baseStats, predictedStats, catalog);
      for (UndefinedFactorWarning warning : factors.warnings()) {
        log.warn("{}: class {} has no normalization factor ({})",
            date, warning.classId(), warning.reason());
      }
      Raster normalized = context.mask().clip(
          engine.apply(forecastLai, context.forecastClasses(), factors));

      List<StatisticsRow> rows = new ArrayList<>(catalog.size() * 2);
      appendRows(rows, date, Period.BASE, baseStats, catalog);
      appendRows(rows, date, Period.PREDICTED, predictedStats, catalog);
      log.debug("{}: factors {}", date, factors.asMap());
      return DailyResult.processed(date, normalized, rows, factors.warnings());
    } catch (RuntimeException ex) {
      log.error("Processing {} failed: {}", date, ex.getMessage(), ex);
      return DailyResult.failed(date, describe(ex));
    }
  }

  private static void appendRows(List<StatisticsRow> rows, LocalDate date, Period period,
      Map<Integer, ClassStatistics> stats, ClassCatalog catalog) {
    for (VegetationClass vegetationClass : catalog.classes()) {
      ClassStatistics classStats = stats.getOrDefault(vegetationClass.id(), ClassStatistics.EMPTY);
      rows.add(StatisticsRow.of(date, vegetationClass.id(), vegetationClass.name(), period,
          classStats));
    }
  }

  private static PipelineResult merge(List<DailyResult> results) {
    List<DailyResult> ordered = new ArrayList<>(results);
    ordered.sort(Comparator.comparing(DailyResult::date));

    TreeMap<LocalDate, Raster> rasters = new TreeMap<>();
    List<StatisticsRow> rows = new ArrayList<>();
    List<UndefinedFactorWarning> warnings = new ArrayList<>();
    List<DateOutcome> outcomes = new ArrayList<>(ordered.size());
    for (DailyResult result : ordered) {
      if (result.normalized() != null) {
        rasters.put(result.date(), result.normalized());
      }
      rows.addAll(result.rows());
      warnings.addAll(result.warnings());
      outcomes.add(result.outcome());
    }
    return new PipelineResult(rasters, List.copyOf(rows), List.copyOf(warnings),
        RunSummary.of(outcomes));
  }

  static String describe(Throwable ex) {
    String message = ex.getMessage();
    String type = ex.getClass().getSimpleName();
    return (message == null || message.isBlank()) ? type : type + ": " + message;
  }

  record RunContext(
      GridGeometry reference,
      VegetationClassMap baseClasses,
      VegetationClassMap forecastClasses,
      StudyAreaMask mask,
      PipelineInputs inputs
  ) {}
}
