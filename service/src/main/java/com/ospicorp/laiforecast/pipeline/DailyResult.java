package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.normalization.UndefinedFactorWarning;
import com.ospicorp.laiforecast.raster.Raster;
import java.time.LocalDate;
import java.util.List;

/** Everything one date contributes to a run; merged by the driver once all dates finish. */
record DailyResult(
    LocalDate date,
    Raster normalized,
    List<StatisticsRow> rows,
    List<UndefinedFactorWarning> warnings,
    DateOutcome outcome
) {

  static DailyResult processed(LocalDate date, Raster normalized, List<StatisticsRow> rows,
      List<UndefinedFactorWarning> warnings) {
    return new DailyResult(date, normalized, List.copyOf(rows), List.copyOf(warnings),
        DateOutcome.processed(date));
  }

  static DailyResult skipped(LocalDate date, String reason) {
    return new DailyResult(date, null, List.of(), List.of(), DateOutcome.skipped(date, reason));
  }

  static DailyResult failed(LocalDate date, String reason) {
    return new DailyResult(date, null, List.of(), List.of(), DateOutcome.failed(date, reason));
  }
}
