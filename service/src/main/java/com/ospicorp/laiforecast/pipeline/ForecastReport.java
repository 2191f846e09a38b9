package com.ospicorp.laiforecast.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ospicorp.laiforecast.normalization.UndefinedFactorWarning;
import java.util.List;

/**
 * Outcome of normalizing the forecast LAI against one forecast class map. {@code year} is null
 * when the class map file name carries none.
 */
public record ForecastReport(
    String name,
    Integer year,
    String classMap,
    String outputDirectory,
    RunSummary summary,
    List<UndefinedFactorWarning> warnings,
    @JsonIgnore List<StatisticsRow> statistics
) {

  public ForecastReport {
    warnings = List.copyOf(warnings);
    statistics = List.copyOf(statistics);
  }
}
