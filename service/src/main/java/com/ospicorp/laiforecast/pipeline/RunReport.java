package com.ospicorp.laiforecast.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Outcome of one service run as returned by the API and written to {@code run-summary.json}:
 * the reclassified class maps that were written and one report per forecast class map.
 */
public record RunReport(
    Instant startedAt,
    Instant finishedAt,
    String outputDirectory,
    List<String> classMaps,
    List<ForecastReport> forecasts
) {

  public RunReport {
    classMaps = List.copyOf(classMaps);
    forecasts = List.copyOf(forecasts);
  }

  /**
   * The forecast called {@code name}; without a name the run must hold a single forecast.
   *
   * @throws NoSuchElementException if no forecast has that name
   * @throws IllegalArgumentException if no name is given and the run holds several forecasts
   */
  public ForecastReport forecast(String name) {
    if (name == null || name.isBlank()) {
      if (forecasts.size() != 1) {
        throw new IllegalArgumentException("Run holds forecasts " + names()
            + "; select one with the forecast parameter");
      }
      return forecasts.get(0);
    }
    return forecasts.stream()
        .filter(forecast -> forecast.name().equals(name))
        .findFirst()
        .orElseThrow(() -> new NoSuchElementException("No forecast " + name + " in run, have "
            + names()));
  }

  private List<String> names() {
    return forecasts.stream().map(ForecastReport::name).toList();
  }
}
