package com.ospicorp.laiforecast.pipeline;

import java.util.Comparator;
import java.util.List;

public record RunSummary(int processed, int skipped, int failed, List<DateOutcome> outcomes) {

  public static RunSummary of(List<DateOutcome> outcomes) {
    List<DateOutcome> sorted = outcomes.stream()
        .sorted(Comparator.comparing(DateOutcome::date))
        .toList();
    int processed = 0;
    int skipped = 0;
    int failed = 0;
    for (DateOutcome outcome : sorted) {
      switch (outcome.status()) {
        case PROCESSED -> processed++;
        case SKIPPED -> skipped++;
        case FAILED -> failed++;
      }
    }
    return new RunSummary(processed, skipped, failed, sorted);
  }

  public List<DateOutcome> withStatus(DateOutcome.Status status) {
    return outcomes.stream().filter(o -> o.status() == status).toList();
  }
}
