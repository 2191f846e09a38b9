package com.ospicorp.laiforecast.pipeline;

import java.time.LocalDate;

public record DateOutcome(LocalDate date, Status status, String detail) {

  public static final String NO_FORECAST_DATE = "no matching forecast date";
  public static final String NO_BASE_DATE = "no matching base date";
  public static final String ABORTED = "run aborted";

  public enum Status {
    PROCESSED,
    SKIPPED,
    FAILED
  }

  public static DateOutcome processed(LocalDate date) {
    return new DateOutcome(date, Status.PROCESSED, null);
  }

  public static DateOutcome skipped(LocalDate date, String reason) {
    return new DateOutcome(date, Status.SKIPPED, reason);
  }

  public static DateOutcome failed(LocalDate date, String reason) {
    return new DateOutcome(date, Status.FAILED, reason);
  }
}
