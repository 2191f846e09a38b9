package com.ospicorp.laiforecast.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.laiforecast.zonal.ClassStatistics;
import java.time.LocalDate;

// One row per (date, class, period); column order is what downstream plotting expects.
@JsonPropertyOrder({"date", "vegetation_class", "pixel_count", "mean_lai", "std_lai", "period",
    "class_name", "min_lai", "q1_lai", "median_lai", "q3_lai", "max_lai"})
public record StatisticsRow(
    LocalDate date,
    @JsonProperty("vegetation_class") int vegetationClass,
    @JsonProperty("pixel_count") int pixelCount,
    @JsonProperty("mean_lai") double meanLai,
    @JsonProperty("std_lai") double stdLai,
    Period period,
    @JsonProperty("class_name") String className,
    @JsonProperty("min_lai") double minLai,
    @JsonProperty("q1_lai") double q1Lai,
    @JsonProperty("median_lai") double medianLai,
    @JsonProperty("q3_lai") double q3Lai,
    @JsonProperty("max_lai") double maxLai
) {

  public static StatisticsRow of(LocalDate date, int classId, String className, Period period,
      ClassStatistics stats) {
    return new StatisticsRow(date, classId, stats.count(), stats.mean(), stats.std(), period,
        className, stats.min(), stats.q1(), stats.median(), stats.q3(), stats.max());
  }
}
