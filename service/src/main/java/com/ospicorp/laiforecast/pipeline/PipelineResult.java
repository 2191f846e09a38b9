package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.normalization.UndefinedFactorWarning;
import com.ospicorp.laiforecast.raster.Raster;
import java.time.LocalDate;
import java.util.List;
import java.util.NavigableMap;

public record PipelineResult(
    NavigableMap<LocalDate, Raster> normalizedRasters,
    List<StatisticsRow> statistics,
    List<UndefinedFactorWarning> warnings,
    RunSummary summary
) {}
