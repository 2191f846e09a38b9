package com.ospicorp.laiforecast.pipeline;

import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.StudyAreaMask;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import java.util.Objects;

/**
 * Inputs of one run. The base-period class map defines the working grid; a null mask covers
 * the whole grid.
 */
public record PipelineInputs(
    VegetationClassMap baseClasses,
    VegetationClassMap forecastClasses,
    StudyAreaMask mask,
    DatedRasterSource baseLai,
    DatedRasterSource forecastLai,
    ClassCatalog catalog
) {

  public PipelineInputs {
    Objects.requireNonNull(baseClasses, "baseClasses");
    Objects.requireNonNull(forecastClasses, "forecastClasses");
    Objects.requireNonNull(baseLai, "baseLai");
    Objects.requireNonNull(forecastLai, "forecastLai");
    Objects.requireNonNull(catalog, "catalog");
  }
}
