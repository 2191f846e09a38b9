package com.ospicorp.laiforecast.normalization;

import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.GridMismatchException;
import com.ospicorp.laiforecast.raster.Raster;
import com.ospicorp.laiforecast.raster.VegetationClass;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import com.ospicorp.laiforecast.zonal.ClassStatistics;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Scales forecast LAI per vegetation class so that its class means line up with the base
 * period.
 */
public class NormalizationEngine {

  static final String NO_PREDICTED_PIXELS = "no predicted-period pixels";
  static final String NO_BASE_PIXELS = "no base-period pixels";
  static final String NON_FINITE_RATIO = "non-finite base/predicted ratio";

  /**
   * {@code base.mean / predicted.mean}; exactly 1.0 when the predicted mean is zero; empty when
   * either side has no pixels.
   */
  public OptionalDouble deriveFactor(ClassStatistics base, ClassStatistics predicted) {
    if (undefinedReason(base, predicted) != null) {
      return OptionalDouble.empty();
    }
    if (predicted.mean() == 0d) {
      return OptionalDouble.of(1d);
    }
    double factor = base.mean() / predicted.mean();
    return Double.isFinite(factor) ? OptionalDouble.of(factor) : OptionalDouble.empty();
  }

  public NormalizationFactors deriveFactors(LocalDate date, Map<Integer, ClassStatistics> base,
      Map<Integer, ClassStatistics> predicted, ClassCatalog catalog) {
    Map<Integer, Double> factors = new LinkedHashMap<>();
    List<UndefinedFactorWarning> warnings = new ArrayList<>();
    for (VegetationClass vegetationClass : catalog.classes()) {
      int id = vegetationClass.id();
      ClassStatistics baseStats = base.getOrDefault(id, ClassStatistics.EMPTY);
      ClassStatistics predictedStats = predicted.getOrDefault(id, ClassStatistics.EMPTY);
      OptionalDouble factor = deriveFactor(baseStats, predictedStats);
      if (factor.isPresent()) {
        factors.put(id, factor.getAsDouble());
      } else {
        String reason = undefinedReason(baseStats, predictedStats);
        warnings.add(new UndefinedFactorWarning(date, id,
            reason != null ? reason : NON_FINITE_RATIO));
      }
    }
    return new NormalizationFactors(factors, warnings);
  }

  /**
   * Forecast LAI times the factor of each pixel's class. Pixels with nodata LAI, no class, or a
   * class without a factor become NaN.
   */
  public Raster apply(Raster forecastLai, VegetationClassMap classes,
      NormalizationFactors factors) {
    GridMismatchException.requireCoRegistered(forecastLai.grid(), classes.grid(),
        "class raster");
    float[] out = new float[forecastLai.grid().size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = Float.NaN;
      if (!forecastLai.isValid(i)) {
        continue;
      }
      int classId = classes.classAt(i);
      if (classId == VegetationClassMap.NO_CLASS) {
        continue;
      }
      OptionalDouble factor = factors.factorFor(classId);
      if (factor.isPresent()) {
        out[i] = (float) (forecastLai.get(i) * factor.getAsDouble());
      }
    }
    return new Raster(forecastLai.grid(), out, Float.NaN);
  }

  private static String undefinedReason(ClassStatistics base, ClassStatistics predicted) {
    if (!predicted.isDefined()) {
      return NO_PREDICTED_PIXELS;
    }
    if (!base.isDefined()) {
      return NO_BASE_PIXELS;
    }
    return null;
  }
}
