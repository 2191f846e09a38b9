package com.ospicorp.laiforecast.normalization;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.GeoTransform;
import com.ospicorp.laiforecast.raster.GridGeometry;
import com.ospicorp.laiforecast.raster.GridMismatchException;
import com.ospicorp.laiforecast.raster.Raster;
import com.ospicorp.laiforecast.raster.VegetationClass;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import com.ospicorp.laiforecast.zonal.ClassStatistics;
import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class NormalizationEngineTest {

  private static final GridGeometry GRID =
      new GridGeometry(2, 2, new GeoTransform(0d, 2d, 1d, -1d), "EPSG:32633");
  private static final LocalDate DATE = LocalDate.of(2023, 2, 14);

  private final NormalizationEngine engine = new NormalizationEngine();

  @Test
  void factorIsRatioOfBaseToPredictedMean() {
    OptionalDouble factor = engine.deriveFactor(ClassStatistics.of(10, 3d, 0.5d),
        ClassStatistics.of(12, 1.5d, 0.2d));

    assertEquals(2d, factor.getAsDouble(), 1e-12);
  }

  @Test
  void zeroPredictedMeanGivesUnitFactor() {
    OptionalDouble factor = engine.deriveFactor(ClassStatistics.of(4, 2d, 0d),
        ClassStatistics.of(4, 0d, 0d));

    assertEquals(1d, factor.getAsDouble());
  }

  @Test
  void emptySideGivesNoFactor() {
    assertTrue(engine.deriveFactor(ClassStatistics.of(4, 2d, 0d), ClassStatistics.EMPTY)
        .isEmpty());
    assertTrue(engine.deriveFactor(ClassStatistics.EMPTY, ClassStatistics.of(4, 2d, 0d))
        .isEmpty());
  }

  @Test
  void scalingForecastByKScalesFactorByOneOverK() {
    ClassStatistics base = ClassStatistics.of(5, 2.4d, 0.3d);
    double k = 4d;

    double factor = engine.deriveFactor(base, ClassStatistics.of(5, 1.2d, 0.1d)).getAsDouble();
    double scaled = engine.deriveFactor(base, ClassStatistics.of(5, 1.2d * k, 0.4d))
        .getAsDouble();

    assertEquals(factor / k, scaled, 1e-12);
  }

  @Test
  void deriveFactorsWarnsForClassesWithoutPixels() {
    ClassCatalog catalog = ClassCatalog.of(new VegetationClass(1, "crop"),
        new VegetationClass(2, "forest"), new VegetationClass(3, "grass"));
    Map<Integer, ClassStatistics> base = Map.of(
        1, ClassStatistics.of(2, 3d, 0d),
        2, ClassStatistics.EMPTY,
        3, ClassStatistics.of(1, 1d, 0d));
    Map<Integer, ClassStatistics> predicted = Map.of(
        1, ClassStatistics.of(2, 1d, 0d),
        2, ClassStatistics.of(2, 5d, 0d));

    NormalizationFactors factors = engine.deriveFactors(DATE, base, predicted, catalog);

    assertEquals(3d, factors.factorFor(1).getAsDouble(), 1e-12);
    assertFalse(factors.isDefined(2));
    assertFalse(factors.isDefined(3));
    assertEquals(2, factors.warnings().size());
    assertEquals(new UndefinedFactorWarning(DATE, 2, NormalizationEngine.NO_BASE_PIXELS),
        factors.warnings().get(0));
    assertEquals(new UndefinedFactorWarning(DATE, 3, NormalizationEngine.NO_PREDICTED_PIXELS),
        factors.warnings().get(1));
  }

  @Test
  void applyMultipliesEachPixelByItsClassFactor() {
    Raster forecast = new Raster(GRID, new float[] {1f, 1f, 5f, 5f}, Float.NaN);
    VegetationClassMap classes = VegetationClassMap.of(GRID, new int[] {1, 1, 2, 2});
    NormalizationFactors factors = NormalizationFactors.of(Map.of(1, 3d, 2, 2d));

    Raster normalized = engine.apply(forecast, classes, factors);

    assertArrayEquals(new float[] {3f, 3f, 10f, 10f}, normalized.toArray());
    assertTrue(Float.isNaN(normalized.nodata()));
  }

  @Test
  void applyLeavesUnfactoredAndInvalidPixelsAsNaN() {
    Raster forecast = new Raster(GRID, new float[] {-9999f, 2f, 2f, 2f}, -9999f);
    VegetationClassMap classes =
        VegetationClassMap.of(GRID, new int[] {1, VegetationClassMap.NO_CLASS, 2, 1});
    NormalizationFactors factors = NormalizationFactors.of(Map.of(1, 0.5d));

    float[] out = engine.apply(forecast, classes, factors).toArray();

    assertTrue(Float.isNaN(out[0]));
    assertTrue(Float.isNaN(out[1]));
    assertTrue(Float.isNaN(out[2]));
    assertEquals(1f, out[3]);
  }

  @Test
  void applyRequiresCoRegisteredClasses() {
    GridGeometry shifted = new GridGeometry(2, 2, new GeoTransform(1d, 2d, 1d, -1d), "EPSG:32633");

    assertThrows(GridMismatchException.class, () -> engine.apply(
        Raster.filled(GRID, 1f, Float.NaN), VegetationClassMap.of(shifted, new int[4]),
        NormalizationFactors.of(Map.of())));
  }
}
