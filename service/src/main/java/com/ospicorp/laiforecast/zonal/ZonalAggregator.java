package com.ospicorp.laiforecast.zonal;

import com.ospicorp.laiforecast.raster.ClassCatalog;
import com.ospicorp.laiforecast.raster.GridMismatchException;
import com.ospicorp.laiforecast.raster.Raster;
import com.ospicorp.laiforecast.raster.StudyAreaMask;
import com.ospicorp.laiforecast.raster.VegetationClass;
import com.ospicorp.laiforecast.raster.VegetationClassMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-class LAI statistics over co-registered LAI, class and mask grids.
 *
 * <p>A pixel counts towards class {@code c} when it lies inside the mask, carries class
 * {@code c} and holds a valid LAI sample. Values are accumulated in row-major order so
 * identical inputs give bit-identical results.
 */
public class ZonalAggregator {

  private static final Logger log = LoggerFactory.getLogger(ZonalAggregator.class);

  public Map<Integer, ClassStatistics> aggregate(Raster lai, VegetationClassMap classes,
      StudyAreaMask mask, ClassCatalog catalog) {
    GridMismatchException.requireCoRegistered(lai.grid(), classes.grid(), "class raster");
    GridMismatchException.requireCoRegistered(lai.grid(), mask.grid(), "study-area mask");

    int size = lai.grid().size();
    int[] slots = new int[size];
    int[] counts = new int[catalog.size()];
    int undeclared = 0;
    for (int i = 0; i < size; i++) {
      slots[i] = -1;
      if (!mask.contains(i) || !lai.isValid(i)) {
        continue;
      }
      int classId = classes.classAt(i);
      if (classId == VegetationClassMap.NO_CLASS) {
        continue;
      }
      int slot = catalog.positionOf(classId);
      if (slot < 0) {
        undeclared++;
        continue;
      }
      slots[i] = slot;
      counts[slot]++;
    }
    if (undeclared > 0) {
      log.debug("{} pixels carry a vegetation class that is not declared", undeclared);
    }

    double[][] values = new double[catalog.size()][];
    int[] filled = new int[catalog.size()];
    for (int s = 0; s < values.length; s++) {
      values[s] = new double[counts[s]];
    }
    for (int i = 0; i < size; i++) {
      int slot = slots[i];
      if (slot >= 0) {
        values[slot][filled[slot]++] = lai.get(i);
      }
    }

    Map<Integer, ClassStatistics> result = new LinkedHashMap<>();
    for (int s = 0; s < values.length; s++) {
      VegetationClass vegetationClass = catalog.classes().get(s);
      result.put(vegetationClass.id(), summarize(values[s]));
    }
    return result;
  }

  static ClassStatistics summarize(double[] values) {
    int n = values.length;
    if (n == 0) {
      return ClassStatistics.EMPTY;
    }
    double sum = 0d;
    for (double v : values) {
      sum += v;
    }
    double mean = sum / n;
    double squares = 0d;
    for (double v : values) {
      double d = v - mean;
      squares += d * d;
    }
    double std = Math.sqrt(squares / n);

    double[] sorted = values.clone();
    Arrays.sort(sorted);
    return new ClassStatistics(n, mean, std, sorted[0], percentile(sorted, 0.25d),
        percentile(sorted, 0.5d), percentile(sorted, 0.75d), sorted[n - 1]);
  }

  /** Linear interpolation between closest ranks. */
  static double percentile(double[] sorted, double fraction) {
    double position = fraction * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    if (lower == upper) {
      return sorted[lower];
    }
    return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
  }
}
