package com.ospicorp.laiforecast.raster;

import java.util.Objects;

/**
 * Raster of vegetation class ids. Valid samples must be non-negative integers.
 */
public final class VegetationClassMap {

  public static final int NO_CLASS = -1;

  private final Raster raster;

  public VegetationClassMap(Raster raster) {
    this.raster = Objects.requireNonNull(raster, "raster");
    for (int i = 0; i < raster.grid().size(); i++) {
      if (raster.isValid(i)) {
        float value = raster.get(i);
        if (value < 0f || value != Math.rint(value)) {
          throw new IllegalArgumentException("class raster holds a non-class value " + value
              + " at index " + i);
        }
      }
    }
  }

  public static VegetationClassMap of(GridGeometry grid, int[] classIds) {
    float[] samples = new float[classIds.length];
    for (int i = 0; i < classIds.length; i++) {
      samples[i] = classIds[i] == NO_CLASS ? Float.NaN : classIds[i];
    }
    return new VegetationClassMap(new Raster(grid, samples, Float.NaN));
  }

  public Raster raster() {
    return raster;
  }

  public GridGeometry grid() {
    return raster.grid();
  }

  public int classAt(int index) {
    return raster.isValid(index) ? (int) raster.get(index) : NO_CLASS;
  }
}
