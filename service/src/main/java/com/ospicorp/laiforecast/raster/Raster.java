package com.ospicorp.laiforecast.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable single-band float raster. Samples are stored row-major; a sample is valid when it
 * is neither NaN nor equal to the nodata sentinel.
 */
public final class Raster {

  private final GridGeometry grid;
  private final float[] samples;
  private final float nodata;

  public Raster(GridGeometry grid, float[] samples, float nodata) {
    this.grid = Objects.requireNonNull(grid, "grid");
    Objects.requireNonNull(samples, "samples");
    if (samples.length != grid.size()) {
      throw new IllegalArgumentException("expected " + grid.size() + " samples for a "
          + grid.width() + " x " + grid.height() + " grid but got " + samples.length);
    }
    this.samples = samples.clone();
    this.nodata = nodata;
  }

  public static Raster filled(GridGeometry grid, float value, float nodata) {
    float[] samples = new float[grid.size()];
    Arrays.fill(samples, value);
    return new Raster(grid, samples, nodata);
  }

  public GridGeometry grid() {
    return grid;
  }

  public int width() {
    return grid.width();
  }

  public int height() {
    return grid.height();
  }

  public float nodata() {
    return nodata;
  }

  public float get(int index) {
    return samples[index];
  }

  public float get(int col, int row) {
    return samples[grid.index(col, row)];
  }

  public boolean isValid(int index) {
    float value = samples[index];
    return !Float.isNaN(value) && value != nodata;
  }

  public boolean isValid(int col, int row) {
    return isValid(grid.index(col, row));
  }

  public int validCount() {
    int count = 0;
    for (int i = 0; i < samples.length; i++) {
      if (isValid(i)) {
        count++;
      }
    }
    return count;
  }

  /** Copy where valid samples below {@code threshold} become nodata. */
  public Raster withInvalidBelow(float threshold) {
    float[] out = samples.clone();
    for (int i = 0; i < out.length; i++) {
      if (isValid(i) && out[i] < threshold) {
        out[i] = nodata;
      }
    }
    return new Raster(grid, out, nodata);
  }

  public float[] toArray() {
    return samples.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Raster other)) {
      return false;
    }
    return Float.compare(nodata, other.nodata) == 0
        && grid.equals(other.grid)
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(grid, nodata) + Arrays.hashCode(samples);
  }

  @Override
  public String toString() {
    return "Raster[" + grid.width() + "x" + grid.height() + ", crs=" + grid.crs()
        + ", nodata=" + nodata + "]";
  }
}
