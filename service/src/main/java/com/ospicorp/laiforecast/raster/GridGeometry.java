package com.ospicorp.laiforecast.raster;

import java.util.Locale;
import java.util.Objects;

/**
 * Shape, transform and CRS of a raster. Two rasters are co-registered only when their
 * geometries are equal.
 */
public record GridGeometry(int width, int height, GeoTransform transform, String crs) {

  public GridGeometry {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("grid must not be empty: " + width + " x " + height);
    }
    Objects.requireNonNull(transform, "transform");
    crs = (crs == null || crs.isBlank()) ? null : crs.trim().toUpperCase(Locale.ROOT);
  }

  public boolean hasCrs() {
    return crs != null;
  }

  public int size() {
    return width * height;
  }

  public int index(int col, int row) {
    return row * width + col;
  }

  public boolean isCoRegistered(GridGeometry other) {
    return equals(other);
  }
}
