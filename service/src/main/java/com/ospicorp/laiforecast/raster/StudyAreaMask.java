package com.ospicorp.laiforecast.raster;

import java.util.Arrays;
import java.util.Objects;

/** Pixels inside the study-area boundary on a given grid. */
public final class StudyAreaMask {

  private final GridGeometry grid;
  private final boolean[] inside;

  public StudyAreaMask(GridGeometry grid, boolean[] inside) {
    this.grid = Objects.requireNonNull(grid, "grid");
    if (inside.length != grid.size()) {
      throw new IllegalArgumentException("mask has " + inside.length + " cells, grid has "
          + grid.size());
    }
    this.inside = inside.clone();
  }

  public static StudyAreaMask all(GridGeometry grid) {
    boolean[] inside = new boolean[grid.size()];
    Arrays.fill(inside, true);
    return new StudyAreaMask(grid, inside);
  }

  public GridGeometry grid() {
    return grid;
  }

  public boolean contains(int index) {
    return inside[index];
  }

  public int insideCount() {
    int count = 0;
    for (boolean b : inside) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /** Copy of {@code raster} with every pixel outside the study area set to nodata. */
  public Raster clip(Raster raster) {
    GridMismatchException.requireCoRegistered(grid, raster.grid(), "raster");
    float[] samples = raster.toArray();
    for (int i = 0; i < samples.length; i++) {
      if (!inside[i]) {
        samples[i] = raster.nodata();
      }
    }
    return new Raster(raster.grid(), samples, raster.nodata());
  }
}
