package com.ospicorp.laiforecast.raster;

import java.util.Objects;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples a raster onto a reference grid, reprojecting pixel centres when the CRS differs.
 */
public class GridAligner {

  private static final Logger log = LoggerFactory.getLogger(GridAligner.class);

  private final CrsRegistry crsRegistry;

  public GridAligner(CrsRegistry crsRegistry) {
    this.crsRegistry = Objects.requireNonNull(crsRegistry, "crsRegistry");
  }

  public Raster align(Raster reference, Raster target, Resampling resampling) {
    return align(reference.grid(), target, resampling);
  }

  public VegetationClassMap alignClasses(GridGeometry reference, VegetationClassMap classes) {
    Raster aligned = align(reference, classes.raster(), Resampling.NEAREST);
    return aligned == classes.raster() ? classes : new VegetationClassMap(aligned);
  }

  public Raster alignLai(GridGeometry reference, Raster lai) {
    return align(reference, lai, Resampling.BILINEAR);
  }

  public Raster align(GridGeometry reference, Raster target, Resampling resampling) {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(resampling, "resampling");
    GridGeometry source = target.grid();
    if (!source.hasCrs()) {
      throw new GridMismatchException("Raster to align has no coordinate reference system");
    }
    if (!reference.hasCrs()) {
      throw new GridMismatchException("Reference grid has no coordinate reference system");
    }
    if (source.isCoRegistered(reference)) {
      return target;
    }

    CoordinateTransform toSource = null;
    if (!source.crs().equals(reference.crs())) {
      try {
        toSource = crsRegistry.transform(reference.crs(), source.crs());
      } catch (IllegalArgumentException | Proj4jException ex) {
        throw new GridMismatchException("Cannot reproject " + source.crs() + " onto "
            + reference.crs() + ": " + ex.getMessage(), ex);
      }
    }

    GeoTransform referenceTransform = reference.transform();
    GeoTransform sourceTransform = source.transform();
    ProjCoordinate centre = new ProjCoordinate();
    ProjCoordinate projected = new ProjCoordinate();
    float[] out = new float[reference.size()];
    int valid = 0;
    for (int row = 0; row < reference.height(); row++) {
      for (int col = 0; col < reference.width(); col++) {
        double x = referenceTransform.columnCenterX(col);
        double y = referenceTransform.rowCenterY(row);
        if (toSource != null) {
          centre.x = x;
          centre.y = y;
          if (!project(toSource, centre, projected)) {
            out[reference.index(col, row)] = target.nodata();
            continue;
          }
          x = projected.x;
          y = projected.y;
        }
        double sourceCol = sourceTransform.toColumn(x);
        double sourceRow = sourceTransform.toRow(y);
        float value = resampling == Resampling.NEAREST
            ? sampleNearest(target, sourceCol, sourceRow)
            : sampleBilinear(target, sourceCol, sourceRow);
        out[reference.index(col, row)] = value;
        if (!Float.isNaN(value) && value != target.nodata()) {
          valid++;
        }
      }
    }
    if (valid == 0) {
      throw new GridMismatchException("Aligning a " + source.width() + "x" + source.height()
          + " " + source.crs() + " raster onto the reference grid produced no valid pixels");
    }
    log.debug("Aligned {} onto {}x{} {} grid ({} resampling, {} valid pixels)",
        target, reference.width(), reference.height(), reference.crs(), resampling, valid);
    return new Raster(reference, out, target.nodata());
  }

  // Points outside the projection's domain have no counterpart in the source grid.
  private static boolean project(CoordinateTransform transform, ProjCoordinate in,
      ProjCoordinate out) {
    try {
      transform.transform(in, out);
    } catch (Proj4jException ex) {
      return false;
    }
    return Double.isFinite(out.x) && Double.isFinite(out.y);
  }

  static float sampleNearest(Raster source, double col, double row) {
    if (col < 0d || row < 0d || col >= source.width() || row >= source.height()) {
      return source.nodata();
    }
    int c = (int) Math.floor(col);
    int r = (int) Math.floor(row);
    return source.isValid(c, r) ? source.get(c, r) : source.nodata();
  }

  /**
   * Bilinear interpolation between the four surrounding pixel centres. Nodata neighbours are
   * dropped and the remaining weights renormalised.
   */
  static float sampleBilinear(Raster source, double col, double row) {
    if (col < 0d || row < 0d || col > source.width() || row > source.height()) {
      return source.nodata();
    }
    double fc = col - 0.5d;
    double fr = row - 0.5d;
    int c0 = (int) Math.floor(fc);
    int r0 = (int) Math.floor(fr);
    double dx = fc - c0;
    double dy = fr - r0;

    double weightSum = 0d;
    double valueSum = 0d;
    for (int j = 0; j <= 1; j++) {
      double wy = j == 0 ? 1d - dy : dy;
      int r = clamp(r0 + j, source.height());
      for (int i = 0; i <= 1; i++) {
        double weight = (i == 0 ? 1d - dx : dx) * wy;
        int c = clamp(c0 + i, source.width());
        if (weight > 0d && source.isValid(c, r)) {
          weightSum += weight;
          valueSum += weight * source.get(c, r);
        }
      }
    }
    return weightSum > 0d ? (float) (valueSum / weightSum) : source.nodata();
  }

  private static int clamp(int index, int size) {
    return Math.max(0, Math.min(size - 1, index));
  }
}
