package com.ospicorp.laiforecast.raster;

/**
 * North-up affine transform: pixel (col, row) covers
 * [originX + col * pixelWidth, originX + (col + 1) * pixelWidth] horizontally.
 * pixelHeight is negative for the usual top-left origin.
 */
public record GeoTransform(double originX, double originY, double pixelWidth, double pixelHeight) {

  public GeoTransform {
    if (!Double.isFinite(originX) || !Double.isFinite(originY)) {
      throw new IllegalArgumentException("origin must be finite");
    }
    if (!Double.isFinite(pixelWidth) || pixelWidth == 0d
        || !Double.isFinite(pixelHeight) || pixelHeight == 0d) {
      throw new IllegalArgumentException(
          "pixel size must be finite and non-zero: " + pixelWidth + " x " + pixelHeight);
    }
  }

  public double columnCenterX(int col) {
    return originX + (col + 0.5d) * pixelWidth;
  }

  public double rowCenterY(int row) {
    return originY + (row + 0.5d) * pixelHeight;
  }

  /** Fractional column measured from the left edge of the grid. */
  public double toColumn(double x) {
    return (x - originX) / pixelWidth;
  }

  /** Fractional row measured from the top edge of the grid. */
  public double toRow(double y) {
    return (y - originY) / pixelHeight;
  }
}
