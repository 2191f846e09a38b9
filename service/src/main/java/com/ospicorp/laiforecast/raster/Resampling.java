package com.ospicorp.laiforecast.raster;

public enum Resampling {
  /** Discrete labels. */
  NEAREST,
  /** Continuous values. */
  BILINEAR
}
