package com.ospicorp.laiforecast.raster;

public class GridMismatchException extends RuntimeException {

  public GridMismatchException(String message) {
    super(message);
  }

  public GridMismatchException(String message, Throwable cause) {
    super(message, cause);
  }

  public static void requireCoRegistered(GridGeometry expected, GridGeometry actual, String what) {
    if (!expected.isCoRegistered(actual)) {
      throw new GridMismatchException(what + " is not co-registered with the working grid: "
          + actual + " vs " + expected);
    }
  }
}
