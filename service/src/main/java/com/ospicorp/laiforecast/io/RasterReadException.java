package com.ospicorp.laiforecast.io;

public class RasterReadException extends RuntimeException {

  public RasterReadException(String message) {
    super(message);
  }

  public RasterReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
