package com.ospicorp.laiforecast.io;

public class RasterWriteException extends RuntimeException {

  public RasterWriteException(String message) {
    super(message);
  }

  public RasterWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
