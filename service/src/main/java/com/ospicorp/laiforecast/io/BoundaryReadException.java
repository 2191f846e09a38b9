package com.ospicorp.laiforecast.io;

public class BoundaryReadException extends RuntimeException {

  public BoundaryReadException(String message) {
    super(message);
  }

  public BoundaryReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
