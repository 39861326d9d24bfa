package com.ospicorp.tsforecast.common;

public class InsufficientDataException extends TimeSeriesException {
  public static final int ERROR_CODE = 2002;

  public InsufficientDataException(String message) {
    super(message, ERROR_CODE);
  }

  public InsufficientDataException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
