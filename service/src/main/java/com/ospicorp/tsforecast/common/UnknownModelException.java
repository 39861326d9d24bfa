package com.ospicorp.tsforecast.common;

public class UnknownModelException extends TimeSeriesException {
  public static final int ERROR_CODE = 2003;

  public UnknownModelException(String message) {
    super(message, ERROR_CODE);
  }

  public UnknownModelException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
