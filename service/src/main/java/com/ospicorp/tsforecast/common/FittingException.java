package com.ospicorp.tsforecast.common;

public class FittingException extends TimeSeriesException {
  public static final int ERROR_CODE = 2005;

  public FittingException(String message) {
    super(message, ERROR_CODE);
  }

  public FittingException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
