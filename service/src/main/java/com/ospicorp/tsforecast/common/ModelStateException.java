package com.ospicorp.tsforecast.common;

public class ModelStateException extends TimeSeriesException {
  public static final int ERROR_CODE = 2006;

  public ModelStateException(String message) {
    super(message, ERROR_CODE);
  }

  public ModelStateException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
