package com.ospicorp.tsforecast.common;

public class DataFormatException extends TimeSeriesException {
  public static final int ERROR_CODE = 2001;

  public DataFormatException(String message) {
    super(message, ERROR_CODE);
  }

  public DataFormatException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
