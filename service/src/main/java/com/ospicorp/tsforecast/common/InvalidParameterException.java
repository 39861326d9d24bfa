package com.ospicorp.tsforecast.common;

public class InvalidParameterException extends TimeSeriesException {
  public static final int ERROR_CODE = 2004;

  private final String parameter;

  public InvalidParameterException(String message) {
    this(message, null);
  }

  public InvalidParameterException(String message, String parameter) {
    super(message, ERROR_CODE);
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }
}
