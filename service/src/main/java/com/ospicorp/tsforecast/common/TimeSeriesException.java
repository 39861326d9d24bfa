package com.ospicorp.tsforecast.common;

public abstract class TimeSeriesException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://docs.ts-forecast.dev/errors/";

  private final int errorCode;

  protected TimeSeriesException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
  }

  protected TimeSeriesException(String message, int errorCode, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return ERROR_DOCS_BASE + errorCode;
  }
}
