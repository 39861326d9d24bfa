package com.ospicorp.tsforecast.forecast.model;

/**
 * Point forecast with its interval, all arrays of the requested horizon length.
 */
public record ForecastOutput(double[] forecast, double[] lowerBound, double[] upperBound) {

  public ForecastOutput {
    if (forecast.length != lowerBound.length || forecast.length != upperBound.length) {
      throw new IllegalArgumentException("forecast and bounds must have equal length");
    }
  }

  public int periods() {
    return forecast.length;
  }
}
