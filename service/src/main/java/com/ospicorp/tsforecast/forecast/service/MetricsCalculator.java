package com.ospicorp.tsforecast.forecast.service;

import com.ospicorp.tsforecast.forecast.model.ForecastMetrics;

/**
 * Accuracy of in-sample predictions against actuals.
 */
public final class MetricsCalculator {
  static final String NO_VALID_POINTS = "No valid data points for metric calculation";

  private MetricsCalculator() {
  }

  /**
   * Trims both sequences to their common length and skips pairs where either side is NaN. MAPE
   * only covers non-zero actuals and is {@code null} when there are none.
   */
  public static ForecastMetrics calculate(double[] actual, double[] predicted) {
    int n = Math.min(actual.length, predicted.length);
    int count = 0;
    double absolute = 0d;
    double squared = 0d;
    int percentageCount = 0;
    double percentage = 0d;
    for (int i = 0; i < n; i++) {
      double a = actual[i];
      double p = predicted[i];
      if (Double.isNaN(a) || Double.isNaN(p)) {
        continue;
      }
      double error = a - p;
      absolute += Math.abs(error);
      squared += error * error;
      count++;
      if (a != 0d) {
        percentage += Math.abs(error / a);
        percentageCount++;
      }
    }
    if (count == 0) {
      return ForecastMetrics.error(NO_VALID_POINTS);
    }
    double mse = squared / count;
    Double mape = percentageCount == 0 ? null : percentage / percentageCount * 100d;
    return ForecastMetrics.of(absolute / count, mse, Math.sqrt(mse), mape, count);
  }
}
