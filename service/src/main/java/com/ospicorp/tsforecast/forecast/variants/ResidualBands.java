package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Constant-width interval {@code point ± 1.96·σ} used by variants without a native forecast-error
 * variance.
 */
final class ResidualBands {
  static final double Z = 1.96;
  static final String DESCRIPTION = "point ± 1.96·σ of in-sample residuals (approximation)";

  private ResidualBands() {
  }

  /** Sample standard deviation of {@code actual - fitted}, skipping warm-up positions. */
  static double residualSigma(double[] actual, double[] fitted) {
    StandardDeviation sd = new StandardDeviation();
    int count = 0;
    int n = Math.min(actual.length, fitted.length);
    for (int i = 0; i < n; i++) {
      if (!Double.isNaN(fitted[i]) && !Double.isNaN(actual[i])) {
        sd.increment(actual[i] - fitted[i]);
        count++;
      }
    }
    return count < 2 ? 0d : sd.getResult();
  }

  static ForecastOutput around(double[] point, double sigma) {
    double[] lower = new double[point.length];
    double[] upper = new double[point.length];
    for (int i = 0; i < point.length; i++) {
      lower[i] = point[i] - Z * sigma;
      upper[i] = point[i] + Z * sigma;
    }
    return new ForecastOutput(point, lower, upper);
  }
}
