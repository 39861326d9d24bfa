package com.ospicorp.tsforecast.analysis.service;

import com.ospicorp.tsforecast.common.InsufficientDataException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import java.util.Arrays;
import java.util.Locale;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Classical moving-average decomposition. The trend is a centred moving average whose missing
 * ends are extrapolated linearly from the nearest {@code period} trend points; the seasonal
 * component is the average detrended value per position in the cycle.
 */
public final class SeasonalDecomposer {

  public enum Mode {
    ADDITIVE, MULTIPLICATIVE;

    public static Mode parse(String raw) {
      if (raw == null) {
        return ADDITIVE;
      }
      switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "additive":
        case "add":
          return ADDITIVE;
        case "multiplicative":
        case "mul":
          return MULTIPLICATIVE;
        default:
          throw new InvalidParameterException("Unknown decomposition method: " + raw, "method");
      }
    }

    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  public record Components(double[] trend, double[] seasonal, double[] residual) {}

  private SeasonalDecomposer() {
  }

  public static Components decompose(double[] x, int period, Mode mode) {
    int n = x.length;
    if (period < 2) {
      throw new InvalidParameterException("Decomposition period must be at least 2", "period");
    }
    if (n < 2 * period) {
      throw new InsufficientDataException(
          "Need at least " + (2 * period) + " observations for period " + period);
    }
    if (mode == Mode.MULTIPLICATIVE) {
      for (double v : x) {
        if (v <= 0) {
          throw new InvalidParameterException(
              "Multiplicative decomposition requires strictly positive values", "method");
        }
      }
    }
    double[] trend = centredMovingAverage(x, period);
    extrapolate(trend, period);

    double[] detrended = new double[n];
    for (int i = 0; i < n; i++) {
      detrended[i] = mode == Mode.ADDITIVE ? x[i] - trend[i] : x[i] / trend[i];
    }
    double[] averages = new double[period];
    for (int p = 0; p < period; p++) {
      double sum = 0d;
      int count = 0;
      for (int i = p; i < n; i += period) {
        if (!Double.isNaN(detrended[i])) {
          sum += detrended[i];
          count++;
        }
      }
      averages[p] = count == 0 ? Double.NaN : sum / count;
    }
    double overall = Arrays.stream(averages).average().orElse(0d);
    for (int p = 0; p < period; p++) {
      averages[p] = mode == Mode.ADDITIVE ? averages[p] - overall : averages[p] / overall;
    }
    double[] seasonal = new double[n];
    double[] residual = new double[n];
    for (int i = 0; i < n; i++) {
      seasonal[i] = averages[i % period];
      residual[i] = mode == Mode.ADDITIVE ? detrended[i] - seasonal[i]
          : detrended[i] / seasonal[i];
    }
    return new Components(trend, seasonal, residual);
  }

  /** Weights 1/p, or [½, 1, …, 1, ½]/p for even p; NaN where the window does not fit. */
  static double[] centredMovingAverage(double[] x, int period) {
    double[] weights;
    if (period % 2 == 0) {
      weights = new double[period + 1];
      Arrays.fill(weights, 1d / period);
      weights[0] = 0.5 / period;
      weights[period] = 0.5 / period;
    } else {
      weights = new double[period];
      Arrays.fill(weights, 1d / period);
    }
    int half = weights.length / 2;
    double[] out = new double[x.length];
    Arrays.fill(out, Double.NaN);
    for (int i = half; i < x.length - half; i++) {
      double sum = 0d;
      for (int j = 0; j < weights.length; j++) {
        sum += weights[j] * x[i - half + j];
      }
      out[i] = sum;
    }
    return out;
  }

  private static void extrapolate(double[] trend, int points) {
    int n = trend.length;
    int front = 0;
    while (front < n && Double.isNaN(trend[front])) {
      front++;
    }
    int back = n - 1;
    while (back >= 0 && Double.isNaN(trend[back])) {
      back--;
    }
    if (front > back) {
      return;
    }
    SimpleRegression head = lineThrough(trend, front, Math.min(front + points, back));
    for (int i = 0; i < front; i++) {
      trend[i] = valueAt(head, trend[front], i);
    }
    SimpleRegression tail = lineThrough(trend, Math.max(front, back - points), back);
    for (int i = back + 1; i < n; i++) {
      trend[i] = valueAt(tail, trend[back], i);
    }
  }

  private static SimpleRegression lineThrough(double[] values, int from, int to) {
    SimpleRegression regression = new SimpleRegression();
    for (int i = from; i < to; i++) {
      regression.addData(i, values[i]);
    }
    return regression;
  }

  /** Constant continuation when there are too few points to fit a line. */
  private static double valueAt(SimpleRegression line, double fallback, int index) {
    if (line.getN() < 2) {
      return fallback;
    }
    return line.predict(index);
  }
}
