package com.ospicorp.tsforecast.analysis.service;

import com.ospicorp.tsforecast.analysis.model.Correlogram;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Sample autocorrelation (Bartlett bands) and partial autocorrelation (Durbin-Levinson on the
 * lag-adjusted autocorrelations, ±z/√n bands) at the 95% level.
 */
public final class Autocorrelation {
  private static final double Z = new NormalDistribution().inverseCumulativeProbability(0.975);

  private Autocorrelation() {
  }

  /** Biased (divide-by-n) autocorrelations for lags {@code 0..maxLag}. */
  static double[] acfValues(double[] x, int maxLag) {
    return acfValues(x, maxLag, false);
  }

  /**
   * Autocorrelations for lags {@code 0..maxLag}. When {@code adjusted}, the lag-k autocovariance
   * is divided by {@code n - k} instead of {@code n}.
   */
  static double[] acfValues(double[] x, int maxLag, boolean adjusted) {
    int n = x.length;
    double mean = 0d;
    for (double v : x) {
      mean += v;
    }
    mean /= n;
    double[] acov = new double[maxLag + 1];
    for (int k = 0; k <= maxLag; k++) {
      double sum = 0d;
      for (int t = k; t < n; t++) {
        sum += (x[t] - mean) * (x[t - k] - mean);
      }
      acov[k] = sum / (adjusted ? n - k : n);
    }
    double[] acf = new double[maxLag + 1];
    for (int k = 0; k <= maxLag; k++) {
      acf[k] = acov[0] == 0d ? (k == 0 ? 1d : 0d) : acov[k] / acov[0];
    }
    return acf;
  }

  public static Correlogram acf(double[] x, int maxLag) {
    double[] acf = acfValues(x, maxLag);
    int n = x.length;
    List<List<Double>> bands = new ArrayList<>(acf.length);
    double cumulative = 0d;
    for (int k = 0; k <= maxLag; k++) {
      double variance;
      if (k == 0) {
        variance = 0d;
      } else {
        variance = (1 + 2 * cumulative) / n;
        cumulative += acf[k] * acf[k];
      }
      double width = Z * Math.sqrt(variance);
      bands.add(List.of(acf[k] - width, acf[k] + width));
    }
    return new Correlogram(toList(acf), bands, lags(maxLag));
  }

  public static Correlogram pacf(double[] x, int maxLag) {
    double[] r = acfValues(x, maxLag, true);
    double[] pacf = new double[maxLag + 1];
    pacf[0] = 1d;
    double[] phi = new double[maxLag + 1];
    double[] previous = new double[maxLag + 1];
    double variance = 1d;
    for (int k = 1; k <= maxLag; k++) {
      double numerator = r[k];
      for (int j = 1; j < k; j++) {
        numerator -= previous[j] * r[k - j];
      }
      double reflection = variance == 0d ? 0d : numerator / variance;
      phi[k] = reflection;
      for (int j = 1; j < k; j++) {
        phi[j] = previous[j] - reflection * previous[k - j];
      }
      variance *= 1 - reflection * reflection;
      pacf[k] = reflection;
      System.arraycopy(phi, 0, previous, 0, k + 1);
    }
    double width = Z / Math.sqrt(x.length);
    List<List<Double>> bands = new ArrayList<>(pacf.length);
    for (int k = 0; k <= maxLag; k++) {
      double w = k == 0 ? 0d : width;
      bands.add(List.of(pacf[k] - w, pacf[k] + w));
    }
    return new Correlogram(toList(pacf), bands, lags(maxLag));
  }

  private static List<Double> toList(double[] values) {
    List<Double> out = new ArrayList<>(values.length);
    for (double v : values) {
      out.add(v);
    }
    return out;
  }

  private static List<Integer> lags(int maxLag) {
    List<Integer> out = new ArrayList<>(maxLag + 1);
    for (int k = 0; k <= maxLag; k++) {
      out.add(k);
    }
    return out;
  }
}
