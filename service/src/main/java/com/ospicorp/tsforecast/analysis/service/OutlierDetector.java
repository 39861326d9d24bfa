package com.ospicorp.tsforecast.analysis.service;

import com.ospicorp.tsforecast.analysis.model.OutlierReport;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Flags outlying points by the interquartile rule, the classical z-score or the robust
 * (median/MAD) modified z-score.
 */
public final class OutlierDetector {
  static final double IQR_MULTIPLIER = 1.5;
  static final double Z_THRESHOLD = 3d;
  private static final double MODIFIED_Z_SCALE = 0.6745;
  // MeanAD scale used when the MAD is zero
  private static final double MEAN_AD_SCALE = 1.253314;

  private OutlierDetector() {
  }

  public static OutlierReport detect(double[] x, String method) {
    String normalized = method == null ? "iqr" : method.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "iqr":
        return interquartile(x);
      case "z_score":
      case "zscore":
        return zScore(x);
      case "modified_z_score":
        return modifiedZScore(x);
      default:
        throw new InvalidParameterException("Unknown outlier detection method: " + method
            + " (expected iqr, z_score or modified_z_score)", "method");
    }
  }

  static OutlierReport interquartile(double[] x) {
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(x);
    double q1 = percentile.evaluate(25);
    double q3 = percentile.evaluate(75);
    double iqr = q3 - q1;
    double lower = q1 - IQR_MULTIPLIER * iqr;
    double upper = q3 + IQR_MULTIPLIER * iqr;
    List<Integer> indices = new ArrayList<>();
    List<Double> values = new ArrayList<>();
    for (int i = 0; i < x.length; i++) {
      if (x[i] < lower || x[i] > upper) {
        indices.add(i);
        values.add(x[i]);
      }
    }
    return new OutlierReport("IQR", indices, values, lower, upper, null, indices.size());
  }

  static OutlierReport zScore(double[] x) {
    DescriptiveStatistics stats = new DescriptiveStatistics(x);
    double mean = stats.getMean();
    double sd = stats.getStandardDeviation();
    List<Integer> indices = new ArrayList<>();
    List<Double> values = new ArrayList<>();
    if (sd > 0) {
      for (int i = 0; i < x.length; i++) {
        if (Math.abs((x[i] - mean) / sd) > Z_THRESHOLD) {
          indices.add(i);
          values.add(x[i]);
        }
      }
    }
    return new OutlierReport("Z-Score", indices, values, null, null, Z_THRESHOLD,
        indices.size());
  }

  static OutlierReport modifiedZScore(double[] x) {
    double median = new Median().evaluate(x);
    double[] deviations = new double[x.length];
    double meanDeviation = 0d;
    for (int i = 0; i < x.length; i++) {
      deviations[i] = Math.abs(x[i] - median);
      meanDeviation += deviations[i];
    }
    meanDeviation /= x.length;
    double mad = new Median().evaluate(deviations);
    double scale;
    if (mad > 0) {
      scale = mad / MODIFIED_Z_SCALE;
    } else {
      scale = MEAN_AD_SCALE * meanDeviation;
    }
    List<Integer> indices = new ArrayList<>();
    List<Double> values = new ArrayList<>();
    if (scale > 0) {
      for (int i = 0; i < x.length; i++) {
        if (deviations[i] / scale > Z_THRESHOLD) {
          indices.add(i);
          values.add(x[i]);
        }
      }
    }
    return new OutlierReport("Modified Z-Score", indices, values, null, null, Z_THRESHOLD,
        indices.size());
  }
}
