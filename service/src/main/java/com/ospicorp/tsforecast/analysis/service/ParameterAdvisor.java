package com.ospicorp.tsforecast.analysis.service;

import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions.ArimaSuggestion;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions.HoltWintersSuggestion;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions.SarimaSuggestion;
import com.ospicorp.tsforecast.common.TimeSeriesException;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starting configurations for ARIMA, SARIMA and Holt-Winters derived from simple trend,
 * seasonality and stationarity checks.
 */
public final class ParameterAdvisor {
  private static final Logger log = LoggerFactory.getLogger(ParameterAdvisor.class);

  static final int EDGE_WINDOW = 12;
  private static final int[] SHORT_CANDIDATES = {7, 12};
  private static final int[] LONG_CANDIDATES = {7, 12, 24, 52};

  private ParameterAdvisor() {
  }

  public static ParameterSuggestions suggest(double[] x) {
    int n = x.length;
    boolean hasTrend = hasTrend(x);
    Integer period = null;
    Boolean hasSeasonality = null;
    if (n >= 24) {
      period = seasonalPeriod(x);
      hasSeasonality = period != null;
    }

    int d;
    try {
      d = StationarityTests.adf(x).stationary() ? 0 : 1;
    } catch (TimeSeriesException ex) {
      log.debug("ADF unavailable for parameter suggestion, assuming d=1: {}", ex.getMessage());
      d = 1;
    }
    ArimaSuggestion arima = new ArimaSuggestion(List.of(1, d, 1),
        "Basic ARIMA configuration based on stationarity test");

    SarimaSuggestion sarima = null;
    if (Boolean.TRUE.equals(hasSeasonality)) {
      sarima = new SarimaSuggestion(List.of(1, 1, 1), List.of(1, 1, 1, period),
          "SARIMA with seasonal period " + period);
    }
    HoltWintersSuggestion holtWinters = new HoltWintersSuggestion(
        hasTrend ? "additive" : "none",
        Boolean.TRUE.equals(hasSeasonality) ? "additive" : "none",
        period != null ? period : 12,
        "Holt-Winters configuration based on trend and seasonality detection");
    return new ParameterSuggestions(hasTrend, period, hasSeasonality, arima, sarima,
        holtWinters);
  }

  /** Means of the first and last 12 points differ by more than half a standard deviation. */
  static boolean hasTrend(double[] x) {
    int n = x.length;
    int edge = Math.min(EDGE_WINDOW, n);
    double head = StatUtils.mean(x, 0, edge);
    double tail = StatUtils.mean(x, n - edge, edge);
    double sd = new StandardDeviation().evaluate(x);
    return Math.abs(tail - head) > 0.5 * sd;
  }

  /**
   * The candidate period whose per-position means vary least. Candidates need at least two full
   * cycles; {@code null} when none qualifies.
   */
  static Integer seasonalPeriod(double[] x) {
    int n = x.length;
    int[] candidates = n >= 52 ? LONG_CANDIDATES : SHORT_CANDIDATES;
    Integer best = null;
    double minVariance = Double.POSITIVE_INFINITY;
    for (int period : candidates) {
      if (n < 2 * period) {
        continue;
      }
      double[] sums = new double[period];
      int[] counts = new int[period];
      for (int i = 0; i < n; i++) {
        sums[i % period] += x[i];
        counts[i % period]++;
      }
      double[] means = new double[period];
      for (int p = 0; p < period; p++) {
        means[p] = sums[p] / counts[p];
      }
      double variance = StatUtils.variance(means);
      if (variance < minVariance) {
        minVariance = variance;
        best = period;
      }
    }
    log.trace("Seasonal period candidates {} -> {}", Arrays.toString(candidates), best);
    return best;
  }
}
