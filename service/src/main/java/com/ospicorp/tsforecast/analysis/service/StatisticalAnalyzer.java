package com.ospicorp.tsforecast.analysis.service;

import com.ospicorp.tsforecast.analysis.model.AcfPacfResult;
import com.ospicorp.tsforecast.analysis.model.DecompositionResult;
import com.ospicorp.tsforecast.analysis.model.OutlierReport;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions;
import com.ospicorp.tsforecast.analysis.model.RollingStatistics;
import com.ospicorp.tsforecast.analysis.model.SeasonalityResult;
import com.ospicorp.tsforecast.analysis.model.SeasonalityResult.PeriodStrength;
import com.ospicorp.tsforecast.analysis.model.StationarityResult;
import com.ospicorp.tsforecast.analysis.model.StationarityTest;
import com.ospicorp.tsforecast.analysis.model.SummaryStatistics;
import com.ospicorp.tsforecast.analysis.service.SeasonalDecomposer.Components;
import com.ospicorp.tsforecast.analysis.service.SeasonalDecomposer.Mode;
import com.ospicorp.tsforecast.common.InsufficientDataException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.Outcome;
import com.ospicorp.tsforecast.common.TimeSeriesException;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Diagnostics on a single series. Every operation is a pure function of its input.
 */
@Service
public class StatisticalAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(StatisticalAnalyzer.class);

  static final int MIN_STATIONARITY_POINTS = 10;
  static final int MIN_SEASONALITY_POINTS = 24;
  static final int[] SEASONALITY_CANDIDATES = {4, 12, 24, 52};
  static final double SIGNIFICANT_STRENGTH = 0.1;
  static final int FULL_ANALYSIS_LAGS = 20;

  public StationarityResult stationarity(TimeSeries series) {
    if (series.length() < MIN_STATIONARITY_POINTS) {
      throw new InsufficientDataException("Insufficient data points for stationarity testing");
    }
    double[] x = series.values();
    StationarityTest adf = StationarityTests.adf(x);
    StationarityTest kpss = StationarityTests.kpss(x);
    boolean stationary = adf.stationary() && kpss.stationary();
    return new StationarityResult(adf, kpss, new StationarityResult.Conclusion(stationary,
        StationarityTests.recommendation(adf.stationary(), kpss.stationary())));
  }

  public SeasonalityResult seasonality(TimeSeries series) {
    int n = series.length();
    if (n < MIN_SEASONALITY_POINTS) {
      return SeasonalityResult.insufficient("Insufficient data for seasonality testing "
          + "(minimum " + MIN_SEASONALITY_POINTS + " observations required)");
    }
    double[] x = series.values();
    Map<String, PeriodStrength> all = new LinkedHashMap<>();
    Integer bestPeriod = null;
    double bestStrength = 0d;
    Variance population = new Variance(false);
    for (int period : SEASONALITY_CANDIDATES) {
      if (n < 2 * period) {
        continue;
      }
      Components parts = SeasonalDecomposer.decompose(x, period, Mode.ADDITIVE);
      double seasonalVariance = population.evaluate(parts.seasonal());
      double residualVariance = population.evaluate(parts.residual());
      double strength = residualVariance > 0
          ? seasonalVariance / (seasonalVariance + residualVariance) : 0d;
      all.put("period_" + period, new PeriodStrength(strength, strength > SIGNIFICANT_STRENGTH));
      if (strength > bestStrength) {
        bestStrength = strength;
        bestPeriod = period;
      }
    }
    return new SeasonalityResult(bestStrength > SIGNIFICANT_STRENGTH, bestPeriod, bestStrength,
        all, null);
  }

  public DecompositionResult decompose(TimeSeries series, String method, Integer period) {
    int n = series.length();
    int p;
    if (period != null) {
      p = period;
    } else if (n >= 24) {
      p = 12;
    } else if (n >= 8) {
      p = 4;
    } else {
      throw new InsufficientDataException("Insufficient data for decomposition");
    }
    Mode mode = Mode.parse(method);
    Components parts = SeasonalDecomposer.decompose(series.values(), p, mode);
    double[] residual = parts.residual();
    for (int i = 0; i < residual.length; i++) {
      if (Double.isNaN(residual[i])) {
        residual[i] = 0d;
      }
    }
    return new DecompositionResult(toList(parts.trend()), toList(parts.seasonal()),
        toList(residual), series.asList(), axis(series), mode.code(), p);
  }

  public AcfPacfResult acfPacf(TimeSeries series, int lags) {
    int n = series.length();
    if (n < MIN_STATIONARITY_POINTS) {
      throw new InsufficientDataException("Insufficient data for ACF/PACF calculation");
    }
    if (lags < 1) {
      throw new InvalidParameterException("Parameter 'lags' must be at least 1", "lags");
    }
    int maxLag = Math.min(lags, n - 1);
    double[] x = series.values();
    return new AcfPacfResult(Autocorrelation.acf(x, maxLag), Autocorrelation.pacf(x, maxLag));
  }

  public RollingStatistics rollingStatistics(TimeSeries series, int window) {
    if (window < 1) {
      throw new InvalidParameterException("Parameter 'window' must be at least 1", "window");
    }
    int n = series.length();
    if (n < window) {
      throw new InsufficientDataException("Insufficient data for window size " + window);
    }
    DescriptiveStatistics rolling = new DescriptiveStatistics(window);
    List<Double> means = new ArrayList<>(n);
    List<Double> deviations = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      rolling.addValue(series.value(i));
      boolean full = i >= window - 1;
      means.add(full ? rolling.getMean() : null);
      deviations.add(full && window > 1 ? rolling.getStandardDeviation() : null);
    }
    return new RollingStatistics(series.asList(), means, deviations, axis(series), window);
  }

  public OutlierReport outliers(TimeSeries series, String method) {
    return OutlierDetector.detect(series.values(), method);
  }

  public ParameterSuggestions suggestParameters(TimeSeries series) {
    return ParameterAdvisor.suggest(series.values());
  }

  public SummaryStatistics summary(TimeSeries series, boolean withMissing) {
    DescriptiveStatistics stats = new DescriptiveStatistics(series.values());
    return new SummaryStatistics(series.length(), stats.getMean(), stats.getStandardDeviation(),
        stats.getMin(), stats.getMax(), withMissing ? null : stats.getPercentile(50),
        withMissing ? series.missingCount() : null);
  }

  /**
   * Summary, stationarity, seasonality, ACF/PACF and rolling statistics. A failing section is
   * reported as an error fragment without affecting the others.
   */
  public Map<String, Object> fullAnalysis(TimeSeries series) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("data_summary", summary(series, true));
    out.put("stationarity", section("stationarity", () -> stationarity(series)));
    out.put("seasonality", section("seasonality", () -> seasonality(series)));
    out.put("acf_pacf", section("acf_pacf", () -> acfPacf(series, FULL_ANALYSIS_LAGS)));
    int window = Math.min(12, series.length() / 4);
    out.put("rolling_stats", section("rolling_stats", () -> rollingStatistics(series, window)));
    return out;
  }

  /** Value of the computation, or an {@code {"error": message}} fragment if it fails. */
  public static Object section(String name, Supplier<?> computation) {
    Outcome<?> outcome = Outcome.of(computation);
    if (outcome instanceof Outcome.Failure<?> failure) {
      TimeSeriesException error = failure.error();
      log.info("Analysis section {} skipped: {}", name, error.getMessage());
    }
    return outcome.valueOrErrorFragment();
  }

  private static List<Object> axis(TimeSeries series) {
    List<Object> out = new ArrayList<>(series.length());
    if (series.hasTimeAxis()) {
      out.addAll(series.timeLabels());
    } else {
      for (int i = 0; i < series.length(); i++) {
        out.add(i);
      }
    }
    return out;
  }

  private static List<Double> toList(double[] values) {
    List<Double> out = new ArrayList<>(values.length);
    for (double v : values) {
      out.add(v);
    }
    return out;
  }
}
