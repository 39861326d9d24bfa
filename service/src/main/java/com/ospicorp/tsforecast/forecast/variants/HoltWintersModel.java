package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Holt-Winters exponential smoothing with optional trend and seasonal components. Smoothing
 * weights minimise the in-sample one-step squared error. There is no native forecast-error
 * variance; intervals are {@link ResidualBands}.
 */
public class HoltWintersModel implements ForecastingModel {
  private static final double LOWER = 1e-4;
  private static final double UPPER = 0.9999;

  enum Component {
    NONE, ADDITIVE, MULTIPLICATIVE;

    static Component parse(String raw, String parameter) {
      if (raw == null) {
        return NONE;
      }
      switch (raw) {
        case "none":
          return NONE;
        case "add":
        case "additive":
          return ADDITIVE;
        case "mul":
        case "multiplicative":
          return MULTIPLICATIVE;
        default:
          throw new InvalidParameterException(
              "Unsupported " + parameter + " component: " + raw, parameter);
      }
    }

    String code() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Component trend;
  private final Component seasonal;
  private final int period;

  private double[] observed;
  private double[] smoothing;
  private State state;
  private double[] fitted;
  private double sse;

  public HoltWintersModel(ModelParameters parameters) {
    this.trend = Component.parse(parameters.string("trend", "additive"), "trend");
    this.seasonal = Component.parse(parameters.string("seasonal", "additive"), "seasonal");
    int seasonLength = parameters.has("seasonal_periods")
        ? parameters.intValue("seasonal_periods", 12)
        : parameters.intValue("period", 12);
    if (seasonal != Component.NONE && seasonLength < 2) {
      throw new InvalidParameterException("Seasonal period must be at least 2",
          "seasonal_periods");
    }
    this.period = seasonal == Component.NONE ? 1 : seasonLength;
  }

  @Override
  public ModelType type() {
    return ModelType.HOLT_WINTERS;
  }

  @Override
  public void fit(TimeSeries series) {
    double[] y = series.values();
    if (seasonal != Component.NONE && y.length < 2 * period) {
      throw new FittingException("Holt-Winters with seasonal period " + period + " needs at least "
          + (2 * period) + " observations, got " + y.length);
    }
    if (y.length < 3) {
      throw new FittingException("Holt-Winters needs at least 3 observations");
    }
    if (trend == Component.MULTIPLICATIVE || seasonal == Component.MULTIPLICATIVE) {
      for (double v : y) {
        if (v <= 0) {
          throw new FittingException(
              "Multiplicative Holt-Winters components require strictly positive data");
        }
      }
    }
    int count = 1 + (trend != Component.NONE ? 1 : 0) + (seasonal != Component.NONE ? 1 : 0);
    double[] start = new double[count];
    start[0] = 0.3;
    for (int i = 1; i < count; i++) {
      start[i] = 0.1;
    }
    double[] best = ParameterSearch.minimize(type().code(),
        params -> run(y, params, null).sse, start, LOWER, UPPER);
    double[] predictions = new double[y.length];
    Run result = run(y, best, predictions);
    if (!Double.isFinite(result.sse)) {
      throw new FittingException("Holt-Winters recursion diverged for the estimated weights");
    }
    this.observed = y;
    this.smoothing = best;
    this.state = result.state;
    this.fitted = predictions;
    this.sse = result.sse;
  }

  private Run run(double[] y, double[] params, double[] predictionsOut) {
    double alpha = params[0];
    double beta = trend != Component.NONE ? params[1] : 0d;
    double gamma = seasonal != Component.NONE ? params[params.length - 1] : 0d;
    State s = initialState(y);
    double total = 0d;
    for (int t = 0; t < y.length; t++) {
      int idx = t % period;
      double season = s.seasons[idx];
      double prediction = withSeason(withTrend(s.level, s.slope, 1), season);
      if (predictionsOut != null) {
        predictionsOut[t] = prediction;
      }
      double error = y[t] - prediction;
      total += error * error;

      double deseasonalised = seasonal == Component.MULTIPLICATIVE ? y[t] / season
          : seasonal == Component.ADDITIVE ? y[t] - season : y[t];
      double level = alpha * deseasonalised + (1 - alpha) * withTrend(s.level, s.slope, 1);
      if (trend == Component.ADDITIVE) {
        s.slope = beta * (level - s.level) + (1 - beta) * s.slope;
      } else if (trend == Component.MULTIPLICATIVE) {
        s.slope = beta * (level / s.level) + (1 - beta) * s.slope;
      }
      if (seasonal == Component.ADDITIVE) {
        s.seasons[idx] = gamma * (y[t] - level) + (1 - gamma) * season;
      } else if (seasonal == Component.MULTIPLICATIVE) {
        s.seasons[idx] = gamma * (y[t] / level) + (1 - gamma) * season;
      }
      s.level = level;
    }
    return new Run(Double.isFinite(total) ? total : Double.POSITIVE_INFINITY, s);
  }

  private State initialState(double[] y) {
    double[] seasons = new double[period];
    double level;
    double slope;
    if (seasonal == Component.NONE) {
      level = y[0];
      slope = trend == Component.MULTIPLICATIVE ? y[1] / y[0] : y[1] - y[0];
      seasons[0] = seasonal == Component.MULTIPLICATIVE ? 1d : 0d;
    } else {
      double first = mean(y, 0, period);
      double second = mean(y, period, 2 * period);
      level = first;
      slope = trend == Component.MULTIPLICATIVE
          ? Math.pow(second / first, 1d / period)
          : (second - first) / period;
      for (int i = 0; i < period; i++) {
        seasons[i] = seasonal == Component.MULTIPLICATIVE ? y[i] / first : y[i] - first;
      }
    }
    if (trend == Component.NONE) {
      slope = 0d;
    }
    return new State(level, slope, seasons);
  }

  private double withTrend(double level, double slope, int steps) {
    switch (trend) {
      case ADDITIVE:
        return level + steps * slope;
      case MULTIPLICATIVE:
        return level * Math.pow(slope, steps);
      default:
        return level;
    }
  }

  private double withSeason(double value, double season) {
    switch (seasonal) {
      case ADDITIVE:
        return value + season;
      case MULTIPLICATIVE:
        return value * season;
      default:
        return value;
    }
  }

  private static double mean(double[] y, int from, int to) {
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += y[i];
    }
    return sum / (to - from);
  }

  @Override
  public ForecastOutput forecast(int periods, double confidenceInterval) {
    requireFit();
    double[] point = new double[periods];
    int n = observed.length;
    for (int h = 1; h <= periods; h++) {
      double season = state.seasons[(n + h - 1) % period];
      point[h - 1] = withSeason(withTrend(state.level, state.slope, h), season);
    }
    return ResidualBands.around(point, ResidualBands.residualSigma(observed, fitted));
  }

  @Override
  public double[] fittedValues() {
    requireFit();
    return fitted.clone();
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("trend", trend.code());
    info.put("seasonal", seasonal.code());
    info.put("seasonal_periods", seasonal == Component.NONE ? null : period);
    if (smoothing != null) {
      info.put("smoothing_level", smoothing[0]);
      info.put("smoothing_trend", trend != Component.NONE ? smoothing[1] : null);
      info.put("smoothing_seasonal",
          seasonal != Component.NONE ? smoothing[smoothing.length - 1] : null);
      int n = observed.length;
      int k = smoothing.length + 1 + (trend != Component.NONE ? 1 : 0)
          + (seasonal != Component.NONE ? period : 0);
      info.put("sse", sse);
      info.put("aic", n * Math.log(Math.max(sse, Double.MIN_VALUE) / n) + 2 * k);
      info.put("interval", ResidualBands.DESCRIPTION);
    }
    return info;
  }

  private void requireFit() {
    if (state == null) {
      throw new ModelStateException("Model must be fitted before use");
    }
  }

  private static final class State {
    private double level;
    private double slope;
    private final double[] seasons;

    private State(double level, double slope, double[] seasons) {
      this.level = level;
      this.slope = slope;
      this.seasons = seasons;
    }
  }

  private record Run(double sse, State state) {}
}
