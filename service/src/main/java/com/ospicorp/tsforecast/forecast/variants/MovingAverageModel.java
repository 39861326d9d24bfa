package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Flat forecast at the mean of the last {@code window} observations, with
 * {@code mean ± 1.96·std} of that window as the interval.
 */
public class MovingAverageModel implements ForecastingModel {
  private final int window;

  private double[] fitted;
  private double level;
  private double spread;

  public MovingAverageModel(ModelParameters parameters) {
    this.window = parameters.intValue("window", 12);
    if (window < 1) {
      throw new InvalidParameterException("Parameter 'window' must be at least 1", "window");
    }
  }

  @Override
  public ModelType type() {
    return ModelType.MOVING_AVERAGE;
  }

  @Override
  public void fit(TimeSeries series) {
    double[] y = series.values();
    // A window longer than the series never fills: fitted values stay NaN and the
    // forecast falls back to the mean of everything observed.
    DescriptiveStatistics rolling = new DescriptiveStatistics(window);
    double[] out = new double[y.length];
    Arrays.fill(out, Double.NaN);
    for (int i = 0; i < y.length; i++) {
      rolling.addValue(y[i]);
      if (i >= window - 1) {
        out[i] = rolling.getMean();
      }
    }
    fitted = out;
    level = rolling.getMean();
    spread = rolling.getN() > 1 ? rolling.getStandardDeviation() : 0d;
  }

  @Override
  public ForecastOutput forecast(int periods, double confidenceInterval) {
    requireFit();
    double[] point = new double[periods];
    Arrays.fill(point, level);
    return ResidualBands.around(point, spread);
  }

  @Override
  public double[] fittedValues() {
    requireFit();
    return fitted.clone();
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("window", window);
    if (fitted != null) {
      info.put("last_window_mean", level);
      info.put("last_window_std", spread);
      info.put("interval", "mean ± 1.96·std of the last window");
    }
    return info;
  }

  private void requireFit() {
    if (fitted == null) {
      throw new ModelStateException("Model must be fitted before use");
    }
  }
}
