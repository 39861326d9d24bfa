package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Non-seasonal ARIMA(p,d,q). Parameter {@code order} defaults to (1,1,1).
 */
public class ArimaModel implements ForecastingModel {
  static final List<Integer> DEFAULT_ORDER = List.of(1, 1, 1);

  protected final List<Integer> order;
  protected ArimaEngine.Fit fit;

  public ArimaModel(ModelParameters parameters) {
    this.order = requireOrder(parameters.intList("order", DEFAULT_ORDER), "order", 3);
  }

  @Override
  public ModelType type() {
    return ModelType.ARIMA;
  }

  @Override
  public void fit(TimeSeries series) {
    ArimaEngine engine = new ArimaEngine(type().code(), order.get(0), order.get(1),
        order.get(2), 0, 0, 0, 1);
    fit = engine.fit(series.values());
  }

  @Override
  public ForecastOutput forecast(int periods, double confidenceInterval) {
    return requireFit().forecast(periods, confidenceInterval);
  }

  @Override
  public double[] fittedValues() {
    return requireFit().fittedValues();
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("order", order);
    if (fit != null) {
      info.put("aic", fit.aic());
      info.put("bic", fit.bic());
      info.put("log_likelihood", fit.logLikelihood());
      info.put("sigma2", fit.sigma2());
      info.put("params", fit.parameters());
      if (fit.intervalSource() != null) {
        info.put("interval", fit.intervalSource());
      }
    }
    return info;
  }

  protected ArimaEngine.Fit requireFit() {
    if (fit == null) {
      throw new ModelStateException("Model must be fitted before use");
    }
    return fit;
  }

  static List<Integer> requireOrder(List<Integer> values, String name, int size) {
    if (values.size() != size) {
      throw new InvalidParameterException(
          "Parameter '" + name + "' must have " + size + " entries", name);
    }
    for (Integer v : values) {
      if (v < 0) {
        throw new InvalidParameterException(
            "Parameter '" + name + "' entries must be non-negative", name);
      }
    }
    return List.copyOf(values);
  }
}
