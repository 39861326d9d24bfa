package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.List;
import java.util.Map;

/**
 * ARIMA(p,d,q)(P,D,Q)s. {@code seasonal_order} is (P,D,Q,s) and defaults to (1,1,1,12).
 */
public class SeasonalArimaModel extends ArimaModel {
  static final List<Integer> DEFAULT_SEASONAL_ORDER = List.of(1, 1, 1, 12);

  private final List<Integer> seasonalOrder;

  public SeasonalArimaModel(ModelParameters parameters) {
    super(parameters);
    this.seasonalOrder = requireOrder(
        parameters.intList("seasonal_order", DEFAULT_SEASONAL_ORDER), "seasonal_order", 4);
    boolean seasonalTerms = seasonalOrder.get(0) + seasonalOrder.get(1) + seasonalOrder.get(2) > 0;
    if (seasonalTerms && seasonalOrder.get(3) < 2) {
      throw new InvalidParameterException(
          "Seasonal period must be at least 2 when seasonal terms are present", "seasonal_order");
    }
  }

  @Override
  public ModelType type() {
    return ModelType.SARIMA;
  }

  @Override
  public void fit(TimeSeries series) {
    ArimaEngine engine = new ArimaEngine(type().code(), order.get(0), order.get(1), order.get(2),
        seasonalOrder.get(0), seasonalOrder.get(1), seasonalOrder.get(2),
        Math.max(seasonalOrder.get(3), 1));
    fit = engine.fit(series.values());
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = super.modelInfo();
    info.put("seasonal_order", seasonalOrder);
    return info;
  }
}
