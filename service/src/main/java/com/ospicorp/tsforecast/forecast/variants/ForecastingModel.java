package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.Map;

/**
 * Contract shared by every forecasting variant. Instances are single-use: created per request,
 * fitted once, then queried.
 */
public interface ForecastingModel {

  ModelType type();

  /**
   * Estimates the model parameters.
   *
   * @throws com.ospicorp.tsforecast.common.FittingException when the input is structurally
   *     unsuitable or the numeric procedure fails
   */
  void fit(TimeSeries series);

  /**
   * Forecasts {@code periods} steps past the end of the fitted series.
   *
   * @throws com.ospicorp.tsforecast.common.ModelStateException when called before {@link #fit}
   */
  ForecastOutput forecast(int periods, double confidenceInterval);

  /**
   * In-sample one-step predictions aligned with the input; {@code NaN} marks warm-up positions.
   *
   * @throws com.ospicorp.tsforecast.common.ModelStateException when called before {@link #fit}
   */
  double[] fittedValues();

  Map<String, Object> modelInfo();
}
