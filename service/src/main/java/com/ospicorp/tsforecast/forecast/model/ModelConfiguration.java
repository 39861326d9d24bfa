package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record ModelConfiguration(
    @JsonProperty("model_type") String modelType,
    Map<String, Object> parameters,
    @JsonProperty("forecast_periods") Integer forecastPeriods,
    @JsonProperty("confidence_interval") Double confidenceInterval
) {

  public static ModelConfiguration of(String modelType, Map<String, Object> parameters) {
    return new ModelConfiguration(modelType, parameters, null, null);
  }

  public ModelParameters params() {
    return new ModelParameters(parameters);
  }
}
