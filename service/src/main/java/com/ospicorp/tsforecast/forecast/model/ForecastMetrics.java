package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastMetrics(
    Double mae,
    Double mse,
    Double rmse,
    @JsonInclude(JsonInclude.Include.ALWAYS) Double mape,
    Integer observations,
    String error
) {

  public static ForecastMetrics of(double mae, double mse, double rmse, Double mape,
      int observations) {
    return new ForecastMetrics(mae, mse, rmse, mape, observations, null);
  }

  public static ForecastMetrics error(String message) {
    return new ForecastMetrics(null, null, null, null, null, message);
  }

  @JsonIgnore
  public boolean hasError() {
    return error != null;
  }
}
