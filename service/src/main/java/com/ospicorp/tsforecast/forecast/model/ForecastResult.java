package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record ForecastResult(
    @JsonProperty("model_type") String modelType,
    @JsonProperty("fitted_values") List<Double> fittedValues,
    List<Double> forecast,
    @JsonProperty("lower_bound") List<Double> lowerBound,
    @JsonProperty("upper_bound") List<Double> upperBound,
    @JsonProperty("forecast_dates") List<String> forecastDates,
    ForecastMetrics metrics,
    @JsonProperty("model_info") Map<String, Object> modelInfo
) {}
