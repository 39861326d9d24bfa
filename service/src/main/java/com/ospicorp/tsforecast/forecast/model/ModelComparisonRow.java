package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ModelComparisonRow(
    @JsonProperty("model_type") String modelType,
    Double mae,
    Double rmse,
    Double mape
) {}
