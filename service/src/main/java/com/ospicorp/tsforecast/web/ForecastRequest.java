package com.ospicorp.tsforecast.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.series.model.DataInput;
import jakarta.validation.constraints.NotNull;

public record ForecastRequest(
    @NotNull DataInput data,
    @NotNull @JsonProperty("model_configuration") ModelConfiguration modelConfiguration
) {}
