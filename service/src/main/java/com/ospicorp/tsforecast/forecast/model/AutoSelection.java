package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record AutoSelection(
    @JsonProperty("recommended_model") ModelType recommendedModel,
    Map<String, Object> parameters,
    String reason
) {}
