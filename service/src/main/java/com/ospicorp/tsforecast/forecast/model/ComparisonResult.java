package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ComparisonResult(
    List<ModelComparisonRow> models,
    List<String> ranking,
    @JsonProperty("best_model") String bestModel
) {}
