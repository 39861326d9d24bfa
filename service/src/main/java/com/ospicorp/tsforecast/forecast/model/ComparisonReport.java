package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Per-configuration results of a comparison run. An entry of {@code results} is either a
 * {@link ForecastResult} or an error fragment for a configuration that failed.
 */
public record ComparisonReport(
    List<Object> results,
    ComparisonResult comparison,
    @JsonProperty("best_model") String bestModel
) {}
