package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Correlation per lag with its 95% band, {@code [lower, upper]} per lag. */
public record Correlogram(
    List<Double> values,
    @JsonProperty("confidence_intervals") List<List<Double>> confidenceIntervals,
    List<Integer> lags
) {}
