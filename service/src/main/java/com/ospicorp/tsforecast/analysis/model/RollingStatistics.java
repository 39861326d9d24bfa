package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Rolling values are {@code null} where the window is not yet full. */
public record RollingStatistics(
    List<Double> original,
    @JsonProperty("rolling_mean") List<Double> rollingMean,
    @JsonProperty("rolling_std") List<Double> rollingStd,
    List<Object> dates,
    int window
) {}
