package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive statistics of a series; {@code std} is the sample standard deviation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryStatistics(
    int count,
    double mean,
    double std,
    double min,
    double max,
    Double median,
    @JsonProperty("missing_values") Integer missingValues
) {}
