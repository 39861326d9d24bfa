package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutlierReport(
    String method,
    @JsonProperty("outlier_indices") List<Integer> outlierIndices,
    @JsonProperty("outlier_values") List<Double> outlierValues,
    @JsonProperty("lower_bound") Double lowerBound,
    @JsonProperty("upper_bound") Double upperBound,
    Double threshold,
    @JsonProperty("outlier_count") int outlierCount
) {}
