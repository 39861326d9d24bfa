package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeasonalityResult(
    @JsonProperty("has_seasonality") boolean hasSeasonality,
    @JsonProperty("seasonal_period") Integer seasonalPeriod,
    @JsonProperty("seasonal_strength") Double seasonalStrength,
    @JsonProperty("all_periods") Map<String, PeriodStrength> allPeriods,
    String reason
) {

  public static SeasonalityResult insufficient(String reason) {
    return new SeasonalityResult(false, null, null, null, reason);
  }

  public record PeriodStrength(
      @JsonProperty("seasonal_strength") double seasonalStrength,
      boolean significant
  ) {}
}
