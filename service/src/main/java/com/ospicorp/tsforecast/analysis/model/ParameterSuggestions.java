package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSuggestions(
    @JsonProperty("has_trend") boolean hasTrend,
    @JsonProperty("seasonal_period") Integer seasonalPeriod,
    @JsonProperty("has_seasonality") Boolean hasSeasonality,
    ArimaSuggestion arima,
    SarimaSuggestion sarima,
    @JsonProperty("holt_winters") HoltWintersSuggestion holtWinters
) {

  public record ArimaSuggestion(List<Integer> order, String reasoning) {}

  public record SarimaSuggestion(
      List<Integer> order,
      @JsonProperty("seasonal_order") List<Integer> seasonalOrder,
      String reasoning
  ) {}

  public record HoltWintersSuggestion(
      String trend,
      String seasonal,
      @JsonProperty("seasonal_periods") int seasonalPeriods,
      String reasoning
  ) {}
}
