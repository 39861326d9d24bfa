package com.ospicorp.tsforecast.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.tsforecast.forecast.model.ForecastResult;
import java.util.ArrayList;
import java.util.List;

/** One forecast step in the CSV rendering of a fit. */
@JsonPropertyOrder({"date", "forecast", "lower_bound", "upper_bound"})
public record ForecastRow(
    String date,
    Double forecast,
    @JsonProperty("lower_bound") Double lowerBound,
    @JsonProperty("upper_bound") Double upperBound
) {

  static List<ForecastRow> of(ForecastResult result) {
    List<ForecastRow> rows = new ArrayList<>(result.forecast().size());
    for (int i = 0; i < result.forecast().size(); i++) {
      rows.add(new ForecastRow(result.forecastDates().get(i), result.forecast().get(i),
          result.lowerBound().get(i), result.upperBound().get(i)));
    }
    return rows;
  }
}
