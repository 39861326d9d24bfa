package com.ospicorp.tsforecast.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.tsforecast.series.model.DataInput;
import java.util.List;
import java.util.Map;

/**
 * Data input plus the optional knobs of the individual diagnostics.
 */
public record AnalysisRequest(
    List<Map<String, Object>> records,
    @JsonProperty("value_column") String valueColumn,
    @JsonProperty("time_column") String timeColumn,
    String method,
    Integer window,
    Integer lags,
    Integer period
) {

  public DataInput toInput() {
    return new DataInput(records, valueColumn, timeColumn);
  }
}
