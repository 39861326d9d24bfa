package com.ospicorp.tsforecast.series.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record DataInput(
    List<Map<String, Object>> records,
    @JsonProperty("value_column") String valueColumn,
    @JsonProperty("time_column") String timeColumn
) {}
