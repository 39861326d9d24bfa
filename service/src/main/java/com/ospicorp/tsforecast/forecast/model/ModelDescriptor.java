package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ModelDescriptor(
    String name,
    String description,
    List<String> parameters,
    @JsonProperty("suitable_for") String suitableFor
) {}
