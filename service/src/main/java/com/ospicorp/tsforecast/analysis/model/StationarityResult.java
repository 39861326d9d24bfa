package com.ospicorp.tsforecast.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StationarityResult(
    @JsonProperty("adf_test") StationarityTest adfTest,
    @JsonProperty("kpss_test") StationarityTest kpssTest,
    Conclusion conclusion
) {

  public record Conclusion(@JsonProperty("is_stationary") boolean stationary,
      String recommendation) {}
}
