package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.tsforecast.common.UnknownModelException;
import java.util.Locale;

public enum ModelType {
  ARIMA("arima"),
  SARIMA("sarima"),
  HOLT_WINTERS("holt-winters"),
  PROPHET("prophet"),
  MOVING_AVERAGE("moving_average"),
  LSTM("lstm");

  private final String code;

  ModelType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public static ModelType fromCode(String code) {
    if (code != null) {
      String normalized = code.trim().toLowerCase(Locale.ROOT);
      for (ModelType type : values()) {
        if (type.code.equals(normalized)) {
          return type;
        }
      }
    }
    throw new UnknownModelException("Unknown model type: " + code);
  }

  @Override
  public String toString() {
    return code;
  }
}
