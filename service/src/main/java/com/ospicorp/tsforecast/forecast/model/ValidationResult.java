package com.ospicorp.tsforecast.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidationResult(@JsonProperty("is_valid") boolean valid, String message) {

  public static ValidationResult ok() {
    return new ValidationResult(true, "Parameters are valid");
  }

  public static ValidationResult invalid(String message) {
    return new ValidationResult(false, message);
  }
}
