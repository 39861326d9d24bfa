package com.ospicorp.tsforecast.forecast.service;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ValidationResult;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-model rule table applied to a configuration before any fitting happens.
 */
public final class ParameterValidator {
  private static final Set<String> TRENDS = Set.of("additive", "multiplicative", "none");
  private static final Set<String> SEASONALS = Set.of("additive", "multiplicative");

  private ParameterValidator() {
  }

  public static ValidationResult validate(ModelConfiguration configuration) {
    String type = configuration.modelType() == null ? ""
        : configuration.modelType().trim().toLowerCase(Locale.ROOT);
    ModelParameters params = configuration.params();
    try {
      switch (type) {
        case "arima":
          return validateArima(params);
        case "sarima":
          return validateSarima(params);
        case "holt-winters":
          return validateHoltWinters(params);
        case "prophet":
        case "moving_average":
        case "lstm":
          return ValidationResult.ok();
        default:
          return ValidationResult.invalid("Unknown model type: " + configuration.modelType());
      }
    } catch (InvalidParameterException ex) {
      return ValidationResult.invalid(ex.getMessage());
    }
  }

  private static ValidationResult validateArima(ModelParameters params) {
    List<Integer> order = params.intList("order", List.of(1, 1, 1));
    if (order.size() != 3 || order.stream().anyMatch(v -> v < 0)) {
      return ValidationResult.invalid("ARIMA order must be three non-negative integers (p, d, q)");
    }
    return ValidationResult.ok();
  }

  private static ValidationResult validateSarima(ModelParameters params) {
    List<Integer> order = params.intList("order", List.of(1, 1, 1));
    List<Integer> seasonalOrder = params.intList("seasonal_order", List.of(1, 1, 1, 12));
    if (order.size() != 3 || seasonalOrder.size() != 4) {
      return ValidationResult.invalid("SARIMA requires valid order and seasonal_order parameters");
    }
    return ValidationResult.ok();
  }

  private static ValidationResult validateHoltWinters(ModelParameters params) {
    String trend = params.string("trend", "additive");
    String seasonal = params.string("seasonal", "additive");
    if (!TRENDS.contains(canonical(trend)) || !SEASONALS.contains(canonical(seasonal))) {
      return ValidationResult.invalid("Holt-Winters trend must be 'additive', 'multiplicative' or "
          + "'none' and seasonal must be 'additive' or 'multiplicative'");
    }
    return ValidationResult.ok();
  }

  private static String canonical(String component) {
    if (component == null) {
      return "none";
    }
    switch (component) {
      case "add":
        return "additive";
      case "mul":
        return "multiplicative";
      default:
        return component;
    }
  }
}
