package com.ospicorp.tsforecast.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.forecast.model.ForecastMetrics;
import org.junit.jupiter.api.Test;

class MetricsCalculatorTest {

  @Test
  void computesErrorsOverValidPairs() {
    ForecastMetrics metrics = MetricsCalculator.calculate(
        new double[] {1, 2, 3, 4}, new double[] {Double.NaN, 2, 4, 4});

    assertFalse(metrics.hasError());
    assertEquals(3, metrics.observations());
    assertEquals(1d / 3, metrics.mae(), 1e-12);
    assertEquals(1d / 3, metrics.mse(), 1e-12);
    assertEquals(Math.sqrt(1d / 3), metrics.rmse(), 1e-12);
    assertEquals(100d * (1d / 3) / 3, metrics.mape(), 1e-9);
  }

  @Test
  void mapeIsAbsentWhenEveryActualIsZero() {
    ForecastMetrics metrics = MetricsCalculator.calculate(new double[] {0, 0}, new double[] {1, -1});
    assertNull(metrics.mape());
    assertEquals(1d, metrics.rmse(), 1e-12);
  }

  @Test
  void zeroActualsAreSkippedForMapeOnly() {
    ForecastMetrics metrics = MetricsCalculator.calculate(new double[] {0, 10}, new double[] {1, 9});
    assertEquals(10d, metrics.mape(), 1e-9);
    assertEquals(2, metrics.observations());
  }

  @Test
  void reportsErrorWhenNothingAligns() {
    ForecastMetrics metrics = MetricsCalculator.calculate(
        new double[] {1, 2}, new double[] {Double.NaN, Double.NaN});
    assertTrue(metrics.hasError());
    assertEquals("No valid data points for metric calculation", metrics.error());
    assertNull(metrics.rmse());
  }

  @Test
  void usesCommonPrefixWhenLengthsDiffer() {
    ForecastMetrics metrics = MetricsCalculator.calculate(new double[] {1, 2, 3}, new double[] {1});
    assertEquals(1, metrics.observations());
    assertEquals(0d, metrics.rmse());
  }
}
