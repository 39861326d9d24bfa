package com.ospicorp.tsforecast.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.SampleSeries;
import com.ospicorp.tsforecast.analysis.service.StatisticalAnalyzer;
import com.ospicorp.tsforecast.common.InsufficientDataException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.UnknownModelException;
import com.ospicorp.tsforecast.forecast.model.AutoSelection;
import com.ospicorp.tsforecast.forecast.model.ComparisonReport;
import com.ospicorp.tsforecast.forecast.model.ComparisonResult;
import com.ospicorp.tsforecast.forecast.model.ForecastMetrics;
import com.ospicorp.tsforecast.forecast.model.ForecastResult;
import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.DataInput;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelManagerTest {

  private final ModelManager manager = new ModelManager(new ModelRegistry(false),
      new StatisticalAnalyzer(), 10, 30, 365, 0.95);

  @Test
  void fitAndForecastReturnsAlignedArrays() {
    double[] values = SampleSeries.seasonal(48);
    ForecastResult result = manager.fitAndForecast(SampleSeries.monthly(values),
        new ModelConfiguration("moving_average", Map.of("window", 6), 5, 0.95));

    assertEquals("moving_average", result.modelType());
    assertEquals(48, result.fittedValues().size());
    assertNull(result.fittedValues().get(0));
    assertEquals(5, result.forecast().size());
    assertEquals(5, result.lowerBound().size());
    assertEquals(5, result.upperBound().size());
    assertEquals(List.of("2022-01-01", "2022-02-01", "2022-03-01", "2022-04-01", "2022-05-01"),
        result.forecastDates());
    assertFalse(result.metrics().hasError());
    assertEquals(43, result.metrics().observations());
  }

  @Test
  void untimedSeriesGetsPeriodLabels() {
    ForecastResult result = manager.fitAndForecast(SampleSeries.untimed(SampleSeries.seasonal(20)),
        new ModelConfiguration("moving_average", Map.of("window", 3), 2, null));
    assertEquals(List.of("Period 21", "Period 22"), result.forecastDates());
  }

  @Test
  void defaultHorizonIsThirtySteps() {
    ForecastResult result = manager.fitAndForecast(SampleSeries.untimed(SampleSeries.seasonal(30)),
        ModelConfiguration.of("arima", Map.of("order", List.of(1, 1, 0))));
    assertEquals(30, result.forecast().size());
  }

  @Test
  void defaultMovingAverageWindowLongerThanSeriesStillForecasts() {
    double[] values = SampleSeries.seasonal(10);
    ForecastResult result = manager.fitAndForecast(SampleSeries.untimed(values),
        new ModelConfiguration("moving_average", Map.of(), 3, null));

    double mean = Arrays.stream(values).average().orElseThrow();
    assertEquals(3, result.forecast().size());
    for (Double point : result.forecast()) {
      assertEquals(mean, point, 1e-9);
    }
    assertTrue(result.fittedValues().stream().allMatch(v -> v == null));
    assertTrue(result.metrics().hasError());
    assertEquals(ForecastMetrics.error(MetricsCalculator.NO_VALID_POINTS), result.metrics());
  }

  @Test
  void shortSeriesIsRejected() {
    DataInput input = SampleSeries.untimed(new double[] {1, 2, 3, 4, 5});
    assertThrows(InsufficientDataException.class,
        () -> manager.fitAndForecast(input, ModelConfiguration.of("arima", Map.of())));
  }

  @Test
  void horizonAndConfidenceAreBounded() {
    DataInput input = SampleSeries.untimed(SampleSeries.seasonal(30));
    assertThrows(InvalidParameterException.class, () -> manager.fitAndForecast(input,
        new ModelConfiguration("moving_average", Map.of(), 0, null)));
    assertThrows(InvalidParameterException.class, () -> manager.fitAndForecast(input,
        new ModelConfiguration("moving_average", Map.of(), 400, null)));
    assertThrows(InvalidParameterException.class, () -> manager.fitAndForecast(input,
        new ModelConfiguration("moving_average", Map.of(), 5, 1.0)));
  }

  @Test
  void unknownAndDisabledModelsAreRejected() {
    DataInput input = SampleSeries.untimed(SampleSeries.seasonal(30));
    assertThrows(UnknownModelException.class,
        () -> manager.fitAndForecast(input, ModelConfiguration.of("tbats", Map.of())));
    var ex = assertThrows(UnknownModelException.class,
        () -> manager.fitAndForecast(input, ModelConfiguration.of("lstm", Map.of())));
    assertEquals("Model type not available: lstm", ex.getMessage());
  }

  @Test
  void invalidParametersFailBeforeFitting() {
    DataInput input = SampleSeries.untimed(SampleSeries.seasonal(30));
    assertThrows(InvalidParameterException.class, () -> manager.fitAndForecast(input,
        ModelConfiguration.of("holt-winters", Map.of("seasonal", "none"))));
  }

  @Test
  void compareRanksByRmseAndKeepsFailures() {
    DataInput input = SampleSeries.monthly(SampleSeries.seasonal(48));
    ComparisonReport report = manager.compareConfigurations(input, List.of(
        new ModelConfiguration("moving_average", Map.of("window", 12), 6, null),
        new ModelConfiguration("holt-winters", Map.of("trend", "additive",
            "seasonal", "additive", "seasonal_periods", 12), 6, null),
        new ModelConfiguration("moving_average", Map.of("window", 100), 6, null)));

    assertEquals(3, report.results().size());
    assertTrue(report.results().get(2) instanceof Map<?, ?>);
    Map<?, ?> failure = (Map<?, ?>) report.results().get(2);
    assertEquals("moving_average", failure.get("model_type"));
    assertNotNull(failure.get("error"));

    ComparisonResult comparison = report.comparison();
    assertEquals(2, comparison.ranking().size());
    assertEquals("holt-winters", comparison.bestModel());
    assertEquals(comparison.bestModel(), report.bestModel());
  }

  @Test
  void compareKeepsInputOrderForTiesAndSkipsMissingRmse() {
    ComparisonResult comparison = manager.compare(List.of(
        result("b", 2.0), result("a", 1.0), result("c", 1.0), result("d", null)));
    assertEquals(List.of("a", "c", "b"), comparison.ranking());
    assertEquals("a", comparison.bestModel());
    assertEquals(4, comparison.models().size());
  }

  @Test
  void compareOfNothingHasNoBestModel() {
    assertNull(manager.compare(List.of()).bestModel());
  }

  @Test
  void autoSelectFollowsLengthThresholds() {
    assertEquals(ModelType.ARIMA, manager.autoSelect(10).recommendedModel());
    assertEquals(ModelType.ARIMA, manager.autoSelect(23).recommendedModel());
    AutoSelection medium = manager.autoSelect(24);
    assertEquals(ModelType.HOLT_WINTERS, medium.recommendedModel());
    assertEquals("Medium-sized dataset suitable for Holt-Winters", medium.reason());
    assertEquals(ModelType.HOLT_WINTERS, manager.autoSelect(49).recommendedModel());
    AutoSelection large = manager.autoSelect(50);
    assertEquals(ModelType.SARIMA, large.recommendedModel());
    assertEquals(List.of(1, 1, 1, 12), large.parameters().get("seasonal_order"));
  }

  @Test
  void analyzeSkipsDecompositionForShortSeries() {
    Map<String, Object> shortReport = manager.analyze(SampleSeries.untimed(SampleSeries.seasonal(12)));
    assertFalse(shortReport.containsKey("decomposition"));
    assertTrue(shortReport.containsKey("basic_stats"));

    Map<String, Object> longReport = manager.analyze(SampleSeries.monthly(SampleSeries.seasonal(36)));
    assertTrue(longReport.containsKey("decomposition"));
    assertTrue(longReport.containsKey("parameter_suggestions"));
  }

  @Test
  void analyzeReportsFailingSectionInPlace() {
    Map<String, Object> report = manager.analyze(SampleSeries.untimed(new double[] {1, 2, 3, 4}));
    assertEquals(Map.of("error", "Insufficient data points for stationarity testing"),
        report.get("stationarity"));
  }

  private static ForecastResult result(String type, Double rmse) {
    ForecastMetrics metrics = rmse == null ? ForecastMetrics.error("none")
        : ForecastMetrics.of(rmse, rmse * rmse, rmse, null, 10);
    return new ForecastResult(type, List.of(), List.of(), List.of(), List.of(), List.of(), metrics,
        Map.of());
  }
}
