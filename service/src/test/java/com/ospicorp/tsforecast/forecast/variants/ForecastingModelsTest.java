package com.ospicorp.tsforecast.forecast.variants;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.SampleSeries;
import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ForecastingModelsTest {

  private static final TimeSeries SERIES = TimeSeries.of(SampleSeries.seasonal(72));

  @Test
  void arimaForecastsWithOrderedBounds() {
    ForecastingModel model = new ArimaModel(params(Map.of("order", List.of(1, 1, 1))));
    model.fit(SERIES);
    ForecastOutput output = model.forecast(12, 0.95);

    assertShape(output, 12);
    assertEquals(72, model.fittedValues().length);
    assertTrue(Double.isNaN(model.fittedValues()[0]));
    Map<String, Object> info = model.modelInfo();
    assertEquals(List.of(1, 1, 1), info.get("order"));
    assertTrue(info.containsKey("aic"));
    assertTrue(info.containsKey("params"));
  }

  @Test
  void arimaBandsWidenWithHorizon() {
    ForecastingModel model = new ArimaModel(params(Map.of("order", List.of(1, 1, 0))));
    model.fit(SERIES);
    ForecastOutput output = model.forecast(10, 0.95);
    double first = output.upperBound()[0] - output.lowerBound()[0];
    double last = output.upperBound()[9] - output.lowerBound()[9];
    assertTrue(last > first);
  }

  @Test
  void seasonalArimaReportsSeasonalOrder() {
    ForecastingModel model = new SeasonalArimaModel(params(Map.of(
        "order", List.of(1, 0, 0), "seasonal_order", List.of(1, 1, 0, 12))));
    model.fit(SERIES);

    assertShape(model.forecast(6, 0.9), 6);
    assertEquals(List.of(1, 1, 0, 12), model.modelInfo().get("seasonal_order"));
  }

  @Test
  void seasonalArimaRejectsDegeneratePeriod() {
    assertThrows(InvalidParameterException.class, () -> new SeasonalArimaModel(params(Map.of(
        "seasonal_order", List.of(1, 0, 0, 1)))));
  }

  @Test
  void arimaNeedsEnoughObservations() {
    ForecastingModel model = new ArimaModel(params(Map.of("order", List.of(3, 1, 3))));
    assertThrows(FittingException.class, () -> model.fit(TimeSeries.of(1, 2, 3, 4, 5, 6)));
  }

  @Test
  void holtWintersTracksSeasonalPattern() {
    ForecastingModel model = new HoltWintersModel(params(Map.of(
        "trend", "additive", "seasonal", "additive", "seasonal_periods", 12)));
    model.fit(SERIES);
    ForecastOutput output = model.forecast(12, 0.95);

    assertShape(output, 12);
    double[] fitted = model.fittedValues();
    assertEquals(72, fitted.length);
    assertTrue(Double.isFinite(fitted[0]));
    // sine peaks at step 3 of each cycle, troughs at step 9
    assertTrue(output.forecast()[3] > output.forecast()[9]);
    assertEquals("additive", model.modelInfo().get("seasonal"));
  }

  @Test
  void holtWintersMultiplicativeNeedsPositiveData() {
    ForecastingModel model = new HoltWintersModel(params(Map.of(
        "trend", "additive", "seasonal", "multiplicative", "seasonal_periods", 4)));
    double[] values = SampleSeries.seasonal(24);
    values[5] = -1;
    assertThrows(FittingException.class, () -> model.fit(TimeSeries.of(values)));
  }

  @Test
  void holtWintersNeedsTwoSeasons() {
    ForecastingModel model = new HoltWintersModel(params(Map.of("seasonal_periods", 12)));
    assertThrows(FittingException.class, () -> model.fit(TimeSeries.of(SampleSeries.seasonal(20))));
  }

  @Test
  void holtWintersRejectsUnknownComponent() {
    assertThrows(InvalidParameterException.class,
        () -> new HoltWintersModel(params(Map.of("trend", "damped"))));
  }

  @Test
  void movingAverageIsFlatWithWarmUp() {
    ForecastingModel model = new MovingAverageModel(params(Map.of("window", 3)));
    model.fit(TimeSeries.of(1, 2, 3, 4, 5, 6));
    double[] fitted = model.fittedValues();

    assertTrue(Double.isNaN(fitted[0]));
    assertTrue(Double.isNaN(fitted[1]));
    assertEquals(2d, fitted[2], 1e-12);
    assertEquals(5d, fitted[5], 1e-12);

    ForecastOutput output = model.forecast(3, 0.95);
    assertArrayEquals(new double[] {5, 5, 5}, output.forecast(), 1e-12);
    assertEquals(5 + 1.96, output.upperBound()[0], 1e-9);
  }

  @Test
  void movingAverageOnConstantDataHasZeroWidthBand() {
    ForecastingModel model = new MovingAverageModel(params(Map.of("window", 4)));
    model.fit(TimeSeries.of(7, 7, 7, 7, 7, 7, 7, 7, 7, 7));
    ForecastOutput output = model.forecast(4, 0.95);
    assertArrayEquals(output.forecast(), output.lowerBound(), 0d);
    assertArrayEquals(output.forecast(), output.upperBound(), 0d);
  }

  @Test
  void movingAverageWindowLongerThanSeriesUsesAllObservations() {
    ForecastingModel model = new MovingAverageModel(params(Map.of("window", 20)));
    model.fit(TimeSeries.of(1, 2, 3));

    for (double value : model.fittedValues()) {
      assertTrue(Double.isNaN(value));
    }
    ForecastOutput output = model.forecast(2, 0.95);
    assertArrayEquals(new double[] {2, 2}, output.forecast(), 1e-12);
    assertEquals(2 + 1.96, output.upperBound()[0], 1e-9);
  }

  @Test
  void movingAverageRejectsEmptyWindow() {
    assertThrows(InvalidParameterException.class,
        () -> new MovingAverageModel(params(Map.of("window", 0))));
  }

  @Test
  void prophetFitsSyntheticCalendar() {
    ForecastingModel model = new ProphetModel(params(Map.of()));
    model.fit(SERIES);
    ForecastOutput output = model.forecast(14, 0.8);

    assertShape(output, 14);
    assertEquals(72, model.fittedValues().length);
    Map<String, Object> info = model.modelInfo();
    assertEquals(Boolean.TRUE, info.get("synthetic_dates"));
  }

  @Test
  void prophetOnlySupportsAdditiveMode() {
    assertThrows(InvalidParameterException.class, () -> new ProphetModel(params(Map.of(
        "seasonality_mode", "multiplicative"))));
  }

  @Test
  void everyModelRefusesToForecastBeforeFit() {
    List<ForecastingModel> models = List.of(
        new ArimaModel(params(Map.of())),
        new SeasonalArimaModel(params(Map.of())),
        new HoltWintersModel(params(Map.of())),
        new MovingAverageModel(params(Map.of())),
        new ProphetModel(params(Map.of())),
        new LstmModel(params(Map.of())));
    for (ForecastingModel model : models) {
      var ex = assertThrows(ModelStateException.class, () -> model.forecast(5, 0.95),
          model.type().code());
      assertEquals("Model must be fitted before use", ex.getMessage());
      assertThrows(ModelStateException.class, model::fittedValues);
    }
  }

  private static ModelParameters params(Map<String, Object> values) {
    return new ModelParameters(values);
  }

  private static void assertShape(ForecastOutput output, int periods) {
    assertEquals(periods, output.periods());
    for (int i = 0; i < periods; i++) {
      assertTrue(Double.isFinite(output.forecast()[i]), "forecast " + i);
      assertTrue(output.lowerBound()[i] <= output.forecast()[i], "lower " + i);
      assertTrue(output.upperBound()[i] >= output.forecast()[i], "upper " + i);
    }
  }
}
