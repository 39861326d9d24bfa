package com.ospicorp.tsforecast.forecast.service;

import static com.ospicorp.tsforecast.analysis.service.StatisticalAnalyzer.section;

import com.ospicorp.tsforecast.analysis.service.StatisticalAnalyzer;
import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.common.InsufficientDataException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.Outcome;
import com.ospicorp.tsforecast.common.TimeSeriesException;
import com.ospicorp.tsforecast.forecast.model.AutoSelection;
import com.ospicorp.tsforecast.forecast.model.ComparisonReport;
import com.ospicorp.tsforecast.forecast.model.ComparisonResult;
import com.ospicorp.tsforecast.forecast.model.ForecastMetrics;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ForecastResult;
import com.ospicorp.tsforecast.forecast.model.ModelComparisonRow;
import com.ospicorp.tsforecast.forecast.model.ModelConfiguration;
import com.ospicorp.tsforecast.forecast.model.ModelDescriptor;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.forecast.model.ValidationResult;
import com.ospicorp.tsforecast.forecast.variants.ForecastingModel;
import com.ospicorp.tsforecast.series.model.DataInput;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import com.ospicorp.tsforecast.series.model.TimeStep;
import com.ospicorp.tsforecast.series.service.TimeSeriesAdapter;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Entry point for fitting, forecasting, comparing and selecting models. Every call builds a fresh
 * model instance; nothing is shared between calls except the immutable registry.
 */
@Service
public class ModelManager {
  private static final Logger log = LoggerFactory.getLogger(ModelManager.class);

  private final ModelRegistry registry;
  private final StatisticalAnalyzer analyzer;
  private final int minObservations;
  private final int defaultPeriods;
  private final int maxPeriods;
  private final double defaultConfidence;

  public ModelManager(ModelRegistry registry, StatisticalAnalyzer analyzer,
      @Value("${forecast.min-observations:10}") int minObservations,
      @Value("${forecast.default-periods:30}") int defaultPeriods,
      @Value("${forecast.max-periods:365}") int maxPeriods,
      @Value("${forecast.default-confidence:0.95}") double defaultConfidence) {
    this.registry = registry;
    this.analyzer = analyzer;
    this.minObservations = minObservations;
    this.defaultPeriods = defaultPeriods;
    this.maxPeriods = maxPeriods;
    this.defaultConfidence = defaultConfidence;
  }

  public ForecastingModel create(String modelType, Map<String, Object> parameters) {
    return registry.create(modelType, new ModelParameters(parameters));
  }

  public ValidationResult validate(ModelConfiguration configuration) {
    return ParameterValidator.validate(configuration);
  }

  public Map<String, ModelDescriptor> availableModels() {
    return registry.available();
  }

  public ForecastResult fitAndForecast(DataInput data, ModelConfiguration configuration) {
    return fitAndForecast(TimeSeriesAdapter.toSeries(data), configuration);
  }

  public ForecastResult fitAndForecast(TimeSeries series, ModelConfiguration configuration) {
    if (series.length() < minObservations) {
      throw new InsufficientDataException("Insufficient data: at least " + minObservations
          + " observations required, got " + series.length());
    }
    int periods = configuration.forecastPeriods() != null
        ? configuration.forecastPeriods() : defaultPeriods;
    double confidence = configuration.confidenceInterval() != null
        ? configuration.confidenceInterval() : defaultConfidence;
    if (periods < 1 || periods > maxPeriods) {
      throw new InvalidParameterException("forecast_periods must be between 1 and " + maxPeriods,
          "forecast_periods");
    }
    if (!(confidence > 0 && confidence < 1)) {
      throw new InvalidParameterException("confidence_interval must be in (0, 1)",
          "confidence_interval");
    }

    ForecastingModel model = create(configuration.modelType(), configuration.parameters());
    ValidationResult validation = validate(configuration);
    if (!validation.valid()) {
      throw new InvalidParameterException(validation.message());
    }
    log.debug("Fitting {} on {} observations, horizon {}", model.type(), series.length(), periods);
    long started = System.nanoTime();
    ForecastOutput output;
    double[] fitted;
    try {
      model.fit(series);
      output = model.forecast(periods, confidence);
      fitted = model.fittedValues();
    } catch (TimeSeriesException ex) {
      log.warn("{} fit failed: {}", model.type(), ex.getMessage());
      throw ex;
    } catch (RuntimeException ex) {
      log.warn("{} fit failed with {}", model.type(), ex.toString());
      throw new FittingException(model.type().code() + " fitting failed: " + ex.getMessage(), ex);
    }
    ForecastMetrics metrics = MetricsCalculator.calculate(series.values(), fitted);
    log.info("Fitted {} on {} observations in {} ms", model.type(), series.length(),
        (System.nanoTime() - started) / 1_000_000);
    return new ForecastResult(model.type().code(), toList(fitted), toList(output.forecast()),
        toList(output.lowerBound()), toList(output.upperBound()),
        forecastDates(series, periods), metrics, model.modelInfo());
  }

  /**
   * Fits every configuration on the same data. A failing configuration is reported in place and
   * left out of the ranking.
   */
  public ComparisonReport compareConfigurations(DataInput data,
      List<ModelConfiguration> configurations) {
    TimeSeries series = TimeSeriesAdapter.toSeries(data);
    List<Object> results = new ArrayList<>(configurations.size());
    List<ForecastResult> fitted = new ArrayList<>(configurations.size());
    for (ModelConfiguration configuration : configurations) {
      Outcome<ForecastResult> outcome = Outcome.of(() -> fitAndForecast(series, configuration));
      if (outcome instanceof Outcome.Success<ForecastResult> success) {
        results.add(success.value());
        fitted.add(success.value());
      } else if (outcome instanceof Outcome.Failure<ForecastResult> failure) {
        Map<String, Object> fragment = new LinkedHashMap<>();
        fragment.put("model_type", configuration.modelType());
        fragment.put("error", failure.error().getMessage());
        results.add(fragment);
      }
    }
    ComparisonResult comparison = compare(fitted);
    return new ComparisonReport(results, comparison, comparison.bestModel());
  }

  /** Ranks by ascending RMSE; results without a usable RMSE keep their row but are not ranked. */
  public ComparisonResult compare(List<ForecastResult> results) {
    List<ModelComparisonRow> rows = new ArrayList<>(results.size());
    for (ForecastResult result : results) {
      ForecastMetrics metrics = result.metrics();
      if (metrics == null) {
        rows.add(new ModelComparisonRow(result.modelType(), null, null, null));
      } else {
        rows.add(new ModelComparisonRow(result.modelType(), metrics.mae(), metrics.rmse(),
            metrics.mape()));
      }
    }
    List<ModelComparisonRow> ranked = rows.stream()
        .filter(row -> row.rmse() != null && !row.rmse().isNaN())
        .sorted(Comparator.comparingDouble(ModelComparisonRow::rmse))
        .toList();
    List<String> ranking = ranked.stream().map(ModelComparisonRow::modelType).toList();
    return new ComparisonResult(rows, ranking, ranking.isEmpty() ? null : ranking.get(0));
  }

  public AutoSelection autoSelect(DataInput data) {
    return autoSelect(TimeSeriesAdapter.toSeries(data).length());
  }

  public AutoSelection autoSelect(int length) {
    if (length < 24) {
      return new AutoSelection(ModelType.ARIMA, Map.of("order", List.of(1, 1, 1)),
          "Insufficient data for seasonal models");
    }
    if (length < 50) {
      Map<String, Object> parameters = new LinkedHashMap<>();
      parameters.put("trend", "additive");
      parameters.put("seasonal", "additive");
      parameters.put("seasonal_periods", 12);
      return new AutoSelection(ModelType.HOLT_WINTERS, parameters,
          "Medium-sized dataset suitable for Holt-Winters");
    }
    Map<String, Object> parameters = new LinkedHashMap<>();
    parameters.put("order", List.of(1, 1, 1));
    parameters.put("seasonal_order", List.of(1, 1, 1, 12));
    return new AutoSelection(ModelType.SARIMA, parameters, "Large dataset suitable for SARIMA");
  }

  /**
   * Basic statistics, stationarity, IQR outliers, parameter suggestions and (from 24 points) a
   * decomposition. Each section fails independently.
   */
  public Map<String, Object> analyze(DataInput data) {
    TimeSeries series = TimeSeriesAdapter.toSeries(data);
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("basic_stats", analyzer.summary(series, false));
    out.put("stationarity", section("stationarity", () -> analyzer.stationarity(series)));
    out.put("outliers", section("outliers", () -> analyzer.outliers(series, "iqr")));
    out.put("parameter_suggestions",
        section("parameter_suggestions", () -> analyzer.suggestParameters(series)));
    if (series.length() >= 24) {
      out.put("decomposition",
          section("decomposition", () -> analyzer.decompose(series, "additive", 12)));
    }
    return out;
  }

  static List<String> forecastDates(TimeSeries series, int periods) {
    List<String> dates = new ArrayList<>(periods);
    TimeStep step = series.step();
    if (series.hasTimeAxis() && step != null) {
      LocalDateTime current = series.lastTimestamp();
      for (int i = 0; i < periods; i++) {
        current = step.next(current);
        dates.add(step.format(current));
      }
    } else {
      int last = series.length();
      for (int i = 0; i < periods; i++) {
        dates.add("Period " + (last + i + 1));
      }
    }
    return dates;
  }

  private static List<Double> toList(double[] values) {
    List<Double> out = new ArrayList<>(values.length);
    for (double v : values) {
      out.add(Double.isFinite(v) ? v : null);
    }
    return out;
  }
}
