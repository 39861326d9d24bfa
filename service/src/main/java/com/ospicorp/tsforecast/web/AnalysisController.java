package com.ospicorp.tsforecast.web;

import com.ospicorp.tsforecast.analysis.model.AcfPacfResult;
import com.ospicorp.tsforecast.analysis.model.DecompositionResult;
import com.ospicorp.tsforecast.analysis.model.OutlierReport;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions;
import com.ospicorp.tsforecast.analysis.model.RollingStatistics;
import com.ospicorp.tsforecast.analysis.model.SeasonalityResult;
import com.ospicorp.tsforecast.analysis.model.StationarityResult;
import com.ospicorp.tsforecast.analysis.service.StatisticalAnalyzer;
import com.ospicorp.tsforecast.forecast.service.ModelManager;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import com.ospicorp.tsforecast.series.service.TimeSeriesAdapter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/analysis")
@Tag(name = "Analysis")
public class AnalysisController {
  private static final int DEFAULT_LAGS = 40;
  private static final int DEFAULT_WINDOW = 12;

  private final StatisticalAnalyzer analyzer;
  private final ModelManager manager;

  public AnalysisController(StatisticalAnalyzer analyzer, ModelManager manager) {
    this.analyzer = analyzer;
    this.manager = manager;
  }

  @PostMapping("/stationarity")
  @Operation(summary = "ADF and KPSS stationarity tests")
  public StationarityResult stationarity(@RequestBody AnalysisRequest request) {
    return analyzer.stationarity(series(request));
  }

  @PostMapping("/seasonality")
  @Operation(summary = "Seasonal strength for candidate periods 4, 12, 24 and 52")
  public SeasonalityResult seasonality(@RequestBody AnalysisRequest request) {
    return analyzer.seasonality(series(request));
  }

  @PostMapping("/decompose")
  @Operation(summary = "Trend, seasonal and residual decomposition")
  public DecompositionResult decompose(@RequestBody AnalysisRequest request) {
    return analyzer.decompose(series(request), request.method(), request.period());
  }

  @PostMapping("/acf-pacf")
  @Operation(summary = "Autocorrelation and partial autocorrelation")
  public AcfPacfResult acfPacf(@RequestBody AnalysisRequest request) {
    int lags = request.lags() != null ? request.lags() : DEFAULT_LAGS;
    return analyzer.acfPacf(series(request), lags);
  }

  @PostMapping("/rolling-stats")
  @Operation(summary = "Rolling mean and standard deviation")
  public RollingStatistics rollingStats(@RequestBody AnalysisRequest request) {
    int window = request.window() != null ? request.window() : DEFAULT_WINDOW;
    return analyzer.rollingStatistics(series(request), window);
  }

  @PostMapping("/outliers")
  @Operation(summary = "Outlier detection (iqr, z_score or modified_z_score)")
  public OutlierReport outliers(@RequestBody AnalysisRequest request) {
    return analyzer.outliers(series(request), request.method());
  }

  @PostMapping("/model-suggestions")
  @Operation(summary = "Suggested ARIMA, SARIMA and Holt-Winters parameters")
  public ParameterSuggestions modelSuggestions(@RequestBody AnalysisRequest request) {
    return analyzer.suggestParameters(series(request));
  }

  @PostMapping("/comprehensive")
  @Operation(summary = "Statistics, stationarity, outliers, suggestions and decomposition")
  public Map<String, Object> comprehensive(@RequestBody AnalysisRequest request) {
    return manager.analyze(request.toInput());
  }

  @PostMapping("/full")
  @Operation(summary = "Summary, stationarity, seasonality, correlograms and rolling statistics")
  public Map<String, Object> full(@RequestBody AnalysisRequest request) {
    return analyzer.fullAnalysis(series(request));
  }

  private static TimeSeries series(AnalysisRequest request) {
    return TimeSeriesAdapter.toSeries(request.toInput());
  }
}
