package com.ospicorp.tsforecast.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.tsforecast.SampleSeries;
import com.ospicorp.tsforecast.series.model.DataInput;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AnalysisControllerTest {

  @Autowired
  private TestRestTemplate rest;

  private static AnalysisRequest request(double[] values, String method, Integer window,
      Integer lags, Integer period) {
    DataInput data = SampleSeries.monthly(values);
    return new AnalysisRequest(data.records(), data.valueColumn(), data.timeColumn(), method,
        window, lags, period);
  }

  private static AnalysisRequest request(double[] values) {
    return request(values, null, null, null, null);
  }

  @Test
  void stationarityReportsBothTests() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/stationarity",
        request(SampleSeries.seasonal(60)), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsKeys("adf_test", "kpss_test", "conclusion");
    Map<String, Object> adf = (Map<String, Object>) response.getBody().get("adf_test");
    assertThat(adf).containsKeys("statistic", "pvalue", "critical_values", "is_stationary");
  }

  @Test
  void stationarityOnShortSeriesIsClientError() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/stationarity",
        request(new double[] {1, 2, 3}), Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("error", "Insufficient data points for stationarity testing");
  }

  @Test
  void decomposeUsesRequestedPeriod() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/decompose",
        request(SampleSeries.seasonal(36), "additive", null, null, 6), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("period", 6).containsEntry("method", "additive");
    assertThat((List<?>) response.getBody().get("trend")).hasSize(36);
    assertThat((List<?>) response.getBody().get("dates")).first().isEqualTo("2018-01-01");
  }

  @Test
  void outliersDefaultToInterquartile() {
    double[] values = SampleSeries.noise(40, 4);
    values[10] = 25;
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/outliers",
        request(values), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("method", "IQR");
    assertThat((List<Object>) response.getBody().get("outlier_indices")).contains(10);
  }

  @Test
  void unknownOutlierMethodIsRejected() {
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/outliers",
        request(SampleSeries.seasonal(20), "lof", null, null, null), Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2004);
  }

  @Test
  void acfPacfAndRollingHonourKnobs() {
    ResponseEntity<Map> correlations = rest.postForEntity("/v1/analysis/acf-pacf",
        request(SampleSeries.seasonal(48), null, null, 10, null), Map.class);
    Map<?, ?> acf = (Map<?, ?>) correlations.getBody().get("acf");
    assertThat((List<?>) acf.get("values")).hasSize(11);

    ResponseEntity<Map> rolling = rest.postForEntity("/v1/analysis/rolling-stats",
        request(SampleSeries.seasonal(48), null, 6, null, null), Map.class);
    assertThat(rolling.getBody()).containsEntry("window", 6);
    assertThat((List<?>) rolling.getBody().get("rolling_mean")).hasSize(48);
  }

  @Test
  void seasonalityAndSuggestionsDescribeSeries() {
    ResponseEntity<Map> seasonality = rest.postForEntity("/v1/analysis/seasonality",
        request(SampleSeries.seasonal(72)), Map.class);
    assertThat(seasonality.getBody()).containsEntry("has_seasonality", true);

    ResponseEntity<Map> suggestions = rest.postForEntity("/v1/analysis/model-suggestions",
        request(SampleSeries.seasonal(72)), Map.class);
    assertThat(suggestions.getBody()).containsKeys("has_trend", "arima", "holt_winters");
  }

  @Test
  void compositeReportsContainEverySection() {
    ResponseEntity<Map> comprehensive = rest.postForEntity("/v1/analysis/comprehensive",
        request(SampleSeries.seasonal(36)), Map.class);
    assertThat(comprehensive.getBody()).containsKeys("basic_stats", "stationarity", "outliers",
        "parameter_suggestions", "decomposition");

    ResponseEntity<Map> full = rest.postForEntity("/v1/analysis/full",
        request(SampleSeries.seasonal(36)), Map.class);
    assertThat(full.getBody()).containsKeys("data_summary", "stationarity", "seasonality",
        "acf_pacf", "rolling_stats");
  }

  @Test
  void malformedBodyIsProblemDetail() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    ResponseEntity<Map> response = rest.postForEntity("/v1/analysis/outliers",
        new HttpEntity<>("{\"records\": [", headers), Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
  }
}
