package com.ospicorp.tsforecast.analysis.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.SampleSeries;
import com.ospicorp.tsforecast.analysis.model.ParameterSuggestions;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterAdvisorTest {

  @Test
  void trendingSeasonalSeriesGetsSeasonalSuggestions() {
    ParameterSuggestions suggestions = ParameterAdvisor.suggest(SampleSeries.seasonal(72));

    assertTrue(suggestions.hasTrend());
    assertEquals(Boolean.TRUE, suggestions.hasSeasonality());
    Integer period = suggestions.seasonalPeriod();
    assertNotNull(period);
    assertNotNull(suggestions.sarima());
    assertEquals(List.of(1, 1, 1, period), suggestions.sarima().seasonalOrder());
    assertEquals("additive", suggestions.holtWinters().trend());
    assertEquals("additive", suggestions.holtWinters().seasonal());
    assertEquals(period.intValue(), suggestions.holtWinters().seasonalPeriods());
    assertEquals(3, suggestions.arima().order().size());
  }

  @Test
  void shortSeriesSkipsSeasonalSearch() {
    double[] flat = new double[16];
    for (int i = 0; i < flat.length; i++) {
      flat[i] = i % 2 == 0 ? 1 : 2;
    }
    ParameterSuggestions suggestions = ParameterAdvisor.suggest(flat);

    assertFalse(suggestions.hasTrend());
    assertNull(suggestions.seasonalPeriod());
    assertNull(suggestions.hasSeasonality());
    assertNull(suggestions.sarima());
    assertEquals("none", suggestions.holtWinters().trend());
    assertEquals("none", suggestions.holtWinters().seasonal());
    assertEquals(12, suggestions.holtWinters().seasonalPeriods());
  }

  @Test
  void trendCompareHeadAndTailMeans() {
    double[] ramp = new double[30];
    for (int i = 0; i < ramp.length; i++) {
      ramp[i] = i;
    }
    assertTrue(ParameterAdvisor.hasTrend(ramp));
  }
}
