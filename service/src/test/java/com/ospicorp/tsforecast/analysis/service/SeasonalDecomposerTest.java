package com.ospicorp.tsforecast.analysis.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.analysis.service.SeasonalDecomposer.Components;
import com.ospicorp.tsforecast.analysis.service.SeasonalDecomposer.Mode;
import com.ospicorp.tsforecast.common.InsufficientDataException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import org.junit.jupiter.api.Test;

class SeasonalDecomposerTest {

  private static double[] repeating(double[] cycle, int cycles, double offset) {
    double[] out = new double[cycle.length * cycles];
    for (int i = 0; i < out.length; i++) {
      out[i] = cycle[i % cycle.length] + offset;
    }
    return out;
  }

  @Test
  void additiveRecoversPatternOfPurelyPeriodicSeries() {
    Components parts = SeasonalDecomposer.decompose(repeating(new double[] {1, 2, 3, 4}, 6, 0), 4,
        Mode.ADDITIVE);

    for (int i = 0; i < 24; i++) {
      assertEquals(2.5, parts.trend()[i], 1e-9, "trend " + i);
      assertEquals((i % 4) - 1.5, parts.seasonal()[i], 1e-9, "seasonal " + i);
      assertEquals(0d, parts.residual()[i], 1e-9, "residual " + i);
    }
  }

  @Test
  void multiplicativeSeasonalFactorsAverageToOne() {
    Components parts = SeasonalDecomposer.decompose(
        repeating(new double[] {8, 10, 12, 10}, 5, 0), 4, Mode.MULTIPLICATIVE);
    double sum = 0d;
    for (int p = 0; p < 4; p++) {
      sum += parts.seasonal()[p];
    }
    assertEquals(4d, sum, 1e-9);
    assertEquals(0.8, parts.seasonal()[0], 1e-9);
  }

  @Test
  void centredMovingAverageUsesHalfWeightsForEvenPeriod() {
    double[] trend = SeasonalDecomposer.centredMovingAverage(new double[] {0, 0, 4, 0, 0}, 2);
    assertTrue(Double.isNaN(trend[0]));
    assertEquals(1d, trend[1], 1e-12);
    assertEquals(2d, trend[2], 1e-12);
    assertTrue(Double.isNaN(trend[4]));
  }

  @Test
  void needsTwoFullCycles() {
    var ex = assertThrows(InsufficientDataException.class,
        () -> SeasonalDecomposer.decompose(new double[7], 4, Mode.ADDITIVE));
    assertEquals("Need at least 8 observations for period 4", ex.getMessage());
  }

  @Test
  void rejectsBadPeriodAndNonPositiveMultiplicativeInput() {
    assertThrows(InvalidParameterException.class,
        () -> SeasonalDecomposer.decompose(new double[10], 1, Mode.ADDITIVE));
    assertThrows(InvalidParameterException.class,
        () -> SeasonalDecomposer.decompose(new double[] {1, 2, 0, 4, 5, 6, 7, 8}, 4,
            Mode.MULTIPLICATIVE));
  }

  @Test
  void modeParsingAcceptsAliases() {
    assertEquals(Mode.ADDITIVE, Mode.parse(null));
    assertEquals(Mode.MULTIPLICATIVE, Mode.parse("mul"));
    assertEquals("additive", Mode.parse("add").code());
    assertThrows(InvalidParameterException.class, () -> Mode.parse("stl"));
  }
}
