package com.ospicorp.tsforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.tsforecast.common.DataFormatException;
import com.ospicorp.tsforecast.series.model.DataInput;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimeSeriesAdapterTest {

  @Test
  void sortsByTimeAndInfersMonthlyStep() {
    var input = new DataInput(List.of(
        Map.of("date", "2020-03-01", "value", 3),
        Map.of("date", "2020-01-01", "value", 1),
        Map.of("date", "2020-02-01", "value", "2")), "value", "date");

    TimeSeries series = TimeSeriesAdapter.toSeries(input);

    assertArrayEquals(new double[] {1, 2, 3}, series.values());
    assertTrue(series.hasTimeAxis());
    assertNotNull(series.step());
    assertEquals(LocalDateTime.of(2020, 4, 1, 0, 0), series.step().next(series.lastTimestamp()));
  }

  @Test
  void dropsNonNumericValuesAndCountsThem() {
    Map<String, Object> blank = new HashMap<>();
    blank.put("value", null);
    var input = new DataInput(List.of(Map.of("value", 1.5), blank, Map.of("value", "n/a"),
        Map.of("value", 4)), "value", null);

    TimeSeries series = TimeSeriesAdapter.toSeries(input);

    assertArrayEquals(new double[] {1.5, 4}, series.values());
    assertEquals(2, series.missingCount());
    assertFalse(series.hasTimeAxis());
  }

  @Test
  void laterRecordWinsForDuplicateTimestamp() {
    var input = new DataInput(List.of(
        Map.of("date", "2021-01-01", "value", 1),
        Map.of("date", "2021-01-01", "value", 7),
        Map.of("date", "2021-01-02", "value", 2)), "value", "date");

    assertArrayEquals(new double[] {7, 2}, TimeSeriesAdapter.toSeries(input).values());
  }

  @Test
  void missingValueColumnIsRejected() {
    var input = new DataInput(List.of(Map.of("x", 1)), "value", null);
    var ex = assertThrows(DataFormatException.class, () -> TimeSeriesAdapter.toSeries(input));
    assertTrue(ex.getMessage().contains("value"));
  }

  @Test
  void emptyRecordsAreRejected() {
    assertThrows(DataFormatException.class,
        () -> TimeSeriesAdapter.toSeries(new DataInput(List.of(), "value", null)));
  }

  @Test
  void offsetsWithAndWithoutColonAreNormalisedToUtc() {
    assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0),
        TimeSeriesAdapter.parseTime("2024-01-01T00:00:00+0000", "date"));
    assertEquals(LocalDateTime.of(2023, 12, 31, 22, 30),
        TimeSeriesAdapter.parseTime("2024-01-01T00:00:00+0130", "date"));
    assertEquals(LocalDateTime.of(2024, 1, 1, 5, 0),
        TimeSeriesAdapter.parseTime("2024-01-01 00:00:00-05:00", "date"));
  }

  @Test
  void unparseableTimestampIsRejected() {
    var input = new DataInput(List.of(Map.of("date", "yesterday", "value", 1)), "value", "date");
    assertThrows(DataFormatException.class, () -> TimeSeriesAdapter.toSeries(input));
  }
}
