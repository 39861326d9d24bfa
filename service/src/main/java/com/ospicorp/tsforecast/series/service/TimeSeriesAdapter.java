package com.ospicorp.tsforecast.series.service;

import com.ospicorp.tsforecast.common.DataFormatException;
import com.ospicorp.tsforecast.series.model.DataInput;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import com.ospicorp.tsforecast.series.model.TimeStep;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.util.StringUtils;

/**
 * Turns the record-oriented data input into a {@link TimeSeries}: numeric values only, sorted by
 * time when a time column is given, one value per timestamp (the last record wins).
 */
public final class TimeSeriesAdapter {
  // Offsets without a colon, e.g. 2024-01-01T00:00:00+0000
  private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .appendPattern("XX")
      .toFormatter();

  private TimeSeriesAdapter() {
  }

  public static TimeSeries toSeries(DataInput input) {
    if (input == null || input.records() == null || input.records().isEmpty()) {
      throw new DataFormatException("Invalid data format: no records supplied");
    }
    String valueColumn = input.valueColumn();
    if (!StringUtils.hasText(valueColumn)) {
      throw new DataFormatException("Invalid data format: value_column must be provided");
    }
    List<Map<String, Object>> records = input.records();
    if (records.stream().noneMatch(r -> r != null && r.containsKey(valueColumn))) {
      throw new DataFormatException("Value column '" + valueColumn + "' not found in records");
    }

    String timeColumn = input.timeColumn();
    boolean timed = StringUtils.hasText(timeColumn)
        && records.stream().anyMatch(r -> r != null && r.containsKey(timeColumn));

    return timed ? timedSeries(records, valueColumn, timeColumn)
        : untimedSeries(records, valueColumn);
  }

  private static TimeSeries untimedSeries(List<Map<String, Object>> records, String valueColumn) {
    List<Double> values = new ArrayList<>(records.size());
    int missing = 0;
    for (Map<String, Object> record : records) {
      Double value = record == null ? null : parseValue(record.get(valueColumn));
      if (value == null) {
        missing++;
      } else {
        values.add(value);
      }
    }
    return build(values, null, missing, valueColumn);
  }

  private static TimeSeries timedSeries(List<Map<String, Object>> records, String valueColumn,
      String timeColumn) {
    TreeMap<LocalDateTime, Double> byTime = new TreeMap<>();
    int missing = 0;
    for (Map<String, Object> record : records) {
      if (record == null) {
        missing++;
        continue;
      }
      LocalDateTime ts = parseTime(record.get(timeColumn), timeColumn);
      Double value = parseValue(record.get(valueColumn));
      if (ts == null || value == null) {
        missing++;
        continue;
      }
      byTime.put(ts, value);
    }
    List<LocalDateTime> timestamps = new ArrayList<>(byTime.keySet());
    return build(new ArrayList<>(byTime.values()), timestamps, missing, valueColumn);
  }

  private static TimeSeries build(List<Double> values, List<LocalDateTime> timestamps,
      int missing, String valueColumn) {
    if (values.isEmpty()) {
      throw new DataFormatException(
          "Value column '" + valueColumn + "' contains no numeric values");
    }
    double[] raw = new double[values.size()];
    for (int i = 0; i < raw.length; i++) {
      raw[i] = values.get(i);
    }
    TimeStep step = timestamps == null ? null : inferStep(timestamps);
    return new TimeSeries(raw, timestamps, step, missing);
  }

  static Double parseValue(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number number) {
      double v = number.doubleValue();
      return Double.isFinite(v) ? v : null;
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      double v = Double.parseDouble(text);
      return Double.isFinite(v) ? v : null;
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  static LocalDateTime parseTime(Object raw, String timeColumn) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number number) {
      return LocalDateTime.ofInstant(Instant.ofEpochMilli(number.longValue()), ZoneOffset.UTC);
    }
    String text = raw.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text).atStartOfDay();
      }
      if (text.length() == 7) {
        return YearMonth.parse(text).atDay(1).atStartOfDay();
      }
      String iso = text.replace(' ', 'T');
      if (iso.endsWith("Z") || iso.matches(".*[+-]\\d{2}:\\d{2}$")) {
        return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      }
      if (iso.matches(".*[+-]\\d{4}$")) {
        return OffsetDateTime.parse(iso, COMPACT_OFFSET)
            .withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      }
      return LocalDateTime.parse(iso);
    } catch (DateTimeParseException ex) {
      throw new DataFormatException(
          "Unparseable value '" + text + "' in time column '" + timeColumn + "'", ex);
    }
  }

  /** Constant spacing of the axis, or {@code null} when fewer than two points or irregular. */
  static TimeStep inferStep(List<LocalDateTime> timestamps) {
    if (timestamps.size() < 2) {
      return null;
    }
    TimeStep calendar = inferCalendarStep(timestamps);
    if (calendar != null) {
      return calendar;
    }
    Duration first = Duration.between(timestamps.get(0), timestamps.get(1));
    for (int i = 2; i < timestamps.size(); i++) {
      if (!first.equals(Duration.between(timestamps.get(i - 1), timestamps.get(i)))) {
        return null;
      }
    }
    return TimeStep.ofDuration(first);
  }

  private static TimeStep inferCalendarStep(List<LocalDateTime> timestamps) {
    boolean allMonthEnd = true;
    boolean sameDay = true;
    int day = timestamps.get(0).getDayOfMonth();
    for (LocalDateTime ts : timestamps) {
      if (!LocalTime.MIDNIGHT.equals(ts.toLocalTime())) {
        return null;
      }
      LocalDate date = ts.toLocalDate();
      allMonthEnd &= date.getDayOfMonth() == date.lengthOfMonth();
      sameDay &= date.getDayOfMonth() == day;
    }
    if (!allMonthEnd && !(sameDay && day <= 28)) {
      return null;
    }
    long months = monthsBetween(timestamps.get(0), timestamps.get(1));
    if (months <= 0) {
      return null;
    }
    for (int i = 2; i < timestamps.size(); i++) {
      if (monthsBetween(timestamps.get(i - 1), timestamps.get(i)) != months) {
        return null;
      }
    }
    return TimeStep.ofMonths((int) months, allMonthEnd && !sameDay);
  }

  private static long monthsBetween(LocalDateTime a, LocalDateTime b) {
    return ChronoUnit.MONTHS.between(YearMonth.from(a), YearMonth.from(b));
  }
}
