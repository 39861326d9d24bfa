package com.ospicorp.tsforecast.series.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Regular spacing of a time axis: either a fixed duration or a calendar step of whole months.
 */
public record TimeStep(Duration duration, int months, boolean monthEnd) {

  private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

  public static TimeStep ofDuration(Duration duration) {
    return new TimeStep(duration, 0, false);
  }

  public static TimeStep ofMonths(int months, boolean monthEnd) {
    return new TimeStep(null, months, monthEnd);
  }

  public static TimeStep daily() {
    return ofDuration(Duration.ofDays(1));
  }

  public LocalDateTime next(LocalDateTime from) {
    if (duration != null) {
      return from.plus(duration);
    }
    LocalDateTime shifted = from.plusMonths(months);
    return monthEnd ? shifted.with(TemporalAdjusters.lastDayOfMonth()) : shifted;
  }

  public String format(LocalDateTime instant) {
    boolean subDaily = duration != null && duration.compareTo(Duration.ofDays(1)) < 0;
    if (subDaily || !LocalTime.MIDNIGHT.equals(instant.toLocalTime())) {
      return DATE_TIME.format(instant);
    }
    return DATE.format(instant);
  }
}
