package com.ospicorp.tsforecast.series.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, gap-free numeric sequence, optionally paired with strictly increasing timestamps.
 */
public final class TimeSeries {
  private final double[] values;
  private final List<LocalDateTime> timestamps;
  private final TimeStep step;
  private final int missingCount;

  public TimeSeries(double[] values, List<LocalDateTime> timestamps, TimeStep step,
      int missingCount) {
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("a time series needs at least one value");
    }
    if (timestamps != null && timestamps.size() != values.length) {
      throw new IllegalArgumentException("timestamps must align with values");
    }
    this.values = values.clone();
    this.timestamps = timestamps == null ? null : List.copyOf(timestamps);
    this.step = step;
    this.missingCount = missingCount;
  }

  public static TimeSeries of(double... values) {
    return new TimeSeries(values, null, null, 0);
  }

  public int length() {
    return values.length;
  }

  public double[] values() {
    return values.clone();
  }

  public double value(int index) {
    return values[index];
  }

  public boolean hasTimeAxis() {
    return timestamps != null;
  }

  public List<LocalDateTime> timestamps() {
    return timestamps == null ? Collections.emptyList() : timestamps;
  }

  public LocalDateTime lastTimestamp() {
    return timestamps == null ? null : timestamps.get(timestamps.size() - 1);
  }

  /** Regular step of the time axis, or {@code null} when absent or irregular. */
  public TimeStep step() {
    return step;
  }

  public int missingCount() {
    return missingCount;
  }

  public List<String> timeLabels() {
    if (timestamps == null) {
      return Collections.emptyList();
    }
    TimeStep formatter = step != null ? step : TimeStep.daily();
    List<String> labels = new ArrayList<>(timestamps.size());
    for (LocalDateTime ts : timestamps) {
      labels.add(formatter.format(ts));
    }
    return labels;
  }

  public List<Double> asList() {
    List<Double> out = new ArrayList<>(values.length);
    for (double v : values) {
      out.add(v);
    }
    return out;
  }

  @Override
  public String toString() {
    return "TimeSeries[length=" + values.length + ", timed=" + hasTimeAxis()
        + ", head=" + Arrays.toString(Arrays.copyOf(values, Math.min(5, values.length))) + "]";
  }
}
