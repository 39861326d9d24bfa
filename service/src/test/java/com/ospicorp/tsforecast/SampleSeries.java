package com.ospicorp.tsforecast;

import com.ospicorp.tsforecast.series.model.DataInput;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/** Deterministic fixtures shared by the tests. */
public final class SampleSeries {
  private SampleSeries() {
  }

  /** Upward trend with a 12-step sine cycle and small seeded noise. */
  public static double[] seasonal(int n) {
    Random random = new Random(11);
    double[] out = new double[n];
    for (int t = 0; t < n; t++) {
      out[t] = 50 + 0.5 * t + 10 * Math.sin(2 * Math.PI * t / 12) + random.nextGaussian();
    }
    return out;
  }

  public static double[] noise(int n, long seed) {
    Random random = new Random(seed);
    double[] out = new double[n];
    for (int t = 0; t < n; t++) {
      out[t] = random.nextGaussian();
    }
    return out;
  }

  public static DataInput monthly(double[] values) {
    List<Map<String, Object>> records = new ArrayList<>(values.length);
    LocalDate start = LocalDate.of(2018, 1, 1);
    for (int i = 0; i < values.length; i++) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("date", start.plusMonths(i).toString());
      record.put("value", values[i]);
      records.add(record);
    }
    return new DataInput(records, "value", "date");
  }

  public static DataInput untimed(double[] values) {
    List<Map<String, Object>> records = new ArrayList<>(values.length);
    for (double v : values) {
      Map<String, Object> record = new LinkedHashMap<>();
      record.put("value", v);
      records.add(record);
    }
    return new DataInput(records, "value", null);
  }
}
