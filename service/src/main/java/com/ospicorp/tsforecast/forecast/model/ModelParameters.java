package com.ospicorp.tsforecast.forecast.model;

import com.ospicorp.tsforecast.common.InvalidParameterException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed read access to the loosely typed parameter map of a model configuration.
 */
public final class ModelParameters {
  private final Map<String, Object> values;

  public ModelParameters(Map<String, Object> values) {
    this.values = values == null ? Collections.emptyMap() : values;
  }

  public boolean has(String name) {
    return values.containsKey(name) && values.get(name) != null;
  }

  public Object raw(String name) {
    return values.get(name);
  }

  public int intValue(String name, int defaultValue) {
    Object raw = values.get(name);
    if (raw == null) {
      return defaultValue;
    }
    return toInt(raw, name);
  }

  public double doubleValue(String name, double defaultValue) {
    Object raw = values.get(name);
    if (raw == null) {
      return defaultValue;
    }
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(raw.toString().trim());
    } catch (NumberFormatException ex) {
      throw new InvalidParameterException("Parameter '" + name + "' must be a number", name);
    }
  }

  /** Lower-cased string value; {@code null} stays {@code null} when the key is present. */
  public String string(String name, String defaultValue) {
    if (!values.containsKey(name)) {
      return defaultValue;
    }
    Object raw = values.get(name);
    return raw == null ? null : raw.toString().trim().toLowerCase(Locale.ROOT);
  }

  public List<Integer> intList(String name, List<Integer> defaultValue) {
    Object raw = values.get(name);
    if (raw == null) {
      return defaultValue;
    }
    Collection<?> items;
    if (raw instanceof Collection<?> collection) {
      items = collection;
    } else if (raw instanceof Object[] array) {
      items = Arrays.asList(array);
    } else {
      throw new InvalidParameterException("Parameter '" + name + "' must be a list of integers",
          name);
    }
    List<Integer> out = new ArrayList<>(items.size());
    for (Object item : items) {
      out.add(toInt(item, name));
    }
    return out;
  }

  private static int toInt(Object raw, String name) {
    if (raw == null) {
      throw new InvalidParameterException("Parameter '" + name + "' must not contain nulls", name);
    }
    if (raw instanceof Number number) {
      double d = number.doubleValue();
      if (d != Math.rint(d)) {
        throw new InvalidParameterException("Parameter '" + name + "' must be an integer", name);
      }
      return number.intValue();
    }
    try {
      return Integer.parseInt(raw.toString().trim());
    } catch (NumberFormatException ex) {
      throw new InvalidParameterException("Parameter '" + name + "' must be an integer", name);
    }
  }
}
