package com.ospicorp.tsforecast.common;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Result of a computation that may fail with a domain error. Used where one failure must not
 * abort the surrounding request, e.g. a single sub-diagnostic of a composite analysis.
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

  static <T> Outcome<T> of(Supplier<T> computation) {
    try {
      return new Success<>(computation.get());
    } catch (TimeSeriesException ex) {
      return new Failure<>(ex);
    }
  }

  boolean isSuccess();

  /** Success value, or an {@code {"error": message}} fragment for a failure. */
  Object valueOrErrorFragment();

  record Success<T>(T value) implements Outcome<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Object valueOrErrorFragment() {
      return value;
    }
  }

  record Failure<T>(TimeSeriesException error) implements Outcome<T> {
    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Object valueOrErrorFragment() {
      String message = Objects.toString(error.getMessage(), error.getClass().getSimpleName());
      return Map.of("error", message);
    }
  }
}
