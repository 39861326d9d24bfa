package com.ospicorp.tsforecast.web;

import com.ospicorp.tsforecast.common.TooManyRequestsException;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Bounds the number of model fits running at once. Excess requests are rejected, not queued.
 */
@Component
public class FitAdmissionControl {
  private static final Logger log = LoggerFactory.getLogger(FitAdmissionControl.class);
  private static final long RETRY_AFTER_SECONDS = 5;

  private final Semaphore permits;
  private final int maxConcurrentFits;

  public FitAdmissionControl(@Value("${forecast.max-concurrent-fits:4}") int maxConcurrentFits) {
    this.maxConcurrentFits = Math.max(maxConcurrentFits, 1);
    this.permits = new Semaphore(this.maxConcurrentFits);
  }

  public <T> T run(Supplier<T> work) {
    if (!permits.tryAcquire()) {
      log.warn("Rejecting fit: {} fits already running", maxConcurrentFits);
      throw new TooManyRequestsException(
          "Too many concurrent model fits, retry later", RETRY_AFTER_SECONDS);
    }
    try {
      return work.get();
    } finally {
      permits.release();
    }
  }
}
