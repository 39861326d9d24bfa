package com.ospicorp.tsforecast.forecast.variants;

import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes whether the ND4J native backend can be loaded on this machine.
 */
public final class NeuralBackend {
  private static final Logger log = LoggerFactory.getLogger(NeuralBackend.class);

  private static volatile Boolean available;

  private NeuralBackend() {
  }

  public static boolean isAvailable() {
    Boolean cached = available;
    if (cached == null) {
      synchronized (NeuralBackend.class) {
        if (available == null) {
          available = probe();
        }
        cached = available;
      }
    }
    return cached;
  }

  private static boolean probe() {
    try {
      double sum = Nd4j.create(new double[] {1d, 2d}, new long[] {2}, DataType.DOUBLE)
          .sumNumber().doubleValue();
      log.info("ND4J backend {} loaded", Nd4j.getBackend().getClass().getSimpleName());
      return sum == 3d;
    } catch (RuntimeException | LinkageError ex) {
      log.warn("ND4J native backend unavailable, neural network models disabled: {}",
          ex.toString());
      return false;
    }
  }
}
