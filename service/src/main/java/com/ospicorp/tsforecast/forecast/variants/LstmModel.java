package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.LSTM;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.conf.layers.recurrent.LastTimeStep;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.factory.Nd4j;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two stacked LSTM layers with dropout and a dense head, trained on sliding windows of min-max
 * scaled values. Forecasts are produced autoregressively: each scaled prediction is appended to
 * the input window for the next step, so errors compound over the horizon.
 *
 * <p>Intervals are {@code forecast ± 1.96·σ}, σ being the spread of the forecast sequence itself
 * (or a tenth of the data's spread for a single-step horizon).
 */
public class LstmModel implements ForecastingModel {
  private static final Logger log = LoggerFactory.getLogger(LstmModel.class);

  private static final double VALIDATION_FRACTION = 0.2;
  private static final double LEARNING_RATE = 1e-3;

  private final int sequenceLength;
  private final int units;
  private final double dropoutRate;
  private final int epochs;
  private final int batchSize;
  private final long seed;

  private MultiLayerNetwork network;
  private double min;
  private double range;
  private double[] scaled;
  private double dataSpread;
  private double[] fitted;
  private double trainingLoss = Double.NaN;
  private double validationLoss = Double.NaN;

  public LstmModel(ModelParameters parameters) {
    this.sequenceLength = parameters.intValue("sequence_length", 60);
    this.units = parameters.intValue("lstm_units", 50);
    this.dropoutRate = parameters.doubleValue("dropout_rate", 0.2);
    this.epochs = parameters.intValue("epochs", 50);
    this.batchSize = parameters.intValue("batch_size", 32);
    this.seed = parameters.intValue("seed", 42);
    if (sequenceLength < 1 || units < 1 || epochs < 1 || batchSize < 1) {
      throw new InvalidParameterException(
          "sequence_length, lstm_units, epochs and batch_size must be positive");
    }
    if (dropoutRate < 0 || dropoutRate >= 1) {
      throw new InvalidParameterException("Parameter 'dropout_rate' must be in [0, 1)",
          "dropout_rate");
    }
  }

  @Override
  public ModelType type() {
    return ModelType.LSTM;
  }

  @Override
  public void fit(TimeSeries series) {
    double[] y = series.values();
    int windows = y.length - sequenceLength;
    if (windows < 1) {
      throw new FittingException("LSTM needs more than sequence_length (" + sequenceLength
          + ") observations, got " + y.length);
    }
    min = Arrays.stream(y).min().orElse(0d);
    double max = Arrays.stream(y).max().orElse(0d);
    range = max - min;
    scaled = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      scaled[i] = range == 0d ? 0d : (y[i] - min) / range;
    }
    dataSpread = new StandardDeviation(false).evaluate(y);

    int validation = (int) Math.floor(windows * VALIDATION_FRACTION);
    int training = windows - validation;
    try {
      network = new MultiLayerNetwork(configuration());
      network.init();
      List<Integer> order = new ArrayList<>();
      for (int i = 0; i < training; i++) {
        order.add(i);
      }
      Random random = new Random(seed);
      DataSet trainSet = windowsDataSet(0, training);
      DataSet validationSet = validation > 0 ? windowsDataSet(training, windows) : null;
      for (int epoch = 0; epoch < epochs; epoch++) {
        Collections.shuffle(order, random);
        for (int from = 0; from < training; from += batchSize) {
          List<Integer> batch = order.subList(from, Math.min(from + batchSize, training));
          network.fit(windowsDataSet(batch));
        }
        if (log.isDebugEnabled()) {
          log.debug("LSTM epoch {}/{} loss={}", epoch + 1, epochs, network.score(trainSet));
        }
      }
      trainingLoss = network.score(trainSet);
      if (validationSet != null) {
        validationLoss = network.score(validationSet);
      }

      fitted = new double[y.length];
      Arrays.fill(fitted, Double.NaN);
      INDArray predictions = network.output(windowsDataSet(0, windows).getFeatures(), false);
      for (int i = 0; i < windows; i++) {
        fitted[sequenceLength + i] = unscale(predictions.getDouble(i, 0));
      }
    } catch (IllegalStateException | IllegalArgumentException ex) {
      network = null;
      throw new FittingException("LSTM training failed: " + ex.getMessage(), ex);
    }
  }

  private MultiLayerConfiguration configuration() {
    double retain = 1d - dropoutRate;
    return new NeuralNetConfiguration.Builder()
        .seed(seed)
        .dataType(DataType.DOUBLE)
        .weightInit(WeightInit.XAVIER)
        .updater(new Adam(LEARNING_RATE))
        .list()
        .layer(new LSTM.Builder()
            .nIn(1)
            .nOut(units)
            .activation(Activation.TANH)
            .build())
        .layer(new LastTimeStep(new LSTM.Builder()
            .nIn(units)
            .nOut(units)
            .activation(Activation.TANH)
            .dropOut(retain)
            .build()))
        .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
            .nIn(units)
            .nOut(1)
            .activation(Activation.IDENTITY)
            .dropOut(retain)
            .build())
        .build();
  }

  private DataSet windowsDataSet(int from, int to) {
    List<Integer> indices = new ArrayList<>(to - from);
    for (int i = from; i < to; i++) {
      indices.add(i);
    }
    return windowsDataSet(indices);
  }

  /** Window {@code i} maps {@code scaled[i .. i+L)} to {@code scaled[i+L]}. */
  private DataSet windowsDataSet(List<Integer> starts) {
    int b = starts.size();
    double[] features = new double[b * sequenceLength];
    double[] labels = new double[b];
    for (int row = 0; row < b; row++) {
      int start = starts.get(row);
      System.arraycopy(scaled, start, features, row * sequenceLength, sequenceLength);
      labels[row] = scaled[start + sequenceLength];
    }
    return new DataSet(
        Nd4j.create(features, new long[] {b, 1, sequenceLength}, DataType.DOUBLE),
        Nd4j.create(labels, new long[] {b, 1}, DataType.DOUBLE));
  }

  private double unscale(double value) {
    return value * range + min;
  }

  @Override
  public ForecastOutput forecast(int periods, double confidenceInterval) {
    requireFit();
    double[] window = Arrays.copyOfRange(scaled, scaled.length - sequenceLength, scaled.length);
    double[] point = new double[periods];
    for (int h = 0; h < periods; h++) {
      INDArray input = Nd4j.create(window, new long[] {1, 1, sequenceLength}, DataType.DOUBLE);
      double next = network.output(input, false).getDouble(0, 0);
      point[h] = unscale(next);
      System.arraycopy(window, 1, window, 0, sequenceLength - 1);
      window[sequenceLength - 1] = next;
    }
    double sigma = periods > 1
        ? new StandardDeviation(false).evaluate(point)
        : 0.1 * dataSpread;
    return ResidualBands.around(point, sigma);
  }

  @Override
  public double[] fittedValues() {
    requireFit();
    return fitted.clone();
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("sequence_length", sequenceLength);
    info.put("lstm_units", units);
    info.put("dropout_rate", dropoutRate);
    info.put("epochs", epochs);
    info.put("batch_size", batchSize);
    if (network != null) {
      info.put("parameters", network.numParams());
      info.put("training_loss", trainingLoss);
      info.put("validation_loss", Double.isNaN(validationLoss) ? null : validationLoss);
      info.put("interval", "forecast ± 1.96·σ of the forecast sequence");
    }
    return info;
  }

  private void requireFit() {
    if (network == null || fitted == null) {
      throw new ModelStateException("Model must be fitted before use");
    }
  }
}
