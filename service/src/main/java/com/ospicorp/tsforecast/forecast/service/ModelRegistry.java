package com.ospicorp.tsforecast.forecast.service;

import com.ospicorp.tsforecast.common.UnknownModelException;
import com.ospicorp.tsforecast.forecast.model.ModelDescriptor;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.forecast.variants.ArimaModel;
import com.ospicorp.tsforecast.forecast.variants.ForecastingModel;
import com.ospicorp.tsforecast.forecast.variants.HoltWintersModel;
import com.ospicorp.tsforecast.forecast.variants.LstmModel;
import com.ospicorp.tsforecast.forecast.variants.MovingAverageModel;
import com.ospicorp.tsforecast.forecast.variants.NeuralBackend;
import com.ospicorp.tsforecast.forecast.variants.ProphetModel;
import com.ospicorp.tsforecast.forecast.variants.SeasonalArimaModel;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Model types that can be instantiated in this process. Optional variants are registered at
 * startup only when their runtime capability is present.
 */
@Component
public class ModelRegistry {
  private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

  private final Map<ModelType, Registration> registrations = new EnumMap<>(ModelType.class);

  public ModelRegistry(@Value("${forecast.models.lstm.enabled:true}") boolean lstmEnabled) {
    register(ModelType.ARIMA, ArimaModel::new, new ModelDescriptor("ARIMA",
        "AutoRegressive Integrated Moving Average", List.of("p", "d", "q"),
        "Stationary time series"));
    register(ModelType.SARIMA, SeasonalArimaModel::new, new ModelDescriptor("SARIMA",
        "Seasonal ARIMA", List.of("p", "d", "q", "P", "D", "Q", "s"),
        "Time series with seasonality"));
    register(ModelType.HOLT_WINTERS, HoltWintersModel::new, new ModelDescriptor("Holt-Winters",
        "Exponential Smoothing with Trend and Seasonality",
        List.of("trend", "seasonal", "seasonal_periods"), "Data with trend and seasonality"));
    register(ModelType.PROPHET, ProphetModel::new, new ModelDescriptor("Prophet",
        "Piecewise-linear trend with Fourier seasonality",
        List.of("seasonality_mode", "yearly_seasonality", "weekly_seasonality"),
        "Business metrics with strong seasonal patterns"));
    register(ModelType.MOVING_AVERAGE, MovingAverageModel::new, new ModelDescriptor(
        "Moving Average", "Simple moving average forecasting", List.of("window"),
        "Stable time series without strong trends"));
    if (!lstmEnabled) {
      log.info("LSTM model disabled by configuration");
    } else if (NeuralBackend.isAvailable()) {
      register(ModelType.LSTM, LstmModel::new, new ModelDescriptor("LSTM",
          "Long Short-Term Memory Neural Network",
          List.of("sequence_length", "lstm_units", "dropout_rate"),
          "Complex non-linear patterns"));
    } else {
      log.warn("LSTM model not registered: neural network backend unavailable");
    }
    log.info("Registered forecasting models: {}", registrations.keySet());
  }

  private void register(ModelType type, Function<ModelParameters, ForecastingModel> factory,
      ModelDescriptor descriptor) {
    registrations.put(type, new Registration(factory, descriptor));
  }

  public boolean isRegistered(ModelType type) {
    return registrations.containsKey(type);
  }

  /**
   * @throws UnknownModelException for codes outside the enumeration or types not registered here
   */
  public ForecastingModel create(String modelType, ModelParameters parameters) {
    ModelType type = ModelType.fromCode(modelType);
    Registration registration = registrations.get(type);
    if (registration == null) {
      throw new UnknownModelException("Model type not available: " + type.code());
    }
    return registration.factory().apply(parameters);
  }

  public Map<String, ModelDescriptor> available() {
    Map<String, ModelDescriptor> out = new LinkedHashMap<>();
    registrations.forEach((type, registration) -> out.put(type.code(), registration.descriptor()));
    return Collections.unmodifiableMap(out);
  }

  private record Registration(Function<ModelParameters, ForecastingModel> factory,
      ModelDescriptor descriptor) {}
}
