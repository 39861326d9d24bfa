package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.common.InvalidParameterException;
import com.ospicorp.tsforecast.common.ModelStateException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import com.ospicorp.tsforecast.forecast.model.ModelParameters;
import com.ospicorp.tsforecast.forecast.model.ModelType;
import com.ospicorp.tsforecast.series.model.TimeSeries;
import com.ospicorp.tsforecast.series.model.TimeStep;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Additive trend plus seasonality regression in the style of Prophet: a piecewise-linear trend
 * with hinge changepoints and Fourier seasonal terms, fitted by penalised least squares on scaled
 * time and scaled values.
 *
 * <p>Series without a time axis get a synthetic daily calendar starting at
 * {@link #SYNTHETIC_START}.
 */
public class ProphetModel implements ForecastingModel {
  static final LocalDateTime SYNTHETIC_START = LocalDateTime.of(2020, 1, 1, 0, 0);

  private static final double SECONDS_PER_DAY = 86_400d;
  private static final double UNPENALISED = 1e-9;

  private final int requestedChangepoints;
  private final double changepointRange;
  private final double changepointPriorScale;
  private final double seasonalityPriorScale;
  private final Object yearlySetting;
  private final Object weeklySetting;
  private final Object dailySetting;

  private List<LocalDateTime> dates;
  private boolean syntheticDates;
  private TimeStep step;
  private double originDays;
  private double spanDays;
  private double yScale;
  private double[] changepoints;
  private final List<Seasonality> seasonalities = new ArrayList<>();
  private RealVector beta;
  private RealMatrix covarianceShape;
  private double sigma2;
  private double[] fitted;

  public ProphetModel(ModelParameters parameters) {
    this.requestedChangepoints = parameters.intValue("n_changepoints", 25);
    this.changepointRange = parameters.doubleValue("changepoint_range", 0.8);
    this.changepointPriorScale = parameters.doubleValue("changepoint_prior_scale", 0.05);
    this.seasonalityPriorScale = parameters.doubleValue("seasonality_prior_scale", 10.0);
    this.yearlySetting = setting(parameters, "yearly_seasonality");
    this.weeklySetting = setting(parameters, "weekly_seasonality");
    this.dailySetting = setting(parameters, "daily_seasonality");
    String mode = parameters.string("seasonality_mode", "additive");
    if (mode != null && !"additive".equals(mode)) {
      throw new InvalidParameterException("Unsupported seasonality_mode: " + mode
          + " (only additive is supported)", "seasonality_mode");
    }
    if (requestedChangepoints < 0) {
      throw new InvalidParameterException("Parameter 'n_changepoints' must be non-negative",
          "n_changepoints");
    }
    if (changepointRange <= 0 || changepointRange > 1) {
      throw new InvalidParameterException("Parameter 'changepoint_range' must be in (0, 1]",
          "changepoint_range");
    }
    if (changepointPriorScale <= 0 || seasonalityPriorScale <= 0) {
      throw new InvalidParameterException("Prior scales must be positive");
    }
  }

  private static Object setting(ModelParameters parameters, String name) {
    Object raw = parameters.raw(name);
    if (raw == null || raw instanceof Boolean) {
      return raw == null ? "auto" : raw;
    }
    String text = raw.toString().trim().toLowerCase(Locale.ROOT);
    switch (text) {
      case "auto":
        return "auto";
      case "true":
        return Boolean.TRUE;
      case "false":
        return Boolean.FALSE;
      default:
        throw new InvalidParameterException(
            "Parameter '" + name + "' must be 'auto' or a boolean", name);
    }
  }

  @Override
  public ModelType type() {
    return ModelType.PROPHET;
  }

  @Override
  public void fit(TimeSeries series) {
    double[] y = series.values();
    int n = y.length;
    if (n < 2) {
      throw new FittingException("Prophet needs at least 2 observations");
    }
    syntheticDates = !series.hasTimeAxis();
    if (syntheticDates) {
      dates = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        dates.add(SYNTHETIC_START.plusDays(i));
      }
      step = TimeStep.daily();
    } else {
      dates = series.timestamps();
      step = series.step() != null ? series.step() : TimeStep.daily();
    }

    double[] days = new double[n];
    for (int i = 0; i < n; i++) {
      days[i] = toDays(dates.get(i));
    }
    originDays = days[0];
    spanDays = days[n - 1] - days[0];
    if (spanDays <= 0) {
      throw new FittingException("Prophet needs a time axis spanning more than one instant");
    }
    double minSpacing = Double.MAX_VALUE;
    for (int i = 1; i < n; i++) {
      minSpacing = Math.min(minSpacing, days[i] - days[i - 1]);
    }

    double maxAbs = 0d;
    for (double v : y) {
      maxAbs = Math.max(maxAbs, Math.abs(v));
    }
    yScale = maxAbs == 0d ? 1d : maxAbs;

    double[] t = new double[n];
    for (int i = 0; i < n; i++) {
      t[i] = (days[i] - originDays) / spanDays;
    }
    changepoints = placeChangepoints(t);

    seasonalities.clear();
    if (enabled(yearlySetting, spanDays >= 730)) {
      seasonalities.add(new Seasonality("yearly", 365.25, 10));
    }
    if (enabled(weeklySetting, spanDays >= 14 && minSpacing < 7)) {
      seasonalities.add(new Seasonality("weekly", 7, 3));
    }
    if (enabled(dailySetting, spanDays >= 2 && minSpacing < 1)) {
      seasonalities.add(new Seasonality("daily", 1, 4));
    }

    double[][] rows = new double[n][];
    for (int i = 0; i < n; i++) {
      rows[i] = features(t[i], days[i]);
    }
    RealMatrix x = new Array2DRowRealMatrix(rows, false);
    RealVector target = new ArrayRealVector(n);
    for (int i = 0; i < n; i++) {
      target.setEntry(i, y[i] / yScale);
    }
    RealMatrix gram = x.transpose().multiply(x);
    RealMatrix penalised = gram.copy();
    double[] penalties = penalties();
    for (int j = 0; j < penalties.length; j++) {
      penalised.addToEntry(j, j, penalties[j]);
    }
    DecompositionSolver solver = new LUDecomposition(penalised).getSolver();
    if (!solver.isNonSingular()) {
      throw new FittingException("Prophet design matrix is singular");
    }
    beta = solver.solve(x.transpose().operate(target));
    RealMatrix inverse = solver.getInverse();
    covarianceShape = inverse.multiply(gram).multiply(inverse);

    RealVector prediction = x.operate(beta);
    double sse = 0d;
    fitted = new double[n];
    for (int i = 0; i < n; i++) {
      double residual = target.getEntry(i) - prediction.getEntry(i);
      sse += residual * residual;
      fitted[i] = prediction.getEntry(i) * yScale;
    }
    sigma2 = sse / Math.max(n - beta.getDimension(), 1);
    if (!Double.isFinite(sigma2)) {
      throw new FittingException("Prophet fit produced a non-finite residual variance");
    }
  }

  /** Uniformly spaced over the first {@code changepointRange} of the history. */
  private double[] placeChangepoints(double[] t) {
    int historySize = (int) Math.floor(t.length * changepointRange);
    int count = Math.min(requestedChangepoints, historySize - 1);
    if (count <= 0) {
      return new double[0];
    }
    double[] out = new double[count];
    for (int j = 1; j <= count; j++) {
      int index = (int) Math.round((double) j * (historySize - 1) / count);
      out[j - 1] = t[index];
    }
    return out;
  }

  private static boolean enabled(Object setting, boolean automatic) {
    return setting instanceof Boolean flag ? flag : automatic;
  }

  private double[] features(double t, double days) {
    int width = 2 + changepoints.length + seasonalWidth();
    double[] row = new double[width];
    row[0] = 1d;
    row[1] = t;
    int col = 2;
    for (double c : changepoints) {
      row[col++] = Math.max(t - c, 0d);
    }
    for (Seasonality s : seasonalities) {
      for (int k = 1; k <= s.order(); k++) {
        double angle = 2 * Math.PI * k * days / s.periodDays();
        row[col++] = Math.sin(angle);
        row[col++] = Math.cos(angle);
      }
    }
    return row;
  }

  private int seasonalWidth() {
    int width = 0;
    for (Seasonality s : seasonalities) {
      width += 2 * s.order();
    }
    return width;
  }

  private double[] penalties() {
    double[] out = new double[2 + changepoints.length + seasonalWidth()];
    out[0] = UNPENALISED;
    out[1] = UNPENALISED;
    for (int j = 0; j < changepoints.length; j++) {
      out[2 + j] = 1d / changepointPriorScale;
    }
    for (int j = 2 + changepoints.length; j < out.length; j++) {
      out[j] = 1d / (seasonalityPriorScale * seasonalityPriorScale);
    }
    return out;
  }

  @Override
  public ForecastOutput forecast(int periods, double confidenceInterval) {
    requireFit();
    double z = new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceInterval / 2);
    double meanAbsDelta = 0d;
    for (int j = 0; j < changepoints.length; j++) {
      meanAbsDelta += Math.abs(beta.getEntry(2 + j));
    }
    if (changepoints.length > 0) {
      meanAbsDelta /= changepoints.length;
    }
    double[] point = new double[periods];
    double[] lower = new double[periods];
    double[] upper = new double[periods];
    LocalDateTime current = dates.get(dates.size() - 1);
    for (int h = 0; h < periods; h++) {
      current = step.next(current);
      double days = toDays(current);
      double t = (days - originDays) / spanDays;
      RealVector row = new ArrayRealVector(features(t, days), false);
      double mean = row.dotProduct(beta);
      double parameterVariance = row.dotProduct(covarianceShape.operate(row));
      double beyond = Math.max(t - 1d, 0d);
      double trendVariance = changepoints.length * 2 * meanAbsDelta * meanAbsDelta
          * beyond * beyond * beyond / 3d;
      double se = Math.sqrt(sigma2 * (1 + parameterVariance) + trendVariance);
      point[h] = mean * yScale;
      lower[h] = (mean - z * se) * yScale;
      upper[h] = (mean + z * se) * yScale;
    }
    return new ForecastOutput(point, lower, upper);
  }

  @Override
  public double[] fittedValues() {
    requireFit();
    return fitted.clone();
  }

  @Override
  public Map<String, Object> modelInfo() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("seasonality_mode", "additive");
    info.put("changepoint_prior_scale", changepointPriorScale);
    info.put("seasonality_prior_scale", seasonalityPriorScale);
    if (beta != null) {
      List<String> seasonalityNames = new ArrayList<>();
      for (Seasonality s : seasonalities) {
        seasonalityNames.add(s.name());
      }
      List<String> changepointDates = new ArrayList<>();
      for (double c : changepoints) {
        long seconds = Math.round((originDays + c * spanDays) * SECONDS_PER_DAY);
        changepointDates.add(step.format(LocalDateTime.ofEpochSecond(seconds, 0, ZoneOffset.UTC)));
      }
      info.put("n_changepoints", changepoints.length);
      info.put("changepoints", changepointDates);
      info.put("seasonalities", seasonalityNames);
      info.put("growth_rate", beta.getEntry(1) * yScale / spanDays);
      info.put("sigma", Math.sqrt(sigma2) * yScale);
      info.put("synthetic_dates", syntheticDates);
      info.put("interval", "penalised regression predictive variance plus trend uncertainty");
    }
    return info;
  }

  private void requireFit() {
    if (beta == null) {
      throw new ModelStateException("Model must be fitted before use");
    }
  }

  private static double toDays(LocalDateTime instant) {
    return instant.toEpochSecond(ZoneOffset.UTC) / SECONDS_PER_DAY;
  }

  private record Seasonality(String name, double periodDays, int order) {}
}
