package com.ospicorp.tsforecast.forecast.variants;

import com.ospicorp.tsforecast.common.FittingException;
import com.ospicorp.tsforecast.forecast.model.ForecastOutput;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Seasonal ARIMA(p,d,q)(P,D,Q)s estimated by conditional Gaussian likelihood (conditional sum of
 * squares) on the differenced series:
 *
 * <pre>
 *   φ(B)Φ(B^s) ∇^d ∇_s^D (y_t − μ) = θ(B)Θ(B^s) ε_t
 * </pre>
 *
 * <p>μ is only estimated when no differencing is applied. Coefficients are bounded to
 * (−0.99, 0.99). Forecast intervals come from the ψ-weights of the fully expanded model.
 */
final class ArimaEngine {
  private static final double COEFFICIENT_BOUND = 0.99;
  private static final double INITIAL_COEFFICIENT = 0.1;

  private final String modelName;
  private final int p;
  private final int d;
  private final int q;
  private final int seasonalP;
  private final int seasonalD;
  private final int seasonalQ;
  private final int season;

  ArimaEngine(String modelName, int p, int d, int q, int seasonalP, int seasonalD,
      int seasonalQ, int season) {
    this.modelName = modelName;
    this.p = p;
    this.d = d;
    this.q = q;
    this.seasonalP = seasonalP;
    this.seasonalD = seasonalD;
    this.seasonalQ = seasonalQ;
    this.season = season;
  }

  Fit fit(double[] y) {
    double[] w = y.clone();
    for (int i = 0; i < d; i++) {
      w = diff(w, 1);
    }
    for (int i = 0; i < seasonalD; i++) {
      w = diff(w, season);
    }
    int lostToDifferencing = y.length - w.length;
    boolean hasMean = d == 0 && seasonalD == 0;
    double mean = 0d;
    if (hasMean) {
      mean = Arrays.stream(w).average().orElse(0d);
    }
    double[] x = new double[w.length];
    for (int i = 0; i < w.length; i++) {
      x[i] = w[i] - mean;
    }

    int arLag = p + season * seasonalP;
    int parameterCount = p + q + seasonalP + seasonalQ;
    int effective = x.length - arLag;
    if (effective <= parameterCount + 1) {
      throw new FittingException(modelName + " needs more observations: " + y.length
          + " points leave " + Math.max(effective, 0) + " usable values after differencing");
    }

    double[] start = new double[parameterCount];
    Arrays.fill(start, INITIAL_COEFFICIENT);
    double[] best = ParameterSearch.minimize(modelName,
        params -> conditionalSumOfSquares(x, params, arLag, null),
        start, -COEFFICIENT_BOUND, COEFFICIENT_BOUND);

    double[] innovations = new double[x.length];
    double css = conditionalSumOfSquares(x, best, arLag, innovations);
    if (!Double.isFinite(css)) {
      throw new FittingException(modelName + " likelihood is not finite for the estimated "
          + "coefficients");
    }
    double sigma2 = css / effective;
    double logLikelihood = -0.5 * effective * (Math.log(2 * Math.PI * sigma2) + 1);
    int k = parameterCount + 1 + (hasMean ? 1 : 0);
    double aic = -2 * logLikelihood + 2 * k;
    double bic = -2 * logLikelihood + k * Math.log(effective);

    double[] fitted = new double[y.length];
    double[] levelResiduals = new double[y.length];
    Arrays.fill(fitted, Double.NaN);
    int firstFitted = lostToDifferencing + arLag;
    for (int i = firstFitted; i < y.length; i++) {
      double e = innovations[i - lostToDifferencing];
      levelResiduals[i] = e;
      fitted[i] = y[i] - e;
    }
    return new Fit(split(best), mean, hasMean, sigma2, logLikelihood, aic, bic, y.clone(),
        fitted, levelResiduals);
  }

  private double conditionalSumOfSquares(double[] x, double[] params, int start,
      double[] innovationsOut) {
    Coefficients c = split(params);
    double[] ar = arPolynomial(c);
    double[] ma = maPolynomial(c);
    double[] e = innovationsOut != null ? innovationsOut : new double[x.length];
    double sum = 0d;
    for (int t = start; t < x.length; t++) {
      double prediction = 0d;
      for (int k = 1; k < ar.length; k++) {
        prediction -= ar[k] * x[t - k];
      }
      for (int j = 1; j < ma.length && t - j >= 0; j++) {
        prediction += ma[j] * e[t - j];
      }
      e[t] = x[t] - prediction;
      sum += e[t] * e[t];
      if (!Double.isFinite(sum)) {
        return Double.POSITIVE_INFINITY;
      }
    }
    return sum;
  }

  private Coefficients split(double[] params) {
    int idx = 0;
    double[] ar = Arrays.copyOfRange(params, idx, idx += p);
    double[] ma = Arrays.copyOfRange(params, idx, idx += q);
    double[] sar = Arrays.copyOfRange(params, idx, idx += seasonalP);
    double[] sma = Arrays.copyOfRange(params, idx, idx + seasonalQ);
    return new Coefficients(ar, ma, sar, sma);
  }

  /** 1 − φ₁B − … multiplied by 1 − Φ₁Bˢ − …, as coefficients of B⁰, B¹, … */
  private double[] arPolynomial(Coefficients c) {
    return multiply(lagPolynomial(c.ar(), 1, -1), lagPolynomial(c.seasonalAr(), season, -1));
  }

  private double[] maPolynomial(Coefficients c) {
    return multiply(lagPolynomial(c.ma(), 1, 1), lagPolynomial(c.seasonalMa(), season, 1));
  }

  private double[] levelArPolynomial(Coefficients c) {
    double[] poly = arPolynomial(c);
    for (int i = 0; i < d; i++) {
      poly = multiply(poly, new double[] {1, -1});
    }
    for (int i = 0; i < seasonalD; i++) {
      double[] seasonalDiff = new double[season + 1];
      seasonalDiff[0] = 1;
      seasonalDiff[season] = -1;
      poly = multiply(poly, seasonalDiff);
    }
    return poly;
  }

  private static double[] lagPolynomial(double[] coefficients, int lag, int sign) {
    double[] poly = new double[coefficients.length * lag + 1];
    poly[0] = 1;
    for (int i = 0; i < coefficients.length; i++) {
      poly[(i + 1) * lag] = sign * coefficients[i];
    }
    return poly;
  }

  private static double[] multiply(double[] a, double[] b) {
    double[] out = new double[a.length + b.length - 1];
    for (int i = 0; i < a.length; i++) {
      if (a[i] == 0d) {
        continue;
      }
      for (int j = 0; j < b.length; j++) {
        out[i + j] += a[i] * b[j];
      }
    }
    return out;
  }

  private static double[] diff(double[] x, int lag) {
    if (lag >= x.length) {
      return new double[0];
    }
    double[] out = new double[x.length - lag];
    for (int i = lag; i < x.length; i++) {
      out[i - lag] = x[i] - x[i - lag];
    }
    return out;
  }

  private record Coefficients(double[] ar, double[] ma, double[] seasonalAr,
      double[] seasonalMa) {}

  final class Fit {
    private final Coefficients coefficients;
    private final double mean;
    private final boolean hasMean;
    private final double sigma2;
    private final double logLikelihood;
    private final double aic;
    private final double bic;
    private final double[] observed;
    private final double[] fitted;
    private final double[] residuals;
    private String intervalSource;

    private Fit(Coefficients coefficients, double mean, boolean hasMean, double sigma2,
        double logLikelihood, double aic, double bic, double[] observed, double[] fitted,
        double[] residuals) {
      this.coefficients = coefficients;
      this.mean = mean;
      this.hasMean = hasMean;
      this.sigma2 = sigma2;
      this.logLikelihood = logLikelihood;
      this.aic = aic;
      this.bic = bic;
      this.observed = observed;
      this.fitted = fitted;
      this.residuals = residuals;
    }

    double[] fittedValues() {
      return fitted.clone();
    }

    double aic() {
      return aic;
    }

    double bic() {
      return bic;
    }

    double logLikelihood() {
      return logLikelihood;
    }

    double sigma2() {
      return sigma2;
    }

    /** How the last forecast interval was produced; {@code null} before the first forecast. */
    String intervalSource() {
      return intervalSource;
    }

    /**
     * Multi-step forecast. Falls back to residual bands when the forecast-error variance is not
     * finite.
     */
    ForecastOutput forecast(int periods, double confidence) {
      double[] levelAr = levelArPolynomial(coefficients);
      double[] ma = maPolynomial(coefficients);
      int n = observed.length;
      double[] z = new double[n + periods];
      double[] e = new double[n + periods];
      for (int i = 0; i < n; i++) {
        z[i] = observed[i] - mean;
        e[i] = residuals[i];
      }
      double[] point = new double[periods];
      for (int t = n; t < n + periods; t++) {
        double value = 0d;
        for (int k = 1; k < levelAr.length && t - k >= 0; k++) {
          value -= levelAr[k] * z[t - k];
        }
        for (int j = 1; j < ma.length && t - j >= 0; j++) {
          value += ma[j] * e[t - j];
        }
        z[t] = value;
        point[t - n] = value + mean;
      }

      double[] psi = new double[periods];
      for (int j = 0; j < periods; j++) {
        double value = j == 0 ? 1d : (j < ma.length ? ma[j] : 0d);
        for (int k = 1; k <= j && k < levelAr.length; k++) {
          value -= levelAr[k] * psi[j - k];
        }
        psi[j] = value;
      }
      double zScore = new NormalDistribution().inverseCumulativeProbability(
          0.5 + confidence / 2);
      double[] lower = new double[periods];
      double[] upper = new double[periods];
      intervalSource = "analytic (psi-weight forecast-error variance)";
      double cumulative = 0d;
      for (int h = 0; h < periods; h++) {
        cumulative += psi[h] * psi[h];
        double se = Math.sqrt(sigma2 * cumulative);
        if (!Double.isFinite(se)) {
          intervalSource = ResidualBands.DESCRIPTION;
          return ResidualBands.around(point, ResidualBands.residualSigma(observed, fitted));
        }
        lower[h] = point[h] - zScore * se;
        upper[h] = point[h] + zScore * se;
      }
      return new ForecastOutput(point, lower, upper);
    }

    /** Coefficients keyed the way ARIMA software conventionally names them. */
    Map<String, Object> parameters() {
      Map<String, Object> out = new LinkedHashMap<>();
      if (hasMean) {
        out.put("const", mean);
      }
      for (int i = 0; i < coefficients.ar().length; i++) {
        out.put("ar.L" + (i + 1), coefficients.ar()[i]);
      }
      for (int i = 0; i < coefficients.ma().length; i++) {
        out.put("ma.L" + (i + 1), coefficients.ma()[i]);
      }
      for (int i = 0; i < coefficients.seasonalAr().length; i++) {
        out.put("ar.S.L" + (season * (i + 1)), coefficients.seasonalAr()[i]);
      }
      for (int i = 0; i < coefficients.seasonalMa().length; i++) {
        out.put("ma.S.L" + (season * (i + 1)), coefficients.seasonalMa()[i]);
      }
      out.put("sigma2", sigma2);
      return out;
    }
  }
}
