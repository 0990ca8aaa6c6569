package com.volarb.volatility;

import com.volarb.exception.InsufficientDataException;
import com.volarb.exception.ModelNotCalibratedException;
import com.volarb.exception.ValidationException;
import com.volarb.timeseries.TimeSeries;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * GARCH(1,1) conditional variance model.
 *
 * <p>Variance recursion: {@code sigma2[t] = omega + alpha * r[t-1]^2 + beta * sigma2[t-1]}.
 * The h-step forecast mean-reverts to the long-run variance at rate {@code (alpha + beta)^h}:
 * {@code sqrt(longRun + (alpha + beta)^h * (last - longRun))}.
 *
 * <p>Calibration is moment matching, not maximum likelihood: omega is set to 10% of the sample
 * variance with alpha = 0.1 and beta = 0.8, which puts the long-run variance at the sample
 * variance. The log-likelihood of the calibration sample is cached for AIC/BIC.
 *
 * <p>Lifecycle is one-way: uncalibrated until {@link #calibrate} succeeds. Re-calibrating
 * overwrites all state.
 */
@Slf4j
@Getter
public class GarchModel implements VolatilityModel {

    public static final int MIN_CALIBRATION_OBSERVATIONS = 10;

    private static final int NUM_PARAMETERS = 3;

    private double omega;
    private double alpha;
    private double beta;
    private double lastVariance;
    private double longRunVariance;
    private boolean calibrated;
    private double cachedLogLikelihood;

    /** Number of returns in the last calibration sample; zero before calibration. */
    private int sampleSize;

    /** Timestamp of the last calibration return; anchors {@link #forecastSeries}. */
    private LocalDateTime lastObservationTime;

    /** Uninitialized model with all parameters at zero. Must be calibrated before use. */
    public GarchModel() {}

    /**
     * Seeds the model with explicit parameters. The model is still uncalibrated.
     *
     * @throws ValidationException if omega < 0, alpha or beta outside [0, 1), or alpha + beta >= 1
     */
    public GarchModel(double omega, double alpha, double beta) {
        validateParameters(omega, alpha, beta);
        this.omega = omega;
        this.alpha = alpha;
        this.beta = beta;
        this.longRunVariance = omega / (1.0 - alpha - beta);
    }

    @Override
    public void calibrate(TimeSeries returns) {
        if (returns.size() < MIN_CALIBRATION_OBSERVATIONS) {
            throw new InsufficientDataException(MIN_CALIBRATION_OBSERVATIONS, returns.size(), "GARCH calibration");
        }

        double variance = returns.variance();

        omega = variance * 0.1;
        alpha = 0.1;
        beta = 0.8;
        if (alpha + beta >= 1.0) {
            alpha = 0.05;
            beta = 0.9;
        }

        longRunVariance = omega / (1.0 - alpha - beta);
        lastVariance = longRunVariance;
        sampleSize = returns.size();
        lastObservationTime = returns.lastTimestamp();
        calibrated = true;
        cachedLogLikelihood = logLikelihood(returns);

        log.debug(
                "GARCH calibrated on {} returns: omega={}, alpha={}, beta={}, longRunVariance={}, logLikelihood={}",
                sampleSize,
                omega,
                alpha,
                beta,
                longRunVariance,
                cachedLogLikelihood);
    }

    @Override
    public double forecast(int horizon) {
        requireCalibrated();
        if (horizon <= 0) {
            throw new ValidationException("Forecast horizon must be positive, got " + horizon);
        }
        double persistence = alpha + beta;
        double variance = longRunVariance + Math.pow(persistence, horizon) * (lastVariance - longRunVariance);
        return Math.sqrt(variance);
    }

    @Override
    public TimeSeries forecastSeries(int horizon) {
        requireCalibrated();
        LocalDateTime anchor = lastObservationTime != null ? lastObservationTime : LocalDateTime.now();
        return forecastSeries(horizon, anchor);
    }

    /** Forecasts for horizons 1..h stamped on the business days following {@code anchor}. */
    public TimeSeries forecastSeries(int horizon, LocalDateTime anchor) {
        requireCalibrated();
        TimeSeries series = new TimeSeries("GARCH_Forecast");
        LocalDateTime timestamp = anchor;
        for (int h = 1; h <= horizon; h++) {
            timestamp = nextBusinessDay(timestamp);
            series.put(timestamp, forecast(h));
        }
        return series;
    }

    /**
     * Advances the conditional variance by one step with an observed return. Use to filter new
     * returns through a calibrated model without re-estimating its parameters.
     */
    @Override
    public double update(double lastReturn) {
        requireCalibrated();
        lastVariance = nextVariance(lastVariance, lastReturn);
        return lastVariance;
    }

    /**
     * Gaussian log-likelihood of {@code returns} under the current parameters. The recursion
     * starts at the long-run variance; steps with non-positive variance contribute nothing.
     */
    public double logLikelihood(TimeSeries returns) {
        if (!calibrated && omega == 0.0 && alpha == 0.0 && beta == 0.0) {
            return Double.NEGATIVE_INFINITY;
        }
        List<Double> values = returns.getValues();
        if (values.isEmpty()) {
            return Double.NEGATIVE_INFINITY;
        }

        double logLikelihood = 0.0;
        double variance = longRunVariance;
        for (int i = 1; i < values.size(); i++) {
            variance = nextVariance(variance, values.get(i - 1));
            if (variance > 0.0) {
                double r = values.get(i);
                logLikelihood += -0.5 * (Math.log(2.0 * Math.PI) + Math.log(variance) + (r * r) / variance);
            }
        }
        return logLikelihood;
    }

    public double calculateAIC() {
        if (!calibrated) {
            return Double.POSITIVE_INFINITY;
        }
        return -2.0 * cachedLogLikelihood + 2.0 * NUM_PARAMETERS;
    }

    /** BIC over the actual calibration sample size. */
    public double calculateBIC() {
        if (!calibrated) {
            return Double.POSITIVE_INFINITY;
        }
        return -2.0 * cachedLogLikelihood + NUM_PARAMETERS * Math.log(sampleSize);
    }

    public boolean isStationary() {
        return alpha + beta < 1.0;
    }

    @Override
    public boolean isCalibrated() {
        return calibrated;
    }

    @Override
    public String getModelName() {
        return "GARCH(1,1)";
    }

    @Override
    public Map<String, Double> getParameters() {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("omega", omega);
        params.put("alpha", alpha);
        params.put("beta", beta);
        params.put("long_run_variance", longRunVariance);
        params.put("last_variance", lastVariance);
        return params;
    }

    @Override
    public GarchModel copy() {
        GarchModel copy = new GarchModel();
        copy.omega = omega;
        copy.alpha = alpha;
        copy.beta = beta;
        copy.lastVariance = lastVariance;
        copy.longRunVariance = longRunVariance;
        copy.calibrated = calibrated;
        copy.cachedLogLikelihood = cachedLogLikelihood;
        copy.sampleSize = sampleSize;
        copy.lastObservationTime = lastObservationTime;
        return copy;
    }

    static void validateParameters(double omega, double alpha, double beta) {
        if (omega < 0.0) {
            throw new ValidationException("Omega must be non-negative, got " + omega);
        }
        if (alpha < 0.0 || alpha >= 1.0) {
            throw new ValidationException("Alpha must be in [0, 1), got " + alpha);
        }
        if (beta < 0.0 || beta >= 1.0) {
            throw new ValidationException("Beta must be in [0, 1), got " + beta);
        }
        if (alpha + beta >= 1.0) {
            throw new ValidationException(
                    "Alpha + beta must be less than 1 for stationarity", Map.of("alpha", alpha, "beta", beta));
        }
    }

    private double nextVariance(double previousVariance, double previousReturn) {
        return omega + alpha * previousReturn * previousReturn + beta * previousVariance;
    }

    private void requireCalibrated() {
        if (!calibrated) {
            throw new ModelNotCalibratedException(getModelName());
        }
    }

    private static LocalDateTime nextBusinessDay(LocalDateTime from) {
        LocalDateTime next = from.plusDays(1);
        while (next.getDayOfWeek() == DayOfWeek.SATURDAY || next.getDayOfWeek() == DayOfWeek.SUNDAY) {
            next = next.plusDays(1);
        }
        return next;
    }
}
