package com.volarb.volatility;

import com.volarb.timeseries.TimeSeries;
import java.util.Map;

/**
 * Conditional volatility model: calibrated once against a return series, then queried for
 * forecasts at arbitrary horizons.
 */
public interface VolatilityModel {

    void calibrate(TimeSeries returns);

    /** Forecast standard deviation (same periodicity as the calibration returns) h steps ahead. */
    double forecast(int horizon);

    /** Forecasts for horizons 1..h, one business day apart. */
    TimeSeries forecastSeries(int horizon);

    /** Filters one new return through the calibrated model; returns the updated variance. */
    double update(double lastReturn);

    boolean isCalibrated();

    String getModelName();

    Map<String, Double> getParameters();

    VolatilityModel copy();
}
