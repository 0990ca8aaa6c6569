package com.volarb.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-unit option sensitivities from the Black-Scholes-Merton formulas.
 *
 * <p>Scaling conventions: vega is per 1% volatility move, theta is per calendar day and rho
 * is per 1% rate move. Delta and gamma are unscaled.
 */
@Value
@Builder(toBuilder = true)
public class Greeks {

    /** Price sensitivity to the underlying. Range: -1 (deep ITM put) to +1 (deep ITM call). */
    double delta;

    /** Rate of change of delta. Identical for calls and puts. */
    double gamma;

    /** Sensitivity to a 1% change in volatility. */
    double vega;

    /** Time decay per day. Negative for long options in most regimes. */
    double theta;

    /** Sensitivity to a 1% change in the risk-free rate. */
    double rho;

    /** Expired options, zero-volatility inputs and non-option instruments report this. */
    public static final Greeks ZERO = new Greeks(0.0, 0.0, 0.0, 0.0, 0.0);

    /** Scales every sensitivity by a signed position quantity. */
    public Greeks times(double quantity) {
        return new Greeks(delta * quantity, gamma * quantity, vega * quantity, theta * quantity, rho * quantity);
    }

    public Greeks plus(Greeks other) {
        return new Greeks(
                delta + other.delta,
                gamma + other.gamma,
                vega + other.vega,
                theta + other.theta,
                rho + other.rho);
    }
}
