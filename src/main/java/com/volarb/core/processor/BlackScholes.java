package com.volarb.core.processor;

import com.volarb.domain.enums.OptionType;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Closed-form Black-Scholes-Merton formulas for European options (no dividend yield).
 *
 * <p>This is the single formula set behind both the instruments' own pricing and
 * {@link BsmPricingModel}. Keep every price and Greek derivation here so the two paths can
 * never drift apart.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * N(d1) - K * e^(-rT) * N(d2); Put: K * e^(-rT) * N(-d2) - S * N(-d1)
 *   <li>Delta: N(d1) for calls, N(d1) - 1 for puts
 *   <li>Gamma: n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * n(d1) * sqrt(T) / 100 (per 1% vol change)
 *   <li>Theta: [-S * n(d1) * sigma / (2 * sqrt(T)) -/+ r * K * e^(-rT) * N(+/-d2)] / 365
 *   <li>Rho: +/- K * T * e^(-rT) * N(+/-d2) / 100
 * </ul>
 *
 * <p>Boundaries: T <= 0 prices at intrinsic value with all Greeks zero; sigma <= 0 prices at
 * discounted intrinsic value with all Greeks zero.
 */
public final class BlackScholes {

    public static final double DEFAULT_RISK_FREE_RATE = 0.05;
    public static final double DEFAULT_VOLATILITY = 0.20;

    /** Quoted implied volatilities above 300% are treated as bad data. */
    public static final double MAX_IMPLIED_VOLATILITY = 3.0;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private BlackScholes() {}

    public static double price(double S, double K, double T, double r, double sigma, OptionType type) {
        if (T <= 0) {
            return intrinsicValue(S, K, type);
        }
        double discountedStrike = K * Math.exp(-r * T);
        if (sigma <= 0) {
            return type == OptionType.CALL
                    ? Math.max(0.0, S - discountedStrike)
                    : Math.max(0.0, discountedStrike - S);
        }

        double d1 = d1(S, K, T, r, sigma);
        double d2 = d1 - sigma * Math.sqrt(T);

        if (type == OptionType.CALL) {
            return S * NORM.cumulativeProbability(d1) - discountedStrike * NORM.cumulativeProbability(d2);
        }
        return discountedStrike * NORM.cumulativeProbability(-d2) - S * NORM.cumulativeProbability(-d1);
    }

    public static Greeks greeks(double S, double K, double T, double r, double sigma, OptionType type) {
        if (T <= 0 || sigma <= 0 || S <= 0) {
            return Greeks.ZERO;
        }

        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, r, sigma);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = NORM.density(d1);
        double expRT = Math.exp(-r * T);
        double decay = -S * nd1 * sigma / (2.0 * sqrtT);

        double delta;
        double theta;
        double rho;
        if (type == OptionType.CALL) {
            double Nd2 = NORM.cumulativeProbability(d2);
            delta = NORM.cumulativeProbability(d1);
            theta = (decay - r * K * expRT * Nd2) / 365.0;
            rho = K * T * expRT * Nd2 / 100.0;
        } else {
            double NminusD2 = NORM.cumulativeProbability(-d2);
            delta = NORM.cumulativeProbability(d1) - 1.0;
            theta = (decay + r * K * expRT * NminusD2) / 365.0;
            rho = -K * T * expRT * NminusD2 / 100.0;
        }

        return Greeks.builder()
                .delta(delta)
                .gamma(nd1 / (S * sigma * sqrtT))
                .vega(S * nd1 * sqrtT / 100.0)
                .theta(theta)
                .rho(rho)
                .build();
    }

    public static double intrinsicValue(double S, double K, OptionType type) {
        return type == OptionType.CALL ? Math.max(0.0, S - K) : Math.max(0.0, K - S);
    }

    public static double d1(double S, double K, double T, double r, double sigma) {
        return (Math.log(S / K) + (r + sigma * sigma / 2.0) * T) / (sigma * Math.sqrt(T));
    }

    /** Vega per unit of volatility (not divided by 100). Used as the Newton step derivative. */
    static double rawVega(double S, double K, double T, double r, double sigma) {
        return S * NORM.density(d1(S, K, T, r, sigma)) * Math.sqrt(T);
    }

    /**
     * Market-quoted implied volatility when present and within (0, 3.0], otherwise the 20%
     * default.
     */
    public static double resolveVolatility(MarketObservation observation) {
        if (observation.hasAuxiliary(MarketObservation.IMPLIED_VOLATILITY)) {
            double impliedVol = observation.getAuxiliary(MarketObservation.IMPLIED_VOLATILITY);
            if (impliedVol > 0.0 && impliedVol <= MAX_IMPLIED_VOLATILITY) {
                return impliedVol;
            }
        }
        return DEFAULT_VOLATILITY;
    }

    /** Observation-supplied risk-free rate when present, otherwise 5%. */
    public static double resolveRiskFreeRate(MarketObservation observation) {
        return observation.findAuxiliary(MarketObservation.RISK_FREE_RATE).orElse(DEFAULT_RISK_FREE_RATE);
    }
}
