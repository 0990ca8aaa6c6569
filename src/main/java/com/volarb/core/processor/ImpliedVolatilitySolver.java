package com.volarb.core.processor;

import com.volarb.domain.enums.OptionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver with bisection fallback.
 *
 * <p>Inverts {@link BlackScholes#price}. Newton-Raphson uses raw vega as the derivative and
 * converges in a handful of iterations near the money. Deep ITM/OTM contracts, where vega is
 * close to zero and the Newton step oscillates, fall back to bisection over [0.1%, 500%].
 *
 * <p>Unsolvable inputs (non-positive price, spot, strike or time, or a price outside the
 * achievable range) return -1. This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class ImpliedVolatilitySolver {

    private static final double NR_INITIAL_GUESS = 0.25;
    private static final double NR_TOLERANCE = 0.0001;
    private static final int NR_MAX_ITERATIONS = 100;

    private static final double BISECTION_LOWER = 0.001;
    private static final double BISECTION_UPPER = 5.0;
    private static final int BISECTION_MAX_ITERATIONS = 200;

    /**
     * @param S     spot price
     * @param K     strike price
     * @param T     time to expiry in years
     * @param r     risk-free rate as a decimal
     * @param price observed option price
     * @param type  call or put
     * @return implied volatility as a decimal, or -1 if unsolvable
     */
    public double solve(double S, double K, double T, double r, double price, OptionType type) {
        if (price <= 0 || S <= 0 || K <= 0 || T <= 0) {
            return -1;
        }

        Double iv = tryNewtonRaphson(S, K, T, r, price, type);
        if (iv != null) {
            return iv;
        }

        log.debug(
                "Newton-Raphson did not converge for S={}, K={}, T={}, price={}, type={}, falling back to bisection",
                S,
                K,
                T,
                price,
                type);
        return bisection(S, K, T, r, price, type);
    }

    private Double tryNewtonRaphson(double S, double K, double T, double r, double price, OptionType type) {
        double sigma = NR_INITIAL_GUESS;

        for (int i = 0; i < NR_MAX_ITERATIONS; i++) {
            double diff = BlackScholes.price(S, K, T, r, sigma, type) - price;
            if (Math.abs(diff) < NR_TOLERANCE) {
                return sigma;
            }

            double vega = BlackScholes.rawVega(S, K, T, r, sigma);
            if (Math.abs(vega) < 1e-10) {
                return null;
            }

            sigma = sigma - diff / vega;
            // Keep the iterate inside the bisection bracket
            sigma = Math.max(BISECTION_LOWER, Math.min(sigma, BISECTION_UPPER));
        }

        return null;
    }

    private double bisection(double S, double K, double T, double r, double price, OptionType type) {
        double lower = BISECTION_LOWER;
        double upper = BISECTION_UPPER;

        double lowerPrice = BlackScholes.price(S, K, T, r, lower, type);
        double upperPrice = BlackScholes.price(S, K, T, r, upper, type);
        if (price < lowerPrice || price > upperPrice) {
            log.debug("Option price {} outside achievable range [{}, {}]", price, lowerPrice, upperPrice);
            return -1;
        }

        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = BlackScholes.price(S, K, T, r, mid, type);

            if (Math.abs(midPrice - price) < NR_TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }

        return (lower + upper) / 2.0;
    }
}
