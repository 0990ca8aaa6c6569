package com.volarb.core.processor;

import com.volarb.domain.enums.ExerciseStyle;
import com.volarb.domain.instrument.Option;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes-Merton pricing model. Stateless; delegates every formula to
 * {@link BlackScholes} so results match {@link Option#price} exactly.
 */
@Component
public class BsmPricingModel implements PricingModel {

    private final ImpliedVolatilitySolver impliedVolatilitySolver;

    public BsmPricingModel(ImpliedVolatilitySolver impliedVolatilitySolver) {
        this.impliedVolatilitySolver = impliedVolatilitySolver;
    }

    @Override
    public double price(Option option, MarketObservation observation) {
        double S = observation.getClose();
        double K = option.getStrike();
        double T = option.timeToExpiry(observation.getTimestamp());
        double r = BlackScholes.resolveRiskFreeRate(observation);
        double sigma = BlackScholes.resolveVolatility(observation);

        double europeanPrice = BlackScholes.price(S, K, T, r, sigma, option.getOptionType());
        if (option.getExerciseStyle() == ExerciseStyle.AMERICAN) {
            return Math.max(europeanPrice, BlackScholes.intrinsicValue(S, K, option.getOptionType()));
        }
        return europeanPrice;
    }

    @Override
    public Greeks calculateGreeks(Option option, MarketObservation observation) {
        return BlackScholes.greeks(
                observation.getClose(),
                option.getStrike(),
                option.timeToExpiry(observation.getTimestamp()),
                BlackScholes.resolveRiskFreeRate(observation),
                BlackScholes.resolveVolatility(observation),
                option.getOptionType());
    }

    @Override
    public double impliedVolatility(Option option, MarketObservation observation, double marketPrice) {
        return impliedVolatilitySolver.solve(
                observation.getClose(),
                option.getStrike(),
                option.timeToExpiry(observation.getTimestamp()),
                BlackScholes.resolveRiskFreeRate(observation),
                marketPrice,
                option.getOptionType());
    }

    @Override
    public String getModelName() {
        return "Black-Scholes-Merton";
    }

    @Override
    public BsmPricingModel copy() {
        return new BsmPricingModel(impliedVolatilitySolver);
    }
}
