package com.volarb.core.processor;

import com.volarb.domain.instrument.Option;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;

/**
 * Model-driven option valuation, usable in place of an instrument's own pricing.
 */
public interface PricingModel {

    double price(Option option, MarketObservation observation);

    Greeks calculateGreeks(Option option, MarketObservation observation);

    /**
     * Volatility that reproduces {@code marketPrice} under this model, or a negative value when
     * no volatility in the solver's range does.
     */
    double impliedVolatility(Option option, MarketObservation observation, double marketPrice);

    String getModelName();

    PricingModel copy();
}
