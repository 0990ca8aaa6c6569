package com.volarb.strategy.base;

import com.volarb.domain.instrument.Instrument;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Signal;
import com.volarb.volatility.VolatilityModel;

/** Turns a candidate instrument, a volatility view and the current bar into a trade signal. */
public interface SignalGenerator {

    Signal generateSignal(Instrument instrument, VolatilityModel volatilityModel, MarketObservation observation);

    String getName();

    SignalGenerator copy();
}
