package com.volarb.domain.instrument;

import com.volarb.domain.enums.InstrumentType;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import java.util.Map;
import java.util.Optional;

/**
 * A tradeable instrument held by a position: either an {@link Equity} or an {@link Option}.
 *
 * <p>Option-style sensitivities are a capability, not an attribute: {@link #greeks} returns
 * empty for instruments that have none, and portfolio aggregation branches on that instead of
 * on the concrete type.
 */
public sealed interface Instrument permits Equity, Option {

    /** Unique instrument identifier. Equities use the ticker; options encode their terms. */
    String getSymbol();

    /** Symbol whose market observations drive this instrument's price. */
    String getUnderlyingSymbol();

    InstrumentType getType();

    /** Per-unit price against the given bar. */
    double price(MarketObservation observation);

    /** Per-unit sensitivities, or empty when the instrument has no option-style Greeks. */
    Optional<Greeks> greeks(MarketObservation observation);

    /** Named risk figures for display and diagnostics. */
    Map<String, Double> calculateRiskMetrics(MarketObservation observation);

    /** Independent value copy; mutating the copy never affects this instance. */
    Instrument copy();
}
