package com.volarb.strategy.base;

import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Trade;
import com.volarb.pnl.TransactionCostCalculator;
import com.volarb.portfolio.Portfolio;
import java.util.List;

/**
 * Adjusts a portfolio's risk once per bar by trading the underlying.
 */
public interface HedgingStrategy {

    /**
     * Applies a single hedge adjustment against the given bar, mutating positions and cash.
     *
     * @return the hedge trades executed, empty when no adjustment was needed
     */
    List<Trade> applyHedge(Portfolio portfolio, MarketObservation observation, TransactionCostCalculator costs);

    String getName();

    HedgingStrategy copy();
}
