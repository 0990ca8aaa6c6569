package com.volarb.strategy.base;

import com.volarb.backtest.BacktestParameters;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Trade;
import com.volarb.portfolio.Portfolio;
import java.util.List;

/**
 * Contract for bar-driven strategies run by the backtest engine.
 *
 * <p>The engine copies the caller's strategy, calls {@link #initialize} once, then feeds every
 * observation of the simulation clock through {@link #processBar} in timestamp order. A strategy
 * owns its portfolio and every sub-component it uses; {@link #copy()} must copy all of them so
 * independent runs never share mutable state.
 */
public interface TradingStrategy {

    String getName();

    /** Resets the portfolio to the run's initial capital and clears all per-run state. */
    void initialize(BacktestParameters parameters);

    /**
     * Processes one bar.
     *
     * @return trades executed on this bar (exits, entries, hedges), in execution order
     */
    List<Trade> processBar(MarketObservation observation);

    Portfolio getPortfolio();

    TradingStrategy copy();
}
