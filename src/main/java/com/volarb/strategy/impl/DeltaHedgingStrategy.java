package com.volarb.strategy.impl;

import com.volarb.domain.enums.TradeAction;
import com.volarb.domain.instrument.Equity;
import com.volarb.domain.instrument.InstrumentFactory;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Position;
import com.volarb.domain.model.Trade;
import com.volarb.exception.ValidationException;
import com.volarb.pnl.TransactionCostCalculator;
import com.volarb.portfolio.Portfolio;
import com.volarb.strategy.base.HedgingStrategy;
import java.util.List;
import java.util.OptionalInt;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot proportional delta hedge in the underlying equity.
 *
 * <p>On each call, if {@code |portfolioDelta - targetDelta| > tolerance}, trades
 * {@code -(portfolioDelta - targetDelta)} shares of the bar's symbol at the close. An existing
 * equity position on that symbol is resized (and removed once its size falls under
 * {@value #MIN_HEDGE_QUANTITY}); otherwise a new hedge position is opened.
 */
@Slf4j
@Getter
public class DeltaHedgingStrategy implements HedgingStrategy {

    public static final String IS_HEDGE = "is_hedge";
    public static final String TARGET_DELTA = "target_delta";

    static final double MIN_HEDGE_QUANTITY = 1e-6;

    private final double targetDelta;
    private final double tolerance;

    public DeltaHedgingStrategy(double targetDelta, double tolerance) {
        if (tolerance < 0) {
            throw new ValidationException("Hedge tolerance must be non-negative, got " + tolerance);
        }
        this.targetDelta = targetDelta;
        this.tolerance = tolerance;
    }

    @Override
    public List<Trade> applyHedge(
            Portfolio portfolio, MarketObservation observation, TransactionCostCalculator costs) {
        double currentDelta = portfolio.calculateDelta(observation);
        double deltaGap = currentDelta - targetDelta;
        if (Math.abs(deltaGap) <= tolerance) {
            return List.of();
        }

        String symbol = observation.getSymbol();
        double hedgeQuantity = -deltaGap;
        double price = observation.getClose();

        OptionalInt existing = portfolio.findPositionIndex(
                p -> p.getInstrument() instanceof Equity equity && equity.getSymbol().equals(symbol));
        if (existing.isPresent()) {
            int index = existing.getAsInt();
            double newQuantity = portfolio.getPosition(index).getQuantity() + hedgeQuantity;
            if (Math.abs(newQuantity) < MIN_HEDGE_QUANTITY) {
                portfolio.removePosition(index);
            } else {
                portfolio.updatePosition(index, newQuantity);
            }
        } else {
            Position hedge =
                    new Position(InstrumentFactory.createEquity(symbol), hedgeQuantity, price, observation.getTimestamp());
            hedge.setMetadata(IS_HEDGE, 1.0);
            hedge.setMetadata(TARGET_DELTA, targetDelta);
            portfolio.addPosition(hedge);
        }

        double cost = costs.calculate(hedgeQuantity, price);
        portfolio.removeCash(hedgeQuantity * price + cost);

        log.debug(
                "Delta hedge on {}: delta={} target={} traded {} @ {}",
                symbol,
                currentDelta,
                targetDelta,
                hedgeQuantity,
                price);

        return List.of(Trade.builder()
                .instrumentId(symbol)
                .action(TradeAction.forQuantityChange(hedgeQuantity))
                .quantity(Math.abs(hedgeQuantity))
                .price(price)
                .timestamp(observation.getTimestamp())
                .transactionCost(cost)
                .build());
    }

    @Override
    public String getName() {
        return "DeltaHedging";
    }

    @Override
    public DeltaHedgingStrategy copy() {
        return new DeltaHedgingStrategy(targetDelta, tolerance);
    }
}
