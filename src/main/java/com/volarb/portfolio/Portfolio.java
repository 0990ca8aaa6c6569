package com.volarb.portfolio;

import com.volarb.domain.instrument.Instrument;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.MarketSnapshot;
import com.volarb.domain.model.Position;
import com.volarb.exception.IndexOutOfRangeException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import lombok.Getter;

/**
 * Ordered book of positions plus a cash balance.
 *
 * <p>Total value is always {@code cash + sum(position value)}. No margin or short-borrow
 * constraint is enforced: cash is adjusted without sign checks and may go negative.
 *
 * <p>Greeks aggregation (delta, gamma, vega, theta) against an observation covers positions
 * whose underlying is the observation's symbol. Instruments with option Greeks contribute
 * {@code quantity * greek}; instruments without them (equities) contribute {@code quantity}
 * to delta and nothing else.
 */
public class Portfolio {

    private final List<Position> positions = new ArrayList<>();

    @Getter
    private double cash;

    public Portfolio(double initialCash) {
        this.cash = initialCash;
    }

    public void addPosition(Position position) {
        positions.add(position);
    }

    /** Removes and returns the position at {@code index}. */
    public Position removePosition(int index) {
        checkIndex(index);
        return positions.remove(index);
    }

    public void updatePosition(int index, double newQuantity) {
        checkIndex(index);
        positions.get(index).setQuantity(newQuantity);
    }

    public Position getPosition(int index) {
        checkIndex(index);
        return positions.get(index);
    }

    public int getPositionCount() {
        return positions.size();
    }

    public List<Position> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    /** Index of the first position matching {@code filter}, in insertion order. */
    public OptionalInt findPositionIndex(Predicate<Position> filter) {
        return IntStream.range(0, positions.size())
                .filter(i -> filter.test(positions.get(i)))
                .findFirst();
    }

    public void addCash(double amount) {
        cash += amount;
    }

    public void removeCash(double amount) {
        cash -= amount;
    }

    /** Cash plus every position priced against {@code observation}. */
    public double getTotalValue(MarketObservation observation) {
        double totalValue = cash;
        for (Position position : positions) {
            totalValue += position.getValue(observation);
        }
        return totalValue;
    }

    /** Cash plus every position priced against the latest observation of its own underlying. */
    public double getTotalValue(MarketSnapshot snapshot) {
        double totalValue = cash;
        for (Position position : positions) {
            totalValue += position.getValue(snapshot.get(position.getInstrument().getUnderlyingSymbol()));
        }
        return totalValue;
    }

    public double getTotalPnL(MarketObservation observation) {
        double totalPnL = 0.0;
        for (Position position : positions) {
            totalPnL += position.getPnL(observation);
        }
        return totalPnL;
    }

    public double calculateDelta(MarketObservation observation) {
        return calculateGreeks(observation).getDelta();
    }

    public double calculateGamma(MarketObservation observation) {
        return calculateGreeks(observation).getGamma();
    }

    public double calculateVega(MarketObservation observation) {
        return calculateGreeks(observation).getVega();
    }

    public double calculateTheta(MarketObservation observation) {
        return calculateGreeks(observation).getTheta();
    }

    /** Position-weighted sum of Greeks over positions on the observation's symbol. */
    public Greeks calculateGreeks(MarketObservation observation) {
        Greeks total = Greeks.ZERO;
        for (Position position : positions) {
            Instrument instrument = position.getInstrument();
            if (!instrument.getUnderlyingSymbol().equals(observation.getSymbol())) {
                continue;
            }
            double quantity = position.getQuantity();
            Greeks contribution = instrument.greeks(observation)
                    .map(greeks -> greeks.times(quantity))
                    .orElseGet(() -> Greeks.ZERO.toBuilder().delta(quantity).build());
            total = total.plus(contribution);
        }
        return total;
    }

    /** Deep copy: positions and their instruments are copied. */
    public Portfolio copy() {
        Portfolio copy = new Portfolio(cash);
        for (Position position : positions) {
            copy.positions.add(position.copy());
        }
        return copy;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= positions.size()) {
            throw new IndexOutOfRangeException("Position", index, positions.size());
        }
    }
}
