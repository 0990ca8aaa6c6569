package com.volarb.domain.model;

import com.volarb.domain.instrument.Instrument;
import com.volarb.exception.KeyNotFoundException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A holding of one instrument in a backtest portfolio.
 *
 * <p>Quantity is signed: positive = long, negative = short. Entry price and date are fixed at
 * creation. The position owns its instrument; {@link #copy()} copies both.
 *
 * <p>Metadata is free-form strategy bookkeeping (signal strength, hedge markers).
 */
@Getter
@ToString
public class Position {

    private final Instrument instrument;

    @Setter
    private double quantity;

    private final double entryPrice;
    private final LocalDateTime entryDate;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Double> metadata = new HashMap<>();

    public Position(Instrument instrument, double quantity, double entryPrice, LocalDateTime entryDate) {
        this.instrument = instrument;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.entryDate = entryDate;
    }

    /** Signed mark-to-market value: {@code quantity * price}. */
    public double getValue(MarketObservation observation) {
        return quantity * instrument.price(observation);
    }

    /** Unrealized P&L against the entry price. */
    public double getPnL(MarketObservation observation) {
        return quantity * (instrument.price(observation) - entryPrice);
    }

    public boolean isLong() {
        return quantity > 0;
    }

    public void setMetadata(String key, double value) {
        metadata.put(key, value);
    }

    public double getMetadata(String key) {
        Double value = metadata.get(key);
        if (value == null) {
            throw new KeyNotFoundException("Position metadata", key);
        }
        return value;
    }

    public boolean hasMetadata(String key) {
        return metadata.containsKey(key);
    }

    public Map<String, Double> getAllMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Position copy() {
        Position copy = new Position(instrument.copy(), quantity, entryPrice, entryDate);
        copy.metadata.putAll(metadata);
        return copy;
    }
}
