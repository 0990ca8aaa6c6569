package com.volarb.domain.model;

import com.volarb.domain.enums.TradeAction;
import com.volarb.exception.ValidationException;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * An executed fill reported by a strategy during a backtest.
 *
 * <p>Quantity is always positive; direction is carried by {@link #action}. Net value is the
 * signed cash impact: negative (outflow) for BUY, positive (inflow) for SELL, net of the
 * transaction cost in both cases.
 */
@Value
public class Trade implements Comparable<Trade> {

    String instrumentId;
    TradeAction action;
    double quantity;
    double price;
    LocalDateTime timestamp;
    double transactionCost;

    @Builder(toBuilder = true)
    private Trade(
            String instrumentId,
            TradeAction action,
            double quantity,
            double price,
            LocalDateTime timestamp,
            double transactionCost) {
        if (quantity <= 0) {
            throw new ValidationException("Trade quantity must be positive, got " + quantity);
        }
        if (transactionCost < 0) {
            throw new ValidationException("Transaction cost cannot be negative, got " + transactionCost);
        }
        this.instrumentId = instrumentId;
        this.action = action;
        this.quantity = quantity;
        this.price = price;
        this.timestamp = timestamp;
        this.transactionCost = transactionCost;
    }

    /** Gross traded value, before costs. */
    public double getValue() {
        return quantity * price;
    }

    public double getNetValue() {
        double value = getValue();
        if (action == TradeAction.BUY) {
            return -(value + transactionCost);
        }
        return value - transactionCost;
    }

    @Override
    public int compareTo(Trade other) {
        return timestamp.compareTo(other.timestamp);
    }

    @Override
    public String toString() {
        return String.format(
                "%s %s %s %s @ %.4f (cost: %.2f)", timestamp, action, quantity, instrumentId, price, transactionCost);
    }
}
