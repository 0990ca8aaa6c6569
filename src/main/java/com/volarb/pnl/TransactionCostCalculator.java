package com.volarb.pnl;

import com.volarb.exception.ValidationException;
import lombok.Getter;
import lombok.ToString;

/**
 * Transaction cost model applied to every simulated fill.
 *
 * <p>Cost of a fill is a flat per-trade fee plus a percentage of traded notional:
 * {@code perTradeCost + |quantity * price| * percentageCost}. When costs are disabled every
 * fill is free.
 *
 * <p>Built once per backtest run from the run's parameters and shared by the strategy for
 * entries, exits and hedges.
 */
@Getter
@ToString
public class TransactionCostCalculator {

    public static final TransactionCostCalculator FREE = new TransactionCostCalculator(false, 0.0, 0.0);

    private final boolean enabled;
    private final double perTradeCost;
    private final double percentageCost;

    public TransactionCostCalculator(boolean enabled, double perTradeCost, double percentageCost) {
        if (perTradeCost < 0 || percentageCost < 0) {
            throw new ValidationException(
                    "Transaction costs must be non-negative: perTrade=" + perTradeCost + ", pct=" + percentageCost);
        }
        this.enabled = enabled;
        this.perTradeCost = perTradeCost;
        this.percentageCost = percentageCost;
    }

    /**
     * Cost of a single fill.
     *
     * @param quantity traded quantity, sign ignored
     * @param price    per-unit fill price
     * @return non-negative cost, zero when disabled
     */
    public double calculate(double quantity, double price) {
        if (!enabled) {
            return 0.0;
        }
        return perTradeCost + Math.abs(quantity * price) * percentageCost;
    }
}
