package com.volarb.backtest;

import com.volarb.exception.ValidationException;
import com.volarb.pnl.TransactionCostCalculator;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inputs of a single backtest run: date range, starting capital, symbols and cost model.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BacktestParameters {

    private LocalDateTime startDate;
    private LocalDateTime endDate;

    @Builder.Default
    private double initialCapital = 100_000.0;

    @Builder.Default
    private List<String> symbols = new ArrayList<>();

    @Builder.Default
    private boolean includeTransactionCosts = true;

    /** Flat fee per executed trade. */
    @Builder.Default
    private double transactionCostPerTrade = 1.0;

    /** Fraction of traded notional, e.g. 0.001 = 10 bps. */
    @Builder.Default
    private double transactionCostPercentage = 0.001;

    /**
     * Checks the run preconditions.
     *
     * @throws ValidationException naming the first violated constraint
     */
    public void validate() {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Start and end dates are required");
        }
        if (!startDate.isBefore(endDate)) {
            throw new ValidationException("Start date must be before end date: " + startDate + " >= " + endDate);
        }
        if (initialCapital <= 0) {
            throw new ValidationException("Initial capital must be positive, got " + initialCapital);
        }
        if (symbols == null || symbols.isEmpty()) {
            throw new ValidationException("At least one symbol is required");
        }
        if (transactionCostPerTrade < 0 || transactionCostPercentage < 0) {
            throw new ValidationException("Transaction costs must be non-negative");
        }
    }

    public TransactionCostCalculator costCalculator() {
        return new TransactionCostCalculator(
                includeTransactionCosts, transactionCostPerTrade, transactionCostPercentage);
    }
}
