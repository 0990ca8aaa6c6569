package com.volarb.reporting;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Serializable summary of one backtest run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestReport {

    private String strategyName;
    private List<String> symbols;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private double initialCapital;
    private double finalValue;
    private int tradeCount;
    private Map<String, Double> metrics;
    private List<EquityPoint> equityCurve;
    private List<TradeRecord> trades;

    /** One point of the equity curve. */
    public record EquityPoint(LocalDateTime timestamp, double value) {}

    /** One executed trade, flattened for export. */
    public record TradeRecord(
            LocalDateTime timestamp,
            String instrumentId,
            String action,
            double quantity,
            double price,
            double transactionCost,
            double netValue) {}
}
