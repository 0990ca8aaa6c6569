package com.volarb.backtest;

import static com.volarb.reporting.PerformanceMetricsCalculator.ANNUALIZED_RETURN;
import static com.volarb.reporting.PerformanceMetricsCalculator.ANNUALIZED_VOLATILITY;
import static com.volarb.reporting.PerformanceMetricsCalculator.MAX_DRAWDOWN;
import static com.volarb.reporting.PerformanceMetricsCalculator.PROFIT_FACTOR;
import static com.volarb.reporting.PerformanceMetricsCalculator.SHARPE_RATIO;
import static com.volarb.reporting.PerformanceMetricsCalculator.SORTINO_RATIO;
import static com.volarb.reporting.PerformanceMetricsCalculator.TOTAL_RETURN;
import static com.volarb.reporting.PerformanceMetricsCalculator.WIN_RATE;

import com.volarb.domain.model.Trade;
import com.volarb.reporting.PerformanceMetricsCalculator;
import com.volarb.timeseries.TimeSeries;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of a backtest run: the equity curve, the executed trades and the performance
 * metrics derived from them.
 *
 * <p>Metrics are computed on first access and cached. The cache is either {@link Stale} or
 * {@link Computed}; replacing the equity curve or the trades, or adding a trade, moves it
 * back to {@code Stale} so the next read recomputes. Values stored with
 * {@link #setMetric(String, double)} live in the computed cache and are dropped on the next
 * invalidation.
 */
public class BacktestResult {

    /** Drawdown depth that opens a drawdown period. */
    static final double DRAWDOWN_PERIOD_THRESHOLD = 0.01;

    private static final PerformanceMetricsCalculator CALCULATOR = new PerformanceMetricsCalculator();

    sealed interface MetricsCache permits Stale, Computed {}

    record Stale() implements MetricsCache {}

    record Computed(Map<String, Double> metrics) implements MetricsCache {}

    /** A peak-to-recovery interval; {@code end} is the last curve point when never recovered. */
    public record DrawdownPeriod(LocalDateTime start, LocalDateTime end) {}

    private TimeSeries equityCurve;
    private List<Trade> trades;
    private MetricsCache cache = new Stale();

    public BacktestResult() {
        this(new TimeSeries("Equity"), List.of());
    }

    public BacktestResult(TimeSeries equityCurve, List<Trade> trades) {
        this.equityCurve = equityCurve.copy();
        this.trades = new ArrayList<>(trades);
    }

    public TimeSeries getEquityCurve() {
        return equityCurve.copy();
    }

    public void setEquityCurve(TimeSeries equityCurve) {
        this.equityCurve = equityCurve.copy();
        invalidate();
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public void setTrades(List<Trade> trades) {
        this.trades = new ArrayList<>(trades);
        invalidate();
    }

    public void addTrade(Trade trade) {
        trades.add(trade);
        invalidate();
    }

    public int getTradeCount() {
        return trades.size();
    }

    /** True until the metrics are next read. */
    public boolean isStale() {
        return cache instanceof Stale;
    }

    // ---- Metrics ----

    /** Metric value, or 0.0 for an unknown name. */
    public double getMetric(String name) {
        return metrics().getOrDefault(name, 0.0);
    }

    public boolean hasMetric(String name) {
        return metrics().containsKey(name);
    }

    public void setMetric(String name, double value) {
        Map<String, Double> updated = new LinkedHashMap<>(metrics());
        updated.put(name, value);
        cache = new Computed(updated);
    }

    public Map<String, Double> getAllMetrics() {
        return Collections.unmodifiableMap(metrics());
    }

    public double getTotalReturn() {
        return getMetric(TOTAL_RETURN);
    }

    public double getAnnualizedReturn() {
        return getMetric(ANNUALIZED_RETURN);
    }

    public double getAnnualizedVolatility() {
        return getMetric(ANNUALIZED_VOLATILITY);
    }

    public double getSharpeRatio() {
        return getMetric(SHARPE_RATIO);
    }

    public double getSortinoRatio() {
        return getMetric(SORTINO_RATIO);
    }

    public double getMaxDrawdown() {
        return getMetric(MAX_DRAWDOWN);
    }

    public double getWinRate() {
        return getMetric(WIN_RATE);
    }

    public double getProfitFactor() {
        return getMetric(PROFIT_FACTOR);
    }

    private Map<String, Double> metrics() {
        if (cache instanceof Computed computed) {
            return computed.metrics();
        }
        Map<String, Double> metrics = CALCULATOR.calculate(equityCurve, trades);
        cache = new Computed(metrics);
        return metrics;
    }

    private void invalidate() {
        cache = new Stale();
    }

    // ---- Analytics ----

    /** Drawdown from the running peak at each point, as a non-positive fraction. */
    public TimeSeries getDrawdownSeries() {
        TimeSeries drawdowns = new TimeSeries("Drawdown");
        if (equityCurve.isEmpty()) {
            return drawdowns;
        }
        double peak = equityCurve.firstValue();
        for (Map.Entry<LocalDateTime, Double> point : equityCurve.entries()) {
            double value = point.getValue();
            peak = Math.max(peak, value);
            double drawdown = (peak - value) / peak;
            drawdowns.put(point.getKey(), drawdown == 0.0 ? 0.0 : -drawdown);
        }
        return drawdowns;
    }

    /**
     * Intervals during which the curve sat more than 1% under its running peak, from the first
     * point past the threshold to the point of full recovery.
     */
    public List<DrawdownPeriod> getDrawdownPeriods() {
        List<DrawdownPeriod> periods = new ArrayList<>();
        TimeSeries drawdowns = getDrawdownSeries();
        LocalDateTime start = null;
        for (Map.Entry<LocalDateTime, Double> point : drawdowns.entries()) {
            double drawdown = point.getValue();
            if (start == null && drawdown < -DRAWDOWN_PERIOD_THRESHOLD) {
                start = point.getKey();
            } else if (start != null && drawdown >= 0.0) {
                periods.add(new DrawdownPeriod(start, point.getKey()));
                start = null;
            }
        }
        if (start != null) {
            periods.add(new DrawdownPeriod(start, drawdowns.lastTimestamp()));
        }
        return periods;
    }

    /** Sum of step returns per calendar month. */
    public Map<YearMonth, Double> getReturnsByMonth() {
        Map<YearMonth, Double> monthly = new TreeMap<>();
        if (equityCurve.size() < 2) {
            return monthly;
        }
        TimeSeries returns = equityCurve.pctChange();
        for (Map.Entry<LocalDateTime, Double> step : returns.entries()) {
            monthly.merge(YearMonth.from(step.getKey()), step.getValue(), Double::sum);
        }
        return monthly;
    }

    /** Sum of step returns per calendar year. */
    public Map<Integer, Double> getReturnsByYear() {
        Map<Integer, Double> yearly = new TreeMap<>();
        if (equityCurve.size() < 2) {
            return yearly;
        }
        TimeSeries returns = equityCurve.pctChange();
        for (Map.Entry<LocalDateTime, Double> step : returns.entries()) {
            yearly.merge(step.getKey().getYear(), step.getValue(), Double::sum);
        }
        return yearly;
    }

    public String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Backtest Results Summary ===\n");
        sb.append(String.format(Locale.ROOT, "Total Return: %.4f%%%n", getTotalReturn() * 100));
        sb.append(String.format(Locale.ROOT, "Annualized Return: %.4f%%%n", getAnnualizedReturn() * 100));
        sb.append(String.format(Locale.ROOT, "Annualized Volatility: %.4f%%%n", getAnnualizedVolatility() * 100));
        sb.append(String.format(Locale.ROOT, "Sharpe Ratio: %.4f%n", getSharpeRatio()));
        sb.append(String.format(Locale.ROOT, "Sortino Ratio: %.4f%n", getSortinoRatio()));
        sb.append(String.format(Locale.ROOT, "Max Drawdown: %.4f%%%n", getMaxDrawdown() * 100));
        sb.append(String.format(Locale.ROOT, "Win Rate: %.4f%%%n", getWinRate() * 100));
        sb.append(String.format(Locale.ROOT, "Profit Factor: %.4f%n", getProfitFactor()));
        sb.append("Total Trades: ").append(getTradeCount()).append('\n');
        return sb.toString();
    }
}
