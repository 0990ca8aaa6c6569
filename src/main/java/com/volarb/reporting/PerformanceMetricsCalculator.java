package com.volarb.reporting;

import com.volarb.domain.model.Trade;
import com.volarb.timeseries.TimeSeries;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Computes the performance metrics of a backtest from its equity curve and trade log.
 *
 * <p>Return-based metrics use the per-step percentage changes of the equity curve and
 * assume daily steps (252 per year). Trade-based metrics use each trade's net cash value.
 * Every metric is defined for degenerate inputs: an empty or single-point curve or an empty
 * trade log yields 0.
 */
public class PerformanceMetricsCalculator {

    public static final String TOTAL_RETURN = "total_return";
    public static final String ANNUALIZED_RETURN = "annualized_return";
    public static final String ANNUALIZED_VOLATILITY = "annualized_volatility";
    public static final String SHARPE_RATIO = "sharpe_ratio";
    public static final String SORTINO_RATIO = "sortino_ratio";
    public static final String MAX_DRAWDOWN = "max_drawdown";
    public static final String WIN_RATE = "win_rate";
    public static final String PROFIT_FACTOR = "profit_factor";

    public static final List<String> METRIC_NAMES = List.of(
            SHARPE_RATIO,
            SORTINO_RATIO,
            MAX_DRAWDOWN,
            TOTAL_RETURN,
            ANNUALIZED_RETURN,
            ANNUALIZED_VOLATILITY,
            WIN_RATE,
            PROFIT_FACTOR);

    static final double TRADING_DAYS_PER_YEAR = 252.0;
    static final double DAYS_PER_YEAR = 365.25;

    /** All eight metrics, keyed by the names in {@link #METRIC_NAMES}. */
    public Map<String, Double> calculate(TimeSeries equityCurve, List<Trade> trades) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(SHARPE_RATIO, calculateSharpeRatio(equityCurve));
        metrics.put(SORTINO_RATIO, calculateSortinoRatio(equityCurve));
        metrics.put(MAX_DRAWDOWN, calculateMaxDrawdown(equityCurve));
        metrics.put(TOTAL_RETURN, calculateTotalReturn(equityCurve));
        metrics.put(ANNUALIZED_RETURN, calculateAnnualizedReturn(equityCurve));
        metrics.put(ANNUALIZED_VOLATILITY, calculateAnnualizedVolatility(equityCurve));
        metrics.put(WIN_RATE, calculateWinRate(trades));
        metrics.put(PROFIT_FACTOR, calculateProfitFactor(trades));
        return metrics;
    }

    /** {@code (last - first) / first}. */
    double calculateTotalReturn(TimeSeries equityCurve) {
        if (equityCurve.isEmpty()) {
            return 0.0;
        }
        double first = equityCurve.firstValue();
        return (equityCurve.lastValue() - first) / first;
    }

    /**
     * Compounds the total return over the elapsed calendar years. A curve that lost all of its
     * starting value, or more, annualizes to -1.
     */
    double calculateAnnualizedReturn(TimeSeries equityCurve) {
        if (equityCurve.size() < 2) {
            return 0.0;
        }
        double years = Duration.between(equityCurve.firstTimestamp(), equityCurve.lastTimestamp()).toDays()
                / DAYS_PER_YEAR;
        if (years <= 0.0) {
            return 0.0;
        }
        double growth = 1.0 + calculateTotalReturn(equityCurve);
        if (growth <= 0.0) {
            return -1.0;
        }
        return Math.pow(growth, 1.0 / years) - 1.0;
    }

    double calculateAnnualizedVolatility(TimeSeries equityCurve) {
        DescriptiveStatistics returns = returns(equityCurve);
        if (returns.getN() < 2) {
            return 0.0;
        }
        return returns.getStandardDeviation() * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /** Mean over standard deviation of step returns. */
    double calculateSharpeRatio(TimeSeries equityCurve) {
        DescriptiveStatistics returns = returns(equityCurve);
        if (returns.getN() < 2) {
            return 0.0;
        }
        double std = returns.getStandardDeviation();
        if (std == 0.0) {
            return 0.0;
        }
        return returns.getMean() / std;
    }

    /** Mean step return over the root mean square of the negative step returns. */
    double calculateSortinoRatio(TimeSeries equityCurve) {
        DescriptiveStatistics returns = returns(equityCurve);
        if (returns.getN() < 2) {
            return 0.0;
        }
        DescriptiveStatistics downside = new DescriptiveStatistics();
        for (double r : returns.getValues()) {
            if (r < 0.0) {
                downside.addValue(r * r);
            }
        }
        if (downside.getN() == 0) {
            return 0.0;
        }
        double downsideDeviation = Math.sqrt(downside.getMean());
        if (downsideDeviation == 0.0) {
            return 0.0;
        }
        return returns.getMean() / downsideDeviation;
    }

    /** Largest {@code (peak - value) / peak} over the curve, peak starting at the first point. */
    double calculateMaxDrawdown(TimeSeries equityCurve) {
        if (equityCurve.isEmpty()) {
            return 0.0;
        }
        double peak = equityCurve.firstValue();
        double maxDrawdown = 0.0;
        for (double value : equityCurve.getValues()) {
            if (value > peak) {
                peak = value;
            }
            double drawdown = (peak - value) / peak;
            if (drawdown > maxDrawdown) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    /** Fraction of trades with positive net value. */
    double calculateWinRate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return 0.0;
        }
        long winning = trades.stream().filter(t -> t.getNetValue() > 0.0).count();
        return (double) winning / trades.size();
    }

    /** Gross profit over gross loss of trade net values; +inf with profit and no loss. */
    double calculateProfitFactor(List<Trade> trades) {
        if (trades.isEmpty()) {
            return 0.0;
        }
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        for (Trade trade : trades) {
            double netValue = trade.getNetValue();
            if (netValue > 0.0) {
                grossProfit += netValue;
            } else {
                grossLoss += Math.abs(netValue);
            }
        }
        if (grossLoss == 0.0) {
            return grossProfit > 0.0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return grossProfit / grossLoss;
    }

    private DescriptiveStatistics returns(TimeSeries equityCurve) {
        if (equityCurve.size() < 2) {
            return new DescriptiveStatistics();
        }
        return new DescriptiveStatistics(equityCurve.pctChange().toArray());
    }
}
