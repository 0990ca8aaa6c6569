package com.volarb.unit.backtest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.volarb.backtest.BacktestResult;
import com.volarb.backtest.BacktestResult.DrawdownPeriod;
import com.volarb.domain.enums.TradeAction;
import com.volarb.domain.model.Trade;
import com.volarb.reporting.PerformanceMetricsCalculator;
import com.volarb.timeseries.TimeSeries;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BacktestResult")
class BacktestResultTest {

    private static final LocalDateTime JAN_30 = LocalDateTime.of(2025, 1, 30, 0, 0);

    private BacktestResult result;

    /** 100 -> 110 -> 99 -> 121 over Jan 30 .. Feb 2. */
    private static TimeSeries curve() {
        TimeSeries curve = new TimeSeries("Equity");
        curve.put(JAN_30, 100);
        curve.put(JAN_30.plusDays(1), 110);
        curve.put(JAN_30.plusDays(2), 99);
        curve.put(JAN_30.plusDays(3), 121);
        return curve;
    }

    private static Trade trade(TradeAction action, double price) {
        return Trade.builder()
                .instrumentId("SPY")
                .action(action)
                .quantity(10)
                .price(price)
                .timestamp(JAN_30)
                .transactionCost(0.0)
                .build();
    }

    @BeforeEach
    void setUp() {
        result = new BacktestResult(curve(), List.of(trade(TradeAction.BUY, 100), trade(TradeAction.SELL, 120)));
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("all eight metrics are computed")
        void allMetrics() {
            assertThat(result.getAllMetrics()).containsOnlyKeys(PerformanceMetricsCalculator.METRIC_NAMES);
            assertThat(result.getTotalReturn()).isCloseTo(0.21, within(1e-12));
            assertThat(result.getMaxDrawdown()).isCloseTo(0.10, within(1e-12));
            assertThat(result.getWinRate()).isEqualTo(0.5);
            assertThat(result.getProfitFactor()).isCloseTo(1.2, within(1e-12));
        }

        @Test
        @DisplayName("unknown metric reads as zero")
        void unknownMetric() {
            assertThat(result.getMetric("calmar_ratio")).isZero();
            assertThat(result.hasMetric("calmar_ratio")).isFalse();
        }

        @Test
        @DisplayName("reading metrics clears the stale flag")
        void lazyComputation() {
            assertThat(result.isStale()).isTrue();

            result.getSharpeRatio();

            assertThat(result.isStale()).isFalse();
        }

        @Test
        @DisplayName("replacing the equity curve invalidates cached metrics")
        void equityCurveInvalidates() {
            assertThat(result.getTotalReturn()).isCloseTo(0.21, within(1e-12));

            TimeSeries flat = new TimeSeries("Equity");
            flat.put(JAN_30, 100);
            flat.put(JAN_30.plusDays(1), 100);
            result.setEquityCurve(flat);

            assertThat(result.isStale()).isTrue();
            assertThat(result.getTotalReturn()).isZero();
        }

        @Test
        @DisplayName("replacing the trades invalidates cached metrics")
        void tradesInvalidate() {
            assertThat(result.getWinRate()).isEqualTo(0.5);
            assertThat(result.getProfitFactor()).isCloseTo(1.2, within(1e-12));
            assertThat(result.isStale()).isFalse();

            // net values: +1200, +500, -1000
            result.setTrades(List.of(
                    trade(TradeAction.SELL, 120), trade(TradeAction.SELL, 50), trade(TradeAction.BUY, 100)));

            assertThat(result.isStale()).isTrue();
            assertThat(result.getTradeCount()).isEqualTo(3);
            assertThat(result.getWinRate()).isCloseTo(2.0 / 3.0, within(1e-12));
            assertThat(result.getProfitFactor()).isCloseTo(1.7, within(1e-12));
        }

        @Test
        @DisplayName("adding a trade invalidates cached metrics and drops manual values")
        void addTradeInvalidates() {
            result.setMetric("custom", 7.0);
            assertThat(result.getMetric("custom")).isEqualTo(7.0);
            assertThat(result.getWinRate()).isEqualTo(0.5);

            result.addTrade(trade(TradeAction.SELL, 50));

            assertThat(result.isStale()).isTrue();
            assertThat(result.getTradeCount()).isEqualTo(3);
            assertThat(result.getWinRate()).isCloseTo(2.0 / 3.0, within(1e-12));
            assertThat(result.hasMetric("custom")).isFalse();
        }

        @Test
        @DisplayName("empty result has zero metrics")
        void emptyResult() {
            BacktestResult empty = new BacktestResult();

            assertThat(empty.getAllMetrics()).hasSize(8).allSatisfy((name, value) -> assertThat(value).isZero());
        }
    }

    @Nested
    @DisplayName("Analytics")
    class Analytics {

        @Test
        @DisplayName("drawdown series is measured from the running peak")
        void drawdownSeries() {
            TimeSeries drawdowns = result.getDrawdownSeries();

            assertThat(drawdowns.size()).isEqualTo(4);
            assertThat(drawdowns.getValue(0)).isZero();
            assertThat(drawdowns.getValue(1)).isZero();
            assertThat(drawdowns.getValue(2)).isCloseTo(-0.10, within(1e-12));
            assertThat(drawdowns.getValue(3)).isZero();
        }

        @Test
        @DisplayName("drawdown period spans the dip until recovery")
        void drawdownPeriods() {
            assertThat(result.getDrawdownPeriods())
                    .containsExactly(new DrawdownPeriod(JAN_30.plusDays(2), JAN_30.plusDays(3)));
        }

        @Test
        @DisplayName("unrecovered drawdown ends at the last point")
        void unrecoveredDrawdown() {
            TimeSeries falling = new TimeSeries("Equity");
            falling.put(JAN_30, 100);
            falling.put(JAN_30.plusDays(1), 95);
            falling.put(JAN_30.plusDays(2), 97);
            result.setEquityCurve(falling);

            assertThat(result.getDrawdownPeriods())
                    .containsExactly(new DrawdownPeriod(JAN_30.plusDays(1), JAN_30.plusDays(2)));
        }

        @Test
        @DisplayName("step returns are summed per month and per year")
        void periodicReturns() {
            assertThat(result.getReturnsByMonth()).containsOnlyKeys(YearMonth.of(2025, 1), YearMonth.of(2025, 2));
            assertThat(result.getReturnsByMonth().get(YearMonth.of(2025, 1))).isCloseTo(0.10, within(1e-12));
            assertThat(result.getReturnsByMonth().get(YearMonth.of(2025, 2)))
                    .isCloseTo(-0.10 + 121.0 / 99.0 - 1.0, within(1e-12));
            assertThat(result.getReturnsByYear()).containsOnlyKeys(2025);
            assertThat(result.getReturnsByYear().get(2025)).isCloseTo(121.0 / 99.0 - 1.0, within(1e-12));
        }

        @Test
        @DisplayName("summary lists headline numbers")
        void summary() {
            String summary = result.getSummary();

            assertThat(summary)
                    .startsWith("=== Backtest Results Summary ===")
                    .contains("Total Return: 21.0000%")
                    .contains("Max Drawdown: 10.0000%")
                    .contains("Total Trades: 2");
        }
    }

    @Test
    @DisplayName("returned equity curve is a defensive copy")
    void equityCurveCopy() {
        result.getEquityCurve().put(JAN_30.plusDays(10), 1.0);

        assertThat(result.getEquityCurve().size()).isEqualTo(4);
    }
}
