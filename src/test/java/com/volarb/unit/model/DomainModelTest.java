package com.volarb.unit.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.volarb.domain.enums.SignalType;
import com.volarb.domain.enums.TradeAction;
import com.volarb.domain.model.Greeks;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Signal;
import com.volarb.domain.model.Trade;
import com.volarb.exception.KeyNotFoundException;
import com.volarb.exception.ValidationException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Domain model")
class DomainModelTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 16, 0);

    private static Trade.TradeBuilder trade() {
        return Trade.builder()
                .instrumentId("SPY")
                .action(TradeAction.BUY)
                .quantity(10)
                .price(100)
                .timestamp(T0)
                .transactionCost(2.0);
    }

    @Nested
    @DisplayName("Trade")
    class TradeTests {

        @Test
        @DisplayName("BUY net value is an outflow including cost")
        void buyNetValue() {
            Trade buy = trade().build();

            assertThat(buy.getValue()).isEqualTo(1_000.0);
            assertThat(buy.getNetValue()).isEqualTo(-1_002.0);
        }

        @Test
        @DisplayName("SELL net value is an inflow less cost")
        void sellNetValue() {
            Trade sell = trade().action(TradeAction.SELL).build();

            assertThat(sell.getNetValue()).isEqualTo(998.0);
        }

        @Test
        @DisplayName("rejects non-positive quantity and negative cost")
        void validation() {
            assertThatThrownBy(() -> trade().quantity(0).build()).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> trade().quantity(-1).build()).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> trade().transactionCost(-0.01).build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("orders by timestamp")
        void ordering() {
            Trade later = trade().timestamp(T0.plusDays(1)).build();
            Trade earlier = trade().build();
            List<Trade> trades = new ArrayList<>(List.of(later, earlier));

            Collections.sort(trades);

            assertThat(trades).containsExactly(earlier, later);
        }

        @Test
        @DisplayName("opposite and quantity-change helpers pick the side")
        void actions() {
            assertThat(TradeAction.BUY.opposite()).isEqualTo(TradeAction.SELL);
            assertThat(TradeAction.SELL.opposite()).isEqualTo(TradeAction.BUY);
            assertThat(TradeAction.forQuantityChange(3)).isEqualTo(TradeAction.BUY);
            assertThat(TradeAction.forQuantityChange(-3)).isEqualTo(TradeAction.SELL);
        }
    }

    @Nested
    @DisplayName("Signal")
    class SignalTests {

        @Test
        @DisplayName("HOLD is never actionable")
        void holdNotActionable() {
            assertThat(Signal.hold("SPY", T0).isActionable()).isFalse();
        }

        @Test
        @DisplayName("directional signal needs positive strength")
        void actionable() {
            Signal sell = Signal.builder()
                    .type(SignalType.SELL)
                    .strength(0.3)
                    .instrumentId("SPY")
                    .timestamp(T0)
                    .metadata("vol_spread", 0.3)
                    .build();
            Signal weak = Signal.builder()
                    .type(SignalType.SELL)
                    .strength(0.0)
                    .instrumentId("SPY")
                    .timestamp(T0)
                    .build();

            assertThat(sell.isActionable()).isTrue();
            assertThat(sell.getMetadata()).containsEntry("vol_spread", 0.3);
            assertThat(weak.isActionable()).isFalse();
        }
    }

    @Nested
    @DisplayName("Greeks")
    class GreeksTests {

        @Test
        @DisplayName("times scales and plus adds component-wise")
        void arithmetic() {
            Greeks unit = Greeks.builder().delta(0.5).gamma(0.02).vega(0.1).theta(-0.03).rho(0.04).build();

            Greeks total = unit.times(-10).plus(unit);

            assertThat(total.getDelta()).isCloseTo(-4.5, within(1e-12));
            assertThat(total.getGamma()).isCloseTo(-0.18, within(1e-12));
            assertThat(total.getVega()).isCloseTo(-0.9, within(1e-12));
            assertThat(total.getTheta()).isCloseTo(0.27, within(1e-12));
            assertThat(total.getRho()).isCloseTo(-0.36, within(1e-12));
        }
    }

    @Nested
    @DisplayName("MarketObservation")
    class MarketObservationTests {

        private final MarketObservation bar = MarketObservation.builder()
                .symbol("SPY")
                .timestamp(T0)
                .open(99)
                .high(101)
                .low(98)
                .close(100)
                .volume(5_000)
                .auxiliary(Map.of(MarketObservation.IMPLIED_VOLATILITY, 0.22))
                .build();

        @Test
        @DisplayName("auxiliary lookups")
        void auxiliary() {
            assertThat(bar.getAuxiliary(MarketObservation.IMPLIED_VOLATILITY)).isEqualTo(0.22);
            assertThat(bar.hasAuxiliary(MarketObservation.RISK_FREE_RATE)).isFalse();
            assertThat(bar.findAuxiliary(MarketObservation.RISK_FREE_RATE)).isEmpty();
            assertThatThrownBy(() -> bar.getAuxiliary(MarketObservation.RISK_FREE_RATE))
                    .isInstanceOf(KeyNotFoundException.class);
        }

        @Test
        @DisplayName("withAuxiliary returns a new bar and leaves the original untouched")
        void withAuxiliary() {
            MarketObservation enriched = bar.withAuxiliary(MarketObservation.RISK_FREE_RATE, 0.04);

            assertThat(enriched.getAuxiliary(MarketObservation.RISK_FREE_RATE)).isEqualTo(0.04);
            assertThat(enriched.getAuxiliary(MarketObservation.IMPLIED_VOLATILITY)).isEqualTo(0.22);
            assertThat(bar.hasAuxiliary(MarketObservation.RISK_FREE_RATE)).isFalse();
        }

        @Test
        @DisplayName("auxiliary map is read-only")
        void readOnly() {
            assertThatThrownBy(() -> bar.getAuxiliaryData().put("x", 1.0))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
