package com.volarb.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.volarb.config.StrategyProperties;
import com.volarb.exception.ValidationException;
import com.volarb.strategy.StrategyFactory;
import com.volarb.strategy.impl.DeltaHedgingStrategy;
import com.volarb.strategy.impl.VolatilityArbitrageStrategy;
import com.volarb.strategy.impl.VolatilitySpreadSignal;
import com.volarb.timeseries.TimeSeries;
import com.volarb.volatility.GarchModel;
import com.volarb.volatility.VolatilityModel;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StrategyFactory")
class StrategyFactoryTest {

    @Test
    @DisplayName("wires components from configured properties")
    void wiresFromProperties() {
        StrategyProperties properties = new StrategyProperties();
        properties.setHoldingPeriod(5);
        properties.setEntryThreshold(0.2);
        properties.setExitThreshold(0.1);
        properties.setHedgeTolerance(0.5);

        VolatilityArbitrageStrategy strategy = new StrategyFactory(properties).createVolatilityArbitrage();

        assertThat(strategy.getConfig().getHoldingPeriod()).isEqualTo(5);
        assertThat(strategy.getVolatilityModel()).isInstanceOf(GarchModel.class);
        assertThat(((GarchModel) strategy.getVolatilityModel()).getAlpha()).isEqualTo(0.1);
        assertThat(strategy.getSignalGenerator()).isInstanceOfSatisfying(VolatilitySpreadSignal.class, signal -> {
            assertThat(signal.getEntryThreshold()).isEqualTo(0.2);
            assertThat(signal.getExitThreshold()).isEqualTo(0.1);
        });
        assertThat(strategy.getHedgingStrategy())
                .isInstanceOfSatisfying(DeltaHedgingStrategy.class, hedge -> assertThat(hedge.getTolerance())
                        .isEqualTo(0.5));
    }

    @Test
    @DisplayName("each call returns an independent strategy")
    void freshInstances() {
        StrategyFactory factory = new StrategyFactory(new StrategyProperties());

        assertThat(factory.createVolatilityArbitrage()).isNotSameAs(factory.createVolatilityArbitrage());
    }

    @Test
    @DisplayName("invalid GARCH parameters are rejected")
    void invalidGarch() {
        StrategyProperties properties = new StrategyProperties();
        properties.setGarchAlpha(0.5);
        properties.setGarchBeta(0.6);

        assertThatThrownBy(() -> new StrategyFactory(properties).createVolatilityArbitrage())
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("GARCH seeds are replaced by calibration")
    void seedsDoNotReachForecasts() {
        StrategyProperties lowPersistence = new StrategyProperties();
        lowPersistence.setGarchOmega(0.0005);
        lowPersistence.setGarchAlpha(0.05);
        lowPersistence.setGarchBeta(0.3);

        VolatilityModel seededDefault = new StrategyFactory(new StrategyProperties())
                .createVolatilityArbitrage()
                .getVolatilityModel();
        VolatilityModel seededLow = new StrategyFactory(lowPersistence)
                .createVolatilityArbitrage()
                .getVolatilityModel();

        TimeSeries returns = new TimeSeries("returns");
        LocalDateTime start = LocalDateTime.of(2025, 1, 2, 0, 0);
        for (int i = 0; i < 30; i++) {
            returns.put(start.plusDays(i), 0.01 * Math.sin(i));
        }
        seededDefault.calibrate(returns);
        seededLow.calibrate(returns);

        assertThat(seededLow.forecast(5)).isCloseTo(seededDefault.forecast(5), within(1e-15));
        assertThat(seededLow.getParameters()).isEqualTo(seededDefault.getParameters());
    }
}
