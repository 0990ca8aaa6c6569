package com.volarb.strategy;

import com.volarb.config.StrategyProperties;
import com.volarb.strategy.impl.DeltaHedgingStrategy;
import com.volarb.strategy.impl.VolatilityArbitrageConfig;
import com.volarb.strategy.impl.VolatilityArbitrageStrategy;
import com.volarb.strategy.impl.VolatilitySpreadSignal;
import com.volarb.volatility.ModelFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds volatility arbitrage strategies with their sub-components from configuration.
 *
 * <p>Strategy instances are plain Java objects, not Spring beans. Each call returns a fresh
 * instance with its own GARCH model, signal generator and hedger.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private final StrategyProperties strategyProperties;

    public StrategyFactory(StrategyProperties strategyProperties) {
        this.strategyProperties = strategyProperties;
    }

    public VolatilityArbitrageStrategy createVolatilityArbitrage() {
        return createVolatilityArbitrage(strategyProperties);
    }

    public VolatilityArbitrageStrategy createVolatilityArbitrage(StrategyProperties properties) {
        VolatilityArbitrageStrategy strategy = new VolatilityArbitrageStrategy(
                ModelFactory.createGarchModel(
                        properties.getGarchOmega(), properties.getGarchAlpha(), properties.getGarchBeta()),
                new VolatilitySpreadSignal(properties.getEntryThreshold(), properties.getExitThreshold()),
                new DeltaHedgingStrategy(properties.getTargetDelta(), properties.getHedgeTolerance()),
                VolatilityArbitrageConfig.builder()
                        .holdingPeriod(properties.getHoldingPeriod())
                        .contractsPerTrade(properties.getContractsPerTrade())
                        .optionTenorDays(properties.getOptionTenorDays())
                        .minCalibrationReturns(properties.getMinCalibrationReturns())
                        .build());
        log.info(
                "Created strategy: {}, holdingPeriod={}, thresholds=({}, {}), targetDelta={}",
                strategy.getName(),
                properties.getHoldingPeriod(),
                properties.getEntryThreshold(),
                properties.getExitThreshold(),
                properties.getTargetDelta());
        return strategy;
    }
}
