package com.volarb.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default settings of the volatility arbitrage strategy built by the strategy factory.
 */
@Configuration
@ConfigurationProperties(prefix = "volarb.strategy")
@Getter
@Setter
public class StrategyProperties {

    /** Bars an option position is held before it is closed. */
    private int holdingPeriod = 21;

    /** Option contracts per entry. */
    private double contractsPerTrade = 10;

    /** Calendar days to expiry of the synthesized ATM call. */
    private int optionTenorDays = 30;

    /** Absolute implied-vs-forecast spread that opens a position. */
    private double entryThreshold = 0.15;

    /** Spread at or below which the signal is flat. */
    private double exitThreshold = 0.05;

    /** Portfolio delta the hedger steers toward. */
    private double targetDelta = 0.0;

    /** Delta gap tolerated before hedging. */
    private double hedgeTolerance = 0.01;

    /**
     * GARCH seed parameters. They are checked for stationarity when the strategy is built and
     * then replaced by the first calibration, so they never reach a forecast.
     */
    private double garchOmega = 0.0001;

    private double garchAlpha = 0.1;
    private double garchBeta = 0.8;

    /** Log returns required before the GARCH model is calibrated. */
    private int minCalibrationReturns = 10;
}
