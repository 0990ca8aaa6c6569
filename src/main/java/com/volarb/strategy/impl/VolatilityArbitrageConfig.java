package com.volarb.strategy.impl;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sizing and lifecycle settings of {@link VolatilityArbitrageStrategy}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VolatilityArbitrageConfig {

    /** Bars a position is held before it is closed at market. */
    @Builder.Default
    private int holdingPeriod = 21;

    /** Option contracts per entry. */
    @Builder.Default
    private double contractsPerTrade = 10;

    /** Calendar days to expiry of the synthesized at-the-money call. */
    @Builder.Default
    private int optionTenorDays = 30;

    /** Log returns collected per symbol before the volatility model is calibrated. */
    @Builder.Default
    private int minCalibrationReturns = 10;
}
