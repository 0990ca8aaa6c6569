package com.volarb.marketdata;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Shape of a generated price path. Bars are daily, consecutive calendar days from
 * {@link #start}.
 */
@Value
@Builder(toBuilder = true)
public class SyntheticPathSpec {

    String symbol;
    LocalDateTime start;

    @Builder.Default
    int bars = 252;

    @Builder.Default
    double startPrice = 100.0;

    /** Mean daily return. */
    @Builder.Default
    double drift = 0.0;

    /** Standard deviation of daily returns. */
    @Builder.Default
    double dailyVolatility = 0.02;

    /** Quoted implied volatility attached to every bar; zero or less attaches none. */
    @Builder.Default
    double impliedVolatility = 0.0;

    /** Standard deviation of the per-bar noise added to the quoted implied volatility. */
    @Builder.Default
    double impliedVolatilityNoise = 0.0;

    @Builder.Default
    long seed = 42L;
}
