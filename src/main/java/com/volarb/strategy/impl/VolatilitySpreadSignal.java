package com.volarb.strategy.impl;

import com.volarb.domain.enums.SignalType;
import com.volarb.domain.instrument.Instrument;
import com.volarb.domain.instrument.Option;
import com.volarb.domain.model.MarketObservation;
import com.volarb.domain.model.Signal;
import com.volarb.exception.ValidationException;
import com.volarb.strategy.base.SignalGenerator;
import com.volarb.volatility.VolatilityModel;
import java.util.OptionalDouble;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Trades the spread between market implied volatility and the model's one-step forecast.
 *
 * <p>{@code spread = impliedVol - forecast(1)}. When {@code |spread| >= entryThreshold} the
 * option is considered mispriced: a positive spread (options rich) emits SELL, a negative one
 * (options cheap) emits BUY, with strength {@code |spread|} capped at 1. Anything below the
 * entry threshold emits HOLD with strength 0, including the band between the exit and entry
 * thresholds.
 *
 * <p>Non-option instruments and bars without a positive implied volatility always emit HOLD.
 */
@Slf4j
@Getter
public class VolatilitySpreadSignal implements SignalGenerator {

    public static final String IMPLIED_VOL = "implied_vol";
    public static final String FORECASTED_VOL = "forecasted_vol";
    public static final String VOL_SPREAD = "vol_spread";
    public static final String SPREAD_MAGNITUDE = "spread_magnitude";

    private final double entryThreshold;
    private final double exitThreshold;

    public VolatilitySpreadSignal(double entryThreshold, double exitThreshold) {
        if (entryThreshold < 0 || exitThreshold < 0) {
            throw new ValidationException("Signal thresholds must be non-negative");
        }
        if (exitThreshold > entryThreshold) {
            throw new ValidationException(
                    "Exit threshold " + exitThreshold + " must not exceed entry threshold " + entryThreshold);
        }
        this.entryThreshold = entryThreshold;
        this.exitThreshold = exitThreshold;
    }

    @Override
    public Signal generateSignal(
            Instrument instrument, VolatilityModel volatilityModel, MarketObservation observation) {
        if (!(instrument instanceof Option)) {
            return Signal.hold(instrument.getSymbol(), observation.getTimestamp());
        }

        OptionalDouble quotedVol = observation.findAuxiliary(MarketObservation.IMPLIED_VOLATILITY);
        if (quotedVol.isEmpty() || quotedVol.getAsDouble() <= 0) {
            return Signal.hold(instrument.getSymbol(), observation.getTimestamp());
        }

        double impliedVol = quotedVol.getAsDouble();
        double forecastedVol = volatilityModel.forecast(1);
        double spread = impliedVol - forecastedVol;
        double magnitude = Math.abs(spread);

        SignalType type = SignalType.HOLD;
        double strength = 0.0;
        if (magnitude >= entryThreshold) {
            type = spread > 0 ? SignalType.SELL : SignalType.BUY;
            strength = Math.min(magnitude, 1.0);
        }

        Signal signal = Signal.builder()
                .type(type)
                .strength(strength)
                .instrumentId(instrument.getSymbol())
                .timestamp(observation.getTimestamp())
                .metadata(IMPLIED_VOL, impliedVol)
                .metadata(FORECASTED_VOL, forecastedVol)
                .metadata(VOL_SPREAD, spread)
                .metadata(SPREAD_MAGNITUDE, magnitude)
                .build();

        if (signal.isActionable()) {
            log.debug(
                    "{} signal on {}: implied={}, forecast={}, spread={}",
                    type,
                    instrument.getSymbol(),
                    impliedVol,
                    forecastedVol,
                    spread);
        }
        return signal;
    }

    @Override
    public String getName() {
        return "VolatilitySpread";
    }

    @Override
    public VolatilitySpreadSignal copy() {
        return new VolatilitySpreadSignal(entryThreshold, exitThreshold);
    }
}
