package com.volarb.domain.model;

import com.volarb.exception.KeyNotFoundException;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One OHLCV bar for a symbol, plus free-form auxiliary values such as the market-quoted
 * implied volatility or a risk-free rate.
 *
 * <p>Read-only once built. Auxiliary lookups through {@link #getAuxiliary(String)} fail with
 * {@link KeyNotFoundException} when the key is absent; use {@link #findAuxiliary(String)} for
 * the optional form.
 */
@Getter
@ToString
public class MarketObservation {

    public static final String IMPLIED_VOLATILITY = "implied_volatility";
    public static final String RISK_FREE_RATE = "risk_free_rate";

    private final String symbol;
    private final LocalDateTime timestamp;
    private final double open;
    private final double high;
    private final double low;
    private final double close;
    private final double volume;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Double> auxiliary;

    @Builder(toBuilder = true)
    private MarketObservation(
            String symbol,
            LocalDateTime timestamp,
            double open,
            double high,
            double low,
            double close,
            double volume,
            Map<String, Double> auxiliary) {
        this.symbol = symbol;
        this.timestamp = timestamp;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.auxiliary = auxiliary == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(auxiliary));
    }

    public double getAuxiliary(String key) {
        Double value = auxiliary.get(key);
        if (value == null) {
            throw new KeyNotFoundException("Auxiliary market data", key);
        }
        return value;
    }

    public OptionalDouble findAuxiliary(String key) {
        Double value = auxiliary.get(key);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean hasAuxiliary(String key) {
        return auxiliary.containsKey(key);
    }

    public Map<String, Double> getAuxiliaryData() {
        return auxiliary;
    }

    /** Returns a copy of this bar with one auxiliary value added or replaced. */
    public MarketObservation withAuxiliary(String key, double value) {
        Map<String, Double> merged = new HashMap<>(auxiliary);
        merged.put(key, value);
        return toBuilder().auxiliary(merged).build();
    }
}
