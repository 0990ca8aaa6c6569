package com.volarb.domain.model;

import com.volarb.domain.enums.SignalType;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Directional trade suggestion emitted by a signal generator for one instrument at one bar.
 *
 * <p>Metadata carries the numbers behind the decision (implied vs forecast volatility, the
 * spread) so a run can be inspected after the fact.
 */
@Value
@Builder
public class Signal {

    SignalType type;

    /** Conviction in [0, 1]. Zero for HOLD. */
    double strength;

    String instrumentId;
    LocalDateTime timestamp;

    @Singular("metadata")
    Map<String, Double> metadata;

    public boolean isActionable() {
        return type != SignalType.HOLD && strength > 0;
    }

    public static Signal hold(String instrumentId, LocalDateTime timestamp) {
        return Signal.builder()
                .type(SignalType.HOLD)
                .strength(0.0)
                .instrumentId(instrumentId)
                .timestamp(timestamp)
                .build();
    }
}
